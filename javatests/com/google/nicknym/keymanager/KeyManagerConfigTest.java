/*
 * Copyright 2025 Google LLC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.google.nicknym.keymanager;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import java.net.URI;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class KeyManagerConfigTest {

  @Test
  public void build_optionalValuesDefaultToEmpty() {
    KeyManagerConfig config =
        KeyManagerConfig.builder()
            .setAddress("alice@example.org")
            .setNicknymUri(URI.create("https://nicknym.example.org:6425/"))
            .build();

    assertThat(config.sessionId()).isEmpty();
    assertThat(config.caCertPath()).isEmpty();
    assertThat(config.apiUri()).isEmpty();
    assertThat(config.apiVersion()).isEmpty();
    assertThat(config.uid()).isEmpty();
  }

  @Test
  public void build_blankAddress_fails() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            KeyManagerConfig.builder()
                .setAddress(" ")
                .setNicknymUri(URI.create("https://nicknym.example.org:6425/"))
                .build());
  }

  @Test
  public void build_missingNicknymUri_fails() {
    assertThrows(
        IllegalStateException.class,
        () -> KeyManagerConfig.builder().setAddress("alice@example.org").build());
  }
}
