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

package com.google.nicknym.keymanager.keys;

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import com.google.nicknym.keymanager.KeyManagerException;
import com.google.nicknym.keymanager.model.ErrorReason;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public final class SchemeRegistryTest {

  @Rule public final MockitoRule mockito = MockitoJUnit.rule();

  @Mock private EncryptionScheme openPgpScheme;
  @Mock private EncryptionKey key;

  private SchemeRegistry registry;

  @Before
  public void setUp() {
    when(openPgpScheme.keyType()).thenReturn(KeyType.OPENPGP);
    registry = new SchemeRegistry(ImmutableMap.of(KeyType.OPENPGP, openPgpScheme));
  }

  @Test
  public void schemeFor_registeredType() throws Exception {
    assertThat(registry.schemeFor(KeyType.OPENPGP)).isSameInstanceAs(openPgpScheme);
    assertThat(registry.isRegistered(KeyType.OPENPGP)).isTrue();
    assertThat(registry.keyTypes()).containsExactly(KeyType.OPENPGP);
    assertThat(registry.schemes()).containsExactly(openPgpScheme);
  }

  @Test
  public void schemeFor_unregisteredType_fails() {
    SchemeRegistry empty = new SchemeRegistry(ImmutableMap.of());

    KeyManagerException exception =
        assertThrows(KeyManagerException.class, () -> empty.schemeFor(KeyType.OPENPGP));

    assertThat(exception.getReason()).isEqualTo(ErrorReason.UNKNOWN_KEY_TYPE);
    assertThat(empty.isRegistered(KeyType.OPENPGP)).isFalse();
  }

  @Test
  public void tagFor_returnsTypeTag() throws Exception {
    assertThat(registry.tagFor(KeyType.OPENPGP)).isEqualTo("openpgp");
  }

  @Test
  public void keyTypeForTag_knownTag() throws Exception {
    assertThat(registry.keyTypeForTag("openpgp")).isEqualTo(KeyType.OPENPGP);
  }

  @Test
  public void keyTypeForTag_unknownTag_fails() {
    KeyManagerException exception =
        assertThrows(KeyManagerException.class, () -> registry.keyTypeForTag("smime"));

    assertThat(exception.getReason()).isEqualTo(ErrorReason.UNKNOWN_KEY_TYPE);
  }

  @Test
  public void keyTypeForTag_knownTagWithoutScheme_fails() {
    SchemeRegistry empty = new SchemeRegistry(ImmutableMap.of());

    KeyManagerException exception =
        assertThrows(KeyManagerException.class, () -> empty.keyTypeForTag("openpgp"));

    assertThat(exception.getReason()).isEqualTo(ErrorReason.UNKNOWN_KEY_TYPE);
  }

  @Test
  public void keyFromDocument_delegatesToScheme() throws Exception {
    KeyDocument document = document("openpgp");
    when(openPgpScheme.keyFromDocument(document)).thenReturn(key);

    assertThat(registry.keyFromDocument(document)).isSameInstanceAs(key);
    verify(openPgpScheme).keyFromDocument(document);
  }

  @Test
  public void keyFromDocument_unknownType_fails() {
    KeyManagerException exception =
        assertThrows(
            KeyManagerException.class, () -> registry.keyFromDocument(document("x-unknown")));

    assertThat(exception.getReason()).isEqualTo(ErrorReason.UNKNOWN_KEY_TYPE);
  }

  @Test
  public void constructor_schemeReportingOtherType_fails() {
    EncryptionScheme confused = mock(EncryptionScheme.class);

    assertThrows(
        IllegalArgumentException.class,
        () -> new SchemeRegistry(ImmutableMap.of(KeyType.OPENPGP, confused)));
  }

  private static KeyDocument document(String type) {
    return KeyDocument.builder()
        .setType(type)
        .setAddress("alice@example.org")
        .setKeyId("0123456789ABCDEF")
        .setFingerprint("FINGERPRINT")
        .setKeyData("key data")
        .setIsPrivate(false)
        .setLength(2048)
        .build();
  }
}
