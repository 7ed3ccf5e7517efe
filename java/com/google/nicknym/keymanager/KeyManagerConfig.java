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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.auto.value.AutoValue;
import java.net.URI;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Session and identity context of a key manager: the user's own address, the nickserver, and what
 * is needed to reach the provider API.
 */
@AutoValue
public abstract class KeyManagerConfig {

  public static Builder builder() {
    return new AutoValue_KeyManagerConfig.Builder();
  }

  /** The user's own address. */
  public abstract String address();

  /** Nickserver directory endpoint. */
  public abstract URI nicknymUri();

  /** Provider session token, present once the user is authenticated. */
  public abstract Optional<String> sessionId();

  /** PEM file with the provider CA certificate. */
  public abstract Optional<Path> caCertPath();

  public abstract Optional<URI> apiUri();

  public abstract Optional<String> apiVersion();

  /** The user's id at the provider. */
  public abstract Optional<String> uid();

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setAddress(String address);

    public abstract Builder setNicknymUri(URI nicknymUri);

    public abstract Builder setSessionId(String sessionId);

    public abstract Builder setCaCertPath(Path caCertPath);

    public abstract Builder setApiUri(URI apiUri);

    public abstract Builder setApiVersion(String apiVersion);

    public abstract Builder setUid(String uid);

    abstract KeyManagerConfig autoBuild();

    public KeyManagerConfig build() {
      KeyManagerConfig config = autoBuild();
      checkArgument(!config.address().trim().isEmpty(), "address must not be empty");
      return config;
    }
  }
}
