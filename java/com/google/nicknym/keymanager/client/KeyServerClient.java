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

package com.google.nicknym.keymanager.client;

import com.google.common.collect.ImmutableMap;
import java.net.URI;
import java.nio.file.Path;

/** Client for the nickserver directory and the provider's key publishing endpoint. */
public interface KeyServerClient {

  /**
   * Looks up the keys published for {@code address}.
   *
   * @param nicknymUri the nickserver directory endpoint
   * @param caCertPath PEM file with the provider CA certificate trusted for the connection
   * @return key type tag to serialized key material
   */
  ImmutableMap<String, String> lookupKeys(URI nicknymUri, String address, Path caCertPath)
      throws KeyServerClientException;

  /**
   * Uploads a public key for the authenticated user.
   *
   * @param userUri the provider API resource of the user
   * @param sessionId value of the provider session cookie
   */
  void putPublicKey(URI userUri, String publicKeyData, String sessionId, Path caCertPath)
      throws KeyServerClientException;

  /** Represents an exception thrown by the {@code KeyServerClient} class. */
  final class KeyServerClientException extends Exception {

    /** Creates a new instance from a message String and a {@code Throwable}. */
    public KeyServerClientException(String message, Throwable cause) {
      super(message, cause);
    }

    /** Creates a new instance from a message String. */
    public KeyServerClientException(String message) {
      super(message);
    }
  }
}
