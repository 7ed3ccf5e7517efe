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

package com.google.nicknym.keymanager.model;

/** Error reasons for the key manager. */
public enum ErrorReason {
  // No key of the requested type, role and address exists locally (or remotely, when fetched).
  KEY_NOT_FOUND,
  // A private key already exists for the address a key pair was requested for.
  KEY_ALREADY_EXISTS,
  // A key type or stored type tag has no registered scheme.
  UNKNOWN_KEY_TYPE,
  // A public key was given where a private key is required, or the other way round.
  ROLE_VIOLATION,
  // Non-2xx response, wrong content type, malformed body or TLS failure from the key servers.
  TRANSPORT_FAILURE,
  // An authenticated call to the provider API was attempted without a session id.
  AUTHENTICATION_REQUIRED,
  // A signature was missing, did not match the expected key, or did not validate.
  INVALID_SIGNATURE,
  // A protected private key was used without a passphrase.
  MISSING_CREDENTIAL,
  // A required configuration value (CA certificate, API URI, uid...) is absent.
  INVALID_CONFIGURATION,
  // The scheme for the requested key type cannot publish keys to the provider.
  PUBLISHING_NOT_SUPPORTED,
  // One or more addresses could not be refreshed from the nickserver.
  REFRESH_FAILED,
  // The cryptographic engine rejected the operation, e.g. malformed ciphertext or key material.
  CRYPTO_ERROR,
  // The local key storage could not be read or written.
  LOCAL_STORE_ERROR,
}
