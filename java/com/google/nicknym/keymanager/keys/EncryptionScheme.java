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

import com.google.common.collect.ImmutableList;
import com.google.nicknym.keymanager.KeyManagerException;
import java.util.Optional;

/**
 * A backend able to generate, store and use keys of one {@link KeyType}. Implementations check
 * that the keys they are handed are of their own concrete class; the role of a key is checked by
 * the caller before dispatch.
 */
public interface EncryptionScheme {

  /** The key type this scheme owns. */
  KeyType keyType();

  /**
   * Generates a key pair for {@code address}, stores both halves and returns the private key.
   *
   * @throws KeyManagerException with {@code KEY_ALREADY_EXISTS} if a private key already exists
   */
  EncryptionKey genKey(String address) throws KeyManagerException;

  /** Returns the locally stored key, failing with {@code KEY_NOT_FOUND} if there is none. */
  EncryptionKey getKey(String address, boolean isPrivate) throws KeyManagerException;

  /** Stores the key, replacing any key of the same address and role. */
  void putKey(EncryptionKey key) throws KeyManagerException;

  /** Removes the key of the same address and role as {@code key}, if any. */
  void deleteKey(EncryptionKey key) throws KeyManagerException;

  /** Imports serialized key material, public and private, and returns the stored keys. */
  ImmutableList<EncryptionKey> putAsciiKey(String keyData) throws KeyManagerException;

  /**
   * Imports only the public part of serialized key material, stored under {@code address} alone.
   * Secret material is ignored, and so are keys not bound to {@code address}.
   */
  ImmutableList<EncryptionKey> putPublicAsciiKey(String address, String keyData)
      throws KeyManagerException;

  /** Builds a typed key back from its storage form. */
  EncryptionKey keyFromDocument(KeyDocument document) throws KeyManagerException;

  byte[] encrypt(
      byte[] data,
      EncryptionKey publicKey,
      Optional<String> passphrase,
      Optional<EncryptionKey> signWith)
      throws KeyManagerException;

  byte[] decrypt(
      byte[] data,
      EncryptionKey privateKey,
      Optional<String> passphrase,
      Optional<EncryptionKey> verifyWith)
      throws KeyManagerException;

  byte[] sign(byte[] data, EncryptionKey privateKey, Optional<String> passphrase)
      throws KeyManagerException;

  VerificationResult verify(byte[] signedData, EncryptionKey publicKey)
      throws KeyManagerException;

  /** Whether keys of this type can be published to the provider. */
  default boolean supportsPublishing() {
    return false;
  }
}
