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

import java.time.Instant;
import java.util.Optional;

/**
 * An asymmetric key bound to an address. Concrete subclasses exist per {@link KeyType}; the role
 * flag ({@link #isPrivate()}) is fixed at creation and decides which operations accept the key.
 */
public abstract class EncryptionKey {

  /** The address the key is bound to. */
  public abstract String address();

  /** A short identifier of the key, unique per type. */
  public abstract String keyId();

  public abstract String fingerprint();

  /** The serialized key material. Secret for private keys. */
  public abstract String keyData();

  public abstract boolean isPrivate();

  /** Key strength in bits. */
  public abstract int length();

  public abstract Optional<Instant> expiryDate();

  public abstract KeyType keyType();

  /** Returns the generic storage form of this key. */
  public KeyDocument toDocument() {
    return KeyDocument.builder()
        .setType(keyType().tag())
        .setAddress(address())
        .setKeyId(keyId())
        .setFingerprint(fingerprint())
        .setKeyData(keyData())
        .setIsPrivate(isPrivate())
        .setLength(length())
        .setExpiryDate(expiryDate().orElse(null))
        .build();
  }

  /** Never includes {@link #keyData()}. */
  @Override
  public final String toString() {
    return String.format(
        "%s{type=%s, address=%s, keyId=%s, private=%s}",
        getClass().getSimpleName(), keyType().tag(), address(), keyId(), isPrivate());
  }
}
