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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableCollection;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.nicknym.keymanager.KeyManagerException;
import com.google.nicknym.keymanager.model.ErrorReason;
import java.util.Map;
import javax.inject.Inject;

/**
 * Immutable map from {@link KeyType} to the scheme implementing it. This is where a stored type
 * tag is turned back into a typed key.
 */
public final class SchemeRegistry {

  private final ImmutableMap<KeyType, EncryptionScheme> schemes;

  @Inject
  public SchemeRegistry(Map<KeyType, EncryptionScheme> schemes) {
    for (Map.Entry<KeyType, EncryptionScheme> entry : schemes.entrySet()) {
      checkArgument(
          entry.getKey() == entry.getValue().keyType(),
          "Scheme %s registered for %s reports key type %s",
          entry.getValue().getClass().getSimpleName(),
          entry.getKey(),
          entry.getValue().keyType());
    }
    this.schemes = ImmutableMap.copyOf(schemes);
  }

  /** Returns the scheme registered for {@code keyType}. */
  public EncryptionScheme schemeFor(KeyType keyType) throws KeyManagerException {
    EncryptionScheme scheme = schemes.get(keyType);
    if (scheme == null) {
      throw new KeyManagerException(
          String.format("No scheme registered for key type %s", keyType),
          ErrorReason.UNKNOWN_KEY_TYPE);
    }
    return scheme;
  }

  public boolean isRegistered(KeyType keyType) {
    return schemes.containsKey(keyType);
  }

  public String tagFor(KeyType keyType) throws KeyManagerException {
    return schemeFor(keyType).keyType().tag();
  }

  /** Returns the registered type using {@code tag}. */
  public KeyType keyTypeForTag(String tag) throws KeyManagerException {
    KeyType keyType = KeyType.fromTag(tag);
    if (!isRegistered(keyType)) {
      throw new KeyManagerException(
          String.format("Key type tag '%s' has no registered scheme", tag),
          ErrorReason.UNKNOWN_KEY_TYPE);
    }
    return keyType;
  }

  /** Rebuilds the typed key described by a stored document. */
  public EncryptionKey keyFromDocument(KeyDocument document) throws KeyManagerException {
    return schemeFor(keyTypeForTag(document.type())).keyFromDocument(document);
  }

  public ImmutableSet<KeyType> keyTypes() {
    return schemes.keySet();
  }

  public ImmutableCollection<EncryptionScheme> schemes() {
    return schemes.values();
  }
}
