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

import com.google.nicknym.keymanager.KeyManagerException;
import com.google.nicknym.keymanager.model.ErrorReason;
import java.util.Optional;

/**
 * Key types the key manager knows about. The tag is the name used for the type both in nickserver
 * responses and in documents kept in local storage.
 */
public enum KeyType {
  OPENPGP("openpgp");

  private final String tag;

  KeyType(String tag) {
    this.tag = tag;
  }

  public String tag() {
    return tag;
  }

  /** Returns the type with the given tag, or empty if no type uses it. */
  public static Optional<KeyType> tryFromTag(String tag) {
    for (KeyType keyType : values()) {
      if (keyType.tag.equals(tag)) {
        return Optional.of(keyType);
      }
    }
    return Optional.empty();
  }

  /**
   * Returns the type with the given tag.
   *
   * @throws KeyManagerException with {@link ErrorReason#UNKNOWN_KEY_TYPE} if no type uses the tag
   */
  public static KeyType fromTag(String tag) throws KeyManagerException {
    return tryFromTag(tag)
        .orElseThrow(
            () ->
                new KeyManagerException(
                    String.format("Unknown key type tag '%s'", tag),
                    ErrorReason.UNKNOWN_KEY_TYPE));
  }
}
