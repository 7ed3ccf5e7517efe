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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.nicknym.keymanager.KeyManagerException;
import com.google.nicknym.keymanager.model.ErrorReason;
import com.google.nicknym.keymanager.store.KeyStore;
import com.google.nicknym.shared.api.exception.ServiceException;
import java.util.Optional;

/**
 * Base class for schemes storing their keys in a {@link KeyStore}. Subclasses supply the crypto
 * and the conversion from a {@link KeyDocument} to their key class.
 */
public abstract class AbstractEncryptionScheme<K extends EncryptionKey>
    implements EncryptionScheme {

  private final KeyStore keyStore;
  private final Class<K> keyClass;

  protected AbstractEncryptionScheme(KeyStore keyStore, Class<K> keyClass) {
    this.keyStore = checkNotNull(keyStore);
    this.keyClass = checkNotNull(keyClass);
  }

  @Override
  public final EncryptionKey getKey(String address, boolean isPrivate)
      throws KeyManagerException {
    return getTypedKey(address, isPrivate)
        .orElseThrow(() -> KeyManagerException.keyNotFound(keyType().tag(), address, isPrivate));
  }

  @Override
  public final void putKey(EncryptionKey key) throws KeyManagerException {
    checkKey(key);
    try {
      keyStore.putKey(key.toDocument());
    } catch (ServiceException e) {
      throw new KeyManagerException(
          "Failed to store key " + key.keyId(), ErrorReason.LOCAL_STORE_ERROR, e);
    }
  }

  @Override
  public final void deleteKey(EncryptionKey key) throws KeyManagerException {
    checkKey(key);
    try {
      keyStore.deleteKey(keyType().tag(), key.address(), key.isPrivate());
    } catch (ServiceException e) {
      throw new KeyManagerException(
          "Failed to delete key " + key.keyId(), ErrorReason.LOCAL_STORE_ERROR, e);
    }
  }

  @Override
  public final EncryptionKey keyFromDocument(KeyDocument document) throws KeyManagerException {
    if (!keyType().tag().equals(document.type())) {
      throw new KeyManagerException(
          String.format(
              "Document of type '%s' given to the %s scheme", document.type(), keyType().tag()),
          ErrorReason.UNKNOWN_KEY_TYPE);
    }
    return fromDocument(document);
  }

  /** Returns the stored key, or empty on a local miss. */
  protected final Optional<K> getTypedKey(String address, boolean isPrivate)
      throws KeyManagerException {
    Optional<KeyDocument> document;
    try {
      document = keyStore.getKey(keyType().tag(), address, isPrivate);
    } catch (ServiceException e) {
      throw new KeyManagerException(
          "Failed to read key for " + address, ErrorReason.LOCAL_STORE_ERROR, e);
    }
    if (document.isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(fromDocument(document.get()));
  }

  /**
   * Returns {@code key} as this scheme's key class.
   *
   * @throws KeyManagerException with {@link ErrorReason#UNKNOWN_KEY_TYPE} for a foreign key
   */
  protected final K checkKey(EncryptionKey key) throws KeyManagerException {
    checkNotNull(key);
    if (!keyClass.isInstance(key)) {
      throw new KeyManagerException(
          String.format(
              "%s scheme cannot use key of class %s",
              keyType().tag(), key.getClass().getSimpleName()),
          ErrorReason.UNKNOWN_KEY_TYPE);
    }
    return keyClass.cast(key);
  }

  /** Converts a document already known to be of this scheme's type. */
  protected abstract K fromDocument(KeyDocument document) throws KeyManagerException;
}
