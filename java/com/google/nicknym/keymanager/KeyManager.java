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

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.collect.ImmutableSet.toImmutableSet;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.nicknym.keymanager.client.KeyServerClient;
import com.google.nicknym.keymanager.client.KeyServerClient.KeyServerClientException;
import com.google.nicknym.keymanager.keys.EncryptionKey;
import com.google.nicknym.keymanager.keys.EncryptionScheme;
import com.google.nicknym.keymanager.keys.KeyDocument;
import com.google.nicknym.keymanager.keys.KeyType;
import com.google.nicknym.keymanager.keys.SchemeRegistry;
import com.google.nicknym.keymanager.keys.VerificationResult;
import com.google.nicknym.keymanager.model.ErrorReason;
import com.google.nicknym.keymanager.store.KeyStore;
import com.google.nicknym.shared.api.exception.ServiceException;
import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves keys for addresses, local store first and nickserver second, and hands cryptographic
 * operations to the scheme owning each key.
 *
 * <p>Each operation reads one configuration snapshot; updates replace the snapshot atomically.
 */
public final class KeyManager {

  private static final Logger logger = LoggerFactory.getLogger(KeyManager.class);

  private final SchemeRegistry schemeRegistry;
  private final KeyStore keyStore;
  private final KeyServerClient keyServerClient;
  private final AtomicReference<KeyManagerConfig> config;

  @Inject
  public KeyManager(
      KeyManagerConfig config,
      SchemeRegistry schemeRegistry,
      KeyStore keyStore,
      KeyServerClient keyServerClient) {
    this.config = new AtomicReference<>(checkNotNull(config));
    this.schemeRegistry = schemeRegistry;
    this.keyStore = keyStore;
    this.keyServerClient = keyServerClient;
  }

  /** Returns the current configuration snapshot. */
  public KeyManagerConfig getConfig() {
    return config.get();
  }

  public String getAddress() {
    return config.get().address();
  }

  public void updateSessionId(String sessionId) {
    config.updateAndGet(current -> current.toBuilder().setSessionId(sessionId).build());
  }

  public void updateCaCertPath(Path caCertPath) {
    config.updateAndGet(current -> current.toBuilder().setCaCertPath(caCertPath).build());
  }

  /** Sets where and as whom keys are published. */
  public void updateProviderApi(URI apiUri, String apiVersion, String uid) {
    config.updateAndGet(
        current ->
            current.toBuilder().setApiUri(apiUri).setApiVersion(apiVersion).setUid(uid).build());
  }

  /** Returns the public key of {@code keyType} for {@code address}, fetching it if needed. */
  public EncryptionKey getKey(String address, KeyType keyType) throws KeyManagerException {
    return getKey(address, keyType, false, true);
  }

  public EncryptionKey getKey(String address, KeyType keyType, boolean isPrivate)
      throws KeyManagerException {
    return getKey(address, keyType, isPrivate, true);
  }

  /**
   * Returns the key of {@code keyType} and role for {@code address}. On a local miss for a public
   * key, and only if {@code fetchRemote} is set, the nickserver is asked once and the local store
   * is read again. Private keys are never fetched.
   */
  public EncryptionKey getKey(
      String address, KeyType keyType, boolean isPrivate, boolean fetchRemote)
      throws KeyManagerException {
    EncryptionScheme scheme = schemeRegistry.schemeFor(keyType);
    try {
      return scheme.getKey(address, isPrivate);
    } catch (KeyManagerException e) {
      if (!e.isKeyNotFound() || isPrivate || !fetchRemote) {
        throw e;
      }
      logger.info("No local {} key for {}, asking the nickserver", keyType.tag(), address);
    }
    remoteFetch(address);
    return scheme.getKey(address, false);
  }

  /**
   * Fetches the keys published for {@code address} and stores every one whose type has a scheme.
   * Other entries are skipped.
   */
  public void remoteFetch(String address) throws KeyManagerException {
    KeyManagerConfig current = config.get();
    Path caCertPath = requireCaCertPath(current);
    ImmutableMap<String, String> serverKeys;
    try {
      serverKeys = keyServerClient.lookupKeys(current.nicknymUri(), address, caCertPath);
    } catch (KeyServerClientException e) {
      logger.warn("Nickserver lookup of {} failed: {}", address, e.getMessage());
      throw new KeyManagerException(
          "Failed to fetch keys for " + address, ErrorReason.TRANSPORT_FAILURE, e);
    }
    for (Map.Entry<String, String> entry : serverKeys.entrySet()) {
      Optional<KeyType> keyType =
          KeyType.tryFromTag(entry.getKey()).filter(schemeRegistry::isRegistered);
      if (keyType.isEmpty()) {
        logger.info("Skipping nickserver entry '{}' for {}", entry.getKey(), address);
        continue;
      }
      schemeRegistry.schemeFor(keyType.get()).putPublicAsciiKey(address, entry.getValue());
    }
  }

  /**
   * Fetches again the keys of every address with a local public key, except the user's own.
   * Every address is tried; failures are reported together at the end.
   *
   * @throws KeyManagerException with {@link ErrorReason#REFRESH_FAILED} if any address failed,
   *     carrying each failure as a suppressed exception
   */
  public void refreshKeys() throws KeyManagerException {
    KeyManagerConfig current = config.get();
    ImmutableSet<String> addresses =
        getAllKeysInLocalDb(false).stream()
            .map(EncryptionKey::address)
            .filter(address -> !address.equals(current.address()))
            .collect(toImmutableSet());
    if (addresses.isEmpty()) {
      return;
    }
    requireCaCertPath(current);

    Map<String, KeyManagerException> failures = new LinkedHashMap<>();
    for (String address : addresses) {
      try {
        remoteFetch(address);
      } catch (KeyManagerException e) {
        logger.warn("Refreshing keys of {} failed", address, e);
        failures.put(address, e);
      }
    }
    logger.info(
        "Refreshed {} of {} addresses", addresses.size() - failures.size(), addresses.size());
    if (!failures.isEmpty()) {
      KeyManagerException refreshFailure =
          new KeyManagerException(
              String.format("Failed to refresh keys for %s", failures.keySet()),
              ErrorReason.REFRESH_FAILED);
      failures.values().forEach(refreshFailure::addSuppressed);
      throw refreshFailure;
    }
  }

  /** Generates a key pair of {@code keyType} for the user's own address. */
  public EncryptionKey genKey(KeyType keyType) throws KeyManagerException {
    return schemeRegistry.schemeFor(keyType).genKey(config.get().address());
  }

  /** Publishes the user's own public key of {@code keyType} to the provider. */
  public void sendKey(KeyType keyType) throws KeyManagerException {
    EncryptionScheme scheme = schemeRegistry.schemeFor(keyType);
    if (!scheme.supportsPublishing()) {
      throw new KeyManagerException(
          String.format("Keys of type %s cannot be published", keyType.tag()),
          ErrorReason.PUBLISHING_NOT_SUPPORTED);
    }
    KeyManagerConfig current = config.get();
    // Never fetched remotely.
    EncryptionKey publicKey = getKey(current.address(), keyType, false, false);
    Path caCertPath = requireCaCertPath(current);
    String sessionId =
        current
            .sessionId()
            .orElseThrow(
                () ->
                    new KeyManagerException(
                        "Publishing a key requires a session id",
                        ErrorReason.AUTHENTICATION_REQUIRED));
    URI userUri = providerUserUri(current);

    try {
      keyServerClient.putPublicKey(userUri, publicKey.keyData(), sessionId, caCertPath);
    } catch (KeyServerClientException e) {
      logger.warn("Publishing {} failed: {}", publicKey, e.getMessage());
      throw new KeyManagerException(
          "Failed to publish key " + publicKey.keyId(), ErrorReason.TRANSPORT_FAILURE, e);
    }
    logger.info("Published {}", publicKey);
  }

  /** Removes {@code key} from the local store. */
  public void deleteKey(EncryptionKey key) throws KeyManagerException {
    schemeRegistry.schemeFor(key.keyType()).deleteKey(key);
  }

  /** Returns every locally stored key of the given role, of every registered type. */
  public ImmutableList<EncryptionKey> getAllKeysInLocalDb(boolean isPrivate)
      throws KeyManagerException {
    ImmutableList<KeyDocument> documents;
    try {
      documents = keyStore.getKeysByTag(KeyDocument.KEYMANAGER_KEY_TAG, isPrivate);
    } catch (ServiceException e) {
      throw new KeyManagerException(
          "Failed to list local keys", ErrorReason.LOCAL_STORE_ERROR, e);
    }
    ImmutableList.Builder<EncryptionKey> keys = ImmutableList.builder();
    for (KeyDocument document : documents) {
      keys.add(schemeRegistry.keyFromDocument(document));
    }
    return keys.build();
  }

  public byte[] encrypt(byte[] data, EncryptionKey publicKey) throws KeyManagerException {
    return encrypt(data, publicKey, Optional.empty(), Optional.empty());
  }

  /**
   * Encrypts {@code data} to {@code publicKey}, signing it with {@code signWith} when given.
   *
   * @param passphrase unlocks {@code signWith} if it is protected
   */
  public byte[] encrypt(
      byte[] data,
      EncryptionKey publicKey,
      Optional<String> passphrase,
      Optional<EncryptionKey> signWith)
      throws KeyManagerException {
    EncryptionScheme scheme = schemeForKey(publicKey, false);
    if (signWith.isPresent()) {
      checkSameType(schemeForKey(signWith.get(), true), scheme);
    }
    return scheme.encrypt(data, publicKey, passphrase, signWith);
  }

  public byte[] decrypt(byte[] data, EncryptionKey privateKey) throws KeyManagerException {
    return decrypt(data, privateKey, Optional.empty(), Optional.empty());
  }

  /**
   * Decrypts {@code data} with {@code privateKey}. If {@code verifyWith} is given the data must
   * carry a valid signature by it.
   */
  public byte[] decrypt(
      byte[] data,
      EncryptionKey privateKey,
      Optional<String> passphrase,
      Optional<EncryptionKey> verifyWith)
      throws KeyManagerException {
    EncryptionScheme scheme = schemeForKey(privateKey, true);
    if (verifyWith.isPresent()) {
      checkSameType(schemeForKey(verifyWith.get(), false), scheme);
    }
    return scheme.decrypt(data, privateKey, passphrase, verifyWith);
  }

  public byte[] sign(byte[] data, EncryptionKey privateKey) throws KeyManagerException {
    return sign(data, privateKey, Optional.empty());
  }

  public byte[] sign(byte[] data, EncryptionKey privateKey, Optional<String> passphrase)
      throws KeyManagerException {
    return schemeForKey(privateKey, true).sign(data, privateKey, passphrase);
  }

  public VerificationResult verify(byte[] signedData, EncryptionKey publicKey)
      throws KeyManagerException {
    return schemeForKey(publicKey, false).verify(signedData, publicKey);
  }

  /** Looks up the scheme for {@code key}, then checks the key has the expected role. */
  private EncryptionScheme schemeForKey(EncryptionKey key, boolean expectPrivate)
      throws KeyManagerException {
    checkNotNull(key);
    EncryptionScheme scheme = schemeRegistry.schemeFor(key.keyType());
    if (key.isPrivate() != expectPrivate) {
      throw new KeyManagerException(
          String.format("Expected a %s key, got %s", expectPrivate ? "private" : "public", key),
          ErrorReason.ROLE_VIOLATION);
    }
    return scheme;
  }

  private static void checkSameType(EncryptionScheme other, EncryptionScheme scheme)
      throws KeyManagerException {
    if (other.keyType() != scheme.keyType()) {
      throw new KeyManagerException(
          String.format(
              "Cannot combine %s and %s keys", other.keyType().tag(), scheme.keyType().tag()),
          ErrorReason.UNKNOWN_KEY_TYPE);
    }
  }

  private static Path requireCaCertPath(KeyManagerConfig current) throws KeyManagerException {
    return current
        .caCertPath()
        .orElseThrow(
            () ->
                new KeyManagerException(
                    "No provider CA certificate configured", ErrorReason.INVALID_CONFIGURATION));
  }

  /** {@code <apiUri>/<apiVersion>/users/<uid>.json} */
  private static URI providerUserUri(KeyManagerConfig current) throws KeyManagerException {
    if (current.apiUri().isEmpty() || current.apiVersion().isEmpty() || current.uid().isEmpty()) {
      throw new KeyManagerException(
          "Publishing a key requires the provider API URI, version and uid",
          ErrorReason.INVALID_CONFIGURATION);
    }
    String base = current.apiUri().get().toString();
    if (base.endsWith("/")) {
      base = base.substring(0, base.length() - 1);
    }
    try {
      return URI.create(
          String.format(
              "%s/%s/users/%s.json", base, current.apiVersion().get(), current.uid().get()));
    } catch (IllegalArgumentException e) {
      throw new KeyManagerException(
          "Invalid provider API location", ErrorReason.INVALID_CONFIGURATION, e);
    }
  }
}
