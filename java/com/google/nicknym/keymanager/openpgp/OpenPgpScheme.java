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

package com.google.nicknym.keymanager.openpgp;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.io.BaseEncoding;
import com.google.inject.BindingAnnotation;
import com.google.nicknym.keymanager.KeyManagerException;
import com.google.nicknym.keymanager.keys.AbstractEncryptionScheme;
import com.google.nicknym.keymanager.keys.EncryptionKey;
import com.google.nicknym.keymanager.keys.KeyDocument;
import com.google.nicknym.keymanager.keys.KeyType;
import com.google.nicknym.keymanager.keys.VerificationResult;
import com.google.nicknym.keymanager.model.ErrorReason;
import com.google.nicknym.keymanager.store.KeyStore;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Date;
import java.util.Iterator;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import org.bouncycastle.bcpg.ArmoredOutputStream;
import org.bouncycastle.bcpg.CompressionAlgorithmTags;
import org.bouncycastle.bcpg.HashAlgorithmTags;
import org.bouncycastle.bcpg.PublicKeyAlgorithmTags;
import org.bouncycastle.bcpg.SymmetricKeyAlgorithmTags;
import org.bouncycastle.bcpg.sig.KeyFlags;
import org.bouncycastle.crypto.generators.RSAKeyPairGenerator;
import org.bouncycastle.crypto.params.RSAKeyGenerationParameters;
import org.bouncycastle.openpgp.PGPCompressedData;
import org.bouncycastle.openpgp.PGPCompressedDataGenerator;
import org.bouncycastle.openpgp.PGPEncryptedData;
import org.bouncycastle.openpgp.PGPEncryptedDataGenerator;
import org.bouncycastle.openpgp.PGPEncryptedDataList;
import org.bouncycastle.openpgp.PGPException;
import org.bouncycastle.openpgp.PGPKeyPair;
import org.bouncycastle.openpgp.PGPKeyRing;
import org.bouncycastle.openpgp.PGPKeyRingGenerator;
import org.bouncycastle.openpgp.PGPLiteralData;
import org.bouncycastle.openpgp.PGPLiteralDataGenerator;
import org.bouncycastle.openpgp.PGPMarker;
import org.bouncycastle.openpgp.PGPObjectFactory;
import org.bouncycastle.openpgp.PGPOnePassSignature;
import org.bouncycastle.openpgp.PGPOnePassSignatureList;
import org.bouncycastle.openpgp.PGPPrivateKey;
import org.bouncycastle.openpgp.PGPPublicKey;
import org.bouncycastle.openpgp.PGPPublicKeyEncryptedData;
import org.bouncycastle.openpgp.PGPPublicKeyRing;
import org.bouncycastle.openpgp.PGPSecretKey;
import org.bouncycastle.openpgp.PGPSecretKeyRing;
import org.bouncycastle.openpgp.PGPSignature;
import org.bouncycastle.openpgp.PGPSignatureGenerator;
import org.bouncycastle.openpgp.PGPSignatureList;
import org.bouncycastle.openpgp.PGPSignatureSubpacketGenerator;
import org.bouncycastle.openpgp.PGPUtil;
import org.bouncycastle.openpgp.bc.BcPGPObjectFactory;
import org.bouncycastle.openpgp.operator.PGPDigestCalculator;
import org.bouncycastle.openpgp.operator.bc.BcKeyFingerprintCalculator;
import org.bouncycastle.openpgp.operator.bc.BcPBESecretKeyDecryptorBuilder;
import org.bouncycastle.openpgp.operator.bc.BcPGPContentSignerBuilder;
import org.bouncycastle.openpgp.operator.bc.BcPGPContentVerifierBuilderProvider;
import org.bouncycastle.openpgp.operator.bc.BcPGPDataEncryptorBuilder;
import org.bouncycastle.openpgp.operator.bc.BcPGPDigestCalculatorProvider;
import org.bouncycastle.openpgp.operator.bc.BcPGPKeyPair;
import org.bouncycastle.openpgp.operator.bc.BcPublicKeyDataDecryptorFactory;
import org.bouncycastle.openpgp.operator.bc.BcPublicKeyKeyEncryptionMethodGenerator;
import org.bouncycastle.util.io.Streams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * OpenPGP scheme backed by BouncyCastle. Generated keys are RSA: a certifying and signing primary
 * key with an encryption subkey, unprotected, with the address as the only user id. Messages are
 * ASCII-armored, compressed and integrity protected.
 */
public final class OpenPgpScheme extends AbstractEncryptionScheme<OpenPgpKey> {

  private static final Logger logger = LoggerFactory.getLogger(OpenPgpScheme.class);

  public static final int DEFAULT_KEY_STRENGTH = 4096;

  private static final BigInteger RSA_PUBLIC_EXPONENT = BigInteger.valueOf(0x10001);
  private static final int RSA_PRIME_CERTAINTY = 12;
  private static final int BUFFER_SIZE = 1 << 16;
  private static final int[] PREFERRED_SYMMETRIC_ALGORITHMS = {
    SymmetricKeyAlgorithmTags.AES_256,
    SymmetricKeyAlgorithmTags.AES_192,
    SymmetricKeyAlgorithmTags.AES_128
  };
  private static final int[] PREFERRED_HASH_ALGORITHMS = {
    HashAlgorithmTags.SHA512, HashAlgorithmTags.SHA384, HashAlgorithmTags.SHA256
  };
  private static final Pattern EMAIL_IN_USER_ID = Pattern.compile("<([^<>]+)>");

  private final int keyStrength;
  private final SecureRandom random = new SecureRandom();

  @Inject
  public OpenPgpScheme(KeyStore keyStore, @OpenPgpKeyStrength int keyStrength) {
    super(keyStore, OpenPgpKey.class);
    this.keyStrength = keyStrength;
  }

  @Override
  public KeyType keyType() {
    return KeyType.OPENPGP;
  }

  @Override
  public boolean supportsPublishing() {
    return true;
  }

  @Override
  public EncryptionKey genKey(String address) throws KeyManagerException {
    if (getTypedKey(address, true).isPresent()) {
      throw new KeyManagerException(
          "A private OpenPGP key already exists for " + address, ErrorReason.KEY_ALREADY_EXISTS);
    }
    logger.info("Generating {} bit OpenPGP key pair for {}", keyStrength, address);
    PGPSecretKeyRing secretRing;
    PGPPublicKeyRing publicRing;
    try {
      PGPKeyRingGenerator generator = newKeyRingGenerator(address);
      secretRing = generator.generateSecretKeyRing();
      publicRing = generator.generatePublicKeyRing();
    } catch (PGPException e) {
      throw cryptoError("Failed to generate OpenPGP key for " + address, e);
    }
    OpenPgpKey publicKey = buildKey(address, publicRing.getPublicKey(), armor(publicRing), false);
    OpenPgpKey privateKey = buildKey(address, secretRing.getPublicKey(), armor(secretRing), true);
    putKey(publicKey);
    putKey(privateKey);
    return privateKey;
  }

  @Override
  public ImmutableList<EncryptionKey> putAsciiKey(String keyData) throws KeyManagerException {
    return importKeys(keyData, true, Optional.empty());
  }

  @Override
  public ImmutableList<EncryptionKey> putPublicAsciiKey(String address, String keyData)
      throws KeyManagerException {
    return importKeys(keyData, false, Optional.of(address));
  }

  @Override
  public byte[] encrypt(
      byte[] data,
      EncryptionKey publicKey,
      Optional<String> passphrase,
      Optional<EncryptionKey> signWith)
      throws KeyManagerException {
    OpenPgpKey recipient = checkKey(publicKey);
    Optional<OpenPgpKey> signer =
        signWith.isPresent() ? Optional.of(checkKey(signWith.get())) : Optional.empty();
    try {
      PGPPublicKey encryptionKey = findEncryptionKey(readPublicKeyRing(recipient.keyData()));
      Optional<PGPSignatureGenerator> signatureGenerator =
          signer.isPresent()
              ? Optional.of(newSignatureGenerator(signer.get(), passphrase))
              : Optional.empty();

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      try (ArmoredOutputStream armored = new ArmoredOutputStream(out)) {
        PGPEncryptedDataGenerator encryptedDataGenerator =
            new PGPEncryptedDataGenerator(
                new BcPGPDataEncryptorBuilder(SymmetricKeyAlgorithmTags.AES_256)
                    .setWithIntegrityPacket(true)
                    .setSecureRandom(random));
        encryptedDataGenerator.addMethod(
            new BcPublicKeyKeyEncryptionMethodGenerator(encryptionKey));
        try (OutputStream encryptedOut =
            encryptedDataGenerator.open(armored, new byte[BUFFER_SIZE])) {
          PGPCompressedDataGenerator compressedDataGenerator =
              new PGPCompressedDataGenerator(CompressionAlgorithmTags.ZIP);
          try (OutputStream compressedOut = compressedDataGenerator.open(encryptedOut)) {
            writeLiteralData(compressedOut, data, signatureGenerator);
          }
        }
      }
      return out.toByteArray();
    } catch (IOException | PGPException e) {
      throw cryptoError("Failed to encrypt to key " + recipient.keyId(), e);
    }
  }

  @Override
  public byte[] decrypt(
      byte[] data,
      EncryptionKey privateKey,
      Optional<String> passphrase,
      Optional<EncryptionKey> verifyWith)
      throws KeyManagerException {
    OpenPgpKey recipient = checkKey(privateKey);
    Optional<OpenPgpKey> verifier =
        verifyWith.isPresent() ? Optional.of(checkKey(verifyWith.get())) : Optional.empty();
    SignedContent content;
    try {
      PGPSecretKeyRing secretRing = readSecretKeyRing(recipient.keyData());
      PGPObjectFactory factory =
          new BcPGPObjectFactory(PGPUtil.getDecoderStream(new ByteArrayInputStream(data)));
      Object message = nextObject(factory);
      if (!(message instanceof PGPEncryptedDataList)) {
        throw new PGPException("Data is not an OpenPGP encrypted message");
      }

      PGPPublicKeyEncryptedData encryptedData = null;
      PGPSecretKey secretKey = null;
      for (PGPEncryptedData candidate : (PGPEncryptedDataList) message) {
        if (candidate instanceof PGPPublicKeyEncryptedData) {
          PGPPublicKeyEncryptedData publicKeyEncryptedData = (PGPPublicKeyEncryptedData) candidate;
          PGPSecretKey matchingKey = secretRing.getSecretKey(publicKeyEncryptedData.getKeyID());
          if (matchingKey != null) {
            encryptedData = publicKeyEncryptedData;
            secretKey = matchingKey;
            break;
          }
        }
      }
      if (encryptedData == null) {
        throw new KeyManagerException(
            "Message is not encrypted to key " + recipient.keyId(), ErrorReason.CRYPTO_ERROR);
      }

      PGPPrivateKey decryptionKey = extractPrivateKey(secretKey, passphrase);
      InputStream clear =
          encryptedData.getDataStream(new BcPublicKeyDataDecryptorFactory(decryptionKey));
      content = readSignedContent(new BcPGPObjectFactory(clear));
      Streams.drain(clear);
      if (encryptedData.isIntegrityProtected() && !encryptedData.verify()) {
        throw new KeyManagerException(
            "Message failed its integrity check", ErrorReason.CRYPTO_ERROR);
      }
    } catch (IOException | PGPException | RuntimeException e) {
      // The packet parser reports some malformed input with unchecked exceptions.
      throw cryptoError("Failed to decrypt with key " + recipient.keyId(), e);
    }

    if (verifier.isPresent()) {
      verifySignature(content, readPublicKeyRingForVerification(verifier.get()));
    }
    return content.data;
  }

  @Override
  public byte[] sign(byte[] data, EncryptionKey privateKey, Optional<String> passphrase)
      throws KeyManagerException {
    OpenPgpKey signer = checkKey(privateKey);
    try {
      PGPSignatureGenerator signatureGenerator = newSignatureGenerator(signer, passphrase);
      ByteArrayOutputStream out = new ByteArrayOutputStream();
      try (ArmoredOutputStream armored = new ArmoredOutputStream(out)) {
        writeLiteralData(armored, data, Optional.of(signatureGenerator));
      }
      return out.toByteArray();
    } catch (IOException | PGPException e) {
      throw cryptoError("Failed to sign with key " + signer.keyId(), e);
    }
  }

  @Override
  public VerificationResult verify(byte[] signedData, EncryptionKey publicKey)
      throws KeyManagerException {
    OpenPgpKey signer = checkKey(publicKey);
    PGPPublicKeyRing publicRing = readPublicKeyRingForVerification(signer);
    SignedContent content;
    try {
      InputStream decoded = PGPUtil.getDecoderStream(new ByteArrayInputStream(signedData));
      content = readSignedContent(new BcPGPObjectFactory(decoded));
      // Reading to the end makes the armor checksum count.
      Streams.drain(decoded);
    } catch (IOException | PGPException | RuntimeException e) {
      // The packet parser reports some malformed input with unchecked exceptions.
      throw new KeyManagerException(
          "Signed data is malformed", ErrorReason.INVALID_SIGNATURE, e);
    }
    long signerKeyId = verifySignature(content, publicRing);
    return VerificationResult.create(formatKeyId(signerKeyId), content.data);
  }

  @Override
  protected OpenPgpKey fromDocument(KeyDocument document) {
    return OpenPgpKey.fromDocument(document);
  }

  /**
   * Imports every key ring in {@code keyData}. With {@code boundTo} set, a ring is stored only
   * under that address, and rings whose user ids do not carry it are skipped.
   */
  private ImmutableList<EncryptionKey> importKeys(
      String keyData, boolean includeSecret, Optional<String> boundTo)
      throws KeyManagerException {
    ImmutableList.Builder<EncryptionKey> imported = ImmutableList.builder();
    try {
      PGPObjectFactory factory =
          new BcPGPObjectFactory(
              PGPUtil.getDecoderStream(
                  new ByteArrayInputStream(keyData.getBytes(StandardCharsets.US_ASCII))));
      for (Object object = nextObject(factory); object != null; object = nextObject(factory)) {
        if (object instanceof PGPPublicKeyRing) {
          PGPPublicKeyRing publicRing = (PGPPublicKeyRing) object;
          imported.addAll(storeRing(publicRing, publicRing.getPublicKey(), false, boundTo));
        } else if (object instanceof PGPSecretKeyRing) {
          PGPSecretKeyRing secretRing = (PGPSecretKeyRing) object;
          PGPPublicKeyRing publicRing = publicRingOf(secretRing);
          imported.addAll(storeRing(publicRing, publicRing.getPublicKey(), false, boundTo));
          if (includeSecret) {
            imported.addAll(storeRing(secretRing, secretRing.getPublicKey(), true, boundTo));
          } else {
            logger.warn(
                "Ignoring secret key material for key {}",
                formatKeyId(secretRing.getPublicKey().getKeyID()));
          }
        } else {
          logger.debug("Ignoring OpenPGP object {}", object.getClass().getSimpleName());
        }
      }
    } catch (IOException e) {
      throw cryptoError("Failed to parse OpenPGP key data", e);
    }
    ImmutableList<EncryptionKey> keys = imported.build();
    if (keys.isEmpty()) {
      throw new KeyManagerException(
          boundTo.isPresent()
              ? "Data does not contain an OpenPGP key for " + boundTo.get()
              : "Data does not contain an OpenPGP key",
          ErrorReason.CRYPTO_ERROR);
    }
    return keys;
  }

  /**
   * Stores one key per address found in the primary key's user ids, or only under
   * {@code boundTo} when it is set.
   */
  private ImmutableList<EncryptionKey> storeRing(
      PGPKeyRing ring, PGPPublicKey primaryKey, boolean isPrivate, Optional<String> boundTo)
      throws KeyManagerException {
    ImmutableSet<String> addresses = addressesOf(primaryKey);
    if (addresses.isEmpty()) {
      throw new KeyManagerException(
          "OpenPGP key " + formatKeyId(primaryKey.getKeyID()) + " has no user id",
          ErrorReason.CRYPTO_ERROR);
    }
    if (boundTo.isPresent()) {
      if (!addresses.contains(boundTo.get())) {
        logger.warn(
            "Skipping key {}: no user id for {}",
            formatKeyId(primaryKey.getKeyID()),
            boundTo.get());
        return ImmutableList.of();
      }
      addresses = ImmutableSet.of(boundTo.get());
    }
    String armored = armor(ring);
    ImmutableList.Builder<EncryptionKey> stored = ImmutableList.builder();
    for (String address : addresses) {
      OpenPgpKey key = buildKey(address, primaryKey, armored, isPrivate);
      putKey(key);
      logger.debug("Stored {}", key);
      stored.add(key);
    }
    return stored.build();
  }

  private PGPKeyRingGenerator newKeyRingGenerator(String address) throws PGPException {
    RSAKeyPairGenerator rsaGenerator = new RSAKeyPairGenerator();
    rsaGenerator.init(
        new RSAKeyGenerationParameters(
            RSA_PUBLIC_EXPONENT, random, keyStrength, RSA_PRIME_CERTAINTY));
    Date now = new Date();
    PGPKeyPair primaryPair =
        new BcPGPKeyPair(PublicKeyAlgorithmTags.RSA_GENERAL, rsaGenerator.generateKeyPair(), now);
    PGPKeyPair encryptionPair =
        new BcPGPKeyPair(PublicKeyAlgorithmTags.RSA_GENERAL, rsaGenerator.generateKeyPair(), now);

    PGPSignatureSubpacketGenerator primarySubpackets = new PGPSignatureSubpacketGenerator();
    primarySubpackets.setKeyFlags(false, KeyFlags.CERTIFY_OTHER | KeyFlags.SIGN_DATA);
    primarySubpackets.setPreferredSymmetricAlgorithms(false, PREFERRED_SYMMETRIC_ALGORITHMS);
    primarySubpackets.setPreferredHashAlgorithms(false, PREFERRED_HASH_ALGORITHMS);
    primarySubpackets.setPreferredCompressionAlgorithms(
        false, new int[] {CompressionAlgorithmTags.ZIP, CompressionAlgorithmTags.UNCOMPRESSED});

    PGPSignatureSubpacketGenerator encryptionSubpackets = new PGPSignatureSubpacketGenerator();
    encryptionSubpackets.setKeyFlags(false, KeyFlags.ENCRYPT_COMMS | KeyFlags.ENCRYPT_STORAGE);

    PGPDigestCalculator checksumCalculator =
        new BcPGPDigestCalculatorProvider().get(HashAlgorithmTags.SHA1);
    PGPKeyRingGenerator generator =
        new PGPKeyRingGenerator(
            PGPSignature.POSITIVE_CERTIFICATION,
            primaryPair,
            String.format("%s <%s>", address, address),
            checksumCalculator,
            primarySubpackets.generate(),
            null,
            new BcPGPContentSignerBuilder(
                PublicKeyAlgorithmTags.RSA_GENERAL, HashAlgorithmTags.SHA256),
            null);
    generator.addSubKey(encryptionPair, encryptionSubpackets.generate(), null);
    return generator;
  }

  private static OpenPgpKey buildKey(
      String address, PGPPublicKey primaryKey, String keyData, boolean isPrivate) {
    Optional<Instant> expiryDate = Optional.empty();
    if (primaryKey.getValidSeconds() > 0) {
      expiryDate =
          Optional.of(
              primaryKey.getCreationTime().toInstant().plusSeconds(primaryKey.getValidSeconds()));
    }
    return OpenPgpKey.builder()
        .setAddress(address)
        .setKeyId(formatKeyId(primaryKey.getKeyID()))
        .setFingerprint(BaseEncoding.base16().encode(primaryKey.getFingerprint()))
        .setKeyData(keyData)
        .setIsPrivate(isPrivate)
        .setLength(primaryKey.getBitStrength())
        .setExpiryDate(expiryDate)
        .build();
  }

  private static ImmutableSet<String> addressesOf(PGPPublicKey primaryKey) {
    ImmutableSet.Builder<String> addresses = ImmutableSet.builder();
    Iterator<String> userIds = primaryKey.getUserIDs();
    while (userIds.hasNext()) {
      String userId = userIds.next();
      Matcher matcher = EMAIL_IN_USER_ID.matcher(userId);
      String address = matcher.find() ? matcher.group(1) : userId;
      if (!address.trim().isEmpty()) {
        addresses.add(address.trim());
      }
    }
    return addresses.build();
  }

  private PGPSignatureGenerator newSignatureGenerator(
      OpenPgpKey signer, Optional<String> passphrase)
      throws KeyManagerException, IOException, PGPException {
    if (!signer.isPrivate()) {
      throw new KeyManagerException(
          "Signing requires a private key, got " + signer, ErrorReason.ROLE_VIOLATION);
    }
    PGPSecretKey signingKey = findSigningKey(readSecretKeyRing(signer.keyData()));
    PGPPrivateKey privateKey = extractPrivateKey(signingKey, passphrase);
    PGPSignatureGenerator generator =
        new PGPSignatureGenerator(
            new BcPGPContentSignerBuilder(
                signingKey.getPublicKey().getAlgorithm(), HashAlgorithmTags.SHA256));
    generator.init(PGPSignature.BINARY_DOCUMENT, privateKey);
    return generator;
  }

  /** Writes an optional one-pass signature header, the literal data and the signature. */
  private static void writeLiteralData(
      OutputStream out, byte[] data, Optional<PGPSignatureGenerator> signatureGenerator)
      throws IOException, PGPException {
    if (signatureGenerator.isPresent()) {
      signatureGenerator.get().generateOnePassVersion(false).encode(out);
    }
    PGPLiteralDataGenerator literalDataGenerator = new PGPLiteralDataGenerator();
    try (OutputStream literalOut =
        literalDataGenerator.open(
            out, PGPLiteralData.BINARY, PGPLiteralData.CONSOLE, data.length, new Date())) {
      literalOut.write(data);
    }
    if (signatureGenerator.isPresent()) {
      signatureGenerator.get().update(data);
      signatureGenerator.get().generate().encode(out);
    }
  }

  private static SignedContent readSignedContent(PGPObjectFactory factory)
      throws IOException, PGPException {
    PGPObjectFactory current = factory;
    Object message = nextObject(current);
    if (message instanceof PGPCompressedData) {
      current = new BcPGPObjectFactory(((PGPCompressedData) message).getDataStream());
      message = nextObject(current);
    }
    PGPOnePassSignature onePassSignature = null;
    if (message instanceof PGPOnePassSignatureList) {
      onePassSignature = ((PGPOnePassSignatureList) message).get(0);
      message = nextObject(current);
    }
    if (!(message instanceof PGPLiteralData)) {
      throw new PGPException("Message does not contain literal data");
    }
    byte[] data = Streams.readAll(((PGPLiteralData) message).getInputStream());
    PGPSignature signature = null;
    if (onePassSignature != null) {
      Object trailer = nextObject(current);
      if (trailer instanceof PGPSignatureList && ((PGPSignatureList) trailer).size() > 0) {
        signature = ((PGPSignatureList) trailer).get(0);
      }
    }
    return new SignedContent(data, onePassSignature, signature);
  }

  /** Checks the signature in {@code content} against {@code publicRing}; returns the signer id. */
  private static long verifySignature(SignedContent content, PGPPublicKeyRing publicRing)
      throws KeyManagerException {
    if (content.onePassSignature == null || content.signature == null) {
      throw new KeyManagerException("Data is not signed", ErrorReason.INVALID_SIGNATURE);
    }
    long signerKeyId = content.onePassSignature.getKeyID();
    PGPPublicKey signerKey = publicRing.getPublicKey(signerKeyId);
    if (signerKey == null) {
      throw new KeyManagerException(
          String.format(
              "Data is signed by %s, not by key %s",
              formatKeyId(signerKeyId), formatKeyId(publicRing.getPublicKey().getKeyID())),
          ErrorReason.INVALID_SIGNATURE);
    }
    try {
      content.onePassSignature.init(new BcPGPContentVerifierBuilderProvider(), signerKey);
      content.onePassSignature.update(content.data);
      if (!content.onePassSignature.verify(content.signature)) {
        throw new KeyManagerException(
            "Signature by " + formatKeyId(signerKeyId) + " does not validate",
            ErrorReason.INVALID_SIGNATURE);
      }
    } catch (PGPException e) {
      throw new KeyManagerException(
          "Failed to check signature", ErrorReason.INVALID_SIGNATURE, e);
    }
    return signerKeyId;
  }

  private static PGPPrivateKey extractPrivateKey(
      PGPSecretKey secretKey, Optional<String> passphrase)
      throws KeyManagerException, PGPException {
    if (secretKey.getKeyEncryptionAlgorithm() == SymmetricKeyAlgorithmTags.NULL) {
      return secretKey.extractPrivateKey(null);
    }
    if (passphrase.isEmpty()) {
      throw new KeyManagerException(
          "Key " + formatKeyId(secretKey.getKeyID()) + " is protected and no passphrase was given",
          ErrorReason.MISSING_CREDENTIAL);
    }
    return secretKey.extractPrivateKey(
        new BcPBESecretKeyDecryptorBuilder(new BcPGPDigestCalculatorProvider())
            .build(passphrase.get().toCharArray()));
  }

  private static PGPPublicKey findEncryptionKey(PGPPublicKeyRing publicRing)
      throws PGPException {
    PGPPublicKey fallback = null;
    for (PGPPublicKey key : publicRing) {
      if (!key.isEncryptionKey() || key.hasRevocation()) {
        continue;
      }
      if (!key.isMasterKey()) {
        return key;
      }
      fallback = key;
    }
    if (fallback == null) {
      throw new PGPException(
          "Key " + formatKeyId(publicRing.getPublicKey().getKeyID()) + " cannot encrypt");
    }
    return fallback;
  }

  private static PGPSecretKey findSigningKey(PGPSecretKeyRing secretRing) throws PGPException {
    PGPSecretKey primaryKey = secretRing.getSecretKey();
    if (primaryKey.isSigningKey() && !primaryKey.isPrivateKeyEmpty()) {
      return primaryKey;
    }
    for (PGPSecretKey key : secretRing) {
      if (key.isSigningKey() && !key.isPrivateKeyEmpty()) {
        return key;
      }
    }
    throw new PGPException(
        "Key " + formatKeyId(primaryKey.getKeyID()) + " has no usable signing key");
  }

  private static PGPPublicKeyRing readPublicKeyRingForVerification(OpenPgpKey key)
      throws KeyManagerException {
    try {
      return readPublicKeyRing(key.keyData());
    } catch (IOException | PGPException e) {
      throw cryptoError("Failed to read key " + key.keyId(), e);
    }
  }

  /** Reads a public ring; for private key data this is the public half of the secret ring. */
  private static PGPPublicKeyRing readPublicKeyRing(String keyData)
      throws IOException, PGPException {
    Object ring = readRing(keyData);
    if (ring instanceof PGPSecretKeyRing) {
      return publicRingOf((PGPSecretKeyRing) ring);
    }
    return (PGPPublicKeyRing) ring;
  }

  private static PGPSecretKeyRing readSecretKeyRing(String keyData)
      throws IOException, PGPException {
    Object ring = readRing(keyData);
    if (!(ring instanceof PGPSecretKeyRing)) {
      throw new PGPException("Key data does not contain secret key material");
    }
    return (PGPSecretKeyRing) ring;
  }

  private static Object readRing(String keyData) throws IOException, PGPException {
    PGPObjectFactory factory =
        new BcPGPObjectFactory(
            PGPUtil.getDecoderStream(
                new ByteArrayInputStream(keyData.getBytes(StandardCharsets.US_ASCII))));
    Object ring = nextObject(factory);
    if (!(ring instanceof PGPPublicKeyRing) && !(ring instanceof PGPSecretKeyRing)) {
      throw new PGPException("Key data does not contain an OpenPGP key ring");
    }
    return ring;
  }

  private static PGPPublicKeyRing publicRingOf(PGPSecretKeyRing secretRing) throws IOException {
    ByteArrayOutputStream encoded = new ByteArrayOutputStream();
    Iterator<PGPPublicKey> publicKeys = secretRing.getPublicKeys();
    while (publicKeys.hasNext()) {
      publicKeys.next().encode(encoded);
    }
    return new PGPPublicKeyRing(encoded.toByteArray(), new BcKeyFingerprintCalculator());
  }

  private static Object nextObject(PGPObjectFactory factory) throws IOException {
    Object object = factory.nextObject();
    while (object instanceof PGPMarker) {
      object = factory.nextObject();
    }
    return object;
  }

  private static String armor(PGPKeyRing ring) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    try (ArmoredOutputStream armored = new ArmoredOutputStream(out)) {
      ring.encode(armored);
    } catch (IOException e) {
      // Writing to memory only fails on a broken ring.
      throw new IllegalStateException("Failed to armor OpenPGP key ring", e);
    }
    return out.toString(StandardCharsets.US_ASCII);
  }

  static String formatKeyId(long keyId) {
    return String.format("%016X", keyId);
  }

  private static KeyManagerException cryptoError(String message, Exception cause) {
    logger.warn("{}: {}", message, cause.getMessage());
    return new KeyManagerException(message, ErrorReason.CRYPTO_ERROR, cause);
  }

  /** Content of a literal data packet with its optional one-pass signature. */
  private static final class SignedContent {
    private final byte[] data;
    private final PGPOnePassSignature onePassSignature;
    private final PGPSignature signature;

    private SignedContent(
        byte[] data, PGPOnePassSignature onePassSignature, PGPSignature signature) {
      this.data = data;
      this.onePassSignature = onePassSignature;
      this.signature = signature;
    }
  }

  /** RSA modulus size for generated keys. */
  @BindingAnnotation
  @Target({FIELD, PARAMETER, METHOD})
  @Retention(RUNTIME)
  public @interface OpenPgpKeyStrength {}
}
