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

import com.google.auto.value.AutoValue;
import com.google.nicknym.keymanager.keys.EncryptionKey;
import com.google.nicknym.keymanager.keys.KeyDocument;
import com.google.nicknym.keymanager.keys.KeyType;
import java.time.Instant;
import java.util.Optional;

/** An OpenPGP key ring bound to an address. Key data is the ASCII-armored ring. */
@AutoValue
public abstract class OpenPgpKey extends EncryptionKey {

  public static Builder builder() {
    return new AutoValue_OpenPgpKey.Builder();
  }

  static OpenPgpKey fromDocument(KeyDocument document) {
    return builder()
        .setAddress(document.address())
        .setKeyId(document.keyId())
        .setFingerprint(document.fingerprint())
        .setKeyData(document.keyData())
        .setIsPrivate(document.isPrivate())
        .setLength(document.length())
        .setExpiryDate(Optional.ofNullable(document.expiryDate()))
        .build();
  }

  @Override
  public final KeyType keyType() {
    return KeyType.OPENPGP;
  }

  public abstract Builder toBuilder();

  @AutoValue.Builder
  public abstract static class Builder {

    public abstract Builder setAddress(String address);

    public abstract Builder setKeyId(String keyId);

    public abstract Builder setFingerprint(String fingerprint);

    public abstract Builder setKeyData(String keyData);

    public abstract Builder setIsPrivate(boolean isPrivate);

    public abstract Builder setLength(int length);

    public abstract Builder setExpiryDate(Optional<Instant> expiryDate);

    public abstract OpenPgpKey build();
  }
}
