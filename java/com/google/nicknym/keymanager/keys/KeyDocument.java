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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;
import java.time.Instant;
import java.util.List;
import javax.annotation.Nullable;

/**
 * Generic storage record of a key. Documents are indexed by ({@code tags}, {@code private}) so all
 * keys of one role can be listed without knowing their addresses; {@code type} is turned back into
 * a concrete key by the scheme registry.
 */
@AutoValue
@JsonDeserialize(builder = KeyDocument.Builder.class)
public abstract class KeyDocument {

  /** Tag carried by every document written by the key manager. */
  public static final String KEYMANAGER_KEY_TAG = "keymanager-key";

  public static Builder builder() {
    return Builder.builder();
  }

  /** Tag of the {@link KeyType} owning the key. */
  @JsonProperty("type")
  public abstract String type();

  @JsonProperty("address")
  public abstract String address();

  @JsonProperty("key_id")
  public abstract String keyId();

  @JsonProperty("fingerprint")
  public abstract String fingerprint();

  @JsonProperty("key_data")
  public abstract String keyData();

  @JsonProperty("private")
  public abstract boolean isPrivate();

  @JsonProperty("length")
  public abstract int length();

  @Nullable
  @JsonInclude(Include.NON_NULL)
  @JsonProperty("expiry_date")
  public abstract Instant expiryDate();

  @JsonProperty("tags")
  public abstract ImmutableList<String> tags();

  @AutoValue.Builder
  public abstract static class Builder {

    @JsonCreator
    public static Builder builder() {
      return new AutoValue_KeyDocument.Builder()
          .setTags(ImmutableList.of(KEYMANAGER_KEY_TAG));
    }

    @JsonProperty("type")
    public abstract Builder setType(String type);

    @JsonProperty("address")
    public abstract Builder setAddress(String address);

    @JsonProperty("key_id")
    public abstract Builder setKeyId(String keyId);

    @JsonProperty("fingerprint")
    public abstract Builder setFingerprint(String fingerprint);

    @JsonProperty("key_data")
    public abstract Builder setKeyData(String keyData);

    @JsonProperty("private")
    public abstract Builder setIsPrivate(boolean isPrivate);

    @JsonProperty("length")
    public abstract Builder setLength(int length);

    @JsonProperty("expiry_date")
    public abstract Builder setExpiryDate(@Nullable Instant expiryDate);

    @JsonProperty("tags")
    public abstract Builder setTags(List<String> tags);

    public abstract KeyDocument build();
  }
}
