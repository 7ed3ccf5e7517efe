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

import com.google.auto.value.AutoValue;

/** Outcome of a successful signature verification. */
@AutoValue
public abstract class VerificationResult {

  public static VerificationResult create(String signerKeyId, byte[] content) {
    return new AutoValue_VerificationResult(signerKeyId, content.clone());
  }

  /** Id of the key that made the signature. */
  public abstract String signerKeyId();

  /** The data covered by the signature. */
  @SuppressWarnings("mutable")
  public abstract byte[] content();
}
