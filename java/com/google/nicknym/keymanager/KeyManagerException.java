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

import com.google.nicknym.keymanager.model.ErrorReason;

/** Represents an exception thrown while resolving keys or running a cryptographic operation. */
public final class KeyManagerException extends Exception {
  private final ErrorReason reason;

  /** Creates a new instance from a message String, a reason and a {@code Throwable}. */
  public KeyManagerException(String message, ErrorReason reason, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  /** Creates a new instance from a message String and a reason. */
  public KeyManagerException(String message, ErrorReason reason) {
    super(message);
    this.reason = reason;
  }

  /** Shorthand for the ordinary "no such key yet" failure. */
  public static KeyManagerException keyNotFound(String keyType, String address, boolean isPrivate) {
    return new KeyManagerException(
        String.format(
            "No %s %s key found for address '%s'",
            isPrivate ? "private" : "public", keyType, address),
        ErrorReason.KEY_NOT_FOUND);
  }

  /** Returns {@code ErrorReason} for the exception. */
  public ErrorReason getReason() {
    return reason;
  }

  /** Returns whether the exception signals a missing key rather than a failure. */
  public boolean isKeyNotFound() {
    return reason == ErrorReason.KEY_NOT_FOUND;
  }

  /** Returns a String representation of the class. */
  @Override
  public String toString() {
    return String.format("ERROR: %s\n%s", reason, super.toString());
  }
}
