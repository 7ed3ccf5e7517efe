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

package com.google.nicknym.shared.api.exception;

/** Defined error reasons to be used with shared methods */
public enum SharedErrorReason {
  /** An internal system error occurred on the remote side */
  SERVER_ERROR,
  /** The remote side answered with a body that is not what the protocol expects */
  INVALID_RESPONSE,
  /** The local key storage could not be read or written */
  STORAGE_ERROR,
  /** Not authorized to perform request */
  NOT_AUTHORIZED
}
