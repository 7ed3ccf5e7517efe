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

package com.google.nicknym.shared.api.model;

/**
 * Enum representation of google.rpc.Code, used to classify failures reported by the nickserver and
 * the provider API.
 */
public enum Code {
  /** Not an error, returned on success. HTTP Mapping: 200 OK */
  OK(0, 200),

  /** The operation was cancelled, typically by the caller. HTTP Mapping: 499 */
  CANCELLED(1, 499),

  /** Unknown error, or an error response that carries no usable status. HTTP Mapping: 500 */
  UNKNOWN(2, 500),

  /** The client specified an invalid argument. HTTP Mapping: 400 Bad Request */
  INVALID_ARGUMENT(3, 400),

  /** The deadline expired before the operation could complete. HTTP Mapping: 504 */
  DEADLINE_EXCEEDED(4, 504),

  /** Some requested entity (e.g. a key for an address) was not found. HTTP Mapping: 404 */
  NOT_FOUND(5, 404),

  /** The caller does not have permission to execute the operation. HTTP Mapping: 403 */
  PERMISSION_DENIED(7, 403),

  /** The request does not have valid authentication credentials. HTTP Mapping: 401 */
  UNAUTHENTICATED(16, 401),

  /** Some resource has been exhausted, e.g. a per-user quota. HTTP Mapping: 429 */
  RESOURCE_EXHAUSTED(8, 429),

  /**
   * The system is not in a state required for the operation, e.g. a response arrived with an
   * unexpected content type. HTTP Mapping: 400 Bad Request
   */
  FAILED_PRECONDITION(9, 400),

  /** Internal errors. Some invariant expected by the underlying system was broken. */
  INTERNAL(13, 500),

  /** The service is currently unavailable. HTTP Mapping: 503 Service Unavailable */
  UNAVAILABLE(14, 503),

  /** Unrecoverable data loss or corruption, e.g. an unreadable stored key document. */
  DATA_LOSS(15, 500);

  private final int rpcStatusCode;
  private final int httpStatusCode;

  Code(int rpcStatusCode, int httpStatusCode) {
    this.rpcStatusCode = rpcStatusCode;
    this.httpStatusCode = httpStatusCode;
  }

  /**
   * Maps an HTTP status to the closest code. Statuses shared by several codes resolve to the first
   * declared one; unmapped statuses resolve to {@link #UNKNOWN}.
   */
  public static Code fromHttpStatusCode(int httpStatusCode) {
    if (httpStatusCode == 500) {
      return INTERNAL;
    }
    for (Code code : Code.values()) {
      if (code.getHttpStatusCode() == httpStatusCode) {
        return code;
      }
    }
    return UNKNOWN;
  }

  public int getRpcStatusCode() {
    return rpcStatusCode;
  }

  public int getHttpStatusCode() {
    return httpStatusCode;
  }
}
