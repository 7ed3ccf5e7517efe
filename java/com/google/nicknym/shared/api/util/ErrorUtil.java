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

package com.google.nicknym.shared.api.util;

import com.google.nicknym.shared.api.exception.ServiceException;
import com.google.nicknym.shared.api.exception.SharedErrorReason;
import com.google.nicknym.shared.api.model.Code;

/** Defines helper methods related to errors and exceptions */
public final class ErrorUtil {

  private static final int MAX_MESSAGE_BODY_LENGTH = 256;

  private ErrorUtil() {}

  /**
   * Builds a ServiceException from a non-2xx response, providing an exception that can be thrown
   * (or wrapped) when a service client encounters an error. The nickserver and the provider API do
   * not return structured error bodies, so the status code is the only reliable signal.
   */
  public static ServiceException toServiceException(HttpClientResponse response) {
    var code = Code.fromHttpStatusCode(response.statusCode());
    var reason =
        code == Code.UNAUTHENTICATED || code == Code.PERMISSION_DENIED
            ? SharedErrorReason.NOT_AUTHORIZED
            : SharedErrorReason.SERVER_ERROR;
    var message =
        String.format(
            "Received HTTP status %d: %s",
            response.statusCode(), truncate(response.responseBody()));
    return new ServiceException(code, reason.toString(), message);
  }

  /** Builds a ServiceException for a 2xx response whose body does not match the protocol. */
  public static ServiceException toInvalidResponseException(String message) {
    return new ServiceException(
        Code.FAILED_PRECONDITION, SharedErrorReason.INVALID_RESPONSE.toString(), message);
  }

  private static String truncate(String body) {
    if (body.length() <= MAX_MESSAGE_BODY_LENGTH) {
      return body;
    }
    return body.substring(0, MAX_MESSAGE_BODY_LENGTH) + "...";
  }
}
