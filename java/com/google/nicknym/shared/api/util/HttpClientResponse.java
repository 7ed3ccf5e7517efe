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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableMap;
import java.util.Map;
import java.util.Optional;

/** Status, body and headers of a completed HTTP exchange, read fully into memory. */
@AutoValue
public abstract class HttpClientResponse {

  public static HttpClientResponse create(
      int statusCode, String responseBody, Map<String, String> headers) {
    return new AutoValue_HttpClientResponse(
        statusCode, responseBody, ImmutableMap.copyOf(headers));
  }

  public abstract int statusCode();

  public abstract String responseBody();

  public abstract ImmutableMap<String, String> headers();

  /** Returns the value of the named header, matching the name case-insensitively. */
  public Optional<String> header(String name) {
    return headers().entrySet().stream()
        .filter(entry -> entry.getKey().equalsIgnoreCase(name))
        .map(Map.Entry::getValue)
        .findFirst();
  }

  /** Returns whether the status code is in the 2xx range. */
  public boolean isSuccessful() {
    return statusCode() >= 200 && statusCode() < 300;
  }
}
