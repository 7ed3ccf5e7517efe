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

package com.google.nicknym.keymanager.client.testing;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.nicknym.keymanager.client.KeyServerClient;
import java.net.URI;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** KeyServerClient serving a fixed directory and recording every call. */
public final class FakeKeyServerClient implements KeyServerClient {

  private final Map<String, ImmutableMap<String, String>> directory = new HashMap<>();
  private final Set<String> failingAddresses = new HashSet<>();
  private final List<String> lookups = new ArrayList<>();
  private final List<PutRequest> puts = new ArrayList<>();
  private boolean failPuts = false;

  /** Serves {@code keys} (type tag to key data) for {@code address}. */
  public synchronized void setKeys(String address, ImmutableMap<String, String> keys) {
    directory.put(address, keys);
  }

  /** Makes lookups of {@code address} fail. */
  public synchronized void failLookupsFor(String address) {
    failingAddresses.add(address);
  }

  public synchronized void setFailPuts(boolean failPuts) {
    this.failPuts = failPuts;
  }

  /** Addresses looked up so far, in call order. */
  public synchronized ImmutableList<String> lookups() {
    return ImmutableList.copyOf(lookups);
  }

  public synchronized ImmutableList<PutRequest> puts() {
    return ImmutableList.copyOf(puts);
  }

  @Override
  public synchronized ImmutableMap<String, String> lookupKeys(
      URI nicknymUri, String address, Path caCertPath) throws KeyServerClientException {
    lookups.add(address);
    if (failingAddresses.contains(address)) {
      throw new KeyServerClientException("Lookup of " + address + " failed");
    }
    return directory.getOrDefault(address, ImmutableMap.of());
  }

  @Override
  public synchronized void putPublicKey(
      URI userUri, String publicKeyData, String sessionId, Path caCertPath)
      throws KeyServerClientException {
    puts.add(new PutRequest(userUri, publicKeyData, sessionId));
    if (failPuts) {
      throw new KeyServerClientException("Upload to " + userUri + " failed");
    }
  }

  /** A recorded key upload. */
  public static final class PutRequest {
    public final URI userUri;
    public final String publicKeyData;
    public final String sessionId;

    PutRequest(URI userUri, String publicKeyData, String sessionId) {
      this.userUri = userUri;
      this.publicKeyData = publicKeyData;
      this.sessionId = sessionId;
    }
  }
}
