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

package com.google.nicknym.keymanager.app;

import com.beust.jcommander.Parameter;
import com.google.common.collect.ImmutableList;
import com.google.nicknym.keymanager.KeyManagerConfig;
import com.google.nicknym.keymanager.openpgp.OpenPgpScheme;
import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/** Command line arguments of {@link KeyManagerApplication}. */
public final class KeyManagerArgs {

  @Parameter(
      description =
          "Command to run: get-key <address>, list, refresh, gen-key or send-key.")
  private List<String> command = new ArrayList<>();

  @Parameter(names = "--address", description = "The user's own address.", required = true)
  private String address = "";

  @Parameter(
      names = "--nicknym-uri",
      description = "Nickserver directory endpoint, e.g. https://nicknym.example.org:6425/.",
      required = true)
  private String nicknymUri = "";

  @Parameter(names = "--store-dir", description = "Directory holding the local key store.")
  private String storeDir = System.getProperty("user.home") + "/.nicknym/keys";

  @Parameter(
      names = "--ca-cert-path",
      description = "PEM file with the provider CA certificate. Empty value is ignored.")
  private String caCertPath = "";

  @Parameter(
      names = "--session-id",
      description = "Provider session id, needed to publish keys. Empty value is ignored.")
  private String sessionId = "";

  @Parameter(names = "--api-uri", description = "Provider API base URI. Empty value is ignored.")
  private String apiUri = "";

  @Parameter(names = "--api-version", description = "Provider API version, e.g. 1.")
  private String apiVersion = "";

  @Parameter(names = "--uid", description = "The user's id at the provider.")
  private String uid = "";

  @Parameter(
      names = "--openpgp-key-strength",
      description = "RSA modulus size in bits of generated OpenPGP keys.")
  private int openPgpKeyStrength = OpenPgpScheme.DEFAULT_KEY_STRENGTH;

  @Parameter(names = "--private", description = "Operate on private keys (get-key, list).")
  private boolean isPrivate = false;

  @Parameter(
      names = "--no-fetch-remote",
      description = "Do not ask the nickserver when a key is missing locally (get-key).")
  private boolean noFetchRemote = false;

  @Parameter(names = "--help", help = true, description = "Print usage.")
  private boolean help = false;

  public ImmutableList<String> getCommand() {
    return ImmutableList.copyOf(command);
  }

  public Path getStoreDir() {
    return Paths.get(storeDir);
  }

  public int getOpenPgpKeyStrength() {
    return openPgpKeyStrength;
  }

  public boolean isPrivate() {
    return isPrivate;
  }

  public boolean fetchRemote() {
    return !noFetchRemote;
  }

  public boolean isHelp() {
    return help;
  }

  /** Builds the key manager configuration; empty optional flags are left unset. */
  public KeyManagerConfig toConfig() {
    KeyManagerConfig.Builder builder =
        KeyManagerConfig.builder().setAddress(address).setNicknymUri(URI.create(nicknymUri));
    if (!caCertPath.isEmpty()) {
      builder.setCaCertPath(Paths.get(caCertPath));
    }
    if (!sessionId.isEmpty()) {
      builder.setSessionId(sessionId);
    }
    if (!apiUri.isEmpty()) {
      builder.setApiUri(URI.create(apiUri));
    }
    if (!apiVersion.isEmpty()) {
      builder.setApiVersion(apiVersion);
    }
    if (!uid.isEmpty()) {
      builder.setUid(uid);
    }
    return builder.build();
  }
}
