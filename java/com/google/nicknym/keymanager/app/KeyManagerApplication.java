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

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.google.common.collect.ImmutableList;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.nicknym.keymanager.KeyManager;
import com.google.nicknym.keymanager.KeyManagerException;
import com.google.nicknym.keymanager.keys.EncryptionKey;
import com.google.nicknym.keymanager.keys.KeyType;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Command line front end of the key manager. */
public final class KeyManagerApplication {

  private static final Logger logger = LoggerFactory.getLogger(KeyManagerApplication.class);

  static final int EXIT_OK = 0;
  static final int EXIT_FAILURE = 1;
  static final int EXIT_USAGE = 2;

  /** Parses input arguments and runs the requested command. */
  public static void main(String[] args) {
    KeyManagerArgs params = new KeyManagerArgs();
    JCommander commander = JCommander.newBuilder().addObject(params).build();
    commander.setProgramName("keymanager");
    try {
      commander.parse(args);
    } catch (ParameterException e) {
      System.err.println(e.getMessage());
      commander.usage();
      System.exit(EXIT_USAGE);
    }
    if (params.isHelp()) {
      commander.usage();
      return;
    }

    Injector injector = Guice.createInjector(new KeyManagerAppModule(params));
    KeyManager keyManager = injector.getInstance(KeyManager.class);
    System.exit(run(keyManager, params, System.out));
  }

  /** Runs the command in {@code args} and returns the process exit code. */
  static int run(KeyManager keyManager, KeyManagerArgs args, PrintStream out) {
    ImmutableList<String> command = args.getCommand();
    if (command.isEmpty()) {
      out.println("No command given");
      return EXIT_USAGE;
    }
    try {
      switch (command.get(0)) {
        case "get-key":
          if (command.size() != 2) {
            out.println("Usage: get-key <address>");
            return EXIT_USAGE;
          }
          EncryptionKey key =
              keyManager.getKey(
                  command.get(1), KeyType.OPENPGP, args.isPrivate(), args.fetchRemote());
          out.println(key.keyData());
          return EXIT_OK;
        case "list":
          for (EncryptionKey localKey : keyManager.getAllKeysInLocalDb(args.isPrivate())) {
            out.printf(
                "%s %s %s %s%n",
                localKey.keyType().tag(),
                localKey.keyId(),
                localKey.address(),
                localKey.isPrivate() ? "private" : "public");
          }
          return EXIT_OK;
        case "refresh":
          keyManager.refreshKeys();
          return EXIT_OK;
        case "gen-key":
          out.println(keyManager.genKey(KeyType.OPENPGP).fingerprint());
          return EXIT_OK;
        case "send-key":
          keyManager.sendKey(KeyType.OPENPGP);
          return EXIT_OK;
        default:
          out.println("Unknown command: " + command.get(0));
          return EXIT_USAGE;
      }
    } catch (KeyManagerException e) {
      logger.error("{} failed", command.get(0), e);
      out.println(e.getReason() + ": " + e.getMessage());
      return EXIT_FAILURE;
    }
  }
}
