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

import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.google.nicknym.keymanager.KeyManagerConfig;
import com.google.nicknym.keymanager.KeyManagerModule;
import com.google.nicknym.keymanager.openpgp.OpenPgpScheme.OpenPgpKeyStrength;
import com.google.nicknym.keymanager.store.KeyStore;
import com.google.nicknym.keymanager.store.local.FileSystemKeyStore;
import com.google.nicknym.keymanager.store.local.FileSystemKeyStore.KeyStoreDirectory;
import java.nio.file.Path;

/** Binds the command line configuration, with keys kept on the local file system. */
public final class KeyManagerAppModule extends KeyManagerModule {

  private final KeyManagerArgs args;

  public KeyManagerAppModule(KeyManagerArgs args) {
    this.args = args;
  }

  @Override
  public Class<? extends KeyStore> getKeyStoreImplementation() {
    return FileSystemKeyStore.class;
  }

  @Override
  public void configureModule() {
    bind(Path.class).annotatedWith(KeyStoreDirectory.class).toInstance(args.getStoreDir());
    bind(Integer.class)
        .annotatedWith(OpenPgpKeyStrength.class)
        .toInstance(args.getOpenPgpKeyStrength());
  }

  @Provides
  @Singleton
  KeyManagerConfig provideKeyManagerConfig() {
    return args.toConfig();
  }
}
