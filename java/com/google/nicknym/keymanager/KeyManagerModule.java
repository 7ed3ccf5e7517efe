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

import com.google.inject.AbstractModule;
import com.google.inject.Singleton;
import com.google.inject.multibindings.MapBinder;
import com.google.nicknym.keymanager.client.HttpKeyServerClient;
import com.google.nicknym.keymanager.client.KeyServerClient;
import com.google.nicknym.keymanager.keys.EncryptionScheme;
import com.google.nicknym.keymanager.keys.KeyType;
import com.google.nicknym.keymanager.openpgp.OpenPgpScheme;
import com.google.nicknym.keymanager.store.KeyStore;

/**
 * Module for the key manager. Subclasses choose the local store and provide the configuration;
 * the registered schemes are bound here.
 */
public abstract class KeyManagerModule extends AbstractModule {

  /** Returns the {@code KeyStore} implementation class to bind. */
  public abstract Class<? extends KeyStore> getKeyStoreImplementation();

  /** Returns the {@code KeyServerClient} implementation class to bind. */
  public Class<? extends KeyServerClient> getKeyServerClientImplementation() {
    return HttpKeyServerClient.class;
  }

  /**
   * Arbitrary configurations that can be done by the implementing class to support dependencies
   * that are specific to that implementation, such as the {@link KeyManagerConfig}.
   */
  public void configureModule() {}

  @Override
  protected final void configure() {
    bind(KeyStore.class).to(getKeyStoreImplementation()).in(Singleton.class);
    bind(KeyServerClient.class).to(getKeyServerClientImplementation()).in(Singleton.class);
    bind(KeyManager.class).in(Singleton.class);

    MapBinder<KeyType, EncryptionScheme> schemes =
        MapBinder.newMapBinder(binder(), KeyType.class, EncryptionScheme.class);
    schemes.addBinding(KeyType.OPENPGP).to(OpenPgpScheme.class).in(Singleton.class);

    configureModule();
  }
}
