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

import static com.google.common.truth.Truth.assertThat;

import com.google.acai.Acai;
import com.google.inject.AbstractModule;
import com.google.inject.Inject;
import com.google.inject.Injector;
import com.google.nicknym.keymanager.client.KeyServerClient;
import com.google.nicknym.keymanager.client.testing.FakeKeyServerClient;
import com.google.nicknym.keymanager.keys.EncryptionKey;
import com.google.nicknym.keymanager.keys.KeyType;
import com.google.nicknym.keymanager.keys.SchemeRegistry;
import com.google.nicknym.keymanager.openpgp.OpenPgpScheme;
import com.google.nicknym.keymanager.openpgp.OpenPgpScheme.OpenPgpKeyStrength;
import com.google.nicknym.keymanager.store.KeyStore;
import com.google.nicknym.keymanager.store.testing.InMemoryKeyStore;
import java.net.URI;
import java.nio.file.Paths;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

@RunWith(JUnit4.class)
public final class KeyManagerModuleTest {

  private static final String ALICE = "alice@example.org";

  @Rule public final Acai acai = new Acai(TestEnv.class);

  @Inject Injector injector;
  @Inject SchemeRegistry schemeRegistry;
  @Inject KeyStore keyStore;
  @Inject KeyServerClient keyServerClient;

  // Under test
  @Inject KeyManager keyManager;

  @Test
  public void bindings_areSingletons() {
    assertThat(injector.getInstance(KeyManager.class)).isSameInstanceAs(keyManager);
    assertThat(injector.getInstance(KeyStore.class)).isSameInstanceAs(keyStore);
    assertThat(keyStore).isInstanceOf(InMemoryKeyStore.class);
    assertThat(keyServerClient).isInstanceOf(FakeKeyServerClient.class);
  }

  @Test
  public void schemeRegistry_hasOpenPgp() throws Exception {
    assertThat(schemeRegistry.keyTypes()).containsExactly(KeyType.OPENPGP);
    assertThat(schemeRegistry.schemeFor(KeyType.OPENPGP)).isInstanceOf(OpenPgpScheme.class);
    assertThat(schemeRegistry.schemeFor(KeyType.OPENPGP))
        .isSameInstanceAs(injector.getInstance(SchemeRegistry.class).schemeFor(KeyType.OPENPGP));
  }

  @Test
  public void genKey_storesInBoundKeyStore() throws Exception {
    EncryptionKey privateKey = keyManager.genKey(KeyType.OPENPGP);

    assertThat(privateKey.address()).isEqualTo(ALICE);
    assertThat(privateKey.length()).isEqualTo(1024);
    assertThat(keyStore.getKey(KeyType.OPENPGP.tag(), ALICE, true)).isPresent();
    assertThat(keyStore.getKey(KeyType.OPENPGP.tag(), ALICE, false)).isPresent();
  }

  public static final class TestEnv extends AbstractModule {

    @Override
    protected void configure() {
      install(
          new KeyManagerModule() {
            @Override
            public Class<? extends KeyStore> getKeyStoreImplementation() {
              return InMemoryKeyStore.class;
            }

            @Override
            public Class<? extends KeyServerClient> getKeyServerClientImplementation() {
              return FakeKeyServerClient.class;
            }

            @Override
            public void configureModule() {
              bind(Integer.class).annotatedWith(OpenPgpKeyStrength.class).toInstance(1024);
              bind(KeyManagerConfig.class)
                  .toInstance(
                      KeyManagerConfig.builder()
                          .setAddress(ALICE)
                          .setNicknymUri(URI.create("https://nicknym.example.org:6425/"))
                          .setCaCertPath(Paths.get("/etc/provider/cacert.pem"))
                          .build());
            }
          });
    }
  }
}
