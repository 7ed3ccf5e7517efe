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

package com.google.nicknym.keymanager.client;

import com.google.nicknym.shared.api.util.HttpClientWrapper;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.time.Duration;
import javax.net.ssl.SSLContext;
import org.apache.http.ssl.SSLContexts;

/** Builds HTTP clients that trust only the certificates in a provider CA bundle. */
public class TrustedHttpClientFactory {

  private static final String CERTIFICATE_TYPE = "X.509";
  private static final Duration RETRY_INTERVAL = Duration.ofSeconds(1);

  /** Returns a client whose TLS trust store holds the PEM certificates in {@code caCertPath}. */
  public HttpClientWrapper create(Path caCertPath) throws IOException, GeneralSecurityException {
    return HttpClientWrapper.builder()
        .setSslContext(loadSslContext(caCertPath))
        .setInterval(RETRY_INTERVAL)
        .build();
  }

  static SSLContext loadSslContext(Path caCertPath) throws IOException, GeneralSecurityException {
    KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
    trustStore.load(null, null);
    CertificateFactory certificateFactory = CertificateFactory.getInstance(CERTIFICATE_TYPE);
    int count = 0;
    try (InputStream in = Files.newInputStream(caCertPath)) {
      for (Certificate certificate : certificateFactory.generateCertificates(in)) {
        trustStore.setCertificateEntry("provider-ca-" + count++, certificate);
      }
    }
    if (count == 0) {
      throw new CertificateException("No certificate found in " + caCertPath);
    }
    return SSLContexts.custom().loadTrustMaterial(trustStore, null).build();
  }
}
