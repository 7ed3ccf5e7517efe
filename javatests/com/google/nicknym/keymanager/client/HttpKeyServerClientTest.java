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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.google.common.collect.ImmutableMap;
import com.google.nicknym.keymanager.client.KeyServerClient.KeyServerClientException;
import com.google.nicknym.shared.api.exception.ServiceException;
import com.google.nicknym.shared.api.exception.SharedErrorReason;
import com.google.nicknym.shared.api.model.Code;
import com.google.nicknym.shared.api.util.HttpClientResponse;
import com.google.nicknym.shared.api.util.HttpClientWrapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.cert.CertificateException;
import org.apache.http.client.methods.HttpEntityEnclosingRequestBase;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.util.EntityUtils;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;

@RunWith(JUnit4.class)
public final class HttpKeyServerClientTest {

  private static final URI NICKNYM_URI = URI.create("https://nicknym.example.org:6425/");
  private static final URI USER_URI = URI.create("https://api.example.org:4430/1/users/42.json");
  private static final Path CA_CERT_PATH = Paths.get("/etc/provider/cacert.pem");
  private static final ImmutableMap<String, String> JSON_HEADERS =
      ImmutableMap.of("Content-Type", "application/json; charset=utf-8");

  @Rule public final MockitoRule mockito = MockitoJUnit.rule();

  @Mock private TrustedHttpClientFactory httpClientFactory;
  @Mock private HttpClientWrapper httpClient;

  private HttpKeyServerClient client;

  @Before
  public void setUp() throws Exception {
    when(httpClientFactory.create(CA_CERT_PATH)).thenReturn(httpClient);
    client = new HttpKeyServerClient(httpClientFactory);
  }

  @Test
  public void lookupKeys_success() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(
            HttpClientResponse.create(
                200, "{\"address\":\"bob@example.org\",\"openpgp\":\"KEY\"}", JSON_HEADERS));
    var argument = ArgumentCaptor.forClass(HttpRequestBase.class);

    ImmutableMap<String, String> keys =
        client.lookupKeys(NICKNYM_URI, "bob@example.org", CA_CERT_PATH);

    assertThat(keys).containsExactly("address", "bob@example.org", "openpgp", "KEY");
    verify(httpClient).execute(argument.capture());
    assertThat(argument.getValue().getMethod()).isEqualTo("GET");
    assertThat(argument.getValue().getURI())
        .isEqualTo(URI.create("https://nicknym.example.org:6425/?address=bob%40example.org"));
  }

  @Test
  public void lookupKeys_skipsNonTextEntries() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(
            HttpClientResponse.create(
                200, "{\"openpgp\":\"KEY\",\"expires\":123,\"other\":{}}", JSON_HEADERS));

    assertThat(client.lookupKeys(NICKNYM_URI, "bob@example.org", CA_CERT_PATH))
        .containsExactly("openpgp", "KEY");
  }

  @Test
  public void lookupKeys_notFound_carriesStatus() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(HttpClientResponse.create(404, "Not found", ImmutableMap.of()));

    KeyServerClientException exception =
        assertThrows(
            KeyServerClientException.class,
            () -> client.lookupKeys(NICKNYM_URI, "nobody@example.org", CA_CERT_PATH));

    assertThat(exception).hasCauseThat().isInstanceOf(ServiceException.class);
    assertThat(((ServiceException) exception.getCause()).getErrorCode())
        .isEqualTo(Code.NOT_FOUND);
  }

  @Test
  public void lookupKeys_wrongContentType_fails() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(
            HttpClientResponse.create(
                200, "<html></html>", ImmutableMap.of("Content-Type", "text/html")));

    KeyServerClientException exception =
        assertThrows(
            KeyServerClientException.class,
            () -> client.lookupKeys(NICKNYM_URI, "bob@example.org", CA_CERT_PATH));

    assertThat(((ServiceException) exception.getCause()).getErrorReason())
        .isEqualTo(SharedErrorReason.INVALID_RESPONSE.name());
  }

  @Test
  public void lookupKeys_malformedJson_fails() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(HttpClientResponse.create(200, "{\"openpgp\":", JSON_HEADERS));

    assertThrows(
        KeyServerClientException.class,
        () -> client.lookupKeys(NICKNYM_URI, "bob@example.org", CA_CERT_PATH));
  }

  @Test
  public void lookupKeys_notAnObject_fails() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(HttpClientResponse.create(200, "[\"openpgp\"]", JSON_HEADERS));

    assertThrows(
        KeyServerClientException.class,
        () -> client.lookupKeys(NICKNYM_URI, "bob@example.org", CA_CERT_PATH));
  }

  @Test
  public void lookupKeys_ioFailure_fails() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class))).thenThrow(new IOException("reset"));

    KeyServerClientException exception =
        assertThrows(
            KeyServerClientException.class,
            () -> client.lookupKeys(NICKNYM_URI, "bob@example.org", CA_CERT_PATH));

    assertThat(exception).hasCauseThat().isInstanceOf(IOException.class);
  }

  @Test
  public void lookupKeys_untrustedCaFile_fails() throws Exception {
    Path badPath = Paths.get("/tmp/not-a-cert.pem");
    when(httpClientFactory.create(badPath)).thenThrow(new CertificateException("bad"));

    KeyServerClientException exception =
        assertThrows(
            KeyServerClientException.class,
            () -> client.lookupKeys(NICKNYM_URI, "bob@example.org", badPath));

    assertThat(exception).hasCauseThat().isInstanceOf(CertificateException.class);
  }

  @Test
  public void httpClient_cachedPerCaPath() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(HttpClientResponse.create(200, "{}", JSON_HEADERS));

    client.lookupKeys(NICKNYM_URI, "a@example.org", CA_CERT_PATH);
    client.lookupKeys(NICKNYM_URI, "b@example.org", CA_CERT_PATH);

    verify(httpClientFactory, times(1)).create(CA_CERT_PATH);
  }

  @Test
  public void putPublicKey_sendsFormWithSessionCookie() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(HttpClientResponse.create(204, "", ImmutableMap.of()));
    var argument = ArgumentCaptor.forClass(HttpRequestBase.class);

    client.putPublicKey(USER_URI, "-----BEGIN PGP PUBLIC KEY BLOCK-----", "s3ss10n", CA_CERT_PATH);

    verify(httpClient).execute(argument.capture());
    HttpRequestBase request = argument.getValue();
    assertThat(request.getMethod()).isEqualTo("PUT");
    assertThat(request.getURI()).isEqualTo(USER_URI);
    assertThat(request.getFirstHeader("Cookie").getValue()).isEqualTo("_session_id=s3ss10n");
    String body = EntityUtils.toString(((HttpEntityEnclosingRequestBase) request).getEntity());
    assertThat(URLDecoder.decode(body, StandardCharsets.UTF_8))
        .isEqualTo("user[public_key]=-----BEGIN PGP PUBLIC KEY BLOCK-----");
  }

  @Test
  public void putPublicKey_unauthorized_fails() throws Exception {
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(HttpClientResponse.create(401, "", ImmutableMap.of()));

    KeyServerClientException exception =
        assertThrows(
            KeyServerClientException.class,
            () -> client.putPublicKey(USER_URI, "KEY", "expired", CA_CERT_PATH));

    assertThat(((ServiceException) exception.getCause()).getErrorReason())
        .isEqualTo(SharedErrorReason.NOT_AUTHORIZED.name());
  }

  @Test
  public void evictedClients_areClosed() throws Exception {
    when(httpClientFactory.create(any(Path.class))).thenReturn(httpClient);
    when(httpClient.execute(any(HttpRequestBase.class)))
        .thenReturn(HttpClientResponse.create(204, "", ImmutableMap.of()));

    for (int i = 0; i < 32; i++) {
      client.putPublicKey(USER_URI, "KEY", "s3ss10n", Paths.get("/etc/provider/ca-" + i + ".pem"));
    }

    verify(httpClient, atLeastOnce()).close();
  }
}
