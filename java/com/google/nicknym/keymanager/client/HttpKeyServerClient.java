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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.cache.RemovalNotification;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.net.HttpHeaders;
import com.google.common.net.MediaType;
import com.google.common.primitives.Ints;
import com.google.common.util.concurrent.UncheckedExecutionException;
import com.google.nicknym.shared.api.exception.ServiceException;
import com.google.nicknym.shared.api.util.ErrorUtil;
import com.google.nicknym.shared.api.util.HttpClientResponse;
import com.google.nicknym.shared.api.util.HttpClientWrapper;
import com.google.nicknym.shared.mapper.TimeObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import javax.inject.Inject;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.entity.UrlEncodedFormEntity;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.client.methods.HttpPut;
import org.apache.http.client.methods.HttpRequestBase;
import org.apache.http.client.utils.URIBuilder;
import org.apache.http.message.BasicNameValuePair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * KeyServerClient talking HTTPS to the nickserver and the provider API. One client is kept per CA
 * certificate path.
 */
public final class HttpKeyServerClient implements KeyServerClient {

  private static final Logger logger = LoggerFactory.getLogger(HttpKeyServerClient.class);

  private static final int REQUEST_TIMEOUT_MILLIS =
      Ints.checkedCast(Duration.ofMinutes(1).toMillis());
  static final String ADDRESS_PARAMETER = "address";
  static final String PUBLIC_KEY_FIELD = "user[public_key]";
  static final String SESSION_COOKIE = "_session_id";
  private static final int MAX_CACHED_CLIENTS = 16;

  private final LoadingCache<Path, HttpClientWrapper> httpClients;
  private final ObjectMapper objectMapper = new TimeObjectMapper();

  @Inject
  public HttpKeyServerClient(TrustedHttpClientFactory httpClientFactory) {
    this.httpClients =
        CacheBuilder.newBuilder()
            .maximumSize(MAX_CACHED_CLIENTS)
            .<Path, HttpClientWrapper>removalListener(HttpKeyServerClient::closeClient)
            .build(
                new CacheLoader<Path, HttpClientWrapper>() {
                  @Override
                  public HttpClientWrapper load(Path caCertPath) throws Exception {
                    logger.info("Creating HTTP client trusting {}", caCertPath);
                    return httpClientFactory.create(caCertPath);
                  }
                });
  }

  @Override
  public ImmutableMap<String, String> lookupKeys(URI nicknymUri, String address, Path caCertPath)
      throws KeyServerClientException {
    HttpGet request;
    try {
      request =
          new HttpGet(new URIBuilder(nicknymUri).addParameter(ADDRESS_PARAMETER, address).build());
    } catch (URISyntaxException e) {
      throw new KeyServerClientException("Invalid nickserver URI " + nicknymUri, e);
    }
    request.setHeader(HttpHeaders.ACCEPT, MediaType.JSON_UTF_8.withoutParameters().toString());
    HttpClientResponse response = execute(request, caCertPath);

    String contentType = response.header(HttpHeaders.CONTENT_TYPE).orElse("");
    if (!contentType.startsWith(MediaType.JSON_UTF_8.withoutParameters().toString())) {
      throw invalidResponse(
          String.format(
              "Nickserver answered with content type '%s' for %s", contentType, address));
    }
    return parseKeys(response.responseBody(), address);
  }

  @Override
  public void putPublicKey(URI userUri, String publicKeyData, String sessionId, Path caCertPath)
      throws KeyServerClientException {
    HttpPut request = new HttpPut(userUri);
    request.setEntity(
        new UrlEncodedFormEntity(
            ImmutableList.of(new BasicNameValuePair(PUBLIC_KEY_FIELD, publicKeyData)),
            StandardCharsets.UTF_8));
    request.setHeader(HttpHeaders.COOKIE, SESSION_COOKIE + "=" + sessionId);
    execute(request, caCertPath);
    logger.info("Uploaded public key to {}", userUri);
  }

  private static void closeClient(RemovalNotification<Path, HttpClientWrapper> notification) {
    try {
      notification.getValue().close();
    } catch (IOException e) {
      logger.warn("Failed to close HTTP client for {}", notification.getKey(), e);
    }
  }

  private HttpClientResponse execute(HttpRequestBase request, Path caCertPath)
      throws KeyServerClientException {
    request.setConfig(
        RequestConfig.custom()
            .setConnectTimeout(REQUEST_TIMEOUT_MILLIS)
            .setConnectionRequestTimeout(REQUEST_TIMEOUT_MILLIS)
            .setSocketTimeout(REQUEST_TIMEOUT_MILLIS)
            .build());
    HttpClientResponse response;
    try {
      response = httpClient(caCertPath).execute(request);
    } catch (IOException e) {
      logger.error("{} {} failed", request.getMethod(), request.getURI(), e);
      throw new KeyServerClientException(
          String.format("%s %s failed", request.getMethod(), request.getURI()), e);
    }
    if (!response.isSuccessful()) {
      ServiceException cause = ErrorUtil.toServiceException(response);
      logger.error(
          "{} {} returned {}", request.getMethod(), request.getURI(), response.statusCode());
      throw new KeyServerClientException(
          String.format(
              "%s %s returned HTTP status %d",
              request.getMethod(), request.getURI(), response.statusCode()),
          cause);
    }
    return response;
  }

  private HttpClientWrapper httpClient(Path caCertPath) throws KeyServerClientException {
    try {
      return httpClients.get(caCertPath);
    } catch (ExecutionException | UncheckedExecutionException e) {
      throw new KeyServerClientException(
          "Failed to set up TLS trusting " + caCertPath, e.getCause());
    }
  }

  private ImmutableMap<String, String> parseKeys(String body, String address)
      throws KeyServerClientException {
    JsonNode root;
    try {
      root = objectMapper.readTree(body);
    } catch (JsonProcessingException e) {
      throw new KeyServerClientException(
          "Malformed nickserver response for " + address,
          ErrorUtil.toInvalidResponseException(e.getMessage()));
    }
    if (root == null || !root.isObject()) {
      throw invalidResponse("Nickserver response for " + address + " is not a JSON object");
    }
    ImmutableMap.Builder<String, String> keys = ImmutableMap.builder();
    Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      if (field.getValue().isTextual()) {
        keys.put(field.getKey(), field.getValue().textValue());
      } else {
        logger.debug("Skipping non-text entry '{}' for {}", field.getKey(), address);
      }
    }
    return keys.build();
  }

  private static KeyServerClientException invalidResponse(String message) {
    logger.error(message);
    return new KeyServerClientException(message, ErrorUtil.toInvalidResponseException(message));
  }
}
