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

package com.google.nicknym.keymanager.store.local;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.hash.Hashing;
import com.google.inject.BindingAnnotation;
import com.google.nicknym.keymanager.keys.KeyDocument;
import com.google.nicknym.keymanager.store.KeyStore;
import com.google.nicknym.shared.api.exception.ServiceException;
import com.google.nicknym.shared.mapper.TimeObjectMapper;
import java.io.IOException;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.PosixFileAttributeView;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Optional;
import javax.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * KeyStore keeping one JSON document per key in a directory. File names are derived from the
 * type, a hash of the address and the role, so lookups do not scan the directory.
 */
public final class FileSystemKeyStore implements KeyStore {

  private static final Logger logger = LoggerFactory.getLogger(FileSystemKeyStore.class);
  private static final String DOCUMENT_SUFFIX = ".json";
  private static final String OWNER_ONLY_PERMISSIONS = "rw-------";

  private final Path directory;
  private final ObjectMapper objectMapper = new TimeObjectMapper();

  @Inject
  public FileSystemKeyStore(@KeyStoreDirectory Path directory) {
    this.directory = directory;
  }

  @Override
  public synchronized Optional<KeyDocument> getKey(String type, String address, boolean isPrivate)
      throws ServiceException {
    Path path = documentPath(type, address, isPrivate);
    if (!Files.exists(path)) {
      return Optional.empty();
    }
    return Optional.of(readDocument(path));
  }

  @Override
  public synchronized void putKey(KeyDocument document) throws ServiceException {
    Path path = documentPath(document.type(), document.address(), document.isPrivate());
    Path temporary = path.resolveSibling(path.getFileName() + ".tmp");
    try {
      Files.createDirectories(directory);
      Files.deleteIfExists(temporary);
      if (document.isPrivate() && supportsPosixPermissions(directory)) {
        // Created owner-only, before any secret material is written to it.
        Files.createFile(
            temporary,
            PosixFilePermissions.asFileAttribute(
                PosixFilePermissions.fromString(OWNER_ONLY_PERMISSIONS)));
      }
      Files.write(temporary, objectMapper.writeValueAsBytes(document));
      Files.move(
          temporary, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    } catch (IOException e) {
      throw ServiceException.ofStorageException("Failed to write key document " + path, e);
    }
  }

  @Override
  public synchronized void deleteKey(String type, String address, boolean isPrivate)
      throws ServiceException {
    Path path = documentPath(type, address, isPrivate);
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      throw ServiceException.ofStorageException("Failed to delete key document " + path, e);
    }
  }

  @Override
  public synchronized ImmutableList<KeyDocument> getKeysByTag(String tag, boolean isPrivate)
      throws ServiceException {
    if (!Files.isDirectory(directory)) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<KeyDocument> documents = ImmutableList.builder();
    String roleSuffix = roleName(isPrivate) + DOCUMENT_SUFFIX;
    try (DirectoryStream<Path> paths = Files.newDirectoryStream(directory, "*" + roleSuffix)) {
      for (Path path : paths) {
        KeyDocument document = readDocument(path);
        if (document.isPrivate() == isPrivate && document.tags().contains(tag)) {
          documents.add(document);
        }
      }
    } catch (IOException e) {
      throw ServiceException.ofStorageException("Failed to list key documents in " + directory, e);
    }
    return documents.build();
  }

  private static boolean supportsPosixPermissions(Path path) throws IOException {
    return Files.getFileStore(path).supportsFileAttributeView(PosixFileAttributeView.class);
  }

  private KeyDocument readDocument(Path path) throws ServiceException {
    try {
      return objectMapper.readValue(Files.readAllBytes(path), KeyDocument.class);
    } catch (IOException e) {
      logger.error("Unreadable key document {}", path, e);
      throw ServiceException.ofStorageException("Failed to read key document " + path, e);
    }
  }

  private Path documentPath(String type, String address, boolean isPrivate) {
    String addressHash = Hashing.sha256().hashString(address, StandardCharsets.UTF_8).toString();
    return directory.resolve(
        String.format("%s-%s-%s%s", type, addressHash, roleName(isPrivate), DOCUMENT_SUFFIX));
  }

  private static String roleName(boolean isPrivate) {
    return isPrivate ? "private" : "public";
  }

  /** Directory holding the key documents. */
  @BindingAnnotation
  @Target({FIELD, PARAMETER, METHOD})
  @Retention(RUNTIME)
  public @interface KeyStoreDirectory {}
}
