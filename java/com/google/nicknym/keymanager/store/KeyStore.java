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

package com.google.nicknym.keymanager.store;

import com.google.common.collect.ImmutableList;
import com.google.nicknym.keymanager.keys.KeyDocument;
import com.google.nicknym.shared.api.exception.ServiceException;
import java.util.Optional;

/**
 * Local key cache. Documents are keyed by (type, address, private) and indexed by (tag, private).
 */
public interface KeyStore {

  /** Returns the document stored for the given type, address and role, if any. */
  Optional<KeyDocument> getKey(String type, String address, boolean isPrivate)
      throws ServiceException;

  /** Stores the document, replacing any with the same type, address and role. */
  void putKey(KeyDocument document) throws ServiceException;

  /** Removes the document for the given type, address and role. Missing documents are ignored. */
  void deleteKey(String type, String address, boolean isPrivate) throws ServiceException;

  /** Returns every document carrying {@code tag} with the given role. */
  ImmutableList<KeyDocument> getKeysByTag(String tag, boolean isPrivate) throws ServiceException;
}
