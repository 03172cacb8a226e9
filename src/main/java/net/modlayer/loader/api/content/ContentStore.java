/*
 * Copyright 2016 FabricMC
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package net.modlayer.loader.api.content;

import net.modlayer.loader.api.document.DocumentNode;

/**
 * Keyed store of raw content documents, shared by everything that patches or consumes content.
 *
 * <p>Keys have the form {@code <contentType>/<relative path without .json>}, e.g. {@code Templates/npcs/guard}.
 * Only the mod loader writes to the store while mods are loading.
 */
public interface ContentStore {
	/**
	 * @return the document or null if there is none with this key
	 */
	DocumentNode getDocument(String key);

	boolean containsDocument(String key);

	/**
	 * Stores a new document.
	 *
	 * @throws IllegalArgumentException if a document with this key already exists
	 */
	void addDocument(String key, DocumentNode document);

	/**
	 * Stores a document, replacing any existing one with the same key.
	 */
	void replaceDocument(String key, DocumentNode document);

	/**
	 * Maps a patch target to the key of the document it addresses.
	 *
	 * <p>The default implementation only accepts exact keys.
	 *
	 * @return the document key or null if no document matches
	 */
	default String resolveTarget(String target) {
		return containsDocument(target) ? target : null;
	}
}
