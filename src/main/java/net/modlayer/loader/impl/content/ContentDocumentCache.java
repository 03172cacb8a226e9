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

package net.modlayer.loader.impl.content;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import net.modlayer.loader.api.content.ContentStore;
import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.api.document.DocumentNode.ScalarNode;

/**
 * In-memory {@link ContentStore}.
 *
 * <p>Besides exact keys, patch targets may name the value of a top level id field of a document (by default
 * {@value #DEFAULT_ID_FIELD}). The first document in insertion order carrying that id wins.
 */
public final class ContentDocumentCache implements ContentStore {
	public static final String DEFAULT_ID_FIELD = "templateId";

	private final Map<String, DocumentNode> documents = new LinkedHashMap<>();
	private final String idField;

	public ContentDocumentCache() {
		this(DEFAULT_ID_FIELD);
	}

	/**
	 * @param idField top level string field to match patch targets against, null to only match keys
	 */
	public ContentDocumentCache(/* @Nullable */ String idField) {
		this.idField = idField;
	}

	@Override
	public DocumentNode getDocument(String key) {
		return documents.get(key);
	}

	@Override
	public boolean containsDocument(String key) {
		return documents.containsKey(key);
	}

	@Override
	public void addDocument(String key, DocumentNode document) {
		Objects.requireNonNull(document, "null document");

		if (documents.putIfAbsent(key, document) != null) {
			throw new IllegalArgumentException("duplicate content document "+key);
		}
	}

	@Override
	public void replaceDocument(String key, DocumentNode document) {
		documents.put(key, Objects.requireNonNull(document, "null document"));
	}

	public DocumentNode removeDocument(String key) {
		return documents.remove(key);
	}

	public Set<String> getKeys() {
		return Collections.unmodifiableSet(documents.keySet());
	}

	public int size() {
		return documents.size();
	}

	@Override
	public String resolveTarget(String target) {
		if (documents.containsKey(target)) return target;
		if (idField == null) return null;

		for (Map.Entry<String, DocumentNode> entry : documents.entrySet()) {
			DocumentNode doc = entry.getValue();
			if (!doc.isObject()) continue;

			DocumentNode id = doc.getAsObject().get(idField);

			if (id != null && id.isScalar()
					&& id.getAsScalar().getType() == ScalarNode.Type.STRING
					&& id.getAsScalar().getAsString().equals(target)) {
				return entry.getKey();
			}
		}

		return null;
	}
}
