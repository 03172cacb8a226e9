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

package net.modlayer.loader.impl.patch;

import java.util.List;

import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.api.document.DocumentNode.ArrayNode;
import net.modlayer.loader.api.document.DocumentNode.ObjectNode;
import net.modlayer.loader.api.patch.ModPatch;
import net.modlayer.loader.api.patch.PatchException;
import net.modlayer.loader.api.patch.PatchOperation;
import net.modlayer.loader.impl.document.DocumentSerializer;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.LogCategory;
import net.modlayer.loader.impl.util.log.LogLevel;

/**
 * Applies RFC 6902 operations to a document in place.
 *
 * <p>Operations run in order and each sees the effects of the previous ones. The first failing operation aborts the
 * rest of the patch while everything applied before it stays applied; callers needing isolation have to pass a
 * {@link DocumentNode#deepCopy() copy}.
 */
public final class PatchApplicator {
	/**
	 * Applies all operations of {@code patch} to {@code document}.
	 *
	 * @return {@code document}, mutated
	 * @throws PatchException for the first failing operation, with its index and the applied operation count set
	 */
	public static DocumentNode applyPatch(DocumentNode document, ModPatch patch) throws PatchException {
		return applyOperations(document, patch.getOperations());
	}

	public static DocumentNode applyOperations(DocumentNode document, List<PatchOperation> operations) throws PatchException {
		for (int i = 0; i < operations.size(); i++) {
			PatchOperation operation = operations.get(i);

			if (Log.shouldLog(LogLevel.TRACE, LogCategory.PATCH)) {
				Log.trace(LogCategory.PATCH, "Applying operation #%d: %s", i, operation);
			}

			try {
				applyOperation(document, operation);
			} catch (PatchException e) {
				e.setOperation(i, operation);
				throw e;
			}
		}

		return document;
	}

	public static void applyOperation(DocumentNode document, PatchOperation operation) throws PatchException {
		PatchOperation.Kind kind = operation.validate();
		JsonPointer path = JsonPointer.parse(operation.getPath());

		switch (kind) {
		case ADD:
			add(document, path, operation.getValue().deepCopy());
			break;
		case REMOVE:
			remove(document, path);
			break;
		case REPLACE:
			replace(document, path, operation.getValue().deepCopy());
			break;
		case MOVE: {
			JsonPointer from = JsonPointer.parse(operation.getFrom());
			// a failing destination must leave the source in place, so the move runs on a copy first
			move(document.deepCopy(), from, path);
			move(document, from, path);
			break;
		}
		case COPY: {
			JsonPointer from = JsonPointer.parse(operation.getFrom());
			add(document, path, from.resolve(document).deepCopy());
			break;
		}
		case TEST: {
			String actual = DocumentSerializer.toJson(path.resolve(document));
			String expected = DocumentSerializer.toJson(operation.getValue());

			if (!actual.equals(expected)) {
				throw new PatchException(PatchException.Kind.TEST_FAILED, "Expected %s but found %s", expected, actual);
			}

			break;
		}
		}
	}

	private static void move(DocumentNode document, JsonPointer from, JsonPointer path) throws PatchException {
		DocumentNode value = from.resolve(document);
		// remove first so index shifts within the same array are accounted for
		remove(document, from);
		add(document, path, value);
	}

	private static void add(DocumentNode document, JsonPointer path, DocumentNode value) throws PatchException {
		DocumentNode parent = path.resolveParent(document);
		String key = path.getLastSegment();

		switch (parent.getKind()) {
		case OBJECT:
			parent.getAsObject().put(key, value);
			break;
		case ARRAY: {
			ArrayNode array = parent.getAsArray();

			if (key.equals(JsonPointer.END_OF_ARRAY)) {
				array.add(value);
			} else {
				array.add(path.parseLastIndex(array.size()), value);
			}

			break;
		}
		default:
			throw new PatchException(PatchException.Kind.INVALID_TARGET, "Can't add \"%s\" to %s", key, parent.describe());
		}
	}

	private static void remove(DocumentNode document, JsonPointer path) throws PatchException {
		DocumentNode parent = path.resolveParent(document);
		String key = path.getLastSegment();

		switch (parent.getKind()) {
		case OBJECT:
			if (parent.getAsObject().remove(key) == null) {
				throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "Can't remove missing key \"%s\"", key);
			}

			break;
		case ARRAY: {
			ArrayNode array = parent.getAsArray();
			array.remove(path.parseLastIndex(array.size() - 1));
			break;
		}
		default:
			throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "Can't remove \"%s\" from %s", key, parent.describe());
		}
	}

	private static void replace(DocumentNode document, JsonPointer path, DocumentNode value) throws PatchException {
		DocumentNode parent = path.resolveParent(document);
		String key = path.getLastSegment();

		switch (parent.getKind()) {
		case OBJECT: {
			ObjectNode object = parent.getAsObject();

			if (!object.containsKey(key)) {
				throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "Can't replace missing key \"%s\"", key);
			}

			object.put(key, value);
			break;
		}
		case ARRAY: {
			ArrayNode array = parent.getAsArray();
			array.set(path.parseLastIndex(array.size() - 1), value);
			break;
		}
		default:
			throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "Can't replace \"%s\" in %s", key, parent.describe());
		}
	}

	private PatchApplicator() {
	}
}
