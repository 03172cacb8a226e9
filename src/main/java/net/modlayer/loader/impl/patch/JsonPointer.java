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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.api.document.DocumentNode.ArrayNode;
import net.modlayer.loader.api.patch.PatchException;

/**
 * Parsed JSON pointer (RFC 6901) addressing a node within a {@link DocumentNode} tree.
 *
 * <p>Segments are decoded by replacing {@code ~1} with {@code /} and then {@code ~0} with {@code ~}. The order
 * matters: {@code ~01} has to decode to {@code ~1}, reversing the passes would turn it into {@code /}.
 */
public final class JsonPointer {
	/** Array segment meaning "after the last element", only valid as the final segment of an add. */
	public static final String END_OF_ARRAY = "-";

	private static final JsonPointer ROOT = new JsonPointer("", Collections.emptyList());

	private final String text;
	private final List<String> segments;

	private JsonPointer(String text, List<String> segments) {
		this.text = text;
		this.segments = segments;
	}

	public static JsonPointer parse(String pointer) throws PatchException {
		if (pointer == null) throw new PatchException(PatchException.Kind.INVALID_OPERATION, "Missing JSON pointer");
		if (pointer.isEmpty()) return ROOT;

		if (pointer.charAt(0) != '/') {
			throw new PatchException(PatchException.Kind.INVALID_OPERATION, "JSON pointer \"%s\" must be empty or start with '/'", pointer);
		}

		List<String> segments = new ArrayList<>();
		int start = 1;

		for (;;) {
			int end = pointer.indexOf('/', start);

			if (end < 0) {
				segments.add(unescape(pointer.substring(start)));
				break;
			}

			segments.add(unescape(pointer.substring(start, end)));
			start = end + 1;
		}

		return new JsonPointer(pointer, Collections.unmodifiableList(segments));
	}

	public static String unescape(String segment) {
		return segment.replace("~1", "/").replace("~0", "~");
	}

	public static String escape(String key) {
		return key.replace("~", "~0").replace("/", "~1");
	}

	public boolean isRoot() {
		return segments.isEmpty();
	}

	public List<String> getSegments() {
		return segments;
	}

	/**
	 * @return the decoded final segment, the key or index to mutate within the parent
	 */
	public String getLastSegment() {
		if (isRoot()) throw new IllegalStateException("root pointer has no segments");

		return segments.get(segments.size() - 1);
	}

	/**
	 * Locates the node this pointer addresses.
	 */
	public DocumentNode resolve(DocumentNode root) throws PatchException {
		return navigate(root, segments.size());
	}

	/**
	 * Locates the container holding the node this pointer addresses, which itself may not exist yet.
	 */
	public DocumentNode resolveParent(DocumentNode root) throws PatchException {
		if (isRoot()) throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "The document root has no parent");

		return navigate(root, segments.size() - 1);
	}

	private DocumentNode navigate(DocumentNode root, int depth) throws PatchException {
		DocumentNode current = root;

		for (int i = 0; i < depth; i++) {
			String segment = segments.get(i);

			switch (current.getKind()) {
			case OBJECT: {
				DocumentNode next = current.getAsObject().get(segment);

				if (next == null) {
					throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "Key \"%s\" not found at %s", segment, prefix(i));
				}

				current = next;
				break;
			}
			case ARRAY: {
				ArrayNode array = current.getAsArray();
				current = array.get(parseIndex(segment, array.size() - 1, i));
				break;
			}
			default:
				throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "Can't descend into %s at %s", current.describe(), prefix(i));
			}
		}

		return current;
	}

	/**
	 * Parses an array index segment, which must consist of decimal digits and lie within {@code [0, maxIndex]}.
	 */
	int parseIndex(String segment, int maxIndex, int segmentPos) throws PatchException {
		if (segment.isEmpty()) {
			throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "Empty array index at %s", prefix(segmentPos));
		}

		for (int i = 0; i < segment.length(); i++) {
			char c = segment.charAt(i);

			if (c < '0' || c > '9') {
				throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "Invalid array index \"%s\" at %s", segment, prefix(segmentPos));
			}
		}

		int index;

		try {
			index = Integer.parseInt(segment);
		} catch (NumberFormatException e) {
			index = Integer.MAX_VALUE; // too many digits, out of range below
		}

		if (index > maxIndex) {
			throw new PatchException(PatchException.Kind.PATH_NOT_FOUND, "Array index %s out of range (max %d) at %s", segment, maxIndex, prefix(segmentPos));
		}

		return index;
	}

	/**
	 * Parses the final segment as an array index within {@code [0, maxIndex]}.
	 */
	int parseLastIndex(int maxIndex) throws PatchException {
		return parseIndex(getLastSegment(), maxIndex, segments.size() - 1);
	}

	private String prefix(int segmentPos) {
		StringBuilder sb = new StringBuilder();

		for (int i = 0; i <= segmentPos && i < segments.size(); i++) {
			sb.append('/').append(escape(segments.get(i)));
		}

		return sb.length() == 0 ? "\"\"" : sb.toString();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof JsonPointer && segments.equals(((JsonPointer) obj).segments);
	}

	@Override
	public int hashCode() {
		return segments.hashCode();
	}

	@Override
	public String toString() {
		return text;
	}
}
