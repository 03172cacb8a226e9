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

package net.modlayer.loader.api.patch;

import java.util.Locale;

import net.modlayer.loader.api.document.DocumentNode;

/**
 * One RFC 6902 operation as declared in a patch file.
 *
 * <p>The operation is kept as written, {@link #validate()} checks its shape. A JSON {@code null} value is a present
 * value ({@link DocumentNode#nullValue()}), only a Java null means the field was absent.
 */
public final class PatchOperation {
	public enum Kind {
		ADD("add"),
		REMOVE("remove"),
		REPLACE("replace"),
		MOVE("move"),
		COPY("copy"),
		TEST("test");

		private final String name;

		Kind(String name) {
			this.name = name;
		}

		public String getName() {
			return name;
		}

		public boolean requiresValue() {
			return this == ADD || this == REPLACE || this == TEST;
		}

		public boolean requiresFrom() {
			return this == MOVE || this == COPY;
		}

		/**
		 * Case-insensitive lookup.
		 *
		 * @return the kind or null if {@code name} isn't one of the six operation names
		 */
		public static Kind byName(String name) {
			if (name == null) return null;

			String lower = name.toLowerCase(Locale.ROOT);

			for (Kind kind : values()) {
				if (kind.name.equals(lower)) return kind;
			}

			return null;
		}
	}

	private final String op;
	private final String path;
	private final DocumentNode value;
	private final String from;

	public PatchOperation(String op, String path, /* @Nullable */ DocumentNode value, /* @Nullable */ String from) {
		this.op = op;
		this.path = path;
		this.value = value;
		this.from = from;
	}

	public static PatchOperation add(String path, DocumentNode value) {
		return new PatchOperation("add", path, value, null);
	}

	public static PatchOperation remove(String path) {
		return new PatchOperation("remove", path, null, null);
	}

	public static PatchOperation replace(String path, DocumentNode value) {
		return new PatchOperation("replace", path, value, null);
	}

	public static PatchOperation move(String from, String path) {
		return new PatchOperation("move", path, null, from);
	}

	public static PatchOperation copy(String from, String path) {
		return new PatchOperation("copy", path, null, from);
	}

	public static PatchOperation test(String path, DocumentNode value) {
		return new PatchOperation("test", path, value, null);
	}

	public String getOp() {
		return op;
	}

	/**
	 * @return the operation kind or null if the name is unknown
	 */
	public Kind getKind() {
		return Kind.byName(op);
	}

	public String getPath() {
		return path;
	}

	public DocumentNode getValue() {
		return value;
	}

	public boolean hasValue() {
		return value != null;
	}

	public String getFrom() {
		return from;
	}

	/**
	 * Checks the operation's shape without looking at any document.
	 *
	 * @return the operation kind
	 */
	public Kind validate() throws PatchException {
		Kind kind = getKind();

		if (kind == null) {
			throw new PatchException(PatchException.Kind.INVALID_OPERATION, "Unknown operation \"%s\"", op);
		}

		if (path == null || !path.startsWith("/")) {
			throw new PatchException(PatchException.Kind.INVALID_OPERATION, "Path \"%s\" must start with '/'", path);
		}

		if (kind.requiresValue() && value == null) {
			throw new PatchException(PatchException.Kind.INVALID_OPERATION, "Operation \"%s\" requires a value", kind.getName());
		}

		if (kind.requiresFrom()) {
			if (from == null) {
				throw new PatchException(PatchException.Kind.INVALID_OPERATION, "Operation \"%s\" requires a from path", kind.getName());
			} else if (!from.startsWith("/")) {
				throw new PatchException(PatchException.Kind.INVALID_OPERATION, "From path \"%s\" must start with '/'", from);
			}
		}

		return kind;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(op).append(' ').append(path);
		if (from != null) sb.append(" from ").append(from);
		if (value != null) sb.append(" = ").append(value);

		return sb.toString();
	}
}
