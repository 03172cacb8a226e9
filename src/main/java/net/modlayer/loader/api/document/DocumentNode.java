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

package net.modlayer.loader.api.document;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import net.modlayer.loader.impl.document.DocumentSerializer;

/**
 * Mutable JSON-like content tree.
 *
 * <p>A node is exactly one of {@link ObjectNode}, {@link ArrayNode} or {@link ScalarNode}; no other subclasses can
 * exist. Object members keep their insertion order. Number scalars keep the literal text they were read from so
 * serializing a document twice yields identical output.
 */
public abstract class DocumentNode {
	public enum Kind {
		OBJECT,
		ARRAY,
		SCALAR
	}

	private DocumentNode() { }

	public abstract Kind getKind();

	/**
	 * Creates an independent copy of this node and all of its children.
	 */
	public abstract DocumentNode deepCopy();

	public static ObjectNode object() {
		return new ObjectNode();
	}

	public static ArrayNode array() {
		return new ArrayNode();
	}

	public static ScalarNode string(String value) {
		return new ScalarNode(ScalarNode.Type.STRING, Objects.requireNonNull(value, "null string"));
	}

	/**
	 * Creates a number scalar from its JSON literal, e.g. {@code "1.50"} or {@code "-3e2"}.
	 */
	public static ScalarNode number(String literal) {
		try {
			new BigDecimal(literal);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("invalid number literal: "+literal, e);
		}

		return new ScalarNode(ScalarNode.Type.NUMBER, literal);
	}

	public static ScalarNode number(long value) {
		return new ScalarNode(ScalarNode.Type.NUMBER, Long.toString(value));
	}

	public static ScalarNode bool(boolean value) {
		return value ? ScalarNode.TRUE : ScalarNode.FALSE;
	}

	public static ScalarNode nullValue() {
		return ScalarNode.NULL;
	}

	public final boolean isObject() {
		return this instanceof ObjectNode;
	}

	public final boolean isArray() {
		return this instanceof ArrayNode;
	}

	public final boolean isScalar() {
		return this instanceof ScalarNode;
	}

	public final ObjectNode getAsObject() {
		if (this instanceof ObjectNode) {
			return (ObjectNode) this;
		} else {
			throw new ClassCastException("can't convert "+describe()+" to Object");
		}
	}

	public final ArrayNode getAsArray() {
		if (this instanceof ArrayNode) {
			return (ArrayNode) this;
		} else {
			throw new ClassCastException("can't convert "+describe()+" to Array");
		}
	}

	public final ScalarNode getAsScalar() {
		if (this instanceof ScalarNode) {
			return (ScalarNode) this;
		} else {
			throw new ClassCastException("can't convert "+describe()+" to Scalar");
		}
	}

	/**
	 * Short type description for error messages, e.g. {@code Object} or {@code Scalar(STRING)}.
	 */
	public String describe() {
		switch (getKind()) {
		case OBJECT: return "Object";
		case ARRAY: return "Array";
		default: return "Scalar("+((ScalarNode) this).getType().name()+")";
		}
	}

	/**
	 * Returns the canonical compact JSON form of this node.
	 */
	@Override
	public String toString() {
		return DocumentSerializer.toJson(this);
	}

	public static final class ObjectNode extends DocumentNode implements Iterable<Map.Entry<String, DocumentNode>> {
		private final Map<String, DocumentNode> members = new LinkedHashMap<>();

		private ObjectNode() { }

		@Override
		public Kind getKind() {
			return Kind.OBJECT;
		}

		public int size() {
			return members.size();
		}

		public boolean containsKey(String key) {
			return members.containsKey(key);
		}

		/**
		 * @return the member value or null if there is no member with this key
		 */
		public DocumentNode get(String key) {
			return members.get(key);
		}

		/**
		 * Sets a member, replacing an existing value in place or appending a new key at the end.
		 *
		 * @return the previous value or null
		 */
		public DocumentNode put(String key, DocumentNode value) {
			return members.put(Objects.requireNonNull(key, "null key"), Objects.requireNonNull(value, "null value"));
		}

		/**
		 * @return the removed value or null if there was no member with this key
		 */
		public DocumentNode remove(String key) {
			return members.remove(key);
		}

		public Set<String> keySet() {
			return Collections.unmodifiableSet(members.keySet());
		}

		@Override
		public Iterator<Map.Entry<String, DocumentNode>> iterator() {
			return Collections.unmodifiableMap(members).entrySet().iterator();
		}

		@Override
		public ObjectNode deepCopy() {
			ObjectNode ret = new ObjectNode();

			for (Map.Entry<String, DocumentNode> entry : members.entrySet()) {
				ret.members.put(entry.getKey(), entry.getValue().deepCopy());
			}

			return ret;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ObjectNode && members.equals(((ObjectNode) obj).members);
		}

		@Override
		public int hashCode() {
			return members.hashCode();
		}
	}

	public static final class ArrayNode extends DocumentNode implements Iterable<DocumentNode> {
		private final List<DocumentNode> elements = new ArrayList<>();

		private ArrayNode() { }

		@Override
		public Kind getKind() {
			return Kind.ARRAY;
		}

		public int size() {
			return elements.size();
		}

		public DocumentNode get(int index) {
			return elements.get(index);
		}

		public void add(DocumentNode value) {
			elements.add(Objects.requireNonNull(value, "null value"));
		}

		/**
		 * Inserts at {@code index}, shifting later elements right. {@code index == size()} appends.
		 */
		public void add(int index, DocumentNode value) {
			elements.add(index, Objects.requireNonNull(value, "null value"));
		}

		public DocumentNode set(int index, DocumentNode value) {
			return elements.set(index, Objects.requireNonNull(value, "null value"));
		}

		public DocumentNode remove(int index) {
			return elements.remove(index);
		}

		@Override
		public Iterator<DocumentNode> iterator() {
			return Collections.unmodifiableList(elements).iterator();
		}

		@Override
		public ArrayNode deepCopy() {
			ArrayNode ret = new ArrayNode();

			for (DocumentNode element : elements) {
				ret.elements.add(element.deepCopy());
			}

			return ret;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof ArrayNode && elements.equals(((ArrayNode) obj).elements);
		}

		@Override
		public int hashCode() {
			return elements.hashCode();
		}
	}

	/**
	 * Immutable leaf value. Since scalars can't be modified they are shared instead of copied.
	 */
	public static final class ScalarNode extends DocumentNode {
		public enum Type {
			STRING,
			NUMBER,
			BOOLEAN,
			NULL
		}

		static final ScalarNode TRUE = new ScalarNode(Type.BOOLEAN, "true");
		static final ScalarNode FALSE = new ScalarNode(Type.BOOLEAN, "false");
		static final ScalarNode NULL = new ScalarNode(Type.NULL, "null");

		private final Type type;
		private final String text;

		private ScalarNode(Type type, String text) {
			this.type = type;
			this.text = text;
		}

		@Override
		public Kind getKind() {
			return Kind.SCALAR;
		}

		public Type getType() {
			return type;
		}

		public boolean isNull() {
			return type == Type.NULL;
		}

		/**
		 * Raw text of the scalar: the string value for strings, the literal for numbers, otherwise the JSON keyword.
		 */
		public String getText() {
			return text;
		}

		public String getAsString() {
			if (type != Type.STRING) throw new ClassCastException("can't convert "+describe()+" to String");

			return text;
		}

		public BigDecimal getAsNumber() {
			if (type != Type.NUMBER) throw new ClassCastException("can't convert "+describe()+" to Number");

			return new BigDecimal(text);
		}

		public boolean getAsBoolean() {
			if (type != Type.BOOLEAN) throw new ClassCastException("can't convert "+describe()+" to Boolean");

			return this == TRUE;
		}

		@Override
		public ScalarNode deepCopy() {
			return this;
		}

		@Override
		public boolean equals(Object obj) {
			if (!(obj instanceof ScalarNode)) return false;

			ScalarNode o = (ScalarNode) obj;

			return type == o.type && text.equals(o.text);
		}

		@Override
		public int hashCode() {
			return type.hashCode() * 31 + text.hashCode();
		}
	}
}
