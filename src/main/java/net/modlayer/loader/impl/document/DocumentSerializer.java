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

package net.modlayer.loader.impl.document;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.Map;

import com.google.gson.stream.JsonWriter;

import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.api.document.DocumentNode.ScalarNode;

/**
 * Writes {@link DocumentNode} trees as JSON.
 *
 * <p>The compact form is canonical: members in insertion order, no whitespace, numbers as their original literal.
 * Two documents are considered equal by the patch {@code test} operation iff their compact forms are equal.
 */
public final class DocumentSerializer {
	public static String toJson(DocumentNode node) {
		return write(node, "");
	}

	public static String toPrettyJson(DocumentNode node) {
		return write(node, "  ");
	}

	private static String write(DocumentNode node, String indent) {
		StringWriter out = new StringWriter();

		try {
			write(node, out, indent);
		} catch (IOException e) {
			throw new UncheckedIOException(e); // can't happen with StringWriter
		}

		return out.toString();
	}

	public static void write(DocumentNode node, Writer out, String indent) throws IOException {
		JsonWriter writer = new JsonWriter(out);
		writer.setLenient(true);
		writer.setHtmlSafe(false);
		writer.setSerializeNulls(true);
		writer.setIndent(indent);

		writeValue(writer, node);
		writer.flush();
	}

	private static void writeValue(JsonWriter writer, DocumentNode node) throws IOException {
		switch (node.getKind()) {
		case OBJECT:
			writer.beginObject();

			for (Map.Entry<String, DocumentNode> entry : node.getAsObject()) {
				writer.name(entry.getKey());
				writeValue(writer, entry.getValue());
			}

			writer.endObject();
			break;
		case ARRAY:
			writer.beginArray();

			for (DocumentNode element : node.getAsArray()) {
				writeValue(writer, element);
			}

			writer.endArray();
			break;
		case SCALAR:
			writeScalar(writer, node.getAsScalar());
			break;
		}
	}

	private static void writeScalar(JsonWriter writer, ScalarNode scalar) throws IOException {
		switch (scalar.getType()) {
		case STRING:
			writer.value(scalar.getAsString());
			break;
		case NUMBER:
			writer.jsonValue(scalar.getText());
			break;
		case BOOLEAN:
			writer.value(scalar.getAsBoolean());
			break;
		case NULL:
			writer.nullValue();
			break;
		}
	}

	private DocumentSerializer() {
	}
}
