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
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.MalformedJsonException;

import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.api.document.DocumentNode.ArrayNode;
import net.modlayer.loader.api.document.DocumentNode.ObjectNode;

/**
 * Reads JSON text into {@link DocumentNode} trees.
 */
public final class DocumentParser {
	public static DocumentNode parse(String json) throws IOException {
		return parse(new StringReader(json));
	}

	public static DocumentNode parse(Path file) throws IOException {
		try (InputStream is = Files.newInputStream(file)) {
			return parse(is);
		}
	}

	public static DocumentNode parse(InputStream is) throws IOException {
		return parse(new InputStreamReader(is, StandardCharsets.UTF_8));
	}

	public static DocumentNode parse(Reader input) throws IOException {
		try (JsonReader reader = new JsonReader(input)) {
			DocumentNode ret = readValue(reader);

			if (reader.peek() != JsonToken.END_DOCUMENT) {
				throw new MalformedJsonException("Trailing data after JSON value at "+reader.getPath());
			}

			return ret;
		} catch (IllegalStateException e) { // unexpected token from gson
			throw new MalformedJsonException(e.getMessage(), e);
		}
	}

	/**
	 * Reads the next value from {@code reader}, which must be positioned before a value.
	 */
	public static DocumentNode readValue(JsonReader reader) throws IOException {
		switch (reader.peek()) {
		case BEGIN_OBJECT: {
			reader.beginObject();

			ObjectNode ret = DocumentNode.object();

			while (reader.hasNext()) {
				String key = reader.nextName();
				ret.put(key, readValue(reader)); // duplicate keys: last one wins
			}

			reader.endObject();

			return ret;
		}
		case BEGIN_ARRAY: {
			reader.beginArray();

			ArrayNode ret = DocumentNode.array();

			while (reader.hasNext()) {
				ret.add(readValue(reader));
			}

			reader.endArray();

			return ret;
		}
		case STRING:
			return DocumentNode.string(reader.nextString());
		case NUMBER:
			// nextString returns the literal as written
			return DocumentNode.number(reader.nextString());
		case BOOLEAN:
			return DocumentNode.bool(reader.nextBoolean());
		case NULL:
			reader.nextNull();
			return DocumentNode.nullValue();
		default:
			throw new MalformedJsonException("Expected a JSON value at "+reader.getPath()+", found "+reader.peek());
		}
	}

	private DocumentParser() {
	}
}
