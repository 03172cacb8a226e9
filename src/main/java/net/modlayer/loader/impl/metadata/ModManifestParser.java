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

package net.modlayer.loader.impl.metadata;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;

import net.modlayer.loader.api.Version;
import net.modlayer.loader.api.VersionParsingException;
import net.modlayer.loader.api.metadata.ModDependency;
import net.modlayer.loader.api.metadata.ModManifest;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.LogCategory;

/**
 * Reads {@code mod.json} manifests.
 *
 * <p>Field names are matched case-insensitively, unknown fields are reported as warnings and otherwise ignored.
 * An explicit JSON {@code null} is treated like an absent field.
 */
public final class ModManifestParser {
	public static final String MANIFEST_FILE = "mod.json";
	/**
	 * Keys that will be ignored by the manifest parser.
	 */
	public static final Set<String> IGNORED_KEYS = Collections.singleton("$schema");

	public static ModManifestImpl parseManifest(Path modDir) throws ParseMetadataException {
		try (InputStream is = Files.newInputStream(modDir.resolve(MANIFEST_FILE))) {
			return parseManifest(is, modDir);
		} catch (IOException e) {
			ParseMetadataException exc = new ParseMetadataException(e);
			exc.setModPath(modDir.toString());
			throw exc;
		}
	}

	// Per ECMA-404 the JSON spec does not prohibit duplicate keys, later entries replace previous ones.
	public static ModManifestImpl parseManifest(InputStream is, Path modDir) throws ParseMetadataException {
		try {
			ModManifestImpl ret = readManifest(is, modDir);
			ManifestVerifier.verify(ret);

			return ret;
		} catch (ParseMetadataException e) {
			e.setModPath(modDir.toString());
			throw e;
		} catch (Throwable t) {
			ParseMetadataException e = new ParseMetadataException(t);
			e.setModPath(modDir.toString());
			throw e;
		}
	}

	private static ModManifestImpl readManifest(InputStream is, Path modDir) throws IOException, ParseMetadataException {
		try (JsonReader reader = new JsonReader(new InputStreamReader(is, StandardCharsets.UTF_8))) {
			if (reader.peek() != JsonToken.BEGIN_OBJECT) {
				throw new ParseMetadataException("Root of \"" + MANIFEST_FILE + "\" must be an object", reader);
			}

			reader.beginObject();
			ModManifestImpl ret = readManifest(reader, modDir);
			reader.endObject();

			return ret;
		}
	}

	private static ModManifestImpl readManifest(JsonReader reader, Path modDir) throws IOException, ParseMetadataException {
		List<ParseWarning> warnings = new ArrayList<>();

		// Required
		String id = null;
		String name = null;
		String version = null;

		// Optional (metadata)
		String author = null;
		String description = null;
		List<String> permissions = new ArrayList<>();

		// Optional (load ordering)
		List<String> dependencies = new ArrayList<>();
		List<String> loadBefore = new ArrayList<>();
		List<String> loadAfter = new ArrayList<>();
		int priority = ModManifest.DEFAULT_PRIORITY;

		// Optional (content)
		List<String> scripts = new ArrayList<>();
		List<String> patches = new ArrayList<>();
		Map<String, String> contentFolders = new LinkedHashMap<>();

		while (reader.hasNext()) {
			final String key = reader.nextName();

			if (reader.peek() == JsonToken.NULL) {
				reader.nextNull();
				continue;
			}

			switch (key.toLowerCase(Locale.ROOT)) {
			case "id":
				id = readString(reader, "Mod id");
				break;
			case "name":
				name = readString(reader, "Mod name");
				break;
			case "version":
				version = readString(reader, "Version");
				break;
			case "author":
				author = readString(reader, "Author");
				break;
			case "description":
				description = readString(reader, "Mod description");
				break;
			case "dependencies":
				readStringArray(reader, "Dependencies", dependencies);
				break;
			case "loadbefore":
				readStringArray(reader, "Load before", loadBefore);
				break;
			case "loadafter":
				readStringArray(reader, "Load after", loadAfter);
				break;
			case "priority":
				priority = readPriority(reader);
				break;
			case "scripts":
				readStringArray(reader, "Scripts", scripts);
				break;
			case "permissions":
				readStringArray(reader, "Permissions", permissions);
				break;
			case "patches":
				readStringArray(reader, "Patches", patches);
				break;
			case "contentfolders":
				readContentFolders(reader, contentFolders);
				break;
			default:
				if (!IGNORED_KEYS.contains(key)) {
					warnings.add(new ParseWarning(reader.getPath(), key, "Unsupported root entry"));
				}

				reader.skipValue();
				break;
			}
		}

		// Validate all required fields are resolved
		if (id == null) {
			throw new ParseMetadataException.MissingField("id");
		}

		if (name == null) {
			throw new ParseMetadataException.MissingField("name");
		}

		if (version == null) {
			throw new ParseMetadataException.MissingField("version");
		}

		ManifestVerifier.checkVersion(version);

		Version parsedVersion;

		try {
			parsedVersion = Version.parse(version);
		} catch (VersionParsingException e) {
			throw new ParseMetadataException("Failed to parse version", e);
		}

		List<ModDependency> parsedDependencies = new ArrayList<>(dependencies.size());

		for (String dependency : dependencies) {
			parsedDependencies.add(ModDependencyImpl.parse(dependency));
		}

		logWarningMessages(id, warnings);

		return new ModManifestImpl(id, name, author, parsedVersion, description,
				parsedDependencies, loadBefore, loadAfter, priority,
				scripts, permissions, patches, contentFolders,
				modDir);
	}

	private static String readString(JsonReader reader, String what) throws IOException, ParseMetadataException {
		if (reader.peek() != JsonToken.STRING) {
			throw new ParseMetadataException(what + " must be a string", reader);
		}

		return reader.nextString();
	}

	private static void readStringArray(JsonReader reader, String what, List<String> out) throws IOException, ParseMetadataException {
		if (reader.peek() != JsonToken.BEGIN_ARRAY) {
			throw new ParseMetadataException(what + " must be an array of strings", reader);
		}

		reader.beginArray();

		while (reader.hasNext()) {
			if (reader.peek() != JsonToken.STRING) {
				throw new ParseMetadataException(what + " entry must be a string", reader);
			}

			out.add(reader.nextString());
		}

		reader.endArray();
	}

	private static int readPriority(JsonReader reader) throws IOException, ParseMetadataException {
		if (reader.peek() != JsonToken.NUMBER) {
			throw new ParseMetadataException("Priority must be a number", reader);
		}

		try {
			return reader.nextInt();
		} catch (NumberFormatException e) {
			throw new ParseMetadataException("Priority must be an integer", e);
		}
	}

	private static void readContentFolders(JsonReader reader, Map<String, String> out) throws IOException, ParseMetadataException {
		if (reader.peek() != JsonToken.BEGIN_OBJECT) {
			throw new ParseMetadataException("Content folders must be an object mapping content types to folders", reader);
		}

		reader.beginObject();

		while (reader.hasNext()) {
			String type = reader.nextName();

			if (reader.peek() != JsonToken.STRING) {
				throw new ParseMetadataException("Content folder for type \"" + type + "\" must be a string", reader);
			}

			out.put(type, reader.nextString());
		}

		reader.endObject();
	}

	static void logWarningMessages(String id, List<ParseWarning> warnings) {
		if (warnings.isEmpty()) return;

		final StringBuilder message = new StringBuilder();

		message.append(String.format("The mod \"%s\" contains invalid entries in its %s:", id, MANIFEST_FILE));

		for (ParseWarning warning : warnings) {
			message.append(String.format("\n- %s \"%s\" at %s", warning.getReason(), warning.getKey(), warning.getLocation()));
		}

		Log.warn(LogCategory.METADATA, message.toString());
	}

	private ModManifestParser() {
	}
}
