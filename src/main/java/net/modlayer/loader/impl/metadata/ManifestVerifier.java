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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.google.common.base.CharMatcher;
import com.google.common.base.Strings;

import net.modlayer.loader.api.metadata.ModManifest;
import net.modlayer.loader.impl.util.version.SemanticVersionImpl;

public final class ManifestVerifier {
	// characters a dependency declaration can't express in an id
	private static final CharMatcher INVALID_ID_CHARS = CharMatcher.whitespace().or(CharMatcher.anyOf("<>="));

	static void verify(ModManifest manifest) throws ParseMetadataException {
		checkNotBlank(manifest.getId(), "mod id");
		checkModId(manifest.getId());
		checkNotBlank(manifest.getName(), "mod name");

		List<String> errorList = new ArrayList<>();

		for (String entry : manifest.getLoadAfter()) {
			if (entry.trim().isEmpty()) errorList.add("has a blank loadAfter entry");
		}

		for (String entry : manifest.getLoadBefore()) {
			if (entry.trim().isEmpty()) errorList.add("has a blank loadBefore entry");
		}

		for (String entry : manifest.getScripts()) {
			if (entry.trim().isEmpty()) errorList.add("has a blank script path");
		}

		for (String entry : manifest.getPatches()) {
			if (entry.trim().isEmpty()) errorList.add("has a blank patch path");
		}

		for (Map.Entry<String, String> entry : manifest.getContentFolders().entrySet()) {
			if (entry.getKey().trim().isEmpty()) {
				errorList.add("has a content folder with a blank content type");
			} else if (entry.getValue().trim().isEmpty()) {
				errorList.add("has a blank folder for content type \"" + entry.getKey() + "\"");
			}
		}

		if (errorList.isEmpty()) return;

		StringWriter sw = new StringWriter();

		try (PrintWriter pw = new PrintWriter(sw)) {
			pw.printf("Invalid mod %s:", manifest.getId());

			if (errorList.size() == 1) {
				pw.printf(" It %s", errorList.get(0));
			} else {
				for (String error : errorList) {
					pw.printf("\n\t- It %s", error);
				}
			}
		}

		throw new ParseMetadataException(sw.toString());
	}

	static void checkVersion(String version) throws ParseMetadataException {
		if (!SemanticVersionImpl.VERSION_PREFIX.matcher(version).find()) {
			throw new ParseMetadataException(String.format("Invalid version \"%s\": It must start with major.minor.patch (e.g. 1.0.0)", version));
		}
	}

	private static void checkModId(String id) throws ParseMetadataException {
		int pos = INVALID_ID_CHARS.indexIn(id);
		if (pos < 0) return;

		throw new ParseMetadataException(String.format("Invalid mod id \"%s\": It contains '%s' at position %d, "
				+ "ids must not contain whitespace, '<', '>' or '=' so dependencies can refer to them", id, id.charAt(pos), pos));
	}

	private static void checkNotBlank(String value, String name) throws ParseMetadataException {
		if (Strings.isNullOrEmpty(value) || value.trim().isEmpty()) {
			throw new ParseMetadataException(String.format("Invalid %s \"%s\": It must not be blank", name, Strings.nullToEmpty(value)));
		}
	}

	private ManifestVerifier() {
	}
}
