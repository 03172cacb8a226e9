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

package net.modlayer.test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import net.modlayer.loader.impl.metadata.ModManifestImpl;
import net.modlayer.loader.impl.metadata.ModManifestParser;
import net.modlayer.loader.impl.metadata.ParseMetadataException;

/**
 * Writes mod directories for tests.
 */
final class TestMods {
	static Path write(Path file, String content) {
		try {
			Files.createDirectories(file.getParent());
			Files.write(file, content.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}

		return file;
	}

	/**
	 * Creates {@code modsDir/dirName/mod.json} with the given extra manifest members appended after id, name and version.
	 */
	static Path mod(Path modsDir, String dirName, String id, String version, String extraMembers) {
		Path dir = modsDir.resolve(dirName);
		String json = String.format("{\"id\":\"%s\",\"name\":\"%s\",\"version\":\"%s\"%s}",
				id, id, version, extraMembers.isEmpty() ? "" : "," + extraMembers);
		write(dir.resolve(ModManifestParser.MANIFEST_FILE), json);

		return dir;
	}

	static Path mod(Path modsDir, String id, String extraMembers) {
		return mod(modsDir, id, id, "1.0.0", extraMembers);
	}

	static ModManifestImpl manifest(Path modDir) {
		try {
			return ModManifestParser.parseManifest(modDir);
		} catch (ParseMetadataException e) {
			throw new RuntimeException(e);
		}
	}

	private TestMods() {
	}
}
