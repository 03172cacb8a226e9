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

package net.modlayer.loader.api;

import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;

import net.modlayer.loader.api.metadata.ModManifest;

/**
 * A mod that passed validation and ordering and was (or is being) loaded.
 */
public interface LoadedMod {
	ModManifest getManifest();

	default String getId() {
		return getManifest().getId();
	}

	/**
	 * Returns the mod's root directory.
	 */
	Path getRootDirectory();

	/**
	 * Resolves a path declared by the mod against its root directory.
	 *
	 * @return the resolved path or empty if it escapes the root directory
	 */
	Optional<Path> resolvePath(String relativePath);

	/**
	 * Returns the content type to absolute folder mapping, entries escaping the mod directory excluded.
	 */
	Map<String, Path> getContentFolders();
}
