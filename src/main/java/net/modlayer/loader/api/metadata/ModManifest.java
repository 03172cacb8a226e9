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

package net.modlayer.loader.api.metadata;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import net.modlayer.loader.api.Version;

/**
 * The metadata of a mod, read from the {@code mod.json} file in its directory.
 */
public interface ModManifest {
	/**
	 * Priority of mods that don't declare one.
	 */
	int DEFAULT_PRIORITY = 100;

	/**
	 * Returns the mod's ID.
	 *
	 * <p>A mod's id is used as its unique key, only the first discovered mod with a given id is loaded.</p>
	 */
	String getId();

	/**
	 * Returns the user-friendly mod's name.
	 */
	String getName();

	/**
	 * Returns the mod's author or an empty string.
	 */
	String getAuthor();

	Version getVersion();

	/**
	 * Returns the mod's description or an empty string.
	 */
	String getDescription();

	/**
	 * Returns the hard dependencies, in declaration order.
	 */
	List<ModDependency> getDependencies();

	/**
	 * Returns ids this mod would like to be loaded before.
	 *
	 * <p>Stored for tooling only, load ordering doesn't consult it.
	 */
	List<String> getLoadBefore();

	/**
	 * Returns ids that are loaded before this mod if they are present.
	 */
	List<String> getLoadAfter();

	/**
	 * Returns the mod's priority, lower values load earlier.
	 */
	int getPriority();

	/**
	 * Returns script paths relative to the mod directory.
	 */
	List<String> getScripts();

	List<String> getPermissions();

	/**
	 * Returns patch file or directory paths relative to the mod directory.
	 */
	List<String> getPatches();

	/**
	 * Returns the content type to relative folder mapping, in declaration order.
	 */
	Map<String, String> getContentFolders();

	/**
	 * Returns the directory the manifest was read from.
	 */
	Path getDirectory();
}
