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
import java.util.List;
import java.util.Map;
import java.util.Optional;

import net.modlayer.loader.api.metadata.ModManifest;
import net.modlayer.loader.api.patch.ModPatch;
import net.modlayer.loader.impl.discovery.ModResolutionException;

/**
 * Discovers, orders and loads mods, applying their content and patches to a shared content store.
 */
public interface ModLoader {
	/**
	 * Discovers all mods, computes their load order and loads them one after another.
	 *
	 * <p>A missing or circular dependency fails the whole call before any mod is loaded. Everything else is
	 * contained: invalid manifests, duplicate mod ids, unreadable patch or content files, failing patches and failing
	 * scripts are logged and only affect the mod or patch at fault.</p>
	 *
	 * @return the mods loaded by this call, in load order
	 * @throws ModResolutionException if no valid load order exists
	 */
	List<LoadedMod> loadAll() throws ModResolutionException;

	/**
	 * Unloads a mod, notifying its script instances and dropping its cached patches and manifest.
	 *
	 * <p>Content the mod contributed or patched stays in the content store.</p>
	 *
	 * @param modId the ID of the mod
	 * @return whether the mod was loaded
	 */
	boolean unload(String modId);

	/**
	 * Unloads a mod and loads it again from its directory, re-applying its patches on top of the current content.
	 *
	 * @param modId the ID of the mod
	 * @return whether the mod was loaded afterwards
	 */
	boolean reload(String modId);

	/**
	 * Checks if a mod with a certain ID is loaded.
	 *
	 * @param modId the ID of the mod, in lowercase
	 * @return whether or not the mod is present in this loader's mod list
	 */
	boolean isLoaded(String modId);

	/**
	 * Gets the manifest of a loaded mod.
	 *
	 * @param modId the ID of the mod
	 * @return the manifest or empty if the mod isn't loaded
	 */
	Optional<ModManifest> getManifest(String modId);

	/**
	 * Gets the patches of a loaded mod as read from its patch files.
	 *
	 * @param modId the ID of the mod
	 * @return the patches in application order, empty if the mod isn't loaded
	 */
	List<ModPatch> getPatches(String modId);

	/**
	 * Gets the content folders of a loaded mod.
	 *
	 * @param modId the ID of the mod
	 * @return content type to absolute folder, empty if the mod isn't loaded
	 */
	Map<String, Path> getContentFolders(String modId);

	/**
	 * Gets one content folder of a loaded mod.
	 *
	 * @return the folder or empty if the mod isn't loaded or doesn't declare the content type
	 */
	Optional<Path> getContentFolder(String modId, String contentType);

	/**
	 * Returns all loaded mods in load order.
	 */
	List<LoadedMod> getLoadedMods();

	/**
	 * Finds the file that provides a piece of content, preferring mods loaded later.
	 *
	 * @param contentType the content type, e.g. {@code Templates}
	 * @param relativePath path below the content folder
	 * @return the existing file or empty if neither a loaded mod nor the base content provides it
	 */
	Optional<Path> resolveContentPath(String contentType, String relativePath);

	/**
	 * Returns the load state of a mod known to this loader.
	 *
	 * @return the state or empty if no mod with that id was discovered
	 */
	Optional<ModLoadState> getState(String modId);
}
