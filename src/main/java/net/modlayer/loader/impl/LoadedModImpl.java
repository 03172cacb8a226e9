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

package net.modlayer.loader.impl;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableMap;

import net.modlayer.loader.api.LoadedMod;
import net.modlayer.loader.api.metadata.ModManifest;
import net.modlayer.loader.impl.util.LoaderUtil;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.LogCategory;

public class LoadedModImpl implements LoadedMod {
	private final ModManifest manifest;
	private final Path root;
	private final Map<String, Path> contentFolders;

	public LoadedModImpl(ModManifest manifest) {
		this.manifest = manifest;
		this.root = manifest.getDirectory().toAbsolutePath().normalize();
		this.contentFolders = resolveContentFolders();
	}

	private Map<String, Path> resolveContentFolders() {
		Map<String, Path> ret = new LinkedHashMap<>();

		for (Map.Entry<String, String> entry : manifest.getContentFolders().entrySet()) {
			Path folder = LoaderUtil.resolveWithin(root, entry.getValue());

			if (folder == null) {
				Log.error(LogCategory.CONTENT, "Mod %s declares %s content folder %s outside of its directory, ignoring it",
						manifest.getId(), entry.getKey(), entry.getValue());
				continue;
			}

			ret.put(entry.getKey(), folder);
		}

		return ImmutableMap.copyOf(ret);
	}

	@Override
	public ModManifest getManifest() {
		return manifest;
	}

	@Override
	public Path getRootDirectory() {
		return root;
	}

	@Override
	public Optional<Path> resolvePath(String relativePath) {
		return Optional.ofNullable(LoaderUtil.resolveWithin(root, relativePath));
	}

	@Override
	public Map<String, Path> getContentFolders() {
		return contentFolders;
	}

	@Override
	public String toString() {
		return String.format("%s %s (%s)", manifest.getId(), manifest.getVersion().getFriendlyString(), root);
	}
}
