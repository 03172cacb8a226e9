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

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import net.modlayer.loader.api.Version;
import net.modlayer.loader.api.metadata.ModDependency;
import net.modlayer.loader.api.metadata.ModManifest;

public final class ModManifestImpl implements ModManifest {
	private final String id;
	private final String name;
	private final String author;
	private final Version version;
	private final String description;
	private final List<ModDependency> dependencies;
	private final List<String> loadBefore;
	private final List<String> loadAfter;
	private final int priority;
	private final List<String> scripts;
	private final List<String> permissions;
	private final List<String> patches;
	private final Map<String, String> contentFolders;
	private final Path directory;

	ModManifestImpl(String id, String name, String author, Version version, String description,
			List<ModDependency> dependencies, List<String> loadBefore, List<String> loadAfter, int priority,
			List<String> scripts, List<String> permissions, List<String> patches, Map<String, String> contentFolders,
			Path directory) {
		this.id = id;
		this.name = name;
		this.author = Strings.nullToEmpty(author);
		this.version = version;
		this.description = Strings.nullToEmpty(description);
		this.dependencies = ImmutableList.copyOf(dependencies);
		this.loadBefore = ImmutableList.copyOf(loadBefore);
		this.loadAfter = ImmutableList.copyOf(loadAfter);
		this.priority = priority;
		this.scripts = ImmutableList.copyOf(scripts);
		this.permissions = ImmutableList.copyOf(permissions);
		this.patches = ImmutableList.copyOf(patches);
		this.contentFolders = ImmutableMap.copyOf(contentFolders);
		this.directory = directory;
	}

	@Override
	public String getId() {
		return id;
	}

	@Override
	public String getName() {
		return name;
	}

	@Override
	public String getAuthor() {
		return author;
	}

	@Override
	public Version getVersion() {
		return version;
	}

	@Override
	public String getDescription() {
		return description;
	}

	@Override
	public List<ModDependency> getDependencies() {
		return dependencies;
	}

	@Override
	public List<String> getLoadBefore() {
		return loadBefore;
	}

	@Override
	public List<String> getLoadAfter() {
		return loadAfter;
	}

	@Override
	public int getPriority() {
		return priority;
	}

	@Override
	public List<String> getScripts() {
		return scripts;
	}

	@Override
	public List<String> getPermissions() {
		return permissions;
	}

	@Override
	public List<String> getPatches() {
		return patches;
	}

	@Override
	public Map<String, String> getContentFolders() {
		return contentFolders;
	}

	@Override
	public Path getDirectory() {
		return directory;
	}

	@Override
	public String toString() {
		return String.format("%s %s", id, version.getFriendlyString());
	}
}
