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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;

import net.modlayer.loader.api.LoadedMod;
import net.modlayer.loader.api.ModLoadState;
import net.modlayer.loader.api.ModLoader;
import net.modlayer.loader.api.content.ContentStore;
import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.api.metadata.ModManifest;
import net.modlayer.loader.api.patch.ModPatch;
import net.modlayer.loader.api.patch.PatchException;
import net.modlayer.loader.api.script.ScriptRuntime;
import net.modlayer.loader.api.script.UnloadableScript;
import net.modlayer.loader.impl.content.ContentDocumentLoader;
import net.modlayer.loader.impl.content.ContentDocumentLoader.ContentDocument;
import net.modlayer.loader.impl.content.ContentFolder;
import net.modlayer.loader.impl.discovery.DirectoryModCandidateFinder;
import net.modlayer.loader.impl.discovery.ModDiscoverer;
import net.modlayer.loader.impl.discovery.ModResolutionException;
import net.modlayer.loader.impl.discovery.ModResolver;
import net.modlayer.loader.impl.metadata.ModManifestImpl;
import net.modlayer.loader.impl.patch.PatchApplicator;
import net.modlayer.loader.impl.patch.PatchFileLoader;
import net.modlayer.loader.impl.util.LoaderUtil;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.LogCategory;

/**
 * Default {@link ModLoader}, loading the mods found in the immediate sub directories of a mods directory.
 *
 * <p>Not thread safe, all calls are expected from the thread owning the content store.
 */
public class ModLoaderImpl implements ModLoader {
	private final Path modsDir;
	private final ContentStore store;
	private final ScriptRuntime scriptRuntime;
	private final Path baseContentDir;

	protected final Map<String, LoadedModImpl> modMap = new LinkedHashMap<>();
	private final Map<String, List<ModPatch>> patchMap = new HashMap<>();
	private final Map<String, List<Object>> scriptInstances = new HashMap<>();
	private final Map<String, ModLoadState> states = new HashMap<>();

	public ModLoaderImpl(Path modsDir, ContentStore store, /* @Nullable */ ScriptRuntime scriptRuntime) {
		this(modsDir, store, scriptRuntime, null);
	}

	/**
	 * @param baseContentDir directory with one sub directory per content type, searched by
	 *                       {@link #resolveContentPath} after all mods, may be null
	 */
	public ModLoaderImpl(Path modsDir, ContentStore store, /* @Nullable */ ScriptRuntime scriptRuntime, /* @Nullable */ Path baseContentDir) {
		if (modsDir == null) throw new NullPointerException("null modsDir");
		if (store == null) throw new NullPointerException("null store");

		this.modsDir = modsDir;
		this.store = store;
		this.scriptRuntime = scriptRuntime;
		this.baseContentDir = baseContentDir;
	}

	@Override
	public List<LoadedMod> loadAll() throws ModResolutionException {
		Log.info(LogCategory.GENERAL, "Scanning for mods in %s", modsDir);

		// discover mods

		ModDiscoverer discoverer = new ModDiscoverer();
		discoverer.addCandidateFinder(new DirectoryModCandidateFinder(modsDir));
		List<ModManifestImpl> manifests = discoverer.discoverMods();

		if (manifests.isEmpty()) {
			Log.info(LogCategory.GENERAL, "No mods found in %s", modsDir);
			return Collections.emptyList();
		}

		for (ModManifestImpl manifest : manifests) {
			advanceState(manifest.getId(), ModLoadState.VALIDATED);
		}

		// resolve mods, fails before anything is loaded

		List<ModManifestImpl> ordered = ModResolver.resolve(manifests);

		for (ModManifestImpl manifest : ordered) {
			advanceState(manifest.getId(), ModLoadState.ORDERED);
		}

		dumpModList(ordered);

		// drop duplicate ids, the first occurrence in load order wins

		Map<String, LoadedModImpl> toLoad = new LinkedHashMap<>();

		for (ModManifestImpl manifest : ordered) {
			LoadedMod existing = modMap.get(manifest.getId());
			if (existing == null) existing = toLoad.get(manifest.getId());

			if (existing != null) {
				Log.warn(LogCategory.GENERAL, "Skipping duplicate mod %s at %s, it is already provided by %s",
						manifest.getId(), manifest.getDirectory(), existing.getRootDirectory());
				continue;
			}

			toLoad.put(manifest.getId(), new LoadedModImpl(manifest));
		}

		// read content up front, patches only run once all of it is available

		Map<String, List<ContentDocument>> content = readContent(toLoad.values());

		// add mods

		List<LoadedMod> ret = new ArrayList<>(toLoad.size());

		for (LoadedModImpl mod : toLoad.values()) {
			loadMod(mod, content.getOrDefault(mod.getId(), Collections.emptyList()));
			ret.add(mod);
		}

		Log.info(LogCategory.GENERAL, "Loaded %d mod%s", ret.size(), ret.size() != 1 ? "s" : "");

		return ret;
	}

	private void advanceState(String modId, ModLoadState state) {
		ModLoadState current = states.get(modId);

		// a second loadAll must not demote already loaded mods
		if (current != ModLoadState.LOADED) {
			states.put(modId, state);
		}
	}

	private static void dumpModList(List<? extends ModManifest> mods) {
		StringBuilder modListText = new StringBuilder();

		for (ModManifest mod : mods) {
			modListText.append("\n\t- ").append(mod.getId()).append(' ').append(mod.getVersion().getFriendlyString());
		}

		int count = mods.size();
		Log.info(LogCategory.GENERAL, "Loading %d mod%s:%s", count, count != 1 ? "s" : "", modListText);
	}

	private static Map<String, List<ContentDocument>> readContent(Iterable<LoadedModImpl> mods) {
		List<ContentFolder> folders = new ArrayList<>();

		for (LoadedModImpl mod : mods) {
			for (Map.Entry<String, Path> entry : mod.getContentFolders().entrySet()) {
				folders.add(new ContentFolder(mod.getId(), entry.getKey(), entry.getValue()));
			}
		}

		Map<String, List<ContentDocument>> ret = new HashMap<>();
		if (folders.isEmpty()) return ret;

		for (ContentDocument doc : ContentDocumentLoader.readFolders(folders)) {
			ret.computeIfAbsent(doc.getOwner(), ignored -> new ArrayList<>()).add(doc);
		}

		return ret;
	}

	private void loadMod(LoadedModImpl mod, List<ContentDocument> content) {
		String id = mod.getId();
		ModManifest manifest = mod.getManifest();

		Log.info(LogCategory.GENERAL, "Loading mod %s", mod);

		try {
			List<ModPatch> patches = manifest.getPatches().isEmpty()
					? Collections.emptyList()
					: PatchFileLoader.loadModPatches(mod);
			patchMap.put(id, patches);

			if (!mod.getContentFolders().isEmpty()) {
				int count = ContentDocumentLoader.mergeInto(store, content);
				Log.info(LogCategory.CONTENT, "Registered %d content folder(s) with %d document(s) for mod %s",
						mod.getContentFolders().size(), count, id);
			}

			int applied = applyPatches(mod, patches);

			modMap.put(id, mod);
			states.put(id, ModLoadState.LOADED);

			List<Object> instances = loadScripts(mod);
			if (!instances.isEmpty()) scriptInstances.put(id, instances);

			Log.info(LogCategory.GENERAL, "Loaded mod %s (%s): %d/%d patch(es) applied, %d script(s), %d content folder(s)",
					id, manifest.getName(), applied, patches.size(), instances.size(), mod.getContentFolders().size());
		} catch (RuntimeException e) {
			// drop whatever got registered before the failure
			if (modMap.containsKey(id)) {
				unload(id);
			} else {
				patchMap.remove(id);
			}

			throw new RuntimeException(String.format("Failed to load mod %s", mod), e);
		}
	}

	private int applyPatches(LoadedMod mod, List<ModPatch> patches) {
		int applied = 0;

		for (ModPatch patch : patches) {
			String key = store.resolveTarget(patch.getTarget());

			if (key == null) {
				Log.warn(LogCategory.PATCH, "Patch %s of mod %s targets unknown document %s, skipping it",
						patch.getSource(), mod.getId(), patch.getTarget());
				continue;
			}

			DocumentNode document = store.getDocument(key);

			try {
				PatchApplicator.applyPatch(document, patch);
				applied++;
				Log.debug(LogCategory.PATCH, "Applied %s of mod %s to %s", patch, mod.getId(), key);
			} catch (PatchException e) {
				Log.error(LogCategory.PATCH, "Patch %s of mod %s failed on %s after %d operation(s): %s",
						patch.getSource(), mod.getId(), key, e.getAppliedOperations(), e.getMessage());
			}

			// operations before a failing one stay applied
			store.replaceDocument(key, document);
		}

		return applied;
	}

	private List<Object> loadScripts(LoadedModImpl mod) {
		List<String> scripts = mod.getManifest().getScripts();
		if (scripts.isEmpty()) return Collections.emptyList();

		if (scriptRuntime == null) {
			Log.warn(LogCategory.SCRIPT, "Mod %s declares %d script(s) but no script runtime is available, skipping them",
					mod.getId(), scripts.size());
			return Collections.emptyList();
		}

		Path root = LoaderUtil.normalizePath(modsDir);
		List<Object> ret = new ArrayList<>(scripts.size());

		for (String script : scripts) {
			Optional<Path> file = mod.resolvePath(script);

			if (!file.isPresent()) {
				Log.error(LogCategory.SCRIPT, "Mod %s declares script %s outside of its directory, skipping it", mod.getId(), script);
				continue;
			}

			if (!Files.isRegularFile(file.get())) {
				Log.error(LogCategory.SCRIPT, "Script file %s of mod %s not found", file.get(), mod.getId());
				continue;
			}

			String relativePath = LoaderUtil.toSlashPath(root, file.get());
			Object instance;

			try {
				instance = scriptRuntime.loadScript(relativePath);
			} catch (RuntimeException e) {
				Log.error(LogCategory.SCRIPT, "Failed to load script %s of mod %s", script, mod.getId(), e);
				continue;
			}

			if (instance == null) {
				Log.error(LogCategory.SCRIPT, "Failed to load script %s of mod %s", script, mod.getId());
				continue;
			}

			try {
				scriptRuntime.initializeScript(instance, new ModScriptContext(mod, this, store));
				Log.debug(LogCategory.SCRIPT, "Initialized script %s of mod %s (%s)", script, mod.getId(), instance.getClass().getName());
			} catch (RuntimeException e) {
				Log.error(LogCategory.SCRIPT, "Failed to initialize script %s of mod %s", script, mod.getId(), e);
			}

			ret.add(instance);
		}

		return ret;
	}

	@Override
	public boolean unload(String modId) {
		LoadedModImpl mod = modMap.remove(modId);

		if (mod == null) {
			Log.warn(LogCategory.GENERAL, "Mod %s is not loaded", modId);
			return false;
		}

		Log.info(LogCategory.GENERAL, "Unloading mod %s", modId);

		List<Object> instances = scriptInstances.remove(modId);

		if (instances != null) {
			for (Object instance : instances) {
				if (instance instanceof UnloadableScript) {
					try {
						((UnloadableScript) instance).onUnload();
					} catch (RuntimeException e) {
						Log.warn(LogCategory.SCRIPT, "Error while unloading script instance %s of mod %s", instance.getClass().getName(), modId, e);
					}
				}

				if (instance instanceof AutoCloseable) {
					try {
						((AutoCloseable) instance).close();
					} catch (Exception e) {
						Log.warn(LogCategory.SCRIPT, "Error while closing script instance %s of mod %s", instance.getClass().getName(), modId, e);
					}
				}
			}
		}

		patchMap.remove(modId);
		states.put(modId, ModLoadState.UNLOADED);
		Log.info(LogCategory.GENERAL, "Mod %s unloaded", modId);

		return true;
	}

	@Override
	public boolean reload(String modId) {
		LoadedModImpl mod = modMap.get(modId);

		if (mod == null) {
			Log.warn(LogCategory.GENERAL, "Can't reload mod %s, it isn't loaded", modId);
			return false;
		}

		Log.info(LogCategory.GENERAL, "Reloading mod %s", modId);

		unload(modId);

		LoadedModImpl fresh = new LoadedModImpl(mod.getManifest());
		loadMod(fresh, readContent(Collections.singletonList(fresh)).getOrDefault(modId, Collections.emptyList()));

		return isLoaded(modId);
	}

	@Override
	public boolean isLoaded(String modId) {
		return modMap.containsKey(modId);
	}

	@Override
	public Optional<ModManifest> getManifest(String modId) {
		LoadedModImpl mod = modMap.get(modId);

		return mod != null ? Optional.of(mod.getManifest()) : Optional.empty();
	}

	@Override
	public List<ModPatch> getPatches(String modId) {
		if (!modMap.containsKey(modId)) return Collections.emptyList();

		return ImmutableList.copyOf(patchMap.getOrDefault(modId, Collections.emptyList()));
	}

	@Override
	public Map<String, Path> getContentFolders(String modId) {
		LoadedModImpl mod = modMap.get(modId);

		return mod != null ? mod.getContentFolders() : Collections.emptyMap();
	}

	@Override
	public Optional<Path> getContentFolder(String modId, String contentType) {
		return Optional.ofNullable(getContentFolders(modId).get(contentType));
	}

	@Override
	public List<LoadedMod> getLoadedMods() {
		return ImmutableList.copyOf(modMap.values());
	}

	@Override
	public Optional<Path> resolveContentPath(String contentType, String relativePath) {
		for (LoadedModImpl mod : Lists.reverse(new ArrayList<>(modMap.values()))) {
			Path folder = mod.getContentFolders().get(contentType);
			if (folder == null) continue;

			Path file = LoaderUtil.resolveWithin(folder, relativePath);

			if (file != null && Files.isRegularFile(file)) {
				Log.debug(LogCategory.CONTENT, "Resolved %s/%s from mod %s", contentType, relativePath, mod.getId());
				return Optional.of(file);
			}
		}

		if (baseContentDir != null) {
			Path file = LoaderUtil.resolveWithin(baseContentDir, contentType + "/" + relativePath);

			if (file != null && Files.isRegularFile(file)) {
				return Optional.of(file);
			}
		}

		return Optional.empty();
	}

	@Override
	public Optional<ModLoadState> getState(String modId) {
		return Optional.ofNullable(states.get(modId));
	}
}
