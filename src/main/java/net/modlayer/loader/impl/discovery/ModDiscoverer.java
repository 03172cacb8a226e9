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

package net.modlayer.loader.impl.discovery;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import net.modlayer.loader.impl.FormattedException;
import net.modlayer.loader.impl.metadata.ModManifestImpl;
import net.modlayer.loader.impl.metadata.ModManifestParser;
import net.modlayer.loader.impl.metadata.ParseMetadataException;
import net.modlayer.loader.impl.util.ExceptionUtil;
import net.modlayer.loader.impl.util.SystemProperties;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.LogCategory;

/**
 * Finds mod directories and reads their manifests.
 *
 * <p>Manifests are parsed in parallel, the result keeps the order in which the candidate finders proposed the
 * directories. Directories without a manifest and manifests that fail to parse or validate are logged and skipped.
 */
public final class ModDiscoverer {
	private final List<ModCandidateFinder> candidateFinders = new ArrayList<>();

	public void addCandidateFinder(ModCandidateFinder f) {
		candidateFinders.add(f);
	}

	public List<ModManifestImpl> discoverMods() throws ModResolutionException {
		long startTime = System.nanoTime();
		ForkJoinPool pool = new ForkJoinPool();
		Set<Path> processedPaths = new HashSet<>(); // suppresses duplicate paths
		List<Future<ModManifestImpl>> futures = new ArrayList<>();

		ModCandidateFinder.ModCandidateConsumer taskSubmitter = path -> {
			if (processedPaths.add(path)) {
				futures.add(pool.submit(new ManifestScanTask(path)));
			}
		};

		try {
			for (ModCandidateFinder finder : candidateFinders) {
				finder.findCandidates(taskSubmitter);
			}
		} catch (RuntimeException e) {
			pool.shutdownNow();
			throw e;
		}

		List<ModManifestImpl> manifests = new ArrayList<>(futures.size());
		ModResolutionException exception = null;

		int timeout = Integer.getInteger(SystemProperties.DEBUG_DISCOVERY_TIMEOUT, 60);
		if (timeout <= 0) timeout = Integer.MAX_VALUE;

		try {
			pool.shutdown();

			pool.awaitTermination(timeout, TimeUnit.SECONDS);

			for (Future<ModManifestImpl> future : futures) {
				if (!future.isDone()) {
					throw new TimeoutException();
				}

				try {
					ModManifestImpl manifest = future.get();
					if (manifest != null) manifests.add(manifest);
				} catch (ExecutionException e) {
					exception = ExceptionUtil.gatherExceptions(e, exception, exc -> new ModResolutionException("Mod discovery failed!", exc));
				}
			}
		} catch (TimeoutException e) {
			throw new FormattedException("Mod discovery took too long!",
					"Reading the mod manifests took longer than %d seconds. The timeout can be changed with the system property %s (-D%<s=<desired timeout in seconds>).",
					timeout, SystemProperties.DEBUG_DISCOVERY_TIMEOUT);
		} catch (InterruptedException e) {
			throw new FormattedException("Mod discovery interrupted!", e);
		}

		if (exception != null) throw exception;

		// get optional set of disabled mod ids
		Set<String> disabledModIds = findDisabledModIds();
		List<ModManifestImpl> ret = new ArrayList<>(manifests.size());

		for (ModManifestImpl manifest : manifests) {
			if (disabledModIds.contains(manifest.getId())) {
				Log.info(LogCategory.DISCOVERY, "Skipping disabled mod %s", manifest.getId());
				continue;
			}

			ret.add(manifest);
		}

		long endTime = System.nanoTime();

		Log.debug(LogCategory.DISCOVERY, "Mod discovery time: %.1f ms", (endTime - startTime) * 1e-6);

		return ret;
	}

	// retrieve set of disabled mod ids from system property
	private static Set<String> findDisabledModIds() {
		String modIdList = System.getProperty(SystemProperties.DISABLE_MOD_IDS);

		if (modIdList == null) {
			return Collections.emptySet();
		}

		Set<String> disabledModIds = Arrays.stream(modIdList.split(","))
				.map(String::trim)
				.filter(s -> !s.isEmpty())
				.collect(Collectors.toSet());
		Log.debug(LogCategory.DISCOVERY, "Disabled mod ids: %s", disabledModIds);
		return disabledModIds;
	}

	@SuppressWarnings("serial")
	static final class ManifestScanTask extends RecursiveTask<ModManifestImpl> {
		private final Path modDir;

		ManifestScanTask(Path modDir) {
			this.modDir = modDir;
		}

		@Override
		protected ModManifestImpl compute() {
			if (!Files.isRegularFile(modDir.resolve(ModManifestParser.MANIFEST_FILE))) {
				Log.debug(LogCategory.DISCOVERY, "Skipping %s, it has no %s", modDir, ModManifestParser.MANIFEST_FILE);
				return null;
			}

			try {
				ModManifestImpl ret = ModManifestParser.parseManifest(modDir);
				Log.debug(LogCategory.DISCOVERY, "Discovered mod %s at %s", ret, modDir);

				return ret;
			} catch (ParseMetadataException e) {
				Log.error(LogCategory.DISCOVERY, "Skipping invalid mod: %s", e.getMessage());
				return null;
			}
		}
	}
}
