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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import net.modlayer.loader.api.metadata.ModDependency;
import net.modlayer.loader.api.metadata.ModManifest;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.LogCategory;

/**
 * Computes the load order of validated manifests.
 *
 * <p>Manifests are stably sorted by priority (lower first), then a depth first traversal in that order emits every
 * manifest after its hard dependencies and after the present targets of its {@code loadAfter} hints.
 * {@code loadBefore} is not consulted.
 */
public final class ModResolver {
	private enum VisitState {
		VISITING,
		DONE
	}

	public static <T extends ModManifest> List<T> resolve(Collection<T> manifests) throws ModResolutionException {
		long startTime = System.nanoTime();
		List<T> result = new ModResolver.Traversal<>(manifests).run();

		long endTime = System.nanoTime();
		Log.debug(LogCategory.RESOLUTION, "Mod resolution time: %.1f ms", (endTime - startTime) * 1e-6);

		return result;
	}

	private static final class Traversal<T extends ModManifest> {
		private final List<T> sorted;
		private final Map<String, T> modsById = new HashMap<>();
		// keyed by instance, mods sharing an id are still visited and emitted individually
		private final Map<T, VisitState> states = new IdentityHashMap<>();
		private final List<T> path = new ArrayList<>();
		private final List<T> result;

		Traversal(Collection<T> manifests) {
			sorted = new ArrayList<>(manifests);
			sorted.sort(Comparator.comparingInt(ModManifest::getPriority)); // stable, ties keep discovery order

			for (T mod : sorted) {
				modsById.putIfAbsent(mod.getId(), mod);
			}

			result = new ArrayList<>(sorted.size());
		}

		List<T> run() throws ModResolutionException {
			for (T mod : sorted) {
				if (!states.containsKey(mod)) {
					visit(mod);
				}
			}

			return result;
		}

		private void visit(T mod) throws ModResolutionException {
			states.put(mod, VisitState.VISITING);
			path.add(mod);

			for (ModDependency dep : mod.getDependencies()) {
				T target = modsById.get(dep.getModId());

				if (target == null) {
					throw new ModResolutionException.MissingDependency(mod.getId(), dep);
				}

				VisitState state = states.get(target);

				if (state == null) {
					visit(target);
				} else if (state == VisitState.VISITING) {
					throw new ModResolutionException.CircularDependency(describeCycle(target));
				}

				if (!dep.matches(target.getVersion())) {
					throw new ModResolutionException.UnsatisfiedDependency(mod.getId(), dep, target.getVersion());
				}
			}

			for (String id : mod.getLoadAfter()) {
				T target = modsById.get(id);

				if (target == null) {
					Log.debug(LogCategory.RESOLUTION, "Ignoring loadAfter %s of mod %s, no such mod", id, mod.getId());
					continue;
				}

				VisitState state = states.get(target);

				if (state == null) {
					visit(target);
				} else if (state == VisitState.VISITING) {
					Log.debug(LogCategory.RESOLUTION, "Ignoring loadAfter %s of mod %s, it is already being ordered before it", id, mod.getId());
				}
			}

			if (!mod.getLoadBefore().isEmpty()) {
				Log.debug(LogCategory.RESOLUTION, "Mod %s declares loadBefore %s, which doesn't affect load order", mod.getId(), mod.getLoadBefore());
			}

			path.remove(path.size() - 1);
			states.put(mod, VisitState.DONE);
			result.add(mod);
		}

		private List<String> describeCycle(T target) {
			List<String> ret = new ArrayList<>();
			boolean inCycle = false;

			for (T mod : path) {
				if (mod == target) inCycle = true;
				if (inCycle) ret.add(mod.getId());
			}

			ret.add(target.getId());

			return ret;
		}
	}

	private ModResolver() {
	}
}
