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

import java.util.List;

import com.google.common.collect.ImmutableList;

import net.modlayer.loader.api.Version;
import net.modlayer.loader.api.metadata.ModDependency;

/**
 * Fatal failure to discover mods or to compute their load order, no mod gets loaded.
 */
@SuppressWarnings("serial")
public class ModResolutionException extends Exception {
	public ModResolutionException(String s) {
		super(s);
	}

	public ModResolutionException(Throwable t) {
		super(t);
	}

	public ModResolutionException(String s, Throwable t) {
		super(s, t);
	}

	public ModResolutionException(String format, Object... args) {
		super(String.format(format, args));
	}

	/**
	 * A mod depends on an id no discovered mod has.
	 */
	public static class MissingDependency extends ModResolutionException {
		private final String modId;
		private final String dependencyId;

		public MissingDependency(String modId, ModDependency dependency) {
			super(String.format("Mod '%s' depends on '%s', which is missing", modId, dependency.getModId()));

			this.modId = modId;
			this.dependencyId = dependency.getModId();
		}

		public String getModId() {
			return modId;
		}

		public String getDependencyId() {
			return dependencyId;
		}
	}

	/**
	 * A mod depends on a present mod whose version doesn't satisfy the declared constraint.
	 */
	public static class UnsatisfiedDependency extends ModResolutionException {
		private final String modId;
		private final ModDependency dependency;
		private final Version presentVersion;

		public UnsatisfiedDependency(String modId, ModDependency dependency, Version presentVersion) {
			super(String.format("Mod '%s' depends on '%s', but version %s is present",
					modId, dependency, presentVersion.getFriendlyString()));

			this.modId = modId;
			this.dependency = dependency;
			this.presentVersion = presentVersion;
		}

		public String getModId() {
			return modId;
		}

		public ModDependency getDependency() {
			return dependency;
		}

		public Version getPresentVersion() {
			return presentVersion;
		}
	}

	/**
	 * Hard dependencies form a cycle.
	 */
	public static class CircularDependency extends ModResolutionException {
		private final List<String> cycle;

		/**
		 * @param cycle mod ids along the cycle, the first id repeated at the end
		 */
		public CircularDependency(List<String> cycle) {
			super("Circular dependency detected: " + String.join(" -> ", cycle));

			this.cycle = ImmutableList.copyOf(cycle);
		}

		public List<String> getCycle() {
			return cycle;
		}
	}
}
