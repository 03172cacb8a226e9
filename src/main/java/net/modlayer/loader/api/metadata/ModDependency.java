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

import net.modlayer.loader.api.Version;
import net.modlayer.loader.api.metadata.version.VersionComparisonOperator;

/**
 * Hard dependency of a mod on another mod, declared as {@code "id"} or {@code "id <op> version"}.
 */
public interface ModDependency {
	/**
	 * Returns the ID of the mod to check.
	 */
	String getModId();

	/**
	 * Returns the version comparison operator or null if any version is accepted.
	 */
	VersionComparisonOperator getOperator();

	/**
	 * Returns the version the operator compares against or null if any version is accepted.
	 */
	Version getVersion();

	/**
	 * Checks if a version satisfies this dependency.
	 */
	boolean matches(Version version);
}
