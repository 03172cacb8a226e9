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

import java.util.Optional;

import net.modlayer.loader.api.metadata.ModManifest;
import net.modlayer.loader.impl.util.version.SemanticVersionImpl;

/**
 * Represents a version of a mod.
 *
 * <p>A version starts with three dot separated numeric components ({@code major.minor.patch}), optionally followed
 * by a {@code -prerelease} and {@code +build} suffix. Any other trailing text, a malformed suffix included, is kept
 * for display but ignored when comparing. Components too large for an {@code int} are clamped.
 *
 * @see ModManifest#getVersion()
 */
public interface Version extends Comparable<Version> {
	/**
	 * Returns the user-friendly representation of this version, exactly as declared.
	 */
	String getFriendlyString();

	/**
	 * Returns the numeric component at {@code pos}, 0 for major, 1 for minor and 2 for patch.
	 */
	int getVersionComponent(int pos);

	Optional<String> getPrereleaseKey();

	Optional<String> getBuildKey();

	/**
	 * Parses a version from a string notation.
	 *
	 * @param string the string notation of the version
	 * @return the parsed version
	 * @throws VersionParsingException if the string doesn't start with {@code major.minor.patch}
	 */
	static Version parse(String string) throws VersionParsingException {
		return SemanticVersionImpl.parse(string);
	}
}
