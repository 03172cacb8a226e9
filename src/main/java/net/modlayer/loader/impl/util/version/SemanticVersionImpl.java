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

package net.modlayer.loader.impl.util.version;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;
import java.util.StringTokenizer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.base.CharMatcher;

import net.modlayer.loader.api.Version;
import net.modlayer.loader.api.VersionParsingException;

public final class SemanticVersionImpl implements Version {
	/**
	 * Required version prefix, checked against the start of the declared string.
	 */
	public static final Pattern VERSION_PREFIX = Pattern.compile("^(\\d+)\\.(\\d+)\\.(\\d+)");
	private static final Pattern DOT_SEPARATED_ID = Pattern.compile("[-0-9A-Za-z]+(\\.[-0-9A-Za-z]+)*");
	private static final Pattern UNSIGNED_INTEGER = Pattern.compile("0|[1-9][0-9]*");

	private final int[] components;
	private final String prerelease;
	private final String build;
	private final String friendlyName;

	public static SemanticVersionImpl parse(String version) throws VersionParsingException {
		if (version == null) throw new VersionParsingException("Version must not be null!");

		Matcher matcher = VERSION_PREFIX.matcher(version);

		if (!matcher.find()) {
			throw new VersionParsingException("Version '" + version + "' doesn't start with major.minor.patch!");
		}

		int[] components = new int[3];

		for (int i = 0; i < components.length; i++) {
			components[i] = parseComponent(matcher.group(i + 1));
		}

		String rest = version.substring(matcher.end());
		String prerelease = null;
		String build = null;

		if (rest.startsWith("-") || rest.startsWith("+")) {
			int buildDelimPos = rest.indexOf('+');

			if (buildDelimPos >= 0) {
				build = rest.substring(buildDelimPos + 1);
				rest = rest.substring(0, buildDelimPos);
			}

			if (rest.startsWith("-")) {
				prerelease = rest.substring(1);
			}

			// a malformed suffix is plain trailing text, kept for display only
			if (prerelease != null && !DOT_SEPARATED_ID.matcher(prerelease).matches()
					|| build != null && !DOT_SEPARATED_ID.matcher(build).matches()) {
				prerelease = null;
				build = null;
			}
		}

		return new SemanticVersionImpl(components, prerelease, build, version);
	}

	/**
	 * Components beyond {@link Integer#MAX_VALUE} are clamped to it.
	 */
	private static int parseComponent(String digits) {
		String trimmed = CharMatcher.is('0').trimLeadingFrom(digits);

		if (trimmed.isEmpty()) return 0;
		if (trimmed.length() > 10) return Integer.MAX_VALUE;

		return (int) Math.min(Long.parseLong(trimmed), Integer.MAX_VALUE);
	}

	private SemanticVersionImpl(int[] components, String prerelease, String build, String friendlyName) {
		this.components = components;
		this.prerelease = prerelease;
		this.build = build;
		this.friendlyName = friendlyName;
	}

	@Override
	public int getVersionComponent(int pos) {
		if (pos < 0) {
			throw new IllegalArgumentException("Tried to access negative version number component!");
		} else if (pos >= components.length) {
			return 0;
		} else {
			return components[pos];
		}
	}

	@Override
	public Optional<String> getPrereleaseKey() {
		return Optional.ofNullable(prerelease);
	}

	@Override
	public Optional<String> getBuildKey() {
		return Optional.ofNullable(build);
	}

	@Override
	public String getFriendlyString() {
		return friendlyName;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof SemanticVersionImpl)) {
			return false;
		} else {
			SemanticVersionImpl other = (SemanticVersionImpl) o;

			return Arrays.equals(components, other.components)
					&& Objects.equals(prerelease, other.prerelease)
					&& Objects.equals(build, other.build);
		}
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(components) * 73 + (prerelease != null ? prerelease.hashCode() * 11 : 0) + (build != null ? build.hashCode() : 0);
	}

	@Override
	public String toString() {
		return getFriendlyString();
	}

	@Override
	public int compareTo(Version o) {
		for (int i = 0; i < components.length; i++) {
			int compare = Integer.compare(getVersionComponent(i), o.getVersionComponent(i));
			if (compare != 0) return compare;
		}

		Optional<String> prereleaseA = getPrereleaseKey();
		Optional<String> prereleaseB = o.getPrereleaseKey();

		if (prereleaseA.isPresent() && prereleaseB.isPresent()) {
			StringTokenizer prereleaseATokenizer = new StringTokenizer(prereleaseA.get(), ".");
			StringTokenizer prereleaseBTokenizer = new StringTokenizer(prereleaseB.get(), ".");

			while (prereleaseATokenizer.hasMoreElements()) {
				if (prereleaseBTokenizer.hasMoreElements()) {
					String partA = prereleaseATokenizer.nextToken();
					String partB = prereleaseBTokenizer.nextToken();

					if (UNSIGNED_INTEGER.matcher(partA).matches()) {
						if (UNSIGNED_INTEGER.matcher(partB).matches()) {
							int compare = Integer.compare(partA.length(), partB.length());
							if (compare != 0) return compare;
						} else {
							return -1;
						}
					} else {
						if (UNSIGNED_INTEGER.matcher(partB).matches()) {
							return 1;
						}
					}

					int compare = partA.compareTo(partB);
					if (compare != 0) return compare;
				} else {
					return 1;
				}
			}

			return prereleaseBTokenizer.hasMoreElements() ? -1 : 0;
		} else if (prereleaseA.isPresent()) {
			return -1; // 1.0.0-beta < 1.0.0
		} else if (prereleaseB.isPresent()) {
			return 1;
		} else {
			return 0;
		}
	}
}
