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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import net.modlayer.loader.api.Version;
import net.modlayer.loader.api.VersionParsingException;
import net.modlayer.loader.api.metadata.ModDependency;
import net.modlayer.loader.api.metadata.version.VersionComparisonOperator;

public final class ModDependencyImpl implements ModDependency {
	// id, optionally followed by an operator and the version it compares against
	private static final Pattern DECLARATION = Pattern.compile("^\\s*([^\\s<>=]+)\\s*(?:(>=|<=|==|=|>|<)\\s*(\\S+))?\\s*$");

	private final String modId;
	private final VersionComparisonOperator operator;
	private final Version version;
	private final String declaration;

	public ModDependencyImpl(String modId, /* @Nullable */ VersionComparisonOperator operator, /* @Nullable */ Version version, String declaration) {
		if ((operator == null) != (version == null)) throw new IllegalArgumentException("operator and version must be set together");

		this.modId = modId;
		this.operator = operator;
		this.version = version;
		this.declaration = declaration;
	}

	/**
	 * Parses a dependency declaration such as {@code core} or {@code core >= 1.2.0}.
	 */
	public static ModDependencyImpl parse(String declaration) throws ParseMetadataException {
		Matcher matcher = DECLARATION.matcher(declaration);

		if (!matcher.matches()) {
			throw new ParseMetadataException(String.format("Invalid dependency \"%s\", expected \"id\" or \"id <op> version\"", declaration));
		}

		String modId = matcher.group(1);
		String op = matcher.group(2);

		if (op == null) {
			return new ModDependencyImpl(modId, null, null, declaration.trim());
		}

		Version version;

		try {
			version = Version.parse(matcher.group(3));
		} catch (VersionParsingException e) {
			throw new ParseMetadataException(String.format("Invalid version in dependency \"%s\"", declaration), e);
		}

		return new ModDependencyImpl(modId, VersionComparisonOperator.bySymbol(op), version, declaration.trim());
	}

	@Override
	public String getModId() {
		return modId;
	}

	@Override
	public VersionComparisonOperator getOperator() {
		return operator;
	}

	@Override
	public Version getVersion() {
		return version;
	}

	@Override
	public boolean matches(Version version) {
		return operator == null || operator.test(version, this.version);
	}

	@Override
	public String toString() {
		return declaration;
	}
}
