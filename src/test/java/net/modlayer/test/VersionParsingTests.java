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

package net.modlayer.test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import net.modlayer.loader.api.Version;
import net.modlayer.loader.api.VersionParsingException;
import net.modlayer.loader.api.metadata.version.VersionComparisonOperator;
import net.modlayer.loader.impl.metadata.ModDependencyImpl;
import net.modlayer.loader.impl.metadata.ParseMetadataException;

public class VersionParsingTests {
	private static Version parse(String s) {
		try {
			return Version.parse(s);
		} catch (VersionParsingException e) {
			throw new RuntimeException("Test failed!", e);
		}
	}

	@Test
	public void parseValid() {
		Version version = parse("1.2.3");
		assertEquals(1, version.getVersionComponent(0));
		assertEquals(2, version.getVersionComponent(1));
		assertEquals(3, version.getVersionComponent(2));
		assertFalse(version.getPrereleaseKey().isPresent());

		version = parse("0.4.0-beta.2+git.abc");
		assertEquals("beta.2", version.getPrereleaseKey().get());
		assertEquals("git.abc", version.getBuildKey().get());
		assertEquals("0.4.0-beta.2+git.abc", version.getFriendlyString());

		// only the leading major.minor.patch matters
		version = parse("2.0.0.1");
		assertEquals(2, version.getVersionComponent(0));
		assertFalse(version.getPrereleaseKey().isPresent());
	}

	@Test
	public void parseInvalid() {
		assertThrows(VersionParsingException.class, () -> Version.parse("1.0"));
		assertThrows(VersionParsingException.class, () -> Version.parse("v1.0.0"));
		assertThrows(VersionParsingException.class, () -> Version.parse(""));
	}

	@Test
	public void parseMalformedSuffix() {
		for (String s : new String[] { "1.0.0-rc_1", "1.0.0-", "1.0.0+", "1.0.0-beta!", "1.0.0+bad..build", "1.0.0 beta" }) {
			Version version = parse(s);

			assertEquals(s, version.getFriendlyString());
			assertFalse(version.getPrereleaseKey().isPresent(), () -> s + " must not carry a prerelease");
			assertFalse(version.getBuildKey().isPresent(), () -> s + " must not carry build metadata");
			assertEquals(0, version.compareTo(parse("1.0.0")), () -> s + " must compare like 1.0.0");
		}
	}

	@Test
	public void parseLargeComponents() {
		Version version = parse("99999999999.0.0");
		assertEquals(Integer.MAX_VALUE, version.getVersionComponent(0));
		assertEquals(Integer.MAX_VALUE, parse("2147483648.0.0").getVersionComponent(0));
		assertEquals(2147483647, parse("2147483647.0.0").getVersionComponent(0));
		assertEquals(1, parse("0001.2.3").getVersionComponent(0));
		assertEquals(0, parse("000.0.0").getVersionComponent(0));
		assertTrue(version.compareTo(parse("1.0.0")) > 0);
	}

	@Test
	public void compare() {
		assertTrue(parse("1.0.0").compareTo(parse("1.0.1")) < 0);
		assertTrue(parse("1.10.0").compareTo(parse("1.9.0")) > 0);
		assertTrue(parse("1.0.0-beta").compareTo(parse("1.0.0")) < 0);
		assertTrue(parse("1.0.0-alpha").compareTo(parse("1.0.0-beta")) < 0);
		assertTrue(parse("1.0.0-beta.2").compareTo(parse("1.0.0-beta.11")) < 0);
		assertTrue(parse("1.0.0-beta.2").compareTo(parse("1.0.0-beta.2.1")) < 0);
		assertEquals(0, parse("1.0.0+a").compareTo(parse("1.0.0+b")), "Build metadata must not affect ordering");
	}

	@Test
	public void operators() {
		Version one = parse("1.0.0");
		Version two = parse("2.0.0");

		assertTrue(VersionComparisonOperator.GREATER_EQUAL.test(two, one));
		assertTrue(VersionComparisonOperator.GREATER_EQUAL.test(one, one));
		assertFalse(VersionComparisonOperator.GREATER.test(one, one));
		assertTrue(VersionComparisonOperator.LESS.test(one, two));
		assertTrue(VersionComparisonOperator.LESS_EQUAL.test(one, one));
		assertTrue(VersionComparisonOperator.EQUAL.test(one, parse("1.0.0")));
		assertFalse(VersionComparisonOperator.EQUAL.test(one, two));

		assertEquals(VersionComparisonOperator.EQUAL, VersionComparisonOperator.bySymbol("="));
		assertEquals(VersionComparisonOperator.EQUAL, VersionComparisonOperator.bySymbol("=="));
		assertEquals("==", VersionComparisonOperator.EQUAL.getSerialized());
		assertNull(VersionComparisonOperator.bySymbol("~"));
	}

	@Test
	public void dependencyDeclarations() throws ParseMetadataException {
		ModDependencyImpl bare = ModDependencyImpl.parse("core-lib");
		assertEquals("core-lib", bare.getModId());
		assertTrue(bare.matches(parse("0.0.1")), "A bare dependency accepts any version");

		ModDependencyImpl constrained = ModDependencyImpl.parse("  core-lib>=1.2.0 ");
		assertEquals("core-lib", constrained.getModId());
		assertEquals(VersionComparisonOperator.GREATER_EQUAL, constrained.getOperator());
		assertTrue(constrained.matches(parse("1.2.0")));
		assertTrue(constrained.matches(parse("1.3.0")));
		assertFalse(constrained.matches(parse("1.1.9")));
		assertEquals("core-lib>=1.2.0", constrained.toString());

		assertThrows(ParseMetadataException.class, () -> ModDependencyImpl.parse("core-lib >="));
		assertThrows(ParseMetadataException.class, () -> ModDependencyImpl.parse("core-lib ~ 1.0.0"));
		assertThrows(ParseMetadataException.class, () -> ModDependencyImpl.parse(""));
	}
}
