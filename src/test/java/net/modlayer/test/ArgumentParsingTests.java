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

import java.util.Collections;

import org.junit.jupiter.api.Test;

import net.modlayer.loader.impl.util.Arguments;

public class ArgumentParsingTests {
	@Test
	public void parseNormal() {
		Arguments arguments = new Arguments();
		arguments.parse(new String[]{"--mods", "run/mods", "--content", "run/content", "--idField", "templateId"});
		arguments.put("idField", "name");

		assertEquals(3, arguments.keys().size());
		assertEquals("run/mods", arguments.get(Arguments.MODS));
		assertEquals("run/content", arguments.get(Arguments.CONTENT));
		assertEquals("name", arguments.get(Arguments.ID_FIELD));
	}

	@Test
	public void parseMissing() {
		Arguments arguments = new Arguments();
		arguments.parse(new String[]{"--mods", "run/mods", "--dump", "--content", "run/content"});

		assertEquals(3, arguments.keys().size());
		assertEquals("", arguments.get(Arguments.DUMP));
		assertEquals("run/content", arguments.get(Arguments.CONTENT));
	}

	@Test
	public void parseTrailingKeyAndExtras() {
		Arguments arguments = new Arguments();
		arguments.parse(new String[]{"verbose", "--mods", "run/mods", "--dump"});

		assertEquals("", arguments.get(Arguments.DUMP));
		assertEquals(Collections.singletonList("verbose"), arguments.getExtraArgs());
		assertNull(arguments.get(Arguments.CONTENT));
		assertFalse(arguments.containsKey(Arguments.CONTENT));
		assertEquals("fallback", arguments.getOrDefault(Arguments.CONTENT, "fallback"));
	}
}
