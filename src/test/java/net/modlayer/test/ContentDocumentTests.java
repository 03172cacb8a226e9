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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.impl.content.ContentDocumentCache;
import net.modlayer.loader.impl.content.ContentDocumentLoader;
import net.modlayer.loader.impl.content.ContentDocumentLoader.ContentDocument;
import net.modlayer.loader.impl.content.ContentFolder;
import net.modlayer.loader.impl.document.DocumentParser;
import net.modlayer.loader.impl.document.DocumentSerializer;
import net.modlayer.loader.impl.util.log.LogLevel;

public class ContentDocumentTests {
	@TempDir
	Path tempDir;

	private CapturingLogHandler log;

	@BeforeEach
	public void setup() {
		log = CapturingLogHandler.install();
	}

	@AfterEach
	public void tearDown() {
		CapturingLogHandler.uninstall();
	}

	@Test
	@DisplayName("Adding a key twice is rejected, replacing is not")
	public void addAndReplace() throws IOException {
		ContentDocumentCache cache = new ContentDocumentCache();
		DocumentNode first = DocumentParser.parse("{\"hp\":10}");
		DocumentNode second = DocumentParser.parse("{\"hp\":20}");

		cache.addDocument("Templates/guard", first);
		assertThrows(IllegalArgumentException.class, () -> cache.addDocument("Templates/guard", second));
		assertSame(first, cache.getDocument("Templates/guard"), "A rejected add must not change the stored document");

		cache.replaceDocument("Templates/guard", second);
		assertSame(second, cache.getDocument("Templates/guard"));
		assertEquals(1, cache.size());

		cache.replaceDocument("Templates/new", first);
		assertTrue(cache.containsDocument("Templates/new"), "Replacing an absent key must store it");
		assertSame(first, cache.removeDocument("Templates/new"));
		assertFalse(cache.containsDocument("Templates/new"));
		assertNull(cache.getDocument("Templates/missing"));
	}

	@Test
	@DisplayName("Patch targets resolve by key or by id field")
	public void resolveTarget() throws IOException {
		ContentDocumentCache cache = new ContentDocumentCache();
		cache.addDocument("Templates/npcs/guard", DocumentParser.parse("{\"templateId\":\"guard\"}"));
		cache.addDocument("Templates/npcs/guard2", DocumentParser.parse("{\"templateId\":\"guard\"}"));
		cache.addDocument("Templates/list", DocumentParser.parse("[\"templateId\"]"));
		cache.addDocument("Templates/numeric", DocumentParser.parse("{\"templateId\":7}"));

		assertEquals("Templates/npcs/guard", cache.resolveTarget("Templates/npcs/guard"));
		assertEquals("Templates/npcs/guard", cache.resolveTarget("guard"), "The first document carrying the id must win");
		assertNull(cache.resolveTarget("7"), "Only string ids are matched");
		assertNull(cache.resolveTarget("nothing"));
	}

	@Test
	@DisplayName("Id matching uses the configured field or can be disabled")
	public void customIdField() throws IOException {
		ContentDocumentCache custom = new ContentDocumentCache("name");
		custom.addDocument("Maps/forest", DocumentParser.parse("{\"name\":\"Forest\",\"templateId\":\"forest\"}"));

		assertEquals("Maps/forest", custom.resolveTarget("Forest"));
		assertNull(custom.resolveTarget("forest"));

		ContentDocumentCache keysOnly = new ContentDocumentCache(null);
		keysOnly.addDocument("Maps/forest", DocumentParser.parse("{\"templateId\":\"forest\"}"));

		assertEquals("Maps/forest", keysOnly.resolveTarget("Maps/forest"));
		assertNull(keysOnly.resolveTarget("forest"));
	}

	@Test
	@DisplayName("Keys are built from content type and relative path")
	public void keys() {
		assertEquals("Templates/npcs/guard", ContentDocumentLoader.toKey("Templates", "npcs/guard.json"));
		assertEquals("Maps/forest", ContentDocumentLoader.toKey("Maps", "forest.json"));
		assertEquals("Maps/readme", ContentDocumentLoader.toKey("Maps", "readme"));
	}

	@Test
	@DisplayName("Folders are read in order, files sorted by relative path")
	public void readFolders() {
		Path templates = tempDir.resolve("a/templates");
		TestMods.write(templates.resolve("zombie.json"), "{\"templateId\":\"zombie\"}");
		TestMods.write(templates.resolve("npcs/guard.json"), "{\"templateId\":\"guard\"}");
		TestMods.write(templates.resolve("npcs/archer.json"), "{\"templateId\":\"archer\"}");
		TestMods.write(templates.resolve("notes.txt"), "not content");
		TestMods.write(templates.resolve(".hidden.json"), "{}");
		TestMods.write(templates.resolve("broken.json"), "{\"templateId\":");

		Path maps = tempDir.resolve("a/maps");
		TestMods.write(maps.resolve("forest.json"), "{\"size\":3}");

		List<ContentDocument> docs = ContentDocumentLoader.readFolders(Arrays.asList(
				new ContentFolder("a", "Templates", templates),
				new ContentFolder("a", "Maps", maps),
				new ContentFolder("a", "Missing", tempDir.resolve("a/missing"))));

		List<String> keys = new ArrayList<>();

		for (ContentDocument doc : docs) {
			keys.add(doc.getKey());
			assertEquals("a", doc.getOwner());
		}

		assertEquals(Arrays.asList("Templates/npcs/archer", "Templates/npcs/guard", "Templates/zombie", "Maps/forest"), keys);
		assertTrue(log.contains(LogLevel.WARN, "broken.json"), "Unparsable documents must be reported: " + log);
		assertTrue(log.contains(LogLevel.WARN, "doesn't exist"), "Missing folders must be reported: " + log);
	}

	@Test
	@DisplayName("Later documents override earlier ones with the same key")
	public void mergeOverrides() {
		Path base = tempDir.resolve("base/Templates");
		TestMods.write(base.resolve("guard.json"), "{\"hp\":10}");
		TestMods.write(base.resolve("archer.json"), "{\"hp\":5}");

		Path mod = tempDir.resolve("mod/content");
		TestMods.write(mod.resolve("guard.json"), "{\"hp\":99}");

		ContentDocumentCache cache = new ContentDocumentCache();
		assertEquals(2, ContentDocumentLoader.mergeInto(cache,
				ContentDocumentLoader.readFolders(Collections.singletonList(new ContentFolder("base", "Templates", base)))));
		assertEquals(1, ContentDocumentLoader.mergeInto(cache,
				ContentDocumentLoader.readFolders(Collections.singletonList(new ContentFolder("mod", "Templates", mod)))));

		assertEquals(2, cache.size());
		assertEquals("{\"hp\":99}", DocumentSerializer.toJson(cache.getDocument("Templates/guard")));
		assertEquals("{\"hp\":5}", DocumentSerializer.toJson(cache.getDocument("Templates/archer")));
		assertEquals(Arrays.asList("Templates/archer", "Templates/guard"), new ArrayList<>(cache.getKeys()));
	}
}
