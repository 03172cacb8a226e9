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
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import net.modlayer.loader.impl.launch.ModLayerMain;
import net.modlayer.loader.impl.util.log.LogLevel;

public class ModLayerMainTests {
	@TempDir
	Path tempDir;

	private Path modsDir;
	private Path contentDir;
	private CapturingLogHandler log;
	private ByteArrayOutputStream output;

	@BeforeEach
	public void setup() throws IOException {
		modsDir = Files.createDirectories(tempDir.resolve("mods"));
		contentDir = Files.createDirectories(tempDir.resolve("content"));
		log = CapturingLogHandler.install();
		output = new ByteArrayOutputStream();

		TestMods.write(contentDir.resolve("Templates/npcs/guard.json"), "{\"templateId\":\"guard\",\"hp\":10}");
		TestMods.write(contentDir.resolve("Maps/forest.json"), "{\"size\":3}");
	}

	@AfterEach
	public void tearDown() {
		CapturingLogHandler.uninstall();
	}

	@Test
	@DisplayName("Prints the load order and a patched document")
	public void loadAndDump() {
		Path buff = TestMods.mod(modsDir, "buff", "\"patches\":[\"guard.json\"]");
		TestMods.write(buff.resolve("guard.json"),
				"{\"target\":\"guard\",\"operations\":[{\"op\":\"replace\",\"path\":\"/hp\",\"value\":20}]}");
		TestMods.mod(modsDir, "maps", "\"priority\":5");

		int status = run("--mods", modsDir.toString(), "--content", contentDir.toString(), "--dump", "guard");
		String out = output();

		assertEquals(0, status, () -> "Unexpected failure, log:\n" + log);
		assertTrue(out.contains("Load order (2 mods):"), out);
		assertTrue(out.indexOf("1. maps 1.0.0") < out.indexOf("2. buff 1.0.0"), out);
		assertTrue(out.contains("\"hp\": 20"), "Dump must show the patched document:\n" + out);
		assertTrue(log.contains(LogLevel.INFO, "Loaded 2 base content document(s)"), log.toString());
	}

	@Test
	@DisplayName("Dumping by key works without an id field")
	public void dumpByKey() {
		int status = run("--mods", modsDir.toString(), "--content", contentDir.toString(), "--idField", "", "--dump", "Maps/forest");

		assertEquals(0, status);
		assertTrue(output().contains("Load order (0 mods):"));
		assertTrue(output().contains("\"size\": 3"));

		assertEquals(1, run("--mods", modsDir.toString(), "--content", contentDir.toString(), "--idField", "", "--dump", "guard"),
				"Ids must not resolve with matching disabled");
		assertTrue(log.contains(LogLevel.ERROR, "guard"));
	}

	@Test
	@DisplayName("Resolution failures exit with status 1")
	public void missingDependency() {
		TestMods.mod(modsDir, "needy", "\"dependencies\":[\"ghost >= 2.0.0\"]");

		assertEquals(1, run("--mods", modsDir.toString()));
		assertTrue(log.contains(LogLevel.ERROR, "Incompatible mod set!"), log.toString());
		assertFalse(output().contains("Load order"));
	}

	@Test
	@DisplayName("An invalid content directory exits with status 1")
	public void invalidContentDirectory() {
		assertEquals(1, run("--mods", modsDir.toString(), "--content", tempDir.resolve("nowhere").toString()));
		assertTrue(log.contains(LogLevel.ERROR, "Invalid content directory!"), log.toString());
	}

	private int run(String... args) {
		try (PrintStream out = new PrintStream(output, true, "UTF-8")) {
			return ModLayerMain.run(args, out);
		} catch (IOException e) {
			throw new RuntimeException(e);
		}
	}

	private String output() {
		return new String(output.toByteArray(), StandardCharsets.UTF_8);
	}
}
