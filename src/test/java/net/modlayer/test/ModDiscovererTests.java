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
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.jimfs.Configuration;
import com.google.common.jimfs.Jimfs;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import net.modlayer.loader.impl.discovery.DirectoryModCandidateFinder;
import net.modlayer.loader.impl.discovery.ModDiscoverer;
import net.modlayer.loader.impl.discovery.ModResolutionException;
import net.modlayer.loader.impl.metadata.ModManifestImpl;
import net.modlayer.loader.impl.util.SystemProperties;
import net.modlayer.loader.impl.util.log.LogLevel;

public class ModDiscovererTests {
	private FileSystem fs;
	private Path modsDir;
	private CapturingLogHandler log;

	@BeforeEach
	public void setUp() {
		fs = Jimfs.newFileSystem(Configuration.unix());
		modsDir = fs.getPath("/game/mods");
		log = CapturingLogHandler.install();
	}

	@AfterEach
	public void tearDown() throws IOException {
		CapturingLogHandler.uninstall();
		fs.close();
	}

	private List<String> discoverIds() throws ModResolutionException {
		ModDiscoverer discoverer = new ModDiscoverer();
		discoverer.addCandidateFinder(new DirectoryModCandidateFinder(modsDir));

		return discoverer.discoverMods().stream().map(ModManifestImpl::getId).collect(Collectors.toList());
	}

	@Test
	@DisplayName("Every sub directory with a valid manifest is a mod, in name order")
	public void discover() throws ModResolutionException {
		TestMods.mod(modsDir, "zulu", "");
		TestMods.mod(modsDir, "alpha", "");
		TestMods.mod(modsDir, "mike", "");
		TestMods.write(modsDir.resolve("notes.txt"), "not a mod");
		TestMods.write(modsDir.resolve("empty-dir/readme.md"), "no manifest here");
		TestMods.mod(modsDir, ".hidden", "");

		assertEquals(Arrays.asList("alpha", "mike", "zulu"), discoverIds());
	}

	@Test
	@DisplayName("Invalid manifests skip only their own mod")
	public void invalidManifest() throws ModResolutionException {
		TestMods.mod(modsDir, "good", "");
		TestMods.write(modsDir.resolve("broken/mod.json"), "{\"id\":\"broken\",\"name\":\"Broken\",\"version\":\"one\"}");

		assertEquals(Arrays.asList("good"), discoverIds());
		assertTrue(log.contains(LogLevel.ERROR, "Skipping invalid mod", "/game/mods/broken"), log.toString());
	}

	@Test
	@DisplayName("Manifest directory stamps point into the mods directory")
	public void directoryStamp() throws ModResolutionException {
		TestMods.mod(modsDir, "stamped", "");

		ModDiscoverer discoverer = new ModDiscoverer();
		discoverer.addCandidateFinder(new DirectoryModCandidateFinder(modsDir));
		List<ModManifestImpl> mods = discoverer.discoverMods();

		assertEquals(fs.getPath("/game/mods/stamped"), mods.get(0).getDirectory());
	}

	@Test
	@DisplayName("A missing mods directory is created")
	public void createsModsDirectory() throws ModResolutionException {
		assertEquals(0, discoverIds().size());
		assertTrue(Files.isDirectory(modsDir));
	}

	@Test
	@DisplayName("A mods path that isn't a directory fails discovery")
	public void modsPathIsFile() {
		TestMods.write(modsDir, "oops");

		assertThrows(RuntimeException.class, this::discoverIds);
	}

	@Test
	@DisplayName("Disabled mod ids are skipped")
	public void disabledMods() throws ModResolutionException {
		TestMods.mod(modsDir, "keep", "");
		TestMods.mod(modsDir, "drop", "");
		TestMods.mod(modsDir, "drop-too", "");

		System.setProperty(SystemProperties.DISABLE_MOD_IDS, "drop, drop-too");

		try {
			assertEquals(Arrays.asList("keep"), discoverIds());
			assertTrue(log.contains(LogLevel.INFO, "Skipping disabled mod drop"), log.toString());
		} finally {
			System.clearProperty(SystemProperties.DISABLE_MOD_IDS);
		}
	}
}
