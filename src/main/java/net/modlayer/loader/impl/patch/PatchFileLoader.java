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

package net.modlayer.loader.impl.patch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import net.modlayer.loader.api.LoadedMod;
import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.api.document.DocumentNode.ObjectNode;
import net.modlayer.loader.api.document.DocumentNode.ScalarNode;
import net.modlayer.loader.api.patch.ModPatch;
import net.modlayer.loader.api.patch.PatchOperation;
import net.modlayer.loader.impl.document.DocumentParser;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.LogCategory;

/**
 * Reads the patch files a mod declares.
 *
 * <p>A declared entry is a file or a directory whose {@code *.json} files are read in name order. Field names are
 * matched case-insensitively. A file that can't be parsed or lacks {@code target} or {@code operations} is logged
 * and skipped, the mod's other patch files still load. Operation shape is checked when the patch is applied.
 */
public final class PatchFileLoader {
	public static List<ModPatch> loadModPatches(LoadedMod mod) {
		List<ModPatch> ret = new ArrayList<>();

		for (String entry : mod.getManifest().getPatches()) {
			Optional<Path> resolved = mod.resolvePath(entry);

			if (!resolved.isPresent()) {
				Log.error(LogCategory.PATCH, "Mod %s declares patch %s outside of its directory, skipping", mod.getId(), entry);
				continue;
			}

			Path path = resolved.get();

			if (Files.isDirectory(path)) {
				for (Path file : listPatchFiles(path)) {
					loadPatchFile(mod, file, ret);
				}
			} else if (Files.isRegularFile(path)) {
				loadPatchFile(mod, path, ret);
			} else {
				Log.error(LogCategory.PATCH, "Patch file %s of mod %s not found", entry, mod.getId());
			}
		}

		Log.debug(LogCategory.PATCH, "Loaded %d patches for mod %s", ret.size(), mod.getId());

		return ret;
	}

	private static void loadPatchFile(LoadedMod mod, Path file, List<ModPatch> out) {
		String source = mod.getRootDirectory().relativize(file).toString().replace('\\', '/');

		try {
			out.add(readPatch(DocumentParser.parse(file), source));
		} catch (IOException | PatchFileException e) {
			Log.error(LogCategory.PATCH, "Skipping patch file %s of mod %s: %s", source, mod.getId(), e.getMessage());
		}
	}

	private static List<Path> listPatchFiles(Path dir) {
		try (Stream<Path> stream = Files.list(dir)) {
			return stream
					.filter(p -> p.getFileName().toString().endsWith(".json"))
					.filter(Files::isRegularFile)
					.sorted((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()))
					.collect(Collectors.toList());
		} catch (IOException e) {
			throw new RuntimeException("Exception while listing patches in '" + dir + "'!", e);
		}
	}

	/**
	 * Converts a parsed patch file into a {@link ModPatch}.
	 *
	 * @param source name of the file for log output
	 */
	public static ModPatch readPatch(DocumentNode root, String source) throws PatchFileException {
		if (!root.isObject()) {
			throw new PatchFileException("Root of a patch file must be an object");
		}

		String target = null;
		String description = null;
		DocumentNode operations = null;

		for (Map.Entry<String, DocumentNode> entry : root.getAsObject()) {
			DocumentNode value = entry.getValue();

			switch (entry.getKey().toLowerCase(Locale.ROOT)) {
			case "target":
				target = readString(value, "target");
				break;
			case "description":
				if (!value.isScalar() || !value.getAsScalar().isNull()) description = readString(value, "description");
				break;
			case "operations":
				operations = value;
				break;
			default:
				Log.debug(LogCategory.PATCH, "Ignoring unknown entry \"%s\" in patch %s", entry.getKey(), source);
				break;
			}
		}

		if (target == null) {
			throw new PatchFileException("Missing required field \"target\"");
		}

		if (operations == null || !operations.isArray()) {
			throw new PatchFileException("\"operations\" must be an array");
		}

		List<PatchOperation> ops = new ArrayList<>(operations.getAsArray().size());
		int index = 0;

		for (DocumentNode op : operations.getAsArray()) {
			if (!op.isObject()) {
				throw new PatchFileException("Operation #" + index + " must be an object");
			}

			ops.add(readOperation(op.getAsObject(), index));
			index++;
		}

		return new ModPatch(target, description, ops, source);
	}

	private static PatchOperation readOperation(ObjectNode obj, int index) throws PatchFileException {
		String op = null;
		String path = null;
		DocumentNode value = null;
		String from = null;

		for (Map.Entry<String, DocumentNode> entry : obj) {
			switch (entry.getKey().toLowerCase(Locale.ROOT)) {
			case "op":
				op = readString(entry.getValue(), "op of operation #" + index);
				break;
			case "path":
				path = readString(entry.getValue(), "path of operation #" + index);
				break;
			case "value":
				value = entry.getValue(); // an explicit null is a present value
				break;
			case "from":
				from = readString(entry.getValue(), "from of operation #" + index);
				break;
			default:
				break;
			}
		}

		return new PatchOperation(op, path, value, from);
	}

	private static String readString(DocumentNode value, String what) throws PatchFileException {
		if (!value.isScalar() || value.getAsScalar().getType() != ScalarNode.Type.STRING) {
			throw new PatchFileException("\"" + what + "\" must be a string");
		}

		return value.getAsScalar().getAsString();
	}

	@SuppressWarnings("serial")
	public static class PatchFileException extends Exception {
		public PatchFileException(String message) {
			super(message);
		}
	}

	private PatchFileLoader() {
	}
}
