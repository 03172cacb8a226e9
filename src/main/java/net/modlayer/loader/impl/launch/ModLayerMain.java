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

package net.modlayer.loader.impl.launch;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import net.modlayer.loader.api.LoadedMod;
import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.impl.FormattedException;
import net.modlayer.loader.impl.ModLoaderImpl;
import net.modlayer.loader.impl.content.ContentDocumentCache;
import net.modlayer.loader.impl.content.ContentDocumentLoader;
import net.modlayer.loader.impl.content.ContentFolder;
import net.modlayer.loader.impl.discovery.ModResolutionException;
import net.modlayer.loader.impl.document.DocumentSerializer;
import net.modlayer.loader.impl.util.Arguments;
import net.modlayer.loader.impl.util.LoaderUtil;
import net.modlayer.loader.impl.util.SystemProperties;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.Log4jLogHandler;
import net.modlayer.loader.impl.util.log.LogCategory;

/**
 * Command line entry point: loads base content and mods, prints the load order and optionally one patched document.
 *
 * <pre>--mods &lt;dir&gt; [--content &lt;dir&gt;] [--idField &lt;field&gt;] [--dump &lt;key or id&gt;]</pre>
 */
public final class ModLayerMain {
	static final String BASE_CONTENT_OWNER = "base";
	private static final String DEFAULT_MODS_DIR = "mods";

	public static void main(String[] args) {
		Log.init(new Log4jLogHandler());

		int status = run(args, System.out);
		if (status != 0) System.exit(status);
	}

	/**
	 * @return the process exit status
	 */
	public static int run(String[] args, PrintStream out) {
		Arguments arguments = new Arguments();
		arguments.parse(args);

		Path modsDir = Paths.get(arguments.getOrDefault(Arguments.MODS, System.getProperty(SystemProperties.MODS_FOLDER, DEFAULT_MODS_DIR)));
		String contentArg = arguments.getOrDefault(Arguments.CONTENT, System.getProperty(SystemProperties.CONTENT_FOLDER));
		Path contentDir = contentArg == null || contentArg.isEmpty() ? null : LoaderUtil.normalizePath(Paths.get(contentArg));
		String idField = arguments.getOrDefault(Arguments.ID_FIELD, ContentDocumentCache.DEFAULT_ID_FIELD);

		ContentDocumentCache cache = new ContentDocumentCache(idField.isEmpty() ? null : idField);

		try {
			if (contentDir != null) {
				int count = ContentDocumentLoader.mergeInto(cache, ContentDocumentLoader.readFolders(findBaseContent(contentDir)));
				Log.info(LogCategory.CONTENT, "Loaded %d base content document(s) from %s", count, contentDir);
			}

			ModLoaderImpl loader = new ModLoaderImpl(modsDir, cache, null, contentDir);
			List<LoadedMod> mods = loader.loadAll();

			out.printf("Load order (%d mod%s):%n", mods.size(), mods.size() != 1 ? "s" : "");

			for (int i = 0; i < mods.size(); i++) {
				LoadedMod mod = mods.get(i);
				out.printf("%d. %s %s%n", i + 1, mod.getId(), mod.getManifest().getVersion().getFriendlyString());
			}

			String dump = arguments.get(Arguments.DUMP);

			if (dump != null && !dump.isEmpty()) {
				String key = cache.resolveTarget(dump);

				if (key == null) {
					Log.error(LogCategory.CONTENT, "No content document %s to dump", dump);
					return 1;
				}

				DocumentNode document = cache.getDocument(key);
				out.println(DocumentSerializer.toPrettyJson(document));
			}

			return 0;
		} catch (ModResolutionException e) {
			Log.error(LogCategory.RESOLUTION, "Incompatible mod set!", e);
			return 1;
		} catch (FormattedException e) {
			Throwable actualExc = e.getMessage() != null ? e : e.getCause();
			Log.error(LogCategory.GENERAL, e.getMainText(), actualExc);
			return 1;
		}
	}

	/**
	 * Every immediate sub directory of the base content directory holds one content type, named after it.
	 */
	static List<ContentFolder> findBaseContent(Path contentDir) {
		if (!Files.isDirectory(contentDir)) {
			throw new FormattedException("Invalid content directory!", "Content directory %s doesn't exist or isn't a directory", contentDir);
		}

		try (Stream<Path> stream = Files.list(contentDir)) {
			List<Path> dirs = stream
					.filter(Files::isDirectory)
					.filter(p -> !p.getFileName().toString().startsWith("."))
					.sorted()
					.collect(Collectors.toList());
			List<ContentFolder> ret = new ArrayList<>(dirs.size());

			for (Path dir : dirs) {
				ret.add(new ContentFolder(BASE_CONTENT_OWNER, dir.getFileName().toString(), dir));
			}

			return ret;
		} catch (IOException e) {
			throw new FormattedException("Invalid content directory!", "Content directory " + contentDir + " can't be read", e);
		}
	}
}
