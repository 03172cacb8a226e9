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

package net.modlayer.loader.impl.content;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.RecursiveTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import net.modlayer.loader.api.content.ContentStore;
import net.modlayer.loader.api.document.DocumentNode;
import net.modlayer.loader.impl.FormattedException;
import net.modlayer.loader.impl.document.DocumentParser;
import net.modlayer.loader.impl.util.ExceptionUtil;
import net.modlayer.loader.impl.util.LoaderUtil;
import net.modlayer.loader.impl.util.SystemProperties;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.LogCategory;

/**
 * Reads the {@code *.json} documents below content folders.
 *
 * <p>Files are parsed in parallel since they are independent and read-only. The result is ordered by folder and,
 * within a folder, by relative path, independent of completion order. Files that fail to parse are logged and
 * skipped.
 */
public final class ContentDocumentLoader {
	public static final String FILE_SUFFIX = ".json";

	public static List<ContentDocument> readFolders(List<ContentFolder> folders) {
		long startTime = System.nanoTime();
		ForkJoinPool pool = new ForkJoinPool();
		List<Future<ContentDocument>> futures = new ArrayList<>();

		try {
			for (ContentFolder folder : folders) {
				for (Path file : listDocuments(folder)) {
					futures.add(pool.submit(new DocumentReadTask(folder, file)));
				}
			}
		} catch (RuntimeException e) {
			pool.shutdownNow();
			throw e;
		}

		List<ContentDocument> ret = new ArrayList<>(futures.size());
		FormattedException exception = null;

		int timeout = Integer.getInteger(SystemProperties.DEBUG_CONTENT_TIMEOUT, 60);
		if (timeout <= 0) timeout = Integer.MAX_VALUE;

		try {
			pool.shutdown();

			pool.awaitTermination(timeout, TimeUnit.SECONDS);

			for (Future<ContentDocument> future : futures) {
				if (!future.isDone()) {
					throw new TimeoutException();
				}

				try {
					ContentDocument doc = future.get();
					if (doc != null) ret.add(doc);
				} catch (ExecutionException e) {
					exception = ExceptionUtil.gatherExceptions(e, exception, exc -> new FormattedException("Content loading failed!", exc));
				}
			}
		} catch (TimeoutException e) {
			throw new FormattedException("Content loading took too long!",
					"Reading content documents took longer than %d seconds. The timeout can be changed with the system property %s (-D%<s=<desired timeout in seconds>).",
					timeout, SystemProperties.DEBUG_CONTENT_TIMEOUT);
		} catch (InterruptedException e) {
			throw new FormattedException("Content loading interrupted!", e);
		}

		if (exception != null) throw exception;

		long endTime = System.nanoTime();
		Log.debug(LogCategory.CONTENT, "Read %d content documents from %d folders in %.1f ms", ret.size(), folders.size(), (endTime - startTime) * 1e-6);

		return ret;
	}

	/**
	 * Puts read documents into {@code store} in list order, a document with an existing key overrides it.
	 *
	 * @return number of documents stored
	 */
	public static int mergeInto(ContentStore store, List<ContentDocument> documents) {
		for (ContentDocument doc : documents) {
			if (store.containsDocument(doc.getKey())) {
				Log.debug(LogCategory.CONTENT, "%s overrides content %s", doc.getOwner(), doc.getKey());
				store.replaceDocument(doc.getKey(), doc.getDocument());
			} else {
				store.addDocument(doc.getKey(), doc.getDocument());
			}
		}

		return documents.size();
	}

	static List<Path> listDocuments(ContentFolder folder) {
		Path dir = folder.getDirectory();

		if (!Files.isDirectory(dir)) {
			Log.warn(LogCategory.CONTENT, "Content folder %s doesn't exist, skipping", folder);
			return new ArrayList<>();
		}

		try (Stream<Path> stream = Files.walk(dir)) {
			return stream
					.filter(p -> p.getFileName().toString().endsWith(FILE_SUFFIX))
					.filter(p -> !p.getFileName().toString().startsWith("."))
					.filter(Files::isRegularFile)
					.sorted(Comparator.comparing(p -> LoaderUtil.toSlashPath(dir, p)))
					.collect(Collectors.toList());
		} catch (IOException e) {
			throw new RuntimeException("Exception while searching for content in '" + dir + "'!", e);
		}
	}

	/**
	 * Builds the store key for a file below a content folder, e.g. {@code Templates} and {@code npcs/guard.json}
	 * give {@code Templates/npcs/guard}.
	 */
	public static String toKey(String contentType, String relativePath) {
		String path = relativePath.endsWith(FILE_SUFFIX)
				? relativePath.substring(0, relativePath.length() - FILE_SUFFIX.length())
				: relativePath;

		return contentType + "/" + path;
	}

	public static final class ContentDocument {
		private final String owner;
		private final String key;
		private final Path source;
		private final DocumentNode document;

		ContentDocument(String owner, String key, Path source, DocumentNode document) {
			this.owner = owner;
			this.key = key;
			this.source = source;
			this.document = document;
		}

		public String getOwner() {
			return owner;
		}

		public String getKey() {
			return key;
		}

		public Path getSource() {
			return source;
		}

		public DocumentNode getDocument() {
			return document;
		}
	}

	@SuppressWarnings("serial")
	static final class DocumentReadTask extends RecursiveTask<ContentDocument> {
		private final ContentFolder folder;
		private final Path file;

		DocumentReadTask(ContentFolder folder, Path file) {
			this.folder = folder;
			this.file = file;
		}

		@Override
		protected ContentDocument compute() {
			String key = toKey(folder.getContentType(), LoaderUtil.toSlashPath(folder.getDirectory(), file));

			try {
				return new ContentDocument(folder.getOwner(), key, file, DocumentParser.parse(file));
			} catch (IOException e) {
				Log.warn(LogCategory.CONTENT, "Skipping unreadable content document %s from %s: %s", file, folder.getOwner(), e.getMessage());
				return null;
			}
		}
	}

	private ContentDocumentLoader() {
	}
}
