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

package net.modlayer.loader.impl.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class LoaderUtil {
	public static Path normalizePath(Path path) {
		if (Files.exists(path)) {
			return normalizeExistingPath(path);
		} else {
			return path.toAbsolutePath().normalize();
		}
	}

	public static Path normalizeExistingPath(Path path) {
		try {
			return path.toRealPath();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
	}

	/**
	 * Resolves a manifest supplied relative path against a mod directory.
	 *
	 * @return the resolved path or null if the path is absolute or escapes {@code base}
	 */
	public static Path resolveWithin(Path base, String relativePath) {
		if (relativePath == null || relativePath.isEmpty()) return null;

		String normalized = relativePath.replace('\\', '/');
		if (normalized.startsWith("/")) return null;

		Path root = base.toAbsolutePath().normalize();
		Path ret = root.resolve(normalized).normalize();

		return ret.startsWith(root) ? ret : null;
	}

	/**
	 * Relative path of {@code path} below {@code base} with forward slashes, independent of the file system separator.
	 */
	public static String toSlashPath(Path base, Path path) {
		Path rel = base.toAbsolutePath().normalize().relativize(path.toAbsolutePath().normalize());
		StringBuilder sb = new StringBuilder();

		for (Path part : rel) {
			if (sb.length() > 0) sb.append('/');
			sb.append(part.toString());
		}

		return sb.toString();
	}

	private LoaderUtil() {
	}
}
