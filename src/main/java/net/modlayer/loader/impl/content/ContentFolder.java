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

import java.nio.file.Path;

/**
 * A directory holding documents of one content type, contributed by a mod or the base content.
 */
public final class ContentFolder {
	private final String owner;
	private final String contentType;
	private final Path directory;

	public ContentFolder(String owner, String contentType, Path directory) {
		this.owner = owner;
		this.contentType = contentType;
		this.directory = directory;
	}

	/**
	 * Mod id of the contributing mod, or a fixed name for base content.
	 */
	public String getOwner() {
		return owner;
	}

	public String getContentType() {
		return contentType;
	}

	public Path getDirectory() {
		return directory;
	}

	@Override
	public String toString() {
		return String.format("%s folder %s of %s", contentType, directory, owner);
	}
}
