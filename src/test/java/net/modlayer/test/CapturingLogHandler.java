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

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import net.modlayer.loader.impl.util.log.ConsoleLogHandler;
import net.modlayer.loader.impl.util.log.Log;
import net.modlayer.loader.impl.util.log.LogCategory;
import net.modlayer.loader.impl.util.log.LogHandler;
import net.modlayer.loader.impl.util.log.LogLevel;

/**
 * Records log output for assertions, install with {@link #install()} and restore the console with {@link #uninstall()}.
 */
final class CapturingLogHandler implements LogHandler {
	static final class Entry {
		final LogLevel level;
		final LogCategory category;
		final String message;

		Entry(LogLevel level, LogCategory category, String message) {
			this.level = level;
			this.category = category;
			this.message = message;
		}

		@Override
		public String toString() {
			return String.format("[%s] [%s]: %s", level, category, message);
		}
	}

	private final List<Entry> entries = new ArrayList<>();

	static CapturingLogHandler install() {
		CapturingLogHandler ret = new CapturingLogHandler();
		Log.init(ret);

		return ret;
	}

	static void uninstall() {
		Log.init(new ConsoleLogHandler());
	}

	@Override
	public synchronized void log(long time, LogLevel level, LogCategory category, String msg, Throwable exc) {
		entries.add(new Entry(level, category, msg));
	}

	@Override
	public boolean shouldLog(LogLevel level, LogCategory category) {
		return true;
	}

	@Override
	public void close() { }

	synchronized List<Entry> getEntries(LogLevel level) {
		return entries.stream().filter(e -> e.level == level).collect(Collectors.toList());
	}

	/**
	 * @return whether a message at {@code level} contains every given fragment
	 */
	synchronized boolean contains(LogLevel level, String... fragments) {
		for (Entry entry : entries) {
			if (entry.level != level) continue;

			boolean matches = true;

			for (String fragment : fragments) {
				if (!entry.message.contains(fragment)) {
					matches = false;
					break;
				}
			}

			if (matches) return true;
		}

		return false;
	}

	@Override
	public synchronized String toString() {
		return entries.stream().map(Entry::toString).collect(Collectors.joining("\n"));
	}
}
