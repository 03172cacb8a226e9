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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line arguments in {@code --key value} form, anything else is collected as an extra argument.
 */
public final class Arguments {
	// directory containing one sub directory per mod
	public static final String MODS = "mods";
	// base content directory, read before any mod content
	public static final String CONTENT = "content";
	// document field used to look up patch targets that aren't document keys
	public static final String ID_FIELD = "idField";
	// document key to print after loading
	public static final String DUMP = "dump";

	private final Map<String, String> values;
	private final List<String> extraArgs;

	public Arguments() {
		values = new LinkedHashMap<>();
		extraArgs = new ArrayList<>();
	}

	public Collection<String> keys() {
		return values.keySet();
	}

	public List<String> getExtraArgs() {
		return Collections.unmodifiableList(extraArgs);
	}

	public boolean containsKey(String key) {
		return values.containsKey(key);
	}

	public String get(String key) {
		return values.get(key);
	}

	public String getOrDefault(String key, String value) {
		return values.getOrDefault(key, value);
	}

	public void put(String key, String value) {
		values.put(key, value);
	}

	public void parse(String[] args) {
		parse(Arrays.asList(args));
	}

	public void parse(List<String> args) {
		for (int i = 0; i < args.size(); i++) {
			String arg = args.get(i);

			if (arg.startsWith("--") && i < args.size() - 1 && !args.get(i + 1).startsWith("--")) {
				values.put(arg.substring(2), args.get(++i));
			} else if (arg.startsWith("--")) {
				values.put(arg.substring(2), "");
			} else {
				extraArgs.add(arg);
			}
		}
	}

	public String remove(String s) {
		return values.remove(s);
	}
}
