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

public final class SystemProperties {
	// minimum log level for the console log handler
	public static final String LOG_LEVEL = "modlayer.log.level";
	// a path to a directory to replace the default mod search directory
	public static final String MODS_FOLDER = "modlayer.modsFolder";
	// a path to the base content directory loaded before any mod content
	public static final String CONTENT_FOLDER = "modlayer.contentFolder";
	// a comma-separated list of mod ids to disable, even if they're discovered. mostly useful for unit testing.
	public static final String DISABLE_MOD_IDS = "modlayer.debug.disableModIds";
	// throw exceptions from discovery etc. directly instead of gathering and attaching as suppressed
	public static final String DEBUG_THROW_DIRECTLY = "modlayer.debug.throwDirectly";
	// override the mod discovery timeout, unit in seconds, <= 0 to disable
	public static final String DEBUG_DISCOVERY_TIMEOUT = "modlayer.debug.discoveryTimeout";
	// override the content read timeout, unit in seconds, <= 0 to disable
	public static final String DEBUG_CONTENT_TIMEOUT = "modlayer.debug.contentTimeout";

	private SystemProperties() {
	}
}
