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

package net.modlayer.loader.api.script;

/**
 * The scripting collaborator mod scripts are handed to.
 *
 * <p>The loader only dispatches scripts, compiling and running them is up to the implementation.
 */
public interface ScriptRuntime {
	/**
	 * Loads a script.
	 *
	 * @param relativePath path below the mods directory, separated by {@code /}, e.g. {@code my-mod/scripts/main.csx}
	 * @return the script instance or null if the script couldn't be loaded
	 */
	Object loadScript(String relativePath);

	/**
	 * Initializes a script instance returned by {@link #loadScript}.
	 */
	void initializeScript(Object instance, ScriptContext context);
}
