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

package net.modlayer.loader.api;

/**
 * Life cycle of a mod within a loader.
 *
 * <p>A mod moves from {@code VALIDATED} over {@code ORDERED} to {@code LOADED}, then alternates
 * between {@code LOADED} and {@code UNLOADED} through unload and reload.
 */
public enum ModLoadState {
	/** The manifest was discovered, parsed and passed validation. */
	VALIDATED,
	/** The mod got its place in the load order. */
	ORDERED,
	/** Patches, content and scripts of the mod are active. */
	LOADED,
	/** The mod was unloaded and can be reloaded. */
	UNLOADED
}
