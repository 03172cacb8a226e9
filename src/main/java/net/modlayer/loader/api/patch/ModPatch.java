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

package net.modlayer.loader.api.patch;

import java.util.List;

import com.google.common.collect.ImmutableList;

/**
 * Ordered list of operations a mod applies to one content document.
 */
public final class ModPatch {
	private final String target;
	private final String description;
	private final List<PatchOperation> operations;
	private final String source;

	/**
	 * @param target content key or id of the document to patch
	 * @param description free text, may be null
	 * @param operations operations in application order
	 * @param source where the patch was read from, for log output
	 */
	public ModPatch(String target, /* @Nullable */ String description, List<PatchOperation> operations, String source) {
		this.target = target;
		this.description = description;
		this.operations = ImmutableList.copyOf(operations);
		this.source = source;
	}

	public String getTarget() {
		return target;
	}

	public String getDescription() {
		return description;
	}

	public List<PatchOperation> getOperations() {
		return operations;
	}

	public String getSource() {
		return source;
	}

	@Override
	public String toString() {
		return String.format("patch %s for %s (%d operations)", source, target, operations.size());
	}
}
