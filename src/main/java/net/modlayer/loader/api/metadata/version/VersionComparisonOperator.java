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

package net.modlayer.loader.api.metadata.version;

import net.modlayer.loader.api.Version;

public enum VersionComparisonOperator {
	// order is important to match the longest substring (e.g. try >= before >)
	GREATER_EQUAL(">=") {
		@Override
		public boolean test(Version a, Version b) {
			return a.compareTo(b) >= 0;
		}
	},
	LESS_EQUAL("<=") {
		@Override
		public boolean test(Version a, Version b) {
			return a.compareTo(b) <= 0;
		}
	},
	EQUAL("==") {
		@Override
		public boolean test(Version a, Version b) {
			return a.compareTo(b) == 0;
		}
	},
	GREATER(">") {
		@Override
		public boolean test(Version a, Version b) {
			return a.compareTo(b) > 0;
		}
	},
	LESS("<") {
		@Override
		public boolean test(Version a, Version b) {
			return a.compareTo(b) < 0;
		}
	};

	private final String serialized;

	VersionComparisonOperator(String serialized) {
		this.serialized = serialized;
	}

	public final String getSerialized() {
		return serialized;
	}

	/**
	 * Tests whether {@code a} (the present version) satisfies this operator against {@code b} (the required version).
	 */
	public abstract boolean test(Version a, Version b);

	/**
	 * Looks up an operator by its textual form, {@code =} being accepted as an alias of {@code ==}.
	 *
	 * @return the operator or null if the symbol is unknown
	 */
	public static VersionComparisonOperator bySymbol(String symbol) {
		if (symbol.equals("=")) return EQUAL;

		for (VersionComparisonOperator op : values()) {
			if (op.serialized.equals(symbol)) return op;
		}

		return null;
	}
}
