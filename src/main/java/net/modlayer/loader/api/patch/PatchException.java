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

/**
 * Failure of a single patch operation.
 *
 * <p>Operations before the failing one stay applied, {@link #getAppliedOperations()} tells how many.
 */
@SuppressWarnings("serial")
public class PatchException extends Exception {
	public enum Kind {
		/** Unknown operation name, path or from not starting with {@code /}, missing value or from. */
		INVALID_OPERATION,
		/** Missing object key, array index out of range, non-numeric array index or descent into a scalar. */
		PATH_NOT_FOUND,
		/** The addressed parent can't hold the value, e.g. adding below a scalar. */
		INVALID_TARGET,
		/** A test operation compared unequal. */
		TEST_FAILED
	}

	private final Kind kind;
	private int operationIndex = -1;
	private PatchOperation operation;
	private int appliedOperations;

	public PatchException(Kind kind, String message) {
		super(message);

		this.kind = kind;
	}

	public PatchException(Kind kind, String format, Object... args) {
		this(kind, String.format(format, args));
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Index of the failing operation within its patch or -1 if the failure wasn't attributed to one.
	 */
	public int getOperationIndex() {
		return operationIndex;
	}

	public PatchOperation getOperation() {
		return operation;
	}

	/**
	 * Number of operations applied to the document before this failure.
	 */
	public int getAppliedOperations() {
		return appliedOperations;
	}

	public void setOperation(int index, PatchOperation operation) {
		this.operationIndex = index;
		this.operation = operation;
		this.appliedOperations = index;
	}

	@Override
	public String getMessage() {
		String msg = super.getMessage();
		if (operation == null) return msg;

		return String.format("Operation #%d (%s %s) failed: %s", operationIndex, operation.getOp(), operation.getPath(), msg);
	}
}
