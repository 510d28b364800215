package org.javai.vero.ast;

import java.util.Objects;

/**
 * Bound of a loop statement.
 */
public sealed interface LoopConfig {

	/**
	 * {@code REPEAT n TIMES}. The count is kept as written; the generator rejects negatives.
	 */
	record Count(int times) implements LoopConfig {
	}

	/**
	 * {@code FOR EACH item IN {{items}}}: binds {@code itemName} to each element of the
	 * collection found at {@code sourcePath}.
	 */
	record Collection(String itemName, String sourcePath) implements LoopConfig {
		public Collection {
			Objects.requireNonNull(itemName, "itemName must not be null");
			Objects.requireNonNull(sourcePath, "sourcePath must not be null");
		}
	}

	/**
	 * {@code WHILE cond [MAX n]}. A {@code null} bound falls back to the configured default.
	 */
	record Conditional(ConditionExpression condition, Integer maxIterations) implements LoopConfig {
		public Conditional {
			Objects.requireNonNull(condition, "condition must not be null");
		}
	}
}
