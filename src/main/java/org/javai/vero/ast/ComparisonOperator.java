package org.javai.vero.ast;

/**
 * Operators of a variable comparison. The unary ones ({@link #IS_EMPTY} and friends) take no
 * operand.
 */
public enum ComparisonOperator {
	EQUALS(true),
	NOT_EQUALS(true),
	GREATER_THAN(true),
	LESS_THAN(true),
	GREATER_OR_EQUAL(true),
	LESS_OR_EQUAL(true),
	CONTAINS(true),
	NOT_CONTAINS(true),
	IS_EMPTY(false),
	IS_NOT_EMPTY(false),
	IS_TRUE(false),
	IS_FALSE(false);

	private final boolean binary;

	ComparisonOperator(boolean binary) {
		this.binary = binary;
	}

	public boolean isBinary() {
		return binary;
	}
}
