package org.javai.vero.ast;

public enum AssertionKind {
	VISIBLE(false),
	HIDDEN(false),
	ENABLED(false),
	DISABLED(false),
	CHECKED(false),
	EMPTY(false),
	FOCUSED(false),
	CONTAINS_TEXT(true),
	HAS_TEXT(true),
	HAS_VALUE(true),
	HAS_COUNT(true);

	private final boolean takesOperand;

	AssertionKind(boolean takesOperand) {
		this.takesOperand = takesOperand;
	}

	public boolean takesOperand() {
		return takesOperand;
	}
}
