package org.javai.vero.ast;

/**
 * Element states a condition can test.
 */
public enum ElementState {
	VISIBLE,
	HIDDEN,
	ENABLED,
	DISABLED,
	CHECKED,
	EMPTY,
	FOCUSED,
	/** At least one element matches. */
	EXISTS
}
