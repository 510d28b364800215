package org.javai.vero.ast;

import java.util.Objects;

/**
 * What an element assertion expects.
 *
 * @param kind the expectation
 * @param negated whether the expectation is inverted ({@code IS NOT VISIBLE})
 * @param operand expected text, value or count; {@code null} for state expectations
 */
public record AssertionPredicate(AssertionKind kind, boolean negated, ValueExpression operand) {

	public AssertionPredicate {
		Objects.requireNonNull(kind, "kind must not be null");
		if (kind.takesOperand() && operand == null) {
			throw new IllegalArgumentException(kind + " requires an operand");
		}
	}

	public static AssertionPredicate visible() {
		return new AssertionPredicate(AssertionKind.VISIBLE, false, null);
	}
}
