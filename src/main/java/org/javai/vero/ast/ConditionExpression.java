package org.javai.vero.ast;

import java.util.Objects;

/**
 * Boolean test used by {@code IF} and {@code WHILE}.
 */
public sealed interface ConditionExpression {

	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitElementCheck(ElementCheck condition);

		R visitVariableComparison(VariableComparison condition);

		R visitCustom(Custom condition);

		R visitNot(Not condition);

		R visitAnd(And condition);

		R visitOr(Or condition);
	}

	/**
	 * {@code <locator> IS [NOT] <state>} or {@code <locator> EXISTS}.
	 */
	record ElementCheck(LocatorExpression locator, ElementState state, boolean negated)
			implements ConditionExpression {
		public ElementCheck {
			Objects.requireNonNull(locator, "locator must not be null");
			Objects.requireNonNull(state, "state must not be null");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitElementCheck(this);
		}
	}

	/**
	 * Compares the run-time value at {@code path} against an operand. Unary operators carry a
	 * {@code null} operand.
	 */
	record VariableComparison(String path, ComparisonOperator operator, ValueExpression operand)
			implements ConditionExpression {
		public VariableComparison {
			Objects.requireNonNull(path, "path must not be null");
			Objects.requireNonNull(operator, "operator must not be null");
			if (operator.isBinary() && operand == null) {
				throw new IllegalArgumentException(operator + " requires an operand");
			}
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitVariableComparison(this);
		}
	}

	/**
	 * Raw target-language boolean expression, copied into the generated code as is. It is not
	 * interpolated: the parser rejects {@code {{name}}} inside it, and variables are read with
	 * {@code lookup(vars, 'name')}.
	 */
	record Custom(String code) implements ConditionExpression {
		public Custom {
			Objects.requireNonNull(code, "code must not be null");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCustom(this);
		}
	}

	record Not(ConditionExpression operand) implements ConditionExpression {
		public Not {
			Objects.requireNonNull(operand, "operand must not be null");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitNot(this);
		}
	}

	record And(ConditionExpression left, ConditionExpression right) implements ConditionExpression {
		public And {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAnd(this);
		}
	}

	record Or(ConditionExpression left, ConditionExpression right) implements ConditionExpression {
		public Or {
			Objects.requireNonNull(left, "left must not be null");
			Objects.requireNonNull(right, "right must not be null");
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitOr(this);
		}
	}
}
