package org.javai.vero.codegen;

import org.javai.vero.ast.ConditionExpression;
import org.javai.vero.ast.ValueExpression;

/**
 * Renders conditions as TypeScript boolean expressions, awaiting element queries inline.
 * Compound conditions are always parenthesized.
 */
class ConditionGenerator implements ConditionExpression.Visitor<String> {

	private final LocatorGenerator locators;
	private final ValueGenerator values;
	private final String root;

	ConditionGenerator(LocatorGenerator locators, ValueGenerator values, String root) {
		this.locators = locators;
		this.values = values;
		this.root = root;
	}

	String generate(ConditionExpression condition) {
		return condition.accept(this);
	}

	@Override
	public String visitElementCheck(ConditionExpression.ElementCheck condition) {
		String locator = locators.generate(condition.locator(), root);
		String check = switch (condition.state()) {
			case VISIBLE -> "await " + locator + ".isVisible()";
			case HIDDEN -> "await " + locator + ".isHidden()";
			case ENABLED -> "await " + locator + ".isEnabled()";
			case DISABLED -> "await " + locator + ".isDisabled()";
			case CHECKED -> "await " + locator + ".isChecked()";
			case EMPTY -> "((await " + locator + ".textContent()) ?? '').trim() === ''";
			case FOCUSED -> "await " + locator + ".evaluate((el) => el === document.activeElement)";
			case EXISTS -> "(await " + locator + ".count()) > 0";
		};
		return condition.negated() ? "!(" + check + ")" : check;
	}

	@Override
	public String visitVariableComparison(ConditionExpression.VariableComparison condition) {
		String value = values.reference(condition.path());
		return switch (condition.operator()) {
			case EQUALS -> value + " == " + operand(condition);
			case NOT_EQUALS -> value + " != " + operand(condition);
			case GREATER_THAN -> "Number(" + value + ") > " + numeric(condition);
			case LESS_THAN -> "Number(" + value + ") < " + numeric(condition);
			case GREATER_OR_EQUAL -> "Number(" + value + ") >= " + numeric(condition);
			case LESS_OR_EQUAL -> "Number(" + value + ") <= " + numeric(condition);
			case CONTAINS -> "String(" + value + " ?? '').includes(" + values.string(condition.operand()) + ")";
			case NOT_CONTAINS -> "!String(" + value + " ?? '').includes(" + values.string(condition.operand()) + ")";
			case IS_EMPTY -> "String(" + value + " ?? '').length === 0";
			case IS_NOT_EMPTY -> "String(" + value + " ?? '').length > 0";
			case IS_TRUE -> value + " === true";
			case IS_FALSE -> value + " === false";
		};
	}

	@Override
	public String visitCustom(ConditionExpression.Custom condition) {
		if (condition.code().isBlank()) {
			throw new GenerationException("EXPRESSION condition must not be blank");
		}
		if (condition.code().contains("lookup(")) {
			values.requireLookup();
		}
		return "(" + condition.code().trim() + ")";
	}

	@Override
	public String visitNot(ConditionExpression.Not condition) {
		return "!(" + generate(condition.operand()) + ")";
	}

	@Override
	public String visitAnd(ConditionExpression.And condition) {
		return "(" + generate(condition.left()) + " && " + generate(condition.right()) + ")";
	}

	@Override
	public String visitOr(ConditionExpression.Or condition) {
		return "(" + generate(condition.left()) + " || " + generate(condition.right()) + ")";
	}

	private String operand(ConditionExpression.VariableComparison condition) {
		return values.expression(condition.operand());
	}

	private String numeric(ConditionExpression.VariableComparison condition) {
		ValueExpression operand = condition.operand();
		if (operand instanceof ValueExpression.Number number) {
			return number.literal();
		}
		return "Number(" + values.expression(operand) + ")";
	}
}
