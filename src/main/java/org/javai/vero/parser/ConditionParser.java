package org.javai.vero.parser;

import org.javai.vero.ast.ComparisonOperator;
import org.javai.vero.ast.ConditionExpression;
import org.javai.vero.ast.ElementState;
import org.javai.vero.ast.LocatorExpression;
import org.javai.vero.ast.ValueExpression;
import org.javai.vero.lexer.TokenType;
import org.javai.vero.lexer.VeroToken;

/**
 * Parses {@code IF} and {@code WHILE} conditions. {@code OR} binds loosest, then {@code AND},
 * then prefix {@code NOT}:
 * <pre>
 * condition  := and (OR and)*
 * and        := unary (AND unary)*
 * unary      := NOT unary | primary
 * primary    := '(' condition ')' | VARIABLE comparison | EXPRESSION STRING
 *             | locator (IS NOT? state | EXISTS)
 * comparison := (== | != | > | < | >= | <=) value | NOT? CONTAINS value | IS NOT? (EMPTY | TRUE | FALSE)
 * </pre>
 */
class ConditionParser {

	private final TokenCursor cursor;
	private final ValueParser values;
	private final LocatorParser locators;

	ConditionParser(TokenCursor cursor, ValueParser values, LocatorParser locators) {
		this.cursor = cursor;
		this.values = values;
		this.locators = locators;
	}

	ConditionExpression parse() {
		ConditionExpression left = parseAnd();
		while (cursor.match(TokenType.OR)) {
			left = new ConditionExpression.Or(left, parseAnd());
		}
		return left;
	}

	private ConditionExpression parseAnd() {
		ConditionExpression left = parseUnary();
		while (cursor.match(TokenType.AND)) {
			left = new ConditionExpression.And(left, parseUnary());
		}
		return left;
	}

	private ConditionExpression parseUnary() {
		if (cursor.match(TokenType.NOT)) {
			return new ConditionExpression.Not(parseUnary());
		}
		return parsePrimary();
	}

	private ConditionExpression parsePrimary() {
		if (cursor.match(TokenType.LPAREN)) {
			ConditionExpression inner = parse();
			cursor.expect(TokenType.RPAREN, "Expected ')' to close condition");
			return inner;
		}
		if (cursor.check(TokenType.VARIABLE)) {
			return parseComparison(cursor.advance().lexeme());
		}
		if (cursor.match(TokenType.EXPRESSION)) {
			return parseCustom();
		}
		if (locators.atLocator()) {
			return parseElementCheck(locators.parse());
		}
		throw cursor.error("Expected a condition");
	}

	/**
	 * EXPRESSION code is copied into the test unchanged, so {@code {{name}}} would reach the
	 * generated TypeScript verbatim and break it.
	 */
	private ConditionExpression parseCustom() {
		VeroToken code = cursor.expect(TokenType.STRING, "Expected a quoted expression after EXPRESSION");
		if (code.lexeme().contains("{{")) {
			throw new SyntaxError("EXPRESSION code cannot interpolate {{variables}}; read them with lookup(vars, 'name')",
					code);
		}
		return new ConditionExpression.Custom(code.lexeme());
	}

	private ConditionExpression parseElementCheck(LocatorExpression locator) {
		if (cursor.match(TokenType.EXISTS)) {
			return new ConditionExpression.ElementCheck(locator, ElementState.EXISTS, false);
		}
		cursor.expect(TokenType.IS, "Expected IS or EXISTS after locator");
		boolean negated = cursor.match(TokenType.NOT);
		ElementState state = switch (cursor.peek().type()) {
			case VISIBLE -> ElementState.VISIBLE;
			case HIDDEN -> ElementState.HIDDEN;
			case ENABLED -> ElementState.ENABLED;
			case DISABLED -> ElementState.DISABLED;
			case CHECKED -> ElementState.CHECKED;
			case EMPTY -> ElementState.EMPTY;
			case FOCUSED -> ElementState.FOCUSED;
			default -> throw cursor.error("Expected an element state");
		};
		cursor.advance();
		return new ConditionExpression.ElementCheck(locator, state, negated);
	}

	private ConditionExpression parseComparison(String path) {
		VeroToken token = cursor.peek();
		ComparisonOperator operator = switch (token.type()) {
			case EQ -> ComparisonOperator.EQUALS;
			case NE -> ComparisonOperator.NOT_EQUALS;
			case GT -> ComparisonOperator.GREATER_THAN;
			case LT -> ComparisonOperator.LESS_THAN;
			case GE -> ComparisonOperator.GREATER_OR_EQUAL;
			case LE -> ComparisonOperator.LESS_OR_EQUAL;
			case CONTAINS -> ComparisonOperator.CONTAINS;
			default -> null;
		};
		if (operator != null) {
			cursor.advance();
			return comparison(path, operator);
		}
		if (cursor.match(TokenType.NOT)) {
			cursor.expect(TokenType.CONTAINS, "Expected CONTAINS after NOT");
			return comparison(path, ComparisonOperator.NOT_CONTAINS);
		}
		if (cursor.match(TokenType.IS)) {
			boolean negated = cursor.match(TokenType.NOT);
			ComparisonOperator unary = switch (cursor.peek().type()) {
				case EMPTY -> negated ? ComparisonOperator.IS_NOT_EMPTY : ComparisonOperator.IS_EMPTY;
				case TRUE -> negated ? ComparisonOperator.IS_FALSE : ComparisonOperator.IS_TRUE;
				case FALSE -> negated ? ComparisonOperator.IS_TRUE : ComparisonOperator.IS_FALSE;
				default -> throw cursor.error("Expected EMPTY, TRUE or FALSE after IS");
			};
			cursor.advance();
			return new ConditionExpression.VariableComparison(path, unary, null);
		}
		throw cursor.error("Expected a comparison after {{" + path + "}}");
	}

	private ConditionExpression comparison(String path, ComparisonOperator operator) {
		ValueExpression operand = values.parse("a value to compare with");
		return new ConditionExpression.VariableComparison(path, operator, operand);
	}
}
