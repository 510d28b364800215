package org.javai.vero.parser;

import org.javai.vero.ast.ValueExpression;
import org.javai.vero.lexer.TokenType;
import org.javai.vero.lexer.VeroToken;

/**
 * {@code value := STRING | NUMBER | VARIABLE | TRUE | FALSE}
 */
class ValueParser {

	private final TokenCursor cursor;

	ValueParser(TokenCursor cursor) {
		this.cursor = cursor;
	}

	ValueExpression parse(String what) {
		VeroToken token = cursor.peek();
		return switch (token.type()) {
			case STRING -> {
				cursor.advance();
				yield ValueExpression.Text.parse(token.lexeme());
			}
			case NUMBER -> {
				cursor.advance();
				yield new ValueExpression.Number(token.lexeme());
			}
			case VARIABLE -> {
				cursor.advance();
				yield new ValueExpression.Variable(token.lexeme());
			}
			case TRUE, FALSE -> {
				cursor.advance();
				yield new ValueExpression.Bool(token.type() == TokenType.TRUE);
			}
			default -> throw cursor.error("Expected " + what);
		};
	}

	String string(String what) {
		return cursor.expect(TokenType.STRING, "Expected " + what).lexeme();
	}

	/**
	 * Reads a whole number, rejecting decimals.
	 */
	int integer(String what) {
		VeroToken token = cursor.expect(TokenType.NUMBER, "Expected " + what);
		try {
			return Integer.parseInt(token.lexeme());
		}
		catch (NumberFormatException e) {
			throw new SyntaxError("Expected " + what + " to be a whole number but found " + token.lexeme(), token);
		}
	}
}
