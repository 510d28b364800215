package org.javai.vero.lexer;

import org.javai.vero.diagnostics.Position;

/**
 * Represents a token of Vero source.
 *
 * @param type the token type
 * @param lexeme the token text; decoded content for strings, the inner path for variables
 * @param position where the token starts
 */
public record VeroToken(TokenType type, String lexeme, Position position) {

	@Override
	public String toString() {
		return switch (type) {
			case STRING -> "STRING(\"" + lexeme + "\")";
			case VARIABLE -> "VARIABLE({{" + lexeme + "}})";
			case NUMBER, IDENTIFIER -> type + "(" + lexeme + ")";
			default -> type.toString();
		};
	}

	public boolean isType(TokenType expectedType) {
		return this.type == expectedType;
	}

	public boolean isIdentifier(String expected) {
		return type == TokenType.IDENTIFIER && lexeme.equals(expected);
	}

	/**
	 * Text used when quoting this token in a diagnostic.
	 */
	public String describe() {
		return switch (type) {
			case EOF -> "end of input";
			case STRING -> "\"" + lexeme + "\"";
			case VARIABLE -> "{{" + lexeme + "}}";
			default -> "'" + lexeme + "'";
		};
	}
}
