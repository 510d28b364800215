package org.javai.vero.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.javai.vero.diagnostics.Position;
import org.javai.vero.lexer.TokenType;
import org.javai.vero.lexer.VeroToken;

/**
 * Read position over a token list. The list is guaranteed to end with {@link TokenType#EOF},
 * so {@link #peek()} never runs off the end.
 */
class TokenCursor {

	private final List<VeroToken> tokens;
	private int current = 0;

	TokenCursor(List<VeroToken> tokens) {
		List<VeroToken> copy = new ArrayList<>();
		if (tokens != null) {
			tokens.stream().filter(Objects::nonNull).forEach(copy::add);
		}
		if (copy.isEmpty() || !copy.get(copy.size() - 1).isType(TokenType.EOF)) {
			Position end = copy.isEmpty() ? Position.START : copy.get(copy.size() - 1).position();
			copy.add(new VeroToken(TokenType.EOF, "", end));
		}
		this.tokens = copy;
	}

	VeroToken peek() {
		return tokens.get(current);
	}

	/**
	 * Looks {@code offset} tokens ahead; positions past the end resolve to EOF.
	 */
	VeroToken peek(int offset) {
		return tokens.get(Math.min(current + offset, tokens.size() - 1));
	}

	VeroToken previous() {
		return tokens.get(Math.max(current - 1, 0));
	}

	VeroToken advance() {
		VeroToken token = peek();
		if (!isAtEnd()) {
			current++;
		}
		return token;
	}

	boolean check(TokenType type) {
		return peek().type() == type;
	}

	boolean checkNext(TokenType type) {
		return peek(1).type() == type;
	}

	boolean match(TokenType type) {
		if (check(type)) {
			advance();
			return true;
		}
		return false;
	}

	VeroToken expect(TokenType type, String message) {
		if (check(type)) {
			return advance();
		}
		throw error(message);
	}

	/**
	 * Builds an error at the current token, quoting it after {@code message}.
	 */
	SyntaxError error(String message) {
		return new SyntaxError(message + " but found " + peek().describe(), peek());
	}

	boolean isAtEnd() {
		return peek().type() == TokenType.EOF;
	}

	int index() {
		return current;
	}
}
