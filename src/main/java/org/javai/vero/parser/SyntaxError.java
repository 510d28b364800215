package org.javai.vero.parser;

import org.javai.vero.lexer.VeroToken;

/**
 * Raised by grammar rules when the current token cannot continue the production. Never
 * escapes the parser: the enclosing dispatch loop turns it into a diagnostic and resynchronizes.
 */
class SyntaxError extends RuntimeException {

	private final transient VeroToken token;

	SyntaxError(String message, VeroToken token) {
		super(message, null, false, false);
		this.token = token;
	}

	VeroToken token() {
		return token;
	}
}
