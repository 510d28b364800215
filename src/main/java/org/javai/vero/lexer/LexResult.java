package org.javai.vero.lexer;

import java.util.List;
import org.javai.vero.diagnostics.Diagnostic;

/**
 * Output of {@link VeroLexer#tokenize()}: the token stream (always terminated by
 * {@link TokenType#EOF}) and the lexical diagnostics collected while scanning.
 */
public record LexResult(List<VeroToken> tokens, List<Diagnostic> errors) {

	public LexResult {
		tokens = tokens != null ? List.copyOf(tokens) : List.of();
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
