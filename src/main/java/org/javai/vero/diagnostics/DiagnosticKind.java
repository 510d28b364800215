package org.javai.vero.diagnostics;

/**
 * Pipeline stage that produced a diagnostic.
 */
public enum DiagnosticKind {
	/** Unrecognized character, unterminated string or variable marker. */
	LEXICAL,
	/** Unexpected token, missing clause, unterminated block. */
	SYNTAX,
	/** AST content the code generator could not represent. Indicates a defect, not bad input. */
	GENERATION
}
