package org.javai.vero.diagnostics;

import java.util.Objects;

/**
 * A problem found while compiling Vero source, reported alongside (not instead of) the
 * best-effort output of the stage that found it.
 *
 * @param message human readable description
 * @param position where the problem starts
 * @param severity always {@link Severity#ERROR} for now
 * @param kind the stage that reported it
 */
public record Diagnostic(String message, Position position, Severity severity, DiagnosticKind kind) {

	public Diagnostic {
		Objects.requireNonNull(message, "message must not be null");
		position = position != null ? position : Position.START;
		severity = severity != null ? severity : Severity.ERROR;
		Objects.requireNonNull(kind, "kind must not be null");
	}

	public static Diagnostic lexical(String message, Position position) {
		return new Diagnostic(message, position, Severity.ERROR, DiagnosticKind.LEXICAL);
	}

	public static Diagnostic syntax(String message, Position position) {
		return new Diagnostic(message, position, Severity.ERROR, DiagnosticKind.SYNTAX);
	}

	public static Diagnostic generation(String message, Position position) {
		return new Diagnostic(message, position, Severity.ERROR, DiagnosticKind.GENERATION);
	}

	@Override
	public String toString() {
		return position + ": " + severity.name().toLowerCase() + ": " + message;
	}
}
