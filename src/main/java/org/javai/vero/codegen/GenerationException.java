package org.javai.vero.codegen;

/**
 * Thrown when an AST node cannot be expressed in the generated code. Caught per statement by
 * the transpiler and reported as a generation diagnostic.
 */
public class GenerationException extends RuntimeException {

	public GenerationException(String message) {
		super(message);
	}
}
