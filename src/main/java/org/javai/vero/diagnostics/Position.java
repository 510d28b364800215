package org.javai.vero.diagnostics;

/**
 * A location in Vero source text.
 *
 * @param line 1-based line number
 * @param column 1-based column number
 * @param offset 0-based character offset from the start of the source
 */
public record Position(int line, int column, int offset) {

	public static final Position START = new Position(1, 1, 0);

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
