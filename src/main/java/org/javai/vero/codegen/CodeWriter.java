package org.javai.vero.codegen;

/**
 * Line-oriented text buffer with block indentation.
 */
class CodeWriter {

	private final StringBuilder code = new StringBuilder();
	private final String indentUnit;
	private int indentLevel = 0;

	CodeWriter(String indentUnit) {
		this.indentUnit = indentUnit;
	}

	CodeWriter line(String text) {
		code.append(indentUnit.repeat(indentLevel)).append(text).append('\n');
		return this;
	}

	CodeWriter blank() {
		code.append('\n');
		return this;
	}

	/**
	 * Writes {@code header} and indents the following lines.
	 */
	CodeWriter open(String header) {
		line(header);
		indentLevel++;
		return this;
	}

	/**
	 * Dedents and writes {@code footer}.
	 */
	CodeWriter close(String footer) {
		indentLevel = Math.max(0, indentLevel - 1);
		return line(footer);
	}

	/**
	 * Writes {@code text} one level out, between two blocks (the else line of an if).
	 */
	CodeWriter reopen(String text) {
		indentLevel = Math.max(0, indentLevel - 1);
		line(text);
		indentLevel++;
		return this;
	}

	@Override
	public String toString() {
		return code.toString();
	}
}
