package org.javai.vero.ast;

import java.util.Arrays;
import java.util.Optional;

/**
 * Declared type of a page variable. The spelling is the constant name.
 */
public enum VariableType {
	TEXT,
	NUMBER,
	FLAG,
	LIST;

	public static Optional<VariableType> fromWord(String word) {
		return Arrays.stream(values()).filter(type -> type.name().equals(word)).findFirst();
	}
}
