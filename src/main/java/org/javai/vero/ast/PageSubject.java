package org.javai.vero.ast;

/**
 * Page-level property checked by {@code ASSERT URL ...} and {@code ASSERT TITLE ...}.
 */
public enum PageSubject {
	URL,
	TITLE
}
