package org.javai.vero.ast;

import java.util.Objects;
import org.javai.vero.diagnostics.Position;

/**
 * {@code FIELD name = locator} inside a page.
 */
public record FieldNode(String name, LocatorExpression locator, Position position) {

	public FieldNode {
		Objects.requireNonNull(name, "name must not be null");
		Objects.requireNonNull(locator, "locator must not be null");
	}
}
