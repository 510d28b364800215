package org.javai.vero.ast;

import java.util.List;
import java.util.Objects;
import org.javai.vero.diagnostics.Position;

/**
 * A typed page-level variable such as {@code TEXT greeting = "Hello"}.
 *
 * @param values initial value; exactly one except for {@link VariableType#LIST}
 */
public record PageVariableNode(VariableType type, String name, List<ValueExpression> values, Position position) {

	public PageVariableNode {
		Objects.requireNonNull(type, "type must not be null");
		Objects.requireNonNull(name, "name must not be null");
		values = values != null ? List.copyOf(values) : List.of();
		if (type != VariableType.LIST && values.size() != 1) {
			throw new IllegalArgumentException(type + " variable '" + name + "' needs exactly one value");
		}
	}
}
