package org.javai.vero.ast;

import java.util.List;
import java.util.Objects;
import org.javai.vero.diagnostics.Position;

/**
 * A named, parameterized statement sequence inside a page, invoked with {@code DO}.
 *
 * @param parameters parameter names; inside the body they are read as {@code {{name}}}
 */
public record ActionDefinitionNode(String name, List<String> parameters, List<StatementNode> statements,
		Position position) {

	public ActionDefinitionNode {
		Objects.requireNonNull(name, "name must not be null");
		parameters = parameters != null ? List.copyOf(parameters) : List.of();
		statements = statements != null ? List.copyOf(statements) : List.of();
	}
}
