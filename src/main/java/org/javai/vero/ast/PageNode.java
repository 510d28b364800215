package org.javai.vero.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.javai.vero.diagnostics.Position;

/**
 * A {@code PAGE} block: named element locators, page-level variables and reusable actions,
 * generated as one page object class.
 *
 * @param name class name of the generated page object
 * @param fields element locators, in source order
 * @param variables page-level variables, in source order
 * @param actions reusable statement sequences, in source order
 * @param position position of the {@code PAGE} keyword
 */
public record PageNode(
		String name,
		List<FieldNode> fields,
		List<PageVariableNode> variables,
		List<ActionDefinitionNode> actions,
		Position position
) {

	public PageNode {
		Objects.requireNonNull(name, "name must not be null");
		fields = fields != null ? List.copyOf(fields) : List.of();
		variables = variables != null ? List.copyOf(variables) : List.of();
		actions = actions != null ? List.copyOf(actions) : List.of();
	}

	public Optional<FieldNode> field(String fieldName) {
		return fields.stream().filter(f -> f.name().equals(fieldName)).findFirst();
	}

	public Optional<PageVariableNode> variable(String variableName) {
		return variables.stream().filter(v -> v.name().equals(variableName)).findFirst();
	}

	public Optional<ActionDefinitionNode> action(String actionName) {
		return actions.stream().filter(a -> a.name().equals(actionName)).findFirst();
	}
}
