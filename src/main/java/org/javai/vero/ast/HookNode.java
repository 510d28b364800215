package org.javai.vero.ast;

import java.util.List;
import java.util.Objects;
import org.javai.vero.diagnostics.Position;

/**
 * Setup or teardown block of a feature ({@code BEFORE EACH { ... }}).
 */
public record HookNode(HookType type, List<StatementNode> statements, Position position) {

	public HookNode {
		Objects.requireNonNull(type, "type must not be null");
		statements = statements != null ? List.copyOf(statements) : List.of();
	}
}
