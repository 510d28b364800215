package org.javai.vero.ast;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.javai.vero.diagnostics.Position;

/**
 * A single test case.
 *
 * @param name scenario title
 * @param tags tag names without the leading {@code @}, in first-seen order
 * @param statements steps in execution order
 * @param position position of the {@code SCENARIO} keyword
 */
public record ScenarioNode(String name, Set<String> tags, List<StatementNode> statements, Position position) {

	public ScenarioNode {
		Objects.requireNonNull(name, "name must not be null");
		tags = tags != null ? Collections.unmodifiableSet(new LinkedHashSet<>(tags)) : Set.of();
		statements = statements != null ? List.copyOf(statements) : List.of();
	}
}
