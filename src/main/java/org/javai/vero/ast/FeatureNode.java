package org.javai.vero.ast;

import java.util.List;
import java.util.Objects;
import org.javai.vero.diagnostics.Position;

/**
 * Root of one {@code FEATURE} block: the pages it uses, its hooks and its scenarios in source
 * order.
 */
public record FeatureNode(String name, List<String> uses, List<HookNode> hooks, List<ScenarioNode> scenarios,
		Position position) {

	public FeatureNode {
		Objects.requireNonNull(name, "name must not be null");
		uses = uses != null ? List.copyOf(uses) : List.of();
		hooks = hooks != null ? List.copyOf(hooks) : List.of();
		scenarios = scenarios != null ? List.copyOf(scenarios) : List.of();
	}
}
