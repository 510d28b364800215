package org.javai.vero.parser;

import java.util.List;
import org.javai.vero.ast.FeatureNode;
import org.javai.vero.ast.PageNode;
import org.javai.vero.diagnostics.Diagnostic;

/**
 * Pages and features parsed from a token stream, each in source order, plus the syntax
 * diagnostics found on the way. Both are best-effort when errors are present.
 */
public record ParseResult(List<PageNode> pages, List<FeatureNode> features, List<Diagnostic> errors) {

	public ParseResult {
		pages = pages != null ? List.copyOf(pages) : List.of();
		features = features != null ? List.copyOf(features) : List.of();
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
