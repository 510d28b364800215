package org.javai.vero.codegen;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.vero.diagnostics.Diagnostic;

/**
 * Generated page object classes keyed by page name and test files keyed by feature name, each
 * in source order, plus generation diagnostics.
 */
public record TranspileResult(Map<String, String> pages, Map<String, String> tests, List<Diagnostic> errors) {

	public TranspileResult {
		pages = pages != null ? Collections.unmodifiableMap(new LinkedHashMap<>(pages)) : Map.of();
		tests = tests != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tests)) : Map.of();
		errors = errors != null ? List.copyOf(errors) : List.of();
	}

	public Optional<String> code(String featureName) {
		return Optional.ofNullable(tests.get(featureName));
	}

	public Optional<String> pageCode(String pageName) {
		return Optional.ofNullable(pages.get(pageName));
	}

	public boolean hasErrors() {
		return !errors.isEmpty();
	}
}
