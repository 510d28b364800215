package org.javai.vero;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.javai.vero.ast.FeatureNode;
import org.javai.vero.ast.PageNode;
import org.javai.vero.diagnostics.Diagnostic;

/**
 * Everything one compilation produced. The three diagnostic lists stay separate; generated
 * code is only fit for automated execution when all of them are empty.
 *
 * @param pages parsed pages, possibly partial
 * @param features parsed features, possibly partial
 * @param pageClasses generated page object classes keyed by page name
 * @param tests generated test files keyed by feature name
 * @param lexicalErrors diagnostics from the lexer
 * @param syntaxErrors diagnostics from the parser
 * @param generationErrors diagnostics from the transpiler
 */
public record CompilationResult(
		List<PageNode> pages,
		List<FeatureNode> features,
		Map<String, String> pageClasses,
		Map<String, String> tests,
		List<Diagnostic> lexicalErrors,
		List<Diagnostic> syntaxErrors,
		List<Diagnostic> generationErrors
) {

	public CompilationResult {
		pages = pages != null ? List.copyOf(pages) : List.of();
		features = features != null ? List.copyOf(features) : List.of();
		pageClasses = pageClasses != null ? Collections.unmodifiableMap(new LinkedHashMap<>(pageClasses)) : Map.of();
		tests = tests != null ? Collections.unmodifiableMap(new LinkedHashMap<>(tests)) : Map.of();
		lexicalErrors = lexicalErrors != null ? List.copyOf(lexicalErrors) : List.of();
		syntaxErrors = syntaxErrors != null ? List.copyOf(syntaxErrors) : List.of();
		generationErrors = generationErrors != null ? List.copyOf(generationErrors) : List.of();
	}

	public boolean isTrustworthy() {
		return lexicalErrors.isEmpty() && syntaxErrors.isEmpty() && generationErrors.isEmpty();
	}

	/**
	 * All diagnostics, lexical first, then syntax, then generation.
	 */
	public List<Diagnostic> allErrors() {
		List<Diagnostic> all = new ArrayList<>(lexicalErrors);
		all.addAll(syntaxErrors);
		all.addAll(generationErrors);
		return all;
	}

	public Optional<String> code(String featureName) {
		return Optional.ofNullable(tests.get(featureName));
	}
}
