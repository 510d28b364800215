package org.javai.vero.codegen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.javai.vero.ast.FeatureNode;
import org.javai.vero.ast.PageNode;
import org.javai.vero.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lowers parsed pages into page object classes and features into Playwright test source, one
 * file each.
 * <p>
 * Generation never reads or mutates anything outside the call: each feature gets fresh
 * generators, so a transpiler instance can be shared between threads. Input with earlier
 * lexical or syntax errors is accepted; the output is then best effort.
 */
public class VeroTranspiler {

	private static final Logger logger = LoggerFactory.getLogger(VeroTranspiler.class);

	private final TranspileOptions options;

	public VeroTranspiler() {
		this(TranspileOptions.defaults());
	}

	public VeroTranspiler(TranspileOptions options) {
		this.options = Objects.requireNonNull(options, "options must not be null");
	}

	public TranspileOptions options() {
		return options;
	}

	public TranspileResult transpile(List<FeatureNode> features) {
		return transpile(List.of(), features, List.of());
	}

	public TranspileResult transpile(List<PageNode> pages, List<FeatureNode> features) {
		return transpile(pages, features, List.of());
	}

	/**
	 * @param pages pages to generate, which features may also {@code USE}
	 * @param features features to generate
	 * @param sharedPages pages generated elsewhere that features may {@code USE}; a page in
	 * {@code pages} hides a shared page of the same name
	 */
	public TranspileResult transpile(List<PageNode> pages, List<FeatureNode> features, List<PageNode> sharedPages) {
		Map<String, PageNode> ownPages = new LinkedHashMap<>();
		for (PageNode page : pages != null ? pages : List.<PageNode>of()) {
			if (ownPages.put(page.name(), page) != null) {
				logger.warn("Page '{}' is defined more than once; keeping the last definition", page.name());
			}
		}
		Map<String, PageNode> knownPages = new LinkedHashMap<>();
		for (PageNode shared : sharedPages != null ? sharedPages : List.<PageNode>of()) {
			knownPages.put(shared.name(), shared);
		}
		knownPages.putAll(ownPages);

		List<Diagnostic> errors = new ArrayList<>();
		Map<String, String> pageClasses = new LinkedHashMap<>();
		for (PageNode page : ownPages.values()) {
			pageClasses.put(page.name(), new PageGenerator(page, options, errors).generate());
		}

		Map<String, String> tests = new LinkedHashMap<>();
		for (FeatureNode feature : features != null ? features : List.<FeatureNode>of()) {
			String code = new FeatureGenerator(feature, knownPages, options, errors).generate();
			if (tests.put(feature.name(), code) != null) {
				logger.warn("Feature '{}' is defined more than once; keeping the last definition", feature.name());
			}
		}

		logger.debug("Generated {} page object(s) and {} test file(s) with {} generation error(s)",
				pageClasses.size(), tests.size(), errors.size());
		return new TranspileResult(pageClasses, tests, errors);
	}
}
