package org.javai.vero.codegen;

import java.util.List;
import java.util.Map;
import org.javai.vero.ast.FeatureNode;
import org.javai.vero.ast.HookNode;
import org.javai.vero.ast.HookType;
import org.javai.vero.ast.PageNode;
import org.javai.vero.ast.ScenarioNode;
import org.javai.vero.ast.StatementNode;
import org.javai.vero.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the Playwright test file for one feature: a {@code test.describe} block holding the
 * hooks and one {@code test} per scenario. Every test body gets its own {@code vars} record
 * and, when it switches frames, its own {@code frame} variable; the frame context restarts
 * at the root for each of them. Pages the feature uses are imported and created on the test's
 * page before each test.
 */
class FeatureGenerator {

	private static final Logger logger = LoggerFactory.getLogger(FeatureGenerator.class);

	private final FeatureNode feature;
	private final TranspileOptions options;
	private final CodeWriter body;
	private final PageScope pages;
	private final ValueGenerator values;
	private final StatementGenerator statements;
	private boolean usesFrames = false;

	FeatureGenerator(FeatureNode feature, Map<String, PageNode> knownPages, TranspileOptions options,
			List<Diagnostic> errors) {
		this.feature = feature;
		this.options = options;
		this.body = new CodeWriter(options.indent());
		this.pages = PageScope.forFeature(knownPages, feature.uses());
		this.values = new ValueGenerator(pages);
		this.statements = new StatementGenerator(body, values, options, errors);
		for (String use : feature.uses()) {
			if (!knownPages.containsKey(use)) {
				logger.warn("Feature '{}' uses unknown page '{}'", feature.name(), use);
				errors.add(Diagnostic.generation("Unknown page '" + use + "' in USE", feature.position()));
			}
		}
	}

	String generate() {
		body.open("test.describe(" + ValueGenerator.quote(feature.name()) + ", () => {");
		boolean first = true;
		if (options.baseUrl() != null) {
			body.line("test.use({ baseURL: " + ValueGenerator.quote(options.baseUrl()) + " });");
			first = false;
		}
		if (!pages.usedPages().isEmpty()) {
			if (!first) {
				body.blank();
			}
			generatePageSetup();
			first = false;
		}
		for (HookNode hook : feature.hooks()) {
			if (!first) {
				body.blank();
			}
			generateHook(hook);
			first = false;
		}
		for (ScenarioNode scenario : feature.scenarios()) {
			if (!first) {
				body.blank();
			}
			generateScenario(scenario);
			first = false;
		}
		body.close("});");

		StringBuilder file = new StringBuilder();
		file.append("import { test, expect").append(usesFrames ? ", type FrameLocator" : "")
				.append(" } from ").append(ValueGenerator.quote(options.testModule())).append(";\n");
		for (PageNode page : pages.usedPages()) {
			file.append("import { ").append(page.name()).append(" } from ")
					.append(ValueGenerator.quote(options.pageImportPath() + "/" + page.name())).append(";\n");
		}
		file.append('\n');
		if (values.usesLookup()) {
			file.append(ValueGenerator.LOOKUP_HELPER).append('\n');
		}
		return file.append(body).toString();
	}

	/**
	 * One variable per used page, assigned before every test.
	 */
	private void generatePageSetup() {
		for (PageNode page : pages.usedPages()) {
			body.line("let " + PageScope.instanceName(page.name()) + ": " + page.name() + ";");
		}
		body.blank();
		body.open("test.beforeEach(async ({ page }) => {");
		for (PageNode page : pages.usedPages()) {
			body.line(PageScope.instanceName(page.name()) + " = new " + page.name() + "(page);");
		}
		body.close("});");
	}

	private void generateHook(HookNode hook) {
		boolean suiteLevel = hook.type() == HookType.BEFORE_ALL || hook.type() == HookType.AFTER_ALL;
		String fixture = suiteLevel ? "browser" : "page";
		body.open("test." + hookFunction(hook.type()) + "(async ({ " + fixture + " }) => {");
		if (suiteLevel) {
			body.line("const page = await browser.newPage();");
			// suite-level hooks run outside any test, on page objects of their own page
			for (PageNode page : pages.usedPages()) {
				body.line("const " + PageScope.instanceName(page.name()) + " = new " + page.name() + "(page);");
			}
		}
		generateBody(hook.statements());
		if (suiteLevel) {
			body.line("await page.close();");
		}
		body.close("});");
	}

	private void generateScenario(ScenarioNode scenario) {
		body.open("test(" + ValueGenerator.quote(title(scenario)) + ", async ({ page }) => {");
		generateBody(scenario.statements());
		body.close("});");
	}

	private void generateBody(List<StatementNode> statementNodes) {
		body.line("const vars: Record<string, any> = {};");
		if (FrameSwitches.containsSwitch(statementNodes)) {
			usesFrames = true;
			body.line("let frame: FrameLocator | null = null;");
		}
		statements.generateBlock(statementNodes, FrameContext.root());
	}

	/**
	 * Scenario name followed by its tags, the form Playwright's {@code --grep} filters on.
	 */
	static String title(ScenarioNode scenario) {
		StringBuilder title = new StringBuilder(scenario.name());
		for (String tag : scenario.tags()) {
			title.append(" @").append(tag);
		}
		return title.toString();
	}

	private static String hookFunction(HookType type) {
		return switch (type) {
			case BEFORE_EACH -> "beforeEach";
			case AFTER_EACH -> "afterEach";
			case BEFORE_ALL -> "beforeAll";
			case AFTER_ALL -> "afterAll";
		};
	}
}
