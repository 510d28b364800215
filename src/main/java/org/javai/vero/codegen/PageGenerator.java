package org.javai.vero.codegen;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import org.javai.vero.ast.ActionDefinitionNode;
import org.javai.vero.ast.FieldNode;
import org.javai.vero.ast.PageNode;
import org.javai.vero.ast.PageVariableNode;
import org.javai.vero.ast.VariableType;
import org.javai.vero.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the page object class for one page. Fields become read-only locators created in the
 * constructor, variables become typed properties and each action an async method whose
 * parameters seed the method's {@code vars} record.
 */
class PageGenerator {

	private static final Logger logger = LoggerFactory.getLogger(PageGenerator.class);

	private static final String PLAYWRIGHT_MODULE = "@playwright/test";

	private final PageNode page;
	private final List<Diagnostic> errors;
	private final PageScope scope;
	private final CodeWriter body;
	private final ValueGenerator values;
	private final StatementGenerator statements;
	private boolean usesFrames = false;

	PageGenerator(PageNode page, TranspileOptions options, List<Diagnostic> errors) {
		this.page = page;
		this.errors = errors;
		this.scope = PageScope.forPage(page);
		this.body = new CodeWriter(options.indent());
		this.values = new ValueGenerator(scope);
		this.statements = new StatementGenerator(body, values, options, errors);
	}

	String generate() {
		List<String> assignments = new ArrayList<>();
		List<String> declarations = new ArrayList<>();
		for (FieldNode field : page.fields()) {
			try {
				String locator = fieldLocator(field);
				declarations.add("readonly " + field.name() + ": Locator;");
				assignments.add("this." + field.name() + " = " + locator + ";");
			}
			catch (GenerationException e) {
				logger.warn("Could not generate field '{}' of page '{}' at {}: {}", field.name(), page.name(),
						field.position(), e.getMessage());
				errors.add(Diagnostic.generation(e.getMessage(), field.position()));
				assignments.add("// vero: Field at " + field.position() + " was not generated: " + e.getMessage());
			}
		}
		for (PageVariableNode variable : page.variables()) {
			declarations.add(variable.name() + ": " + typeOf(variable.type()) + ";");
			try {
				assignments.add("this." + variable.name() + " = " + initialValue(variable) + ";");
			}
			catch (GenerationException e) {
				logger.warn("Could not generate variable '{}' of page '{}' at {}: {}", variable.name(), page.name(),
						variable.position(), e.getMessage());
				errors.add(Diagnostic.generation(e.getMessage(), variable.position()));
				assignments.add("// vero: Variable at " + variable.position() + " was not generated: " + e.getMessage());
			}
		}

		body.open("export class " + page.name() + " {");
		body.line("readonly page: Page;");
		declarations.forEach(body::line);
		body.blank();
		body.open("constructor(page: Page) {");
		body.line("this.page = page;");
		assignments.forEach(body::line);
		body.close("}");
		for (ActionDefinitionNode action : page.actions()) {
			body.blank();
			generateAction(action);
		}
		body.close("}");

		StringBuilder file = new StringBuilder();
		file.append("import { expect, type Locator, type Page").append(usesFrames ? ", type FrameLocator" : "")
				.append(" } from ").append(ValueGenerator.quote(PLAYWRIGHT_MODULE)).append(";\n\n");
		if (values.usesLookup()) {
			file.append(ValueGenerator.LOOKUP_HELPER).append('\n');
		}
		return file.append(body).toString();
	}

	/**
	 * Fields and variables are built in the constructor, before any action has a {@code vars}
	 * record to read.
	 */
	private String fieldLocator(FieldNode field) {
		ValueGenerator fieldValues = new ValueGenerator(scope);
		String locator = new LocatorGenerator(fieldValues).generate(field.locator(), "page");
		if (fieldValues.usesLookup()) {
			throw new GenerationException("Field '" + field.name()
					+ "' cannot use {{variables}}; fields are created with the page object");
		}
		return locator;
	}

	private void generateAction(ActionDefinitionNode action) {
		String parameters = action.parameters().stream().map(p -> p + ": any").collect(Collectors.joining(", "));
		body.open("async " + action.name() + "(" + parameters + "): Promise<void> {");
		body.line("const page = this.page;");
		body.line("const vars: Record<string, any> = {" + (action.parameters().isEmpty()
				? ""
				: " " + String.join(", ", action.parameters()) + " ") + "};");
		if (FrameSwitches.containsSwitch(action.statements())) {
			usesFrames = true;
			body.line("let frame: FrameLocator | null = null;");
		}
		statements.generateBlock(action.statements(), FrameContext.root());
		body.close("}");
	}

	private String initialValue(PageVariableNode variable) {
		ValueGenerator initialValues = new ValueGenerator(scope);
		String value = variable.type() == VariableType.LIST
				? variable.values().stream().map(initialValues::expression).collect(Collectors.joining(", ", "[", "]"))
				: initialValues.expression(variable.values().get(0));
		if (initialValues.usesLookup()) {
			throw new GenerationException("Variable '" + variable.name()
					+ "' cannot use {{variables}}; variables are created with the page object");
		}
		return value;
	}

	private static String typeOf(VariableType type) {
		return switch (type) {
			case TEXT -> "string";
			case NUMBER -> "number";
			case FLAG -> "boolean";
			case LIST -> "string[]";
		};
	}
}
