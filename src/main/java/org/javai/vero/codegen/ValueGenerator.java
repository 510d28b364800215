package org.javai.vero.codegen;

import org.javai.vero.ast.ValueExpression;

/**
 * Renders Vero values as TypeScript expressions. {@code {{path}}} references become run-time
 * lookups into the test's {@code vars} record; {@code {{env.NAME}}} reads the process
 * environment and {@code {{Page.variable}}} a page object's variable instead.
 */
class ValueGenerator {

	static final String LOOKUP_HELPER = """
			function lookup(vars: Record<string, any>, path: string): any {
			  return path.split('.').reduce((value, key) => (value == null ? undefined : value[key]), vars as any);
			}
			""";

	private static final String ENV_PREFIX = "env.";

	private final PageScope pages;
	private boolean usesLookup = false;

	ValueGenerator(PageScope pages) {
		this.pages = pages;
	}

	PageScope pages() {
		return pages;
	}

	/**
	 * Whether any rendered value needs the {@code lookup} helper.
	 */
	boolean usesLookup() {
		return usesLookup;
	}

	/**
	 * Records that hand-written code calls the {@code lookup} helper.
	 */
	void requireLookup() {
		usesLookup = true;
	}

	/**
	 * The value with its natural type: strings, numbers, booleans or whatever a variable holds.
	 */
	String expression(ValueExpression value) {
		if (value instanceof ValueExpression.Text text) {
			return text(text);
		}
		if (value instanceof ValueExpression.Number number) {
			return number.literal();
		}
		if (value instanceof ValueExpression.Bool bool) {
			return Boolean.toString(bool.value());
		}
		if (value instanceof ValueExpression.Variable variable) {
			return reference(variable.path());
		}
		throw new GenerationException("No rendering for value " + value);
	}

	/**
	 * The value as a string expression, for APIs that only accept strings.
	 */
	String string(ValueExpression value) {
		if (value instanceof ValueExpression.Number number) {
			return quote(number.literal());
		}
		if (value instanceof ValueExpression.Bool bool) {
			return quote(Boolean.toString(bool.value()));
		}
		if (value instanceof ValueExpression.Variable variable) {
			return "String(" + reference(variable.path()) + " ?? '')";
		}
		return expression(value);
	}

	/**
	 * A literal from a locator or similar string field, with references resolved.
	 */
	String literal(String raw) {
		return text(ValueExpression.Text.parse(raw));
	}

	String text(ValueExpression.Text text) {
		if (!text.isInterpolated()) {
			return quote(text.raw());
		}
		StringBuilder sb = new StringBuilder("`");
		for (ValueExpression.Segment segment : text.segments()) {
			if (segment instanceof ValueExpression.Literal literal) {
				sb.append(escapeTemplate(literal.text()));
			}
			else if (segment instanceof ValueExpression.VariableSegment variable) {
				String path = variable.path();
				if (isEnvironmentPath(path)) {
					sb.append("${").append(environment(path)).append(" ?? ''}");
				}
				else {
					sb.append("${").append(reference(path)).append('}');
				}
			}
		}
		return sb.append('`').toString();
	}

	String reference(String path) {
		if (isEnvironmentPath(path)) {
			return environment(path);
		}
		String pageVariable = pages.variable(path);
		if (pageVariable != null) {
			return pageVariable;
		}
		usesLookup = true;
		return "lookup(vars, " + quote(path) + ")";
	}

	private static boolean isEnvironmentPath(String path) {
		return path.startsWith(ENV_PREFIX) && path.indexOf('.', ENV_PREFIX.length()) < 0;
	}

	private static String environment(String path) {
		return "process.env[" + quote(path.substring(ENV_PREFIX.length())) + "]";
	}

	/**
	 * Single-quoted TypeScript string literal.
	 */
	static String quote(String value) {
		StringBuilder sb = new StringBuilder("'");
		for (char c : value.toCharArray()) {
			switch (c) {
				case '\\' -> sb.append("\\\\");
				case '\'' -> sb.append("\\'");
				case '\n' -> sb.append("\\n");
				case '\r' -> sb.append("\\r");
				case '\t' -> sb.append("\\t");
				default -> sb.append(c);
			}
		}
		return sb.append('\'').toString();
	}

	private static String escapeTemplate(String value) {
		return value.replace("\\", "\\\\").replace("`", "\\`").replace("${", "\\${");
	}
}
