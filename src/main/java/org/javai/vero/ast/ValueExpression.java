package org.javai.vero.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Operand of a statement or condition: URLs, fill values, option labels, messages and
 * comparison operands.
 */
public sealed interface ValueExpression {

	/**
	 * A string literal split into literal runs and {@code {{path}}} references, in source
	 * order. References are resolved when the generated test runs.
	 */
	record Text(List<Segment> segments) implements ValueExpression {
		public Text {
			segments = segments != null ? List.copyOf(segments) : List.of();
		}

		private static final Pattern REFERENCE = Pattern.compile(
				"\\{\\{\\s*([A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*)\\s*}}");

		public static Text literal(String value) {
			return new Text(value.isEmpty() ? List.of() : List.of(new Literal(value)));
		}

		/**
		 * Splits decoded string content on {@code {{path}}} references. Braces that do not
		 * form a valid reference stay literal text.
		 */
		public static Text parse(String value) {
			List<Segment> segments = new ArrayList<>();
			Matcher matcher = REFERENCE.matcher(value);
			int last = 0;
			while (matcher.find()) {
				if (matcher.start() > last) {
					segments.add(new Literal(value.substring(last, matcher.start())));
				}
				segments.add(new VariableSegment(matcher.group(1)));
				last = matcher.end();
			}
			if (last < value.length()) {
				segments.add(new Literal(value.substring(last)));
			}
			return new Text(segments);
		}

		public boolean isInterpolated() {
			return segments.stream().anyMatch(VariableSegment.class::isInstance);
		}

		/**
		 * Source spelling with {@code {{path}}} markers put back.
		 */
		public String raw() {
			StringBuilder sb = new StringBuilder();
			for (Segment segment : segments) {
				if (segment instanceof Literal literal) {
					sb.append(literal.text());
				} else if (segment instanceof VariableSegment variable) {
					sb.append("{{").append(variable.path()).append("}}");
				}
			}
			return sb.toString();
		}
	}

	/**
	 * Numeric literal kept in its source spelling.
	 */
	record Number(String literal) implements ValueExpression {
		public Number {
			Objects.requireNonNull(literal, "literal must not be null");
		}
	}

	record Bool(boolean value) implements ValueExpression {
	}

	/**
	 * A bare {@code {{path}}} operand, resolved at run time without string conversion.
	 */
	record Variable(String path) implements ValueExpression {
		public Variable {
			Objects.requireNonNull(path, "path must not be null");
		}
	}

	sealed interface Segment {
	}

	record Literal(String text) implements Segment {
		public Literal {
			Objects.requireNonNull(text, "text must not be null");
		}
	}

	record VariableSegment(String path) implements Segment {
		public VariableSegment {
			Objects.requireNonNull(path, "path must not be null");
		}
	}
}
