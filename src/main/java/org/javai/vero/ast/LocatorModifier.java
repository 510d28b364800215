package org.javai.vero.ast;

import java.util.Objects;

/**
 * Refinement applied to a located element set: position picks and content filters.
 */
public sealed interface LocatorModifier {

	record First() implements LocatorModifier {
	}

	record Last() implements LocatorModifier {
	}

	/**
	 * Zero-based pick.
	 */
	record Nth(int index) implements LocatorModifier {
	}

	record WithText(ValueExpression text) implements LocatorModifier {
		public WithText {
			Objects.requireNonNull(text, "text must not be null");
		}
	}

	record WithoutText(ValueExpression text) implements LocatorModifier {
		public WithoutText {
			Objects.requireNonNull(text, "text must not be null");
		}
	}

	/**
	 * Keeps elements containing a descendant matched by {@code locator}.
	 */
	record Has(LocatorExpression locator) implements LocatorModifier {
		public Has {
			Objects.requireNonNull(locator, "locator must not be null");
		}
	}

	record HasNot(LocatorExpression locator) implements LocatorModifier {
		public HasNot {
			Objects.requireNonNull(locator, "locator must not be null");
		}
	}
}
