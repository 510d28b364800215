package org.javai.vero.codegen;

import org.javai.vero.ast.LocatorExpression;
import org.javai.vero.ast.LocatorModifier;

/**
 * Maps locator expressions onto Playwright's locator API. The strategy mapping is a total
 * visitor; modifiers are appended as chained calls in source order. Page fields resolve to the
 * page object's locator, whatever the root.
 */
class LocatorGenerator {

	private final ValueGenerator values;

	LocatorGenerator(ValueGenerator values) {
		this.values = values;
	}

	/**
	 * @param root expression the locator is resolved from, for example {@code page}
	 */
	String generate(LocatorExpression locator, String root) {
		StringBuilder sb = new StringBuilder(locator.accept(new BaseVisitor(root)));
		for (LocatorModifier modifier : locator.modifiers()) {
			sb.append(modifier(modifier, root));
		}
		return sb.toString();
	}

	private String modifier(LocatorModifier modifier, String root) {
		if (modifier instanceof LocatorModifier.First) {
			return ".first()";
		}
		if (modifier instanceof LocatorModifier.Last) {
			return ".last()";
		}
		if (modifier instanceof LocatorModifier.Nth nth) {
			return ".nth(" + nth.index() + ")";
		}
		if (modifier instanceof LocatorModifier.WithText withText) {
			return ".filter({ hasText: " + values.string(withText.text()) + " })";
		}
		if (modifier instanceof LocatorModifier.WithoutText withoutText) {
			return ".filter({ hasNotText: " + values.string(withoutText.text()) + " })";
		}
		if (modifier instanceof LocatorModifier.Has has) {
			return ".filter({ has: " + generate(has.locator(), root) + " })";
		}
		if (modifier instanceof LocatorModifier.HasNot hasNot) {
			return ".filter({ hasNot: " + generate(hasNot.locator(), root) + " })";
		}
		throw new GenerationException("No generation rule for locator modifier " + modifier);
	}

	/**
	 * Produces the base locator, before any modifier.
	 */
	private class BaseVisitor implements LocatorExpression.Visitor<String> {

		private final String root;

		BaseVisitor(String root) {
			this.root = root;
		}

		private String call(String method, String arguments) {
			return root + "." + method + "(" + arguments + ")";
		}

		@Override
		public String visitRole(LocatorExpression.Role locator) {
			String role = values.literal(locator.role());
			if (locator.accessibleName() == null) {
				return call("getByRole", role);
			}
			return call("getByRole", role + ", { name: " + values.literal(locator.accessibleName()) + " }");
		}

		@Override
		public String visitText(LocatorExpression.Text locator) {
			return call("getByText", values.literal(locator.text()));
		}

		@Override
		public String visitLabel(LocatorExpression.Label locator) {
			return call("getByLabel", values.literal(locator.label()));
		}

		@Override
		public String visitPlaceholder(LocatorExpression.Placeholder locator) {
			return call("getByPlaceholder", values.literal(locator.placeholder()));
		}

		@Override
		public String visitTestId(LocatorExpression.TestId locator) {
			return call("getByTestId", values.literal(locator.testId()));
		}

		@Override
		public String visitAltText(LocatorExpression.AltText locator) {
			return call("getByAltText", values.literal(locator.altText()));
		}

		@Override
		public String visitTitle(LocatorExpression.Title locator) {
			return call("getByTitle", values.literal(locator.title()));
		}

		@Override
		public String visitCss(LocatorExpression.Css locator) {
			return call("locator", values.literal(locator.selector()));
		}

		@Override
		public String visitXPath(LocatorExpression.XPath locator) {
			return call("locator", values.literal("xpath=" + locator.expression()));
		}

		@Override
		public String visitPageField(LocatorExpression.PageField locator) {
			return values.pages().field(locator);
		}
	}
}
