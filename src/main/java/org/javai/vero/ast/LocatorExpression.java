package org.javai.vero.ast;

import java.util.List;
import java.util.Objects;

/**
 * How a statement addresses a UI element: one strategy plus an ordered chain of refining
 * modifiers. The strategy set mirrors the locator API of the automation target.
 */
public sealed interface LocatorExpression {

	/**
	 * Modifiers applied after the base strategy, in source order.
	 */
	List<LocatorModifier> modifiers();

	/**
	 * Returns a copy of this locator with a different modifier chain.
	 */
	LocatorExpression withModifiers(List<LocatorModifier> modifiers);

	<R> R accept(Visitor<R> visitor);

	/**
	 * One method per strategy. Adding a strategy without a generation rule fails to compile.
	 */
	interface Visitor<R> {
		R visitRole(Role locator);

		R visitText(Text locator);

		R visitLabel(Label locator);

		R visitPlaceholder(Placeholder locator);

		R visitTestId(TestId locator);

		R visitAltText(AltText locator);

		R visitTitle(Title locator);

		R visitCss(Css locator);

		R visitXPath(XPath locator);

		R visitPageField(PageField locator);
	}

	/**
	 * ARIA role, optionally narrowed by accessible name.
	 */
	record Role(String role, String accessibleName, List<LocatorModifier> modifiers) implements LocatorExpression {
		public Role {
			Objects.requireNonNull(role, "role must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public Role withModifiers(List<LocatorModifier> modifiers) {
			return new Role(role, accessibleName, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitRole(this);
		}
	}

	record Text(String text, List<LocatorModifier> modifiers) implements LocatorExpression {
		public Text {
			Objects.requireNonNull(text, "text must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public Text withModifiers(List<LocatorModifier> modifiers) {
			return new Text(text, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitText(this);
		}
	}

	record Label(String label, List<LocatorModifier> modifiers) implements LocatorExpression {
		public Label {
			Objects.requireNonNull(label, "label must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public Label withModifiers(List<LocatorModifier> modifiers) {
			return new Label(label, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLabel(this);
		}
	}

	record Placeholder(String placeholder, List<LocatorModifier> modifiers) implements LocatorExpression {
		public Placeholder {
			Objects.requireNonNull(placeholder, "placeholder must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public Placeholder withModifiers(List<LocatorModifier> modifiers) {
			return new Placeholder(placeholder, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPlaceholder(this);
		}
	}

	record TestId(String testId, List<LocatorModifier> modifiers) implements LocatorExpression {
		public TestId {
			Objects.requireNonNull(testId, "testId must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public TestId withModifiers(List<LocatorModifier> modifiers) {
			return new TestId(testId, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitTestId(this);
		}
	}

	record AltText(String altText, List<LocatorModifier> modifiers) implements LocatorExpression {
		public AltText {
			Objects.requireNonNull(altText, "altText must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public AltText withModifiers(List<LocatorModifier> modifiers) {
			return new AltText(altText, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAltText(this);
		}
	}

	record Title(String title, List<LocatorModifier> modifiers) implements LocatorExpression {
		public Title {
			Objects.requireNonNull(title, "title must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public Title withModifiers(List<LocatorModifier> modifiers) {
			return new Title(title, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitTitle(this);
		}
	}

	record Css(String selector, List<LocatorModifier> modifiers) implements LocatorExpression {
		public Css {
			Objects.requireNonNull(selector, "selector must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public Css withModifiers(List<LocatorModifier> modifiers) {
			return new Css(selector, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitCss(this);
		}
	}

	record XPath(String expression, List<LocatorModifier> modifiers) implements LocatorExpression {
		public XPath {
			Objects.requireNonNull(expression, "expression must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public XPath withModifiers(List<LocatorModifier> modifiers) {
			return new XPath(expression, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitXPath(this);
		}
	}

	/**
	 * A field declared in a page, {@code LoginPage.email}. Resolves to the locator the page
	 * object built at construction time, not relative to the active frame.
	 *
	 * @param page page name, or {@code null} for a bare field name inside a page action
	 */
	record PageField(String page, String field, List<LocatorModifier> modifiers) implements LocatorExpression {
		public PageField {
			Objects.requireNonNull(field, "field must not be null");
			modifiers = copy(modifiers);
		}

		@Override
		public PageField withModifiers(List<LocatorModifier> modifiers) {
			return new PageField(page, field, modifiers);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPageField(this);
		}
	}

	private static List<LocatorModifier> copy(List<LocatorModifier> modifiers) {
		return modifiers != null ? List.copyOf(modifiers) : List.of();
	}
}
