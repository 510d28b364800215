package org.javai.vero.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import org.javai.vero.ast.LocatorExpression;
import org.javai.vero.ast.LocatorModifier;
import org.javai.vero.lexer.TokenType;
import org.javai.vero.lexer.VeroToken;

/**
 * Parses locator expressions:
 * <pre>
 * locator  := (strategy STRING ('name' STRING)? | roleShorthand STRING | STRING | IDENTIFIER '.' IDENTIFIER) modifier*
 * modifier := FIRST | LAST | NTH NUMBER | WITH TEXT value | WITHOUT TEXT value | HAS NOT? locator
 * </pre>
 * Strategy words are matched on identifier text, so they stay free for use as names elsewhere.
 * A locator nested by {@code HAS} takes no modifiers of its own; modifiers after it refine the
 * outer locator. {@code Page.field} names a page field; inside a page action a bare field name
 * does too.
 */
class LocatorParser {

	/**
	 * Lower-case words that stand for {@code role "<word>" name "<value>"}.
	 */
	static final Set<String> ROLE_SHORTHANDS = Set.of(
			"button", "link", "textbox", "checkbox", "radio", "heading", "combobox", "listbox",
			"tab", "tabpanel", "menuitem", "option", "row", "cell", "img", "dialog", "navigation");

	private static final Pattern PSEUDO_CLASS = Pattern.compile(":[a-z-]+(\\(|$)", Pattern.CASE_INSENSITIVE);
	private static final Pattern TAG_WITH_SELECTOR = Pattern.compile("^[a-z]+[.#\\[]", Pattern.CASE_INSENSITIVE);

	/**
	 * What a bare string stands for.
	 */
	private enum BareString {
		TEXT,
		CSS,
		DETECT
	}

	private final TokenCursor cursor;
	private final ValueParser values;
	private boolean inPageAction = false;

	LocatorParser(TokenCursor cursor, ValueParser values) {
		this.cursor = cursor;
		this.values = values;
	}

	/**
	 * While set, an identifier on its own is a field of the page whose action is being parsed.
	 */
	void setInPageAction(boolean inPageAction) {
		this.inPageAction = inPageAction;
	}

	/**
	 * True when the current token can begin a locator.
	 */
	boolean atLocator() {
		VeroToken token = cursor.peek();
		if (token.isType(TokenType.STRING)) {
			return true;
		}
		return token.isType(TokenType.IDENTIFIER)
				&& (cursor.checkNext(TokenType.STRING) || cursor.checkNext(TokenType.DOT) || inPageAction);
	}

	LocatorExpression parse() {
		return parse(BareString.TEXT, true);
	}

	/**
	 * {@code SWITCH TO FRAME} target: a bare string is a CSS selector.
	 */
	LocatorExpression parseFrameTarget() {
		return parse(BareString.CSS, true);
	}

	/**
	 * Right-hand side of {@code FIELD name = ...}: a bare string is classified by its shape,
	 * and other fields cannot be referenced.
	 */
	LocatorExpression parseFieldDefinition() {
		return parse(BareString.DETECT, false);
	}

	private LocatorExpression parse(BareString bareString, boolean fieldReferences) {
		LocatorExpression base = parseBase(bareString, fieldReferences);
		List<LocatorModifier> modifiers = parseModifiers();
		return modifiers.isEmpty() ? base : base.withModifiers(modifiers);
	}

	private LocatorExpression parseBase(BareString bareString, boolean fieldReferences) {
		VeroToken token = cursor.peek();
		if (token.isType(TokenType.STRING)) {
			cursor.advance();
			return switch (bareString) {
				case TEXT -> new LocatorExpression.Text(token.lexeme(), List.of());
				case CSS -> new LocatorExpression.Css(token.lexeme(), List.of());
				case DETECT -> detect(token.lexeme());
			};
		}
		if (!token.isType(TokenType.IDENTIFIER)) {
			throw cursor.error("Expected a locator");
		}

		String word = token.lexeme();
		if (cursor.checkNext(TokenType.DOT)) {
			if (!fieldReferences) {
				throw new SyntaxError("A FIELD cannot be defined by another field", token);
			}
			cursor.advance();
			cursor.advance();
			String field = cursor.expect(TokenType.IDENTIFIER, "Expected a field name after '" + word + ".'").lexeme();
			return new LocatorExpression.PageField(word, field, List.of());
		}
		if (inPageAction && fieldReferences && !cursor.checkNext(TokenType.STRING)) {
			cursor.advance();
			return new LocatorExpression.PageField(null, word, List.of());
		}
		if (ROLE_SHORTHANDS.contains(word)) {
			cursor.advance();
			String name = values.string("the " + word + " name");
			return new LocatorExpression.Role(word, name, List.of());
		}

		LocatorExpression strategy = switch (word) {
			case "role" -> {
				cursor.advance();
				String role = values.string("a role name");
				String accessibleName = null;
				if (cursor.peek().isIdentifier("name") && cursor.checkNext(TokenType.STRING)) {
					cursor.advance();
					accessibleName = cursor.advance().lexeme();
				}
				yield new LocatorExpression.Role(role, accessibleName, List.of());
			}
			case "text" -> new LocatorExpression.Text(strategyValue(word), List.of());
			case "label" -> new LocatorExpression.Label(strategyValue(word), List.of());
			case "placeholder" -> new LocatorExpression.Placeholder(strategyValue(word), List.of());
			case "testId", "testid" -> new LocatorExpression.TestId(strategyValue(word), List.of());
			case "altText", "alt" -> new LocatorExpression.AltText(strategyValue(word), List.of());
			case "title" -> new LocatorExpression.Title(strategyValue(word), List.of());
			case "css" -> new LocatorExpression.Css(strategyValue(word), List.of());
			case "xpath" -> new LocatorExpression.XPath(strategyValue(word), List.of());
			default -> null;
		};
		if (strategy == null) {
			throw new SyntaxError("Unknown locator strategy '" + word + "'", token);
		}
		return strategy;
	}

	/**
	 * Classifies a bare field selector: XPath and CSS-looking strings become selectors,
	 * anything else is visible text.
	 */
	static LocatorExpression detect(String value) {
		if (value.startsWith("//") || value.startsWith("/html")) {
			return new LocatorExpression.XPath(value, List.of());
		}
		boolean css = value.startsWith("#")
				|| value.startsWith(".")
				|| (value.startsWith("[") && value.contains("]"))
				|| value.contains(">") || value.contains("~") || value.contains("+")
				|| PSEUDO_CLASS.matcher(value).find()
				|| TAG_WITH_SELECTOR.matcher(value).find();
		return css ? new LocatorExpression.Css(value, List.of()) : new LocatorExpression.Text(value, List.of());
	}

	private String strategyValue(String strategy) {
		cursor.advance();
		return values.string("a string after '" + strategy + "'");
	}

	private List<LocatorModifier> parseModifiers() {
		List<LocatorModifier> modifiers = new ArrayList<>();
		while (true) {
			if (cursor.match(TokenType.FIRST)) {
				modifiers.add(new LocatorModifier.First());
			}
			else if (cursor.match(TokenType.LAST)) {
				modifiers.add(new LocatorModifier.Last());
			}
			else if (cursor.match(TokenType.NTH)) {
				int index = values.integer("an index after NTH");
				if (index < 0) {
					throw new SyntaxError("NTH index must not be negative", cursor.previous());
				}
				modifiers.add(new LocatorModifier.Nth(index));
			}
			else if (cursor.check(TokenType.WITH) && cursor.checkNext(TokenType.TEXT)) {
				cursor.advance();
				cursor.advance();
				modifiers.add(new LocatorModifier.WithText(values.parse("text after WITH TEXT")));
			}
			else if (cursor.match(TokenType.WITHOUT)) {
				cursor.expect(TokenType.TEXT, "Expected TEXT after WITHOUT");
				modifiers.add(new LocatorModifier.WithoutText(values.parse("text after WITHOUT TEXT")));
			}
			else if (cursor.check(TokenType.HAS) && !startsHasPredicate(cursor.peek(1))) {
				cursor.advance();
				boolean negated = cursor.match(TokenType.NOT);
				LocatorExpression inner = parseBase(BareString.TEXT, true);
				modifiers.add(negated ? new LocatorModifier.HasNot(inner) : new LocatorModifier.Has(inner));
			}
			else {
				return modifiers;
			}
		}
	}

	/**
	 * {@code HAS TEXT}, {@code HAS VALUE} and {@code HAS COUNT} belong to assertions.
	 */
	private static boolean startsHasPredicate(VeroToken next) {
		return next.isType(TokenType.TEXT) || next.isType(TokenType.VALUE) || next.isType(TokenType.COUNT);
	}
}
