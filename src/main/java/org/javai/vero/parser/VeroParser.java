package org.javai.vero.parser;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.javai.vero.ast.ActionDefinitionNode;
import org.javai.vero.ast.AssertionKind;
import org.javai.vero.ast.AssertionPredicate;
import org.javai.vero.ast.ClickType;
import org.javai.vero.ast.ConditionExpression;
import org.javai.vero.ast.FeatureNode;
import org.javai.vero.ast.FieldNode;
import org.javai.vero.ast.HookNode;
import org.javai.vero.ast.HookType;
import org.javai.vero.ast.LocatorExpression;
import org.javai.vero.ast.LoopConfig;
import org.javai.vero.ast.PageNode;
import org.javai.vero.ast.PageSubject;
import org.javai.vero.ast.PageVariableNode;
import org.javai.vero.ast.ScenarioNode;
import org.javai.vero.ast.StatementNode;
import org.javai.vero.ast.ValueExpression;
import org.javai.vero.ast.VariableType;
import org.javai.vero.diagnostics.Diagnostic;
import org.javai.vero.diagnostics.Position;
import org.javai.vero.lexer.TokenType;
import org.javai.vero.lexer.VeroToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser turning a Vero token stream into {@link PageNode}s and
 * {@link FeatureNode}s.
 * <p>
 * Grammar rules throw a {@link SyntaxError} as soon as a token does not fit. The loops that
 * dispatch statements, feature members and features catch it, record a diagnostic at the
 * offending token and call {@link #synchronize} to skip to the next boundary, so one bad
 * statement never hides the rest of the document. Parsing itself never throws.
 */
public class VeroParser {

	private static final Logger logger = LoggerFactory.getLogger(VeroParser.class);

	/**
	 * Tokens that can begin a statement.
	 */
	private static final Set<TokenType> STATEMENT_STARTS = EnumSet.of(
			TokenType.NAVIGATE, TokenType.GOTO, TokenType.OPEN, TokenType.CLICK, TokenType.DOUBLE,
			TokenType.RIGHT, TokenType.FILL, TokenType.CLEAR, TokenType.SELECT, TokenType.CHECK,
			TokenType.UNCHECK, TokenType.HOVER, TokenType.PRESS, TokenType.WAIT, TokenType.SEE,
			TokenType.ASSERT, TokenType.VERIFY, TokenType.SWITCH, TokenType.IF, TokenType.FOR,
			TokenType.REPEAT, TokenType.WHILE, TokenType.BREAK, TokenType.CONTINUE, TokenType.SET,
			TokenType.LOG, TokenType.TAKE, TokenType.REFRESH, TokenType.DO);

	private static final Set<TokenType> TOP_LEVEL_STARTS = EnumSet.of(TokenType.FEATURE, TokenType.PAGE);

	/**
	 * Tokens that start a feature or page member, or a feature or page, and therefore end any
	 * open block.
	 */
	private static final Set<TokenType> MEMBER_STARTS = EnumSet.of(
			TokenType.SCENARIO, TokenType.BEFORE, TokenType.AFTER, TokenType.USE, TokenType.FIELD,
			TokenType.FEATURE, TokenType.PAGE);

	/**
	 * Where recovery resumes inside a page: variables start with a type word and actions with
	 * their name, both identifiers except {@code TEXT}.
	 */
	private static final Set<TokenType> PAGE_MEMBER_BOUNDARIES = EnumSet.of(
			TokenType.FIELD, TokenType.TEXT, TokenType.IDENTIFIER, TokenType.FEATURE, TokenType.PAGE);

	/**
	 * Names the generated page object class already uses.
	 */
	private static final Set<String> RESERVED_MEMBER_NAMES = Set.of("page", "constructor", "vars", "frame", "lookup");

	private static final Set<TokenType> STATEMENT_BOUNDARIES = union(STATEMENT_STARTS, MEMBER_STARTS);

	private final TokenCursor cursor;
	private final ValueParser values;
	private final LocatorParser locators;
	private final ConditionParser conditions;
	private final List<Diagnostic> errors = new ArrayList<>();
	private int loopDepth = 0;
	private boolean inPageAction = false;
	private int lastMissingBraceIndex = -1;

	public VeroParser(List<VeroToken> tokens) {
		this.cursor = new TokenCursor(tokens);
		this.values = new ValueParser(cursor);
		this.locators = new LocatorParser(cursor, values);
		this.conditions = new ConditionParser(cursor, values, locators);
	}

	public static ParseResult parse(List<VeroToken> tokens) {
		return new VeroParser(tokens).parse();
	}

	/**
	 * Parses the whole token stream.
	 *
	 * @return the pages and features in source order and the syntax diagnostics
	 */
	public ParseResult parse() {
		List<PageNode> pages = new ArrayList<>();
		List<FeatureNode> features = new ArrayList<>();
		Set<String> pageNames = new HashSet<>();
		Set<String> featureNames = new HashSet<>();

		while (!cursor.isAtEnd()) {
			int start = cursor.index();
			try {
				if (cursor.check(TokenType.FEATURE)) {
					FeatureNode feature = parseFeature();
					if (!featureNames.add(feature.name())) {
						errors.add(Diagnostic.syntax("Duplicate feature name '" + feature.name() + "'",
								feature.position()));
					}
					features.add(feature);
				}
				else if (cursor.check(TokenType.PAGE)) {
					PageNode page = parsePage();
					if (!pageNames.add(page.name())) {
						errors.add(Diagnostic.syntax("Duplicate page name '" + page.name() + "'", page.position()));
					}
					pages.add(page);
				}
				else {
					throw cursor.error("Expected FEATURE or PAGE");
				}
			}
			catch (SyntaxError e) {
				report(e);
				synchronize(start, TOP_LEVEL_STARTS, false);
			}
		}

		logger.debug("Parsed {} page(s) and {} feature(s) with {} syntax error(s)", pages.size(), features.size(),
				errors.size());
		return new ParseResult(pages, features, errors);
	}

	// ---------------------------------------------------------------------------------------
	// Structure
	// ---------------------------------------------------------------------------------------

	private FeatureNode parseFeature() {
		Position position = cursor.advance().position();
		String name = parseName("a feature name");
		cursor.expect(TokenType.LBRACE, "Expected '{' after feature name");

		Set<String> uses = new LinkedHashSet<>();
		List<HookNode> hooks = new ArrayList<>();
		List<ScenarioNode> scenarios = new ArrayList<>();
		while (!cursor.check(TokenType.RBRACE) && !cursor.isAtEnd() && !TOP_LEVEL_STARTS.contains(cursor.peek().type())) {
			int start = cursor.index();
			try {
				if (cursor.check(TokenType.SCENARIO)) {
					scenarios.add(parseScenario());
				}
				else if (cursor.check(TokenType.BEFORE) || cursor.check(TokenType.AFTER)) {
					hooks.add(parseHook());
				}
				else if (cursor.match(TokenType.USE)) {
					do {
						uses.add(cursor.expect(TokenType.IDENTIFIER, "Expected a page name after USE").lexeme());
					} while (cursor.match(TokenType.COMMA));
				}
				else {
					throw cursor.error("Expected SCENARIO, BEFORE, AFTER or USE");
				}
			}
			catch (SyntaxError e) {
				report(e);
				synchronize(start, MEMBER_STARTS, true);
			}
		}
		closeBlock("feature '" + name + "'");
		return new FeatureNode(name, List.copyOf(uses), hooks, scenarios, position);
	}

	/**
	 * {@code page := PAGE IDENTIFIER '{' (field | variable | action)* '}'}
	 */
	private PageNode parsePage() {
		Position position = cursor.advance().position();
		String name = declaredName(cursor.expect(TokenType.IDENTIFIER, "Expected a page name"), "a page name");
		cursor.expect(TokenType.LBRACE, "Expected '{' after page name");

		List<FieldNode> fields = new ArrayList<>();
		List<PageVariableNode> variables = new ArrayList<>();
		List<ActionDefinitionNode> actions = new ArrayList<>();
		Set<String> members = new HashSet<>();
		while (!cursor.check(TokenType.RBRACE) && !cursor.isAtEnd() && !TOP_LEVEL_STARTS.contains(cursor.peek().type())) {
			int start = cursor.index();
			try {
				String member;
				Position memberPosition = cursor.peek().position();
				if (cursor.check(TokenType.FIELD)) {
					FieldNode field = parseField();
					fields.add(field);
					member = field.name();
				}
				else if (atVariableDeclaration()) {
					PageVariableNode variable = parsePageVariable();
					variables.add(variable);
					member = variable.name();
				}
				else if (cursor.check(TokenType.IDENTIFIER)) {
					ActionDefinitionNode action = parseAction();
					actions.add(action);
					member = action.name();
				}
				else {
					throw cursor.error("Expected FIELD, a variable or an action in page '" + name + "'");
				}
				if (!members.add(member)) {
					errors.add(Diagnostic.syntax("Duplicate member '" + member + "' in page '" + name + "'",
							memberPosition));
				}
			}
			catch (SyntaxError e) {
				report(e);
				synchronizePageMember(start);
			}
		}
		closeBlock("page '" + name + "'");
		return new PageNode(name, fields, variables, actions, position);
	}

	private FieldNode parseField() {
		Position position = cursor.advance().position();
		String name = declaredName(cursor.expect(TokenType.IDENTIFIER, "Expected a field name after FIELD"),
				"a field name");
		cursor.expect(TokenType.ASSIGN, "Expected '=' after the field name");
		return new FieldNode(name, locators.parseFieldDefinition(), position);
	}

	/**
	 * {@code TEXT}, {@code NUMBER}, {@code FLAG} or {@code LIST} followed by a name. Only
	 * {@code TEXT} is reserved; the other type words are identifiers.
	 */
	private boolean atVariableDeclaration() {
		VeroToken token = cursor.peek();
		return (token.isType(TokenType.TEXT) || token.isType(TokenType.IDENTIFIER))
				&& VariableType.fromWord(token.lexeme()).isPresent()
				&& cursor.checkNext(TokenType.IDENTIFIER);
	}

	/**
	 * {@code variable := type IDENTIFIER '=' literal}; a {@code LIST} takes comma-separated strings.
	 */
	private PageVariableNode parsePageVariable() {
		VeroToken typeToken = cursor.advance();
		VariableType type = VariableType.fromWord(typeToken.lexeme()).orElseThrow();
		String name = declaredName(cursor.advance(), "a variable name");
		cursor.expect(TokenType.ASSIGN, "Expected '=' after the variable name");

		List<ValueExpression> initial = new ArrayList<>();
		do {
			initial.add(variableValue(type, name));
		} while (type == VariableType.LIST && cursor.match(TokenType.COMMA));
		return new PageVariableNode(type, name, initial, typeToken.position());
	}

	private ValueExpression variableValue(VariableType type, String name) {
		VeroToken token = cursor.peek();
		String expected = "Expected a " + type + " value for '" + name + "'";
		return switch (type) {
			case TEXT, LIST -> ValueExpression.Text.literal(cursor.expect(TokenType.STRING, expected).lexeme());
			case NUMBER -> new ValueExpression.Number(cursor.expect(TokenType.NUMBER, expected).lexeme());
			case FLAG -> {
				if (!token.isType(TokenType.TRUE) && !token.isType(TokenType.FALSE)) {
					throw cursor.error(expected);
				}
				cursor.advance();
				yield new ValueExpression.Bool(token.isType(TokenType.TRUE));
			}
		};
	}

	/**
	 * {@code action := IDENTIFIER (WITH IDENTIFIER (',' IDENTIFIER)*)? block}
	 */
	private ActionDefinitionNode parseAction() {
		VeroToken nameToken = cursor.advance();
		declaredName(nameToken, "an action name");
		List<String> parameters = new ArrayList<>();
		if (cursor.match(TokenType.WITH)) {
			do {
				VeroToken parameter = cursor.expect(TokenType.IDENTIFIER, "Expected a parameter name");
				declaredName(parameter, "a parameter name");
				if (parameters.contains(parameter.lexeme())) {
					throw new SyntaxError("Duplicate parameter '" + parameter.lexeme() + "'", parameter);
				}
				parameters.add(parameter.lexeme());
			} while (cursor.match(TokenType.COMMA));
		}

		inPageAction = true;
		locators.setInPageAction(true);
		try {
			List<StatementNode> statements = parseBlock("action '" + nameToken.lexeme() + "'");
			return new ActionDefinitionNode(nameToken.lexeme(), parameters, statements, nameToken.position());
		}
		finally {
			inPageAction = false;
			locators.setInPageAction(false);
		}
	}

	private ScenarioNode parseScenario() {
		Position position = cursor.advance().position();
		String name = parseName("a scenario name");

		Set<String> tags = new LinkedHashSet<>();
		while (cursor.match(TokenType.AT)) {
			VeroToken tag = cursor.peek();
			if (!tag.isType(TokenType.IDENTIFIER) && !tag.type().isKeyword()) {
				throw cursor.error("Expected a tag name after '@'");
			}
			tags.add(cursor.advance().lexeme());
		}

		List<StatementNode> statements = parseBlock("scenario '" + name + "'");
		return new ScenarioNode(name, tags, statements, position);
	}

	private HookNode parseHook() {
		VeroToken keyword = cursor.advance();
		boolean before = keyword.isType(TokenType.BEFORE);
		HookType type;
		if (cursor.match(TokenType.ALL)) {
			type = before ? HookType.BEFORE_ALL : HookType.AFTER_ALL;
		}
		else {
			cursor.match(TokenType.EACH);
			type = before ? HookType.BEFORE_EACH : HookType.AFTER_EACH;
		}
		List<StatementNode> statements = parseBlock(type.name().toLowerCase().replace('_', ' ') + " hook");
		return new HookNode(type, statements, keyword.position());
	}

	/**
	 * Page names and page members become TypeScript identifiers in the page object class.
	 */
	private static String declaredName(VeroToken token, String what) {
		String name = token.lexeme();
		if (name.indexOf('-') >= 0) {
			throw new SyntaxError("'" + name + "' cannot be used as " + what + " because it contains '-'", token);
		}
		if (RESERVED_MEMBER_NAMES.contains(name)) {
			throw new SyntaxError("'" + name + "' is reserved and cannot be used as " + what, token);
		}
		return name;
	}

	private String parseName(String what) {
		if (cursor.check(TokenType.IDENTIFIER) || cursor.check(TokenType.STRING)) {
			return cursor.advance().lexeme();
		}
		throw cursor.error("Expected " + what);
	}

	/**
	 * {@code block := '{' statement* '}'}. A missing closing brace is reported and the
	 * statements read so far are kept.
	 */
	private List<StatementNode> parseBlock(String owner) {
		cursor.expect(TokenType.LBRACE, "Expected '{' to open " + owner);

		List<StatementNode> statements = new ArrayList<>();
		while (!cursor.check(TokenType.RBRACE) && !cursor.isAtEnd() && !MEMBER_STARTS.contains(cursor.peek().type())) {
			int start = cursor.index();
			try {
				statements.add(parseStatement());
			}
			catch (SyntaxError e) {
				report(e);
				synchronize(start, STATEMENT_BOUNDARIES, true);
			}
		}
		closeBlock(owner);
		return statements;
	}

	private void closeBlock(String owner) {
		if (cursor.match(TokenType.RBRACE)) {
			return;
		}
		// nested blocks left open by the same token share one diagnostic
		if (lastMissingBraceIndex != cursor.index()) {
			lastMissingBraceIndex = cursor.index();
			errors.add(Diagnostic.syntax("Expected '}' to close " + owner + " but found " + cursor.peek().describe(),
					cursor.peek().position()));
		}
	}

	// ---------------------------------------------------------------------------------------
	// Statements
	// ---------------------------------------------------------------------------------------

	private StatementNode parseStatement() {
		VeroToken token = cursor.peek();
		Position position = token.position();

		return switch (token.type()) {
			case NAVIGATE -> {
				cursor.advance();
				cursor.expect(TokenType.TO, "Expected TO after NAVIGATE");
				yield new StatementNode.Navigate(values.parse("a URL"), position);
			}
			case GOTO, OPEN -> {
				cursor.advance();
				yield new StatementNode.Navigate(values.parse("a URL"), position);
			}
			case CLICK -> {
				cursor.advance();
				yield new StatementNode.Click(locators.parse(), ClickType.SINGLE, position);
			}
			case DOUBLE, RIGHT -> {
				cursor.advance();
				cursor.expect(TokenType.CLICK, "Expected CLICK after " + token.lexeme());
				ClickType type = token.isType(TokenType.DOUBLE) ? ClickType.DOUBLE : ClickType.RIGHT;
				yield new StatementNode.Click(locators.parse(), type, position);
			}
			case FILL -> {
				cursor.advance();
				LocatorExpression locator = locators.parse();
				cursor.expect(TokenType.WITH, "Expected WITH after the FILL target");
				yield new StatementNode.Fill(locator, values.parse("a value to fill"), position);
			}
			case CLEAR -> {
				cursor.advance();
				yield new StatementNode.Clear(locators.parse(), position);
			}
			case SELECT -> {
				cursor.advance();
				LocatorExpression locator = locators.parse();
				cursor.expect(TokenType.OPTION, "Expected OPTION after the SELECT target");
				yield new StatementNode.Select(locator, values.parse("an option"), position);
			}
			case CHECK, UNCHECK -> {
				cursor.advance();
				yield new StatementNode.Check(locators.parse(), token.isType(TokenType.CHECK), position);
			}
			case HOVER -> {
				cursor.advance();
				cursor.match(TokenType.OVER);
				yield new StatementNode.Hover(locators.parse(), position);
			}
			case PRESS -> {
				cursor.advance();
				yield new StatementNode.Press(values.parse("a key"), position);
			}
			case WAIT -> parseWait(position);
			case SEE, ASSERT, VERIFY -> parseAssertion(position);
			case SWITCH -> parseSwitch(position);
			case IF -> parseIf();
			case FOR, REPEAT -> parseFor(position);
			case WHILE -> parseWhile(position);
			case BREAK, CONTINUE -> {
				if (loopDepth == 0) {
					throw new SyntaxError(token.lexeme() + " is only allowed inside a loop", token);
				}
				cursor.advance();
				yield token.isType(TokenType.BREAK)
						? new StatementNode.Break(position)
						: new StatementNode.Continue(position);
			}
			case SET -> {
				cursor.advance();
				String name = cursor.expect(TokenType.IDENTIFIER, "Expected a variable name after SET").lexeme();
				cursor.expect(TokenType.ASSIGN, "Expected '=' after the variable name");
				yield new StatementNode.SetVariable(name, values.parse("a value"), position);
			}
			case LOG -> {
				cursor.advance();
				yield new StatementNode.Log(values.parse("a message"), position);
			}
			case TAKE -> {
				cursor.advance();
				cursor.expect(TokenType.SCREENSHOT, "Expected SCREENSHOT after TAKE");
				ValueExpression fileName = cursor.check(TokenType.STRING) || cursor.check(TokenType.VARIABLE)
						? values.parse("a file name")
						: null;
				yield new StatementNode.TakeScreenshot(fileName, position);
			}
			case REFRESH -> {
				cursor.advance();
				yield new StatementNode.Refresh(position);
			}
			case DO -> parseDo(position);
			default -> throw cursor.error("Expected a statement");
		};
	}

	private StatementNode parseWait(Position position) {
		cursor.advance();
		if (cursor.match(TokenType.FOR)) {
			return new StatementNode.WaitFor(locators.parse(), position);
		}
		if (cursor.check(TokenType.NUMBER)) {
			double amount = Double.parseDouble(cursor.advance().lexeme());
			StatementNode.DurationUnit unit = StatementNode.DurationUnit.SECONDS;
			if (cursor.match(TokenType.MILLISECONDS)) {
				unit = StatementNode.DurationUnit.MILLISECONDS;
			}
			else {
				cursor.match(TokenType.SECONDS);
			}
			return new StatementNode.WaitDuration(amount, unit, position);
		}
		return new StatementNode.WaitLoadState(position);
	}

	/**
	 * {@code DO (IDENTIFIER '.')? IDENTIFIER (WITH value ((',' | AND) value)*)?}. The page may
	 * only be left out inside a page action.
	 */
	private StatementNode parseDo(Position position) {
		cursor.advance();
		VeroToken first = cursor.expect(TokenType.IDENTIFIER, "Expected an action after DO");
		String page = null;
		String action = first.lexeme();
		if (cursor.match(TokenType.DOT)) {
			page = first.lexeme();
			action = cursor.expect(TokenType.IDENTIFIER, "Expected an action name after '" + page + ".'").lexeme();
		}
		else if (!inPageAction) {
			throw new SyntaxError("Expected Page.action after DO outside a page", first);
		}

		List<ValueExpression> arguments = new ArrayList<>();
		if (cursor.match(TokenType.WITH)) {
			do {
				arguments.add(values.parse("an argument"));
			} while (cursor.match(TokenType.COMMA) || cursor.match(TokenType.AND));
		}
		return new StatementNode.Do(page, action, arguments, position);
	}

	private StatementNode parseAssertion(Position position) {
		cursor.advance();
		if (cursor.check(TokenType.URL) || cursor.check(TokenType.TITLE)) {
			PageSubject subject = cursor.advance().isType(TokenType.URL) ? PageSubject.URL : PageSubject.TITLE;
			boolean contains;
			if (cursor.match(TokenType.CONTAINS)) {
				contains = true;
			}
			else {
				cursor.expect(TokenType.IS, "Expected IS or CONTAINS after " + subject);
				contains = false;
			}
			return new StatementNode.AssertPage(subject, contains, values.parse("an expected value"), position);
		}
		LocatorExpression locator = locators.parse();
		return new StatementNode.Assert(locator, parsePredicate(), position);
	}

	/**
	 * {@code predicate := IS NOT? state | NOT? CONTAINS value | NOT? HAS (TEXT | VALUE) value | NOT? HAS COUNT NUMBER}.
	 * Absent predicates mean visibility.
	 */
	private AssertionPredicate parsePredicate() {
		if (cursor.match(TokenType.IS)) {
			boolean negated = cursor.match(TokenType.NOT);
			AssertionKind kind = switch (cursor.peek().type()) {
				case VISIBLE -> AssertionKind.VISIBLE;
				case HIDDEN -> AssertionKind.HIDDEN;
				case ENABLED -> AssertionKind.ENABLED;
				case DISABLED -> AssertionKind.DISABLED;
				case CHECKED -> AssertionKind.CHECKED;
				case EMPTY -> AssertionKind.EMPTY;
				case FOCUSED -> AssertionKind.FOCUSED;
				default -> throw cursor.error("Expected an element state after IS");
			};
			cursor.advance();
			return new AssertionPredicate(kind, negated, null);
		}

		boolean negated = cursor.match(TokenType.NOT);
		if (cursor.match(TokenType.CONTAINS)) {
			return new AssertionPredicate(AssertionKind.CONTAINS_TEXT, negated, values.parse("the expected text"));
		}
		if (cursor.match(TokenType.HAS)) {
			if (cursor.match(TokenType.TEXT)) {
				return new AssertionPredicate(AssertionKind.HAS_TEXT, negated, values.parse("the expected text"));
			}
			if (cursor.match(TokenType.VALUE)) {
				return new AssertionPredicate(AssertionKind.HAS_VALUE, negated, values.parse("the expected value"));
			}
			if (cursor.match(TokenType.COUNT)) {
				ValueExpression count = cursor.check(TokenType.VARIABLE)
						? values.parse("a count")
						: new ValueExpression.Number(Integer.toString(values.integer("a count")));
				return new AssertionPredicate(AssertionKind.HAS_COUNT, negated, count);
			}
			throw cursor.error("Expected TEXT, VALUE or COUNT after HAS");
		}
		if (negated) {
			throw cursor.error("Expected CONTAINS or HAS after NOT");
		}
		return AssertionPredicate.visible();
	}

	private StatementNode parseSwitch(Position position) {
		cursor.advance();
		cursor.expect(TokenType.TO, "Expected TO after SWITCH");
		if (cursor.match(TokenType.MAIN)) {
			cursor.expect(TokenType.FRAME, "Expected FRAME after MAIN");
			return new StatementNode.SwitchToMainFrame(position);
		}
		cursor.expect(TokenType.FRAME, "Expected FRAME or MAIN FRAME after SWITCH TO");
		return new StatementNode.SwitchToFrame(locators.parseFrameTarget(), position);
	}

	private StatementNode parseIf() {
		Position position = cursor.advance().position();
		ConditionExpression condition = conditions.parse();
		List<StatementNode> thenBranch = parseBlock("IF block");
		List<StatementNode> elseBranch = List.of();
		if (cursor.match(TokenType.ELSE)) {
			elseBranch = cursor.check(TokenType.IF) ? List.of(parseIf()) : parseBlock("ELSE block");
		}
		return new StatementNode.If(condition, thenBranch, elseBranch, position);
	}

	private StatementNode parseFor(Position position) {
		VeroToken keyword = cursor.advance();
		LoopConfig config;
		if (keyword.isType(TokenType.FOR) && cursor.match(TokenType.EACH)) {
			String item = cursor.expect(TokenType.IDENTIFIER, "Expected a loop variable after FOR EACH").lexeme();
			cursor.expect(TokenType.IN, "Expected IN after the loop variable");
			String source = cursor.expect(TokenType.VARIABLE, "Expected a {{collection}} after IN").lexeme();
			config = new LoopConfig.Collection(item, source);
		}
		else {
			int times = values.integer("a repeat count");
			cursor.expect(TokenType.TIMES, "Expected TIMES after the repeat count");
			config = new LoopConfig.Count(times);
		}
		return new StatementNode.ForLoop(config, parseLoopBody("loop"), position);
	}

	private StatementNode parseWhile(Position position) {
		cursor.advance();
		ConditionExpression condition = conditions.parse();
		Integer max = null;
		if (cursor.match(TokenType.MAX)) {
			max = values.integer("an iteration limit after MAX");
			if (max < 0) {
				throw new SyntaxError("MAX must not be negative", cursor.previous());
			}
		}
		List<StatementNode> body = parseLoopBody("WHILE loop");
		return new StatementNode.WhileLoop(new LoopConfig.Conditional(condition, max), body, position);
	}

	private List<StatementNode> parseLoopBody(String owner) {
		loopDepth++;
		try {
			return parseBlock(owner);
		}
		finally {
			loopDepth--;
		}
	}

	// ---------------------------------------------------------------------------------------
	// Recovery
	// ---------------------------------------------------------------------------------------

	private void report(SyntaxError e) {
		errors.add(Diagnostic.syntax(e.getMessage(), e.token().position()));
	}

	/**
	 * Skips to the next token in {@code boundaries} (or, when {@code stopAtClose}, to a
	 * {@code '}'}) at the current brace depth. Nested {@code {...}} groups are skipped whole.
	 * At least one token is consumed when the failed rule consumed none.
	 */
	private void synchronize(int startIndex, Set<TokenType> boundaries, boolean stopAtClose) {
		VeroToken failedAt = cursor.peek();
		int depth = 0;
		if (cursor.index() == startIndex && !cursor.isAtEnd()) {
			if (cursor.advance().isType(TokenType.LBRACE)) {
				depth++;
			}
		}
		while (!cursor.isAtEnd()) {
			VeroToken token = cursor.peek();
			if (depth == 0) {
				if (boundaries.contains(token.type()) || (stopAtClose && token.isType(TokenType.RBRACE))) {
					break;
				}
			}
			if (token.isType(TokenType.LBRACE)) {
				depth++;
			}
			else if (token.isType(TokenType.RBRACE)) {
				depth = Math.max(0, depth - 1);
			}
			cursor.advance();
		}
		logger.debug("Recovered from syntax error at {}; resuming at {} ({})", failedAt.position(),
				cursor.peek().position(), cursor.peek().describe());
	}

	/**
	 * Page recovery: an identifier or {@code TEXT} only ends the skip when it starts a
	 * variable or an action, not when it is part of the member that failed.
	 */
	private void synchronizePageMember(int startIndex) {
		synchronize(startIndex, PAGE_MEMBER_BOUNDARIES, true);
		while ((cursor.check(TokenType.IDENTIFIER) || cursor.check(TokenType.TEXT)) && !atPageMemberStart()) {
			cursor.advance();
			synchronize(-1, PAGE_MEMBER_BOUNDARIES, true);
		}
	}

	private boolean atPageMemberStart() {
		return atVariableDeclaration()
				|| (cursor.check(TokenType.IDENTIFIER)
						&& (cursor.checkNext(TokenType.LBRACE) || cursor.checkNext(TokenType.WITH)));
	}

	private static Set<TokenType> union(Set<TokenType> a, Set<TokenType> b) {
		Set<TokenType> result = EnumSet.copyOf(a);
		result.addAll(b);
		return result;
	}
}
