package org.javai.vero.codegen;

import java.util.List;
import java.util.stream.Collectors;
import org.javai.vero.ast.AssertionPredicate;
import org.javai.vero.ast.LocatorExpression;
import org.javai.vero.ast.LoopConfig;
import org.javai.vero.ast.PageSubject;
import org.javai.vero.ast.StatementNode;
import org.javai.vero.ast.ValueExpression;
import org.javai.vero.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits the TypeScript for each statement. The frame context is passed in and the context in
 * effect after the statement is returned; nothing about frames is stored in the generator.
 * <p>
 * A statement that cannot be generated is replaced by a marker comment and reported as a
 * generation diagnostic. Compound statements render their header before writing anything, so
 * a failure never leaves a half-written block behind.
 */
class StatementGenerator implements StatementNode.Visitor<FrameContext, FrameContext> {

	private static final Logger logger = LoggerFactory.getLogger(StatementGenerator.class);

	private final CodeWriter writer;
	private final ValueGenerator values;
	private final LocatorGenerator locators;
	private final TranspileOptions options;
	private final List<Diagnostic> errors;
	private int loopCounter = 0;

	StatementGenerator(CodeWriter writer, ValueGenerator values, TranspileOptions options, List<Diagnostic> errors) {
		this.writer = writer;
		this.values = values;
		this.locators = new LocatorGenerator(values);
		this.options = options;
		this.errors = errors;
	}

	/**
	 * Generates {@code statements} in order starting from {@code context}.
	 *
	 * @return the frame context after the last statement
	 */
	FrameContext generateBlock(List<StatementNode> statements, FrameContext context) {
		FrameContext current = context;
		for (StatementNode statement : statements) {
			current = generate(statement, current);
		}
		return current;
	}

	FrameContext generate(StatementNode statement, FrameContext context) {
		try {
			return statement.accept(this, context);
		}
		catch (GenerationException e) {
			String kind = statement.getClass().getSimpleName();
			logger.warn("Could not generate {} at {}: {}", kind, statement.position(), e.getMessage());
			errors.add(Diagnostic.generation(e.getMessage(), statement.position()));
			writer.line("// vero: " + kind + " at " + statement.position() + " was not generated: " + e.getMessage());
			return context;
		}
	}

	private String locator(LocatorExpression locator, FrameContext context) {
		return locators.generate(locator, context.rootExpression());
	}

	private FrameContext emit(String code, FrameContext context) {
		writer.line(code);
		return context;
	}

	// ---------------------------------------------------------------------------------------
	// Actions
	// ---------------------------------------------------------------------------------------

	@Override
	public FrameContext visitNavigate(StatementNode.Navigate statement, FrameContext context) {
		// navigation always targets the page, whatever frame is active
		return emit("await page.goto(" + values.string(statement.url()) + ");", context);
	}

	@Override
	public FrameContext visitClick(StatementNode.Click statement, FrameContext context) {
		String target = locator(statement.locator(), context);
		String call = switch (statement.clickType()) {
			case SINGLE -> ".click()";
			case DOUBLE -> ".dblclick()";
			case RIGHT -> ".click({ button: 'right' })";
		};
		return emit("await " + target + call + ";", context);
	}

	@Override
	public FrameContext visitFill(StatementNode.Fill statement, FrameContext context) {
		String target = locator(statement.locator(), context);
		return emit("await " + target + ".fill(" + values.string(statement.value()) + ");", context);
	}

	@Override
	public FrameContext visitClear(StatementNode.Clear statement, FrameContext context) {
		return emit("await " + locator(statement.locator(), context) + ".clear();", context);
	}

	@Override
	public FrameContext visitSelect(StatementNode.Select statement, FrameContext context) {
		String target = locator(statement.locator(), context);
		return emit("await " + target + ".selectOption(" + values.string(statement.option()) + ");", context);
	}

	@Override
	public FrameContext visitCheck(StatementNode.Check statement, FrameContext context) {
		String call = statement.checked() ? ".check();" : ".uncheck();";
		return emit("await " + locator(statement.locator(), context) + call, context);
	}

	@Override
	public FrameContext visitHover(StatementNode.Hover statement, FrameContext context) {
		return emit("await " + locator(statement.locator(), context) + ".hover();", context);
	}

	@Override
	public FrameContext visitPress(StatementNode.Press statement, FrameContext context) {
		return emit("await page.keyboard.press(" + values.string(statement.key()) + ");", context);
	}

	@Override
	public FrameContext visitWaitFor(StatementNode.WaitFor statement, FrameContext context) {
		return emit("await " + locator(statement.locator(), context) + ".waitFor({ state: 'visible' });", context);
	}

	@Override
	public FrameContext visitWaitDuration(StatementNode.WaitDuration statement, FrameContext context) {
		if (statement.amount() < 0) {
			throw new GenerationException("WAIT duration must not be negative");
		}
		return emit("await page.waitForTimeout(" + statement.toMillis() + ");", context);
	}

	@Override
	public FrameContext visitWaitLoadState(StatementNode.WaitLoadState statement, FrameContext context) {
		return emit("await page.waitForLoadState('networkidle');", context);
	}

	@Override
	public FrameContext visitRefresh(StatementNode.Refresh statement, FrameContext context) {
		return emit("await page.reload();", context);
	}

	@Override
	public FrameContext visitTakeScreenshot(StatementNode.TakeScreenshot statement, FrameContext context) {
		if (statement.fileName() == null) {
			return emit("await page.screenshot();", context);
		}
		return emit("await page.screenshot({ path: " + values.string(statement.fileName()) + " });", context);
	}

	// ---------------------------------------------------------------------------------------
	// Assertions
	// ---------------------------------------------------------------------------------------

	@Override
	public FrameContext visitAssert(StatementNode.Assert statement, FrameContext context) {
		AssertionPredicate predicate = statement.predicate();
		String matcher = switch (predicate.kind()) {
			case VISIBLE -> "toBeVisible()";
			case HIDDEN -> "toBeHidden()";
			case ENABLED -> "toBeEnabled()";
			case DISABLED -> "toBeDisabled()";
			case CHECKED -> "toBeChecked()";
			case EMPTY -> "toBeEmpty()";
			case FOCUSED -> "toBeFocused()";
			case CONTAINS_TEXT -> "toContainText(" + values.string(predicate.operand()) + ")";
			case HAS_TEXT -> "toHaveText(" + values.string(predicate.operand()) + ")";
			case HAS_VALUE -> "toHaveValue(" + values.string(predicate.operand()) + ")";
			case HAS_COUNT -> "toHaveCount(" + count(predicate.operand()) + ")";
		};
		String target = locator(statement.locator(), context);
		return emit("await expect(" + target + ")." + (predicate.negated() ? "not." : "") + matcher + ";", context);
	}

	private String count(ValueExpression operand) {
		if (operand instanceof ValueExpression.Number number) {
			return number.literal();
		}
		return "Number(" + values.expression(operand) + ")";
	}

	@Override
	public FrameContext visitAssertPage(StatementNode.AssertPage statement, FrameContext context) {
		String expected = values.string(statement.value());
		boolean url = statement.subject() == PageSubject.URL;
		if (statement.contains()) {
			String actual = url ? "page.url()" : "await page.title()";
			return emit("expect(" + actual + ").toContain(" + expected + ");", context);
		}
		String matcher = url ? "toHaveURL" : "toHaveTitle";
		return emit("await expect(page)." + matcher + "(" + expected + ");", context);
	}

	// ---------------------------------------------------------------------------------------
	// Frames
	// ---------------------------------------------------------------------------------------

	@Override
	public FrameContext visitSwitchToFrame(StatementNode.SwitchToFrame statement, FrameContext context) {
		LocatorExpression target = statement.locator();
		String root = context.rootExpression();
		String frame;
		if (target.modifiers().isEmpty() && target instanceof LocatorExpression.Css css) {
			frame = root + ".frameLocator(" + values.literal(css.selector()) + ")";
		}
		else if (target.modifiers().isEmpty() && target instanceof LocatorExpression.XPath xpath) {
			frame = root + ".frameLocator(" + values.literal("xpath=" + xpath.expression()) + ")";
		}
		else {
			frame = locators.generate(target, root) + ".contentFrame()";
		}
		writer.line("frame = " + frame + ";");
		return context.enter();
	}

	@Override
	public FrameContext visitSwitchToMainFrame(StatementNode.SwitchToMainFrame statement, FrameContext context) {
		writer.line("frame = null;");
		return FrameContext.root();
	}

	// ---------------------------------------------------------------------------------------
	// Control flow
	// ---------------------------------------------------------------------------------------

	@Override
	public FrameContext visitIf(StatementNode.If statement, FrameContext context) {
		String condition = conditions(context).generate(statement.condition());
		writer.open("if (" + condition + ") {");
		FrameContext afterThen = generateBlock(statement.thenBranch(), context);
		if (statement.elseBranch().isEmpty()) {
			writer.close("}");
			return afterThen.merge(context);
		}
		writer.reopen("} else {");
		FrameContext afterElse = generateBlock(statement.elseBranch(), context);
		writer.close("}");
		return afterThen.merge(afterElse);
	}

	@Override
	public FrameContext visitForLoop(StatementNode.ForLoop statement, FrameContext context) {
		LoopConfig config = statement.config();
		FrameContext entry = loopEntry(statement.body(), context);
		int id = loopCounter++;
		if (config instanceof LoopConfig.Count count) {
			if (count.times() < 0) {
				throw new GenerationException("Loop count must not be negative but was " + count.times());
			}
			String index = "i" + id;
			writer.open("for (let " + index + " = 0; " + index + " < " + count.times() + "; " + index + "++) {");
		}
		else if (config instanceof LoopConfig.Collection collection) {
			String entryName = "entry" + id;
			String source = values.reference(collection.sourcePath());
			writer.open("for (const " + entryName + " of (" + source + " ?? []) as any[]) {");
			writer.line("vars[" + ValueGenerator.quote(collection.itemName()) + "] = " + entryName + ";");
		}
		else {
			throw new GenerationException("Unsupported loop bound " + config);
		}
		FrameContext afterBody = generateBlock(statement.body(), entry);
		writer.close("}");
		return entry.merge(afterBody);
	}

	@Override
	public FrameContext visitWhileLoop(StatementNode.WhileLoop statement, FrameContext context) {
		LoopConfig.Conditional config = statement.config();
		int max = config.maxIterations() != null ? config.maxIterations() : options.maxWhileIterations();
		FrameContext entry = loopEntry(statement.body(), context);
		String condition = conditions(entry).generate(config.condition());
		String guard = "guard" + loopCounter++;
		writer.open("for (let " + guard + " = 0; " + guard + " < " + max + " && " + condition + "; " + guard + "++) {");
		FrameContext afterBody = generateBlock(statement.body(), entry);
		writer.close("}");
		return entry.merge(afterBody);
	}

	@Override
	public FrameContext visitBreak(StatementNode.Break statement, FrameContext context) {
		return emit("break;", context);
	}

	@Override
	public FrameContext visitContinue(StatementNode.Continue statement, FrameContext context) {
		return emit("continue;", context);
	}

	// ---------------------------------------------------------------------------------------
	// Data
	// ---------------------------------------------------------------------------------------

	@Override
	public FrameContext visitSetVariable(StatementNode.SetVariable statement, FrameContext context) {
		String name = ValueGenerator.quote(statement.name());
		return emit("vars[" + name + "] = " + values.expression(statement.value()) + ";", context);
	}

	@Override
	public FrameContext visitLog(StatementNode.Log statement, FrameContext context) {
		return emit("console.log(" + values.expression(statement.message()) + ");", context);
	}

	// ---------------------------------------------------------------------------------------
	// Page objects
	// ---------------------------------------------------------------------------------------

	@Override
	public FrameContext visitDo(StatementNode.Do statement, FrameContext context) {
		String method = values.pages().action(statement);
		String arguments = statement.arguments().stream().map(values::expression).collect(Collectors.joining(", "));
		return emit("await " + method + "(" + arguments + ");", context);
	}

	private ConditionGenerator conditions(FrameContext context) {
		return new ConditionGenerator(locators, values, context.rootExpression());
	}

	/**
	 * A body that switches frames can start an iteration in either context.
	 */
	private static FrameContext loopEntry(List<StatementNode> body, FrameContext context) {
		return FrameSwitches.containsSwitch(body) ? context.unsettled() : context;
	}
}
