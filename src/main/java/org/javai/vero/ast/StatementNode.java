package org.javai.vero.ast;

import java.util.List;
import java.util.Objects;
import org.javai.vero.diagnostics.Position;

/**
 * One executable step of a scenario or hook. The variant set is closed; consumers dispatch
 * through {@link Visitor}, so a new statement kind does not compile until every consumer
 * handles it.
 */
public sealed interface StatementNode {

	Position position();

	/**
	 * Dispatches to the matching {@link Visitor} method, handing the caller's context through.
	 */
	<R, C> R accept(Visitor<R, C> visitor, C context);

	/**
	 * Exhaustive statement visitor. {@code C} is threaded state owned by the caller, for
	 * example the frame context during generation.
	 */
	interface Visitor<R, C> {
		R visitNavigate(Navigate statement, C context);

		R visitClick(Click statement, C context);

		R visitFill(Fill statement, C context);

		R visitClear(Clear statement, C context);

		R visitSelect(Select statement, C context);

		R visitCheck(Check statement, C context);

		R visitHover(Hover statement, C context);

		R visitPress(Press statement, C context);

		R visitWaitFor(WaitFor statement, C context);

		R visitWaitDuration(WaitDuration statement, C context);

		R visitWaitLoadState(WaitLoadState statement, C context);

		R visitAssert(Assert statement, C context);

		R visitAssertPage(AssertPage statement, C context);

		R visitSwitchToFrame(SwitchToFrame statement, C context);

		R visitSwitchToMainFrame(SwitchToMainFrame statement, C context);

		R visitIf(If statement, C context);

		R visitForLoop(ForLoop statement, C context);

		R visitWhileLoop(WhileLoop statement, C context);

		R visitBreak(Break statement, C context);

		R visitContinue(Continue statement, C context);

		R visitSetVariable(SetVariable statement, C context);

		R visitLog(Log statement, C context);

		R visitTakeScreenshot(TakeScreenshot statement, C context);

		R visitRefresh(Refresh statement, C context);

		R visitDo(Do statement, C context);
	}

	enum DurationUnit {
		SECONDS,
		MILLISECONDS
	}

	/**
	 * {@code NAVIGATE TO}, {@code GOTO} and {@code OPEN}.
	 */
	record Navigate(ValueExpression url, Position position) implements StatementNode {
		public Navigate {
			Objects.requireNonNull(url, "url must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitNavigate(this, context);
		}
	}

	record Click(LocatorExpression locator, ClickType clickType, Position position) implements StatementNode {
		public Click {
			Objects.requireNonNull(locator, "locator must not be null");
			clickType = clickType != null ? clickType : ClickType.SINGLE;
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitClick(this, context);
		}
	}

	record Fill(LocatorExpression locator, ValueExpression value, Position position) implements StatementNode {
		public Fill {
			Objects.requireNonNull(locator, "locator must not be null");
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitFill(this, context);
		}
	}

	record Clear(LocatorExpression locator, Position position) implements StatementNode {
		public Clear {
			Objects.requireNonNull(locator, "locator must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitClear(this, context);
		}
	}

	record Select(LocatorExpression locator, ValueExpression option, Position position) implements StatementNode {
		public Select {
			Objects.requireNonNull(locator, "locator must not be null");
			Objects.requireNonNull(option, "option must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitSelect(this, context);
		}
	}

	/**
	 * {@code CHECK} when {@code checked}, {@code UNCHECK} otherwise.
	 */
	record Check(LocatorExpression locator, boolean checked, Position position) implements StatementNode {
		public Check {
			Objects.requireNonNull(locator, "locator must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitCheck(this, context);
		}
	}

	record Hover(LocatorExpression locator, Position position) implements StatementNode {
		public Hover {
			Objects.requireNonNull(locator, "locator must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitHover(this, context);
		}
	}

	record Press(ValueExpression key, Position position) implements StatementNode {
		public Press {
			Objects.requireNonNull(key, "key must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitPress(this, context);
		}
	}

	record WaitFor(LocatorExpression locator, Position position) implements StatementNode {
		public WaitFor {
			Objects.requireNonNull(locator, "locator must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitWaitFor(this, context);
		}
	}

	/**
	 * Fixed pause. {@code WAIT 2} means two seconds.
	 */
	record WaitDuration(double amount, DurationUnit unit, Position position) implements StatementNode {
		public WaitDuration {
			unit = unit != null ? unit : DurationUnit.SECONDS;
		}

		public long toMillis() {
			return unit == DurationUnit.SECONDS ? Math.round(amount * 1000) : Math.round(amount);
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitWaitDuration(this, context);
		}
	}

	/**
	 * Bare {@code WAIT}: waits until the network has been idle.
	 */
	record WaitLoadState(Position position) implements StatementNode {
		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitWaitLoadState(this, context);
		}
	}

	record Assert(LocatorExpression locator, AssertionPredicate predicate, Position position)
			implements StatementNode {
		public Assert {
			Objects.requireNonNull(locator, "locator must not be null");
			predicate = predicate != null ? predicate : AssertionPredicate.visible();
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitAssert(this, context);
		}
	}

	/**
	 * {@code ASSERT URL IS "..."} or {@code ASSERT TITLE CONTAINS "..."}.
	 */
	record AssertPage(PageSubject subject, boolean contains, ValueExpression value, Position position)
			implements StatementNode {
		public AssertPage {
			Objects.requireNonNull(subject, "subject must not be null");
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitAssertPage(this, context);
		}
	}

	record SwitchToFrame(LocatorExpression locator, Position position) implements StatementNode {
		public SwitchToFrame {
			Objects.requireNonNull(locator, "locator must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitSwitchToFrame(this, context);
		}
	}

	record SwitchToMainFrame(Position position) implements StatementNode {
		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitSwitchToMainFrame(this, context);
		}
	}

	/**
	 * {@code ELSE IF} chains are nested {@code If} statements as the only else statement.
	 */
	record If(ConditionExpression condition, List<StatementNode> thenBranch, List<StatementNode> elseBranch,
			Position position) implements StatementNode {
		public If {
			Objects.requireNonNull(condition, "condition must not be null");
			thenBranch = thenBranch != null ? List.copyOf(thenBranch) : List.of();
			elseBranch = elseBranch != null ? List.copyOf(elseBranch) : List.of();
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitIf(this, context);
		}
	}

	/**
	 * Counted or collection loop. Conditional loops are {@link WhileLoop}s.
	 */
	record ForLoop(LoopConfig config, List<StatementNode> body, Position position) implements StatementNode {
		public ForLoop {
			Objects.requireNonNull(config, "config must not be null");
			if (config instanceof LoopConfig.Conditional) {
				throw new IllegalArgumentException("conditional loops are WhileLoop statements");
			}
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitForLoop(this, context);
		}
	}

	record WhileLoop(LoopConfig.Conditional config, List<StatementNode> body, Position position)
			implements StatementNode {
		public WhileLoop {
			Objects.requireNonNull(config, "config must not be null");
			body = body != null ? List.copyOf(body) : List.of();
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitWhileLoop(this, context);
		}
	}

	record Break(Position position) implements StatementNode {
		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitBreak(this, context);
		}
	}

	record Continue(Position position) implements StatementNode {
		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitContinue(this, context);
		}
	}

	record SetVariable(String name, ValueExpression value, Position position) implements StatementNode {
		public SetVariable {
			Objects.requireNonNull(name, "name must not be null");
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitSetVariable(this, context);
		}
	}

	record Log(ValueExpression message, Position position) implements StatementNode {
		public Log {
			Objects.requireNonNull(message, "message must not be null");
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitLog(this, context);
		}
	}

	/**
	 * @param fileName target file, or {@code null} to let the runtime pick one
	 */
	record TakeScreenshot(ValueExpression fileName, Position position) implements StatementNode {
		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitTakeScreenshot(this, context);
		}
	}

	record Refresh(Position position) implements StatementNode {
		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitRefresh(this, context);
		}
	}

	/**
	 * {@code DO Page.action WITH args} invokes a page action.
	 *
	 * @param page page name, or {@code null} inside a page action for an action of the same page
	 */
	record Do(String page, String action, List<ValueExpression> arguments, Position position)
			implements StatementNode {
		public Do {
			Objects.requireNonNull(action, "action must not be null");
			arguments = arguments != null ? List.copyOf(arguments) : List.of();
		}

		@Override
		public <R, C> R accept(Visitor<R, C> visitor, C context) {
			return visitor.visitDo(this, context);
		}
	}
}
