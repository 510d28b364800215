package org.javai.vero.codegen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.javai.vero.ast.ComparisonOperator;
import org.javai.vero.ast.ConditionExpression;
import org.javai.vero.ast.ElementState;
import org.javai.vero.ast.LocatorExpression;
import org.javai.vero.ast.PageNode;
import org.javai.vero.ast.PageVariableNode;
import org.javai.vero.ast.ValueExpression;
import org.javai.vero.ast.VariableType;
import org.javai.vero.diagnostics.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConditionGeneratorTest {

	private static final LocatorExpression BANNER = new LocatorExpression.Css(".banner", List.of());

	private static final PageNode CART = new PageNode("Cart", List.of(),
			List.of(new PageVariableNode(VariableType.NUMBER, "limit", List.of(new ValueExpression.Number("5")),
					Position.START)),
			List.of(), Position.START);

	private ValueGenerator values;
	private ConditionGenerator generator;

	@BeforeEach
	void setUp() {
		values = new ValueGenerator(PageScope.forFeature(Map.of("Cart", CART), List.of("Cart")));
		generator = new ConditionGenerator(new LocatorGenerator(values), values, "page");
	}

	@Test
	void elementStatesAreAwaitedInline() {
		assertThat(check(ElementState.VISIBLE, false)).isEqualTo("await page.locator('.banner').isVisible()");
		assertThat(check(ElementState.HIDDEN, false)).isEqualTo("await page.locator('.banner').isHidden()");
		assertThat(check(ElementState.ENABLED, false)).isEqualTo("await page.locator('.banner').isEnabled()");
		assertThat(check(ElementState.DISABLED, false)).isEqualTo("await page.locator('.banner').isDisabled()");
		assertThat(check(ElementState.CHECKED, false)).isEqualTo("await page.locator('.banner').isChecked()");
		assertThat(check(ElementState.EXISTS, false)).isEqualTo("(await page.locator('.banner').count()) > 0");
	}

	@Test
	void negatedElementCheckIsWrapped() {
		assertThat(check(ElementState.VISIBLE, true)).isEqualTo("!(await page.locator('.banner').isVisible())");
	}

	@Test
	void emptyAndFocusedUseContentAndActiveElement() {
		assertThat(check(ElementState.EMPTY, false))
				.isEqualTo("((await page.locator('.banner').textContent()) ?? '').trim() === ''");
		assertThat(check(ElementState.FOCUSED, false))
				.isEqualTo("await page.locator('.banner').evaluate((el) => el === document.activeElement)");
	}

	@Test
	void elementChecksResolveFromFrameRoot() {
		ConditionGenerator inFrame = new ConditionGenerator(new LocatorGenerator(values), values, "frame!");

		assertThat(inFrame.generate(new ConditionExpression.ElementCheck(BANNER, ElementState.VISIBLE, false)))
				.isEqualTo("await frame!.locator('.banner').isVisible()");
	}

	@Test
	void equalityComparesLoosely() {
		assertThat(compare("mode", ComparisonOperator.EQUALS, ValueExpression.Text.literal("strict")))
				.isEqualTo("lookup(vars, 'mode') == 'strict'");
		assertThat(compare("count", ComparisonOperator.NOT_EQUALS, new ValueExpression.Number("3")))
				.isEqualTo("lookup(vars, 'count') != 3");
		assertThat(values.usesLookup()).isTrue();
	}

	@Test
	void orderingComparesNumerically() {
		assertThat(compare("total", ComparisonOperator.GREATER_THAN, new ValueExpression.Number("2")))
				.isEqualTo("Number(lookup(vars, 'total')) > 2");
		assertThat(compare("total", ComparisonOperator.LESS_OR_EQUAL, new ValueExpression.Variable("limit")))
				.isEqualTo("Number(lookup(vars, 'total')) <= Number(lookup(vars, 'limit'))");
	}

	@Test
	void containmentAndEmptinessWorkOnStrings() {
		assertThat(compare("name", ComparisonOperator.CONTAINS, ValueExpression.Text.literal("an")))
				.isEqualTo("String(lookup(vars, 'name') ?? '').includes('an')");
		assertThat(compare("name", ComparisonOperator.NOT_CONTAINS, new ValueExpression.Number("7")))
				.isEqualTo("!String(lookup(vars, 'name') ?? '').includes('7')");
		assertThat(compare("name", ComparisonOperator.IS_EMPTY, null))
				.isEqualTo("String(lookup(vars, 'name') ?? '').length === 0");
		assertThat(compare("name", ComparisonOperator.IS_NOT_EMPTY, null))
				.isEqualTo("String(lookup(vars, 'name') ?? '').length > 0");
	}

	@Test
	void truthChecksAreStrict() {
		assertThat(compare("done", ComparisonOperator.IS_TRUE, null)).isEqualTo("lookup(vars, 'done') === true");
		assertThat(compare("done", ComparisonOperator.IS_FALSE, null)).isEqualTo("lookup(vars, 'done') === false");
	}

	@Test
	void environmentComparisonsSkipLookup() {
		assertThat(compare("env.MODE", ComparisonOperator.EQUALS, ValueExpression.Text.literal("ci")))
				.isEqualTo("process.env['MODE'] == 'ci'");
		assertThat(values.usesLookup()).isFalse();
	}

	@Test
	void compoundConditionsAreParenthesized() {
		ConditionExpression visible = new ConditionExpression.ElementCheck(BANNER, ElementState.VISIBLE, false);
		ConditionExpression custom = new ConditionExpression.Custom(" window.ready ");
		ConditionExpression condition = new ConditionExpression.Or(
				new ConditionExpression.And(visible, custom),
				new ConditionExpression.Not(custom));

		assertThat(generator.generate(condition)).isEqualTo(
				"((await page.locator('.banner').isVisible() && (window.ready)) || !((window.ready)))");
	}

	@Test
	void pageVariablesAreReadFromThePageObject() {
		assertThat(compare("total", ComparisonOperator.GREATER_THAN, new ValueExpression.Variable("Cart.limit")))
				.isEqualTo("Number(lookup(vars, 'total')) > Number(cart.limit)");
		assertThat(compare("Cart.limit", ComparisonOperator.EQUALS, new ValueExpression.Number("5")))
				.isEqualTo("cart.limit == 5");
	}

	@Test
	void customExpressionsCallingLookupPullInTheHelper() {
		assertThat(generator.generate(new ConditionExpression.Custom("lookup(vars, 'n') > 2")))
				.isEqualTo("(lookup(vars, 'n') > 2)");
		assertThat(values.usesLookup()).isTrue();
	}

	@Test
	void customExpressionsWithoutLookupLeaveTheHelperOut() {
		generator.generate(new ConditionExpression.Custom("window.ready"));

		assertThat(values.usesLookup()).isFalse();
	}

	@Test
	void blankCustomExpressionIsRejected() {
		assertThatThrownBy(() -> generator.generate(new ConditionExpression.Custom("  ")))
				.isInstanceOf(GenerationException.class)
				.hasMessage("EXPRESSION condition must not be blank");
	}

	private String check(ElementState state, boolean negated) {
		return generator.generate(new ConditionExpression.ElementCheck(BANNER, state, negated));
	}

	private String compare(String path, ComparisonOperator operator, ValueExpression operand) {
		return generator.generate(new ConditionExpression.VariableComparison(path, operator, operand));
	}
}
