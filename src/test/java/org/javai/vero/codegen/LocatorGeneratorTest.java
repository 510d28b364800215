package org.javai.vero.codegen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.javai.vero.ast.FieldNode;
import org.javai.vero.ast.LocatorExpression;
import org.javai.vero.ast.LocatorModifier;
import org.javai.vero.ast.PageNode;
import org.javai.vero.ast.ValueExpression;
import org.javai.vero.diagnostics.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class LocatorGeneratorTest {

	/**
	 * One sample per strategy with the call it must produce.
	 */
	private static final Map<LocatorExpression, String> STRATEGIES = new LinkedHashMap<>();

	static {
		STRATEGIES.put(new LocatorExpression.Role("button", "Submit", List.of()),
				"page.getByRole('button', { name: 'Submit' })");
		STRATEGIES.put(new LocatorExpression.Text("Welcome", List.of()), "page.getByText('Welcome')");
		STRATEGIES.put(new LocatorExpression.Label("Email", List.of()), "page.getByLabel('Email')");
		STRATEGIES.put(new LocatorExpression.Placeholder("Search", List.of()), "page.getByPlaceholder('Search')");
		STRATEGIES.put(new LocatorExpression.TestId("save", List.of()), "page.getByTestId('save')");
		STRATEGIES.put(new LocatorExpression.AltText("Logo", List.of()), "page.getByAltText('Logo')");
		STRATEGIES.put(new LocatorExpression.Title("Close", List.of()), "page.getByTitle('Close')");
		STRATEGIES.put(new LocatorExpression.Css("#main > .item", List.of()), "page.locator('#main > .item')");
		STRATEGIES.put(new LocatorExpression.XPath("//div[@id='a']", List.of()), "page.locator('xpath=//div[@id=\\'a\\']')");
		STRATEGIES.put(new LocatorExpression.PageField("LoginPage", "email", List.of()), "loginPage.email");
	}

	private static final PageNode LOGIN_PAGE = new PageNode("LoginPage",
			List.of(new FieldNode("email", new LocatorExpression.Css("#email", List.of()), Position.START)),
			List.of(), List.of(), Position.START);

	private static final PageNode CART = new PageNode("Cart", List.of(), List.of(), List.of(), Position.START);

	private ValueGenerator values;
	private LocatorGenerator generator;

	@BeforeEach
	void setUp() {
		values = new ValueGenerator(PageScope.forFeature(Map.of("LoginPage", LOGIN_PAGE, "Cart", CART),
				List.of("LoginPage")));
		generator = new LocatorGenerator(values);
	}

	@Test
	void everyStrategyHasExactlyOneSample() {
		Set<Class<?>> sampled = STRATEGIES.keySet().stream().map(Object::getClass).collect(Collectors.toSet());
		Set<Class<?>> permitted = Arrays.stream(LocatorExpression.class.getPermittedSubclasses()).collect(Collectors.toSet());

		assertThat(sampled).isEqualTo(permitted);
		assertThat(STRATEGIES).hasSameSizeAs(permitted);
	}

	@Test
	void everyStrategyMapsToItsLocatorCall() {
		STRATEGIES.forEach((locator, expected) -> assertThat(generator.generate(locator, "page"))
				.as(locator.getClass().getSimpleName())
				.isEqualTo(expected));
	}

	@Test
	void strategiesMapToDistinctCalls() {
		assertThat(STRATEGIES.keySet().stream().map(l -> generator.generate(l, "page")).distinct())
				.hasSameSizeAs(STRATEGIES.keySet());
	}

	@Test
	void roleWithoutNameOmitsOptions() {
		assertThat(generator.generate(new LocatorExpression.Role("navigation", null, List.of()), "page"))
				.isEqualTo("page.getByRole('navigation')");
	}

	@Test
	void locatorsResolveFromGivenRoot() {
		assertThat(generator.generate(new LocatorExpression.Text("Pay", List.of()), "frame!"))
				.isEqualTo("frame!.getByText('Pay')");
	}

	@Test
	void modifiersAreChainedInOrder() {
		LocatorExpression locator = new LocatorExpression.Css("li", List.of(
				new LocatorModifier.WithText(ValueExpression.Text.literal("Apple")),
				new LocatorModifier.WithoutText(ValueExpression.Text.literal("Sold out")),
				new LocatorModifier.Has(new LocatorExpression.Role("button", "Buy", List.of())),
				new LocatorModifier.HasNot(new LocatorExpression.Css(".disabled", List.of())),
				new LocatorModifier.First(),
				new LocatorModifier.Last(),
				new LocatorModifier.Nth(2)));

		assertThat(generator.generate(locator, "page")).isEqualTo("page.locator('li')"
				+ ".filter({ hasText: 'Apple' })"
				+ ".filter({ hasNotText: 'Sold out' })"
				+ ".filter({ has: page.getByRole('button', { name: 'Buy' }) })"
				+ ".filter({ hasNot: page.locator('.disabled') })"
				+ ".first().last().nth(2)");
	}

	@Test
	void interpolatedValuesBecomeTemplateLiterals() {
		String code = generator.generate(new LocatorExpression.Text("Hello {{user.name}}!", List.of()), "page");

		assertThat(code).isEqualTo("page.getByText(`Hello ${lookup(vars, 'user.name')}!`)");
		assertThat(values.usesLookup()).isTrue();
	}

	@Test
	void environmentReferencesReadProcessEnv() {
		String code = generator.generate(new LocatorExpression.Label("{{env.FIELD}}", List.of()), "page");

		assertThat(code).isEqualTo("page.getByLabel(`${process.env['FIELD'] ?? ''}`)");
		assertThat(values.usesLookup()).isFalse();
	}

	@Test
	void plainLiteralsDoNotNeedLookup() {
		generator.generate(new LocatorExpression.Css("a[href='x']", List.of()), "page");

		assertThat(values.usesLookup()).isFalse();
	}

	@Test
	void pageFieldsIgnoreTheRootButKeepModifiers() {
		LocatorExpression locator = new LocatorExpression.PageField("LoginPage", "email",
				List.of(new LocatorModifier.Nth(1)));

		assertThat(generator.generate(locator, "frame!")).isEqualTo("loginPage.email.nth(1)");
	}

	@Test
	void unknownPageFieldIsAGenerationError() {
		assertThatThrownBy(() -> generator.generate(new LocatorExpression.PageField("LoginPage", "phone", List.of()), "page"))
				.isInstanceOf(GenerationException.class)
				.hasMessage("Page 'LoginPage' has no field 'phone'");
	}

	@Test
	void pagesMustBeUsedBeforeTheirFieldsAre() {
		assertThatThrownBy(() -> generator.generate(new LocatorExpression.PageField("Cart", "total", List.of()), "page"))
				.isInstanceOf(GenerationException.class)
				.hasMessage("Page 'Cart' is not used by this feature; add USE Cart");
		assertThatThrownBy(() -> generator.generate(new LocatorExpression.PageField("Menu", "open", List.of()), "page"))
				.hasMessage("Unknown page 'Menu'");
		assertThatThrownBy(() -> generator.generate(new LocatorExpression.PageField(null, "email", List.of()), "page"))
				.hasMessage("A page name is required outside page actions");
	}

	@Test
	void insidePageActionsFieldsAreReadFromThis() {
		LocatorGenerator inPage = new LocatorGenerator(new ValueGenerator(PageScope.forPage(LOGIN_PAGE)));

		assertThat(inPage.generate(new LocatorExpression.PageField(null, "email", List.of()), "page"))
				.isEqualTo("this.email");
		assertThat(inPage.generate(new LocatorExpression.PageField("LoginPage", "email", List.of()), "page"))
				.isEqualTo("this.email");
		assertThatThrownBy(() -> inPage.generate(new LocatorExpression.PageField("Cart", "total", List.of()), "page"))
				.hasMessage("Page 'LoginPage' cannot refer to page 'Cart'; page actions only see their own page");
	}
}
