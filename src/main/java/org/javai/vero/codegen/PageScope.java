package org.javai.vero.codegen;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import org.javai.vero.ast.ActionDefinitionNode;
import org.javai.vero.ast.LocatorExpression;
import org.javai.vero.ast.PageNode;
import org.javai.vero.ast.StatementNode;

/**
 * The page objects generated code may refer to, and how it refers to them. A feature sees
 * the pages it uses through one instance variable each; a page action sees only its own page,
 * through {@code this}.
 */
final class PageScope {

	private static final Set<String> RESERVED_INSTANCE_NAMES = Set.of(
			"page", "browser", "vars", "frame", "test", "expect", "lookup");

	private final Map<String, PageNode> pages;
	private final Set<String> used;
	private final PageNode owner;

	private PageScope(Map<String, PageNode> pages, Set<String> used, PageNode owner) {
		this.pages = pages;
		this.used = used;
		this.owner = owner;
	}

	/**
	 * Scope of a feature's tests and hooks.
	 *
	 * @param pages every known page by name
	 * @param uses the pages named by the feature's {@code USE} lines; unknown names are ignored
	 */
	static PageScope forFeature(Map<String, PageNode> pages, Collection<String> uses) {
		Set<String> used = new LinkedHashSet<>();
		for (String name : uses) {
			if (pages.containsKey(name)) {
				used.add(name);
			}
		}
		return new PageScope(Map.copyOf(pages), used, null);
	}

	/**
	 * Scope inside the class generated for {@code owner}.
	 */
	static PageScope forPage(PageNode owner) {
		return new PageScope(Map.of(owner.name(), owner), Set.of(), owner);
	}

	/**
	 * Used pages that resolved, in {@code USE} order.
	 */
	Collection<PageNode> usedPages() {
		return used.stream().map(pages::get).toList();
	}

	/**
	 * Variable a test keeps a page object in: the class name in lower camel case.
	 */
	static String instanceName(String pageName) {
		String name = Character.toLowerCase(pageName.charAt(0)) + pageName.substring(1);
		return RESERVED_INSTANCE_NAMES.contains(name) ? name + "Page" : name;
	}

	String field(LocatorExpression.PageField reference) {
		PageNode page = resolve(reference.page());
		if (page.field(reference.field()).isEmpty()) {
			throw new GenerationException("Page '" + page.name() + "' has no field '" + reference.field() + "'");
		}
		return receiver(page) + "." + reference.field();
	}

	/**
	 * The method to call for a {@code DO} statement, after checking the action exists and takes
	 * as many arguments as given.
	 */
	String action(StatementNode.Do statement) {
		PageNode page = resolve(statement.page());
		ActionDefinitionNode action = page.action(statement.action()).orElseThrow(() ->
				new GenerationException("Page '" + page.name() + "' has no action '" + statement.action() + "'"));
		int expected = action.parameters().size();
		int given = statement.arguments().size();
		if (expected != given) {
			throw new GenerationException("Action '" + page.name() + "." + action.name() + "' takes " + expected
					+ " argument(s) but was given " + given);
		}
		return receiver(page) + "." + action.name();
	}

	/**
	 * Expression for {@code {{Page.variable}}}, or {@code null} when the path does not name a
	 * variable of a page in scope.
	 */
	String variable(String path) {
		int dot = path.indexOf('.');
		if (dot < 0 || path.indexOf('.', dot + 1) >= 0) {
			return null;
		}
		String pageName = path.substring(0, dot);
		PageNode page = owner != null && owner.name().equals(pageName)
				? owner
				: used.contains(pageName) ? pages.get(pageName) : null;
		if (page == null || page.variable(path.substring(dot + 1)).isEmpty()) {
			return null;
		}
		return receiver(page) + path.substring(dot);
	}

	private PageNode resolve(String pageName) {
		if (owner != null) {
			if (pageName == null || pageName.equals(owner.name())) {
				return owner;
			}
			throw new GenerationException("Page '" + owner.name() + "' cannot refer to page '" + pageName
					+ "'; page actions only see their own page");
		}
		if (pageName == null) {
			throw new GenerationException("A page name is required outside page actions");
		}
		PageNode page = pages.get(pageName);
		if (page == null) {
			throw new GenerationException("Unknown page '" + pageName + "'");
		}
		if (!used.contains(pageName)) {
			throw new GenerationException("Page '" + pageName + "' is not used by this feature; add USE " + pageName);
		}
		return page;
	}

	private String receiver(PageNode page) {
		return page == owner ? "this" : instanceName(page.name());
	}
}
