package org.javai.vero.codegen;

/**
 * Options for generating Playwright test files.
 *
 * @param baseUrl emitted as {@code test.use({ baseURL })} when not {@code null}
 * @param indent one level of indentation in the generated code
 * @param maxWhileIterations iteration guard for {@code WHILE} loops without {@code MAX}
 * @param testModule module the {@code test} and {@code expect} functions are imported from
 * @param pageImportPath directory, relative to a generated test, that page object classes are
 * imported from
 */
public record TranspileOptions(
		String baseUrl,
		String indent,
		int maxWhileIterations,
		String testModule,
		String pageImportPath
) {

	public static final int DEFAULT_MAX_WHILE_ITERATIONS = 100;
	public static final String DEFAULT_TEST_MODULE = "@playwright/test";
	public static final String DEFAULT_PAGE_IMPORT_PATH = "./pages";

	public TranspileOptions {
		indent = indent != null ? indent : "  ";
		testModule = testModule != null && !testModule.isBlank() ? testModule : DEFAULT_TEST_MODULE;
		pageImportPath = pageImportPath != null && !pageImportPath.isBlank()
				? stripTrailingSlash(pageImportPath)
				: DEFAULT_PAGE_IMPORT_PATH;
		if (maxWhileIterations <= 0) {
			throw new IllegalArgumentException("maxWhileIterations must be positive but was " + maxWhileIterations);
		}
	}

	public static TranspileOptions defaults() {
		return new TranspileOptions(null, "  ", DEFAULT_MAX_WHILE_ITERATIONS, DEFAULT_TEST_MODULE,
				DEFAULT_PAGE_IMPORT_PATH);
	}

	public TranspileOptions withBaseUrl(String baseUrl) {
		return new TranspileOptions(baseUrl, indent, maxWhileIterations, testModule, pageImportPath);
	}

	private static String stripTrailingSlash(String path) {
		return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
	}
}
