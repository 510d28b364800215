package org.javai.vero.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import org.javai.vero.CompilationResult;
import org.javai.vero.VeroCompiler;
import org.javai.vero.ast.PageNode;
import org.javai.vero.codegen.TranspileOptions;
import org.javai.vero.config.TranspileOptionsLoader;
import org.javai.vero.config.VeroConfigException;
import org.javai.vero.diagnostics.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/**
 * Command line entry point.
 * <ul>
 *   <li>{@code vero compile [-o DIR] [-c vero.yml] FILES...} writes one {@code <Feature>.spec.ts}
 *   per feature and one {@code <Page>.ts} per page under the page import path, or nothing at
 *   all when any file has diagnostics. Pages defined in any of the files are visible to all of
 *   them.</li>
 *   <li>{@code vero check [--json] FILES...} only reports diagnostics</li>
 * </ul>
 * Exit codes: 0 clean, 1 diagnostics found, 2 unreadable input or configuration.
 */
@Command(
		name = "vero",
		description = "Compiles Vero scenarios into Playwright tests",
		version = "0.1.0",
		mixinStandardHelpOptions = true,
		subcommands = {
				VeroCommand.CompileCommand.class,
				VeroCommand.CheckCommand.class
		}
)
public class VeroCommand implements Callable<Integer> {

	static final int EXIT_OK = 0;
	static final int EXIT_DIAGNOSTICS = 1;
	static final int EXIT_INPUT = 2;

	public static void main(String[] args) {
		int exitCode = new CommandLine(new VeroCommand()).execute(args);
		System.exit(exitCode);
	}

	@Override
	public Integer call() {
		CommandLine.usage(this, System.out);
		return EXIT_OK;
	}

	@Command(name = "compile", description = "Generate Playwright tests from .vero files", mixinStandardHelpOptions = true)
	static class CompileCommand implements Callable<Integer> {

		private static final Logger logger = LoggerFactory.getLogger(CompileCommand.class);

		@Parameters(arity = "1..*", description = "Vero source files")
		List<Path> files;

		@Option(names = {"-o", "--output"}, description = "Output directory (default: current directory)", defaultValue = ".")
		Path outputDir;

		@Option(names = {"-c", "--config"}, description = "Options file (vero.yml)")
		Path config;

		@Override
		public Integer call() {
			Map<String, String> pageClasses = new LinkedHashMap<>();
			Map<String, String> tests = new LinkedHashMap<>();
			boolean clean = true;
			try {
				TranspileOptions options = config != null
						? new TranspileOptionsLoader().load(config)
						: TranspileOptions.defaults();
				VeroCompiler compiler = new VeroCompiler(options);

				Map<Path, String> sources = new LinkedHashMap<>();
				List<PageNode> pages = new ArrayList<>();
				for (Path file : files) {
					String source = readSource(file);
					sources.put(file, source);
					pages.addAll(compiler.check(source).pages());
				}

				for (Map.Entry<Path, String> source : sources.entrySet()) {
					Path file = source.getKey();
					CompilationResult result = compiler.compile(source.getValue(), pages);
					if (!result.isTrustworthy()) {
						clean = false;
						printDiagnostics(file, result.allErrors());
						continue;
					}
					for (Map.Entry<String, String> page : result.pageClasses().entrySet()) {
						if (pageClasses.put(page.getKey(), page.getValue()) != null) {
							logger.warn("Page '{}' defined in more than one file; {} wins", page.getKey(), file);
						}
					}
					for (Map.Entry<String, String> test : result.tests().entrySet()) {
						if (tests.put(test.getKey(), test.getValue()) != null) {
							logger.warn("Feature '{}' defined in more than one file; {} wins", test.getKey(), file);
						}
					}
				}
				if (!clean) {
					return EXIT_DIAGNOSTICS;
				}
				writePages(pageClasses, outputDir.resolve(options.pageImportPath()).normalize());
				writeTests(tests);
				return EXIT_OK;
			} catch (VeroConfigException e) {
				logger.debug("Compilation aborted", e);
				System.err.println("error: " + e.getMessage());
				return EXIT_INPUT;
			}
		}

		private void writePages(Map<String, String> pageClasses, Path pagesDir) {
			if (pageClasses.isEmpty()) {
				return;
			}
			try {
				Files.createDirectories(pagesDir);
				for (Map.Entry<String, String> page : pageClasses.entrySet()) {
					Path target = pagesDir.resolve(page.getKey() + ".ts");
					Files.writeString(target, page.getValue());
					System.out.println("Wrote " + target);
				}
			} catch (IOException e) {
				throw new VeroConfigException("Failed to write page objects to " + pagesDir, e);
			}
		}

		private void writeTests(Map<String, String> tests) {
			try {
				Files.createDirectories(outputDir);
				for (Map.Entry<String, String> test : tests.entrySet()) {
					Path target = outputDir.resolve(fileName(test.getKey()));
					Files.writeString(target, test.getValue());
					System.out.println("Wrote " + target);
				}
			} catch (IOException e) {
				throw new VeroConfigException("Failed to write tests to " + outputDir, e);
			}
		}
	}

	@Command(name = "check", description = "Report diagnostics without generating code", mixinStandardHelpOptions = true)
	static class CheckCommand implements Callable<Integer> {

		private static final Logger logger = LoggerFactory.getLogger(CheckCommand.class);

		@Parameters(arity = "1..*", description = "Vero source files")
		List<Path> files;

		@Option(names = "--json", description = "Print diagnostics as JSON")
		boolean json;

		@Override
		public Integer call() {
			Map<String, List<Diagnostic>> diagnostics = new LinkedHashMap<>();
			try {
				VeroCompiler compiler = new VeroCompiler();
				for (Path file : files) {
					diagnostics.put(file.toString(), compiler.check(readSource(file)).allErrors());
				}
			} catch (VeroConfigException e) {
				logger.debug("Check aborted", e);
				System.err.println("error: " + e.getMessage());
				return EXIT_INPUT;
			}

			boolean clean = diagnostics.values().stream().allMatch(List::isEmpty);
			if (json) {
				System.out.println(DiagnosticsJsonEmitter.emit(diagnostics));
			}
			else {
				diagnostics.forEach((file, errors) -> errors.forEach(error -> System.out.println(format(file, error))));
			}
			return clean ? EXIT_OK : EXIT_DIAGNOSTICS;
		}
	}

	static String readSource(Path file) {
		try {
			return Files.readString(file);
		} catch (IOException e) {
			throw new VeroConfigException("Cannot read " + file, e);
		}
	}

	static void printDiagnostics(Path file, List<Diagnostic> diagnostics) {
		diagnostics.forEach(diagnostic -> System.err.println(format(file.toString(), diagnostic)));
	}

	/**
	 * {@code file:line:col: error: message}, the format most editors link.
	 */
	static String format(String file, Diagnostic diagnostic) {
		return file + ":" + diagnostic;
	}

	/**
	 * Output file name for a feature, keeping only characters safe on every file system.
	 */
	static String fileName(String featureName) {
		String safe = featureName.replaceAll("[^A-Za-z0-9_-]", "_");
		return (safe.isEmpty() ? "feature" : safe) + ".spec.ts";
	}
}
