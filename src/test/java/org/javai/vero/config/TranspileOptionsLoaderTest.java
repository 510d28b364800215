package org.javai.vero.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.logging.log4j.Level;
import org.javai.vero.codegen.TranspileOptions;
import org.javai.vero.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TranspileOptionsLoaderTest {

	private final TranspileOptionsLoader loader = new TranspileOptionsLoader();

	@Test
	void loadsOptionsFromClasspathResource() throws Exception {
		try (InputStream in = getClass().getResourceAsStream("/vero.yml")) {
			TranspileOptions options = loader.load(in);

			assertThat(options.baseUrl()).isEqualTo("https://staging.example.com");
			assertThat(options.indent()).isEqualTo("    ");
			assertThat(options.maxWhileIterations()).isEqualTo(25);
			assertThat(options.testModule()).isEqualTo("./fixtures");
		}
	}

	@Test
	void loadsOptionsFromFile(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("vero.yml");
		Files.writeString(file, "baseUrl: http://localhost:3000\nindent: \"\\t\"\n");

		TranspileOptions options = loader.load(file);

		assertThat(options.baseUrl()).isEqualTo("http://localhost:3000");
		assertThat(options.indent()).isEqualTo("\t");
		assertThat(options.maxWhileIterations()).isEqualTo(TranspileOptions.DEFAULT_MAX_WHILE_ITERATIONS);
	}

	@Test
	void emptyDocumentGivesDefaults() {
		assertThat(loader.loadString("")).isEqualTo(TranspileOptions.defaults());
	}

	@Test
	void keysWithoutValuesKeepDefaults() {
		TranspileOptions options = loader.loadString("baseUrl:\ntestModule:\npageImportPath:\nindent:\n");

		assertThat(options.baseUrl()).isNull();
		assertThat(options.testModule()).isEqualTo("@playwright/test");
		assertThat(options.pageImportPath()).isEqualTo(TranspileOptions.DEFAULT_PAGE_IMPORT_PATH);
		assertThat(options).isEqualTo(TranspileOptions.defaults());
	}

	@Test
	void pageImportPathIsLoadedWithoutTrailingSlash() {
		assertThat(loader.loadString("pageImportPath: ../pages/\n").pageImportPath()).isEqualTo("../pages");
	}

	@Test
	void unknownKeysAreLoggedAndIgnored() {
		try (LogCaptorAppender captor = LogCaptorAppender.attach(TranspileOptionsLoader.class, Level.WARN)) {
			TranspileOptions options = loader.loadString("baseUrl: https://a.example\nheadless: true\n");

			assertThat(options.baseUrl()).isEqualTo("https://a.example");
			assertThat(captor.messages(Level.WARN)).containsExactly("Ignoring unknown option 'headless'");
		}
	}

	@Test
	void nonPositiveIterationGuardIsRejected() {
		assertThatThrownBy(() -> loader.loadString("maxWhileIterations: 0"))
				.isInstanceOf(VeroConfigException.class)
				.hasMessage("'maxWhileIterations' must be a positive integer but was 0");
		assertThatThrownBy(() -> loader.loadString("maxWhileIterations: lots"))
				.isInstanceOf(VeroConfigException.class);
	}

	@Test
	void negativeIndentIsRejected() {
		assertThatThrownBy(() -> loader.loadString("indent: -2"))
				.isInstanceOf(VeroConfigException.class)
				.hasMessageContaining("'indent' must not be negative");
	}

	@Test
	void malformedYamlIsWrapped() {
		assertThatThrownBy(() -> loader.loadString("baseUrl: [unclosed"))
				.isInstanceOf(VeroConfigException.class)
				.hasMessage("Failed to read options from string")
				.hasCauseInstanceOf(Exception.class);
	}

	@Test
	void missingFileIsWrapped(@TempDir Path dir) {
		Path missing = dir.resolve("absent.yml");

		assertThatThrownBy(() -> loader.load(missing))
				.isInstanceOf(VeroConfigException.class)
				.hasMessageStartingWith("Failed to read options from path");
	}
}
