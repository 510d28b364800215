package org.javai.vero.cli;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

class VeroCommandTest {

	private static final String VALID = """
			FEATURE "Login flow" {
			  SCENARIO "valid user" @smoke {
			    OPEN "https://example.com/login"
			    FILL label "Email" WITH "{{user.email}}"
			    CLICK button "Sign in"
			  }
			}
			""";

	private static final String BROKEN = "FEATURE F { SCENARIO s { CLICK } }";

	@TempDir
	Path dir;

	private ByteArrayOutputStream outContent;
	private ByteArrayOutputStream errContent;
	private PrintStream originalOut;
	private PrintStream originalErr;

	@BeforeEach
	void setUp() {
		outContent = new ByteArrayOutputStream();
		errContent = new ByteArrayOutputStream();
		originalOut = System.out;
		originalErr = System.err;
		System.setOut(new PrintStream(outContent));
		System.setErr(new PrintStream(errContent));
	}

	@AfterEach
	void tearDown() {
		System.setOut(originalOut);
		System.setErr(originalErr);
	}

	private int execute(String... args) {
		return new CommandLine(new VeroCommand()).execute(args);
	}

	private Path source(String name, String content) throws Exception {
		Path file = dir.resolve(name);
		Files.writeString(file, content);
		return file;
	}

	@Test
	void compileWritesOneSpecPerFeature() throws Exception {
		Path login = source("login.vero", VALID);
		Path out = dir.resolve("generated");

		int exitCode = execute("compile", "-o", out.toString(), login.toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_OK);
		Path spec = out.resolve("Login_flow.spec.ts");
		assertThat(spec).exists();
		assertThat(Files.readString(spec))
				.contains("test.describe('Login flow', () => {")
				.contains("test('valid user @smoke', async ({ page }) => {")
				.contains("await page.goto('https://example.com/login');");
		assertThat(outContent.toString()).contains("Wrote " + spec);
	}

	@Test
	void compileAppliesConfigFile() throws Exception {
		Path login = source("login.vero", VALID);
		Path config = source("vero.yml", "baseUrl: https://qa.example.com\n");
		Path out = dir.resolve("generated");

		int exitCode = execute("compile", "-c", config.toString(), "-o", out.toString(), login.toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_OK);
		assertThat(Files.readString(out.resolve("Login_flow.spec.ts")))
				.contains("test.use({ baseURL: 'https://qa.example.com' });");
	}

	@Test
	void compileWritesPageObjectsUsedAcrossFiles() throws Exception {
		Path pages = source("pages.vero", """
				PAGE LoginPage {
				  FIELD email = "#email"
				  signIn WITH address {
				    FILL email WITH {{address}}
				  }
				}
				""");
		Path feature = source("login.vero", """
				FEATURE Login {
				  USE LoginPage
				  SCENARIO s { DO LoginPage.signIn WITH "ann@example.com" }
				}
				""");
		Path out = dir.resolve("generated");

		int exitCode = execute("compile", "-o", out.toString(), pages.toString(), feature.toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_OK);
		Path pageObject = out.resolve("pages").resolve("LoginPage.ts");
		assertThat(Files.readString(pageObject))
				.contains("this.email = page.locator('#email');")
				.contains("async signIn(address: any): Promise<void> {");
		assertThat(Files.readString(out.resolve("Login.spec.ts")))
				.contains("import { LoginPage } from './pages/LoginPage';")
				.contains("await loginPage.signIn('ann@example.com');");
		assertThat(outContent.toString()).contains("Wrote " + pageObject);
	}

	@Test
	void pageImportPathDecidesWherePageObjectsGo() throws Exception {
		Path source = source("all.vero", "PAGE Home { FIELD logo = \"img.logo\" }");
		Path config = source("vero.yml", "pageImportPath: ../page-objects\n");
		Path out = dir.resolve("tests");

		int exitCode = execute("compile", "-c", config.toString(), "-o", out.toString(), source.toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_OK);
		assertThat(dir.resolve("page-objects").resolve("Home.ts")).exists();
	}

	@Test
	void compileWritesNothingWhenAnyFileHasDiagnostics() throws Exception {
		Path login = source("login.vero", VALID);
		Path broken = source("broken.vero", BROKEN);
		Path out = dir.resolve("generated");

		int exitCode = execute("compile", "-o", out.toString(), login.toString(), broken.toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_DIAGNOSTICS);
		assertThat(out).doesNotExist();
		assertThat(errContent.toString())
				.contains(broken + ":1:32: error: Expected a locator but found '}'");
	}

	@Test
	void unreadableInputIsAnInputError() {
		int exitCode = execute("compile", "-o", dir.toString(), dir.resolve("missing.vero").toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_INPUT);
		assertThat(errContent.toString()).startsWith("error: Cannot read ");
	}

	@Test
	void invalidConfigIsAnInputError() throws Exception {
		Path login = source("login.vero", VALID);
		Path config = source("vero.yml", "maxWhileIterations: -1\n");

		int exitCode = execute("compile", "-c", config.toString(), "-o", dir.toString(), login.toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_INPUT);
		assertThat(errContent.toString())
				.contains("error: 'maxWhileIterations' must be a positive integer but was -1");
	}

	@Test
	void checkReportsDiagnosticsInEditorFormat() throws Exception {
		Path broken = source("broken.vero", BROKEN);

		int exitCode = execute("check", broken.toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_DIAGNOSTICS);
		assertThat(outContent.toString().trim())
				.isEqualTo(broken + ":1:32: error: Expected a locator but found '}'");
	}

	@Test
	void checkOfCleanFileIsSilent() throws Exception {
		Path login = source("login.vero", VALID);

		int exitCode = execute("check", login.toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_OK);
		assertThat(outContent.toString()).isEmpty();
	}

	@Test
	void checkEmitsJson() throws Exception {
		Path login = source("login.vero", VALID);
		Path broken = source("broken.vero", BROKEN);

		int exitCode = execute("check", "--json", login.toString(), broken.toString());

		assertThat(exitCode).isEqualTo(VeroCommand.EXIT_DIAGNOSTICS);
		JsonNode json = new ObjectMapper().readTree(outContent.toString());
		assertThat(json.get("errorCount").asInt()).isEqualTo(1);
		assertThat(json.get("files")).hasSize(2);
		assertThat(json.get("files").get(0).get("diagnostics")).isEmpty();
		JsonNode diagnostic = json.get("files").get(1).get("diagnostics").get(0);
		assertThat(diagnostic.get("kind").asText()).isEqualTo("SYNTAX");
		assertThat(diagnostic.get("severity").asText()).isEqualTo("ERROR");
		assertThat(diagnostic.get("line").asInt()).isEqualTo(1);
		assertThat(diagnostic.get("column").asInt()).isEqualTo(32);
		assertThat(diagnostic.get("offset").asInt()).isEqualTo(31);
	}

	@Test
	void fileNamesAreSanitized() {
		assertThat(VeroCommand.fileName("Login flow")).isEqualTo("Login_flow.spec.ts");
		assertThat(VeroCommand.fileName("a/b:c")).isEqualTo("a_b_c.spec.ts");
		assertThat(VeroCommand.fileName("")).isEqualTo("feature.spec.ts");
	}
}
