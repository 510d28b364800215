package org.javai.vero.lexer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.javai.vero.diagnostics.Diagnostic;
import org.javai.vero.diagnostics.DiagnosticKind;
import org.javai.vero.diagnostics.Position;
import org.junit.jupiter.api.Test;

class VeroLexerTest {

	private static List<TokenType> types(LexResult result) {
		return result.tokens().stream().map(VeroToken::type).toList();
	}

	@Test
	void tokenizeEmptyString() {
		LexResult result = VeroLexer.tokenize("");

		assertThat(types(result)).containsExactly(TokenType.EOF);
		assertThat(result.errors()).isEmpty();
	}

	@Test
	void tokenizeNullInput() {
		LexResult result = VeroLexer.tokenize(null);

		assertThat(types(result)).containsExactly(TokenType.EOF);
		assertThat(result.hasErrors()).isFalse();
	}

	@Test
	void tokenizeWhitespaceAndCommentsOnly() {
		LexResult result = VeroLexer.tokenize("  # a comment\n\t// another one\n");

		assertThat(types(result)).containsExactly(TokenType.EOF);
		assertThat(result.errors()).isEmpty();
	}

	@Test
	void keywordsAreCaseSensitive() {
		LexResult result = VeroLexer.tokenize("CLICK click Click");

		assertThat(types(result)).containsExactly(TokenType.CLICK, TokenType.IDENTIFIER, TokenType.IDENTIFIER,
				TokenType.EOF);
	}

	@Test
	void tokenizeFeatureHeader() {
		LexResult result = VeroLexer.tokenize("FEATURE Login {\n  SCENARIO \"works\" @smoke {\n  }\n}");

		assertThat(types(result)).containsExactly(
				TokenType.FEATURE, TokenType.IDENTIFIER, TokenType.LBRACE,
				TokenType.SCENARIO, TokenType.STRING, TokenType.AT, TokenType.IDENTIFIER, TokenType.LBRACE,
				TokenType.RBRACE, TokenType.RBRACE, TokenType.EOF);
		assertThat(result.tokens().get(4).lexeme()).isEqualTo("works");
		assertThat(result.tokens().get(6).lexeme()).isEqualTo("smoke");
	}

	@Test
	void tracksLineAndColumn() {
		LexResult result = VeroLexer.tokenize("OPEN \"x\"\n  CLICK \"y\"");

		VeroToken click = result.tokens().get(2);
		assertThat(click.type()).isEqualTo(TokenType.CLICK);
		assertThat(click.position()).isEqualTo(new Position(2, 3, 11));
	}

	@Test
	void decodesStringEscapes() {
		LexResult result = VeroLexer.tokenize("\"a\\\"b\\\\c\\nd\\te\\q\"");

		assertThat(result.errors()).isEmpty();
		assertThat(result.tokens().get(0).lexeme()).isEqualTo("a\"b\\c\nd\teq");
	}

	@Test
	void unterminatedStringReportsOpeningQuoteAndContinues() {
		LexResult result = VeroLexer.tokenize("CLICK \"Submit\nOPEN \"https://example.com\"");

		assertThat(result.errors()).hasSize(1);
		Diagnostic error = result.errors().get(0);
		assertThat(error.message()).isEqualTo("Unterminated string");
		assertThat(error.position()).isEqualTo(new Position(1, 7, 6));
		assertThat(error.kind()).isEqualTo(DiagnosticKind.LEXICAL);
		assertThat(types(result)).containsExactly(TokenType.CLICK, TokenType.STRING, TokenType.OPEN, TokenType.STRING,
				TokenType.EOF);
		assertThat(result.tokens().get(1).lexeme()).isEqualTo("Submit");
	}

	@Test
	void unterminatedStringAtEndOfInput() {
		LexResult result = VeroLexer.tokenize("\"abc");

		assertThat(result.errors()).extracting(Diagnostic::message).containsExactly("Unterminated string");
		assertThat(types(result)).containsExactly(TokenType.STRING, TokenType.EOF);
	}

	@Test
	void tokenizeVariableReference() {
		LexResult result = VeroLexer.tokenize("{{ user.email }}");

		assertThat(types(result)).containsExactly(TokenType.VARIABLE, TokenType.EOF);
		assertThat(result.tokens().get(0).lexeme()).isEqualTo("user.email");
	}

	@Test
	void singleBraceIsPunctuation() {
		LexResult result = VeroLexer.tokenize("{ }");

		assertThat(types(result)).containsExactly(TokenType.LBRACE, TokenType.RBRACE, TokenType.EOF);
	}

	@Test
	void unterminatedVariableReference() {
		LexResult result = VeroLexer.tokenize("LOG {{name\nREFRESH");

		assertThat(result.errors()).extracting(Diagnostic::message)
				.containsExactly("Unterminated variable reference, expected '}}'");
		assertThat(result.errors().get(0).position()).isEqualTo(new Position(1, 5, 4));
		assertThat(types(result)).containsExactly(TokenType.LOG, TokenType.REFRESH, TokenType.EOF);
	}

	@Test
	void malformedVariablePath() {
		LexResult result = VeroLexer.tokenize("{{1abc}}");

		assertThat(result.errors()).extracting(Diagnostic::message).containsExactly("Invalid variable reference '{{1abc}}'");
		assertThat(types(result)).containsExactly(TokenType.EOF);
	}

	@Test
	void variablePathValidation() {
		assertThat(VeroLexer.isVariablePath("a")).isTrue();
		assertThat(VeroLexer.isVariablePath("env.BASE_URL")).isTrue();
		assertThat(VeroLexer.isVariablePath("a..b")).isFalse();
		assertThat(VeroLexer.isVariablePath("a.")).isFalse();
		assertThat(VeroLexer.isVariablePath("")).isFalse();
		assertThat(VeroLexer.isVariablePath("a-b")).isFalse();
	}

	@Test
	void tokenizeNumbers() {
		LexResult result = VeroLexer.tokenize("3 2.5 -1 10");

		assertThat(result.tokens()).extracting(VeroToken::lexeme).containsExactly("3", "2.5", "-1", "10", "");
		assertThat(types(result)).containsOnly(TokenType.NUMBER, TokenType.EOF);
	}

	@Test
	void tokenizeOperators() {
		LexResult result = VeroLexer.tokenize("= == != > < >= <= ( ) ,");

		assertThat(types(result)).containsExactly(TokenType.ASSIGN, TokenType.EQ, TokenType.NE, TokenType.GT,
				TokenType.LT, TokenType.GE, TokenType.LE, TokenType.LPAREN, TokenType.RPAREN, TokenType.COMMA,
				TokenType.EOF);
	}

	@Test
	void identifiersMayContainHyphens() {
		LexResult result = VeroLexer.tokenize("@smoke-test");

		assertThat(result.tokens().get(1).lexeme()).isEqualTo("smoke-test");
	}

	@Test
	void pageReferencesSplitOnDot() {
		LexResult result = VeroLexer.tokenize("USE LoginPage DO LoginPage.login WAIT 1.5");

		assertThat(types(result)).containsExactly(TokenType.USE, TokenType.IDENTIFIER, TokenType.DO,
				TokenType.IDENTIFIER, TokenType.DOT, TokenType.IDENTIFIER, TokenType.WAIT, TokenType.NUMBER,
				TokenType.EOF);
		assertThat(result.tokens().get(7).lexeme()).isEqualTo("1.5");
	}

	@Test
	void unexpectedCharactersAreReportedOneByOne() {
		LexResult result = VeroLexer.tokenize("CLICK $ \"a\" % !");

		assertThat(result.errors()).extracting(Diagnostic::message)
				.containsExactly("Unexpected character: '$'", "Unexpected character: '%'", "Unexpected character: '!'");
		assertThat(types(result)).containsExactly(TokenType.CLICK, TokenType.STRING, TokenType.EOF);
	}

	@Test
	void commentsRunToEndOfLine() {
		LexResult result = VeroLexer.tokenize("REFRESH # CLICK \"x\"\nREFRESH // CLICK");

		assertThat(types(result)).containsExactly(TokenType.REFRESH, TokenType.REFRESH, TokenType.EOF);
	}

	@Test
	void tokenizationIsDeterministic() {
		String source = "FEATURE A { SCENARIO \"b\" { CLICK button \"Go\" $ \"open } }";

		assertThat(VeroLexer.tokenize(source)).isEqualTo(VeroLexer.tokenize(source));
	}

	@Test
	void errorFreeInputConsumesEverything() {
		LexResult result = VeroLexer.tokenize("FILL label \"Email\" WITH {{user.email}}");

		assertThat(result.errors()).isEmpty();
		assertThat(types(result)).containsExactly(TokenType.FILL, TokenType.IDENTIFIER, TokenType.STRING, TokenType.WITH,
				TokenType.VARIABLE, TokenType.EOF);
	}
}
