package org.javai.vero.lexer;

import java.util.ArrayList;
import java.util.List;
import org.javai.vero.diagnostics.Diagnostic;
import org.javai.vero.diagnostics.Position;

/**
 * Tokenizer for Vero source text.
 * <p>
 * Scanning never stops on bad input: unrecognized characters, unterminated strings and
 * malformed variable markers are recorded as lexical diagnostics and the lexer carries on
 * from the next plausible boundary. Comments ({@code #} or {@code //} to end of line) are
 * dropped. A lexer instance scans a single source once; use {@link #tokenize(String)} for
 * the common case.
 */
public class VeroLexer {

	private final String input;
	private final List<VeroToken> tokens = new ArrayList<>();
	private final List<Diagnostic> errors = new ArrayList<>();
	private int pos = 0;
	private int line = 1;
	private int column = 1;

	public VeroLexer(String input) {
		this.input = input != null ? input : "";
	}

	public static LexResult tokenize(String input) {
		return new VeroLexer(input).tokenize();
	}

	/**
	 * Tokenizes the entire input.
	 *
	 * @return tokens (ending with EOF) and any lexical diagnostics
	 */
	public LexResult tokenize() {
		tokens.clear();
		errors.clear();
		pos = 0;
		line = 1;
		column = 1;

		while (!isAtEnd()) {
			skipWhitespaceAndComments();
			if (isAtEnd()) break;

			scanToken();
		}

		tokens.add(new VeroToken(TokenType.EOF, "", position()));
		return new LexResult(tokens, errors);
	}

	private void scanToken() {
		Position start = position();
		char c = peek();

		switch (c) {
			case '{' -> {
				if (peekNext() == '{') {
					scanVariable(start);
				} else {
					advance();
					add(TokenType.LBRACE, "{", start);
				}
			}
			case '}' -> single(TokenType.RBRACE, start);
			case '(' -> single(TokenType.LPAREN, start);
			case ')' -> single(TokenType.RPAREN, start);
			case ',' -> single(TokenType.COMMA, start);
			case '.' -> single(TokenType.DOT, start);
			case '@' -> single(TokenType.AT, start);
			case '=' -> pair('=', TokenType.EQ, "==", TokenType.ASSIGN, "=", start);
			case '>' -> pair('=', TokenType.GE, ">=", TokenType.GT, ">", start);
			case '<' -> pair('=', TokenType.LE, "<=", TokenType.LT, "<", start);
			case '!' -> {
				advance();
				if (peek() == '=') {
					advance();
					add(TokenType.NE, "!=", start);
				} else {
					errors.add(Diagnostic.lexical("Unexpected character: '!'", start));
				}
			}
			case '"' -> scanString(start);
			default -> {
				if (isDigit(c) || (c == '-' && isDigit(peekNext()))) {
					scanNumber(start);
				} else if (isIdentifierStart(c)) {
					scanIdentifier(start);
				} else {
					advance();
					errors.add(Diagnostic.lexical("Unexpected character: '" + c + "'", start));
				}
			}
		}
	}

	private void single(TokenType type, Position start) {
		char c = advance();
		add(type, String.valueOf(c), start);
	}

	private void pair(char second, TokenType pairType, String pairText, TokenType singleType, String singleText,
			Position start) {
		advance();
		if (peek() == second) {
			advance();
			add(pairType, pairText, start);
		} else {
			add(singleType, singleText, start);
		}
	}

	private void scanString(Position start) {
		advance(); // consume opening "

		StringBuilder sb = new StringBuilder();
		while (!isAtEnd() && peek() != '"' && peek() != '\n') {
			char c = advance();
			if (c == '\\' && !isAtEnd() && peek() != '\n') {
				char next = advance();
				sb.append(switch (next) {
					case 'n' -> '\n';
					case 't' -> '\t';
					case 'r' -> '\r';
					case '"' -> '"';
					case '\\' -> '\\';
					default -> next;
				});
			} else {
				sb.append(c);
			}
		}

		if (isAtEnd() || peek() == '\n') {
			// resume at the line break, keep what was read so the parser can continue
			errors.add(Diagnostic.lexical("Unterminated string", start));
		} else {
			advance(); // consume closing "
		}
		add(TokenType.STRING, sb.toString(), start);
	}

	private void scanVariable(Position start) {
		advance(); // {
		advance(); // {

		int contentStart = pos;
		while (!isAtEnd() && peek() != '\n' && !(peek() == '}' && peekNext() == '}')) {
			advance();
		}

		if (isAtEnd() || peek() == '\n') {
			errors.add(Diagnostic.lexical("Unterminated variable reference, expected '}}'", start));
			return;
		}

		String path = input.substring(contentStart, pos).trim();
		advance(); // }
		advance(); // }

		if (!isVariablePath(path)) {
			errors.add(Diagnostic.lexical("Invalid variable reference '{{" + path + "}}'", start));
			return;
		}
		add(TokenType.VARIABLE, path, start);
	}

	private void scanNumber(Position start) {
		int begin = pos;

		if (peek() == '-') {
			advance();
		}

		while (isDigit(peek())) {
			advance();
		}

		// Check for decimal part
		if (peek() == '.' && isDigit(peekNext())) {
			advance(); // consume '.'
			while (isDigit(peek())) {
				advance();
			}
		}

		add(TokenType.NUMBER, input.substring(begin, pos), start);
	}

	private void scanIdentifier(Position start) {
		int begin = pos;

		while (isIdentifierChar(peek())) {
			advance();
		}

		String word = input.substring(begin, pos);
		add(TokenType.keyword(word).orElse(TokenType.IDENTIFIER), word, start);
	}

	private void skipWhitespaceAndComments() {
		while (!isAtEnd()) {
			char c = peek();
			if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
				advance();
			} else if (c == '#' || (c == '/' && peekNext() == '/')) {
				while (!isAtEnd() && peek() != '\n') {
					advance();
				}
			} else {
				break;
			}
		}
	}

	private void add(TokenType type, String lexeme, Position start) {
		tokens.add(new VeroToken(type, lexeme, start));
	}

	private Position position() {
		return new Position(line, column, pos);
	}

	private char peek() {
		return isAtEnd() ? '\0' : input.charAt(pos);
	}

	private char peekNext() {
		return pos + 1 < input.length() ? input.charAt(pos + 1) : '\0';
	}

	private char advance() {
		char c = input.charAt(pos++);
		if (c == '\n') {
			line++;
			column = 1;
		} else {
			column++;
		}
		return c;
	}

	private boolean isAtEnd() {
		return pos >= input.length();
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierChar(char c) {
		return isIdentifierStart(c) || isDigit(c) || c == '-';
	}

	static boolean isVariablePath(String path) {
		if (path.isEmpty()) {
			return false;
		}
		for (String segment : path.split("\\.", -1)) {
			if (segment.isEmpty() || !isIdentifierStart(segment.charAt(0))) {
				return false;
			}
			for (int i = 1; i < segment.length(); i++) {
				char c = segment.charAt(i);
				if (!isIdentifierStart(c) && !isDigit(c)) {
					return false;
				}
			}
		}
		return true;
	}
}
