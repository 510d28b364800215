package org.javai.vero.lexer;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token categories of the Vero language.
 * <p>
 * Keyword constants carry {@code keyword = true}; their spelling is the constant name and is
 * matched case-sensitively by the lexer.
 */
public enum TokenType {

	// Structure
	FEATURE(true),
	SCENARIO(true),
	BEFORE(true),
	AFTER(true),
	EACH(true),
	ALL(true),

	// Page objects
	PAGE(true),
	FIELD(true),
	USE(true),
	DO(true),

	// Navigation and frames
	SWITCH(true),
	TO(true),
	FRAME(true),
	MAIN(true),
	OPEN(true),
	NAVIGATE(true),
	GOTO(true),
	REFRESH(true),

	// Actions
	CLICK(true),
	DOUBLE(true),
	RIGHT(true),
	FILL(true),
	WITH(true),
	CLEAR(true),
	SELECT(true),
	OPTION(true),
	CHECK(true),
	UNCHECK(true),
	HOVER(true),
	OVER(true),
	PRESS(true),
	WAIT(true),
	FOR(true),
	SECONDS(true),
	MILLISECONDS(true),
	SET(true),
	LOG(true),
	TAKE(true),
	SCREENSHOT(true),

	// Assertions and element states
	SEE(true),
	ASSERT(true),
	VERIFY(true),
	IS(true),
	NOT(true),
	VISIBLE(true),
	HIDDEN(true),
	ENABLED(true),
	DISABLED(true),
	CHECKED(true),
	EMPTY(true),
	FOCUSED(true),
	EXISTS(true),
	CONTAINS(true),
	HAS(true),
	TEXT(true),
	VALUE(true),
	COUNT(true),
	URL(true),
	TITLE(true),

	// Locator modifiers
	FIRST(true),
	LAST(true),
	NTH(true),
	WITHOUT(true),

	// Control flow
	IF(true),
	ELSE(true),
	WHILE(true),
	MAX(true),
	REPEAT(true),
	TIMES(true),
	IN(true),
	BREAK(true),
	CONTINUE(true),
	END(true),
	AND(true),
	OR(true),
	EXPRESSION(true),
	TRUE(true),
	FALSE(true),

	// Literals
	IDENTIFIER(false),
	STRING(false),
	NUMBER(false),
	VARIABLE(false),

	// Punctuation
	LBRACE(false),
	RBRACE(false),
	LPAREN(false),
	RPAREN(false),
	COMMA(false),
	DOT(false),
	AT(false),
	ASSIGN(false),
	EQ(false),
	NE(false),
	GT(false),
	LT(false),
	GE(false),
	LE(false),

	EOF(false);

	private static final Map<String, TokenType> KEYWORDS;

	static {
		Map<String, TokenType> keywords = new HashMap<>();
		for (TokenType type : values()) {
			if (type.keyword) {
				keywords.put(type.name(), type);
			}
		}
		KEYWORDS = Collections.unmodifiableMap(keywords);
	}

	private final boolean keyword;

	TokenType(boolean keyword) {
		this.keyword = keyword;
	}

	public boolean isKeyword() {
		return keyword;
	}

	/**
	 * Looks up the reserved word table. Matching is case-sensitive: {@code "CLICK"} is a
	 * keyword, {@code "click"} is an identifier.
	 */
	public static Optional<TokenType> keyword(String word) {
		return Optional.ofNullable(KEYWORDS.get(word));
	}
}
