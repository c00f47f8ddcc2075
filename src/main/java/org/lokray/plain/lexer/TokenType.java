package org.lokray.plain.lexer;

/**
 * Kinds of tokens produced by the Plain lexer.
 * Plain keeps almost everything as WORD tokens; phrases are recognized later by the grammar resolver.
 */
public enum TokenType
{
	// Words and literals
	WORD,
	NUMBER,
	STRING,

	// Punctuation
	LEFT_PAREN,
	RIGHT_PAREN,
	LEFT_BRACKET,
	RIGHT_BRACKET,
	LEFT_BRACE,
	RIGHT_BRACE,
	COMMA,
	DOT,
	COLON,

	// Symbolic operators
	PLUS,
	MINUS,
	STAR,
	STAR_STAR,
	SLASH,
	PERCENT,
	ASSIGN,
	EQUAL_EQUAL,
	BANG_EQUAL,
	LESS,
	LESS_EQUAL,
	GREATER,
	GREATER_EQUAL,

	// Layout
	NEWLINE,
	INDENT,
	DEDENT,
	EOF
}
