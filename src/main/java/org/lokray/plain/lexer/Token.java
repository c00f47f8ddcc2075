package org.lokray.plain.lexer;

import java.util.Objects;

/**
 * Represents a single token produced by the Plain Lexer.
 * Each token encapsulates its type, the actual text (lexeme),
 * and its position in the source for error reporting. Tokens are immutable.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., WORD, NUMBER, COMMA)
	private final String lexeme;     // The actual text of the token as written
	private final Object literal;    // Decoded value of STRING and NUMBER tokens
	private final int line;
	private final int column;

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type    The TokenType of this token.
	 * @param lexeme  The raw string value of the token from the source code.
	 * @param literal The decoded literal value (String for strings, BigDecimal for numbers), otherwise null.
	 * @param line    The line number where this token begins.
	 * @param column  The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, Object literal, int line, int column)
	{
		this.type = type;
		this.lexeme = lexeme;
		this.literal = literal;
		this.line = line;
		this.column = column;
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * Checks whether this token is a WORD spelling one of the given words, ignoring case.
	 */
	public boolean isWord(String... words)
	{
		if(type != TokenType.WORD)
		{
			return false;
		}
		for(String word : words)
		{
			if(lexeme.equalsIgnoreCase(word))
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns the lowercase spelling of a WORD, which is how the grammar compares words.
	 */
	public String normalized()
	{
		return lexeme.toLowerCase();
	}

	/**
	 * Format: "TokenType 'lexeme' [literal] (Line:Column)"
	 */
	@Override
	public String toString()
	{
		String literalStr = (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + lexeme + "'" + literalStr + " (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Compares type, lexeme and literal only, so tokens from different positions may be equal.
	 */
	@Override
	public boolean equals(Object o)
	{
		if(this == o)
			return true;
		if(o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;
		return type == token.type && Objects.equals(lexeme, token.lexeme) && Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(type, lexeme, literal);
	}
}
