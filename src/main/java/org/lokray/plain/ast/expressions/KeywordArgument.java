package org.lokray.plain.ast.expressions;

import org.lokray.plain.lexer.Token;

/**
 * A {@code name=value} argument of a call.
 */
public class KeywordArgument
{
	private final Token name;
	private final Expression value;

	public KeywordArgument(Token name, Expression value)
	{
		this.name = name;
		this.value = value;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getNameToken()
	{
		return name;
	}

	public Expression getValue()
	{
		return value;
	}
}
