package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * One handler of a try statement. Both the exception type and the alias are optional.
 */
public class ExceptClause
{
	private final Token firstToken;
	private final Expression exceptionType;
	private final Token alias;
	private final BlockStatement body;

	public ExceptClause(Token firstToken, Expression exceptionType, Token alias, BlockStatement body)
	{
		this.firstToken = firstToken;
		this.exceptionType = exceptionType;
		this.alias = alias;
		this.body = body;
	}

	public Token getFirstToken()
	{
		return firstToken;
	}

	public Expression getExceptionType()
	{
		return exceptionType;
	}

	public Token getAlias()
	{
		return alias;
	}

	public BlockStatement getBody()
	{
		return body;
	}
}
