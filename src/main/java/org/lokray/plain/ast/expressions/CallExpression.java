package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

import java.util.List;

/**
 * AST node representing a call with positional and keyword arguments.
 */
public class CallExpression implements Expression
{
	private final Token firstToken;
	private final Expression callee;
	private final List<Expression> arguments;
	private final List<KeywordArgument> keywordArguments;

	public CallExpression(Token firstToken, Expression callee, List<Expression> arguments, List<KeywordArgument> keywordArguments)
	{
		this.firstToken = firstToken;
		this.callee = callee;
		this.arguments = List.copyOf(arguments);
		this.keywordArguments = List.copyOf(keywordArguments);
	}

	public CallExpression(Token firstToken, Expression callee, List<Expression> arguments)
	{
		this(firstToken, callee, arguments, List.of());
	}

	public Expression getCallee()
	{
		return callee;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	public List<KeywordArgument> getKeywordArguments()
	{
		return keywordArguments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}

	@Override
	public String toString()
	{
		return callee + "(" + arguments + ")";
	}
}
