package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.Parameter;
import org.lokray.plain.lexer.Token;

import java.util.List;

public class LambdaExpression implements Expression
{
	private final Token firstToken;
	private final List<Parameter> parameters;
	private final Expression body;

	public LambdaExpression(Token firstToken, List<Parameter> parameters, Expression body)
	{
		this.firstToken = firstToken;
		this.parameters = List.copyOf(parameters);
		this.body = body;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public Expression getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLambdaExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}
}
