package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

public class AwaitExpression implements Expression
{
	private final Token keyword;
	private final Expression value;

	public AwaitExpression(Token keyword, Expression value)
	{
		this.keyword = keyword;
		this.value = value;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAwaitExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}
}
