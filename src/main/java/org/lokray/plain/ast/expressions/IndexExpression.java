package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

public class IndexExpression implements Expression
{
	private final Expression object;
	private final Expression index;

	public IndexExpression(Expression object, Expression index)
	{
		this.object = object;
		this.index = index;
	}

	public Expression getObject()
	{
		return object;
	}

	public Expression getIndex()
	{
		return index;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIndexExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return object.getFirstToken();
	}
}
