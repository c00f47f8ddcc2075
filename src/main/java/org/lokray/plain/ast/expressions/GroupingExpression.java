package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

/**
 * An expression written in parentheses. Kept in the tree so the generated code keeps the grouping.
 */
public class GroupingExpression implements Expression
{
	private final Token leftParen;
	private final Expression expression;

	public GroupingExpression(Token leftParen, Expression expression)
	{
		this.leftParen = leftParen;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGroupingExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return leftParen;
	}
}
