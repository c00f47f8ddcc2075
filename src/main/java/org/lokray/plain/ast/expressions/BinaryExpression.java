package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

/**
 * AST node representing a binary operation (e.g., a plus b, x is greater than 3).
 */
public class BinaryExpression implements Expression
{
	private final Expression left;
	private final BinaryOperator operator;
	private final Expression right;

	public BinaryExpression(Expression left, BinaryOperator operator, Expression right)
	{
		this.left = left;
		this.operator = operator;
		this.right = right;
	}

	public Expression getLeft()
	{
		return left;
	}

	public BinaryOperator getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return left.getFirstToken();
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getSymbol() + " " + right + ")";
	}
}
