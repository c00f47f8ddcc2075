package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

public class UnaryExpression implements Expression
{
	private final Token operatorToken;
	private final UnaryOperator operator;
	private final Expression operand;

	public UnaryExpression(Token operatorToken, UnaryOperator operator, Expression operand)
	{
		this.operatorToken = operatorToken;
		this.operator = operator;
		this.operand = operand;
	}

	public UnaryOperator getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return operatorToken;
	}

	@Override
	public String toString()
	{
		return operator.getSymbol() + operand;
	}
}
