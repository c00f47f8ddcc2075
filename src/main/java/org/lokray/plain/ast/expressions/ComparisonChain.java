package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

import java.util.List;

/**
 * A chained comparison such as {@code low <= x <= high}, produced by "x is between low and high".
 * Holds one more operand than operators.
 */
public class ComparisonChain implements Expression
{
	private final List<Expression> operands;
	private final List<BinaryOperator> operators;

	public ComparisonChain(List<Expression> operands, List<BinaryOperator> operators)
	{
		if(operands.size() != operators.size() + 1)
		{
			throw new IllegalArgumentException("A comparison chain needs one more operand than operators");
		}
		this.operands = List.copyOf(operands);
		this.operators = List.copyOf(operators);
	}

	public List<Expression> getOperands()
	{
		return operands;
	}

	public List<BinaryOperator> getOperators()
	{
		return operators;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitComparisonChain(this);
	}

	@Override
	public Token getFirstToken()
	{
		return operands.get(0).getFirstToken();
	}
}
