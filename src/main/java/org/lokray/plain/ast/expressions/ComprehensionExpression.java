package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

/**
 * "the list of E for each x in Y where C", rendered as a list comprehension.
 */
public class ComprehensionExpression implements Expression
{
	private final Token firstToken;
	private final Expression element;
	private final Token variable;
	private final Expression iterable;
	private final Expression condition; // optional

	public ComprehensionExpression(Token firstToken, Expression element, Token variable, Expression iterable, Expression condition)
	{
		this.firstToken = firstToken;
		this.element = element;
		this.variable = variable;
		this.iterable = iterable;
		this.condition = condition;
	}

	public Expression getElement()
	{
		return element;
	}

	public Token getVariable()
	{
		return variable;
	}

	public Expression getIterable()
	{
		return iterable;
	}

	public Expression getCondition()
	{
		return condition;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitComprehensionExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}
}
