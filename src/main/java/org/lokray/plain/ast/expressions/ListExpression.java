package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

import java.util.List;

public class ListExpression implements Expression
{
	private final Token firstToken;
	private final List<Expression> elements;

	public ListExpression(Token firstToken, List<Expression> elements)
	{
		this.firstToken = firstToken;
		this.elements = List.copyOf(elements);
	}

	public List<Expression> getElements()
	{
		return elements;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitListExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}
}
