package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

import java.util.List;

/**
 * A dictionary display; keys and values are parallel lists.
 */
public class DictExpression implements Expression
{
	private final Token firstToken;
	private final List<Expression> keys;
	private final List<Expression> values;

	public DictExpression(Token firstToken, List<Expression> keys, List<Expression> values)
	{
		this.firstToken = firstToken;
		this.keys = List.copyOf(keys);
		this.values = List.copyOf(values);
	}

	public List<Expression> getKeys()
	{
		return keys;
	}

	public List<Expression> getValues()
	{
		return values;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDictExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}
}
