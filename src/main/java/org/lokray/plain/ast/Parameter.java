package org.lokray.plain.ast;

import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * A function, method or lambda parameter with an optional type hint and default value.
 */
public class Parameter
{
	private final Token name;
	private final TypeHint typeHint;
	private final Expression defaultValue;

	public Parameter(Token name, TypeHint typeHint, Expression defaultValue)
	{
		this.name = name;
		this.typeHint = typeHint;
		this.defaultValue = defaultValue;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public TypeHint getTypeHint()
	{
		return typeHint;
	}

	public Expression getDefaultValue()
	{
		return defaultValue;
	}
}
