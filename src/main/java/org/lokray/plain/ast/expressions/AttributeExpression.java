package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

/**
 * AST node for member access, {@code object.name}.
 */
public class AttributeExpression implements Expression
{
	private final Expression object;
	private final String name;

	public AttributeExpression(Expression object, String name)
	{
		this.object = object;
		this.name = name;
	}

	public Expression getObject()
	{
		return object;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAttributeExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return object.getFirstToken();
	}

	@Override
	public String toString()
	{
		return object + "." + name;
	}
}
