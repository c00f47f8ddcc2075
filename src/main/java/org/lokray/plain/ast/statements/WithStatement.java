package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * AST node for {@code with resource as alias:}.
 */
public class WithStatement implements Statement
{
	private final Token firstToken;
	private final Expression resource;
	private final Token alias; // optional
	private final BlockStatement body;

	public WithStatement(Token firstToken, Expression resource, Token alias, BlockStatement body)
	{
		this.firstToken = firstToken;
		this.resource = resource;
		this.alias = alias;
		this.body = body;
	}

	public Expression getResource()
	{
		return resource;
	}

	public Token getAlias()
	{
		return alias;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWithStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}
}
