package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * Plain-shaped resource scope: "using R as N do ...". Becomes a with-block.
 */
public class UsingStatement implements Statement
{
	private final Token usingKeyword;
	private final Expression resource;
	private final Token alias; // optional
	private final BlockStatement body;

	public UsingStatement(Token usingKeyword, Expression resource, Token alias, BlockStatement body)
	{
		this.usingKeyword = usingKeyword;
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
	public boolean isPlainShaped()
	{
		return true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUsingStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return usingKeyword;
	}
}
