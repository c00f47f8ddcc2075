package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

public class ContinueStatement implements Statement
{
	private final Token keyword;

	public ContinueStatement(Token keyword)
	{
		this.keyword = keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitContinueStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}
}
