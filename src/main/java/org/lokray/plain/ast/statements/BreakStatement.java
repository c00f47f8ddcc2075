package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

public class BreakStatement implements Statement
{
	private final Token keyword;

	public BreakStatement(Token keyword)
	{
		this.keyword = keyword;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBreakStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}
}
