package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * AST node for a 'raise' statement with an optional exception.
 */
public class RaiseStatement implements Statement
{
	private final Token keyword;
	private final Expression exception; // optional

	public RaiseStatement(Token keyword, Expression exception)
	{
		this.keyword = keyword;
		this.exception = exception;
	}

	public Expression getException()
	{
		return exception;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRaiseStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return keyword;
	}
}
