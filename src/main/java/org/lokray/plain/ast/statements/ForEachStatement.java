package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * AST node for {@code for variable in iterable:}.
 */
public class ForEachStatement implements Statement
{
	private final Token forKeyword;
	private final Token variable;
	private final Expression iterable;
	private final BlockStatement body;

	public ForEachStatement(Token forKeyword, Token variable, Expression iterable, BlockStatement body)
	{
		this.forKeyword = forKeyword;
		this.variable = variable;
		this.iterable = iterable;
		this.body = body;
	}

	public Token getVariable()
	{
		return variable;
	}

	public Expression getIterable()
	{
		return iterable;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForEachStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return forKeyword;
	}
}
