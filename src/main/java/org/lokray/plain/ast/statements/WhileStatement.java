package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

public class WhileStatement implements Statement
{
	private final Token whileKeyword;
	private final Expression condition;
	private final BlockStatement body;

	public WhileStatement(Token whileKeyword, Expression condition, BlockStatement body)
	{
		this.whileKeyword = whileKeyword;
		this.condition = condition;
		this.body = body;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhileStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return whileKeyword;
	}
}
