package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

import java.util.List;

/**
 * AST node for try / except / finally.
 */
public class TryStatement implements Statement
{
	private final Token tryKeyword;
	private final BlockStatement body;
	private final List<ExceptClause> handlers;
	private final BlockStatement finallyBlock; // optional

	public TryStatement(Token tryKeyword, BlockStatement body, List<ExceptClause> handlers, BlockStatement finallyBlock)
	{
		this.tryKeyword = tryKeyword;
		this.body = body;
		this.handlers = List.copyOf(handlers);
		this.finallyBlock = finallyBlock;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	public List<ExceptClause> getHandlers()
	{
		return handlers;
	}

	public BlockStatement getFinallyBlock()
	{
		return finallyBlock;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTryStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return tryKeyword;
	}
}
