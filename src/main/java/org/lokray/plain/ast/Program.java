package org.lokray.plain.ast;

import org.lokray.plain.ast.statements.BlockStatement;
import org.lokray.plain.lexer.Token;

/**
 * The root AST node representing a whole Plain program or one REPL fragment.
 */
public class Program implements ASTNode
{
	private final Token firstToken;
	private final BlockStatement body;

	public Program(Token firstToken, BlockStatement body)
	{
		this.firstToken = firstToken;
		this.body = body;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public String toString()
	{
		return "Program " + body;
	}
}
