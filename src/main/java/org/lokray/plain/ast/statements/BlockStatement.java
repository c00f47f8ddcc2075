package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An indented sequence of statements. The semantic analyzer may replace statements in place
 * while desugaring, and may insert synthesized ones.
 */
public class BlockStatement implements Statement
{
	private final Token firstToken;
	private final List<Statement> statements;

	public BlockStatement(Token firstToken, List<Statement> statements)
	{
		this.firstToken = firstToken;
		this.statements = new ArrayList<>(statements);
	}

	public List<Statement> getStatements()
	{
		return Collections.unmodifiableList(statements);
	}

	public void replace(int index, Statement replacement)
	{
		statements.set(index, replacement);
	}

	public void insert(int index, Statement statement)
	{
		statements.add(index, statement);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBlockStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}

	@Override
	public String toString()
	{
		return "Block" + statements;
	}
}
