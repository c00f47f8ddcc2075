package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * AST node representing a conditional. An "otherwise if" clause is an IfStatement flagged as
 * {@code elseIf}, placed alone in the else branch of the preceding one.
 */
public class IfStatement implements Statement
{
	private final Token ifKeyword;
	private final Expression condition;
	private final BlockStatement thenBranch;
	private final BlockStatement elseBranch; // optional
	private final boolean elseIf;

	public IfStatement(Token ifKeyword, Expression condition, BlockStatement thenBranch, BlockStatement elseBranch, boolean elseIf)
	{
		this.ifKeyword = ifKeyword;
		this.condition = condition;
		this.thenBranch = thenBranch;
		this.elseBranch = elseBranch;
		this.elseIf = elseIf;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public BlockStatement getThenBranch()
	{
		return thenBranch;
	}

	public BlockStatement getElseBranch()
	{
		return elseBranch;
	}

	public boolean isElseIf()
	{
		return elseIf;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return ifKeyword;
	}

	@Override
	public String toString()
	{
		return "If(" + condition + ") " + thenBranch + (elseBranch != null ? " Else " + elseBranch : "");
	}
}
