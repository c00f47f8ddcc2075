package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * Plain-shaped "print numbers from A to B", inclusive of both ends.
 */
public class PrintRangeStatement implements Statement
{
	private final Token printKeyword;
	private final Expression from;
	private final Expression to;

	public PrintRangeStatement(Token printKeyword, Expression from, Expression to)
	{
		this.printKeyword = printKeyword;
		this.from = from;
		this.to = to;
	}

	public Expression getFrom()
	{
		return from;
	}

	public Expression getTo()
	{
		return to;
	}

	@Override
	public boolean isPlainShaped()
	{
		return true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPrintRangeStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return printKeyword;
	}
}
