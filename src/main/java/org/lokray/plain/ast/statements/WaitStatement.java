package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * Plain-shaped wait. With a time unit it pauses ("wait 2 seconds"); in the "wait for" form
 * without a unit it awaits the value ("wait for fetch with url").
 */
public class WaitStatement implements Statement
{
	private final Token waitKeyword;
	private final Expression value;
	private final String unit;       // "seconds", "milliseconds", "minutes", "hours" or null
	private final boolean awaitForm; // written as "wait for" / "await"

	public WaitStatement(Token waitKeyword, Expression value, String unit, boolean awaitForm)
	{
		this.waitKeyword = waitKeyword;
		this.value = value;
		this.unit = unit;
		this.awaitForm = awaitForm;
	}

	public Expression getValue()
	{
		return value;
	}

	public String getUnit()
	{
		return unit;
	}

	public boolean isAwaitForm()
	{
		return awaitForm;
	}

	/**
	 * @return True when the statement pauses for a duration rather than awaiting a value.
	 */
	public boolean isPause()
	{
		return unit != null || !awaitForm;
	}

	@Override
	public boolean isPlainShaped()
	{
		return true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWaitStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return waitKeyword;
	}
}
