package org.lokray.plain.ast.expressions;

/**
 * Python binary operators that English operator phrases are parsed into.
 */
public enum BinaryOperator
{
	OR("or"),
	AND("and"),
	EQUAL("=="),
	NOT_EQUAL("!="),
	LESS("<"),
	LESS_EQUAL("<="),
	GREATER(">"),
	GREATER_EQUAL(">="),
	IN("in"),
	NOT_IN("not in"),
	ADD("+"),
	SUBTRACT("-"),
	MULTIPLY("*"),
	DIVIDE("/"),
	MODULO("%"),
	POWER("**");

	private final String symbol;

	BinaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	public boolean isComparison()
	{
		return ordinal() >= EQUAL.ordinal() && ordinal() <= NOT_IN.ordinal();
	}
}
