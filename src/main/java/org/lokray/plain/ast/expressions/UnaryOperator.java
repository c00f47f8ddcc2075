package org.lokray.plain.ast.expressions;

public enum UnaryOperator
{
	NOT("not "),
	NEGATE("-");

	private final String symbol;

	UnaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}
}
