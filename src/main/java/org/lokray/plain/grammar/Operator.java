package org.lokray.plain.grammar;

/**
 * Meanings of operator phrases, each bound to the precedence level at which it is parsed.
 */
public enum Operator
{
	OR(Level.OR),
	AND(Level.AND),

	EQUAL(Level.COMPARISON),
	NOT_EQUAL(Level.COMPARISON),
	LESS(Level.COMPARISON),
	LESS_EQUAL(Level.COMPARISON),
	GREATER(Level.COMPARISON),
	GREATER_EQUAL(Level.COMPARISON),
	IN(Level.COMPARISON),
	NOT_IN(Level.COMPARISON),
	CONTAINS(Level.COMPARISON),
	NOT_CONTAINS(Level.COMPARISON),
	STARTS_WITH(Level.COMPARISON),
	ENDS_WITH(Level.COMPARISON),
	BETWEEN(Level.COMPARISON),
	IS_INSTANCE(Level.COMPARISON),
	LONGER(Level.COMPARISON),
	SHORTER(Level.COMPARISON),
	SAME_LENGTH(Level.COMPARISON),
	IS_EMPTY(Level.COMPARISON, true),
	IS_NOT_EMPTY(Level.COMPARISON, true),

	ADD(Level.ADDITIVE),
	SUBTRACT(Level.ADDITIVE),

	MULTIPLY(Level.MULTIPLICATIVE),
	DIVIDE(Level.MULTIPLICATIVE),
	MODULO(Level.MULTIPLICATIVE),

	POWER(Level.POWER);

	public enum Level
	{
		OR,
		AND,
		COMPARISON,
		ADDITIVE,
		MULTIPLICATIVE,
		POWER
	}

	private final Level level;
	private final boolean postfix; // takes no right operand, e.g. "is empty"

	Operator(Level level)
	{
		this(level, false);
	}

	Operator(Level level, boolean postfix)
	{
		this.level = level;
		this.postfix = postfix;
	}

	public Level getLevel()
	{
		return level;
	}

	public boolean isPostfix()
	{
		return postfix;
	}
}
