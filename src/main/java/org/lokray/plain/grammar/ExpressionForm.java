package org.lokray.plain.grammar;

/**
 * English phrases that introduce an expression, such as "the length of" or "a new".
 */
public enum ExpressionForm
{
	LENGTH,
	SUM,
	AVERAGE,
	MAXIMUM,
	MINIMUM,
	SQUARE_ROOT,
	ABSOLUTE_VALUE,
	ROUNDED,
	UPPERCASE,
	LOWERCASE,
	TRIMMED,
	RANDOM_NUMBER,
	RANDOM_CHOICE,
	CURRENT_TIME,
	ASK,
	NEW_INSTANCE,
	CALL,
	COMPREHENSION,
	LAMBDA,
	OPEN_FILE,
	READ_FILE,
	AWAIT
}
