package org.lokray.plain.grammar;

/**
 * Statement families recognized at the start of a Plain statement.
 */
public enum Production
{
	LET,
	SET,
	ASSIGN,
	CREATE_VARIABLE,
	CREATE_LIST,
	CREATE_DICTIONARY,
	INCREASE,
	DECREASE,
	MULTIPLY,
	DIVIDE,
	APPEND,
	PREPEND,
	REMOVE,
	POP,
	SORT,
	REVERSE,
	CLEAR,
	SAY,
	PRINT_NUMBERS,
	LOG,
	IF,
	ELSE_IF,
	ELSE,
	WHILE,
	FOR_EACH,
	REPEAT_TIMES,
	REPEAT_UNTIL,
	REPEAT_WHILE,
	REPEAT_FOREVER,
	BREAK,
	CONTINUE,
	PASS,
	RETURN,
	YIELD,
	EXIT,
	DEFINE_FUNCTION,
	DEFINE_ASYNC_FUNCTION,
	DEFINE_GENERATOR,
	DEFINE_METHOD,
	DEFINE_ASYNC_METHOD,
	DEFINE_STATIC_METHOD,
	DEFINE_CLASS_METHOD,
	DEFINE_CONSTRUCTOR,
	DEFINE_PROPERTY,
	DEFINE_CLASS,
	API_ENDPOINT,
	ASYNC_API_ENDPOINT,
	TRY,
	CATCH,
	FINALLY,
	RAISE,
	FAIL,
	USING,
	WAIT_FOR,
	WAIT,
	IMPORT,
	USE,
	FROM_IMPORT,
	CALL,
	CALL_WITH,
	EXPRESSION,
	DECORATE
}
