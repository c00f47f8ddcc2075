package org.lokray.plain.ast.statements;

/**
 * How a function is bound: free function, instance method, static or class method, or constructor, or property getter.
 */
public enum FunctionKind
{
	FUNCTION,
	METHOD,
	STATIC_METHOD,
	CLASS_METHOD,
	PROPERTY,
	CONSTRUCTOR;

	public boolean isMember()
	{
		return this != FUNCTION;
	}
}
