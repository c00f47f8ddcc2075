package org.lokray.plain.semantics;

public enum ScopeKind
{
	BUILTIN,
	GLOBAL,
	FUNCTION,
	CLASS,
	COMPREHENSION
}
