package org.lokray.plain.semantics;

/**
 * What a name is bound to.
 */
public enum SymbolKind
{
	VARIABLE,
	FUNCTION,
	CLASS,
	MODULE_ALIAS
}
