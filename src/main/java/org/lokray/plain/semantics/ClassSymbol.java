package org.lokray.plain.semantics;

import org.lokray.plain.lexer.Token;

/**
 * Represents a class, either declared in the program or a Python builtin type.
 * Class names may be used as type hints.
 */
public class ClassSymbol extends Symbol
{
	private final boolean builtin;

	public ClassSymbol(String name, Token declarationToken)
	{
		this(name, declarationToken, false);
	}

	private ClassSymbol(String name, Token declarationToken, boolean builtin)
	{
		super(name, declarationToken, null);
		this.builtin = builtin;
	}

	public static ClassSymbol builtin(String name)
	{
		return new ClassSymbol(name, null, true);
	}

	public boolean isBuiltin()
	{
		return builtin;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.CLASS;
	}
}
