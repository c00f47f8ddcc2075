package org.lokray.plain.semantics;

import org.lokray.plain.ast.TypeHint;
import org.lokray.plain.ast.statements.FunctionKind;
import org.lokray.plain.lexer.Token;

/**
 * Represents a function or method in a scope.
 */
public class FunctionSymbol extends Symbol
{
	private final FunctionKind functionKind;
	private final boolean async;

	public FunctionSymbol(String name, Token declarationToken, TypeHint returnHint, FunctionKind functionKind, boolean async)
	{
		super(name, declarationToken, returnHint);
		this.functionKind = functionKind;
		this.async = async;
	}

	/**
	 * Creates the symbol of a Python builtin function.
	 */
	public static FunctionSymbol builtin(String name)
	{
		return new FunctionSymbol(name, null, null, FunctionKind.FUNCTION, false);
	}

	public FunctionKind getFunctionKind()
	{
		return functionKind;
	}

	public boolean isAsync()
	{
		return async;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.FUNCTION;
	}
}
