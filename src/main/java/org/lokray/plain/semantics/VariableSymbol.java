package org.lokray.plain.semantics;

import org.lokray.plain.ast.TypeHint;
import org.lokray.plain.lexer.Token;

/**
 * A variable, parameter, loop variable or exception alias.
 */
public class VariableSymbol extends Symbol
{
	private final boolean generated;

	public VariableSymbol(String name, Token declarationToken, TypeHint typeHint)
	{
		this(name, declarationToken, typeHint, false);
	}

	private VariableSymbol(String name, Token declarationToken, TypeHint typeHint, boolean generated)
	{
		super(name, declarationToken, typeHint);
		this.generated = generated;
	}

	/**
	 * A variable the compiler binds itself, such as the Flask application behind api endpoints.
	 */
	public static VariableSymbol generated(String name, Token declarationToken)
	{
		return new VariableSymbol(name, declarationToken, null, true);
	}

	public boolean isGenerated()
	{
		return generated;
	}

	public VariableSymbol(String name, Token declarationToken)
	{
		this(name, declarationToken, null);
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.VARIABLE;
	}
}
