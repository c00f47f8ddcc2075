package org.lokray.plain.semantics;

import org.lokray.plain.lexer.Token;

/**
 * A name bound by an import, e.g. {@code pd} for {@code import pandas as pd}.
 */
public class ModuleAliasSymbol extends Symbol
{
	private final String importLine;

	public ModuleAliasSymbol(String name, Token declarationToken, String importLine)
	{
		super(name, declarationToken, null);
		this.importLine = importLine;
	}

	/**
	 * @return The Python import statement that binds this name.
	 */
	public String getImportLine()
	{
		return importLine;
	}

	@Override
	public SymbolKind getKind()
	{
		return SymbolKind.MODULE_ALIAS;
	}
}
