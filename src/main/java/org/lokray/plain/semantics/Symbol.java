package org.lokray.plain.semantics;

import org.lokray.plain.ast.TypeHint;
import org.lokray.plain.lexer.Token;

/**
 * Abstract base class for all symbols in a scope.
 * A symbol represents a name bound in the program: a variable, function, class or imported module alias.
 */
public abstract class Symbol
{
	private final String name;
	private final Token declarationToken; // null for builtins and auto-imported names
	private final TypeHint typeHint;      // optional declared type

	/**
	 * Constructor for a Symbol.
	 *
	 * @param name             The name of the symbol.
	 * @param declarationToken The token where this symbol was first bound, or null.
	 * @param typeHint         The declared type hint, or null.
	 */
	protected Symbol(String name, Token declarationToken, TypeHint typeHint)
	{
		this.name = name;
		this.declarationToken = declarationToken;
		this.typeHint = typeHint;
	}

	public String getName()
	{
		return name;
	}

	public Token getDeclarationToken()
	{
		return declarationToken;
	}

	public TypeHint getTypeHint()
	{
		return typeHint;
	}

	public abstract SymbolKind getKind();

	@Override
	public String toString()
	{
		return "Symbol{" + "name='" + name + '\'' + ", kind=" + getKind()
				+ (declarationToken != null ? ", line=" + declarationToken.getLine() : "") + '}';
	}
}
