package org.lokray.plain.semantics;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Represents a scope: a table mapping names to their {@link Symbol}s.
 * Scopes form a chain (builtin, global, then function, class or comprehension scopes).
 * Lookup walks outward, except that a function scope does not see the names of an enclosing class body.
 */
public class Scope
{
	private final Map<String, Symbol> symbols;
	private final Scope enclosingScope;
	private final String scopeName; // for debugging, e.g. "global", "function:greet"
	private final ScopeKind kind;

	public Scope(Scope enclosingScope, String scopeName, ScopeKind kind)
	{
		this(enclosingScope, scopeName, kind, new LinkedHashMap<>());
	}

	private Scope(Scope enclosingScope, String scopeName, ScopeKind kind, Map<String, Symbol> symbols)
	{
		this.enclosingScope = enclosingScope;
		this.scopeName = scopeName;
		this.kind = kind;
		this.symbols = symbols;
	}

	/**
	 * Defines a symbol in this scope. A later binding of the same name replaces the earlier one.
	 *
	 * @param symbol The symbol to define.
	 */
	public void define(Symbol symbol)
	{
		symbols.put(symbol.getName(), symbol);
	}

	/**
	 * Looks up a symbol, starting from this scope and moving up to enclosing scopes.
	 *
	 * @param name The name of the symbol to look up.
	 * @return The found Symbol, or null if not found in any enclosing scope.
	 */
	public Symbol resolve(String name)
	{
		Symbol symbol = symbols.get(name);
		if(symbol != null)
		{
			return symbol;
		}
		Scope outer = enclosingScope;
		if(kind == ScopeKind.FUNCTION || kind == ScopeKind.COMPREHENSION)
		{
			while(outer != null && outer.kind == ScopeKind.CLASS)
			{
				outer = outer.enclosingScope;
			}
		}
		return outer != null ? outer.resolve(name) : null;
	}

	/**
	 * Looks up a symbol only in this scope.
	 */
	public Symbol resolveLocally(String name)
	{
		return symbols.get(name);
	}

	/**
	 * @return Every name visible from this scope, innermost first. Used for "did you mean" hints.
	 */
	public List<String> visibleNames()
	{
		List<String> names = new ArrayList<>();
		for(Scope scope = this; scope != null; scope = scope.enclosingScope)
		{
			names.addAll(scope.symbols.keySet());
		}
		return names;
	}

	/**
	 * Copies this scope's own table for a checkpoint. The enclosing chain is shared.
	 */
	public Scope copy()
	{
		return new Scope(enclosingScope, scopeName, kind, new LinkedHashMap<>(symbols));
	}

	public Scope getEnclosingScope()
	{
		return enclosingScope;
	}

	public String getScopeName()
	{
		return scopeName;
	}

	public ScopeKind getKind()
	{
		return kind;
	}

	public Collection<Symbol> getSymbols()
	{
		return symbols.values();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Scope '").append(scopeName).append("':\n");
		for(Symbol symbol : symbols.values())
		{
			sb.append("  ").append(symbol).append("\n");
		}
		return sb.toString();
	}
}
