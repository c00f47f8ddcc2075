package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

import java.util.List;

/**
 * AST node for an explicit import. Either {@code import module [as alias]}
 * or {@code from module import name, ...}.
 */
public class ImportStatement implements Statement
{
	private final Token firstToken;
	private final String module;
	private final String alias;       // optional, only for plain imports
	private final List<String> names; // empty for plain imports

	public ImportStatement(Token firstToken, String module, String alias, List<String> names)
	{
		this.firstToken = firstToken;
		this.module = module;
		this.alias = alias;
		this.names = List.copyOf(names);
	}

	public String getModule()
	{
		return module;
	}

	public String getAlias()
	{
		return alias;
	}

	public List<String> getNames()
	{
		return names;
	}

	public boolean isFromImport()
	{
		return !names.isEmpty();
	}

	/**
	 * @return The names this import binds in the importing scope.
	 */
	public List<String> boundNames()
	{
		if(isFromImport())
		{
			return names;
		}
		if(alias != null)
		{
			return List.of(alias);
		}
		int dot = module.indexOf('.');
		return List.of(dot < 0 ? module : module.substring(0, dot));
	}

	/**
	 * @return The Python source line of this import.
	 */
	public String toPython()
	{
		if(isFromImport())
		{
			return "from " + module + " import " + String.join(", ", names);
		}
		return "import " + module + (alias != null ? " as " + alias : "");
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitImportStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}

	@Override
	public String toString()
	{
		return toPython();
	}
}
