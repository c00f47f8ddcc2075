package org.lokray.plain.ast;

import org.lokray.plain.lexer.Token;

import java.util.List;

/**
 * A type hint as written in Plain, e.g. "integer", "list of text" or "dictionary from text to number".
 * The semantic analyzer validates it and records its Python rendering.
 */
public class TypeHint
{
	private final Token nameToken; // first word of the hint
	private final String name;     // normalized head word: "integer", "list", "optional", or a class name
	private final List<TypeHint> arguments;
	private String pythonForm;      // set by the semantic analyzer

	public TypeHint(Token nameToken, String name, List<TypeHint> arguments)
	{
		this.nameToken = nameToken;
		this.name = name;
		this.arguments = List.copyOf(arguments);
	}

	public Token getNameToken()
	{
		return nameToken;
	}

	public String getName()
	{
		return name;
	}

	public List<TypeHint> getArguments()
	{
		return arguments;
	}

	public String getPythonForm()
	{
		return pythonForm;
	}

	public void setPythonForm(String pythonForm)
	{
		this.pythonForm = pythonForm;
	}

	public boolean isResolved()
	{
		return pythonForm != null;
	}

	@Override
	public String toString()
	{
		return arguments.isEmpty() ? name : name + arguments;
	}
}
