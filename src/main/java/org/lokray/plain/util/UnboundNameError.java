package org.lokray.plain.util;

/**
 * Raised when an identifier is neither bound in any visible scope nor known to the import table.
 */
public class UnboundNameError extends CompileError
{
	private final String name;

	public UnboundNameError(int line, int column, String name, String hint)
	{
		super(line, column, "'" + name + "' is not defined", hint);
		this.name = name;
	}

	public String getName()
	{
		return name;
	}
}
