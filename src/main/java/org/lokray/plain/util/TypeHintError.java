package org.lokray.plain.util;

public class TypeHintError extends CompileError
{
	public TypeHintError(int line, int column, String detail, String hint)
	{
		super(line, column, detail, hint);
	}
}
