package org.lokray.plain.util;

/**
 * Raised by the lexer for unterminated strings, unexpected characters and broken indentation.
 */
public class LexError extends CompileError
{
	public LexError(int line, int column, String detail)
	{
		super(line, column, detail, null);
	}
}
