package org.lokray.plain.util;

import java.util.Collections;
import java.util.List;

/**
 * Raised when no grammar rule matches a statement, or when a block or clause is malformed.
 * Carries the words of the line that could not be matched.
 */
public class SyntaxError extends CompileError
{
	private final List<String> window;

	public SyntaxError(int line, int column, String detail, List<String> window, String hint)
	{
		super(line, column, detail, hint);
		this.window = window == null ? Collections.emptyList() : List.copyOf(window);
	}

	public SyntaxError(int line, int column, String detail)
	{
		this(line, column, detail, null, null);
	}

	/**
	 * @return Lexemes of the unmatched token window, in source order.
	 */
	public List<String> getWindow()
	{
		return window;
	}
}
