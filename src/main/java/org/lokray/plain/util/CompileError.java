package org.lokray.plain.util;

/**
 * Base class of every error a user can cause by submitting Plain source.
 * Each error carries the source position it refers to and an optional, advisory hint.
 * Errors propagate unchanged from the stage that raised them to the caller of the compiler.
 */
public abstract class CompileError extends RuntimeException
{
	private final int line;
	private final int column;
	private final String detail;
	private final String hint;

	protected CompileError(int line, int column, String detail, String hint)
	{
		super(line + ":" + column + ": " + detail + (hint != null ? " (" + hint + ")" : ""));
		this.line = line;
		this.column = column;
		this.detail = detail;
		this.hint = hint;
	}

	/**
	 * @return Short name of the error family, e.g. "SyntaxError".
	 */
	public String getKind()
	{
		return getClass().getSimpleName();
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * @return The error message without position or hint.
	 */
	public String getDetail()
	{
		return detail;
	}

	/**
	 * @return A suggestion such as a nearby rule or name, or null when none was found.
	 */
	public String getHint()
	{
		return hint;
	}
}
