package org.lokray.plain.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Formats compile errors for people: the position, the offending source line, a caret under the column, and the hint.
 */
public class ErrorReporter
{
	private static final Logger logger = LoggerFactory.getLogger(ErrorReporter.class);

	private boolean hasErrors = false; // Flag to indicate if any errors have been reported

	/**
	 * Reports a compile error.
	 *
	 * @param error  The error.
	 * @param source The source text the error refers to, or null if unavailable.
	 * @return The formatted diagnostic.
	 */
	public String report(CompileError error, String source)
	{
		String diagnostic = format(error, source);
		logger.debug("Reported {} at {}:{}", error.getKind(), error.getLine(), error.getColumn());
		hasErrors = true;
		return diagnostic;
	}

	/**
	 * Renders a diagnostic without recording it.
	 */
	public static String format(CompileError error, String source)
	{
		StringBuilder sb = new StringBuilder();
		sb.append('[').append(error.getKind()).append("] Line ").append(error.getLine())
				.append(", Column ").append(error.getColumn()).append(": ").append(error.getDetail());
		String line = sourceLine(source, error.getLine());
		if(line != null)
		{
			sb.append('\n').append("    ").append(line);
			sb.append('\n').append("    ").append(" ".repeat(Math.max(0, Math.min(error.getColumn() - 1, line.length())))).append('^');
		}
		if(error.getHint() != null)
		{
			sb.append('\n').append("Hint: ").append(error.getHint());
		}
		return sb.toString();
	}

	private static String sourceLine(String source, int line)
	{
		if(source == null || line < 1)
		{
			return null;
		}
		String[] lines = source.split("\r?\n", -1);
		if(line > lines.length)
		{
			return null;
		}
		return lines[line - 1].replace('\t', ' ');
	}

	/**
	 * Checks if any errors have been reported.
	 *
	 * @return True if errors exist, false otherwise.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}

	/**
	 * Resets the error flag.
	 */
	public void reset()
	{
		hasErrors = false;
	}
}
