package org.lokray.plain.runtime;

import org.lokray.plain.codegen.LineMap;

/**
 * Runs generated Python. Implementations used by a REPL keep their globals between calls,
 * so that later fragments see the names earlier fragments bound.
 */
public interface ExecutionCollaborator extends AutoCloseable
{
	/**
	 * Executes Python source.
	 *
	 * @param pythonSource The generated code.
	 * @param lineMap      Used to point tracebacks at Plain source lines.
	 * @return The exit status and captured output.
	 * @throws ExecutionException if the interpreter cannot be reached.
	 */
	ExecutionResult execute(String pythonSource, LineMap lineMap);

	/**
	 * Discards all state kept between calls.
	 */
	default void reset()
	{
	}

	@Override
	default void close()
	{
	}
}
