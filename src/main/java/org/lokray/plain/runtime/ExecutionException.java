package org.lokray.plain.runtime;

/**
 * Thrown when generated code cannot be handed to the interpreter at all.
 * Failures of the code itself are reported through {@link ExecutionResult} instead.
 */
public class ExecutionException extends RuntimeException
{
	public ExecutionException(String message, Throwable cause)
	{
		super(message, cause);
	}

	public ExecutionException(String message)
	{
		super(message);
	}
}
