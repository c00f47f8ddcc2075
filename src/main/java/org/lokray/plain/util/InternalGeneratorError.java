package org.lokray.plain.util;

/**
 * Signals a defect in the compiler itself: the code generator met a node that semantic analysis
 * should have desugared or rejected. Deliberately not a {@link CompileError}.
 */
public class InternalGeneratorError extends IllegalStateException
{
	public InternalGeneratorError(String message)
	{
		super(message);
	}
}
