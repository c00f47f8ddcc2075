package org.lokray.plain.session;

import org.lokray.plain.CompilationResult;
import org.lokray.plain.util.CompileError;

/**
 * One unit of Plain source submitted for compilation, with the stage it has reached.
 */
public class Fragment
{
	private final String text;
	private FragmentState state = FragmentState.RECEIVED;
	private CompileError error;
	private CompilationResult result;

	public Fragment(String text)
	{
		this.text = text;
	}

	/**
	 * Moves the fragment to its next stage.
	 *
	 * @throws IllegalStateException if {@code next} does not directly follow the current stage.
	 */
	public void advance(FragmentState next)
	{
		if(next == FragmentState.REJECTED || !state.canAdvanceTo(next))
		{
			throw new IllegalStateException("Fragment cannot move from " + state + " to " + next);
		}
		state = next;
	}

	/**
	 * Marks the fragment rejected because of {@code cause}.
	 */
	public void reject(CompileError cause)
	{
		if(!state.canAdvanceTo(FragmentState.REJECTED))
		{
			throw new IllegalStateException("Fragment cannot be rejected once " + state);
		}
		state = FragmentState.REJECTED;
		error = cause;
	}

	void attach(CompilationResult result)
	{
		this.result = result;
	}

	public String getText()
	{
		return text;
	}

	public FragmentState getState()
	{
		return state;
	}

	public CompileError getError()
	{
		return error;
	}

	public CompilationResult getResult()
	{
		return result;
	}
}
