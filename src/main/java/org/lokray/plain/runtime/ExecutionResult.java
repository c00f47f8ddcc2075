package org.lokray.plain.runtime;

/**
 * What running a piece of generated Python produced.
 */
public final class ExecutionResult
{
	private final int exitStatus;
	private final String stdout;
	private final String stderr;
	private final boolean stateLost;

	public ExecutionResult(int exitStatus, String stdout, String stderr)
	{
		this(exitStatus, stdout, stderr, false);
	}

	/**
	 * @param stateLost True when the interpreter had to be started again, so names bound by earlier calls are gone.
	 */
	public ExecutionResult(int exitStatus, String stdout, String stderr, boolean stateLost)
	{
		this.exitStatus = exitStatus;
		this.stdout = stdout;
		this.stderr = stderr;
		this.stateLost = stateLost;
	}

	public int getExitStatus()
	{
		return exitStatus;
	}

	public String getStdout()
	{
		return stdout;
	}

	/**
	 * @return The error output, with traceback lines pointing at Plain source lines.
	 */
	public String getStderr()
	{
		return stderr;
	}

	public boolean isStateLost()
	{
		return stateLost;
	}

	public boolean isSuccess()
	{
		return exitStatus == 0;
	}

	@Override
	public String toString()
	{
		return "ExecutionResult{exitStatus=" + exitStatus + ", stdout='" + stdout + "', stderr='" + stderr + "'}";
	}
}
