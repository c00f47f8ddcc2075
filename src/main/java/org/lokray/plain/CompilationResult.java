package org.lokray.plain;

import org.lokray.plain.codegen.LineMap;

import java.util.List;

/**
 * The outcome of compiling a program or fragment: the Python source, its line map,
 * and the import lines this unit newly required.
 */
public final class CompilationResult
{
	private final String pythonSource;
	private final LineMap lineMap;
	private final List<String> newImports;

	public CompilationResult(String pythonSource, LineMap lineMap, List<String> newImports)
	{
		this.pythonSource = pythonSource;
		this.lineMap = lineMap;
		this.newImports = List.copyOf(newImports);
	}

	public String getPythonSource()
	{
		return pythonSource;
	}

	public LineMap getLineMap()
	{
		return lineMap;
	}

	public List<String> getNewImports()
	{
		return newImports;
	}

	@Override
	public String toString()
	{
		return pythonSource;
	}
}
