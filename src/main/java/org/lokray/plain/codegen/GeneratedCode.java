package org.lokray.plain.codegen;

/**
 * The output of the generator: Python source text and its line map.
 */
public final class GeneratedCode
{
	private final String source;
	private final LineMap lineMap;

	public GeneratedCode(String source, LineMap lineMap)
	{
		this.source = source;
		this.lineMap = lineMap;
	}

	public String getSource()
	{
		return source;
	}

	public LineMap getLineMap()
	{
		return lineMap;
	}
}
