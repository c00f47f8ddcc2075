package org.lokray.plain.codegen;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalInt;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps lines of generated Python back to the lines of the Plain source they came from.
 * Generated lines are 1-based, as in Python tracebacks.
 */
public class LineMap
{
	/**
	 * The file name generated code is executed under.
	 */
	public static final String SOURCE_NAME = "<plain>";

	private static final Pattern TRACEBACK_LINE = Pattern.compile("File \"" + Pattern.quote(SOURCE_NAME) + "\", line (\\d+)");

	private final TreeMap<Integer, Integer> lines = new TreeMap<>();

	void record(int generatedLine, int originalLine)
	{
		lines.put(generatedLine, originalLine);
	}

	/**
	 * @return The original line of a generated line. A line without its own entry belongs to the statement above it.
	 */
	public OptionalInt originalLine(int generatedLine)
	{
		Map.Entry<Integer, Integer> entry = lines.floorEntry(generatedLine);
		return entry == null ? OptionalInt.empty() : OptionalInt.of(entry.getValue());
	}

	/**
	 * Rewrites {@code File "<plain>", line N} references in a traceback to original source lines.
	 */
	public String translate(String traceback)
	{
		Matcher matcher = TRACEBACK_LINE.matcher(traceback);
		StringBuilder sb = new StringBuilder();
		while(matcher.find())
		{
			int generated = Integer.parseInt(matcher.group(1));
			OptionalInt original = originalLine(generated);
			String replacement = "File \"" + SOURCE_NAME + "\", line " + (original.isPresent() ? original.getAsInt() : generated);
			matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
		}
		matcher.appendTail(sb);
		return sb.toString();
	}

	public Map<Integer, Integer> asMap()
	{
		return Collections.unmodifiableMap(lines);
	}

	public boolean isEmpty()
	{
		return lines.isEmpty();
	}

	@Override
	public String toString()
	{
		return "LineMap" + lines;
	}
}
