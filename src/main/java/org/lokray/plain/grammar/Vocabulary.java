package org.lokray.plain.grammar;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Word classes of the Plain language: which words are connectors, which spell numbers,
 * and which may be used as names.
 */
public final class Vocabulary
{
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

	/**
	 * Words that glue phrases together and can never name a variable.
	 */
	private static final Set<String> CONNECTORS = Set.of(
			"and", "or", "not", "is", "then", "do", "otherwise", "else", "be", "to", "by", "with", "as",
			"in", "of", "from", "that", "takes", "returns", "does", "true", "false", "nothing", "none",
			"null", "times", "plus", "minus", "divided", "multiplied", "mod", "modulo", "equals",
			"contains", "where", "for", "if", "yes", "no");

	private static final Set<String> PYTHON_KEYWORDS = Set.of(
			"False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
			"def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
			"is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with", "yield");

	private static final Map<String, Integer> NUMBER_WORDS = new HashMap<>();

	static
	{
		String[] names = { "zero", "one", "two", "three", "four", "five", "six", "seven", "eight", "nine", "ten",
				"eleven", "twelve" };
		for(int i = 0; i < names.length; i++)
		{
			NUMBER_WORDS.put(names[i], i);
		}
	}

	private final Set<String> statementHeads;

	public Vocabulary(Set<String> statementHeads)
	{
		this.statementHeads = Collections.unmodifiableSet(new HashSet<>(statementHeads));
	}

	/**
	 * Checks whether a word may name a variable, function, class or parameter.
	 */
	public boolean isIdentifier(String word)
	{
		return IDENTIFIER.matcher(word).matches()
				&& !CONNECTORS.contains(word.toLowerCase())
				&& !PYTHON_KEYWORDS.contains(word)
				&& !NUMBER_WORDS.containsKey(word.toLowerCase());
	}

	/**
	 * A name that may begin a Python-style statement such as {@code total = 0}.
	 * Words that open a Plain statement are excluded so they keep their English meaning.
	 */
	public boolean isStatementName(String word)
	{
		return isIdentifier(word) && !statementHeads.contains(word.toLowerCase());
	}

	public boolean isConnector(String word)
	{
		return CONNECTORS.contains(word.toLowerCase());
	}

	public boolean isPythonKeyword(String word)
	{
		return PYTHON_KEYWORDS.contains(word);
	}

	/**
	 * @return The value spelled by a number word such as "three", or null.
	 */
	public Integer numberWord(String word)
	{
		return NUMBER_WORDS.get(word.toLowerCase());
	}

	public Set<String> getStatementHeads()
	{
		return statementHeads;
	}
}
