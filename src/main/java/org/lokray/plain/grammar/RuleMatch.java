package org.lokray.plain.grammar;

/**
 * Result of a successful resolution: the rule that matched and how many tokens it consumed.
 */
public final class RuleMatch<T>
{
	private final GrammarRule<T> rule;

	RuleMatch(GrammarRule<T> rule)
	{
		this.rule = rule;
	}

	public GrammarRule<T> getRule()
	{
		return rule;
	}

	public T getProduction()
	{
		return rule.getProduction();
	}

	public int getConsumed()
	{
		return rule.length();
	}
}
