package org.lokray.plain.grammar;

import org.lokray.plain.lexer.Token;
import org.lokray.plain.lexer.TokenType;
import org.lokray.plain.util.Suggestions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * An ordered collection of grammar rules producing values of one production type.
 * Rules are tried longest pattern first; equally long patterns are tried in registration order.
 * The first rule whose every element matches the upcoming tokens wins.
 */
public final class RuleTable<T>
{
	private final List<GrammarRule<T>> rules = new ArrayList<>();

	/**
	 * Registers a rule. Returns this table for chaining.
	 */
	public RuleTable<T> add(String pattern, T production)
	{
		rules.add(new GrammarRule<>(pattern, production, rules.size()));
		rules.sort(Comparator.comparingInt((GrammarRule<T> r) -> -r.length()).thenComparingInt(GrammarRule::getOrder));
		return this;
	}

	public List<GrammarRule<T>> getRules()
	{
		return Collections.unmodifiableList(rules);
	}

	public Optional<RuleMatch<T>> resolve(TokenWindow window, Vocabulary vocabulary)
	{
		for(GrammarRule<T> rule : rules)
		{
			if(matches(rule, window, vocabulary))
			{
				return Optional.of(new RuleMatch<>(rule));
			}
		}
		return Optional.empty();
	}

	private boolean matches(GrammarRule<T> rule, TokenWindow window, Vocabulary vocabulary)
	{
		List<PatternElement> elements = rule.getElements();
		for(int i = 0; i < elements.size(); i++)
		{
			Token token = window.get(i);
			if(token.getType() == TokenType.EOF || !elements.get(i).matches(token, vocabulary))
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * Finds the rule whose phrase reads most like the given words. Advisory only.
	 *
	 * @param words Lowercase words from the start of an unmatched line.
	 * @return The display phrase of the closest rule, or null.
	 */
	public String suggest(List<String> words)
	{
		if(words.isEmpty())
		{
			return null;
		}
		List<String> phrases = new ArrayList<>();
		for(GrammarRule<T> rule : rules)
		{
			String phrase = rule.displayPhrase();
			if(!phrase.startsWith("<") && !phrases.contains(phrase))
			{
				phrases.add(phrase);
			}
		}
		String best = null;
		int bestDistance = Integer.MAX_VALUE;
		for(String phrase : phrases)
		{
			int length = phrase.split(" ").length;
			String candidate = String.join(" ", words.subList(0, Math.min(length, words.size())));
			int distance = Suggestions.distance(candidate, phrase);
			int limit = Math.max(1, phrase.length() / 3);
			if(distance > 0 && distance <= limit && distance < bestDistance)
			{
				best = phrase;
				bestDistance = distance;
			}
		}
		return best;
	}
}
