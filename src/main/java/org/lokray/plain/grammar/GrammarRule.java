package org.lokray.plain.grammar;

import org.lokray.plain.lexer.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * An ordered pattern of {@link PatternElement}s mapped to a production.
 * <p>
 * Patterns are written as space separated elements: {@code "define a|an function called|named"}.
 * {@code <name>} stands for a user-chosen name, and punctuation such as {@code (} or {@code >=}
 * stands for the token of that kind.
 *
 * @param <T> The production type of the table this rule belongs to.
 */
public final class GrammarRule<T>
{
	private static final Map<String, TokenType> PUNCTUATION = Map.ofEntries(
			Map.entry("(", TokenType.LEFT_PAREN),
			Map.entry("[", TokenType.LEFT_BRACKET),
			Map.entry("{", TokenType.LEFT_BRACE),
			Map.entry(".", TokenType.DOT),
			Map.entry(":", TokenType.COLON),
			Map.entry(",", TokenType.COMMA),
			Map.entry("=", TokenType.ASSIGN),
			Map.entry("+", TokenType.PLUS),
			Map.entry("-", TokenType.MINUS),
			Map.entry("*", TokenType.STAR),
			Map.entry("**", TokenType.STAR_STAR),
			Map.entry("/", TokenType.SLASH),
			Map.entry("%", TokenType.PERCENT),
			Map.entry("==", TokenType.EQUAL_EQUAL),
			Map.entry("!=", TokenType.BANG_EQUAL),
			Map.entry("<", TokenType.LESS),
			Map.entry("<=", TokenType.LESS_EQUAL),
			Map.entry(">", TokenType.GREATER),
			Map.entry(">=", TokenType.GREATER_EQUAL));

	private final List<PatternElement> elements;
	private final T production;
	private final int order; // registration order, breaks ties between equally long patterns
	private final String pattern;

	GrammarRule(String pattern, T production, int order)
	{
		this.pattern = pattern;
		this.elements = parse(pattern);
		this.production = production;
		this.order = order;
	}

	private static List<PatternElement> parse(String pattern)
	{
		List<PatternElement> parsed = new ArrayList<>();
		for(String part : pattern.trim().split("\\s+"))
		{
			if(part.equals("<name>"))
			{
				parsed.add(PatternElement.name());
			}
			else if(PUNCTUATION.containsKey(part))
			{
				parsed.add(PatternElement.token(PUNCTUATION.get(part)));
			}
			else
			{
				parsed.add(PatternElement.words(part.split("\\|")));
			}
		}
		return Collections.unmodifiableList(parsed);
	}

	public List<PatternElement> getElements()
	{
		return elements;
	}

	public T getProduction()
	{
		return production;
	}

	public int getOrder()
	{
		return order;
	}

	/**
	 * Number of tokens this rule consumes when it matches.
	 */
	public int length()
	{
		return elements.size();
	}

	/**
	 * A readable rendering of the rule using the first alternative of each element.
	 */
	public String displayPhrase()
	{
		return elements.stream()
				.map(e -> e.leadingWord() != null ? e.leadingWord() : e.toString())
				.collect(Collectors.joining(" "));
	}

	@Override
	public String toString()
	{
		return pattern + " -> " + production;
	}
}
