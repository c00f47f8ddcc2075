package org.lokray.plain.grammar;

import org.lokray.plain.lexer.Token;
import org.lokray.plain.lexer.TokenType;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One position of a grammar rule pattern. An element matches exactly one token:
 * a word from a set of alternatives, a user-chosen name, or a punctuation token of a given kind.
 */
public final class PatternElement
{
	private enum Kind
	{
		WORDS,
		NAME,
		TOKEN
	}

	private final Kind kind;
	private final Set<String> words;
	private final TokenType tokenType;

	private PatternElement(Kind kind, Set<String> words, TokenType tokenType)
	{
		this.kind = kind;
		this.words = words;
		this.tokenType = tokenType;
	}

	public static PatternElement words(String... alternatives)
	{
		Set<String> normalized = Arrays.stream(alternatives)
				.map(String::toLowerCase)
				.collect(Collectors.toCollection(LinkedHashSet::new));
		return new PatternElement(Kind.WORDS, normalized, null);
	}

	public static PatternElement name()
	{
		return new PatternElement(Kind.NAME, Set.of(), null);
	}

	public static PatternElement token(TokenType type)
	{
		return new PatternElement(Kind.TOKEN, Set.of(), type);
	}

	public boolean matches(Token token, Vocabulary vocabulary)
	{
		switch(kind)
		{
			case WORDS:
				return token.getType() == TokenType.WORD && words.contains(token.normalized());
			case NAME:
				return token.getType() == TokenType.WORD && vocabulary.isStatementName(token.getLexeme());
			default:
				return token.getType() == tokenType;
		}
	}

	/**
	 * @return The first word alternative, or null when this element is not a word element.
	 */
	public String leadingWord()
	{
		return kind == Kind.WORDS ? words.iterator().next() : null;
	}

	public Set<String> getWords()
	{
		return words;
	}

	@Override
	public String toString()
	{
		switch(kind)
		{
			case WORDS:
				return String.join("|", words);
			case NAME:
				return "<name>";
			default:
				return tokenType.name();
		}
	}
}
