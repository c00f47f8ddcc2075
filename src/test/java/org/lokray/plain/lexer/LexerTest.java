package org.lokray.plain.lexer;

import org.lokray.plain.util.LexError;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.lokray.plain.lexer.TokenType.*;

class LexerTest
{
	private static List<TokenType> types(String source)
	{
		return new Lexer(source).scanTokens().stream().map(Token::getType).collect(Collectors.toList());
	}

	@Test
	void scansWordsAndNumbers()
	{
		List<Token> tokens = new Lexer("let x be 5").scanTokens();

		assertEquals(List.of(WORD, WORD, WORD, NUMBER, NEWLINE, EOF), tokens.stream().map(Token::getType).collect(Collectors.toList()));
		assertEquals(new BigDecimal("5"), tokens.get(3).getLiteral());
		assertEquals(1, tokens.get(1).getLine());
		assertEquals(5, tokens.get(1).getColumn());
	}

	@Test
	void emitsIndentAndDedentFromLeadingWhitespace()
	{
		assertEquals(List.of(WORD, WORD, WORD, NEWLINE, INDENT, WORD, WORD, NEWLINE, DEDENT, WORD, WORD, NEWLINE, EOF),
				types("if x then\n    say x\nsay y\n"));
	}

	@Test
	void closesOpenBlocksAtEndOfInput()
	{
		assertEquals(List.of(WORD, NEWLINE, INDENT, WORD, NEWLINE, INDENT, WORD, NEWLINE, DEDENT, DEDENT, EOF),
				types("a\n  b\n    c"));
	}

	@Test
	void skipsCommentsAndBlankLines()
	{
		assertEquals(List.of(WORD, NUMBER, NEWLINE, EOF), types("# note\n\n// another note\nsay 1 # trailing\n"));
	}

	@Test
	void decodesStringEscapes()
	{
		Token string = new Lexer("say \"a\\nb\\\"c\"").scanTokens().get(1);

		assertEquals(STRING, string.getType());
		assertEquals("a\nb\"c", string.getLiteral());
	}

	@Test
	void acceptsSingleQuotedStrings()
	{
		assertEquals("it's", new Lexer("say 'it\\'s'").scanTokens().get(1).getLiteral());
	}

	@Test
	void distinguishesDecimalsFromAttributeAccess()
	{
		List<Token> decimal = new Lexer("3.25").scanTokens();
		assertEquals(new BigDecimal("3.25"), decimal.get(0).getLiteral());

		assertEquals(List.of(WORD, DOT, WORD, NEWLINE, EOF), types("x.y"));
	}

	@Test
	void keepsInnerApostropheInWords()
	{
		Token word = new Lexer("doesn't").scanTokens().get(0);

		assertEquals(WORD, word.getType());
		assertEquals("doesn't", word.getLexeme());
	}

	@Test
	void joinsLinesInsideBrackets()
	{
		assertEquals(List.of(WORD, WORD, WORD, LEFT_BRACKET, NUMBER, COMMA, NUMBER, RIGHT_BRACKET, NEWLINE, EOF),
				types("let a be [1,\n  2]\n"));
	}

	@Test
	void scansSymbolicOperators()
	{
		assertEquals(List.of(WORD, GREATER_EQUAL, NUMBER, STAR_STAR, NUMBER, BANG_EQUAL, NUMBER, NEWLINE, EOF),
				types("x >= 1 ** 2 != 3"));
	}

	@Test
	void reportsUnterminatedString()
	{
		LexError error = assertThrows(LexError.class, () -> new Lexer("say \"oops").scanTokens());

		assertEquals(1, error.getLine());
		assertEquals(5, error.getColumn());
		assertEquals("Unterminated string", error.getDetail());
	}

	@Test
	void reportsUnexpectedCharacter()
	{
		LexError error = assertThrows(LexError.class, () -> new Lexer("let x be 5 $").scanTokens());

		assertEquals(12, error.getColumn());
	}

	@Test
	void rejectsTabsAndSpacesInOneIndentation()
	{
		LexError error = assertThrows(LexError.class, () -> new Lexer("if x then\n \tsay x\n").scanTokens());

		assertEquals(2, error.getLine());
		assertEquals("Indentation mixes tabs and spaces", error.getDetail());
	}

	@Test
	void rejectsSwitchingIndentationCharacter()
	{
		LexError error = assertThrows(LexError.class,
				() -> new Lexer("if a then\n    say a\nif b then\n\tsay b\n").scanTokens());

		assertEquals(4, error.getLine());
		assertTrue(error.getDetail().contains("tabs"));
	}

	@Test
	void rejectsDedentToUnknownLevel()
	{
		LexError error = assertThrows(LexError.class, () -> new Lexer("if a then\n    say a\n  say b\n").scanTokens());

		assertEquals(3, error.getLine());
		assertTrue(error.getDetail().startsWith("Unindent does not match"));
	}

	@Test
	void iteratesLazilyUpToTheBrokenLine()
	{
		Iterator<Token> tokens = new Lexer("say 1\nsay \"broken").iterator();

		assertTrue(tokens.next().isWord("say"));
		assertEquals(NUMBER, tokens.next().getType());
		assertEquals(NEWLINE, tokens.next().getType());
		assertThrows(LexError.class, tokens::hasNext);
	}

	@Test
	void eachIterationScansAgain()
	{
		Lexer lexer = new Lexer("if x then\n    say x\n");

		assertEquals(lexer.scanTokens(), lexer.scanTokens());
	}
}
