package org.lokray.plain.grammar;

import org.lokray.plain.lexer.Lexer;
import org.lokray.plain.lexer.Token;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GrammarResolverTest
{
	private final GrammarResolver grammar = GrammarResolver.standard();

	private static TokenWindow window(String text)
	{
		List<Token> tokens = new Lexer(text).scanTokens();
		return offset -> offset < tokens.size() ? tokens.get(offset) : tokens.get(tokens.size() - 1);
	}

	private RuleMatch<Production> statement(String text)
	{
		return grammar.resolveStatement(window(text)).orElseThrow();
	}

	@Test
	void longerPhraseWinsOverItsPrefix()
	{
		RuleMatch<Production> waitFor = statement("wait for fetch()");
		assertEquals(Production.WAIT_FOR, waitFor.getProduction());
		assertEquals(2, waitFor.getConsumed());

		RuleMatch<Production> pause = statement("wait 5 seconds");
		assertEquals(Production.WAIT, pause.getProduction());
		assertEquals(1, pause.getConsumed());
	}

	@Test
	void printNumbersIsMoreSpecificThanPrint()
	{
		assertEquals(Production.PRINT_NUMBERS, statement("print numbers from 1 to 3").getProduction());
		assertEquals(Production.SAY, statement("print x").getProduction());
	}

	@Test
	void catchPhraseBeatsPlainIf()
	{
		assertEquals(Production.CATCH, statement("if something goes wrong").getProduction());
		assertEquals(Production.IF, statement("if something is 1").getProduction());
	}

	@Test
	void nameSlotAcceptsOnlyNonKeywords()
	{
		assertEquals(Production.ASSIGN, statement("total = 0").getProduction());
		assertEquals(Production.CALL_WITH, statement("greet with name").getProduction());
		assertEquals(Production.SAY, statement("say = 0").getProduction());
	}

	@Test
	void resolvesLongestOperatorPhrase()
	{
		RuleMatch<Operator> greaterEqual = grammar.resolveOperator(window("is greater than or equal to 3")).orElseThrow();
		assertEquals(Operator.GREATER_EQUAL, greaterEqual.getProduction());
		assertEquals(6, greaterEqual.getConsumed());

		assertEquals(Operator.GREATER, grammar.resolveOperator(window("is greater than 3")).orElseThrow().getProduction());
		assertEquals(Operator.EQUAL, grammar.resolveOperator(window("is 3")).orElseThrow().getProduction());
		assertEquals(Operator.IS_NOT_EMPTY, grammar.resolveOperator(window("is not empty")).orElseThrow().getProduction());
	}

	@Test
	void resolvesExpressionForms()
	{
		assertEquals(ExpressionForm.SQUARE_ROOT, grammar.resolveExpressionForm(window("the square root of 9")).orElseThrow().getProduction());
		assertEquals(ExpressionForm.AWAIT, grammar.resolveExpressionForm(window("wait for job")).orElseThrow().getProduction());
		assertTrue(grammar.resolveExpressionForm(window("total")).isEmpty());
	}

	@Test
	void equallyLongRulesKeepRegistrationOrder()
	{
		RuleTable<String> table = new RuleTable<String>()
				.add("go", "first")
				.add("go home", "longer")
				.add("go", "second");
		Vocabulary vocabulary = new Vocabulary(Set.of());

		assertEquals("first", table.resolve(window("go now"), vocabulary).orElseThrow().getProduction());
		assertEquals("longer", table.resolve(window("go home"), vocabulary).orElseThrow().getProduction());
	}

	@Test
	void unmatchedStatementResolvesToNothing()
	{
		Optional<RuleMatch<Production>> match = grammar.resolveStatement(window("frobnicate the widget"));

		assertTrue(match.isEmpty());
	}

	@Test
	void suggestsNearestStatementPhrase()
	{
		assertEquals("let", grammar.suggestStatement(new Lexer("lett x be 1").scanTokens()));
		assertNull(grammar.suggestStatement(new Lexer("42").scanTokens()));
	}

	@Test
	void statementHeadsAreNotNames()
	{
		Vocabulary vocabulary = grammar.getVocabulary();

		assertTrue(vocabulary.isStatementName("total"));
		assertFalse(vocabulary.isStatementName("say"));
		assertFalse(vocabulary.isIdentifier("otherwise"));
		assertFalse(vocabulary.isIdentifier("class"));
		assertEquals(Integer.valueOf(3), vocabulary.numberWord("Three"));
	}

	@Test
	void listEndsAndPropertiesHaveTheirOwnStatements()
	{
		assertEquals(Production.PREPEND, statement("prepend 1 to items").getProduction());
		assertEquals(2, statement("pop from items").getConsumed());
		assertEquals(Production.POP, statement("pop the last item from items").getProduction());
		assertEquals(Production.DEFINE_PROPERTY, statement("create a property named area that returns 1").getProduction());
	}

	@Test
	void lengthComparisonsBeatPlainIsAndHas()
	{
		assertEquals(Operator.LONGER, grammar.resolveOperator(window("is longer than b")).orElseThrow().getProduction());
		assertEquals(Operator.SHORTER, grammar.resolveOperator(window("is shorter than b")).orElseThrow().getProduction());
		assertEquals(Operator.SAME_LENGTH, grammar.resolveOperator(window("is as long as b")).orElseThrow().getProduction());
		assertEquals(Operator.SAME_LENGTH, grammar.resolveOperator(window("has the same length as b")).orElseThrow().getProduction());
		assertEquals(Operator.CONTAINS, grammar.resolveOperator(window("has b")).orElseThrow().getProduction());
	}
}
