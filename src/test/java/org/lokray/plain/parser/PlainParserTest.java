package org.lokray.plain.parser;

import org.lokray.plain.ast.Program;
import org.lokray.plain.ast.expressions.BinaryExpression;
import org.lokray.plain.ast.expressions.BinaryOperator;
import org.lokray.plain.ast.expressions.CallExpression;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.ast.statements.*;
import org.lokray.plain.grammar.GrammarResolver;
import org.lokray.plain.lexer.Lexer;
import org.lokray.plain.util.SyntaxError;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlainParserTest
{
	private final GrammarResolver grammar = GrammarResolver.standard();

	private List<Statement> parse(String source)
	{
		Program program = new PlainParser(new Lexer(source), grammar).parse();
		return program.getBody().getStatements();
	}

	private SyntaxError failure(String source)
	{
		return assertThrows(SyntaxError.class, () -> parse(source));
	}

	@Test
	void parsesLetAsAssignment()
	{
		List<Statement> statements = parse("let x be 5");

		assertEquals(1, statements.size());
		assertInstanceOf(AssignmentStatement.class, statements.get(0));
	}

	@Test
	void multiplicationBindsTighterThanAddition()
	{
		Expression expression = new PlainParser(new Lexer("1 plus 2 times 3"), grammar).expression();

		BinaryExpression sum = assertInstanceOf(BinaryExpression.class, expression);
		assertEquals(BinaryOperator.ADD, sum.getOperator());
		assertEquals(BinaryOperator.MULTIPLY, assertInstanceOf(BinaryExpression.class, sum.getRight()).getOperator());
	}

	@Test
	void inlineIfTakesAnOtherwiseBranch()
	{
		IfStatement statement = assertInstanceOf(IfStatement.class,
				parse("if x is greater than 3 then say \"big\" otherwise say \"small\"").get(0));

		assertEquals(1, statement.getThenBranch().getStatements().size());
		assertNotNull(statement.getElseBranch());
		assertEquals(1, statement.getElseBranch().getStatements().size());
	}

	@Test
	void otherwiseIfChainsNestAsElseIf()
	{
		IfStatement statement = assertInstanceOf(IfStatement.class,
				parse("if x is 1 then\n    say 1\notherwise if x is 2 then\n    say 2\notherwise\n    say 3\n").get(0));

		IfStatement elseIf = assertInstanceOf(IfStatement.class, statement.getElseBranch().getStatements().get(0));
		assertTrue(elseIf.isElseIf());
		assertNotNull(elseIf.getElseBranch());
	}

	@Test
	void repeatStaysPlainShapedUntilAnalysis()
	{
		RepeatStatement repeat = assertInstanceOf(RepeatStatement.class, parse("repeat 3 times\n    say 1\n").get(0));

		assertEquals(RepeatStatement.Mode.TIMES, repeat.getMode());
		assertTrue(repeat.isPlainShaped());
	}

	@Test
	void countedParametersAreNamedAlphabetically()
	{
		FunctionDeclaration function = assertInstanceOf(FunctionDeclaration.class,
				parse("define a function called add that takes two numbers and returns a plus b").get(0));

		assertEquals("add", function.getName());
		assertEquals(2, function.getParameters().size());
		assertEquals("a", function.getParameters().get(0).getName());
		assertEquals("b", function.getParameters().get(1).getName());
		assertInstanceOf(ReturnStatement.class, function.getBody().getStatements().get(0));
	}

	@Test
	void namedCallWithArguments()
	{
		ExpressionStatement statement = assertInstanceOf(ExpressionStatement.class, parse("greet with \"Ann\", 3").get(0));

		CallExpression call = assertInstanceOf(CallExpression.class, statement.getExpression());
		assertEquals(2, call.getArguments().size());
	}

	@Test
	void tryCollectsHandlersAndFinally()
	{
		TryStatement statement = assertInstanceOf(TryStatement.class,
				parse("try\n    say 1\nif something goes wrong as problem\n    say 2\nfinally\n    say 3\n").get(0));

		assertEquals(1, statement.getHandlers().size());
		assertEquals("problem", statement.getHandlers().get(0).getAlias().getLexeme());
		assertNotNull(statement.getFinallyBlock());
	}

	@Test
	void waitForAndWaitAreDistinct()
	{
		WaitStatement awaitForm = assertInstanceOf(WaitStatement.class, parse("wait for fetch()").get(0));
		WaitStatement pause = assertInstanceOf(WaitStatement.class, parse("wait 2 minutes").get(0));

		assertFalse(awaitForm.isPause());
		assertTrue(pause.isPause());
		assertEquals("minutes", pause.getUnit());
	}

	@Test
	void missingValueAfterBe()
	{
		SyntaxError error = failure("let x be");

		assertEquals("Expected a value after 'be'", error.getDetail());
		assertEquals(1, error.getLine());
	}

	@Test
	void unknownPhraseCarriesWindowAndHint()
	{
		SyntaxError error = failure("lett x be 1");

		assertEquals("I don't understand 'lett x be 1'", error.getDetail());
		assertEquals(List.of("lett", "x", "be", "1"), error.getWindow());
		assertEquals("did you mean 'let'?", error.getHint());
	}

	@Test
	void blockHeaderNeedsIndentedBody()
	{
		assertEquals("Expected an indented block after 'if'", failure("if x then\nsay x\n").getDetail());
	}

	@Test
	void strayIndentationIsRejected()
	{
		assertEquals("Unexpected indentation", failure("say 1\n    say 2\n").getDetail());
	}

	@Test
	void otherwiseNeedsAnIf()
	{
		assertEquals("'otherwise' without a matching 'if'", failure("otherwise say 1").getDetail());
	}

	@Test
	void tryNeedsAHandler()
	{
		assertTrue(failure("try\n    say 1\nsay 2\n").getDetail().startsWith("A 'try' block needs"));
	}

	@Test
	void endpointNeedsAnHttpVerb()
	{
		SyntaxError error = failure("create an api endpoint at \"/x\" that jumps and returns 1");

		assertEquals("Expected an HTTP verb such as 'gets' or 'posts'", error.getDetail());
	}

	@Test
	void reservedWordsCannotBeNames()
	{
		assertTrue(failure("let class be 1").getDetail().contains("reserved word"));
	}

	@Test
	void trailingWordsAfterStatementAreRejected()
	{
		assertTrue(failure("say 1 2").getDetail().startsWith("Unexpected '2'"));
	}
}
