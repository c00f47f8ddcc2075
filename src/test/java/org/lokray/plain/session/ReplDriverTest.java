package org.lokray.plain.session;

import org.lokray.plain.PlainCompiler;
import org.lokray.plain.codegen.LineMap;
import org.lokray.plain.runtime.ExecutionCollaborator;
import org.lokray.plain.runtime.ExecutionException;
import org.lokray.plain.runtime.ExecutionResult;
import org.lokray.plain.util.SyntaxError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplDriverTest
{
	/**
	 * Records what it is asked to run and answers with a canned result.
	 */
	private static class RecordingCollaborator implements ExecutionCollaborator
	{
		final List<String> executed = new ArrayList<>();
		int resets;
		boolean unreachable;
		boolean restarted;

		@Override
		public ExecutionResult execute(String pythonSource, LineMap lineMap)
		{
			if(unreachable)
			{
				throw new ExecutionException("python3 is not installed");
			}
			executed.add(pythonSource);
			boolean stateLost = restarted;
			restarted = false;
			return new ExecutionResult(0, "ran " + executed.size() + "\n", "", stateLost);
		}

		@Override
		public void reset()
		{
			resets++;
		}
	}

	private RecordingCollaborator collaborator;
	private ReplDriver driver;

	@BeforeEach
	void setUp()
	{
		collaborator = new RecordingCollaborator();
		driver = new ReplDriver(new PlainCompiler(), collaborator);
	}

	private String run(String input) throws IOException
	{
		ByteArrayOutputStream bytes = new ByteArrayOutputStream();
		PrintStream out = new PrintStream(bytes, true, StandardCharsets.UTF_8);
		driver.run(new BufferedReader(new StringReader(input)), out);
		return bytes.toString(StandardCharsets.UTF_8);
	}

	@Test
	void rejectedFragmentDoesNotDisturbTheSession()
	{
		driver.submit("let x be 1");
		assertThrows(SyntaxError.class, () -> driver.submit("let x be"));
		driver.submit("say x");

		assertEquals(List.of("x = 1\n", "print(x)\n"), collaborator.executed);
		assertEquals(List.of("let x be 1", "say x"), driver.getHistory());
	}

	@Test
	void resetClearsSessionAndInterpreter()
	{
		driver.submit("let x be 1");

		driver.reset();

		assertEquals(1, collaborator.resets);
		assertTrue(driver.getHistory().isEmpty());
		assertThrows(org.lokray.plain.util.UnboundNameError.class, () -> driver.submit("say x"));
	}

	@Test
	void restartedInterpreterClearsTheSession()
	{
		driver.submit("wait 1 second");
		driver.submit("let x be 1");
		collaborator.restarted = true;

		ExecutionResult result = driver.submit("say 2");

		assertTrue(result.isStateLost());
		assertTrue(driver.getHistory().isEmpty());
		assertThrows(org.lokray.plain.util.UnboundNameError.class, () -> driver.submit("say x"));
		driver.submit("wait 1 second");
		assertEquals("import time\n\ntime.sleep(1)\n", collaborator.executed.get(collaborator.executed.size() - 1));
	}

	@Test
	void loopTellsTheUserWhenTheInterpreterRestarted() throws IOException
	{
		collaborator.restarted = true;

		String output = run("let x be 1\nsay x\n");

		assertTrue(output.contains(ReplDriver.STATE_LOST_NOTICE), output);
		assertTrue(output.contains("'x' is not defined"), output);
		assertEquals(1, collaborator.executed.size());
	}

	@Test
	void loopEvaluatesLinesAndBlocks() throws IOException
	{
		String output = run("let x be 5\nif x is greater than 3 then\n    say \"big\"\n\n:history\n:quit\nsay 1\n");

		assertEquals(List.of("x = 5\n", "if x > 3:\n    print(\"big\")\n"), collaborator.executed);
		assertTrue(output.contains("ran 1"));
		assertTrue(output.contains("ran 2"));
		assertTrue(output.contains("1: let x be 5"));
		assertTrue(output.contains(ReplDriver.CONTINUATION_PROMPT));
	}

	@Test
	void loopPrintsCompileErrorsAndCarriesOn() throws IOException
	{
		String output = run("say y\nlet y be 2\nsay y\n");

		assertTrue(output.contains("[UnboundNameError] Line 1, Column 5: 'y' is not defined"), output);
		assertEquals(2, collaborator.executed.size());
	}

	@Test
	void loopEvaluatesAnUnfinishedBlockAtEndOfInput() throws IOException
	{
		run("repeat 2 times\n    say 1\n");

		assertEquals(List.of("for _ in range(2):\n    print(1)\n"), collaborator.executed);
	}

	@Test
	void loopShowsGeneratedPythonWhenAsked() throws IOException
	{
		driver.setShowGenerated(true);

		String output = run("wait 1 second\n");

		assertTrue(output.contains("import time\n\ntime.sleep(1)"), output);
	}

	@Test
	void loopReportsAnUnreachableInterpreter() throws IOException
	{
		collaborator.unreachable = true;

		String output = run("say 1\n");

		assertTrue(output.contains("Could not run the fragment: python3 is not installed"));
	}

	@Test
	void resetCommandStartsOver() throws IOException
	{
		String output = run("let x be 1\n:reset\nsay x\n");

		assertTrue(output.contains("Session cleared."));
		assertTrue(output.contains("'x' is not defined"));
		assertEquals(1, collaborator.resets);
	}

	@Test
	void recognisesBlockOpeningLines()
	{
		assertTrue(ReplDriver.opensBlock("if x is 1 then"));
		assertTrue(ReplDriver.opensBlock("for each n in numbers do"));
		assertTrue(ReplDriver.opensBlock("try"));
		assertTrue(ReplDriver.opensBlock("define a function called greet"));
		assertTrue(ReplDriver.opensBlock("repeat 3 times"));
		assertFalse(ReplDriver.opensBlock("define a function called add that takes a and b and returns a plus b"));
		assertTrue(ReplDriver.opensBlock("create a property named area"));
		assertFalse(ReplDriver.opensBlock("create a property named area that returns 1"));
		assertFalse(ReplDriver.opensBlock("if x is 1 then say x"));
		assertFalse(ReplDriver.opensBlock("say \"done\""));
	}
}
