package org.lokray.plain.session;

import org.lokray.plain.CompilationResult;
import org.lokray.plain.PlainCompiler;
import org.lokray.plain.semantics.SymbolKind;
import org.lokray.plain.util.SyntaxError;
import org.lokray.plain.util.UnboundNameError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SessionTest
{
	private final PlainCompiler compiler = new PlainCompiler();

	@Test
	void laterFragmentsSeeEarlierNames()
	{
		Session session = compiler.newSession();
		compiler.compileIncremental(session, "let x be 1");

		assertEquals("print(x)\n", compiler.compileIncremental(session, "say x").getPythonSource());
		assertEquals(SymbolKind.VARIABLE, session.getGlobals().resolveLocally("x").getKind());
	}

	@Test
	void committedImportsAreNotEmittedAgain()
	{
		Session session = compiler.newSession();

		CompilationResult first = compiler.compileIncremental(session, "wait 2 seconds");
		CompilationResult second = compiler.compileIncremental(session, "wait 2 seconds");

		assertEquals("import time\n\ntime.sleep(2)\n", first.getPythonSource());
		assertEquals(List.of("import time"), first.getNewImports());
		assertEquals("time.sleep(2)\n", second.getPythonSource());
		assertTrue(second.getNewImports().isEmpty());
		assertEquals(Set.of("import time"), session.getCommittedImports());
	}

	@Test
	void rejectedFragmentLeavesTheSessionUntouched()
	{
		Session session = compiler.newSession();
		compiler.compileIncremental(session, "let a be 1");

		assertThrows(UnboundNameError.class, () -> compiler.compileIncremental(session, "let c be 2\nsay nope"));

		assertNull(session.getGlobals().resolveLocally("c"));
		assertEquals(1, session.getTranscript().size());
		assertThrows(UnboundNameError.class, () -> compiler.compileIncremental(session, "say c"));
	}

	@Test
	void rejectedFragmentDoesNotCommitItsImports()
	{
		Session session = compiler.newSession();

		assertThrows(UnboundNameError.class, () -> compiler.compileIncremental(session, "wait 1 second\nsay nope"));

		assertTrue(session.getCommittedImports().isEmpty());
		assertEquals("import time\n\ntime.sleep(1)\n", compiler.compileIncremental(session, "wait 1 second").getPythonSource());
	}

	@Test
	void failedFragmentDoesNotChangeLaterOutput()
	{
		Session clean = compiler.newSession();
		Session disturbed = compiler.newSession();
		compiler.compileIncremental(clean, "let x be 1");
		compiler.compileIncremental(disturbed, "let x be 1");

		assertThrows(SyntaxError.class, () -> compiler.compileIncremental(disturbed, "let y be\nwait 1 second"));

		for(String fragment : List.of("say x", "wait 1 second", "let y be x plus 1", "say y"))
		{
			assertEquals(compiler.compileIncremental(clean, fragment).getPythonSource(),
					compiler.compileIncremental(disturbed, fragment).getPythonSource());
		}
	}

	@Test
	void transcriptRecordsCommittedFragmentsInOrder()
	{
		Session session = compiler.newSession();
		compiler.compileIncremental(session, "let x be 1");
		compiler.compileIncremental(session, "say x");

		List<Fragment> transcript = session.getTranscript();
		assertEquals(2, transcript.size());
		assertEquals("let x be 1", transcript.get(0).getText());
		assertEquals(FragmentState.COMMITTED, transcript.get(1).getState());
		assertEquals("print(x)\n", transcript.get(1).getResult().getPythonSource());
	}

	@Test
	void resetForgetsEverything()
	{
		Session session = compiler.newSession();
		compiler.compileIncremental(session, "let x be 1\nwait 1 second");

		session.reset();

		assertNull(session.getGlobals().resolveLocally("x"));
		assertTrue(session.getCommittedImports().isEmpty());
		assertTrue(session.getTranscript().isEmpty());
	}

	@Test
	void sessionsAreIndependent()
	{
		Session first = compiler.newSession();
		Session second = compiler.newSession();
		compiler.compileIncremental(first, "let x be 1");

		assertThrows(UnboundNameError.class, () -> compiler.compileIncremental(second, "say x"));
	}
}
