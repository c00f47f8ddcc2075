package org.lokray.plain.runtime;

import org.lokray.plain.PlainCompiler;
import org.lokray.plain.codegen.LineMap;
import org.lokray.plain.session.ReplDriver;
import org.lokray.plain.util.SyntaxError;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

/**
 * Runs against a real interpreter; skipped where python3 is not installed.
 */
class PythonProcessCollaboratorTest
{
	private static final String PYTHON = "python3";

	private PythonProcessCollaborator collaborator;
	private ReplDriver driver;

	@BeforeAll
	static void requirePython()
	{
		boolean available;
		try
		{
			Process check = new ProcessBuilder(PYTHON, "-c", "pass").start();
			available = check.waitFor(10, TimeUnit.SECONDS) && check.exitValue() == 0;
		}
		catch(Exception e)
		{
			available = false;
		}
		assumeTrue(available, "python3 is not available");
	}

	@BeforeEach
	void setUp()
	{
		collaborator = new PythonProcessCollaborator(PYTHON);
		driver = new ReplDriver(new PlainCompiler(), collaborator);
	}

	@AfterEach
	void tearDown()
	{
		collaborator.close();
	}

	@Test
	void fragmentsShareGlobals()
	{
		driver.submit("let x be 1");
		assertThrows(SyntaxError.class, () -> driver.submit("let x be"));
		ExecutionResult result = driver.submit("say x");

		assertEquals("1\n", result.getStdout());
		assertTrue(result.isSuccess());
	}

	@Test
	void tracebacksPointAtPlainLines()
	{
		ExecutionResult result = driver.submit("let a be 1\n\n# about to fail\nfail with ValueError(\"boom\")\n");

		assertEquals(1, result.getExitStatus());
		assertTrue(result.getStderr().contains("File \"<plain>\", line 4"), result.getStderr());
		assertTrue(result.getStderr().contains("ValueError: boom"));
	}

	@Test
	void exitStatusIsReported()
	{
		ExecutionResult result = driver.submit("exit with code 3");

		assertEquals(3, result.getExitStatus());
		assertEquals(0, driver.submit("say 2").getExitStatus());
	}

	@Test
	void resetDiscardsInterpreterGlobals()
	{
		driver.submit("let x be 1");
		driver.reset();

		ExecutionResult result = collaborator.execute("print('x' in dir())\n", new LineMap());
		assertEquals("False\n", result.getStdout());
	}

	@Test
	void restartedInterpreterClearsTheSession()
	{
		driver.submit("wait 0 seconds");
		driver.submit("let x be 1");
		collaborator.execute("import os\nos._exit(1)\n", new LineMap());

		ExecutionResult result = driver.submit("say 2");

		assertTrue(result.isStateLost());
		assertEquals("2\n", result.getStdout());
		assertTrue(driver.getHistory().isEmpty());
		assertTrue(driver.submit("wait 0 seconds").isSuccess());
	}

	@Test
	void conditionalPicksABranch()
	{
		ExecutionResult result = driver.submit("let n be 7\nif n is greater than 5 then\n    say \"big\"\n"
				+ "otherwise\n    say \"small\"\n");

		assertEquals("big\n", result.getStdout());
	}

	@Test
	void loopsRunTheirBodies()
	{
		ExecutionResult result = driver.submit("let total be 0\nfor each n in [1, 2, 3] do\n    increase total by n\n"
				+ "let count be 0\nwhile count is less than 2 do\n    increase count\n"
				+ "repeat 2 times\n    say \"tick\"\nsay total, count\n");

		assertEquals("tick\ntick\n6 2\n", result.getStdout());
	}

	@Test
	void functionsCanBeCalledFromLaterFragments()
	{
		driver.submit("define a function called add that takes a and b and returns a plus b");

		assertEquals("5\n", driver.submit("say add(2, 3)").getStdout());
	}

	@Test
	void classesBuildInstances()
	{
		driver.submit("define a class called Shape\n    define the constructor that takes name\n        set self.name to name\n"
				+ "    define a method called describe that returns \"I am \" plus self.name\n");

		ExecutionResult result = driver.submit("let s be a new Shape with \"circle\"\nsay s.describe()\n");

		assertEquals("I am circle\n", result.getStdout());
	}

	@Test
	void handlersCatchFailures()
	{
		ExecutionResult result = driver.submit("try\n    let ratio be 1 divided by 0\n"
				+ "if something goes wrong as problem\n    say \"caught\"\nfinally\n    say \"done\"\n");

		assertEquals("caught\ndone\n", result.getStdout());
		assertTrue(result.isSuccess());
	}

	@Test
	void usingClosesTheFile(@TempDir Path directory)
	{
		String path = directory.resolve("note.txt").toString().replace('\\', '/');

		ExecutionResult result = driver.submit("using open file \"" + path + "\" for writing as f do\n    f.write(\"hello\")\n"
				+ "say the contents of file \"" + path + "\"\n");

		assertEquals("hello\n", result.getStdout(), result.getStderr());
	}

	@Test
	void asyncFunctionsRunUnderAsyncio()
	{
		driver.submit("define an async function called main\n    wait 0 seconds\n    say \"awake\"\n");

		ExecutionResult result = driver.submit("asyncio.run(main())");

		assertEquals("awake\n", result.getStdout(), result.getStderr());
	}

	@Test
	void listEndsPropertiesAndLengthsBehaveAtRuntime()
	{
		driver.submit("define a class called Word\n    define the constructor that takes text\n        set self.text to text\n"
				+ "    create a property named size that returns the length of self.text\n");

		ExecutionResult result = driver.submit("let items be [2, 3]\nprepend 1 to items\npop from items\n"
				+ "let w be a new Word with \"plain\"\nsay items, w.size\nsay \"abc\" is longer than \"ab\"\n");

		assertEquals("[1, 2] 5\nTrue\n", result.getStdout(), result.getStderr());
	}
}
