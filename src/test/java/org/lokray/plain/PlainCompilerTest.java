package org.lokray.plain;

import org.lokray.plain.util.SyntaxError;
import org.lokray.plain.util.UnboundNameError;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class PlainCompilerTest
{
	private final PlainCompiler compiler = new PlainCompiler();

	private String compile(String source)
	{
		return compiler.compile(source).getPythonSource();
	}

	@Test
	void letBecomesAssignment()
	{
		assertEquals("x = 5\n", compile("let x be 5"));
	}

	@Test
	void inlineIfWithOtherwise()
	{
		assertEquals("x = 5\nif x > 3:\n    print(\"big\")\nelse:\n    print(\"small\")\n",
				compile("let x be 5\nif x is greater than 3 then say \"big\" otherwise say \"small\""));
	}

	@Test
	void undefinedNameIsRejected()
	{
		UnboundNameError error = assertThrows(UnboundNameError.class,
				() -> compile("if x is greater than 3 then say \"big\" otherwise say \"small\""));

		assertEquals("x", error.getName());
		assertEquals(1, error.getLine());
	}

	@Test
	void libraryIsImportedOnceWhateverTheUses()
	{
		String python = compile("let a be pd.Series([1, 2])\nlet b be pd.Series([3])\nsay pd.concat([a, b])");

		long imports = Arrays.stream(python.split("\n")).filter(line -> line.equals("import pandas as pd")).count();
		assertEquals(1, imports);
		assertTrue(python.startsWith("import pandas as pd\n\n"));
	}

	@Test
	void nestedBlocksKeepTheirIndentation()
	{
		assertEquals("def check(numbers):\n    for n in numbers:\n        if n > 2:\n            print(n)\n",
				compile("define a function called check that takes numbers\n"
						+ "    for each n in numbers do\n"
						+ "        if n is greater than 2 then\n"
						+ "            say n\n"));
	}

	@Test
	void compilationIsDeterministic()
	{
		String source = "wait 1 second\nlet d be datetime.now()\nsay json.dumps(1)\nsay the square root of 4\n";

		assertEquals(compile(source), compile(source));
		assertEquals(compile(source), new PlainCompiler().compile(source).getPythonSource());
	}

	@Test
	void waitPausesButWaitForAwaits()
	{
		assertEquals("import time\n\ntime.sleep(2)\n", compile("wait 2 seconds"));
		assertEquals("import asyncio\n\nasync def main():\n    await asyncio.sleep(1)\n",
				compile("define an async function called main\n    wait 1 second\n"));
		SyntaxError error = assertThrows(SyntaxError.class, () -> compile("wait for fetch()"));
		assertEquals("'wait for' can only be used inside an asynchronous function", error.getDetail());
	}

	@Test
	void repeatAndPrintRange()
	{
		assertEquals("for _ in range(3):\n    print(\"hi\")\n", compile("repeat 3 times\n    say \"hi\"\n"));
		assertEquals("for number in range(1, 5 + 1):\n    print(number)\n", compile("print numbers from 1 to 5"));
	}

	@Test
	void usingOpensAContext()
	{
		assertEquals("with open(\"data.txt\", \"r\") as f:\n    print(f.read())\n",
				compile("using open file \"data.txt\" for reading as f do\n    say f.read()\n"));
	}

	@Test
	void endpointBecomesFlaskRoute()
	{
		assertEquals("from flask import Flask\n\napp = Flask(__name__)\n@app.route(\"/hello/<name>\", methods=[\"GET\"])\n"
						+ "def get_hello_name(name):\n    return name\n",
				compile("create an api endpoint at \"/hello/<name>\" that gets and returns name"));
	}

	@Test
	void explicitImportsAreHoisted()
	{
		assertEquals("import json\n\ndata = json.loads(\"{}\")\nprint(json.dumps(data))\n",
				compile("let data be json.loads(\"{}\")\nimport json\nsay json.dumps(data)"));
		assertEquals("import requests\n", compile("use requests"));
		assertEquals("from datetime import datetime\n\nnow = datetime.now()\n", compile("let now be datetime.now()"));
	}

	@Test
	void emptyProgramIsRejected()
	{
		assertEquals("The program is empty.", assertThrows(SyntaxError.class, () -> compile("")).getDetail());
		assertEquals("The program is empty.", assertThrows(SyntaxError.class, () -> compile("# only a comment\n\n")).getDetail());
	}

	@Test
	void compileFileRequiresPlainSuffix(@TempDir Path dir) throws IOException
	{
		Path wrong = dir.resolve("notes.txt");
		Files.writeString(wrong, "say 1\n");

		assertThrows(IllegalArgumentException.class, () -> compiler.compileFile(wrong));
	}

	@Test
	void compileToFileWritesSiblingPython(@TempDir Path dir) throws IOException
	{
		Path source = dir.resolve("hello.pln");
		Files.writeString(source, "say \"héllo\"\n", StandardCharsets.UTF_8);

		Path written = compiler.compileToFile(source, null);

		assertEquals(dir.resolve("hello.py"), written);
		assertEquals("print(\"héllo\")\n", Files.readString(written, StandardCharsets.UTF_8));
	}

	@Test
	void compileToFileCreatesOutputDirectories(@TempDir Path dir) throws IOException
	{
		Path source = dir.resolve("a.pln");
		Files.writeString(source, "let x be 1\n");
		Path output = dir.resolve("build/out/a.py");

		assertEquals(output, compiler.compileToFile(source, output));
		assertEquals("x = 1\n", Files.readString(output));
	}
}
