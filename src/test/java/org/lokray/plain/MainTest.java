package org.lokray.plain;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class MainTest
{
	@Test
	void usageErrors()
	{
		assertEquals(2, Main.run(new String[0]));
		assertEquals(2, Main.run(new String[]{"translate", "a.pln"}));
		assertEquals(2, Main.run(new String[]{"compile"}));
		assertEquals(2, Main.run(new String[]{"run"}));
	}

	@Test
	void compileWritesOutput(@TempDir Path dir) throws IOException
	{
		Path source = dir.resolve("count.pln");
		Files.writeString(source, "let total be 0\nincrease total by 2\n");
		Path output = dir.resolve("out.py");

		assertEquals(0, Main.run(new String[]{"compile", source.toString(), "-o", output.toString()}));
		assertEquals("total = 0\ntotal += 2\n", Files.readString(output));
	}

	@Test
	void compileErrorsExitWithOne(@TempDir Path dir) throws IOException
	{
		Path source = dir.resolve("broken.pln");
		Files.writeString(source, "say missing\n");

		assertEquals(1, Main.run(new String[]{"compile", source.toString()}));
		assertFalse(Files.exists(dir.resolve("broken.py")));
	}

	@Test
	void wrongSuffixIsAUsageError(@TempDir Path dir) throws IOException
	{
		Path source = dir.resolve("notes.txt");
		Files.writeString(source, "say 1\n");

		assertEquals(2, Main.run(new String[]{"compile", source.toString()}));
	}
}
