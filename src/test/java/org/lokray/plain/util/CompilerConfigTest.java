package org.lokray.plain.util;

import org.lokray.plain.PlainCompiler;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CompilerConfigTest
{
	@Test
	void defaultsApplyWhenNothingIsSet()
	{
		CompilerConfig config = CompilerConfig.defaults();

		assertEquals(4, config.getIndentWidth());
		assertEquals("python3", config.getPythonExecutable());
		assertEquals("plain> ", config.getPrompt());
		assertFalse(config.isShowGenerated());
		assertTrue(config.getExtraImportTables().isEmpty());
	}

	@Test
	void bundledDefaultsLoad()
	{
		CompilerConfig config = CompilerConfig.load();

		assertTrue(config.getIndentWidth() >= 1);
		assertNotNull(config.getPythonExecutable());
	}

	@Test
	void readsEveryKey()
	{
		Properties props = new Properties();
		props.setProperty("codegen.indent_width", " 2 ");
		props.setProperty("python.executable", "/usr/bin/python3.11");
		props.setProperty("repl.show_generated", "true");
		props.setProperty("repl.prompt", ">> ");
		props.setProperty("imports.extra_table", "a.properties, b.properties");

		CompilerConfig config = new CompilerConfig(props);

		assertEquals(2, config.getIndentWidth());
		assertEquals("/usr/bin/python3.11", config.getPythonExecutable());
		assertTrue(config.isShowGenerated());
		assertEquals(">> ", config.getPrompt());
		assertEquals(List.of(Path.of("a.properties"), Path.of("b.properties")), config.getExtraImportTables());
	}

	@Test
	void rejectsBadIndentWidths()
	{
		Properties zero = new Properties();
		zero.setProperty("codegen.indent_width", "0");
		Properties word = new Properties();
		word.setProperty("codegen.indent_width", "four");

		assertThrows(IllegalArgumentException.class, () -> new CompilerConfig(zero));
		assertThrows(IllegalArgumentException.class, () -> new CompilerConfig(word));
	}

	@Test
	void compilerUsesIndentWidthAndExtraTables(@TempDir Path dir) throws IOException
	{
		Path table = dir.resolve("team.properties");
		Files.writeString(table, "acme = import acme.tools as acme\n");
		Properties props = new Properties();
		props.setProperty("codegen.indent_width", "2");
		props.setProperty("imports.extra_table", table.toString());

		PlainCompiler compiler = new PlainCompiler(new CompilerConfig(props));

		assertEquals("for _ in range(2):\n  print(1)\n", compiler.compile("repeat 2 times\n    say 1\n").getPythonSource());
		assertEquals("import acme.tools as acme\n\nacme.run()\n", compiler.compile("acme.run()").getPythonSource());
	}
}
