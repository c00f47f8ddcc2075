package org.lokray.plain.imports;

import org.lokray.plain.PlainCompiler;
import org.lokray.plain.session.Session;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class ImportTableTest
{
	private static final PlainCompiler COMPILER = new PlainCompiler();

	@Test
	void standardTableCoversCommonLibraries()
	{
		ImportTable table = ImportTable.standard();

		assertTrue(table.size() >= 50, "only " + table.size() + " entries");
		assertEquals("import pandas as pd", table.lookup("pd").orElseThrow().getStatement());
		assertEquals("from pathlib import Path", table.lookup("Path").orElseThrow().getStatement());
		assertEquals("pathlib", table.lookup("Path").orElseThrow().getModule());
		assertFalse(table.contains("print"));
	}

	@Test
	void tableKeepsFileOrder()
	{
		List<String> names = new ArrayList<>(ImportTable.standard().names());

		assertEquals("json", names.get(0));
		assertTrue(names.indexOf("os") < names.indexOf("pd"));
	}

	@Test
	void firstRegistrationWins()
	{
		ImportTable table = new ImportTable();

		assertTrue(table.register("np", "import numpy as np"));
		assertFalse(table.register("np", "import numpy.random as np"));
		assertEquals("import numpy as np", table.lookup("np").orElseThrow().getStatement());
	}

	@Test
	void rejectsEntriesThatAreNotImports()
	{
		assertThrows(IllegalArgumentException.class, () -> new ImportTable().register("x", "x = 1"));
	}

	@Test
	void extraTablesAppendWithoutOverriding(@TempDir Path dir) throws IOException
	{
		Path extra = dir.resolve("extra.properties");
		Files.writeString(extra, "# team libraries\nacme = import acme\njson = import simplejson as json\n");
		ImportTable table = ImportTable.standard();
		int before = table.size();

		table.loadExtra(extra);

		assertEquals(before + 1, table.size());
		assertEquals("import acme", table.lookup("acme").orElseThrow().getStatement());
		assertEquals("import json", table.lookup("json").orElseThrow().getStatement());
	}

	static Stream<String> tableNames()
	{
		return ImportTable.standard().names().stream();
	}

	@ParameterizedTest
	@MethodSource("tableNames")
	void everyNameIsImportedExactlyOnceAcrossFragments(String name)
	{
		String statement = COMPILER.getImportTable().lookup(name).orElseThrow().getStatement();
		Session session = COMPILER.newSession();
		StringBuilder generated = new StringBuilder();
		for(int i = 0; i < 3; i++)
		{
			generated.append(COMPILER.compileIncremental(session, "say " + name).getPythonSource());
		}

		long count = Arrays.stream(generated.toString().split("\n")).filter(statement::equals).count();
		assertEquals(1, count, generated.toString());
	}
}
