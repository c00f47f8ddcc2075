package org.lokray.plain.imports;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered mapping from an identifier to the canonical Python import that binds it.
 * The built-in table is a classpath resource; extra tables may be appended from files.
 * When two tables bind the same name, the first registration wins.
 */
public class ImportTable
{
	private static final Logger logger = LoggerFactory.getLogger(ImportTable.class);

	public static final String RESOURCE = "/org/lokray/plain/imports/import-table.properties";

	private final Map<String, ImportEntry> entries = new LinkedHashMap<>();

	/**
	 * Loads the built-in table from the classpath.
	 */
	public static ImportTable standard()
	{
		ImportTable table = new ImportTable();
		try(InputStream in = ImportTable.class.getResourceAsStream(RESOURCE))
		{
			if(in == null)
			{
				throw new IllegalStateException("Import table resource not found: " + RESOURCE);
			}
			table.load(new InputStreamReader(in, StandardCharsets.UTF_8), RESOURCE);
		}
		catch(IOException e)
		{
			throw new UncheckedIOException("Could not read " + RESOURCE, e);
		}
		return table;
	}

	/**
	 * Appends the entries of a table file. Names already registered keep their first binding.
	 *
	 * @param file A properties file of {@code name = python import statement} lines.
	 */
	public void loadExtra(Path file) throws IOException
	{
		try(Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
		{
			load(reader, file.toString());
		}
	}

	private void load(Reader reader, String origin) throws IOException
	{
		OrderedProperties properties = new OrderedProperties();
		properties.load(reader);
		for(String name : properties.orderedKeys())
		{
			register(name, properties.getProperty(name).trim());
		}
		logger.debug("Loaded import table {} ({} names registered)", origin, entries.size());
	}

	/**
	 * Registers a name. A name that is already registered is left unchanged.
	 *
	 * @return True if the entry was added.
	 */
	public boolean register(String name, String statement)
	{
		if(!statement.startsWith("import ") && !statement.startsWith("from "))
		{
			throw new IllegalArgumentException("Not an import statement for '" + name + "': " + statement);
		}
		ImportEntry existing = entries.get(name);
		if(existing != null)
		{
			logger.debug("Ignoring duplicate import table entry '{}' ({}); keeping '{}'", name, statement, existing.getStatement());
			return false;
		}
		entries.put(name, new ImportEntry(name, statement));
		return true;
	}

	public Optional<ImportEntry> lookup(String name)
	{
		return Optional.ofNullable(entries.get(name));
	}

	public boolean contains(String name)
	{
		return entries.containsKey(name);
	}

	public Set<String> names()
	{
		return Collections.unmodifiableSet(entries.keySet());
	}

	public int size()
	{
		return entries.size();
	}
}
