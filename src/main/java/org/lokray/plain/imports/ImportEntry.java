package org.lokray.plain.imports;

import java.util.Objects;

/**
 * One row of the import table: the name a program may use, and the Python statement that binds it.
 */
public final class ImportEntry
{
	private final String name;
	private final String statement;

	public ImportEntry(String name, String statement)
	{
		this.name = Objects.requireNonNull(name);
		this.statement = Objects.requireNonNull(statement);
	}

	public String getName()
	{
		return name;
	}

	/**
	 * @return The canonical Python statement, e.g. {@code import pandas as pd}.
	 */
	public String getStatement()
	{
		return statement;
	}

	/**
	 * @return The module the statement imports from, e.g. {@code pandas} or {@code pathlib}.
	 */
	public String getModule()
	{
		String[] words = statement.split("\\s+");
		return words[1];
	}

	@Override
	public boolean equals(Object o)
	{
		if(this == o)
		{
			return true;
		}
		if(!(o instanceof ImportEntry))
		{
			return false;
		}
		ImportEntry that = (ImportEntry) o;
		return name.equals(that.name) && statement.equals(that.statement);
	}

	@Override
	public int hashCode()
	{
		return Objects.hash(name, statement);
	}

	@Override
	public String toString()
	{
		return name + " -> " + statement;
	}
}
