package org.lokray.plain.semantics;

import org.lokray.plain.imports.ImportEntry;
import org.lokray.plain.imports.ImportTable;
import org.lokray.plain.lexer.Token;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * The state one unit of analysis works on: a checkpoint copy of the global scope,
 * the imports already committed before it, and the imports it newly requires.
 * Nothing here is visible to a session until the unit is committed.
 */
public class AnalysisContext
{
	private static final Logger logger = LoggerFactory.getLogger(AnalysisContext.class);

	private final Scope globals;
	private final ImportTable importTable;
	private final Set<String> committedImports;
	private final Set<String> requiredImports = new LinkedHashSet<>();

	/**
	 * @param globals          The global scope to analyze in. Callers pass a copy when they may need to roll back.
	 * @param importTable      The table consulted for unbound names.
	 * @param committedImports Import lines already emitted by earlier units.
	 */
	public AnalysisContext(Scope globals, ImportTable importTable, Set<String> committedImports)
	{
		this.globals = globals;
		this.importTable = importTable;
		this.committedImports = Collections.unmodifiableSet(new LinkedHashSet<>(committedImports));
	}

	/**
	 * Binds {@code name} through the import table if it has an entry.
	 * The import is recorded and a module alias symbol is defined in the global scope.
	 *
	 * @return The bound symbol, or empty if the table does not know the name.
	 */
	public Optional<Symbol> autoImport(String name, Token at)
	{
		Optional<ImportEntry> entry = importTable.lookup(name);
		if(entry.isEmpty())
		{
			return Optional.empty();
		}
		String statement = entry.get().getStatement();
		requireImport(statement);
		ModuleAliasSymbol symbol = new ModuleAliasSymbol(name, at, statement);
		globals.define(symbol);
		logger.debug("Auto-imported '{}' with '{}'", name, statement);
		return Optional.of(symbol);
	}

	/**
	 * Records an import line unless an earlier unit or this one already has it.
	 */
	public void requireImport(String statement)
	{
		if(!committedImports.contains(statement))
		{
			requiredImports.add(statement);
		}
	}

	/**
	 * Returns the canonical statement the table holds for {@code name}, if any.
	 */
	public Optional<String> canonicalImport(String name)
	{
		return importTable.lookup(name).map(ImportEntry::getStatement);
	}

	public Scope getGlobals()
	{
		return globals;
	}

	public ImportTable getImportTable()
	{
		return importTable;
	}

	/**
	 * @return Import lines newly required by this unit, in first-required order.
	 */
	public Set<String> getRequiredImports()
	{
		return Collections.unmodifiableSet(requiredImports);
	}
}
