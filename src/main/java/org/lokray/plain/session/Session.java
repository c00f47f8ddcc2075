package org.lokray.plain.session;

import org.lokray.plain.CompilationResult;
import org.lokray.plain.imports.ImportTable;
import org.lokray.plain.semantics.AnalysisContext;
import org.lokray.plain.semantics.Builtins;
import org.lokray.plain.semantics.Scope;
import org.lokray.plain.semantics.ScopeKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The accumulated state of a REPL: the global scope, the imports already emitted,
 * and the transcript of committed fragments. A session only changes when a fragment is committed.
 */
public class Session
{
	private static final Logger logger = LoggerFactory.getLogger(Session.class);

	private final ImportTable importTable;
	private final Scope builtins = Builtins.createScope();
	private Scope globals;
	private final Set<String> committedImports = new LinkedHashSet<>();
	private final List<Fragment> transcript = new ArrayList<>();

	public Session(ImportTable importTable)
	{
		this.importTable = importTable;
		this.globals = newGlobals();
	}

	private Scope newGlobals()
	{
		return new Scope(builtins, "global", ScopeKind.GLOBAL);
	}

	/**
	 * Creates an analysis context over a copy of the session's state.
	 * Whatever the analysis does to it stays invisible until {@link #commit}.
	 */
	public AnalysisContext checkpoint()
	{
		return new AnalysisContext(globals.copy(), importTable, committedImports);
	}

	/**
	 * Adopts the state of a successful analysis and records the fragment.
	 */
	public void commit(Fragment fragment, AnalysisContext context, CompilationResult result)
	{
		fragment.advance(FragmentState.COMMITTED);
		fragment.attach(result);
		globals = context.getGlobals();
		committedImports.addAll(context.getRequiredImports());
		transcript.add(fragment);
		logger.info("Committed fragment #{} ({} new imports)", transcript.size(), context.getRequiredImports().size());
	}

	/**
	 * Forgets every committed fragment.
	 */
	public void reset()
	{
		globals = newGlobals();
		committedImports.clear();
		transcript.clear();
		logger.info("Session reset");
	}

	public Scope getGlobals()
	{
		return globals;
	}

	public Set<String> getCommittedImports()
	{
		return Collections.unmodifiableSet(committedImports);
	}

	public List<Fragment> getTranscript()
	{
		return Collections.unmodifiableList(transcript);
	}

	public ImportTable getImportTable()
	{
		return importTable;
	}
}
