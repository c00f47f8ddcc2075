package org.lokray.plain;

import org.lokray.plain.ast.Program;
import org.lokray.plain.codegen.GeneratedCode;
import org.lokray.plain.codegen.PythonGenerator;
import org.lokray.plain.grammar.GrammarResolver;
import org.lokray.plain.imports.ImportTable;
import org.lokray.plain.lexer.Lexer;
import org.lokray.plain.lexer.Token;
import org.lokray.plain.parser.PlainParser;
import org.lokray.plain.semantics.AnalysisContext;
import org.lokray.plain.semantics.SemanticAnalyzer;
import org.lokray.plain.session.Fragment;
import org.lokray.plain.session.FragmentState;
import org.lokray.plain.session.Session;
import org.lokray.plain.util.CompileError;
import org.lokray.plain.util.CompilerConfig;
import org.lokray.plain.util.SyntaxError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point of the compiler pipeline: source text, lexer, parser, semantic analyzer, Python generator.
 * Whole programs compile in a throwaway {@link Session}; REPL fragments compile against a caller-owned one.
 */
public class PlainCompiler
{
	private static final Logger logger = LoggerFactory.getLogger(PlainCompiler.class);

	public static final String SOURCE_SUFFIX = ".pln";

	private final CompilerConfig config;
	private final GrammarResolver grammar;
	private final ImportTable importTable;

	public PlainCompiler()
	{
		this(CompilerConfig.defaults());
	}

	public PlainCompiler(CompilerConfig config)
	{
		this.config = config;
		this.grammar = GrammarResolver.standard();
		this.importTable = ImportTable.standard();
		for(Path extra : config.getExtraImportTables())
		{
			try
			{
				importTable.loadExtra(extra);
			}
			catch(IOException e)
			{
				throw new UncheckedIOException("Could not read import table " + extra, e);
			}
		}
	}

	/**
	 * @return A new, empty session for incremental compilation.
	 */
	public Session newSession()
	{
		return new Session(importTable);
	}

	/**
	 * Compiles a whole program.
	 *
	 * @throws CompileError on the first error in the program.
	 */
	public CompilationResult compile(String text)
	{
		return compileIncremental(newSession(), text);
	}

	/**
	 * Compiles a fragment against a session. The session changes only if the fragment compiles.
	 *
	 * @throws CompileError on the first error in the fragment; the session is then left as it was.
	 */
	public CompilationResult compileIncremental(Session session, String text)
	{
		Fragment fragment = new Fragment(text);
		try
		{
			if(text.isBlank())
			{
				throw new SyntaxError(1, 1, "The program is empty.");
			}
			List<Token> tokens = new Lexer(text).scanTokens();
			fragment.advance(FragmentState.LEXED);

			Program program = new PlainParser(tokens, grammar).parse();
			if(program.getBody().getStatements().isEmpty())
			{
				throw new SyntaxError(1, 1, "The program is empty.");
			}
			fragment.advance(FragmentState.PARSED);

			AnalysisContext context = session.checkpoint();
			new SemanticAnalyzer(context).analyze(program);
			fragment.advance(FragmentState.ANALYZED);

			GeneratedCode code = new PythonGenerator(config.getIndentWidth()).generate(program, context.getRequiredImports());
			fragment.advance(FragmentState.GENERATED);

			CompilationResult result = new CompilationResult(code.getSource(), code.getLineMap(), new ArrayList<>(context.getRequiredImports()));
			session.commit(fragment, context, result);
			return result;
		}
		catch(CompileError e)
		{
			fragment.reject(e);
			logger.info("Rejected fragment: {}", e.getMessage());
			throw e;
		}
	}

	/**
	 * Compiles a {@code .pln} file.
	 *
	 * @throws IllegalArgumentException if the file does not have the {@code .pln} suffix.
	 */
	public CompilationResult compileFile(Path source) throws IOException
	{
		String name = source.getFileName().toString();
		if(!name.endsWith(SOURCE_SUFFIX))
		{
			throw new IllegalArgumentException("Plain source files must end in " + SOURCE_SUFFIX + ": " + source);
		}
		logger.debug("Compiling {}", source);
		return compile(Files.readString(source, StandardCharsets.UTF_8));
	}

	/**
	 * Compiles a {@code .pln} file and writes the Python next to it, or to {@code output} if given.
	 *
	 * @return The path written.
	 */
	public Path compileToFile(Path source, Path output) throws IOException
	{
		CompilationResult result = compileFile(source);
		Path target = output;
		if(target == null)
		{
			String name = source.getFileName().toString();
			target = source.resolveSibling(name.substring(0, name.length() - SOURCE_SUFFIX.length()) + ".py");
		}
		Path parent = target.toAbsolutePath().getParent();
		if(parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(target, result.getPythonSource(), StandardCharsets.UTF_8);
		logger.info("Wrote {}", target);
		return target;
	}

	public CompilerConfig getConfig()
	{
		return config;
	}

	public ImportTable getImportTable()
	{
		return importTable;
	}
}
