package org.lokray.plain;

import org.lokray.plain.runtime.ExecutionResult;
import org.lokray.plain.runtime.PythonProcessCollaborator;
import org.lokray.plain.session.ReplDriver;
import org.lokray.plain.util.CompileError;
import org.lokray.plain.util.CompilerConfig;
import org.lokray.plain.util.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line entry point.
 * <pre>
 * plain compile &lt;file.pln&gt; [-o out.py]
 * plain run &lt;file.pln&gt;
 * plain repl [--show-python]
 * </pre>
 */
public class Main
{
	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	static int run(String[] args)
	{
		if(args.length == 0)
		{
			printUsage();
			return 2;
		}

		CompilerConfig config;
		try
		{
			config = CompilerConfig.load();
		}
		catch(IllegalArgumentException e)
		{
			System.err.println("Error: bad configuration: " + e.getMessage());
			return 2;
		}

		String command = args[0];
		List<String> rest = new ArrayList<>(List.of(args).subList(1, args.length));
		switch(command)
		{
			case "compile":
				return compile(new PlainCompiler(config), rest);
			case "run":
				return runFile(new PlainCompiler(config), config, rest);
			case "repl":
				return repl(new PlainCompiler(config), config, rest);
			default:
				System.err.println("Error: unknown command '" + command + "'");
				printUsage();
				return 2;
		}
	}

	private static void printUsage()
	{
		System.err.println("Usage: plain compile <file.pln> [-o out.py]");
		System.err.println("   or: plain run <file.pln>");
		System.err.println("   or: plain repl [--show-python]");
	}

	private static int compile(PlainCompiler compiler, List<String> args)
	{
		Path input = null;
		Path output = null;
		for(int i = 0; i < args.size(); i++)
		{
			String arg = args.get(i);
			if(arg.equals("-o") && i + 1 < args.size())
			{
				output = Paths.get(args.get(++i));
			}
			else if(input == null)
			{
				input = Paths.get(arg);
			}
			else
			{
				System.err.println("Error: unexpected argument '" + arg + "'");
				return 2;
			}
		}
		if(input == null)
		{
			printUsage();
			return 2;
		}
		try
		{
			Path written = compiler.compileToFile(input, output);
			System.out.println("Wrote " + written);
			return 0;
		}
		catch(CompileError e)
		{
			System.err.println(ErrorReporter.format(e, readQuietly(input)));
			return 1;
		}
		catch(IllegalArgumentException | IOException e)
		{
			System.err.println("Error: " + e.getMessage());
			return 2;
		}
	}

	private static int runFile(PlainCompiler compiler, CompilerConfig config, List<String> args)
	{
		if(args.size() != 1)
		{
			printUsage();
			return 2;
		}
		Path input = Paths.get(args.get(0));
		CompilationResult result;
		try
		{
			result = compiler.compileFile(input);
		}
		catch(CompileError e)
		{
			System.err.println(ErrorReporter.format(e, readQuietly(input)));
			return 1;
		}
		catch(IllegalArgumentException | IOException e)
		{
			System.err.println("Error: " + e.getMessage());
			return 2;
		}

		try(PythonProcessCollaborator python = new PythonProcessCollaborator(config.getPythonExecutable()))
		{
			ExecutionResult execution = python.execute(result.getPythonSource(), result.getLineMap());
			System.out.print(execution.getStdout());
			System.err.print(execution.getStderr());
			return execution.getExitStatus();
		}
		catch(RuntimeException e)
		{
			logger.warn("Could not run {}", input, e);
			System.err.println("Error: could not run Python: " + e.getMessage());
			return 2;
		}
	}

	private static int repl(PlainCompiler compiler, CompilerConfig config, List<String> args)
	{
		try(PythonProcessCollaborator python = new PythonProcessCollaborator(config.getPythonExecutable()))
		{
			ReplDriver driver = new ReplDriver(compiler, python);
			if(args.contains("--show-python"))
			{
				driver.setShowGenerated(true);
			}
			driver.run(new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)), System.out);
			return 0;
		}
		catch(IOException e)
		{
			System.err.println("Error: " + e.getMessage());
			return 2;
		}
	}

	private static String readQuietly(Path file)
	{
		try
		{
			return Files.readString(file, StandardCharsets.UTF_8);
		}
		catch(IOException e)
		{
			logger.debug("Could not re-read {} for the diagnostic", file, e);
			return null;
		}
	}
}
