package org.lokray.plain.session;

import org.lokray.plain.CompilationResult;
import org.lokray.plain.PlainCompiler;
import org.lokray.plain.runtime.ExecutionCollaborator;
import org.lokray.plain.runtime.ExecutionException;
import org.lokray.plain.runtime.ExecutionResult;
import org.lokray.plain.util.CompileError;
import org.lokray.plain.util.ErrorReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Drives an interactive session: each submitted fragment is compiled against the session and,
 * once committed, handed to the execution collaborator.
 */
public class ReplDriver
{
	private static final Logger logger = LoggerFactory.getLogger(ReplDriver.class);

	static final String CONTINUATION_PROMPT = "... ";
	static final String STATE_LOST_NOTICE = "Python was restarted, so earlier definitions are gone. Session cleared.";

	private static final Set<String> BLOCK_WORDS = Set.of("try", "attempt", "finally", "otherwise", "else",
			"no matter what", "in any case");
	private static final List<String> BLOCK_HEADS = List.of("define ", "create a class", "create an api", "make a class",
			"create a property", "make a property",
			"repeat ", "if something goes wrong", "if anything goes wrong", "catch", "except", "on error");
	private static final Pattern INLINE_BODY = Pattern.compile(" (returns|does|yields) ");

	private final PlainCompiler compiler;
	private final ExecutionCollaborator collaborator;
	private final ErrorReporter errorReporter = new ErrorReporter();
	private Session session;
	private boolean showGenerated;
	private final String prompt;

	public ReplDriver(PlainCompiler compiler, ExecutionCollaborator collaborator)
	{
		this.compiler = compiler;
		this.collaborator = collaborator;
		this.session = compiler.newSession();
		this.showGenerated = compiler.getConfig().isShowGenerated();
		this.prompt = compiler.getConfig().getPrompt();
	}

	/**
	 * Compiles and runs one fragment.
	 *
	 * @return What the collaborator reported.
	 * @throws CompileError if the fragment does not compile. Nothing is executed and the session is unchanged.
	 */
	public ExecutionResult submit(String text)
	{
		CompilationResult result = compiler.compileIncremental(session, text);
		logger.debug("Executing fragment #{}", session.getTranscript().size());
		return execute(result);
	}

	/**
	 * Runs a committed fragment. When the interpreter had to be restarted, the names and imports the
	 * session remembers no longer exist in Python, so the session starts over with it.
	 */
	private ExecutionResult execute(CompilationResult result)
	{
		ExecutionResult execution = collaborator.execute(result.getPythonSource(), result.getLineMap());
		if(execution.isStateLost())
		{
			logger.warn("Python was restarted; clearing a session of {} fragments", session.getTranscript().size());
			session = compiler.newSession();
		}
		return execution;
	}

	/**
	 * @return The source of every committed fragment, oldest first.
	 */
	public List<String> getHistory()
	{
		List<String> history = new ArrayList<>();
		for(Fragment fragment : session.getTranscript())
		{
			history.add(fragment.getText());
		}
		return history;
	}

	/**
	 * Starts over with an empty session and a fresh interpreter state.
	 */
	public void reset()
	{
		session = compiler.newSession();
		collaborator.reset();
	}

	public Session getSession()
	{
		return session;
	}

	public void setShowGenerated(boolean showGenerated)
	{
		this.showGenerated = showGenerated;
	}

	/**
	 * Reads fragments from {@code in} until end of input or {@code :quit}.
	 * A line that opens a block starts a multi-line fragment, which a blank line ends.
	 */
	public void run(BufferedReader in, PrintStream out) throws IOException
	{
		out.println("Plain REPL. Type :quit to leave, :reset to start over, :history to list what ran.");
		StringBuilder pending = new StringBuilder();
		out.print(prompt);
		out.flush();
		String line;
		while((line = in.readLine()) != null)
		{
			if(pending.length() == 0)
			{
				String command = line.trim();
				if(command.equals(":quit") || command.equals(":exit"))
				{
					break;
				}
				if(command.equals(":reset"))
				{
					reset();
					out.println("Session cleared.");
					out.print(prompt);
					out.flush();
					continue;
				}
				if(command.equals(":history"))
				{
					List<String> history = getHistory();
					for(int i = 0; i < history.size(); i++)
					{
						out.println((i + 1) + ": " + history.get(i).strip().replace("\n", "\n   "));
					}
					out.print(prompt);
					out.flush();
					continue;
				}
				if(command.isEmpty())
				{
					out.print(prompt);
					out.flush();
					continue;
				}
			}

			boolean multiLine = pending.length() > 0;
			if(multiLine && line.isBlank())
			{
				evaluate(pending.toString(), out);
				pending.setLength(0);
				out.print(prompt);
				out.flush();
				continue;
			}

			pending.append(line).append('\n');
			if(multiLine || opensBlock(line))
			{
				out.print(CONTINUATION_PROMPT);
			}
			else
			{
				evaluate(pending.toString(), out);
				pending.setLength(0);
				out.print(prompt);
			}
			out.flush();
		}
		if(pending.length() > 0)
		{
			evaluate(pending.toString(), out);
		}
		out.println();
	}

	/**
	 * A line opens a block when it ends with a colon, "do" or "then", is a bare block word such as "try",
	 * or starts a definition, loop or handler without an inline body.
	 */
	static boolean opensBlock(String line)
	{
		String trimmed = line.strip().toLowerCase(Locale.ROOT);
		if(trimmed.endsWith(":") || trimmed.equals("do") || trimmed.endsWith(" do")
				|| trimmed.equals("then") || trimmed.endsWith(" then"))
		{
			return true;
		}
		if(BLOCK_WORDS.contains(trimmed))
		{
			return true;
		}
		for(String head : BLOCK_HEADS)
		{
			if(trimmed.startsWith(head))
			{
				return !INLINE_BODY.matcher(trimmed).find();
			}
		}
		return false;
	}

	private void evaluate(String text, PrintStream out)
	{
		try
		{
			CompilationResult result = compiler.compileIncremental(session, text);
			if(showGenerated)
			{
				out.println(result.getPythonSource().stripTrailing());
			}
			ExecutionResult execution = execute(result);
			if(execution.isStateLost())
			{
				out.println(STATE_LOST_NOTICE);
			}
			out.print(execution.getStdout());
			out.print(execution.getStderr());
		}
		catch(CompileError e)
		{
			out.println(errorReporter.report(e, text));
		}
		catch(ExecutionException e)
		{
			logger.warn("Execution failed", e);
			out.println("Could not run the fragment: " + e.getMessage());
		}
	}
}
