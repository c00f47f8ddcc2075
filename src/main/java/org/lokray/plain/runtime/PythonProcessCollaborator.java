package org.lokray.plain.runtime;

import org.lokray.plain.codegen.LineMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Runs generated Python in one long-lived interpreter process, so that consecutive fragments share globals.
 * <p>
 * A small bootstrap loop in the interpreter reads a line count and that many lines of code,
 * executes them under the file name {@code <plain>}, and ends each output stream with a marker line
 * that carries the exit status. Two reader threads drain the streams.
 */
public class PythonProcessCollaborator implements ExecutionCollaborator
{
	private static final Logger logger = LoggerFactory.getLogger(PythonProcessCollaborator.class);

	private static final String MARKER = "\u0001PLAIN_END";
	private static final String CLOSED = "\u0001PLAIN_CLOSED"; // queued when a stream reaches end of file

	private static final String BOOTSTRAP = String.join("\n",
			"import sys, traceback",
			"g = {'__name__': '__main__'}",
			"while True:",
			"    header = sys.stdin.readline()",
			"    if not header:",
			"        break",
			"    if header.strip() == 'RESET':",
			"        g = {'__name__': '__main__'}",
			"        continue",
			"    code = ''.join(sys.stdin.readline() for _ in range(int(header)))",
			"    status = 0",
			"    try:",
			"        exec(compile(code, '" + LineMap.SOURCE_NAME + "', 'exec'), g)",
			"    except SystemExit as e:",
			"        status = e.code if isinstance(e.code, int) else (0 if e.code is None else 1)",
			"    except BaseException:",
			"        traceback.print_exc()",
			"        status = 1",
			"    sys.stderr.write('" + MARKER.replace("\u0001", "\\x01") + "\\n')",
			"    sys.stderr.flush()",
			"    sys.stdout.write('" + MARKER.replace("\u0001", "\\x01") + " %d\\n' % status)",
			"    sys.stdout.flush()",
			"");

	private final String pythonExecutable;
	private Process process;
	private Writer stdin;
	private BlockingQueue<String> stdoutLines;
	private BlockingQueue<String> stderrLines;
	private boolean everStarted;

	public PythonProcessCollaborator(String pythonExecutable)
	{
		this.pythonExecutable = pythonExecutable;
	}

	@Override
	public synchronized ExecutionResult execute(String pythonSource, LineMap lineMap)
	{
		boolean stateLost = ensureStarted();
		List<String> lines = splitLines(pythonSource);
		try
		{
			stdin.write(lines.size() + "\n");
			for(String line : lines)
			{
				stdin.write(line);
				stdin.write('\n');
			}
			stdin.flush();
		}
		catch(IOException e)
		{
			stop();
			throw new ExecutionException("Could not send code to " + pythonExecutable, e);
		}

		StringBuilder out = new StringBuilder();
		int status = drain(stdoutLines, out);
		StringBuilder err = new StringBuilder();
		drain(stderrLines, err);
		if(status == Integer.MIN_VALUE)
		{
			logger.warn("Python process ended unexpectedly");
			stop();
			status = 1;
			stateLost = true;
		}
		return new ExecutionResult(status, out.toString(), lineMap.translate(err.toString()), stateLost);
	}

	/**
	 * Collects lines up to the marker.
	 *
	 * @return The status carried by the marker, 0 for a marker without one, or {@code Integer.MIN_VALUE} at end of stream.
	 */
	private static int drain(BlockingQueue<String> queue, StringBuilder sink)
	{
		while(true)
		{
			String line;
			try
			{
				line = queue.take();
			}
			catch(InterruptedException e)
			{
				Thread.currentThread().interrupt();
				throw new ExecutionException("Interrupted while waiting for Python", e);
			}
			if(line.equals(CLOSED))
			{
				return Integer.MIN_VALUE;
			}
			int marker = line.indexOf(MARKER);
			if(marker >= 0)
			{
				sink.append(line, 0, marker);
				String status = line.substring(marker + MARKER.length()).trim();
				return status.isEmpty() ? 0 : Integer.parseInt(status);
			}
			sink.append(line).append('\n');
		}
	}

	private static List<String> splitLines(String source)
	{
		List<String> lines = new ArrayList<>(List.of(source.split("\n", -1)));
		if(!lines.isEmpty() && lines.get(lines.size() - 1).isEmpty())
		{
			lines.remove(lines.size() - 1);
		}
		return lines;
	}

	/**
	 * Starts the interpreter if it is not running.
	 *
	 * @return True if an earlier interpreter, and the globals it held, had to be replaced.
	 */
	private boolean ensureStarted()
	{
		if(process != null && process.isAlive())
		{
			return false;
		}
		boolean restarted = everStarted;
		ProcessBuilder builder = new ProcessBuilder(pythonExecutable, "-u", "-c", BOOTSTRAP);
		builder.environment().put("PYTHONIOENCODING", "utf-8");
		try
		{
			process = builder.start();
		}
		catch(IOException e)
		{
			throw new ExecutionException("Could not start " + pythonExecutable, e);
		}
		stdin = new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8);
		stdoutLines = new LinkedBlockingQueue<>();
		stderrLines = new LinkedBlockingQueue<>();
		startReader("plain-python-stdout", process.getInputStream(), stdoutLines);
		startReader("plain-python-stderr", process.getErrorStream(), stderrLines);
		logger.debug("Started {} (pid {})", pythonExecutable, process.pid());
		if(restarted)
		{
			logger.warn("Restarted {}; earlier definitions are gone", pythonExecutable);
		}
		everStarted = true;
		return restarted;
	}

	private static void startReader(String name, InputStream stream, BlockingQueue<String> sink)
	{
		Thread reader = new Thread(() -> {
			try(BufferedReader in = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8)))
			{
				String line;
				while((line = in.readLine()) != null)
				{
					sink.add(line);
				}
			}
			catch(IOException e)
			{
				logger.warn("{} stopped: {}", name, e.getMessage());
			}
			finally
			{
				sink.add(CLOSED);
			}
		}, name);
		reader.setDaemon(true);
		reader.start();
	}

	@Override
	public synchronized void reset()
	{
		if(process == null || !process.isAlive())
		{
			everStarted = false; // the next interpreter starts empty, as a reset asks
			return;
		}
		try
		{
			stdin.write("RESET\n");
			stdin.flush();
		}
		catch(IOException e)
		{
			logger.warn("Could not reset Python globals, restarting: {}", e.getMessage());
			stop();
			everStarted = false;
		}
	}

	@Override
	public synchronized void close()
	{
		stop();
	}

	private void stop()
	{
		if(process == null)
		{
			return;
		}
		try
		{
			stdin.close();
		}
		catch(IOException e)
		{
			logger.debug("Closing Python stdin failed: {}", e.getMessage());
		}
		process.destroy();
		process = null;
	}
}
