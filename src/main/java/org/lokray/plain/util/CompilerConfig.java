package org.lokray.plain.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;

/**
 * Holds configuration settings for the Plain compiler, loaded from properties.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	private static final Logger logger = LoggerFactory.getLogger(CompilerConfig.class);

	public static final String DEFAULTS_RESOURCE = "/plain.properties";

	private final int indentWidth;
	private final List<Path> extraImportTables;
	private final String pythonExecutable;
	private final boolean showGenerated;
	private final String prompt;

	public CompilerConfig(Properties props)
	{
		this.indentWidth = parseIndentWidth(props.getProperty("codegen.indent_width", "4"));
		this.extraImportTables = parsePaths(props.getProperty("imports.extra_table", ""));
		this.pythonExecutable = props.getProperty("python.executable", "python3");
		this.showGenerated = Boolean.parseBoolean(props.getProperty("repl.show_generated", "false"));
		this.prompt = props.getProperty("repl.prompt", "plain> ");
	}

	/**
	 * The configuration used when nothing is configured.
	 */
	public static CompilerConfig defaults()
	{
		return new CompilerConfig(new Properties());
	}

	/**
	 * Loads the bundled defaults, then overlays {@code ~/.config/plain/plain.conf} if it exists.
	 */
	public static CompilerConfig load()
	{
		Properties props = new Properties();
		try(InputStream in = CompilerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE))
		{
			if(in != null)
			{
				props.load(in);
			}
		}
		catch(IOException e)
		{
			logger.warn("Could not read bundled defaults {}: {}", DEFAULTS_RESOURCE, e.getMessage());
		}

		Path configPath = Paths.get(System.getProperty("user.home"), ".config", "plain", "plain.conf");
		if(Files.exists(configPath))
		{
			try(Reader reader = Files.newBufferedReader(configPath, StandardCharsets.UTF_8))
			{
				props.load(reader);
				logger.debug("Loaded configuration from {}", configPath);
			}
			catch(IOException e)
			{
				logger.warn("Could not read config file at {}. Using default settings.", configPath);
			}
		}
		return new CompilerConfig(props);
	}

	private static int parseIndentWidth(String value)
	{
		try
		{
			int width = Integer.parseInt(value.trim());
			if(width < 1 || width > 8)
			{
				throw new IllegalArgumentException("codegen.indent_width must be between 1 and 8, got " + width);
			}
			return width;
		}
		catch(NumberFormatException e)
		{
			throw new IllegalArgumentException("codegen.indent_width is not a number: " + value, e);
		}
	}

	private static List<Path> parsePaths(String value)
	{
		List<Path> paths = new ArrayList<>();
		for(String part : value.split(","))
		{
			if(!part.isBlank())
			{
				paths.add(Paths.get(part.trim()));
			}
		}
		return Collections.unmodifiableList(paths);
	}

	public int getIndentWidth()
	{
		return indentWidth;
	}

	/**
	 * @return Import table files appended after the built-in table, in order.
	 */
	public List<Path> getExtraImportTables()
	{
		return extraImportTables;
	}

	public String getPythonExecutable()
	{
		return pythonExecutable;
	}

	public boolean isShowGenerated()
	{
		return showGenerated;
	}

	public String getPrompt()
	{
		return prompt;
	}
}
