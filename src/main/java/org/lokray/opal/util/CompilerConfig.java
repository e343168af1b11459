package org.lokray.opal.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Holds configuration settings for the OPAL front-end, loaded from properties.
 * Provides sensible defaults if settings are not specified.
 */
public class CompilerConfig
{
	private static final Logger LOG = LoggerFactory.getLogger(CompilerConfig.class);

	public static final String TRACE = "opal.trace";
	public static final String DIAGNOSTICS_LIMIT = "opal.diagnostics.limit";
	public static final String KEEP_TRIVIA = "opal.lexer.keep_trivia";

	private static final String DEFAULTS_RESOURCE = "/opal.properties";

	private final boolean traceEnabled;
	private final int diagnosticsLimit;
	private final boolean keepTrivia;

	public CompilerConfig(Properties props)
	{
		this.traceEnabled = Boolean.parseBoolean(props.getProperty(TRACE, "false").trim());
		this.diagnosticsLimit = parseLimit(props.getProperty(DIAGNOSTICS_LIMIT, "0").trim());
		this.keepTrivia = Boolean.parseBoolean(props.getProperty(KEEP_TRIVIA, "false").trim());
	}

	/**
	 * @return A configuration made of the built-in defaults only.
	 */
	public static CompilerConfig defaults()
	{
		return new CompilerConfig(loadDefaults());
	}

	/**
	 * Loads the built-in defaults and overlays {@code ~/.config/opal/opal.conf} when present.
	 */
	public static CompilerConfig load()
	{
		return load(Paths.get(System.getProperty("user.home"), ".config", "opal", "opal.conf"));
	}

	/**
	 * Loads the built-in defaults and overlays the given file when it exists.
	 * An unreadable file is logged and ignored.
	 *
	 * @param configPath The user configuration file.
	 */
	public static CompilerConfig load(Path configPath)
	{
		Properties props = loadDefaults();

		if (Files.exists(configPath))
		{
			try (InputStream input = Files.newInputStream(configPath))
			{
				props.load(input);
				LOG.debug("Loaded configuration from {}", configPath);
			}
			catch (IOException e)
			{
				LOG.warn("Could not read config file at {}. Using default settings.", configPath, e);
			}
		}
		else
		{
			LOG.debug("No config file found at {}. Using default settings.", configPath);
		}
		return new CompilerConfig(props);
	}

	private static Properties loadDefaults()
	{
		Properties props = new Properties();
		try (InputStream input = CompilerConfig.class.getResourceAsStream(DEFAULTS_RESOURCE))
		{
			if (input != null)
			{
				props.load(input);
			}
		}
		catch (IOException e)
		{
			LOG.warn("Could not read built-in defaults {}", DEFAULTS_RESOURCE, e);
		}
		return props;
	}

	private static int parseLimit(String value)
	{
		int limit;
		try
		{
			limit = Integer.parseInt(value);
		}
		catch (NumberFormatException e)
		{
			throw new IllegalArgumentException(DIAGNOSTICS_LIMIT + " must be an integer, got '" + value + "'", e);
		}
		if (limit < 0)
		{
			throw new IllegalArgumentException(DIAGNOSTICS_LIMIT + " must be >= 0, got " + limit);
		}
		return limit;
	}

	public boolean isTraceEnabled()
	{
		return traceEnabled;
	}

	public int getDiagnosticsLimit()
	{
		return diagnosticsLimit;
	}

	public boolean isKeepTrivia()
	{
		return keepTrivia;
	}

	/**
	 * @return A fresh diagnostic collector honouring the configured limit.
	 */
	public DiagnosticBag newDiagnosticBag()
	{
		return new DiagnosticBag(diagnosticsLimit);
	}
}
