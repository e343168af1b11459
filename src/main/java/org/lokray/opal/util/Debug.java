package org.lokray.opal.util;

import org.slf4j.Logger;

/**
 * Indented trace output for the lexer and parser.
 * Each lexer or parser owns its own instance, so the indentation level is never shared.
 */
public class Debug
{
	private final Logger logger;
	private final boolean enabled; // Master switch, from the opal.trace setting
	private int indentLevel = 0;

	public Debug(Logger logger, boolean enabled)
	{
		this.logger = logger;
		this.enabled = enabled;
	}

	/**
	 * Logs a formatted message if tracing is enabled.
	 *
	 * @param format The message format string (e.g., "Parsed call: %s").
	 * @param args   The arguments to format into the message.
	 */
	public void log(String format, Object... args)
	{
		if (enabled && logger.isDebugEnabled())
		{
			String indent = "  ".repeat(indentLevel);
			logger.debug("{}{}", indent, String.format(format, args));
		}
	}

	/**
	 * Increases the indentation level for subsequent log messages.
	 */
	public void indent()
	{
		if (enabled)
		{
			indentLevel++;
		}
	}

	/**
	 * Decreases the indentation level for subsequent log messages.
	 */
	public void dedent()
	{
		if (enabled)
		{
			indentLevel = Math.max(0, indentLevel - 1);
		}
	}

	public boolean isEnabled()
	{
		return enabled;
	}
}
