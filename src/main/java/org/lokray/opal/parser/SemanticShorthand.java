package org.lokray.opal.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Expands {@code #}-prefixed parameter hints such as {@code #input} into descriptions.
 */
public final class SemanticShorthand
{
	private static final Map<String, String> descriptions;

	static
	{
		Map<String, String> table = new HashMap<>();
		table.put("#input", "user input");
		table.put("#dbid", "database identifier");
		table.put("#errmsg", "error message");
		table.put("#counter", "loop counter");
		table.put("#retval", "return value");
		table.put("#index", "array index");
		table.put("#count", "count value");
		table.put("#name", "name identifier");
		table.put("#path", "file path");
		table.put("#url", "URL");
		descriptions = Collections.unmodifiableMap(table);
	}

	private SemanticShorthand()
	{
	}

	/**
	 * @param shortcode The hint as written, e.g. {@code #input} or {@code #"custom text"}.
	 * @return The description, the text itself when it has no {@code #}, or null when empty.
	 */
	public static String expand(String shortcode)
	{
		if (shortcode == null || shortcode.isEmpty())
		{
			return null;
		}
		if (!shortcode.startsWith("#"))
		{
			return shortcode;
		}
		if (shortcode.length() >= 3 && shortcode.startsWith("#\"") && shortcode.endsWith("\""))
		{
			return shortcode.substring(2, shortcode.length() - 1);
		}

		String description = descriptions.get(shortcode.toLowerCase(Locale.ROOT));
		return description != null ? description : shortcode.substring(1);
	}
}
