package org.lokray.opal.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Expands effect codes ({@code cw}, {@code fr}, {@code db}, ...) into a category and value.
 */
public final class EffectShorthand
{
	/**
	 * One expanded effect, e.g. {@code io / console_write}.
	 */
	public record Effect(String category, String value)
	{
	}

	private static final Map<String, Effect> codes;

	static
	{
		Map<String, Effect> table = new HashMap<>();
		// Console and files
		table.put("cw", new Effect("io", "console_write"));
		table.put("cr", new Effect("io", "console_read"));
		table.put("fw", new Effect("io", "file_write"));
		table.put("fr", new Effect("io", "file_read"));
		table.put("fd", new Effect("io", "file_delete"));
		// Network and database
		table.put("net", new Effect("io", "network"));
		table.put("http", new Effect("io", "http"));
		table.put("db", new Effect("io", "database"));
		table.put("dbr", new Effect("io", "database_read"));
		table.put("dbw", new Effect("io", "database_write"));
		// System
		table.put("env", new Effect("io", "environment"));
		table.put("proc", new Effect("io", "process"));
		table.put("alloc", new Effect("memory", "allocation"));
		table.put("time", new Effect("nondeterminism", "time"));
		table.put("rand", new Effect("nondeterminism", "random"));
		codes = Collections.unmodifiableMap(table);
	}

	private EffectShorthand()
	{
	}

	/**
	 * @param code An effect code; unknown codes become {@code io/<code>}.
	 * @return The expanded effect.
	 */
	public static Effect expand(String code)
	{
		Effect effect = codes.get(code.toLowerCase(Locale.ROOT));
		return effect != null ? effect : new Effect("io", code);
	}

	/**
	 * Expands a list of codes and joins the values of each category with commas,
	 * keeping declaration order.
	 *
	 * @param effectCodes The codes in declaration order.
	 * @return Category to comma-joined values.
	 */
	public static Map<String, String> expandAll(List<String> effectCodes)
	{
		Map<String, String> effects = new LinkedHashMap<>();
		for (String code : effectCodes)
		{
			Effect effect = expand(code);
			effects.merge(effect.category(), effect.value(), (existing, added) -> existing + "," + added);
		}
		return effects;
	}
}
