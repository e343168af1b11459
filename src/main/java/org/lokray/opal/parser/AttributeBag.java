package org.lokray.opal.parser;

import org.lokray.opal.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The attributes read from the bracket groups after one tag.
 * Named (v1) entries are stored under their names; positional (v2) entries under
 * {@code _pos0}, {@code _pos1}, ... with the total under {@code _posCount}.
 * Keys keep insertion order and a key may carry several values. Values read from source
 * also remember the tokens they were read from.
 */
public class AttributeBag
{
	public static final String POSITION_PREFIX = "_pos";
	public static final String POSITION_COUNT = "_posCount";

	private final Map<String, List<String>> entries = new LinkedHashMap<>();
	private final Map<String, List<Token>> sources = new HashMap<>(); // Tokens of the first value under each key

	/**
	 * Appends a value under a key.
	 *
	 * @param key   The attribute name.
	 * @param value The attribute value.
	 */
	public void add(String key, String value)
	{
		entries.computeIfAbsent(key, k -> new ArrayList<>()).add(value);
	}

	void add(String key, String value, List<Token> tokens)
	{
		add(key, value);
		if (!tokens.isEmpty())
		{
			sources.putIfAbsent(key, List.copyOf(tokens));
		}
	}

	/**
	 * Replaces every value under a key with a single value.
	 */
	public void set(String key, String value)
	{
		List<String> values = new ArrayList<>();
		values.add(value);
		entries.put(key, values);
	}

	/**
	 * @param key The attribute name.
	 * @return The first value stored under the key, or null.
	 */
	public String get(String key)
	{
		List<String> values = entries.get(key);
		return values == null || values.isEmpty() ? null : values.get(0);
	}

	public String getOrEmpty(String key)
	{
		String value = get(key);
		return value == null ? "" : value;
	}

	/**
	 * @return True if the key carries a non-empty value.
	 */
	public boolean has(String key)
	{
		String value = get(key);
		return value != null && !value.isEmpty();
	}

	/**
	 * @param index The positional slot.
	 * @return The value in {@code _pos<index>}, or null.
	 */
	public String positional(int index)
	{
		return get(POSITION_PREFIX + index);
	}

	public String positionalOrEmpty(int index)
	{
		String value = positional(index);
		return value == null ? "" : value;
	}

	/**
	 * @return The number of positional values, 0 if the tag had none.
	 */
	public int positionalCount()
	{
		String count = get(POSITION_COUNT);
		if (count == null)
		{
			return 0;
		}
		try
		{
			return Integer.parseInt(count);
		}
		catch (NumberFormatException e)
		{
			return 0;
		}
	}

	/**
	 * @return The positional values in slot order.
	 */
	public List<String> positionals()
	{
		List<String> values = new ArrayList<>();
		int count = positionalCount();
		for (int i = 0; i < count; i++)
		{
			values.add(positionalOrEmpty(i));
		}
		return values;
	}

	/**
	 * Appends a positional value at the next free slot and updates the count.
	 *
	 * @param value The value to store.
	 */
	void addPositional(String value, List<Token> tokens)
	{
		int index = positionalCount();
		set(POSITION_PREFIX + index, value);
		set(POSITION_COUNT, Integer.toString(index + 1));
		if (!tokens.isEmpty())
		{
			sources.put(POSITION_PREFIX + index, List.copyOf(tokens));
		}
	}

	/**
	 * Returns the tokens a value was read from: the named value {@code key} when present,
	 * otherwise positional slot {@code index}.
	 *
	 * @return The tokens in source order; empty when the value was not read from source.
	 */
	public List<Token> source(String key, int index)
	{
		List<Token> tokens = sources.get(key);
		if (tokens == null)
		{
			tokens = sources.get(POSITION_PREFIX + index);
		}
		return tokens == null ? List.of() : tokens;
	}

	public boolean isEmpty()
	{
		return entries.isEmpty();
	}

	/**
	 * @return A read-only snapshot of every key and its values.
	 */
	public Map<String, List<String>> asMap()
	{
		Map<String, List<String>> copy = new LinkedHashMap<>();
		for (Map.Entry<String, List<String>> entry : entries.entrySet())
		{
			copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
		}
		return Collections.unmodifiableMap(copy);
	}

	@Override
	public String toString()
	{
		return "AttributeBag" + entries;
	}
}
