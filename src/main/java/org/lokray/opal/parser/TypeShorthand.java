package org.lokray.opal.parser;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Expands compact type codes into canonical type descriptors.
 * {@code ?T} is an option of T, {@code T!E} a result of T or E (E defaults to STRING),
 * and primitive codes such as {@code i32} or {@code str} map through a fixed table.
 */
public final class TypeShorthand
{
	private static final Map<String, String> primitives;

	static
	{
		Map<String, String> table = new HashMap<>();
		table.put("i8", "INT[bits=8][signed=true]");
		table.put("i16", "INT[bits=16][signed=true]");
		table.put("i32", "INT");
		table.put("int", "INT");
		table.put("i64", "INT[bits=64][signed=true]");
		table.put("u8", "INT[bits=8][signed=false]");
		table.put("u16", "INT[bits=16][signed=false]");
		table.put("u32", "INT[bits=32][signed=false]");
		table.put("u64", "INT[bits=64][signed=false]");
		table.put("f32", "FLOAT[bits=32]");
		table.put("f64", "FLOAT");
		table.put("float", "FLOAT");
		table.put("str", "STRING");
		table.put("string", "STRING");
		table.put("bool", "BOOL");
		table.put("void", "VOID");
		table.put("never", "NEVER");
		table.put("char", "CHAR");
		primitives = Collections.unmodifiableMap(table);
	}

	private TypeShorthand()
	{
	}

	/**
	 * @param compactType A type as written in a positional attribute.
	 * @return The canonical descriptor; unknown names come back unchanged.
	 */
	public static String expand(String compactType)
	{
		if (compactType == null || compactType.isEmpty())
		{
			return compactType;
		}

		if (compactType.startsWith("?"))
		{
			return "OPTION[inner=" + expand(compactType.substring(1)) + "]";
		}

		int bang = compactType.indexOf('!');
		if (bang >= 0)
		{
			String ok = expand(compactType.substring(0, bang));
			String errorPart = compactType.substring(bang + 1);
			String err = errorPart.isEmpty() ? "STRING" : expand(errorPart);
			return "RESULT[ok=" + ok + "][err=" + err + "]";
		}

		String primitive = primitives.get(compactType.toLowerCase(Locale.ROOT));
		return primitive != null ? primitive : compactType;
	}

	/**
	 * @return True if the code is one of the primitive shorthands, case-insensitively.
	 */
	public static boolean isPrimitive(String code)
	{
		return code != null && primitives.containsKey(code.toLowerCase(Locale.ROOT));
	}
}
