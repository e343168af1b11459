package org.lokray.opal.ast.expressions;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Binary operators of the prefix form {@code (op a b)}. Each operator has one symbol
 * and may have word aliases ({@code and}, {@code eq}, {@code lte}, ...).
 */
public enum BinaryOperator
{
	ADD("+"),
	SUBTRACT("-"),
	MULTIPLY("*"),
	DIVIDE("/"),
	MODULO("%", "mod"),
	POWER("**"),
	EQUAL("==", "eq"),
	NOT_EQUAL("!=", "ne", "neq"),
	LESS("<", "lt"),
	LESS_OR_EQUAL("<=", "le", "lte"),
	GREATER(">", "gt"),
	GREATER_OR_EQUAL(">=", "ge", "gte"),
	AND("&&", "and"),
	OR("||", "or"),
	BIT_AND("&"),
	BIT_OR("|"),
	BIT_XOR("^"),
	SHIFT_LEFT("<<"),
	SHIFT_RIGHT(">>");

	private static final Map<String, BinaryOperator> bySpelling;

	static
	{
		Map<String, BinaryOperator> table = new HashMap<>();
		for (BinaryOperator operator : values())
		{
			table.put(operator.symbol, operator);
			for (String alias : operator.aliases)
			{
				table.put(alias, operator);
			}
		}
		bySpelling = Collections.unmodifiableMap(table);
	}

	private final String symbol;
	private final String[] aliases;

	BinaryOperator(String symbol, String... aliases)
	{
		this.symbol = symbol;
		this.aliases = aliases;
	}

	public String getSymbol()
	{
		return symbol;
	}

	/**
	 * @param spelling A symbol such as {@code +} or a word alias such as {@code and}.
	 * @return The operator, or null if the spelling is not a binary operator.
	 */
	public static BinaryOperator fromSpelling(String spelling)
	{
		return bySpelling.get(spelling);
	}
}
