package org.lokray.opal.ast.expressions;

public enum UnaryOperator
{
	NOT("!"),
	NEGATE("-"),
	BIT_NOT("~");

	private final String symbol;

	UnaryOperator(String symbol)
	{
		this.symbol = symbol;
	}

	public String getSymbol()
	{
		return symbol;
	}

	/**
	 * @param spelling {@code !}, {@code not}, {@code -} or {@code ~}.
	 * @return The operator, or null if the spelling is not a unary operator.
	 */
	public static UnaryOperator fromSpelling(String spelling)
	{
		switch (spelling)
		{
			case "!":
			case "not":
				return NOT;
			case "-":
				return NEGATE;
			case "~":
				return BIT_NOT;
			default:
				return null;
		}
	}
}
