package org.lokray.opal.lexer;

import java.util.Objects;

/**
 * A single token produced by the OPAL Lexer.
 * Each token carries its type, the raw text it was scanned from, an optional
 * typed value for literals, and the span it occupies in the source.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, INT_LITERAL, MODULE)
	private final String lexeme;     // The raw text of the token (e.g., "§M", "INT:5", "\"hi\"")
	private final Object literal;    // Long, Double, Boolean or String for literals; the name for identifiers
	private final Span span;         // Where the token sits in the source

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type    The TokenType of this token.
	 * @param lexeme  The raw text of the token from the source.
	 * @param literal The typed value for literal tokens, or null.
	 * @param span    The source region the token occupied.
	 */
	public Token(TokenType type, String lexeme, Object literal, Span span)
	{
		this.type = Objects.requireNonNull(type, "type");
		this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
		this.literal = literal;
		this.span = Objects.requireNonNull(span, "span");
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public Object getLiteral()
	{
		return literal;
	}

	public Span getSpan()
	{
		return span;
	}

	public int getLine()
	{
		return span.getLine();
	}

	public int getColumn()
	{
		return span.getColumn();
	}

	/**
	 * The name this token stands for: the literal value of identifiers (backtick
	 * identifiers lose their backticks), otherwise the raw lexeme.
	 */
	public String getText()
	{
		if (type == TokenType.IDENTIFIER && literal instanceof String)
		{
			return (String) literal;
		}
		return lexeme;
	}

	/**
	 * @return True if this token was spelled with the section sigil (a tag keyword, or an
	 * error token for an unknown one).
	 */
	public boolean isSectionMarker()
	{
		return lexeme.startsWith("§");
	}

	/**
	 * Format: "TokenType 'lexeme' [literal] (Line:Column)"
	 */
	@Override
	public String toString()
	{
		String literalStr = (literal != null) ? " [" + literal + "]" : "";
		return type + " '" + lexeme + "'" + literalStr + " (Line:" + getLine() + ", Col:" + getColumn() + ")";
	}

	/**
	 * Compares type, lexeme and literal. Spans are not included so tokens scanned
	 * from different positions still compare equal.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;

		if (type != token.type)
			return false;
		if (!lexeme.equals(token.lexeme))
			return false;
		return Objects.equals(literal, token.literal);
	}

	@Override
	public int hashCode()
	{
		int result = type.hashCode();
		result = 31 * result + lexeme.hashCode();
		result = 31 * result + (literal != null ? literal.hashCode() : 0);
		return result;
	}
}
