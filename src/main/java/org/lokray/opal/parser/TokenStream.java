package org.lokray.opal.parser;

import org.lokray.opal.lexer.Span;
import org.lokray.opal.lexer.Token;
import org.lokray.opal.lexer.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * A random-access cursor over a filtered token list. Reads past the end clamp at the
 * final EOF token, so lookahead never goes out of bounds.
 * Shared by the parser and the attribute reader so both advance the same position.
 */
public class TokenStream
{
	private final List<Token> tokens; // Always ends with EOF
	private int current = 0; // Current position in the token list

	public TokenStream(List<Token> tokens)
	{
		List<Token> copy = new ArrayList<>(tokens);
		if (copy.isEmpty() || copy.get(copy.size() - 1).getType() != TokenType.EOF)
		{
			Span end = copy.isEmpty() ? Span.EMPTY : copy.get(copy.size() - 1).getSpan();
			copy.add(new Token(TokenType.EOF, "", null, new Span(end.getEnd(), 0, end.getLine(), end.getColumn())));
		}
		this.tokens = copy;
	}

	/**
	 * Looks at the token at a given offset from the current position without consuming it.
	 *
	 * @param offset The offset from the current token (0 for current, 1 for next, etc.).
	 * @return The Token at the specified offset, or EOF if past the end of the token list.
	 */
	public Token peek(int offset)
	{
		int index = current + offset;
		if (index >= tokens.size())
		{
			return tokens.get(tokens.size() - 1);
		}
		return tokens.get(index);
	}

	public Token peek()
	{
		return peek(0);
	}

	/**
	 * @return The token just consumed, or the first token if nothing was consumed yet.
	 */
	public Token previous()
	{
		return tokens.get(Math.max(0, current - 1));
	}

	/**
	 * Consumes the current token and returns it. EOF is never consumed.
	 *
	 * @return The consumed Token.
	 */
	public Token advance()
	{
		Token token = peek();
		if (!isAtEnd())
		{
			current++;
		}
		return token;
	}

	/**
	 * Checks if the current token's type matches any of the given types.
	 *
	 * @param types The TokenType(s) to check against.
	 * @return True if the current token matches any of the types.
	 */
	public boolean check(TokenType... types)
	{
		TokenType currentType = peek().getType();
		for (TokenType type : types)
		{
			if (currentType == type)
			{
				return true;
			}
		}
		return false;
	}

	/**
	 * @param offset The offset from the current token.
	 * @param type   The TokenType to check for.
	 * @return True if the token at the offset matches the type.
	 */
	public boolean check(int offset, TokenType type)
	{
		return peek(offset).getType() == type;
	}

	/**
	 * Consumes the current token if its type matches any of the given types.
	 *
	 * @param types The TokenType(s) to match against.
	 * @return True if a match was found and the token was consumed.
	 */
	public boolean match(TokenType... types)
	{
		if (check(types))
		{
			advance();
			return true;
		}
		return false;
	}

	public boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}
}
