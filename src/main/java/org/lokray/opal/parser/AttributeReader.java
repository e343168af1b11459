package org.lokray.opal.parser;

import org.lokray.opal.lexer.Token;
import org.lokray.opal.lexer.TokenType;
import org.lokray.opal.util.DiagnosticBag;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the bracket groups that follow a tag keyword into one {@link AttributeBag}.
 * <p>
 * A group that starts with {@code name=} is read as named pairs ({@code [id=f1 name=Main]}),
 * any other group as a colon-separated positional list ({@code [f1:Main:pub]}). Positional
 * slots continue across groups, so {@code [a:b][c]} fills {@code _pos0.._pos2}.
 */
public class AttributeReader
{
	private final TokenStream stream;
	private final DiagnosticBag diagnostics;

	public AttributeReader(TokenStream stream, DiagnosticBag diagnostics)
	{
		this.stream = stream;
		this.diagnostics = diagnostics;
	}

	/**
	 * Consumes zero or more consecutive bracket groups at the cursor.
	 *
	 * @return The merged attributes; empty when no group follows.
	 */
	public AttributeBag read()
	{
		AttributeBag bag = new AttributeBag();
		while (stream.check(TokenType.OPEN_BRACKET))
		{
			readGroup(bag);
		}
		return bag;
	}

	private void readGroup(AttributeBag bag)
	{
		stream.advance(); // '['
		if (stream.match(TokenType.CLOSE_BRACKET))
		{
			return;
		}

		if (isNamedPairStart())
		{
			readNamedPairs(bag);
		}
		else
		{
			readPositionalList(bag);
		}
	}

	private boolean isNamedPairStart()
	{
		return stream.check(TokenType.IDENTIFIER) && stream.check(1, TokenType.EQUALS);
	}

	/**
	 * Grammar: {@code name=value ((',' | whitespace) name=value)* ']'}
	 */
	private void readNamedPairs(AttributeBag bag)
	{
		while (true)
		{
			if (!isNamedPairStart())
			{
				recover("attribute 'name=value'");
				return;
			}
			String name = stream.advance().getText();
			stream.advance(); // '='
			List<Token> tokens = new ArrayList<>();
			bag.add(name, readValue(true, tokens), tokens);

			stream.match(TokenType.COMMA);
			if (stream.match(TokenType.CLOSE_BRACKET))
			{
				return;
			}
		}
	}

	/**
	 * Grammar: {@code value (':' value)* ']'}
	 */
	private void readPositionalList(AttributeBag bag)
	{
		while (true)
		{
			List<Token> tokens = new ArrayList<>();
			bag.addPositional(readValue(false, tokens), tokens);
			if (stream.match(TokenType.COLON))
			{
				continue;
			}
			if (stream.match(TokenType.CLOSE_BRACKET))
			{
				return;
			}
			recover("':' or ']'");
			return;
		}
	}

	/**
	 * Reads one value: a run of tokens up to the next separator. A named value stops at
	 * whitespace; a positional value keeps whitespace-separated pieces, joined by one space.
	 * A lone string literal yields its decoded text; otherwise the raw token texts are joined.
	 *
	 * @param named  Whether the value belongs to a {@code name=value} pair.
	 * @param tokens Receives the tokens the value was read from.
	 * @return The value text, possibly empty.
	 */
	private String readValue(boolean named, List<Token> tokens)
	{
		StringBuilder text = new StringBuilder();
		Token last = null;

		while (isValueToken(named))
		{
			Token token = stream.peek();
			boolean adjacent = last == null || last.getSpan().getEnd() == token.getSpan().getStart();
			if (!adjacent)
			{
				if (named)
				{
					break;
				}
				text.append(' ');
			}
			stream.advance();
			text.append(rawText(token));
			tokens.add(token);
			last = token;
		}

		if (tokens.size() == 1 && last.getType() == TokenType.STR_LITERAL)
		{
			return (String) last.getLiteral();
		}
		return text.toString();
	}

	private boolean isValueToken(boolean named)
	{
		Token token = stream.peek();
		switch (token.getType())
		{
			case COLON:
			case OPEN_BRACKET:
			case CLOSE_BRACKET:
			case EOF:
				return false;
			case COMMA:
				// In a named group a comma before the next 'name=' separates pairs
				return !(named && stream.check(1, TokenType.IDENTIFIER) && stream.check(2, TokenType.EQUALS));
			default:
				return !token.isSectionMarker();
		}
	}

	private static String rawText(Token token)
	{
		if (token.getType() == TokenType.IDENTIFIER)
		{
			return token.getText();
		}
		return token.getLexeme();
	}

	/**
	 * Reports the token that broke the group and skips to the closing bracket, stopping
	 * early (without consuming) at a tag keyword or the end of input.
	 *
	 * @param expected What the group needed at this point.
	 */
	private void recover(String expected)
	{
		Token found = stream.peek();
		diagnostics.reportUnexpectedToken(found.getSpan(), expected, describe(found));
		while (!stream.isAtEnd() && !stream.peek().isSectionMarker())
		{
			if (stream.advance().getType() == TokenType.CLOSE_BRACKET)
			{
				return;
			}
		}
	}

	static String describe(Token token)
	{
		return token.getType() == TokenType.EOF ? "end of input" : token.getLexeme();
	}
}
