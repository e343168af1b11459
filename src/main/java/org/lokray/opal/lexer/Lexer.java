package org.lokray.opal.lexer;

import org.lokray.opal.util.Debug;
import org.lokray.opal.util.DiagnosticBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * The Lexer is responsible for performing lexical analysis (scanning).
 * It reads raw OPAL source and converts it into a stream of Tokens: section keywords
 * introduced by the {@code §} sigil, bracket and operator symbols, typed and untyped
 * literals, and identifiers.
 * <p>
 * Lexical problems are reported to the {@link DiagnosticBag} and never stop the scan;
 * the stream always ends with a single {@link TokenType#EOF} token.
 */
public class Lexer
{
	private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

	public static final char SIGIL = '§';
	private static final char UNICODE_ARROW = '→';

	private final String source; // The raw source code string
	private final List<Token> tokens = new ArrayList<>(); // Tokens of the current pass, trivia included
	private final DiagnosticBag diagnostics; // For reporting lexical errors
	private final Debug debug;

	private int start = 0; // Current token's starting position in the source
	private int current = 0; // Current position in the source
	private int line = 1; // Current line number
	private int column = 1; // Current column number

	private int startLine = 1;
	private int startColumn = 1;

	// Keyword spellings (without the sigil) to token types; read-only after class init
	private static final Map<String, TokenType> keywords;

	static
	{
		Map<String, TokenType> table = new HashMap<>();

		// Module, functions and declaration prefix
		put(table, TokenType.MODULE, "M", "MODULE");
		put(table, TokenType.END_MODULE, "/M", "END_MODULE");
		put(table, TokenType.FUNC, "F", "FUNC");
		put(table, TokenType.END_FUNC, "/F", "END_FUNC");
		put(table, TokenType.USING, "U", "USING");
		put(table, TokenType.IN, "I", "IN");
		put(table, TokenType.OUT, "O", "OUT");
		put(table, TokenType.EFFECTS, "E", "EFFECTS");
		put(table, TokenType.REQUIRES, "Q", "REQUIRES");
		put(table, TokenType.ENSURES, "S", "ENSURES");
		put(table, TokenType.TYPE_PARAM, "TP", "TYPE_PARAM");
		put(table, TokenType.WHERE, "WR", "WHERE");
		put(table, TokenType.BODY, "BODY");
		put(table, TokenType.END_BODY, "END_BODY");

		// Statements
		put(table, TokenType.CALL, "C", "CALL");
		put(table, TokenType.END_CALL, "/C", "END_CALL");
		put(table, TokenType.ARG, "A", "ARG");
		put(table, TokenType.BIND, "B", "BIND");
		put(table, TokenType.RETURN, "R", "RETURN");
		put(table, TokenType.FOR, "L", "FOR");
		put(table, TokenType.END_FOR, "/L", "END_FOR");
		put(table, TokenType.WHILE, "WH", "WHILE");
		put(table, TokenType.END_WHILE, "/WH", "END_WHILE");
		put(table, TokenType.DO, "DO");
		put(table, TokenType.END_DO, "/DO", "END_DO");
		put(table, TokenType.IF, "IF");
		put(table, TokenType.ELSE_IF, "EI", "ELSEIF");
		put(table, TokenType.ELSE, "EL", "ELSE");
		put(table, TokenType.END_IF, "/I", "/IF", "END_IF");
		put(table, TokenType.MATCH, "W", "SW", "MATCH");
		put(table, TokenType.END_MATCH, "/W", "/SW", "END_MATCH");
		put(table, TokenType.CASE, "K", "CASE");
		put(table, TokenType.END_CASE, "/K", "END_CASE");
		put(table, TokenType.FOREACH, "EACH", "FOREACH");
		put(table, TokenType.END_FOREACH, "/EACH", "END_FOREACH");
		put(table, TokenType.ASSIGN, "ASSIGN");
		put(table, TokenType.TRY, "TR", "TRY");
		put(table, TokenType.END_TRY, "/TR", "END_TRY");
		put(table, TokenType.CATCH, "CA", "CATCH");
		put(table, TokenType.FINALLY, "FI", "FINALLY");
		put(table, TokenType.THROW, "TH", "THROW");
		put(table, TokenType.RETHROW, "RT", "RETHROW");
		put(table, TokenType.WHEN, "WHEN");
		put(table, TokenType.SUBSCRIBE, "SUB");
		put(table, TokenType.UNSUBSCRIBE, "UNSUB");
		put(table, TokenType.BREAK, "BK", "BREAK");
		put(table, TokenType.CONTINUE, "CN", "CONTINUE");
		put(table, TokenType.PRINT, "P", "PRINT");
		put(table, TokenType.PRINTF, "Pf", "PRINTF");
		put(table, TokenType.YIELD, "YIELD");
		put(table, TokenType.YIELD_BREAK, "YBRK", "YIELD_BREAK");

		// Expressions
		put(table, TokenType.SOME, "SM", "SOME");
		put(table, TokenType.NONE, "NN", "NONE");
		put(table, TokenType.OK, "OK");
		put(table, TokenType.ERR, "ERR");
		put(table, TokenType.RECORD, "D", "RECORD");
		put(table, TokenType.END_RECORD, "/D", "END_RECORD");
		put(table, TokenType.FIELD, "FL", "FIELD");
		put(table, TokenType.ARRAY, "ARR", "ARRAY");
		put(table, TokenType.END_ARRAY, "/ARR", "END_ARRAY");
		put(table, TokenType.INDEX, "IDX", "INDEX");
		put(table, TokenType.LENGTH, "LEN", "LENGTH");
		put(table, TokenType.GENERIC, "G", "GENERIC");
		put(table, TokenType.NEW, "NEW");
		put(table, TokenType.END_NEW, "/NEW", "END_NEW");
		put(table, TokenType.THIS, "THIS");
		put(table, TokenType.END_THIS, "/THIS");
		put(table, TokenType.BASE, "BASE");
		put(table, TokenType.END_BASE, "/BASE");
		put(table, TokenType.LAMBDA, "LAM", "LAMBDA");
		put(table, TokenType.END_LAMBDA, "/LAM", "END_LAMBDA");
		put(table, TokenType.AWAIT, "AWAIT");
		put(table, TokenType.INTERPOLATE, "INTERP");
		put(table, TokenType.END_INTERPOLATE, "/INTERP");
		put(table, TokenType.EXPRESSION, "EXP");
		put(table, TokenType.NULL_COALESCE, "??");
		put(table, TokenType.NULL_CONDITIONAL, "?.");
		put(table, TokenType.RANGE, "RANGE");
		put(table, TokenType.INDEX_END, "^");
		put(table, TokenType.WITH, "WITH");
		put(table, TokenType.END_WITH, "/WITH");

		// Collections
		put(table, TokenType.LIST, "LIST");
		put(table, TokenType.END_LIST, "/LIST", "END_LIST");
		put(table, TokenType.DICT, "DICT");
		put(table, TokenType.END_DICT, "/DICT", "END_DICT");
		put(table, TokenType.HASH_SET, "HSET");
		put(table, TokenType.END_HASH_SET, "/HSET", "END_HSET");
		put(table, TokenType.KEY_VALUE, "KV");
		put(table, TokenType.PUSH, "PUSH");
		put(table, TokenType.ADD, "ADD");
		put(table, TokenType.PUT, "PUT");
		put(table, TokenType.REMOVE, "REM");
		put(table, TokenType.SET_INDEX, "SETIDX");
		put(table, TokenType.CLEAR, "CLR");
		put(table, TokenType.INSERT, "INS");
		put(table, TokenType.HAS, "HAS");
		put(table, TokenType.KEY, "KEY");
		put(table, TokenType.VAL, "VAL");
		put(table, TokenType.COUNT, "CNT");

		// Patterns
		put(table, TokenType.VAR, "VAR");
		put(table, TokenType.POSITIONAL_PATTERN, "PPOS");
		put(table, TokenType.PROPERTY_PATTERN, "PPROP");
		put(table, TokenType.PROPERTY_MATCH, "PMATCH");
		put(table, TokenType.RELATIONAL_PATTERN, "PREL");
		put(table, TokenType.LIST_PATTERN, "PLIST");
		put(table, TokenType.REST, "REST");

		// Classes and interfaces
		put(table, TokenType.CLASS, "CL", "CLASS");
		put(table, TokenType.END_CLASS, "/CL", "END_CLASS");
		put(table, TokenType.INTERFACE, "IFACE", "INTERFACE");
		put(table, TokenType.END_INTERFACE, "/IFACE", "END_INTERFACE");
		put(table, TokenType.EXTENDS, "EXT", "EXTENDS");
		put(table, TokenType.IMPLEMENTS, "IMPL", "IMPLEMENTS");
		put(table, TokenType.METHOD, "MT", "METHOD");
		put(table, TokenType.END_METHOD, "/MT", "END_METHOD");
		put(table, TokenType.FIELD_DEF, "FLD");
		put(table, TokenType.PROPERTY, "PROP", "PROPERTY");
		put(table, TokenType.END_PROPERTY, "/PROP", "END_PROPERTY");
		put(table, TokenType.GET, "GET");
		put(table, TokenType.END_GET, "/GET");
		put(table, TokenType.SET, "SET");
		put(table, TokenType.END_SET, "/SET");
		put(table, TokenType.INIT, "INIT");
		put(table, TokenType.CONSTRUCTOR, "CTOR", "CONSTRUCTOR");
		put(table, TokenType.END_CONSTRUCTOR, "/CTOR", "END_CONSTRUCTOR");
		put(table, TokenType.DELEGATE, "DEL", "DELEGATE");
		put(table, TokenType.END_DELEGATE, "/DEL", "END_DELEGATE");
		put(table, TokenType.EVENT, "EVT", "EVENT");

		// Type definitions
		put(table, TokenType.TYPE_DEF, "T", "TYPE");
		put(table, TokenType.END_TYPE_DEF, "/T", "END_TYPE");
		put(table, TokenType.VARIANT, "V", "VARIANT");
		put(table, TokenType.ENUM, "EN", "ENUM");
		put(table, TokenType.END_ENUM, "/EN", "/ENUM", "END_ENUM");
		put(table, TokenType.ENUM_EXTENSION, "EEXT");
		put(table, TokenType.END_ENUM_EXTENSION, "/EEXT", "END_EEXT");

		// Metadata
		put(table, TokenType.INVARIANT, "IV", "INVARIANT");
		put(table, TokenType.TODO, "TD", "TODO");
		put(table, TokenType.FIXME, "FX", "FIXME");
		put(table, TokenType.HACK, "HK", "HACK");
		put(table, TokenType.ASSUME, "AS", "ASSUME");
		put(table, TokenType.DECISION, "DC", "DECISION");
		put(table, TokenType.END_DECISION, "/DC", "END_DECISION");
		put(table, TokenType.CHOSEN, "CHOSEN");
		put(table, TokenType.REJECTED, "REJECTED");
		put(table, TokenType.REASON, "REASON");
		put(table, TokenType.CONTEXT, "CT", "CONTEXT");
		put(table, TokenType.END_CONTEXT, "/CT", "END_CONTEXT");
		put(table, TokenType.VISIBLE, "VS", "VISIBLE");
		put(table, TokenType.END_VISIBLE, "/VS", "END_VISIBLE");
		put(table, TokenType.HIDDEN, "HD", "HIDDEN");
		put(table, TokenType.END_HIDDEN, "/HD", "END_HIDDEN");
		put(table, TokenType.FOCUS, "FC", "FOCUS");
		put(table, TokenType.FILE_REF, "FILE");
		put(table, TokenType.LOCK, "LK", "LOCK");
		put(table, TokenType.AUTHOR, "AU", "AUTHOR");
		put(table, TokenType.EXAMPLE, "EX", "EXAMPLE");
		put(table, TokenType.USES, "US", "USES");
		put(table, TokenType.SINCE, "SN", "SINCE");
		put(table, TokenType.DEPRECATED, "DP", "DEPRECATED");

		keywords = Collections.unmodifiableMap(table);
	}

	private static void put(Map<String, TokenType> table, TokenType type, String... spellings)
	{
		for (String spelling : spellings)
		{
			table.put(spelling, type);
		}
	}

	/**
	 * Constructs a Lexer.
	 *
	 * @param source      The source code string to tokenize.
	 * @param diagnostics The collector lexical errors are reported to.
	 */
	public Lexer(String source, DiagnosticBag diagnostics)
	{
		this(source, diagnostics, false);
	}

	/**
	 * @param source       The source code string to tokenize.
	 * @param diagnostics  The collector lexical errors are reported to.
	 * @param traceEnabled Whether to trace every token through the debug logger.
	 */
	public Lexer(String source, DiagnosticBag diagnostics, boolean traceEnabled)
	{
		this.source = source == null ? "" : source;
		this.diagnostics = diagnostics;
		this.debug = new Debug(LOG, traceEnabled);
	}

	/**
	 * Scans the source and returns the tokens the parser consumes: whitespace,
	 * newlines and comments are left out.
	 *
	 * @return The token stream, ending with EOF.
	 */
	public List<Token> tokenize()
	{
		return withoutTrivia(scanTokens());
	}

	/**
	 * @param tokens A token list as returned by {@link #scanTokens()}.
	 * @return The same tokens with whitespace, newlines and comments removed.
	 */
	public static List<Token> withoutTrivia(List<Token> tokens)
	{
		List<Token> filtered = new ArrayList<>(tokens.size());
		for (Token token : tokens)
		{
			if (!token.getType().isTrivia())
			{
				filtered.add(token);
			}
		}
		return filtered;
	}

	/**
	 * Scans the entire source code and returns every token, trivia included.
	 * Each call starts a fresh pass over the text.
	 *
	 * @return The token stream, ending with EOF.
	 */
	public List<Token> scanTokens()
	{
		tokens.clear();
		start = 0;
		current = 0;
		line = 1;
		column = 1;

		while (!isAtEnd())
		{
			start = current; // Mark the beginning of the current token
			startLine = line;
			startColumn = column;

			scanToken();
		}

		tokens.add(new Token(TokenType.EOF, "", null, new Span(current, 0, line, column)));
		LOG.debug("Scanned {} tokens from {} characters", tokens.size(), source.length());
		return new ArrayList<>(tokens);
	}

	/**
	 * Scans a single token from the source code.
	 */
	private void scanToken()
	{
		char c = advance();

		switch (c)
		{
			case SIGIL:
				scanSectionMarker();
				break;

			// Structural symbols
			case '[':
				addToken(TokenType.OPEN_BRACKET);
				break;
			case ']':
				addToken(TokenType.CLOSE_BRACKET);
				break;
			case '(':
				addToken(TokenType.OPEN_PAREN);
				break;
			case ')':
				addToken(TokenType.CLOSE_PAREN);
				break;
			case ':':
				addToken(TokenType.COLON);
				break;
			case '~':
				addToken(TokenType.TILDE);
				break;
			case '#':
				addToken(TokenType.HASH);
				break;
			case ',':
				addToken(TokenType.COMMA);
				break;
			case '@':
				addToken(TokenType.AT);
				break;
			case '?':
				if (match('?'))
				{
					addToken(TokenType.NULL_COALESCE);
				}
				else if (match('.'))
				{
					addToken(TokenType.NULL_CONDITIONAL);
				}
				else
				{
					addToken(TokenType.QUESTION);
				}
				break;
			case '.':
				if (isDigit(peek()))
				{
					scanNumber();
				}
				else
				{
					addToken(TokenType.DOT);
				}
				break;
			case UNICODE_ARROW:
				addToken(TokenType.ARROW);
				break;

			// Operators
			case '+':
				addToken(TokenType.PLUS);
				break;
			case '%':
				addToken(TokenType.PERCENT);
				break;
			case '^':
				addToken(TokenType.CARET);
				break;
			case '=':
				addToken(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUALS);
				break;
			case '!':
				addToken(match('=') ? TokenType.BANG_EQUAL : TokenType.BANG);
				break;
			case '*':
				addToken(match('*') ? TokenType.STAR_STAR : TokenType.STAR);
				break;
			case '<':
				addToken(match('=') ? TokenType.LESS_EQUAL : (match('<') ? TokenType.LESS_LESS : TokenType.LESS));
				break;
			case '>':
				addToken(match('=') ? TokenType.GREATER_EQUAL : (match('>') ? TokenType.GREATER_GREATER : TokenType.GREATER));
				break;
			case '&':
				addToken(match('&') ? TokenType.AMP_AMP : TokenType.AMP);
				break;
			case '|':
				addToken(match('|') ? TokenType.PIPE_PIPE : TokenType.PIPE);
				break;
			case '-':
				if (match('>'))
				{
					addToken(TokenType.ARROW);
				}
				else if (isDigit(peek()))
				{
					scanNumber();
				}
				else
				{
					addToken(TokenType.MINUS);
				}
				break;
			case '/':
				if (match('/'))
				{ // Line comment
					while (peek() != '\n' && !isAtEnd())
					{
						advance();
					}
					addToken(TokenType.COMMENT);
				}
				else
				{
					addToken(TokenType.SLASH);
				}
				break;

			// Whitespace
			case ' ':
			case '\r':
			case '\t':
				while (peek() == ' ' || peek() == '\r' || peek() == '\t')
				{
					advance();
				}
				addToken(TokenType.WHITESPACE);
				break;
			case '\n':
				addToken(TokenType.NEWLINE);
				break;

			// Literals
			case '"':
				scanStringLiteral();
				break;
			case '`':
				scanBacktickIdentifier();
				break;

			default:
				if (isDigit(c))
				{
					scanNumber();
				}
				else if (isIdentifierStart(c))
				{
					scanIdentifier();
				}
				else
				{
					diagnostics.reportUnexpectedCharacter(currentSpan(), c);
					addToken(TokenType.ERROR);
				}
				break;
		}
	}

	/**
	 * Scans the keyword after a {@code §}: {@code ??}, {@code ?.}, {@code ^}, or an
	 * optional {@code /} followed by letters, digits and underscores.
	 */
	private void scanSectionMarker()
	{
		if (peek() == '?' && (peekNext() == '?' || peekNext() == '.'))
		{
			advance();
			advance();
		}
		else if (peek() == '^')
		{
			advance();
		}
		else
		{
			match('/');
			while (isKeywordChar(peek()))
			{
				advance();
			}
		}

		String keyword = source.substring(start + 1, current);
		TokenType type = keywords.get(keyword);
		if (type == null)
		{
			diagnostics.reportUnknownSectionMarker(currentSpan(), keyword);
			addToken(TokenType.ERROR);
			return;
		}
		addToken(type);
	}

	/**
	 * Scans an identifier, promoting it to a typed literal ({@code INT:}, {@code STR:},
	 * {@code BOOL:}, {@code FLOAT:}) or a bare boolean when the text allows it.
	 */
	private void scanIdentifier()
	{
		while (isIdentifierPart(peek()))
		{
			advance();
		}

		String text = source.substring(start, current);

		if (peek() == ':' && scanTypedLiteral(text))
		{
			return;
		}

		if (text.equals("true") || text.equals("false"))
		{
			addToken(TokenType.BOOL_LITERAL, Boolean.parseBoolean(text));
			return;
		}

		addToken(TokenType.IDENTIFIER, text);
	}

	/**
	 * Tries to continue {@code prefix:} as a typed literal. The character after the
	 * colon decides; when it does not fit, nothing is consumed and the identifier and
	 * colon become two ordinary tokens.
	 *
	 * @param prefix The identifier just scanned.
	 * @return True if a typed literal (or an error token for a bad payload) was emitted.
	 */
	private boolean scanTypedLiteral(String prefix)
	{
		char after = peekNext();
		switch (prefix)
		{
			case "INT":
				if (!isDigit(after) && after != '-')
				{
					return false;
				}
				advance(); // ':'
				scanIntPayload(prefix);
				return true;
			case "FLOAT":
				if (!isDigit(after) && after != '-' && after != '.')
				{
					return false;
				}
				advance(); // ':'
				scanFloatPayload(prefix);
				return true;
			case "STR":
				if (after != '"')
				{
					return false;
				}
				advance(); // ':'
				advance(); // opening quote
				scanStringLiteral();
				return true;
			case "BOOL":
				if (after != 't' && after != 'f')
				{
					return false;
				}
				advance(); // ':'
				int payloadStart = current;
				while (isIdentifierPart(peek()))
				{
					advance();
				}
				String payload = source.substring(payloadStart, current);
				if (payload.equals("true") || payload.equals("false"))
				{
					addToken(TokenType.BOOL_LITERAL, Boolean.parseBoolean(payload));
				}
				else
				{
					diagnostics.reportInvalidTypedLiteral(currentSpan(), prefix, payload);
					addToken(TokenType.ERROR);
				}
				return true;
			default:
				return false;
		}
	}

	private void scanIntPayload(String prefix)
	{
		int payloadStart = current;
		match('-');
		while (isDigit(peek()))
		{
			advance();
		}
		String payload = source.substring(payloadStart, current);
		try
		{
			addToken(TokenType.INT_LITERAL, Long.parseLong(payload));
		}
		catch (NumberFormatException e)
		{
			diagnostics.reportInvalidTypedLiteral(currentSpan(), prefix, payload);
			addToken(TokenType.ERROR);
		}
	}

	private void scanFloatPayload(String prefix)
	{
		int payloadStart = current;
		match('-');
		while (isDigit(peek()))
		{
			advance();
		}
		if (peek() == '.' && isDigit(peekNext()))
		{
			advance();
			while (isDigit(peek()))
			{
				advance();
			}
		}
		if ((peek() == 'e' || peek() == 'E')
				&& (isDigit(peekNext()) || ((peekNext() == '+' || peekNext() == '-') && isDigit(peek(2)))))
		{
			advance(); // 'e'
			if (peek() == '+' || peek() == '-')
			{
				advance();
			}
			while (isDigit(peek()))
			{
				advance();
			}
		}
		String payload = source.substring(payloadStart, current);
		try
		{
			addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(payload));
		}
		catch (NumberFormatException e)
		{
			diagnostics.reportInvalidTypedLiteral(currentSpan(), prefix, payload);
			addToken(TokenType.ERROR);
		}
	}

	/**
	 * Scans an untyped number. The first character (digit, '-' or '.') is already consumed.
	 */
	private void scanNumber()
	{
		boolean isFloatingPoint = source.charAt(start) == '.';

		while (isDigit(peek()))
		{
			advance();
		}

		if (!isFloatingPoint && peek() == '.' && isDigit(peekNext()))
		{
			isFloatingPoint = true;
			advance(); // consume the '.'
			while (isDigit(peek()))
			{
				advance();
			}
		}

		String numberText = source.substring(start, current);
		try
		{
			if (isFloatingPoint)
			{
				addToken(TokenType.FLOAT_LITERAL, Double.parseDouble(numberText));
			}
			else
			{
				addToken(TokenType.INT_LITERAL, Long.parseLong(numberText));
			}
		}
		catch (NumberFormatException e)
		{
			diagnostics.reportInvalidTypedLiteral(currentSpan(), isFloatingPoint ? "FLOAT" : "INT", numberText);
			addToken(TokenType.ERROR);
		}
	}

	/**
	 * Scans a string literal body; the opening quote is already consumed.
	 * A newline or the end of input before the closing quote yields an ERROR token.
	 */
	private void scanStringLiteral()
	{
		StringBuilder value = new StringBuilder();

		while (true)
		{
			if (isAtEnd() || peek() == '\n')
			{
				diagnostics.reportUnterminatedString(currentSpan());
				addToken(TokenType.ERROR);
				return;
			}

			char c = advance();
			if (c == '"')
			{
				break;
			}
			if (c != '\\')
			{
				value.append(c);
				continue;
			}

			if (isAtEnd() || peek() == '\n')
			{
				continue; // reported as unterminated on the next iteration
			}

			int escapeStart = current - 1;
			int escapeColumn = column - 1;
			char escaped = advance();
			switch (escaped)
			{
				case 'n':
					value.append('\n');
					break;
				case 'r':
					value.append('\r');
					break;
				case 't':
					value.append('\t');
					break;
				case '\\':
					value.append('\\');
					break;
				case '"':
					value.append('"');
					break;
				default:
					// The whole escape is dropped
					diagnostics.reportInvalidEscape(new Span(escapeStart, 2, line, escapeColumn), escaped);
					break;
			}
		}

		addToken(TokenType.STR_LITERAL, value.toString());
	}

	/**
	 * Scans a backtick-quoted identifier; the opening backtick is already consumed.
	 */
	private void scanBacktickIdentifier()
	{
		while (!isAtEnd() && peek() != '`' && peek() != '\n')
		{
			advance();
		}

		if (isAtEnd() || peek() == '\n')
		{
			diagnostics.reportUnterminatedString(currentSpan());
			addToken(TokenType.ERROR);
			return;
		}

		advance(); // closing backtick
		addToken(TokenType.IDENTIFIER, source.substring(start + 1, current - 1));
	}

	/**
	 * Consumes the current character and returns it, also updates line/column.
	 *
	 * @return The consumed character.
	 */
	private char advance()
	{
		char c = source.charAt(current++);
		if (c == '\n')
		{
			line++;
			column = 1;
		}
		else
		{
			column++;
		}
		return c;
	}

	/**
	 * Adds a token spanning from the start of the current scan to the cursor.
	 *
	 * @param type    The TokenType of the token.
	 * @param literal The literal value of the token.
	 */
	private void addToken(TokenType type, Object literal)
	{
		String text = source.substring(start, current);
		Token token = new Token(type, text, literal, currentSpan());
		tokens.add(token);
		if (!type.isTrivia())
		{
			debug.log("%s", token);
		}
	}

	private void addToken(TokenType type)
	{
		addToken(type, null);
	}

	private Span currentSpan()
	{
		return new Span(start, current - start, startLine, startColumn);
	}

	/**
	 * Consumes the current character if it matches the expected one.
	 *
	 * @param expected The expected character.
	 * @return True if the character matched and was consumed, false otherwise.
	 */
	private boolean match(char expected)
	{
		if (isAtEnd() || source.charAt(current) != expected)
		{
			return false;
		}
		advance();
		return true;
	}

	/**
	 * @return The current character, or '\0' if at the end of the source.
	 */
	private char peek()
	{
		return peek(0);
	}

	private char peekNext()
	{
		return peek(1);
	}

	/**
	 * @param offset The number of characters to look ahead.
	 * @return The character at the offset, or '\0' past the end of the source.
	 */
	private char peek(int offset)
	{
		if (current + offset >= source.length())
		{
			return '\0';
		}
		return source.charAt(current + offset);
	}

	private boolean isAtEnd()
	{
		return current >= source.length();
	}

	private static boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private static boolean isIdentifierStart(char c)
	{
		return Character.isLetter(c) || c == '_';
	}

	private static boolean isIdentifierPart(char c)
	{
		return Character.isLetterOrDigit(c) || c == '_' || c == '.';
	}

	private static boolean isKeywordChar(char c)
	{
		return Character.isLetterOrDigit(c) || c == '_';
	}
}
