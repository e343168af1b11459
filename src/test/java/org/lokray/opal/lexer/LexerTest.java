package org.lokray.opal.lexer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.lokray.opal.util.DiagnosticBag;
import org.lokray.opal.util.DiagnosticCode;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest
{
	private DiagnosticBag diagnostics;

	private List<Token> lex(String source)
	{
		diagnostics = new DiagnosticBag();
		return new Lexer(source, diagnostics).tokenize();
	}

	private List<TokenType> types(String source)
	{
		List<TokenType> types = new ArrayList<>();
		for (Token token : lex(source))
		{
			types.add(token.getType());
		}
		return types;
	}

	@Test
	void tagWithPositionalAttributes()
	{
		assertEquals(List.of(TokenType.MODULE, TokenType.OPEN_BRACKET, TokenType.IDENTIFIER, TokenType.COLON,
				TokenType.IDENTIFIER, TokenType.CLOSE_BRACKET, TokenType.EOF), types("§M[m1:Demo]"));
		assertTrue(diagnostics.isEmpty());
	}

	@ParameterizedTest
	@CsvSource({
			"§M, MODULE",
			"§MODULE, MODULE",
			"§/F, END_FUNC",
			"§END_FUNC, END_FUNC",
			"§/I, END_IF",
			"§/IF, END_IF",
			"§SW, MATCH",
			"§Pf, PRINTF",
			"§PREL, RELATIONAL_PATTERN",
			"§FILE, FILE_REF",
			"§??, NULL_COALESCE",
			"§?., NULL_CONDITIONAL",
			"§^, INDEX_END"
	})
	void sectionKeywords(String source, TokenType expected)
	{
		List<Token> tokens = lex(source);
		assertEquals(expected, tokens.get(0).getType());
		assertEquals(2, tokens.size());
		assertTrue(tokens.get(0).isSectionMarker());
	}

	@Test
	void bareOperatorsAreNotSectionMarkers()
	{
		assertEquals(List.of(TokenType.NULL_COALESCE, TokenType.NULL_CONDITIONAL, TokenType.QUESTION, TokenType.CARET,
				TokenType.EOF), types("?? ?. ? ^"));
		for (Token token : lex("?? ?. ^"))
		{
			assertFalse(token.isSectionMarker());
		}
	}

	@Test
	void twoCharacterOperatorsUseMaximalMunch()
	{
		assertEquals(List.of(TokenType.EQUAL_EQUAL, TokenType.BANG_EQUAL, TokenType.STAR_STAR, TokenType.LESS_EQUAL,
				TokenType.LESS_LESS, TokenType.GREATER_EQUAL, TokenType.GREATER_GREATER, TokenType.AMP_AMP,
				TokenType.PIPE_PIPE, TokenType.EOF), types("== != ** <= << >= >> && ||"));
		assertEquals(List.of(TokenType.EQUALS, TokenType.BANG, TokenType.STAR, TokenType.LESS, TokenType.GREATER,
				TokenType.AMP, TokenType.PIPE, TokenType.EOF), types("= ! * < > & |"));
	}

	@Test
	void minusArrowAndNegativeNumbers()
	{
		List<Token> tokens = lex("-> → -5 - 5");
		assertEquals(TokenType.ARROW, tokens.get(0).getType());
		assertEquals(TokenType.ARROW, tokens.get(1).getType());
		assertEquals(TokenType.INT_LITERAL, tokens.get(2).getType());
		assertEquals(-5L, tokens.get(2).getLiteral());
		assertEquals(TokenType.MINUS, tokens.get(3).getType());
		assertEquals(5L, tokens.get(4).getLiteral());
	}

	@Test
	void typedLiterals()
	{
		List<Token> tokens = lex("INT:42 STR:\"hi\" BOOL:true FLOAT:1.5e3");
		assertEquals(42L, tokens.get(0).getLiteral());
		assertEquals(TokenType.STR_LITERAL, tokens.get(1).getType());
		assertEquals("hi", tokens.get(1).getLiteral());
		assertEquals(Boolean.TRUE, tokens.get(2).getLiteral());
		assertEquals(TokenType.FLOAT_LITERAL, tokens.get(3).getType());
		assertEquals(1500.0, (Double) tokens.get(3).getLiteral(), 0.0);
		assertTrue(diagnostics.isEmpty());
	}

	@Test
	void untypedNumbersAndBooleans()
	{
		List<Token> tokens = lex("42 1.25 .5 false");
		assertEquals(42L, tokens.get(0).getLiteral());
		assertEquals(1.25, (Double) tokens.get(1).getLiteral(), 0.0);
		assertEquals(0.5, (Double) tokens.get(2).getLiteral(), 0.0);
		assertEquals(TokenType.BOOL_LITERAL, tokens.get(3).getType());
		assertEquals(Boolean.FALSE, tokens.get(3).getLiteral());
	}

	@Test
	void overflowingIntPayloadIsAnErrorToken()
	{
		List<Token> tokens = lex("INT:99999999999999999999 7");
		assertEquals(TokenType.ERROR, tokens.get(0).getType());
		assertEquals(1, diagnostics.count(DiagnosticCode.INVALID_TYPED_LITERAL));
		// Scanning goes on after the bad literal
		assertEquals(7L, tokens.get(1).getLiteral());
	}

	@Test
	void prefixWithoutPayloadStaysAnIdentifier()
	{
		assertEquals(List.of(TokenType.IDENTIFIER, TokenType.COLON, TokenType.IDENTIFIER, TokenType.EOF),
				types("INT:x"));
	}

	@Test
	void stringEscapes()
	{
		List<Token> tokens = lex("\"a\\nb\\t\\\"c\\\"\"");
		assertEquals("a\nb\t\"c\"", tokens.get(0).getLiteral());
		assertTrue(diagnostics.isEmpty());
	}

	@Test
	void invalidEscapeIsDropped()
	{
		List<Token> tokens = lex("\"a\\qb\"");
		assertEquals(TokenType.STR_LITERAL, tokens.get(0).getType());
		assertEquals("ab", tokens.get(0).getLiteral());
		assertEquals(1, diagnostics.count(DiagnosticCode.INVALID_ESCAPE_SEQUENCE));
	}

	@Test
	void backslashZeroIsNotAnEscape()
	{
		List<Token> tokens = lex("\"x\\0y\"");
		assertEquals("xy", tokens.get(0).getLiteral());
		assertEquals(1, diagnostics.count(DiagnosticCode.INVALID_ESCAPE_SEQUENCE));
	}

	@Test
	void unterminatedString()
	{
		List<Token> tokens = lex("\"abc\n§R");
		assertEquals(TokenType.ERROR, tokens.get(0).getType());
		assertEquals(TokenType.RETURN, tokens.get(1).getType());
		assertEquals(1, diagnostics.count(DiagnosticCode.UNTERMINATED_STRING));
	}

	@Test
	void unknownSectionMarker()
	{
		List<Token> tokens = lex("§XYZ §R");
		assertEquals(TokenType.ERROR, tokens.get(0).getType());
		assertEquals(TokenType.RETURN, tokens.get(1).getType());
		assertEquals(1, diagnostics.count(DiagnosticCode.UNKNOWN_SECTION_MARKER));
	}

	@Test
	void unexpectedCharacter()
	{
		List<Token> tokens = lex("a $ b");
		assertEquals(TokenType.ERROR, tokens.get(1).getType());
		assertEquals(1, diagnostics.count(DiagnosticCode.UNEXPECTED_CHARACTER));
		assertEquals("b", tokens.get(2).getText());
	}

	@Test
	void dottedAndBacktickIdentifiers()
	{
		List<Token> tokens = lex("Console.WriteLine `my var`");
		assertEquals("Console.WriteLine", tokens.get(0).getText());
		assertEquals(TokenType.IDENTIFIER, tokens.get(1).getType());
		assertEquals("my var", tokens.get(1).getText());
		assertEquals("`my var`", tokens.get(1).getLexeme());
	}

	@Test
	void unterminatedBacktickIdentifier()
	{
		List<Token> tokens = lex("`oops");
		assertEquals(TokenType.ERROR, tokens.get(0).getType());
		assertEquals(1, diagnostics.count(DiagnosticCode.UNTERMINATED_STRING));
	}

	@Test
	void triviaIsDroppedByTokenizeButKeptByScanTokens()
	{
		String source = "§R 1 // done\n";
		DiagnosticBag bag = new DiagnosticBag();
		Lexer lexer = new Lexer(source, bag);

		List<TokenType> all = new ArrayList<>();
		for (Token token : lexer.scanTokens())
		{
			all.add(token.getType());
		}
		assertEquals(List.of(TokenType.RETURN, TokenType.WHITESPACE, TokenType.INT_LITERAL, TokenType.WHITESPACE,
				TokenType.COMMENT, TokenType.NEWLINE, TokenType.EOF), all);
		assertEquals(List.of(TokenType.RETURN, TokenType.INT_LITERAL, TokenType.EOF), types(source));
	}

	@Test
	void spansTrackOffsetLineAndColumn()
	{
		List<Token> tokens = lex("§R 42\n  §/F");
		Span number = tokens.get(1).getSpan();
		assertEquals(3, number.getStart());
		assertEquals(2, number.getLength());
		assertEquals(1, number.getLine());
		assertEquals(4, number.getColumn());

		Span close = tokens.get(2).getSpan();
		assertEquals(2, close.getLine());
		assertEquals(3, close.getColumn());
	}

	@Test
	void spanUnionCoversBoth()
	{
		Span first = new Span(2, 3, 1, 3);
		Span second = new Span(10, 2, 1, 11);
		Span union = first.union(second);
		assertEquals(2, union.getStart());
		assertEquals(12, union.getEnd());
		assertEquals(union, second.union(first));
	}
}
