package org.lokray.opal.lexer;

/**
 * Every kind of token the OPAL lexer can produce.
 * Keyword kinds are reached through the section sigil ({@code §}); several spellings
 * (compact and verbose) can map to the same kind.
 */
public enum TokenType
{
	// Structural symbols
	OPEN_BRACKET, CLOSE_BRACKET, OPEN_PAREN, CLOSE_PAREN,
	COLON, TILDE, HASH, QUESTION, COMMA, AT, DOT, EQUALS, ARROW,

	// Operator symbols
	PLUS, MINUS, STAR, STAR_STAR, SLASH, PERCENT, CARET,
	EQUAL_EQUAL, BANG, BANG_EQUAL,
	LESS, LESS_EQUAL, LESS_LESS, GREATER, GREATER_EQUAL, GREATER_GREATER,
	AMP, AMP_AMP, PIPE, PIPE_PIPE,

	// Literals and names
	INT_LITERAL, STR_LITERAL, BOOL_LITERAL, FLOAT_LITERAL, IDENTIFIER,

	// Module, functions and their declaration prefix
	MODULE, END_MODULE, FUNC, END_FUNC, USING,
	IN, OUT, EFFECTS, REQUIRES, ENSURES, TYPE_PARAM, WHERE, BODY, END_BODY,

	// Statements
	CALL, END_CALL, ARG, BIND, RETURN,
	FOR, END_FOR, WHILE, END_WHILE, DO, END_DO,
	IF, ELSE_IF, ELSE, END_IF,
	MATCH, END_MATCH, CASE, END_CASE,
	FOREACH, END_FOREACH, ASSIGN,
	TRY, END_TRY, CATCH, FINALLY, THROW, RETHROW, WHEN,
	SUBSCRIBE, UNSUBSCRIBE, BREAK, CONTINUE, PRINT, PRINTF, YIELD, YIELD_BREAK,

	// Expressions
	SOME, NONE, OK, ERR, RECORD, END_RECORD, FIELD,
	ARRAY, END_ARRAY, INDEX, LENGTH, GENERIC,
	NEW, END_NEW, THIS, END_THIS, BASE, END_BASE,
	LAMBDA, END_LAMBDA, AWAIT,
	INTERPOLATE, END_INTERPOLATE, EXPRESSION,
	NULL_COALESCE, NULL_CONDITIONAL, RANGE, INDEX_END, WITH, END_WITH,

	// Collections
	LIST, END_LIST, DICT, END_DICT, HASH_SET, END_HASH_SET, KEY_VALUE,
	PUSH, ADD, PUT, REMOVE, SET_INDEX, CLEAR, INSERT, HAS, KEY, VAL, COUNT,

	// Patterns
	VAR, POSITIONAL_PATTERN, PROPERTY_PATTERN, PROPERTY_MATCH, RELATIONAL_PATTERN, LIST_PATTERN, REST,

	// Classes and interfaces
	CLASS, END_CLASS, INTERFACE, END_INTERFACE, EXTENDS, IMPLEMENTS,
	METHOD, END_METHOD, FIELD_DEF, PROPERTY, END_PROPERTY,
	GET, END_GET, SET, END_SET, INIT, CONSTRUCTOR, END_CONSTRUCTOR,
	DELEGATE, END_DELEGATE, EVENT,

	// Type definitions
	TYPE_DEF, END_TYPE_DEF, VARIANT, ENUM, END_ENUM, ENUM_EXTENSION, END_ENUM_EXTENSION,

	// Metadata
	INVARIANT, TODO, FIXME, HACK, ASSUME,
	DECISION, END_DECISION, CHOSEN, REJECTED, REASON,
	CONTEXT, END_CONTEXT, VISIBLE, END_VISIBLE, HIDDEN, END_HIDDEN, FOCUS, FILE_REF,
	LOCK, AUTHOR, EXAMPLE, USES, SINCE, DEPRECATED,

	// Trivia, only kept when a caller asks for it
	WHITESPACE, NEWLINE, COMMENT,

	// Sentinels
	ERROR, EOF;

	/**
	 * @return True for whitespace, newline and comment tokens.
	 */
	public boolean isTrivia()
	{
		return this == WHITESPACE || this == NEWLINE || this == COMMENT;
	}

	/**
	 * @return True for the four literal kinds.
	 */
	public boolean isLiteral()
	{
		return this == INT_LITERAL || this == STR_LITERAL || this == BOOL_LITERAL || this == FLOAT_LITERAL;
	}
}
