package org.lokray.opal.util;

/**
 * Stable identifiers for every diagnostic the front-end reports.
 */
public enum DiagnosticCode
{
	// Lexer
	UNEXPECTED_CHARACTER("OPAL0001"),
	UNTERMINATED_STRING("OPAL0002"),
	INVALID_TYPED_LITERAL("OPAL0003"),
	INVALID_ESCAPE_SEQUENCE("OPAL0004"),
	UNKNOWN_SECTION_MARKER("OPAL0005"),

	// Parser
	UNEXPECTED_TOKEN("OPAL0100"),
	MISMATCHED_ID("OPAL0101"),
	MISSING_REQUIRED_ATTRIBUTE("OPAL0102"),
	OPERATOR_ARGUMENT_COUNT("OPAL0110"),
	INVALID_OPERATOR("OPAL0111"),
	TYPE_PARAMETER_NOT_FOUND("OPAL0115");

	private final String id;

	DiagnosticCode(String id)
	{
		this.id = id;
	}

	public String getId()
	{
		return id;
	}
}
