package org.lokray.opal.util;

import org.lokray.opal.lexer.Span;

import java.util.Objects;

/**
 * One problem found in the source: where, what kind, a human readable message and
 * how severe it is.
 */
public final class Diagnostic
{
	private final Span span;
	private final DiagnosticCode code;
	private final String message;
	private final Severity severity;

	public Diagnostic(Span span, DiagnosticCode code, String message, Severity severity)
	{
		this.span = Objects.requireNonNull(span, "span");
		this.code = Objects.requireNonNull(code, "code");
		this.message = Objects.requireNonNull(message, "message");
		this.severity = Objects.requireNonNull(severity, "severity");
	}

	public Span getSpan()
	{
		return span;
	}

	public DiagnosticCode getCode()
	{
		return code;
	}

	public String getMessage()
	{
		return message;
	}

	public Severity getSeverity()
	{
		return severity;
	}

	public boolean isError()
	{
		return severity == Severity.ERROR;
	}

	@Override
	public String toString()
	{
		return "(" + span.getLine() + "," + span.getColumn() + "): " + severity.name().toLowerCase() + " " + code.getId() + ": " + message;
	}
}
