package org.lokray.opal.util;

import org.lokray.opal.lexer.Span;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Collects the diagnostics of one compilation in the order they were reported.
 * Reporting never throws; the lexer and parser keep going after every entry.
 */
public class DiagnosticBag
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private final int limit; // 0 means unlimited
	private boolean hasErrors = false; // Set once any error-severity entry is reported
	private int reportedCount = 0;

	public DiagnosticBag()
	{
		this(0);
	}

	/**
	 * @param limit The maximum number of entries to keep; 0 keeps everything.
	 */
	public DiagnosticBag(int limit)
	{
		if (limit < 0)
		{
			throw new IllegalArgumentException("Diagnostic limit must be >= 0, got " + limit);
		}
		this.limit = limit;
	}

	/**
	 * Appends a diagnostic. Entries past the configured limit are counted but not stored.
	 *
	 * @param diagnostic The diagnostic to add.
	 */
	public void add(Diagnostic diagnostic)
	{
		reportedCount++;
		if (diagnostic.isError())
		{
			hasErrors = true;
		}
		if (limit == 0 || diagnostics.size() < limit)
		{
			diagnostics.add(diagnostic);
		}
	}

	/**
	 * Reports an error-severity diagnostic.
	 *
	 * @param span    Where the problem is.
	 * @param code    The kind of problem.
	 * @param message The message.
	 */
	public void reportError(Span span, DiagnosticCode code, String message)
	{
		add(new Diagnostic(span, code, message, Severity.ERROR));
	}

	public void reportWarning(Span span, DiagnosticCode code, String message)
	{
		add(new Diagnostic(span, code, message, Severity.WARNING));
	}

	public void reportUnexpectedCharacter(Span span, char c)
	{
		reportError(span, DiagnosticCode.UNEXPECTED_CHARACTER, "Unexpected character '" + c + "'.");
	}

	public void reportUnterminatedString(Span span)
	{
		reportError(span, DiagnosticCode.UNTERMINATED_STRING, "Unterminated string literal.");
	}

	public void reportInvalidEscape(Span span, char escaped)
	{
		reportError(span, DiagnosticCode.INVALID_ESCAPE_SEQUENCE, "Invalid escape sequence '\\" + escaped + "'.");
	}

	public void reportInvalidTypedLiteral(Span span, String prefix, String payload)
	{
		reportError(span, DiagnosticCode.INVALID_TYPED_LITERAL, "Invalid " + prefix + " literal '" + payload + "'.");
	}

	public void reportUnknownSectionMarker(Span span, String keyword)
	{
		reportError(span, DiagnosticCode.UNKNOWN_SECTION_MARKER, "Unknown section marker '§" + keyword + "'.");
	}

	public void reportUnexpectedToken(Span span, String expected, String found)
	{
		reportError(span, DiagnosticCode.UNEXPECTED_TOKEN, "Expected " + expected + " but found '" + found + "'.");
	}

	public void reportMissingRequiredAttribute(Span span, String construct, String attribute)
	{
		reportError(span, DiagnosticCode.MISSING_REQUIRED_ATTRIBUTE, construct + " is missing required attribute '" + attribute + "'.");
	}

	/**
	 * Reports an opening tag whose id differs from the id on its closing tag.
	 *
	 * @param span      The closing tag's span.
	 * @param construct The construct kind, e.g. "FUNC".
	 * @param openId    The id declared on the opening tag.
	 * @param closeId   The id found on the closing tag.
	 */
	public void reportMismatchedId(Span span, String construct, String openId, String closeId)
	{
		reportError(span, DiagnosticCode.MISMATCHED_ID,
				construct + " opened with id '" + openId + "' but closed with id '" + closeId + "'.");
	}

	/**
	 * @return True if at least one error-severity diagnostic was reported.
	 */
	public boolean hasErrors()
	{
		return hasErrors;
	}

	/**
	 * @return The stored diagnostics, in report order.
	 */
	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}

	/**
	 * @param code The code to look for.
	 * @return The stored diagnostics carrying {@code code}.
	 */
	public List<Diagnostic> withCode(DiagnosticCode code)
	{
		List<Diagnostic> result = new ArrayList<>();
		for (Diagnostic diagnostic : diagnostics)
		{
			if (diagnostic.getCode() == code)
			{
				result.add(diagnostic);
			}
		}
		return result;
	}

	public int count(DiagnosticCode code)
	{
		return withCode(code).size();
	}

	public int size()
	{
		return diagnostics.size();
	}

	public boolean isEmpty()
	{
		return diagnostics.isEmpty();
	}

	/**
	 * @return How many diagnostics were reported, including those dropped by the limit.
	 */
	public int getReportedCount()
	{
		return reportedCount;
	}

	/**
	 * Clears all entries and the error flag.
	 */
	public void reset()
	{
		diagnostics.clear();
		hasErrors = false;
		reportedCount = 0;
	}
}
