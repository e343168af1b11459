package org.lokray.opal.util;

import org.junit.jupiter.api.Test;
import org.lokray.opal.lexer.Span;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticBagTest
{
	private static final Span SPAN = new Span(4, 2, 1, 5);

	@Test
	void keepsReportOrder()
	{
		DiagnosticBag bag = new DiagnosticBag();
		bag.reportUnexpectedToken(SPAN, "expression", "]");
		bag.reportMismatchedId(SPAN, "FUNC", "f1", "f2");

		assertEquals(2, bag.size());
		assertEquals(DiagnosticCode.UNEXPECTED_TOKEN, bag.getDiagnostics().get(0).getCode());
		assertEquals(DiagnosticCode.MISMATCHED_ID, bag.getDiagnostics().get(1).getCode());
		assertTrue(bag.hasErrors());
	}

	@Test
	void warningsDoNotMarkErrors()
	{
		DiagnosticBag bag = new DiagnosticBag();
		bag.reportWarning(SPAN, DiagnosticCode.UNEXPECTED_TOKEN, "odd");

		assertFalse(bag.hasErrors());
		assertFalse(bag.isEmpty());
		assertEquals(Severity.WARNING, bag.getDiagnostics().get(0).getSeverity());
	}

	@Test
	void limitDropsButStillCounts()
	{
		DiagnosticBag bag = new DiagnosticBag(2);
		for (int i = 0; i < 5; i++)
		{
			bag.reportUnterminatedString(SPAN);
		}

		assertEquals(2, bag.size());
		assertEquals(5, bag.getReportedCount());
		assertTrue(bag.hasErrors());
	}

	@Test
	void withCodeFilters()
	{
		DiagnosticBag bag = new DiagnosticBag();
		bag.reportUnexpectedCharacter(SPAN, '@');
		bag.reportInvalidEscape(SPAN, 'q');
		bag.reportUnexpectedCharacter(SPAN, '$');

		assertEquals(2, bag.withCode(DiagnosticCode.UNEXPECTED_CHARACTER).size());
		assertEquals(1, bag.count(DiagnosticCode.INVALID_ESCAPE_SEQUENCE));
		assertEquals(0, bag.count(DiagnosticCode.MISMATCHED_ID));
	}

	@Test
	void resetClearsEverything()
	{
		DiagnosticBag bag = new DiagnosticBag();
		bag.reportMissingRequiredAttribute(SPAN, "MODULE", "id");
		bag.reset();

		assertTrue(bag.isEmpty());
		assertFalse(bag.hasErrors());
		assertEquals(0, bag.getReportedCount());
	}

	@Test
	void storedListIsReadOnly()
	{
		DiagnosticBag bag = new DiagnosticBag();
		bag.reportUnterminatedString(SPAN);

		assertThrows(UnsupportedOperationException.class, () -> bag.getDiagnostics().clear());
	}

	@Test
	void negativeLimitIsRejected()
	{
		assertThrows(IllegalArgumentException.class, () -> new DiagnosticBag(-1));
	}

	@Test
	void formattedDiagnosticCarriesPositionAndCode()
	{
		DiagnosticBag bag = new DiagnosticBag();
		bag.reportMismatchedId(SPAN, "FUNC", "f1", "f2");

		assertEquals("(1,5): error OPAL0101: FUNC opened with id 'f1' but closed with id 'f2'.",
				bag.getDiagnostics().get(0).toString());
	}
}
