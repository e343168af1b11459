package org.lokray.opal.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CompilerConfigTest
{
	@Test
	void builtInDefaults()
	{
		CompilerConfig config = CompilerConfig.defaults();

		assertFalse(config.isTraceEnabled());
		assertFalse(config.isKeepTrivia());
		assertEquals(0, config.getDiagnosticsLimit());
	}

	@Test
	void readsProperties()
	{
		Properties props = new Properties();
		props.setProperty(CompilerConfig.TRACE, "true");
		props.setProperty(CompilerConfig.DIAGNOSTICS_LIMIT, " 3 ");
		props.setProperty(CompilerConfig.KEEP_TRIVIA, "TRUE");

		CompilerConfig config = new CompilerConfig(props);

		assertTrue(config.isTraceEnabled());
		assertTrue(config.isKeepTrivia());
		assertEquals(3, config.getDiagnosticsLimit());
	}

	@Test
	void emptyPropertiesFallBackToDefaults()
	{
		CompilerConfig config = new CompilerConfig(new Properties());

		assertFalse(config.isTraceEnabled());
		assertEquals(0, config.getDiagnosticsLimit());
	}

	@Test
	void invalidLimitIsRejected()
	{
		Properties notANumber = new Properties();
		notANumber.setProperty(CompilerConfig.DIAGNOSTICS_LIMIT, "many");
		assertThrows(IllegalArgumentException.class, () -> new CompilerConfig(notANumber));

		Properties negative = new Properties();
		negative.setProperty(CompilerConfig.DIAGNOSTICS_LIMIT, "-2");
		assertThrows(IllegalArgumentException.class, () -> new CompilerConfig(negative));
	}

	@Test
	void missingFileKeepsDefaults(@TempDir Path directory)
	{
		CompilerConfig config = CompilerConfig.load(directory.resolve("absent.conf"));

		assertEquals(0, config.getDiagnosticsLimit());
		assertFalse(config.isKeepTrivia());
	}

	@Test
	void userFileOverlaysDefaults(@TempDir Path directory) throws IOException
	{
		Path file = directory.resolve("opal.conf");
		Files.writeString(file, "opal.diagnostics.limit = 7\nopal.lexer.keep_trivia = true\n");

		CompilerConfig config = CompilerConfig.load(file);

		assertEquals(7, config.getDiagnosticsLimit());
		assertTrue(config.isKeepTrivia());
		assertFalse(config.isTraceEnabled());
	}

	@Test
	void bagHonoursTheLimit()
	{
		Properties props = new Properties();
		props.setProperty(CompilerConfig.DIAGNOSTICS_LIMIT, "1");
		DiagnosticBag bag = new CompilerConfig(props).newDiagnosticBag();

		bag.reportUnterminatedString(org.lokray.opal.lexer.Span.EMPTY);
		bag.reportUnterminatedString(org.lokray.opal.lexer.Span.EMPTY);

		assertEquals(1, bag.size());
		assertEquals(2, bag.getReportedCount());
	}
}
