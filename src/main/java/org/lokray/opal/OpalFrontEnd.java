package org.lokray.opal;

import org.lokray.opal.ast.declarations.ModuleDeclaration;
import org.lokray.opal.lexer.Lexer;
import org.lokray.opal.lexer.Token;
import org.lokray.opal.parser.OpalParser;
import org.lokray.opal.util.CompilerConfig;
import org.lokray.opal.util.Diagnostic;
import org.lokray.opal.util.DiagnosticBag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Entry point a driver calls to turn OPAL text into a syntax tree.
 * Runs the lexer and the parser over one shared {@link DiagnosticBag}.
 */
public class OpalFrontEnd
{
	private static final Logger LOG = LoggerFactory.getLogger(OpalFrontEnd.class);

	private final CompilerConfig config;

	/**
	 * Uses the built-in defaults.
	 */
	public OpalFrontEnd()
	{
		this(CompilerConfig.defaults());
	}

	public OpalFrontEnd(CompilerConfig config)
	{
		this.config = Objects.requireNonNull(config, "config");
	}

	/**
	 * Lexes and parses one source text. Never throws on malformed input; problems end up
	 * in the returned unit's diagnostics.
	 *
	 * @param source The OPAL source text.
	 * @return The module, the tokens and the diagnostics.
	 */
	public CompilationUnit parse(String source)
	{
		DiagnosticBag diagnostics = config.newDiagnosticBag();

		// --- Lexical Analysis Phase ---
		Lexer lexer = new Lexer(source, diagnostics, config.isTraceEnabled());
		List<Token> allTokens = lexer.scanTokens();
		List<Token> parserTokens = Lexer.withoutTrivia(allTokens);
		LOG.debug("Lexing produced {} tokens ({} significant), {} diagnostics", allTokens.size(), parserTokens.size(),
				diagnostics.getReportedCount());

		// --- Parsing Phase ---
		OpalParser parser = new OpalParser(parserTokens, diagnostics, config.isTraceEnabled());
		ModuleDeclaration module = parser.parse();
		LOG.debug("Parsing produced module '{}' with {} functions, {} classes, {} interfaces; {} diagnostics",
				module.getName(), module.getFunctions().size(), module.getClasses().size(),
				module.getInterfaces().size(), diagnostics.getReportedCount());

		for (Diagnostic diagnostic : diagnostics.getDiagnostics())
		{
			LOG.debug("{}", diagnostic);
		}

		return new CompilationUnit(module, config.isKeepTrivia() ? allTokens : parserTokens, diagnostics);
	}
}
