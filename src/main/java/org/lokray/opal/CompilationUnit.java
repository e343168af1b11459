package org.lokray.opal;

import org.lokray.opal.ast.declarations.ModuleDeclaration;
import org.lokray.opal.lexer.Token;
import org.lokray.opal.util.DiagnosticBag;

import java.util.List;

/**
 * The result of running the front-end over one source text.
 *
 * @param module      The parsed module; never null, possibly empty when the text held no module.
 * @param tokens      The lexer output, trivia included only when the configuration keeps it.
 * @param diagnostics Every problem reported while lexing and parsing.
 */
public record CompilationUnit(ModuleDeclaration module, List<Token> tokens, DiagnosticBag diagnostics)
{
	public CompilationUnit
	{
		tokens = List.copyOf(tokens);
	}

	public boolean hasErrors()
	{
		return diagnostics.hasErrors();
	}
}
