package org.lokray.opal.parser;

import org.lokray.opal.ast.declarations.FunctionDeclaration;
import org.lokray.opal.ast.declarations.ModuleDeclaration;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.ast.statements.Statement;
import org.lokray.opal.lexer.Lexer;
import org.lokray.opal.util.DiagnosticBag;

import java.util.List;

/**
 * Lexes and parses test sources with one fresh diagnostic bag.
 */
final class ParseResult
{
	final ModuleDeclaration module;
	final Expression expression;
	final DiagnosticBag diagnostics;

	private ParseResult(ModuleDeclaration module, Expression expression, DiagnosticBag diagnostics)
	{
		this.module = module;
		this.expression = expression;
		this.diagnostics = diagnostics;
	}

	static ParseResult module(String source)
	{
		DiagnosticBag diagnostics = new DiagnosticBag();
		OpalParser parser = new OpalParser(new Lexer(source, diagnostics).tokenize(), diagnostics);
		return new ParseResult(parser.parse(), null, diagnostics);
	}

	/**
	 * Wraps statements in a module with one function {@code f1}.
	 */
	static ParseResult body(String statements)
	{
		return module("§M[m1:Test] §F[f1:Run] " + statements + " §/F[f1] §/M[m1]");
	}

	static ParseResult expression(String source)
	{
		DiagnosticBag diagnostics = new DiagnosticBag();
		OpalParser parser = new OpalParser(new Lexer(source, diagnostics).tokenize(), diagnostics);
		return new ParseResult(null, parser.parseStandaloneExpression(), diagnostics);
	}

	FunctionDeclaration function()
	{
		return module.getFunctions().get(0);
	}

	List<Statement> statements()
	{
		return function().getBody();
	}

	Statement statement(int index)
	{
		return statements().get(index);
	}
}
