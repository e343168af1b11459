package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

/**
 * Prints a value, with or without a trailing line break.
 */
public class PrintStatement implements Statement
{
	private final Span span;
	private final Expression value;
	private final boolean newline;

	public PrintStatement(Span span, Expression value, boolean newline)
	{
		this.span = span;
		this.value = value;
		this.newline = newline;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getValue()
	{
		return value;
	}

	public boolean isNewline()
	{
		return newline;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPrintStatement(this);
	}

	@Override
	public String toString()
	{
		return (newline ? "PrintLine " : "Print ") + value;
	}
}
