package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class YieldBreakStatement implements Statement
{
	private final Span span;

	public YieldBreakStatement(Span span)
	{
		this.span = span;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitYieldBreakStatement(this);
	}

	@Override
	public String toString()
	{
		return "YieldBreak";
	}
}
