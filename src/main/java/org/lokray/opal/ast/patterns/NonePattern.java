package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class NonePattern implements Pattern
{
	private final Span span;

	public NonePattern(Span span)
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
		return visitor.visitNonePattern(this);
	}

	@Override
	public String toString()
	{
		return "None";
	}
}
