package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class SomePattern implements Pattern
{
	private final Span span;
	private final Pattern inner;

	public SomePattern(Span span, Pattern inner)
	{
		this.span = span;
		this.inner = inner;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Pattern getInner()
	{
		return inner;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSomePattern(this);
	}

	@Override
	public String toString()
	{
		return "Some(" + inner + ")";
	}
}
