package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class OkPattern implements Pattern
{
	private final Span span;
	private final Pattern inner;

	public OkPattern(Span span, Pattern inner)
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
		return visitor.visitOkPattern(this);
	}

	@Override
	public String toString()
	{
		return "Ok(" + inner + ")";
	}
}
