package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class WildcardPattern implements Pattern
{
	private final Span span;

	public WildcardPattern(Span span)
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
		return visitor.visitWildcardPattern(this);
	}

	@Override
	public String toString()
	{
		return "_";
	}
}
