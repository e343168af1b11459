package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

/**
 * Binds the matched value to a name.
 */
public class VariablePattern implements Pattern
{
	private final Span span;
	private final String name;

	public VariablePattern(Span span, String name)
	{
		this.span = span;
		this.name = name;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public String getName()
	{
		return name;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariablePattern(this);
	}

	@Override
	public String toString()
	{
		return name;
	}
}
