package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

/**
 * A reference to a named value; dotted names stay one reference.
 */
public class ReferenceExpression implements Expression
{
	private final Span span;
	private final String name;

	public ReferenceExpression(Span span, String name)
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
		return visitor.visitReferenceExpression(this);
	}

	@Override
	public String toString()
	{
		return "Ref(" + name + ")";
	}
}
