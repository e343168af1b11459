package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

/**
 * Stands in for an expression that could not be parsed. A diagnostic is always reported with it.
 */
public class MissingExpression implements Expression
{
	private final Span span;

	public MissingExpression(Span span)
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
		return visitor.visitMissingExpression(this);
	}

	@Override
	public String toString()
	{
		return "<missing>";
	}
}
