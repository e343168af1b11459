package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

/**
 * A range; either end may be open.
 */
public class RangeExpression implements Expression
{
	private final Span span;
	private final Expression start;
	private final Expression end;

	public RangeExpression(Span span, Expression start, Expression end)
	{
		this.span = span;
		this.start = start;
		this.end = end;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getStart()
	{
		return start;
	}

	public Expression getEnd()
	{
		return end;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRangeExpression(this);
	}

	@Override
	public String toString()
	{
		return (start != null ? start.toString() : "") + ".." + (end != null ? end.toString() : "");
	}
}
