package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class IndexFromEnd implements Expression
{
	private final Span span;
	private final Expression offset;

	public IndexFromEnd(Span span, Expression offset)
	{
		this.span = span;
		this.offset = offset;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getOffset()
	{
		return offset;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIndexFromEnd(this);
	}

	@Override
	public String toString()
	{
		return "^" + offset;
	}
}
