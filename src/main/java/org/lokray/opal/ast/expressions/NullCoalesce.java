package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class NullCoalesce implements Expression
{
	private final Span span;
	private final Expression left;
	private final Expression right;

	public NullCoalesce(Span span, Expression left, Expression right)
	{
		this.span = span;
		this.left = left;
		this.right = right;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitNullCoalesce(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " ?? " + right + ")";
	}
}
