package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class BaseExpression implements Expression
{
	private final Span span;

	public BaseExpression(Span span)
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
		return visitor.visitBaseExpression(this);
	}

	@Override
	public String toString()
	{
		return "base";
	}
}
