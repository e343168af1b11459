package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class OkExpression implements Expression
{
	private final Span span;
	private final Expression value;

	public OkExpression(Span span, Expression value)
	{
		this.span = span;
		this.value = value;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitOkExpression(this);
	}

	@Override
	public String toString()
	{
		return "Ok(" + value + ")";
	}
}
