package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class IntLiteral implements Expression
{
	private final Span span;
	private final long value;

	public IntLiteral(Span span, long value)
	{
		this.span = span;
		this.value = value;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public long getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIntLiteral(this);
	}

	@Override
	public String toString()
	{
		return "Int(" + value + ")";
	}
}
