package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class BoolLiteral implements Expression
{
	private final Span span;
	private final boolean value;

	public BoolLiteral(Span span, boolean value)
	{
		this.span = span;
		this.value = value;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public boolean isValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBoolLiteral(this);
	}

	@Override
	public String toString()
	{
		return "Bool(" + value + ")";
	}
}
