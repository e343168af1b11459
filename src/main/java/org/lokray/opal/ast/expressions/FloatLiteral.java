package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class FloatLiteral implements Expression
{
	private final Span span;
	private final double value;

	public FloatLiteral(Span span, double value)
	{
		this.span = span;
		this.value = value;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public double getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFloatLiteral(this);
	}

	@Override
	public String toString()
	{
		return "Float(" + value + ")";
	}
}
