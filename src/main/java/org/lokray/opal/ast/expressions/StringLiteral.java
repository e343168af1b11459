package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class StringLiteral implements Expression
{
	private final Span span;
	private final String value;

	public StringLiteral(Span span, String value)
	{
		this.span = span;
		this.value = value;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public String getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitStringLiteral(this);
	}

	@Override
	public String toString()
	{
		return "Str(\"" + value + "\")";
	}
}
