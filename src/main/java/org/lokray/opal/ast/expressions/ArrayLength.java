package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class ArrayLength implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final Expression array;

	public ArrayLength(Span span, Expression array, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.array = array;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	@Override
	public Map<String, List<String>> getAttributes()
	{
		return attributes;
	}

	public Expression getArray()
	{
		return array;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArrayLength(this);
	}

	@Override
	public String toString()
	{
		return "Len(" + array + ")";
	}
}
