package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class ArrayAccess implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final Expression array;
	private final Expression index;

	public ArrayAccess(Span span, Expression array, Expression index, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.array = array;
		this.index = index;
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

	public Expression getIndex()
	{
		return index;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArrayAccess(this);
	}

	@Override
	public String toString()
	{
		return array + "[" + index + "]";
	}
}
