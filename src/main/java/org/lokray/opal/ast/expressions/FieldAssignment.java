package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class FieldAssignment implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String name;
	private final Expression value;

	public FieldAssignment(Span span, String name, Expression value, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.name = name;
		this.value = value;
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

	public String getName()
	{
		return name;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFieldAssignment(this);
	}

	@Override
	public String toString()
	{
		return name + " = " + value;
	}
}
