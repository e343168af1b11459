package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class NoneExpression implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String typeName;

	public NoneExpression(Span span, String typeName, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.typeName = typeName;
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

	public String getTypeName()
	{
		return typeName;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitNoneExpression(this);
	}

	@Override
	public String toString()
	{
		return "None" + (typeName != null ? "<" + typeName + ">" : "");
	}
}
