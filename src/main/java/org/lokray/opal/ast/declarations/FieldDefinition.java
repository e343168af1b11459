package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class FieldDefinition implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String name;
	private final String type;
	private final Expression defaultValue; // Null when the field has no default

	public FieldDefinition(Span span, String name, String type, Expression defaultValue, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.name = name;
		this.type = type;
		this.defaultValue = defaultValue;
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

	public String getType()
	{
		return type;
	}

	public Expression getDefaultValue()
	{
		return defaultValue;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFieldDefinition(this);
	}

	@Override
	public String toString()
	{
		return name + ": " + type + (defaultValue == null ? "" : " = " + defaultValue);
	}
}
