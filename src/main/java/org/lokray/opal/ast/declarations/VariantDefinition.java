package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * One case of a union. A variant without fields is a plain tag.
 */
public class VariantDefinition implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String name;
	private final List<FieldDefinition> fields;

	public VariantDefinition(Span span, String name, List<FieldDefinition> fields, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.name = name;
		this.fields = List.copyOf(fields);
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

	public List<FieldDefinition> getFields()
	{
		return fields;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitVariantDefinition(this);
	}

	@Override
	public String toString()
	{
		return "Variant " + name + fields;
	}
}
