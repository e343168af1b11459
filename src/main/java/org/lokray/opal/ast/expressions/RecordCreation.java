package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Creates a record from named field values.
 */
public class RecordCreation implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String typeName;
	private final List<FieldAssignment> fields;

	public RecordCreation(Span span, String typeName, List<FieldAssignment> fields, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.typeName = typeName;
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

	public String getTypeName()
	{
		return typeName;
	}

	public List<FieldAssignment> getFields()
	{
		return fields;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRecordCreation(this);
	}

	@Override
	public String toString()
	{
		return "Record(" + typeName + ", " + fields + ")";
	}
}
