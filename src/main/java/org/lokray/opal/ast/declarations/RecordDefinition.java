package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A record type declared at module level: {@code §D[id:Name] §FL[name:type] ... §/D[id]}.
 */
public class RecordDefinition implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final List<FieldDefinition> fields;

	public RecordDefinition(Span span, String id, String name, List<FieldDefinition> fields, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
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

	public String getId()
	{
		return id;
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
		return visitor.visitRecordDefinition(this);
	}

	@Override
	public String toString()
	{
		return "Record[" + id + ":" + name + "] " + fields;
	}
}
