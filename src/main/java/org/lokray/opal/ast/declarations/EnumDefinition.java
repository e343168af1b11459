package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * An enumeration: {@code §EN[id:Name:underlying?]} with one member per line, closed by {@code §/EN[id]}.
 */
public class EnumDefinition implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final String underlyingType; // Null when the tag names none
	private final List<EnumMember> members;

	public EnumDefinition(Span span, String id, String name, String underlyingType, List<EnumMember> members, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.underlyingType = underlyingType;
		this.members = List.copyOf(members);
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

	public String getUnderlyingType()
	{
		return underlyingType;
	}

	public List<EnumMember> getMembers()
	{
		return members;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitEnumDefinition(this);
	}

	@Override
	public String toString()
	{
		return "Enum[" + id + ":" + name + "] " + members;
	}
}
