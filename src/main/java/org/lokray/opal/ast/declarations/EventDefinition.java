package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A class event: {@code §EVT[id:Name:visibility:DelegateType]}.
 */
public class EventDefinition implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final Visibility visibility;
	private final String delegateType;

	public EventDefinition(Span span, String id, String name, Visibility visibility, String delegateType, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.visibility = visibility;
		this.delegateType = delegateType;
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

	public Visibility getVisibility()
	{
		return visibility;
	}

	public String getDelegateType()
	{
		return delegateType;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitEventDefinition(this);
	}

	@Override
	public String toString()
	{
		return "Event[" + id + ":" + name + "] " + delegateType;
	}
}
