package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A list literal: {@code §LIST[id:type] elem* §/LIST[id]}.
 */
public class ListCreation implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String elementType;
	private final List<Expression> elements;

	public ListCreation(Span span, String id, String elementType, List<Expression> elements, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.elementType = elementType;
		this.elements = List.copyOf(elements);
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

	public String getElementType()
	{
		return elementType;
	}

	public List<Expression> getElements()
	{
		return elements;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitListCreation(this);
	}

	@Override
	public String toString()
	{
		return "List[" + id + ":" + elementType + "] " + elements;
	}
}
