package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Creates an array, either sized or from an element list.
 */
public class ArrayCreation implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String elementType;
	private final Expression size; // Null for an initializer list
	private final List<Expression> elements;

	public ArrayCreation(Span span, String id, String elementType, Expression size, List<Expression> elements, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.elementType = elementType;
		this.size = size;
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

	public Expression getSize()
	{
		return size;
	}

	public List<Expression> getElements()
	{
		return elements;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitArrayCreation(this);
	}

	@Override
	public String toString()
	{
		return "Array<" + elementType + ">" + (size != null ? "[" + size + "]" : elements.toString());
	}
}
