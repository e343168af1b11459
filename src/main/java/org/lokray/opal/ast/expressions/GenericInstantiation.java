package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class GenericInstantiation implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String typeName;
	private final List<String> typeArguments;

	public GenericInstantiation(Span span, String typeName, List<String> typeArguments, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.typeName = typeName;
		this.typeArguments = List.copyOf(typeArguments);
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

	public List<String> getTypeArguments()
	{
		return typeArguments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitGenericInstantiation(this);
	}

	@Override
	public String toString()
	{
		return typeName + "<" + String.join(", ", typeArguments) + ">";
	}
}
