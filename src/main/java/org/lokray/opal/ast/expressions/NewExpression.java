package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Object construction with constructor arguments and property initializers.
 */
public class NewExpression implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String typeName;
	private final List<String> typeArguments;
	private final List<Expression> arguments;
	private final List<PropertyAssignment> initializers;

	public NewExpression(Span span, String typeName, List<String> typeArguments, List<Expression> arguments, List<PropertyAssignment> initializers, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.typeName = typeName;
		this.typeArguments = List.copyOf(typeArguments);
		this.arguments = List.copyOf(arguments);
		this.initializers = List.copyOf(initializers);
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

	public List<Expression> getArguments()
	{
		return arguments;
	}

	public List<PropertyAssignment> getInitializers()
	{
		return initializers;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitNewExpression(this);
	}

	@Override
	public String toString()
	{
		return "New(" + typeName + (typeArguments.isEmpty() ? "" : "<" + String.join(", ", typeArguments) + ">") + ", " + arguments + ")";
	}
}
