package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A generic type parameter and the constraints its where clauses added.
 */
public class TypeParameter implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String name;
	private final List<TypeConstraint> constraints;

	public TypeParameter(Span span, String name, List<TypeConstraint> constraints, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.name = name;
		this.constraints = List.copyOf(constraints);
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

	public List<TypeConstraint> getConstraints()
	{
		return constraints;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTypeParameter(this);
	}

	@Override
	public String toString()
	{
		return name + (constraints.isEmpty() ? "" : " : " + constraints);
	}
}
