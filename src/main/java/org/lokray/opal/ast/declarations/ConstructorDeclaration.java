package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.statements.Statement;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A class constructor.
 */
public class ConstructorDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final Visibility visibility;
	private final List<Parameter> parameters;
	private final List<RequiresClause> preconditions;
	private final ConstructorInitializer initializer; // base(...) or this(...) call
	private final List<Statement> body;

	public ConstructorDeclaration(Span span, String id, Visibility visibility, List<Parameter> parameters, List<RequiresClause> preconditions, ConstructorInitializer initializer, List<Statement> body, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.visibility = visibility;
		this.parameters = List.copyOf(parameters);
		this.preconditions = List.copyOf(preconditions);
		this.initializer = initializer;
		this.body = List.copyOf(body);
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

	public Visibility getVisibility()
	{
		return visibility;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public List<RequiresClause> getPreconditions()
	{
		return preconditions;
	}

	public ConstructorInitializer getInitializer()
	{
		return initializer;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitConstructorDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Constructor[" + id + "]";
	}
}
