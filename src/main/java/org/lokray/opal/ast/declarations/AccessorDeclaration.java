package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.statements.Statement;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A get, set or init accessor. An empty body means an auto-implemented accessor.
 */
public class AccessorDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final AccessorKind kind;
	private final Visibility visibility; // Null when the accessor keeps the property's visibility
	private final List<RequiresClause> preconditions;
	private final List<Statement> body;

	public AccessorDeclaration(Span span, AccessorKind kind, Visibility visibility, List<RequiresClause> preconditions, List<Statement> body, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.kind = kind;
		this.visibility = visibility;
		this.preconditions = List.copyOf(preconditions);
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

	public AccessorKind getKind()
	{
		return kind;
	}

	public Visibility getVisibility()
	{
		return visibility;
	}

	public List<RequiresClause> getPreconditions()
	{
		return preconditions;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAccessorDeclaration(this);
	}

	@Override
	public String toString()
	{
		return kind.name().toLowerCase();
	}
}
