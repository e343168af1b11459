package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A todo, fixme or hack marker.
 */
public class IssueDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final IssueKind kind;
	private final String id;
	private final String category;
	private final IssuePriority priority;
	private final String description;

	public IssueDeclaration(Span span, IssueKind kind, String id, String category, IssuePriority priority, String description, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.kind = kind;
		this.id = id;
		this.category = category;
		this.priority = priority;
		this.description = description;
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

	public IssueKind getKind()
	{
		return kind;
	}

	public String getId()
	{
		return id;
	}

	public String getCategory()
	{
		return category;
	}

	public IssuePriority getPriority()
	{
		return priority;
	}

	public String getDescription()
	{
		return description;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIssueDeclaration(this);
	}

	@Override
	public String toString()
	{
		return kind + " " + description;
	}
}
