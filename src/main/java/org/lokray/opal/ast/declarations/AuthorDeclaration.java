package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class AuthorDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String agent;
	private final String task;

	public AuthorDeclaration(Span span, String agent, String task, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.agent = agent;
		this.task = task;
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

	public String getAgent()
	{
		return agent;
	}

	public String getTask()
	{
		return task;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAuthorDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "author " + agent;
	}
}
