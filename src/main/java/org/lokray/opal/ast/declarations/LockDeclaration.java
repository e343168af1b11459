package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * An edit lock held by an agent.
 */
public class LockDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String agent;

	public LockDeclaration(Span span, String agent, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.agent = agent;
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

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLockDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "lock " + agent;
	}
}
