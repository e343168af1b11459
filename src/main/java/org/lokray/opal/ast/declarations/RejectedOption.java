package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;

public class RejectedOption implements ASTNode
{
	private final Span span;
	private final String name;
	private final List<String> reasons;

	public RejectedOption(Span span, String name, List<String> reasons)
	{
		this.span = span;
		this.name = name;
		this.reasons = List.copyOf(reasons);
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public String getName()
	{
		return name;
	}

	public List<String> getReasons()
	{
		return reasons;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRejectedOption(this);
	}

	@Override
	public String toString()
	{
		return "rejected " + name;
	}
}
