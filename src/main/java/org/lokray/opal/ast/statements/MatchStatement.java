package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A match used as a statement.
 */
public class MatchStatement implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final Expression target;
	private final List<MatchCase> cases;

	public MatchStatement(Span span, String id, Expression target, List<MatchCase> cases, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.target = target;
		this.cases = List.copyOf(cases);
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

	public Expression getTarget()
	{
		return target;
	}

	public List<MatchCase> getCases()
	{
		return cases;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMatchStatement(this);
	}

	@Override
	public String toString()
	{
		return "Match[" + id + "] " + target;
	}
}
