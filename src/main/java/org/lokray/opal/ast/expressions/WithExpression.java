package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;

/**
 * A copy of the target with some properties replaced.
 */
public class WithExpression implements Expression
{
	private final Span span;
	private final Expression target;
	private final List<PropertyAssignment> assignments;

	public WithExpression(Span span, Expression target, List<PropertyAssignment> assignments)
	{
		this.span = span;
		this.target = target;
		this.assignments = List.copyOf(assignments);
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getTarget()
	{
		return target;
	}

	public List<PropertyAssignment> getAssignments()
	{
		return assignments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWithExpression(this);
	}

	@Override
	public String toString()
	{
		return target + " with " + assignments;
	}
}
