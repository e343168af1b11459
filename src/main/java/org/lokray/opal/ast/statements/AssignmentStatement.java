package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

public class AssignmentStatement implements Statement
{
	private final Span span;
	private final Expression target;
	private final Expression value;

	public AssignmentStatement(Span span, Expression target, Expression value)
	{
		this.span = span;
		this.target = target;
		this.value = value;
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

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentStatement(this);
	}

	@Override
	public String toString()
	{
		return target + " = " + value;
	}
}
