package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class FieldAccess implements Expression
{
	private final Span span;
	private final Expression target;
	private final String member;

	public FieldAccess(Span span, Expression target, String member)
	{
		this.span = span;
		this.target = target;
		this.member = member;
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

	public String getMember()
	{
		return member;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFieldAccess(this);
	}

	@Override
	public String toString()
	{
		return target + "." + member;
	}
}
