package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class ErrExpression implements Expression
{
	private final Span span;
	private final Expression error;

	public ErrExpression(Span span, Expression error)
	{
		this.span = span;
		this.error = error;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getError()
	{
		return error;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitErrExpression(this);
	}

	@Override
	public String toString()
	{
		return "Err(" + error + ")";
	}
}
