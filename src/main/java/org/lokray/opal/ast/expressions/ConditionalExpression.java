package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

/**
 * {@code (? condition whenTrue whenFalse)}
 */
public class ConditionalExpression implements Expression
{
	private final Span span;
	private final Expression condition;
	private final Expression whenTrue;
	private final Expression whenFalse;

	public ConditionalExpression(Span span, Expression condition, Expression whenTrue, Expression whenFalse)
	{
		this.span = span;
		this.condition = condition;
		this.whenTrue = whenTrue;
		this.whenFalse = whenFalse;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public Expression getWhenTrue()
	{
		return whenTrue;
	}

	public Expression getWhenFalse()
	{
		return whenFalse;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitConditionalExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + condition + " ? " + whenTrue + " : " + whenFalse + ")";
	}
}
