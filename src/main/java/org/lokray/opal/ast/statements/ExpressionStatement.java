package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

public class ExpressionStatement implements Statement
{
	private final Span span;
	private final Expression expression;

	public ExpressionStatement(Span span, Expression expression)
	{
		this.span = span;
		this.expression = expression;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public String toString()
	{
		return expression.toString();
	}
}
