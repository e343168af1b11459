package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

/**
 * Produces the next element of an iterator function: {@code §YIELD expr}.
 */
public class YieldStatement implements Statement
{
	private final Span span;
	private final Expression value;

	public YieldStatement(Span span, Expression value)
	{
		this.span = span;
		this.value = value;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitYieldStatement(this);
	}

	@Override
	public String toString()
	{
		return "Yield " + value;
	}
}
