package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

/**
 * A return statement, with an optional value.
 */
public class ReturnStatement implements Statement
{
	private final Span span;
	private final Expression value;

	public ReturnStatement(Span span, Expression value)
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
		return visitor.visitReturnStatement(this);
	}

	@Override
	public String toString()
	{
		return "Return" + (value != null ? " " + value : "");
	}
}
