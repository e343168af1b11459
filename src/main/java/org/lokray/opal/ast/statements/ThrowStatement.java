package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

public class ThrowStatement implements Statement
{
	private final Span span;
	private final Expression exception;

	public ThrowStatement(Span span, Expression exception)
	{
		this.span = span;
		this.exception = exception;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getException()
	{
		return exception;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitThrowStatement(this);
	}

	@Override
	public String toString()
	{
		return "Throw" + (exception != null ? " " + exception : "");
	}
}
