package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

public class LiteralPattern implements Pattern
{
	private final Span span;
	private final Expression literal;

	public LiteralPattern(Span span, Expression literal)
	{
		this.span = span;
		this.literal = literal;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getLiteral()
	{
		return literal;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralPattern(this);
	}

	@Override
	public String toString()
	{
		return literal.toString();
	}
}
