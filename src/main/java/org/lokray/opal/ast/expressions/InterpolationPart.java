package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

/**
 * Either literal text or an embedded expression; exactly one is set.
 */
public class InterpolationPart implements ASTNode
{
	private final Span span;
	private final String text;
	private final Expression expression;

	public InterpolationPart(Span span, String text, Expression expression)
	{
		this.span = span;
		this.text = text;
		this.expression = expression;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public String getText()
	{
		return text;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInterpolationPart(this);
	}

	@Override
	public String toString()
	{
		return text != null ? "\"" + text + "\"" : "{" + expression + "}";
	}
}
