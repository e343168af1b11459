package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class AwaitExpression implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final Expression awaited;
	private final Boolean continueOnCapturedContext; // Null when unspecified

	public AwaitExpression(Span span, Expression awaited, Boolean continueOnCapturedContext, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.awaited = awaited;
		this.continueOnCapturedContext = continueOnCapturedContext;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	@Override
	public Map<String, List<String>> getAttributes()
	{
		return attributes;
	}

	public Expression getAwaited()
	{
		return awaited;
	}

	public Boolean getContinueOnCapturedContext()
	{
		return continueOnCapturedContext;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAwaitExpression(this);
	}

	@Override
	public String toString()
	{
		return "Await(" + awaited + ")";
	}
}
