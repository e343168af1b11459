package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A call in expression position. Either {@link #getTarget()} names the callee or {@link #getTargetExpression()} computes it.
 */
public class CallExpression implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String target;
	private final Expression targetExpression;
	private final List<Expression> arguments;

	public CallExpression(Span span, String target, Expression targetExpression, List<Expression> arguments, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.target = target;
		this.targetExpression = targetExpression;
		this.arguments = List.copyOf(arguments);
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

	public String getTarget()
	{
		return target;
	}

	public Expression getTargetExpression()
	{
		return targetExpression;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallExpression(this);
	}

	@Override
	public String toString()
	{
		return "Call(" + (targetExpression != null ? targetExpression.toString() : target) + ", " + arguments + ")";
	}
}
