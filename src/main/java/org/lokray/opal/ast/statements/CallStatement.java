package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A call used as a statement. Either {@link #getTarget()} names the callee or, for a tag without a target, {@link #getTargetExpression()} computes it.
 */
public class CallStatement implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String target;
	private final Expression targetExpression;
	private final boolean fallible; // Written with a trailing '!'
	private final List<Expression> arguments;

	public CallStatement(Span span, String target, Expression targetExpression, boolean fallible, List<Expression> arguments, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.target = target;
		this.targetExpression = targetExpression;
		this.fallible = fallible;
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

	public boolean isFallible()
	{
		return fallible;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCallStatement(this);
	}

	@Override
	public String toString()
	{
		return "Call " + (targetExpression != null ? targetExpression.toString() : target) + (fallible ? "!" : "") + arguments;
	}
}
