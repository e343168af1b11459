package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A numeric for loop over {@code from..to} by {@code step}.
 */
public class ForStatement implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String variable;
	private final Expression from;
	private final Expression to;
	private final Expression step;
	private final List<Statement> body;

	public ForStatement(Span span, String id, String variable, Expression from, Expression to, Expression step, List<Statement> body, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.variable = variable;
		this.from = from;
		this.to = to;
		this.step = step;
		this.body = List.copyOf(body);
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

	public String getId()
	{
		return id;
	}

	public String getVariable()
	{
		return variable;
	}

	public Expression getFrom()
	{
		return from;
	}

	public Expression getTo()
	{
		return to;
	}

	public Expression getStep()
	{
		return step;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}

	@Override
	public String toString()
	{
		return "For[" + id + "] " + variable + " = " + from + " to " + to + " step " + step;
	}
}
