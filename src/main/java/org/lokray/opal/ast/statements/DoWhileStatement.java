package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A loop that runs its body once before checking the condition.
 */
public class DoWhileStatement implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final List<Statement> body;
	private final Expression condition;

	public DoWhileStatement(Span span, String id, List<Statement> body, Expression condition, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.body = List.copyOf(body);
		this.condition = condition;
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

	public List<Statement> getBody()
	{
		return body;
	}

	public Expression getCondition()
	{
		return condition;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDoWhileStatement(this);
	}

	@Override
	public String toString()
	{
		return "Do[" + id + "] while " + condition;
	}
}
