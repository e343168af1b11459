package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A module-level invariant.
 */
public class InvariantDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final Expression condition;
	private final String message;

	public InvariantDeclaration(Span span, Expression condition, String message, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.condition = condition;
		this.message = message;
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

	public Expression getCondition()
	{
		return condition;
	}

	public String getMessage()
	{
		return message;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInvariantDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "invariant " + condition;
	}
}
