package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * An inline example in a function header: {@code §EX[id:msg] (Add 2 3) → 5}.
 * The id and the message are both optional.
 */
public class ExampleDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final Expression expression;
	private final Expression expected;
	private final String message;

	public ExampleDeclaration(Span span, String id, Expression expression, Expression expected, String message, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.expression = expression;
		this.expected = expected;
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

	public String getId()
	{
		return id;
	}

	public Expression getExpression()
	{
		return expression;
	}

	public Expression getExpected()
	{
		return expected;
	}

	public String getMessage()
	{
		return message;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExampleDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Example " + expression + " -> " + expected;
	}
}
