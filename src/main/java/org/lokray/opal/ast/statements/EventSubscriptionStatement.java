package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

/**
 * Subscribes a handler to an event, or unsubscribes it.
 */
public class EventSubscriptionStatement implements Statement
{
	private final Span span;
	private final Expression event;
	private final Expression handler;
	private final boolean subscribe; // False for unsubscribe

	public EventSubscriptionStatement(Span span, Expression event, Expression handler, boolean subscribe)
	{
		this.span = span;
		this.event = event;
		this.handler = handler;
		this.subscribe = subscribe;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getEvent()
	{
		return event;
	}

	public Expression getHandler()
	{
		return handler;
	}

	public boolean isSubscribe()
	{
		return subscribe;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitEventSubscriptionStatement(this);
	}

	@Override
	public String toString()
	{
		return event + (subscribe ? " += " : " -= ") + handler;
	}
}
