package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.ast.patterns.Pattern;
import org.lokray.opal.lexer.Span;

import java.util.List;

/**
 * One arm of a match. The guard slot is never filled by the grammar and stays null.
 */
public class MatchCase implements ASTNode
{
	private final Span span;
	private final Pattern pattern;
	private final Expression guard;
	private final List<Statement> body;

	public MatchCase(Span span, Pattern pattern, Expression guard, List<Statement> body)
	{
		this.span = span;
		this.pattern = pattern;
		this.guard = guard;
		this.body = List.copyOf(body);
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	public Expression getGuard()
	{
		return guard;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitMatchCase(this);
	}

	@Override
	public String toString()
	{
		return "Case " + pattern + " " + body;
	}
}
