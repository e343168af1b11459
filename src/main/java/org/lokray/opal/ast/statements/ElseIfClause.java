package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;

public class ElseIfClause implements ASTNode
{
	private final Span span;
	private final Expression condition;
	private final List<Statement> body;

	public ElseIfClause(Span span, Expression condition, List<Statement> body)
	{
		this.span = span;
		this.condition = condition;
		this.body = List.copyOf(body);
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public Expression getCondition()
	{
		return condition;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitElseIfClause(this);
	}

	@Override
	public String toString()
	{
		return "ElseIf " + condition;
	}
}
