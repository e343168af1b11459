package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * An if statement with optional else-if clauses and else branch.
 */
public class IfStatement implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final Expression condition;
	private final List<Statement> thenBody;
	private final List<ElseIfClause> elseIfClauses;
	private final List<Statement> elseBody; // Null when there is no else branch

	public IfStatement(Span span, String id, Expression condition, List<Statement> thenBody, List<ElseIfClause> elseIfClauses, List<Statement> elseBody, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.condition = condition;
		this.thenBody = List.copyOf(thenBody);
		this.elseIfClauses = List.copyOf(elseIfClauses);
		this.elseBody = elseBody == null ? null : List.copyOf(elseBody);
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

	public Expression getCondition()
	{
		return condition;
	}

	public List<Statement> getThenBody()
	{
		return thenBody;
	}

	public List<ElseIfClause> getElseIfClauses()
	{
		return elseIfClauses;
	}

	public List<Statement> getElseBody()
	{
		return elseBody;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		return "If[" + id + "] " + condition;
	}
}
