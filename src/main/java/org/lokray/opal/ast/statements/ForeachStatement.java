package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class ForeachStatement implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String variable;
	private final String variableType;
	private final Expression collection;
	private final List<Statement> body;

	public ForeachStatement(Span span, String id, String variable, String variableType, Expression collection, List<Statement> body, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.variable = variable;
		this.variableType = variableType;
		this.collection = collection;
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

	public String getVariableType()
	{
		return variableType;
	}

	public Expression getCollection()
	{
		return collection;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForeachStatement(this);
	}

	@Override
	public String toString()
	{
		return "Foreach[" + id + "] " + variable + " in " + collection;
	}
}
