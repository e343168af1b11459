package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A try statement with its catch clauses and an optional finally block.
 */
public class TryStatement implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final List<Statement> body;
	private final List<CatchClause> catchClauses;
	private final List<Statement> finallyBody; // Null when there is no finally block

	public TryStatement(Span span, String id, List<Statement> body, List<CatchClause> catchClauses, List<Statement> finallyBody, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.body = List.copyOf(body);
		this.catchClauses = List.copyOf(catchClauses);
		this.finallyBody = finallyBody == null ? null : List.copyOf(finallyBody);
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

	public List<CatchClause> getCatchClauses()
	{
		return catchClauses;
	}

	public List<Statement> getFinallyBody()
	{
		return finallyBody;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTryStatement(this);
	}

	@Override
	public String toString()
	{
		return "Try[" + id + "]";
	}
}
