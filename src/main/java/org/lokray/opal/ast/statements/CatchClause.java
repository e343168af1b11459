package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A catch clause. Without a type it catches everything; the filter is the optional {@code when} condition.
 */
public class CatchClause implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String exceptionType;
	private final String variable;
	private final Expression filter;
	private final List<Statement> body;

	public CatchClause(Span span, String exceptionType, String variable, Expression filter, List<Statement> body, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.exceptionType = exceptionType;
		this.variable = variable;
		this.filter = filter;
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

	public String getExceptionType()
	{
		return exceptionType;
	}

	public String getVariable()
	{
		return variable;
	}

	public Expression getFilter()
	{
		return filter;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCatchClause(this);
	}

	@Override
	public String toString()
	{
		return "Catch" + (exceptionType != null ? " " + exceptionType : "");
	}
}
