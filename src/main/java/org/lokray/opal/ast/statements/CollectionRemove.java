package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class CollectionRemove implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String collection;
	private final Expression value;

	public CollectionRemove(Span span, String collection, Expression value, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.collection = collection;
		this.value = value;
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

	public String getCollection()
	{
		return collection;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCollectionRemove(this);
	}

	@Override
	public String toString()
	{
		return "Remove(" + collection + ", " + value + ")";
	}
}
