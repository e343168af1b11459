package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * The element count of a collection: {@code §CNT[coll]} or {@code §CNT expr}.
 */
public class CollectionCount implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final Expression collection;

	public CollectionCount(Span span, Expression collection, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.collection = collection;
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

	public Expression getCollection()
	{
		return collection;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCollectionCount(this);
	}

	@Override
	public String toString()
	{
		return "Count(" + collection + ")";
	}
}
