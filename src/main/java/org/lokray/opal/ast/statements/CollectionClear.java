package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class CollectionClear implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String collection;

	public CollectionClear(Span span, String collection, Map<String, List<String>> attributes)
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

	public String getCollection()
	{
		return collection;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCollectionClear(this);
	}

	@Override
	public String toString()
	{
		return "Clear(" + collection + ")";
	}
}
