package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Replaces the element at an index: {@code §SETIDX[coll] index value}.
 */
public class CollectionSetIndex implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String collection;
	private final Expression index;
	private final Expression value;

	public CollectionSetIndex(Span span, String collection, Expression index, Expression value, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.collection = collection;
		this.index = index;
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

	public Expression getIndex()
	{
		return index;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCollectionSetIndex(this);
	}

	@Override
	public String toString()
	{
		return "SetIndex(" + collection + ", " + index + ", " + value + ")";
	}
}
