package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A membership test: {@code §HAS[coll] value}, {@code §HAS[dict] §KEY key} or {@code §HAS[dict] §VAL value}.
 */
public class CollectionContains implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String collection;
	private final ContainsMode mode;
	private final Expression value;

	public CollectionContains(Span span, String collection, ContainsMode mode, Expression value, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.collection = collection;
		this.mode = mode;
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

	public ContainsMode getMode()
	{
		return mode;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitCollectionContains(this);
	}

	@Override
	public String toString()
	{
		return "Has(" + collection + ", " + mode + ", " + value + ")";
	}
}
