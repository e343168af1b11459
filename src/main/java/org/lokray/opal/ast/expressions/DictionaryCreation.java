package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A dictionary literal: {@code §DICT[id:keyType:valueType] (§KV key value)* §/DICT[id]}.
 */
public class DictionaryCreation implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String keyType;
	private final String valueType;
	private final List<KeyValuePair> entries;

	public DictionaryCreation(Span span, String id, String keyType, String valueType, List<KeyValuePair> entries, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.keyType = keyType;
		this.valueType = valueType;
		this.entries = List.copyOf(entries);
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

	public String getKeyType()
	{
		return keyType;
	}

	public String getValueType()
	{
		return valueType;
	}

	public List<KeyValuePair> getEntries()
	{
		return entries;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDictionaryCreation(this);
	}

	@Override
	public String toString()
	{
		return "Dict[" + id + ":" + keyType + ":" + valueType + "] " + entries;
	}
}
