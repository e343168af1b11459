package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Adds or replaces a dictionary entry: {@code §PUT[dict] key value}.
 */
public class DictionaryPut implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String dictionary;
	private final Expression key;
	private final Expression value;

	public DictionaryPut(Span span, String dictionary, Expression key, Expression value, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.dictionary = dictionary;
		this.key = key;
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

	public String getDictionary()
	{
		return dictionary;
	}

	public Expression getKey()
	{
		return key;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDictionaryPut(this);
	}

	@Override
	public String toString()
	{
		return "Put(" + dictionary + ", " + key + ", " + value + ")";
	}
}
