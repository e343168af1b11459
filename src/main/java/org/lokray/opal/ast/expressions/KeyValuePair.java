package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class KeyValuePair implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final Expression key;
	private final Expression value;

	public KeyValuePair(Span span, Expression key, Expression value, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
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
		return visitor.visitKeyValuePair(this);
	}

	@Override
	public String toString()
	{
		return key + " => " + value;
	}
}
