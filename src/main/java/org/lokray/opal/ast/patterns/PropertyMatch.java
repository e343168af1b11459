package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class PropertyMatch implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String property;
	private final Pattern pattern;

	public PropertyMatch(Span span, String property, Pattern pattern, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.property = property;
		this.pattern = pattern;
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

	public String getProperty()
	{
		return property;
	}

	public Pattern getPattern()
	{
		return pattern;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPropertyMatch(this);
	}

	@Override
	public String toString()
	{
		return property + ": " + pattern;
	}
}
