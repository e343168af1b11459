package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class ListPattern implements Pattern
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final List<Pattern> patterns;
	private final String restName; // Name bound to the remaining elements, if any

	public ListPattern(Span span, List<Pattern> patterns, String restName, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.patterns = List.copyOf(patterns);
		this.restName = restName;
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

	public List<Pattern> getPatterns()
	{
		return patterns;
	}

	public String getRestName()
	{
		return restName;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitListPattern(this);
	}

	@Override
	public String toString()
	{
		return patterns + (restName != null ? " .." + restName : "");
	}
}
