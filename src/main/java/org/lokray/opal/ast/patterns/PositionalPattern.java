package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Deconstructs a value of the given type into positional sub-patterns.
 */
public class PositionalPattern implements Pattern
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String typeName;
	private final List<Pattern> patterns;

	public PositionalPattern(Span span, String typeName, List<Pattern> patterns, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.typeName = typeName;
		this.patterns = List.copyOf(patterns);
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

	public String getTypeName()
	{
		return typeName;
	}

	public List<Pattern> getPatterns()
	{
		return patterns;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPositionalPattern(this);
	}

	@Override
	public String toString()
	{
		return typeName + patterns;
	}
}
