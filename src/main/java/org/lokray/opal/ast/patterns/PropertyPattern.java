package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class PropertyPattern implements Pattern
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String typeName;
	private final List<PropertyMatch> matches;

	public PropertyPattern(Span span, String typeName, List<PropertyMatch> matches, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.typeName = typeName;
		this.matches = List.copyOf(matches);
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

	public List<PropertyMatch> getMatches()
	{
		return matches;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPropertyPattern(this);
	}

	@Override
	public String toString()
	{
		return typeName + " " + matches;
	}
}
