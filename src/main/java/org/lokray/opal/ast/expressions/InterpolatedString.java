package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A string built from literal text and embedded expressions.
 */
public class InterpolatedString implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final List<InterpolationPart> parts;

	public InterpolatedString(Span span, List<InterpolationPart> parts, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.parts = List.copyOf(parts);
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

	public List<InterpolationPart> getParts()
	{
		return parts;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInterpolatedString(this);
	}

	@Override
	public String toString()
	{
		return "Interp" + parts;
	}
}
