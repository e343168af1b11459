package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared side effects, keyed by category ({@code io}, {@code memory}, ...).
 */
public class EffectsDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final Map<String, String> effects; // Category to comma-joined values

	public EffectsDeclaration(Span span, Map<String, String> effects, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.effects = Collections.unmodifiableMap(new LinkedHashMap<>(effects));
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

	public Map<String, String> getEffects()
	{
		return effects;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitEffectsDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Effects" + effects;
	}
}
