package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A tagged union: {@code §T[id:Name]} followed by its {@code §V} variants, closed by {@code §/T[id]}.
 */
public class UnionDefinition implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final List<VariantDefinition> variants;

	public UnionDefinition(Span span, String id, String name, List<VariantDefinition> variants, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.variants = List.copyOf(variants);
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

	public String getName()
	{
		return name;
	}

	public List<VariantDefinition> getVariants()
	{
		return variants;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnionDefinition(this);
	}

	@Override
	public String toString()
	{
		return "Union[" + id + ":" + name + "] " + variants;
	}
}
