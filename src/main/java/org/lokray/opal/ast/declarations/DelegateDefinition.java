package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A named function type: {@code §DEL[id:Name] §I[...] §O[...] §E[...] §/DEL[id]}.
 */
public class DelegateDefinition implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final List<Parameter> parameters;
	private final OutputDeclaration output;
	private final EffectsDeclaration effects;

	public DelegateDefinition(Span span, String id, String name, List<Parameter> parameters, OutputDeclaration output, EffectsDeclaration effects, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.parameters = List.copyOf(parameters);
		this.output = output;
		this.effects = effects;
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

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public OutputDeclaration getOutput()
	{
		return output;
	}

	public EffectsDeclaration getEffects()
	{
		return effects;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDelegateDefinition(this);
	}

	@Override
	public String toString()
	{
		return "Delegate[" + id + ":" + name + "] " + parameters;
	}
}
