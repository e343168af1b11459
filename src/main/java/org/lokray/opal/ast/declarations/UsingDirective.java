package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A using directive: plain, aliased ({@code alias = ns}) or static.
 */
public class UsingDirective implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String namespace;
	private final String alias;
	private final boolean isStatic;

	public UsingDirective(Span span, String namespace, String alias, boolean isStatic, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.namespace = namespace;
		this.alias = alias;
		this.isStatic = isStatic;
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

	public String getNamespace()
	{
		return namespace;
	}

	public String getAlias()
	{
		return alias;
	}

	public boolean isStatic()
	{
		return isStatic;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUsingDirective(this);
	}

	@Override
	public String toString()
	{
		return "Using " + (isStatic ? "static " : "") + (alias != null ? alias + " = " : "") + namespace;
	}
}
