package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A typed input parameter, with an optional semantic hint.
 */
public class Parameter implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String type;
	private final String name;
	private final String semantic; // Expanded semantic hint

	public Parameter(Span span, String type, String name, String semantic, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.type = type;
		this.name = name;
		this.semantic = semantic;
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

	public String getType()
	{
		return type;
	}

	public String getName()
	{
		return name;
	}

	public String getSemantic()
	{
		return semantic;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitParameter(this);
	}

	@Override
	public String toString()
	{
		return name + ": " + type;
	}
}
