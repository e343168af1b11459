package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class SinceDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String version;

	public SinceDeclaration(Span span, String version, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.version = version;
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

	public String getVersion()
	{
		return version;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSinceDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Since " + version;
	}
}
