package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * The declared output type of a function or method.
 */
public class OutputDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String type;

	public OutputDeclaration(Span span, String type, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.type = type;
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

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitOutputDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "-> " + type;
	}
}
