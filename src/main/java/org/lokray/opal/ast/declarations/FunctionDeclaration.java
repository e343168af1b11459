package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.statements.Statement;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A module-level function.
 */
public class FunctionDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final Visibility visibility;
	private final FunctionHeader header;
	private final List<Statement> body;

	public FunctionDeclaration(Span span, String id, String name, Visibility visibility, FunctionHeader header, List<Statement> body, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.visibility = visibility;
		this.header = header;
		this.body = List.copyOf(body);
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

	public Visibility getVisibility()
	{
		return visibility;
	}

	public FunctionHeader getHeader()
	{
		return header;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public String toString()
	{
		return visibility.name().toLowerCase() + " func " + name + "[" + id + "]";
	}
}
