package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class FileReference implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String path;
	private final String description;

	public FileReference(Span span, String path, String description, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.path = path;
		this.description = description;
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

	public String getPath()
	{
		return path;
	}

	public String getDescription()
	{
		return description;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFileReference(this);
	}

	@Override
	public String toString()
	{
		return path;
	}
}
