package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * The functions a function depends on: {@code §US[Validate, Save?, Log@2.0]}.
 */
public class UsesDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final List<Dependency> dependencies;

	public UsesDeclaration(Span span, List<Dependency> dependencies, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.dependencies = List.copyOf(dependencies);
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

	public List<Dependency> getDependencies()
	{
		return dependencies;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUsesDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Uses " + dependencies;
	}
}
