package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.statements.Statement;
import org.lokray.opal.lexer.Span;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A class method.
 */
public class MethodDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final Visibility visibility;
	private final Set<Modifier> modifiers;
	private final FunctionHeader header;
	private final List<Statement> body;

	public MethodDeclaration(Span span, String id, String name, Visibility visibility, Set<Modifier> modifiers, FunctionHeader header, List<Statement> body, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.visibility = visibility;
		this.modifiers = Collections.unmodifiableSet(modifiers.isEmpty() ? EnumSet.noneOf(Modifier.class) : EnumSet.copyOf(modifiers));
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

	public Set<Modifier> getModifiers()
	{
		return modifiers;
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
		return visitor.visitMethodDeclaration(this);
	}

	@Override
	public String toString()
	{
		return visibility.name().toLowerCase() + " method " + name + "[" + id + "]";
	}
}
