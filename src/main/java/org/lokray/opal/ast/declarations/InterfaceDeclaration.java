package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * An interface: a name, its base interfaces and method signatures.
 */
public class InterfaceDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final List<String> baseInterfaces;
	private final List<MethodSignature> methods;

	public InterfaceDeclaration(Span span, String id, String name, List<String> baseInterfaces, List<MethodSignature> methods, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.baseInterfaces = List.copyOf(baseInterfaces);
		this.methods = List.copyOf(methods);
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

	public List<String> getBaseInterfaces()
	{
		return baseInterfaces;
	}

	public List<MethodSignature> getMethods()
	{
		return methods;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitInterfaceDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Interface " + name + "[" + id + "]";
	}
}
