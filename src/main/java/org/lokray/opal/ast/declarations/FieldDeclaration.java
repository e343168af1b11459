package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class FieldDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String name;
	private final String type;
	private final Visibility visibility;
	private final Set<Modifier> modifiers;
	private final Expression defaultValue;

	public FieldDeclaration(Span span, String name, String type, Visibility visibility, Set<Modifier> modifiers, Expression defaultValue, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.name = name;
		this.type = type;
		this.visibility = visibility;
		this.modifiers = Collections.unmodifiableSet(modifiers.isEmpty() ? EnumSet.noneOf(Modifier.class) : EnumSet.copyOf(modifiers));
		this.defaultValue = defaultValue;
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

	public String getName()
	{
		return name;
	}

	public String getType()
	{
		return type;
	}

	public Visibility getVisibility()
	{
		return visibility;
	}

	public Set<Modifier> getModifiers()
	{
		return modifiers;
	}

	public Expression getDefaultValue()
	{
		return defaultValue;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFieldDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Field " + name + ": " + type;
	}
}
