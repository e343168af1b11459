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

/**
 * A property with optional get, set and init accessors.
 */
public class PropertyDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final String type;
	private final Visibility visibility;
	private final Set<Modifier> modifiers;
	private final AccessorDeclaration getter;
	private final AccessorDeclaration setter;
	private final AccessorDeclaration initAccessor;
	private final Expression defaultValue;

	public PropertyDeclaration(Span span, String id, String name, String type, Visibility visibility, Set<Modifier> modifiers, AccessorDeclaration getter, AccessorDeclaration setter, AccessorDeclaration initAccessor, Expression defaultValue, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.type = type;
		this.visibility = visibility;
		this.modifiers = Collections.unmodifiableSet(modifiers.isEmpty() ? EnumSet.noneOf(Modifier.class) : EnumSet.copyOf(modifiers));
		this.getter = getter;
		this.setter = setter;
		this.initAccessor = initAccessor;
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

	public String getId()
	{
		return id;
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

	public AccessorDeclaration getGetter()
	{
		return getter;
	}

	public AccessorDeclaration getSetter()
	{
		return setter;
	}

	public AccessorDeclaration getInitAccessor()
	{
		return initAccessor;
	}

	public Expression getDefaultValue()
	{
		return defaultValue;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPropertyDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Property " + name + ": " + type;
	}
}
