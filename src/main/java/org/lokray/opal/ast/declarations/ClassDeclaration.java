package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A class with its fields, properties, constructors and methods.
 */
public class ClassDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final String baseClass;
	private final List<String> interfaces; // Implemented interface names
	private final Set<Modifier> modifiers;
	private final List<TypeParameter> typeParameters;
	private final List<FieldDeclaration> fields;
	private final List<PropertyDeclaration> properties;
	private final List<ConstructorDeclaration> constructors;
	private final List<MethodDeclaration> methods;
	private final List<EventDefinition> events;

	public ClassDeclaration(Span span, String id, String name, String baseClass, List<String> interfaces, Set<Modifier> modifiers, List<TypeParameter> typeParameters, List<FieldDeclaration> fields, List<PropertyDeclaration> properties, List<ConstructorDeclaration> constructors, List<MethodDeclaration> methods,
							List<EventDefinition> events, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.baseClass = baseClass;
		this.interfaces = List.copyOf(interfaces);
		this.modifiers = Collections.unmodifiableSet(modifiers.isEmpty() ? EnumSet.noneOf(Modifier.class) : EnumSet.copyOf(modifiers));
		this.typeParameters = List.copyOf(typeParameters);
		this.fields = List.copyOf(fields);
		this.properties = List.copyOf(properties);
		this.constructors = List.copyOf(constructors);
		this.methods = List.copyOf(methods);
		this.events = List.copyOf(events);
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

	public String getBaseClass()
	{
		return baseClass;
	}

	public List<String> getInterfaces()
	{
		return interfaces;
	}

	public Set<Modifier> getModifiers()
	{
		return modifiers;
	}

	public List<TypeParameter> getTypeParameters()
	{
		return typeParameters;
	}

	public List<FieldDeclaration> getFields()
	{
		return fields;
	}

	public List<PropertyDeclaration> getProperties()
	{
		return properties;
	}

	public List<ConstructorDeclaration> getConstructors()
	{
		return constructors;
	}

	public List<MethodDeclaration> getMethods()
	{
		return methods;
	}

	public List<EventDefinition> getEvents()
	{
		return events;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitClassDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Class " + name + "[" + id + "]" + (baseClass != null ? " : " + baseClass : "");
	}
}
