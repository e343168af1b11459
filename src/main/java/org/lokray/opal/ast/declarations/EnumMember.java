package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class EnumMember implements ASTNode
{
	private final Span span;
	private final String name;
	private final String value; // Written value, kept as text; null when omitted

	public EnumMember(Span span, String name, String value)
	{
		this.span = span;
		this.name = name;
		this.value = value;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public String getName()
	{
		return name;
	}

	public String getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitEnumMember(this);
	}

	@Override
	public String toString()
	{
		return value == null ? name : name + " = " + value;
	}
}
