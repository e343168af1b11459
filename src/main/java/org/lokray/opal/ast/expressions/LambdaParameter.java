package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class LambdaParameter implements ASTNode
{
	private final Span span;
	private final String name;
	private final String type;

	public LambdaParameter(Span span, String name, String type)
	{
		this.span = span;
		this.name = name;
		this.type = type;
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

	public String getType()
	{
		return type;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLambdaParameter(this);
	}

	@Override
	public String toString()
	{
		return name + (type != null ? ": " + type : "");
	}
}
