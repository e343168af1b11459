package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;

public class ConstructorInitializer implements ASTNode
{
	private final Span span;
	private final boolean isBase; // True for base(...), false for this(...)
	private final List<Expression> arguments;

	public ConstructorInitializer(Span span, boolean isBase, List<Expression> arguments)
	{
		this.span = span;
		this.isBase = isBase;
		this.arguments = List.copyOf(arguments);
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public boolean isBase()
	{
		return isBase;
	}

	public List<Expression> getArguments()
	{
		return arguments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitConstructorInitializer(this);
	}

	@Override
	public String toString()
	{
		return (isBase ? "base" : "this") + arguments;
	}
}
