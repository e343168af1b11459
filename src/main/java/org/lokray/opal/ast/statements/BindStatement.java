package org.lokray.opal.ast.statements;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A local binding, optionally mutable, typed and initialized.
 */
public class BindStatement implements Statement
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String name;
	private final String type;
	private final boolean mutable;
	private final Expression initializer;

	public BindStatement(Span span, String name, String type, boolean mutable, Expression initializer, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.name = name;
		this.type = type;
		this.mutable = mutable;
		this.initializer = initializer;
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

	public boolean isMutable()
	{
		return mutable;
	}

	public Expression getInitializer()
	{
		return initializer;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBindStatement(this);
	}

	@Override
	public String toString()
	{
		return "Bind " + (mutable ? "~" : "") + name + (type != null ? ": " + type : "") + (initializer != null ? " = " + initializer : "");
	}
}
