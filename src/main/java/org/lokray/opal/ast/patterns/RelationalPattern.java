package org.lokray.opal.ast.patterns;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.expressions.BinaryOperator;
import org.lokray.opal.ast.expressions.Expression;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Compares the matched value against a constant: {@code >=}, {@code <=}, {@code >} or {@code <}.
 */
public class RelationalPattern implements Pattern
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final BinaryOperator operator;
	private final Expression value;

	public RelationalPattern(Span span, BinaryOperator operator, Expression value, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.operator = operator;
		this.value = value;
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

	public BinaryOperator getOperator()
	{
		return operator;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRelationalPattern(this);
	}

	@Override
	public String toString()
	{
		return operator.getSymbol() + " " + value;
	}
}
