package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

/**
 * A binary operation; {@code (+ a b c)} folds into nested left-associative operations.
 */
public class BinaryOperation implements Expression
{
	private final Span span;
	private final BinaryOperator operator;
	private final Expression left;
	private final Expression right;

	public BinaryOperation(Span span, BinaryOperator operator, Expression left, Expression right)
	{
		this.span = span;
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public BinaryOperator getOperator()
	{
		return operator;
	}

	public Expression getLeft()
	{
		return left;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryOperation(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getSymbol() + " " + right + ")";
	}
}
