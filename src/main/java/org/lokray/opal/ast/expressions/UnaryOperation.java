package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class UnaryOperation implements Expression
{
	private final Span span;
	private final UnaryOperator operator;
	private final Expression operand;

	public UnaryOperation(Span span, UnaryOperator operator, Expression operand)
	{
		this.span = span;
		this.operator = operator;
		this.operand = operand;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public UnaryOperator getOperator()
	{
		return operator;
	}

	public Expression getOperand()
	{
		return operand;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitUnaryOperation(this);
	}

	@Override
	public String toString()
	{
		return "(" + operator.getSymbol() + operand + ")";
	}
}
