package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

public class TypeConstraint implements ASTNode
{
	private final Span span;
	private final ConstraintKind kind;
	private final String typeName; // Set only for TYPE constraints

	public TypeConstraint(Span span, ConstraintKind kind, String typeName)
	{
		this.span = span;
		this.kind = kind;
		this.typeName = typeName;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public ConstraintKind getKind()
	{
		return kind;
	}

	public String getTypeName()
	{
		return typeName;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitTypeConstraint(this);
	}

	@Override
	public String toString()
	{
		return kind == ConstraintKind.TYPE ? typeName : kind.name().toLowerCase();
	}
}
