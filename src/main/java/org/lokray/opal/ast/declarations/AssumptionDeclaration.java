package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

public class AssumptionDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final AssumptionCategory category;
	private final String text;

	public AssumptionDeclaration(Span span, AssumptionCategory category, String text, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.category = category;
		this.text = text;
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

	public AssumptionCategory getCategory()
	{
		return category;
	}

	public String getText()
	{
		return text;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssumptionDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "assume " + text;
	}
}
