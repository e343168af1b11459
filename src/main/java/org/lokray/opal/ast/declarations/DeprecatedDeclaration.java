package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Marks a function deprecated: {@code §DP[since:replacement?]}.
 */
public class DeprecatedDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String since;
	private final String replacement; // Null when no replacement is named

	public DeprecatedDeclaration(Span span, String since, String replacement, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.since = since;
		this.replacement = replacement;
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

	public String getSince()
	{
		return since;
	}

	public String getReplacement()
	{
		return replacement;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDeprecatedDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Deprecated since " + since + (replacement == null ? "" : ", use " + replacement);
	}
}
