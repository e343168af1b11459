package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

/**
 * One entry of a uses list. A trailing {@code ?} marks it optional and {@code @version} pins a version.
 */
public class Dependency implements ASTNode
{
	private final Span span;
	private final String target;
	private final String version; // Null when unpinned
	private final boolean optional;

	public Dependency(Span span, String target, String version, boolean optional)
	{
		this.span = span;
		this.target = target;
		this.version = version;
		this.optional = optional;
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	public String getTarget()
	{
		return target;
	}

	public String getVersion()
	{
		return version;
	}

	public boolean isOptional()
	{
		return optional;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDependency(this);
	}

	@Override
	public String toString()
	{
		return target + (version == null ? "" : "@" + version) + (optional ? "?" : "");
	}
}
