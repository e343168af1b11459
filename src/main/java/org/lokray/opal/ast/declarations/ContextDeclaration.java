package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Which files an agent should see, ignore, or focus on.
 */
public class ContextDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final boolean partial;
	private final List<FileReference> visibleFiles;
	private final List<FileReference> hiddenFiles;
	private final String focus;
	private final List<FileReference> files; // Bare file references outside a visible/hidden list

	public ContextDeclaration(Span span, boolean partial, List<FileReference> visibleFiles, List<FileReference> hiddenFiles, String focus, List<FileReference> files, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.partial = partial;
		this.visibleFiles = List.copyOf(visibleFiles);
		this.hiddenFiles = List.copyOf(hiddenFiles);
		this.focus = focus;
		this.files = List.copyOf(files);
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

	public boolean isPartial()
	{
		return partial;
	}

	public List<FileReference> getVisibleFiles()
	{
		return visibleFiles;
	}

	public List<FileReference> getHiddenFiles()
	{
		return hiddenFiles;
	}

	public String getFocus()
	{
		return focus;
	}

	public List<FileReference> getFiles()
	{
		return files;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitContextDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Context" + (partial ? "[partial]" : "");
	}
}
