package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A recorded design decision: the option chosen, why, and the options rejected.
 */
public class DecisionDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String title;
	private final String chosen;
	private final String chosenReason;
	private final List<RejectedOption> rejected;
	private final String context;
	private final String author;

	public DecisionDeclaration(Span span, String id, String title, String chosen, String chosenReason, List<RejectedOption> rejected, String context, String author, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.title = title;
		this.chosen = chosen;
		this.chosenReason = chosenReason;
		this.rejected = List.copyOf(rejected);
		this.context = context;
		this.author = author;
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

	public String getId()
	{
		return id;
	}

	public String getTitle()
	{
		return title;
	}

	public String getChosen()
	{
		return chosen;
	}

	public String getChosenReason()
	{
		return chosenReason;
	}

	public List<RejectedOption> getRejected()
	{
		return rejected;
	}

	public String getContext()
	{
		return context;
	}

	public String getAuthor()
	{
		return author;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDecisionDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Decision[" + id + "] " + title;
	}
}
