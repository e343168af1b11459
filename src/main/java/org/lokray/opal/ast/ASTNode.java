package org.lokray.opal.ast;

import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Base interface for all nodes in the syntax tree.
 * Nodes are immutable once built and own their children.
 */
public interface ASTNode
{
	/**
	 * @return The source range this node was parsed from, covering all of its children.
	 */
	Span getSpan();

	/**
	 * @return The attributes read from the node's tag, by key ({@code _pos0}... for positional
	 * values); empty for nodes that are not built from a tag.
	 */
	default Map<String, List<String>> getAttributes()
	{
		return Map.of();
	}

	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);
}
