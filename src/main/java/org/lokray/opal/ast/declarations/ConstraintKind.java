package org.lokray.opal.ast.declarations;

/**
 * Kinds of generic constraint; {@link #TYPE} carries a type name.
 */
public enum ConstraintKind
{
	CLASS,
	STRUCT,
	NEW,
	TYPE
}
