package org.lokray.opal.ast.declarations;

/**
 * Declared accessibility of a function, member or accessor.
 */
public enum Visibility
{
	PUBLIC,
	PRIVATE,
	INTERNAL
}
