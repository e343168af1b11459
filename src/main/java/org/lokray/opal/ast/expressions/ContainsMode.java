package org.lokray.opal.ast.expressions;

/**
 * What a {@link CollectionContains} looks for.
 */
public enum ContainsMode
{
	VALUE, // §HAS[coll] value
	KEY, // §HAS[dict] §KEY key
	DICT_VALUE // §HAS[dict] §VAL value
}
