package org.lokray.opal.ast.declarations;

public enum AccessorKind
{
	GET,
	SET,
	INIT
}
