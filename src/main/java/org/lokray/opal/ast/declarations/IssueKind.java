package org.lokray.opal.ast.declarations;

public enum IssueKind
{
	TODO,
	FIXME,
	HACK
}
