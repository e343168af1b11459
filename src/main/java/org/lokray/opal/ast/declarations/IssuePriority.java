package org.lokray.opal.ast.declarations;

public enum IssuePriority
{
	LOW,
	MEDIUM,
	HIGH,
	CRITICAL
}
