package org.lokray.opal.ast.declarations;

/**
 * What an assumption is about.
 */
public enum AssumptionCategory
{
	ENVIRONMENT,
	AUTHENTICATION,
	DATA,
	TIMING,
	RESOURCE
}
