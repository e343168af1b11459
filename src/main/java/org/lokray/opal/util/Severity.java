package org.lokray.opal.util;

/**
 * How serious a diagnostic is. Only {@link #ERROR} marks a compilation as failed.
 */
public enum Severity
{
	ERROR,
	WARNING,
	INFO
}
