package org.lokray.opal.lexer;

/**
 * An immutable region of source text.
 * Offsets are zero-based character indices; line and column are one-based and
 * describe where the region starts.
 */
public final class Span
{
	public static final Span EMPTY = new Span(0, 0, 1, 1);

	private final int start;
	private final int length;
	private final int line;
	private final int column;

	public Span(int start, int length, int line, int column)
	{
		if (start < 0 || length < 0)
		{
			throw new IllegalArgumentException("Span offsets must be non-negative: start=" + start + ", length=" + length);
		}
		this.start = start;
		this.length = length;
		this.line = line;
		this.column = column;
	}

	public int getStart()
	{
		return start;
	}

	public int getLength()
	{
		return length;
	}

	/**
	 * @return The offset one past the last character of this span.
	 */
	public int getEnd()
	{
		return start + length;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * Returns the smallest span containing both this span and {@code other}.
	 * The line and column of the result are those of whichever span starts first.
	 *
	 * @param other The span to merge with.
	 * @return The union of the two spans.
	 */
	public Span union(Span other)
	{
		if (other == null)
		{
			return this;
		}
		Span first = start <= other.start ? this : other;
		int end = Math.max(getEnd(), other.getEnd());
		return new Span(first.start, end - first.start, first.line, first.column);
	}

	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Span span = (Span) o;
		return start == span.start && length == span.length && line == span.line && column == span.column;
	}

	@Override
	public int hashCode()
	{
		int result = start;
		result = 31 * result + length;
		result = 31 * result + line;
		result = 31 * result + column;
		return result;
	}

	@Override
	public String toString()
	{
		return "(" + line + ":" + column + ", " + start + ".." + getEnd() + ")";
	}
}
