package org.lokray.opal.ast.declarations;

/**
 * Member and class modifiers. Written in attributes as any text containing
 * {@link #getCode()}, so {@code virt}, {@code virtual} and {@code abs,stat} all work.
 */
public enum Modifier
{
	VIRTUAL("virt"),
	OVERRIDE("over"),
	ABSTRACT("abs"),
	SEALED("seal"),
	STATIC("stat");

	private final String code;

	Modifier(String code)
	{
		this.code = code;
	}

	public String getCode()
	{
		return code;
	}
}
