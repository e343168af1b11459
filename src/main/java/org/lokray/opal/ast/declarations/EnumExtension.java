package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * Extension functions attached to an enum: {@code §EEXT[id:EnumName] §F ... §/F §/EEXT[id]}.
 */
public class EnumExtension implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String enumName;
	private final List<FunctionDeclaration> functions;

	public EnumExtension(Span span, String id, String enumName, List<FunctionDeclaration> functions, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.enumName = enumName;
		this.functions = List.copyOf(functions);
	}

	@Override
	public Span getSpan()
	{
		return span;
	}

	@Override
	public Map<String, List<String>> getAttributes()
	{
		return attributes;
	}

	public String getId()
	{
		return id;
	}

	public String getEnumName()
	{
		return enumName;
	}

	public List<FunctionDeclaration> getFunctions()
	{
		return functions;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitEnumExtension(this);
	}

	@Override
	public String toString()
	{
		return "EnumExtension[" + id + ":" + enumName + "] " + functions.size() + " function(s)";
	}
}
