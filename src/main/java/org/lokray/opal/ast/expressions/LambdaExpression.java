package org.lokray.opal.ast.expressions;

import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.ast.declarations.EffectsDeclaration;
import org.lokray.opal.ast.statements.Statement;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * A lambda with an expression body, a statement body, or both.
 */
public class LambdaExpression implements Expression
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final boolean async;
	private final List<LambdaParameter> parameters;
	private final EffectsDeclaration effects;
	private final Expression expressionBody;
	private final List<Statement> statementBody;

	public LambdaExpression(Span span, String id, boolean async, List<LambdaParameter> parameters, EffectsDeclaration effects, Expression expressionBody, List<Statement> statementBody, Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.async = async;
		this.parameters = List.copyOf(parameters);
		this.effects = effects;
		this.expressionBody = expressionBody;
		this.statementBody = List.copyOf(statementBody);
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

	public boolean isAsync()
	{
		return async;
	}

	public List<LambdaParameter> getParameters()
	{
		return parameters;
	}

	public EffectsDeclaration getEffects()
	{
		return effects;
	}

	public Expression getExpressionBody()
	{
		return expressionBody;
	}

	public List<Statement> getStatementBody()
	{
		return statementBody;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLambdaExpression(this);
	}

	@Override
	public String toString()
	{
		return (async ? "async " : "") + "Lambda[" + id + "]" + parameters;
	}
}
