package org.lokray.opal.ast.declarations;

import java.util.List;

/**
 * Everything a function, method or interface method declares before its body:
 * generics, parameters, output, effects, contracts, examples and metadata.
 */
public class FunctionHeader
{
	private final List<TypeParameter> typeParameters;
	private final List<Parameter> parameters;
	private final OutputDeclaration output; // Null means no declared output
	private final EffectsDeclaration effects; // Null means no declared effects
	private final List<RequiresClause> preconditions;
	private final List<EnsuresClause> postconditions;
	private final List<IssueDeclaration> issues;
	private final List<AssumptionDeclaration> assumptions;
	private final LockDeclaration lock;
	private final AuthorDeclaration author;
	private final List<ExampleDeclaration> examples;
	private final UsesDeclaration uses; // Null when no §US tag is present
	private final SinceDeclaration since;
	private final DeprecatedDeclaration deprecated;

	public FunctionHeader(List<TypeParameter> typeParameters, List<Parameter> parameters, OutputDeclaration output,
						  EffectsDeclaration effects, List<RequiresClause> preconditions, List<EnsuresClause> postconditions,
						  List<IssueDeclaration> issues, List<AssumptionDeclaration> assumptions, LockDeclaration lock,
						  AuthorDeclaration author, List<ExampleDeclaration> examples, UsesDeclaration uses,
						  SinceDeclaration since, DeprecatedDeclaration deprecated)
	{
		this.typeParameters = List.copyOf(typeParameters);
		this.parameters = List.copyOf(parameters);
		this.output = output;
		this.effects = effects;
		this.preconditions = List.copyOf(preconditions);
		this.postconditions = List.copyOf(postconditions);
		this.issues = List.copyOf(issues);
		this.assumptions = List.copyOf(assumptions);
		this.lock = lock;
		this.author = author;
		this.examples = List.copyOf(examples);
		this.uses = uses;
		this.since = since;
		this.deprecated = deprecated;
	}

	public List<TypeParameter> getTypeParameters()
	{
		return typeParameters;
	}

	public List<Parameter> getParameters()
	{
		return parameters;
	}

	public OutputDeclaration getOutput()
	{
		return output;
	}

	public EffectsDeclaration getEffects()
	{
		return effects;
	}

	public List<RequiresClause> getPreconditions()
	{
		return preconditions;
	}

	public List<EnsuresClause> getPostconditions()
	{
		return postconditions;
	}

	public List<IssueDeclaration> getIssues()
	{
		return issues;
	}

	public List<AssumptionDeclaration> getAssumptions()
	{
		return assumptions;
	}

	public LockDeclaration getLock()
	{
		return lock;
	}

	public AuthorDeclaration getAuthor()
	{
		return author;
	}

	public List<ExampleDeclaration> getExamples()
	{
		return examples;
	}

	public UsesDeclaration getUses()
	{
		return uses;
	}

	public SinceDeclaration getSince()
	{
		return since;
	}

	public DeprecatedDeclaration getDeprecated()
	{
		return deprecated;
	}
}
