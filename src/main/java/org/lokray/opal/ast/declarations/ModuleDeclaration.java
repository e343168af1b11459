package org.lokray.opal.ast.declarations;

import org.lokray.opal.ast.ASTNode;
import org.lokray.opal.ast.ASTVisitor;
import org.lokray.opal.lexer.Span;

import java.util.List;
import java.util.Map;

/**
 * The root of a parsed file: one module with its declarations and module-level metadata.
 */
public class ModuleDeclaration implements ASTNode
{
	private final Span span;
	private final Map<String, List<String>> attributes;
	private final String id;
	private final String name;
	private final List<UsingDirective> usings;
	private final List<InterfaceDeclaration> interfaces;
	private final List<ClassDeclaration> classes;
	private final List<FunctionDeclaration> functions;
	private final List<IssueDeclaration> issues;
	private final List<AssumptionDeclaration> assumptions;
	private final List<InvariantDeclaration> invariants;
	private final List<DecisionDeclaration> decisions;
	private final List<RecordDefinition> records;
	private final List<UnionDefinition> unions;
	private final List<EnumDefinition> enums;
	private final List<EnumExtension> enumExtensions;
	private final List<DelegateDefinition> delegates;
	private final ContextDeclaration context; // Optional context block

	public ModuleDeclaration(Span span, String id, String name, List<UsingDirective> usings, List<InterfaceDeclaration> interfaces, List<ClassDeclaration> classes, List<FunctionDeclaration> functions, List<IssueDeclaration> issues, List<AssumptionDeclaration> assumptions, List<InvariantDeclaration> invariants, List<DecisionDeclaration> decisions,
							 List<RecordDefinition> records, List<UnionDefinition> unions, List<EnumDefinition> enums,
							 List<EnumExtension> enumExtensions, List<DelegateDefinition> delegates, ContextDeclaration context,
							 Map<String, List<String>> attributes)
	{
		this.span = span;
		this.attributes = attributes;
		this.id = id;
		this.name = name;
		this.usings = List.copyOf(usings);
		this.interfaces = List.copyOf(interfaces);
		this.classes = List.copyOf(classes);
		this.functions = List.copyOf(functions);
		this.issues = List.copyOf(issues);
		this.assumptions = List.copyOf(assumptions);
		this.invariants = List.copyOf(invariants);
		this.decisions = List.copyOf(decisions);
		this.records = List.copyOf(records);
		this.unions = List.copyOf(unions);
		this.enums = List.copyOf(enums);
		this.enumExtensions = List.copyOf(enumExtensions);
		this.delegates = List.copyOf(delegates);
		this.context = context;
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

	public String getName()
	{
		return name;
	}

	public List<UsingDirective> getUsings()
	{
		return usings;
	}

	public List<InterfaceDeclaration> getInterfaces()
	{
		return interfaces;
	}

	public List<ClassDeclaration> getClasses()
	{
		return classes;
	}

	public List<FunctionDeclaration> getFunctions()
	{
		return functions;
	}

	public List<IssueDeclaration> getIssues()
	{
		return issues;
	}

	public List<AssumptionDeclaration> getAssumptions()
	{
		return assumptions;
	}

	public List<InvariantDeclaration> getInvariants()
	{
		return invariants;
	}

	public List<DecisionDeclaration> getDecisions()
	{
		return decisions;
	}

	public List<RecordDefinition> getRecords()
	{
		return records;
	}

	public List<UnionDefinition> getUnions()
	{
		return unions;
	}

	public List<EnumDefinition> getEnums()
	{
		return enums;
	}

	public List<EnumExtension> getEnumExtensions()
	{
		return enumExtensions;
	}

	public List<DelegateDefinition> getDelegates()
	{
		return delegates;
	}

	public ContextDeclaration getContext()
	{
		return context;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitModuleDeclaration(this);
	}

	@Override
	public String toString()
	{
		return "Module[" + id + ":" + name + "] " + functions.size() + " function(s), " + classes.size() + " class(es)";
	}
}
