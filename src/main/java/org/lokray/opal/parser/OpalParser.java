package org.lokray.opal.parser;

import org.lokray.opal.ast.declarations.*;
import org.lokray.opal.ast.expressions.*;
import org.lokray.opal.ast.patterns.*;
import org.lokray.opal.ast.statements.*;
import org.lokray.opal.lexer.Span;
import org.lokray.opal.lexer.Token;
import org.lokray.opal.lexer.TokenType;
import org.lokray.opal.util.Debug;
import org.lokray.opal.util.DiagnosticBag;
import org.lokray.opal.util.DiagnosticCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The OpalParser performs syntactic analysis of an OPAL token stream.
 * It is a recursive-descent parser that decides every production from the kind of the
 * current token, reads tag attributes through an {@link AttributeReader} and turns them
 * into canonical fields with the {@link Reconciler}.
 * <p>
 * The parser never throws on malformed input. Every problem is reported to the
 * {@link DiagnosticBag}, a safe default is substituted, and parsing continues, so a
 * single pass surfaces every independent problem and always yields a module.
 */
public class OpalParser
{
	private static final Logger logger = LoggerFactory.getLogger(OpalParser.class);

	private final TokenStream stream; // Shared with the attribute reader
	private final AttributeReader attributeReader;
	private final DiagnosticBag diagnostics;
	private final Debug debug;
	private boolean insideArgContext = false; // Set while reading an §A argument, so §NEW leaves the next §A alone
	private final List<TokenType> enclosingClosers = new ArrayList<>(); // Closing tags of the open constructs, innermost last

	private record MatchParts(Span span, String id, boolean expressionForm, Expression target, List<MatchCase> cases,
							  Map<String, List<String>> attributes)
	{
	}

	/**
	 * A type parameter whose constraints can still grow while where-clauses are read.
	 */
	private static final class PendingTypeParameter
	{
		private final Span span;
		private final String name;
		private final Map<String, List<String>> attributes;
		private final List<TypeConstraint> constraints = new ArrayList<>();

		PendingTypeParameter(Span span, String name, Map<String, List<String>> attributes)
		{
			this.span = span;
			this.name = name;
			this.attributes = attributes;
		}

		TypeParameter build()
		{
			Span full = span;
			for (TypeConstraint constraint : constraints)
			{
				full = full.union(constraint.getSpan());
			}
			return new TypeParameter(full, name, constraints, attributes);
		}
	}

	/**
	 * Collects the declaration prefix of a function, method or method signature.
	 */
	private static final class HeaderBuilder
	{
		private final List<PendingTypeParameter> typeParameters = new ArrayList<>();
		private final List<Parameter> parameters = new ArrayList<>();
		private OutputDeclaration output;
		private EffectsDeclaration effects;
		private final List<RequiresClause> preconditions = new ArrayList<>();
		private final List<EnsuresClause> postconditions = new ArrayList<>();
		private final List<IssueDeclaration> issues = new ArrayList<>();
		private final List<AssumptionDeclaration> assumptions = new ArrayList<>();
		private LockDeclaration lock;
		private AuthorDeclaration author;
		private final List<ExampleDeclaration> examples = new ArrayList<>();
		private UsesDeclaration uses;
		private SinceDeclaration since;
		private DeprecatedDeclaration deprecated;

		FunctionHeader build()
		{
			return new FunctionHeader(buildTypeParameters(typeParameters), parameters, output, effects, preconditions,
					postconditions, issues, assumptions, lock, author, examples, uses, since, deprecated);
		}
	}

	/**
	 * Constructs an OpalParser with tracing disabled.
	 *
	 * @param tokens      The tokens produced by the lexer, trivia already removed.
	 * @param diagnostics The bag every parse problem is reported to.
	 */
	public OpalParser(List<Token> tokens, DiagnosticBag diagnostics)
	{
		this(tokens, diagnostics, false);
	}

	/**
	 * Constructs an OpalParser.
	 *
	 * @param tokens       The tokens produced by the lexer, trivia already removed.
	 * @param diagnostics  The bag every parse problem is reported to.
	 * @param traceEnabled Whether each production is traced through {@link Debug}.
	 */
	public OpalParser(List<Token> tokens, DiagnosticBag diagnostics, boolean traceEnabled)
	{
		this.stream = new TokenStream(tokens);
		this.diagnostics = diagnostics;
		this.attributeReader = new AttributeReader(stream, diagnostics);
		this.debug = new Debug(logger, traceEnabled);
	}

	/**
	 * Parses the whole token stream as one module.
	 * Tokens before the opening {@code §M} and after the closing {@code §/M} are reported.
	 *
	 * @return The module; an empty one when the stream holds no module tag at all.
	 */
	public ModuleDeclaration parse()
	{
		if (!check(TokenType.MODULE))
		{
			reportUnexpected("§M");
			while (!isAtEnd() && !check(TokenType.MODULE))
			{
				advance();
			}
			if (isAtEnd())
			{
				return new ModuleDeclaration(peek().getSpan(), "", "", List.of(), List.of(), List.of(), List.of(),
						List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
						null, Map.of());
			}
		}

		ModuleDeclaration module = moduleDeclaration();
		if (!isAtEnd())
		{
			reportUnexpected("end of input");
		}
		return module;
	}

	/**
	 * Parses a single expression and reports anything left over. Used for expressions
	 * embedded in attribute values, such as {@code §L[l1:i:0:(- n 1)]}.
	 *
	 * @return The expression.
	 */
	public Expression parseStandaloneExpression()
	{
		Expression expression = expression();
		if (!isAtEnd())
		{
			reportUnexpected("end of expression");
		}
		return expression;
	}

	// --- Module level ---

	/**
	 * Parses a module.
	 * Grammar: `§M[id:name] (using | iface | class | func | typedef | metadata)* §/M[id]`
	 */
	private ModuleDeclaration moduleDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.ModuleAttributes attributes = Reconciler.module(bag);
		String id = requireAttribute(start, "MODULE", "id", attributes.id());
		String name = requireAttribute(start, "MODULE", "name", attributes.name());
		debug.log("Module '%s' (%s)", name, id);
		debug.indent();

		List<UsingDirective> usings = new ArrayList<>();
		List<InterfaceDeclaration> interfaces = new ArrayList<>();
		List<ClassDeclaration> classes = new ArrayList<>();
		List<FunctionDeclaration> functions = new ArrayList<>();
		List<IssueDeclaration> issues = new ArrayList<>();
		List<AssumptionDeclaration> assumptions = new ArrayList<>();
		List<InvariantDeclaration> invariants = new ArrayList<>();
		List<DecisionDeclaration> decisions = new ArrayList<>();
		List<RecordDefinition> records = new ArrayList<>();
		List<UnionDefinition> unions = new ArrayList<>();
		List<EnumDefinition> enums = new ArrayList<>();
		List<EnumExtension> enumExtensions = new ArrayList<>();
		List<DelegateDefinition> delegates = new ArrayList<>();
		ContextDeclaration context = null;

		int scope = openScope(TokenType.END_MODULE);
		while (!isAtEnd() && !check(TokenType.END_MODULE))
		{
			switch (peek().getType())
			{
				case USING -> usings.add(usingDirective());
				case INTERFACE -> interfaces.add(interfaceDeclaration());
				case CLASS -> classes.add(classDeclaration());
				case FUNC -> functions.add(functionDeclaration());
				case TODO, FIXME, HACK -> issues.add(issueDeclaration());
				case ASSUME -> assumptions.add(assumptionDeclaration());
				case INVARIANT -> invariants.add(invariantDeclaration());
				case DECISION -> decisions.add(decisionDeclaration());
				case CONTEXT -> context = contextDeclaration();
				case RECORD -> records.add(recordDefinition());
				case TYPE_DEF -> unions.add(unionDefinition());
				case ENUM -> enums.add(enumDefinition());
				case ENUM_EXTENSION -> enumExtensions.add(enumExtension());
				case DELEGATE -> delegates.add(delegateDefinition());
				default ->
				{
					// Resynchronize one token at a time
					reportUnexpected("§U, §IFACE, §CL, §F, a type definition, module metadata or §/M");
					advance();
				}
			}
		}

		closeScope(scope);
		debug.dedent();
		Span span = closeConstruct(start, TokenType.END_MODULE, "MODULE", id);
		return new ModuleDeclaration(span, id, name, usings, interfaces, classes, functions, issues, assumptions,
				invariants, decisions, records, unions, enums, enumExtensions, delegates, context, bag.asMap());
	}

	private UsingDirective usingDirective()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.UsingAttributes attributes = Reconciler.using(bag);
		requireAttribute(start, "USING", "namespace", attributes.namespace());
		return new UsingDirective(spanFrom(start), attributes.namespace(), attributes.alias(), attributes.isStatic(),
				bag.asMap());
	}

	private InvariantDeclaration invariantDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String message = Reconciler.message(bag);
		Expression condition = expression();
		return new InvariantDeclaration(spanFrom(start), condition, message, bag.asMap());
	}

	// --- Functions and their declaration prefix ---

	/**
	 * Parses a function.
	 * Grammar: `§F[id:name:vis] <T,...>? prefix* (§BODY stmt* §/BODY | stmt*) §/F[id]`
	 */
	private FunctionDeclaration functionDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.FunctionAttributes attributes = Reconciler.function(bag);
		String id = requireAttribute(start, "FUNC", "id", attributes.id());
		String name = requireAttribute(start, "FUNC", "name", attributes.name());
		debug.log("Function '%s' (%s)", name, id);
		debug.indent();

		HeaderBuilder header = new HeaderBuilder();
		typeParameterList(header.typeParameters);
		declarationPrefix(header);
		List<Statement> body = callableBody(TokenType.END_FUNC);

		debug.dedent();
		Span span = closeConstruct(start, TokenType.END_FUNC, "FUNC", id);
		return new FunctionDeclaration(span, id, name, attributes.visibility(), header.build(), body, bag.asMap());
	}

	/**
	 * Reads the declaration prefix in any order. Stops at the first token that does not
	 * belong to it; that token starts the body.
	 */
	private void declarationPrefix(HeaderBuilder header)
	{
		while (true)
		{
			switch (peek().getType())
			{
				case TYPE_PARAM -> header.typeParameters.add(typeParameter());
				case WHERE -> whereClause(header.typeParameters);
				case IN -> header.parameters.add(parameter());
				case OUT -> header.output = outputDeclaration();
				case EFFECTS -> header.effects = effectsDeclaration();
				case REQUIRES -> header.preconditions.add(requiresClause());
				case ENSURES -> header.postconditions.add(ensuresClause());
				case TODO, FIXME, HACK -> header.issues.add(issueDeclaration());
				case ASSUME -> header.assumptions.add(assumptionDeclaration());
				case LOCK -> header.lock = lockDeclaration();
				case AUTHOR -> header.author = authorDeclaration();
				case EXAMPLE -> header.examples.add(exampleDeclaration());
				case USES -> header.uses = usesDeclaration();
				case SINCE -> header.since = sinceDeclaration();
				case DEPRECATED -> header.deprecated = deprecatedDeclaration();
				default ->
				{
					return;
				}
			}
		}
	}

	/**
	 * Reads an explicit {@code §BODY ... §/BODY} block, or the statements up to the
	 * construct's own closing tag.
	 */
	private List<Statement> callableBody(TokenType closeType)
	{
		if (match(TokenType.BODY))
		{
			List<Statement> body = statementsUntil(TokenType.END_BODY);
			expect(TokenType.END_BODY, "§/BODY");
			return body;
		}
		return statementsUntil(closeType);
	}

	/**
	 * Parses the optional {@code <T, U>} list that may follow an opening tag's attributes.
	 */
	private void typeParameterList(List<PendingTypeParameter> typeParameters)
	{
		if (!match(TokenType.LESS))
		{
			return;
		}
		do
		{
			if (check(TokenType.IDENTIFIER))
			{
				Token name = advance();
				typeParameters.add(new PendingTypeParameter(name.getSpan(), name.getText(), Map.of()));
			}
			else
			{
				reportUnexpected("type parameter name");
				break;
			}
		}
		while (match(TokenType.COMMA));
		expect(TokenType.GREATER, "'>'");
	}

	private PendingTypeParameter typeParameter()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String name = requireAttribute(start, "TP", "name", Reconciler.typeParameter(bag));
		return new PendingTypeParameter(spanFrom(start), name, bag.asMap());
	}

	/**
	 * Parses a where-clause and adds its constraints to an already declared type parameter.
	 * Both {@code §WR[T:class:IComparable]} and {@code §WHERE T : class, IComparable<T>} are accepted.
	 */
	private void whereClause(List<PendingTypeParameter> typeParameters)
	{
		Token start = advance();
		String name;
		List<String> constraints;
		Span span;

		if (check(TokenType.IDENTIFIER))
		{
			name = advance().getText();
			expect(TokenType.COLON, "':'");
			constraints = constraintList();
			span = spanFrom(start);
		}
		else if (check(TokenType.OPEN_BRACKET))
		{
			Reconciler.WhereAttributes where = Reconciler.where(readAttributes());
			name = where.typeParameter();
			constraints = where.constraints();
			span = spanFrom(start);
			if (name.isEmpty())
			{
				diagnostics.reportMissingRequiredAttribute(start.getSpan(), "WHERE", "type parameter");
				return;
			}
		}
		else
		{
			reportUnexpected("type parameter name or '['");
			return;
		}

		PendingTypeParameter target = null;
		for (PendingTypeParameter candidate : typeParameters)
		{
			if (candidate.name.equals(name))
			{
				target = candidate;
				break;
			}
		}
		if (target == null)
		{
			diagnostics.reportError(span, DiagnosticCode.TYPE_PARAMETER_NOT_FOUND,
					"Type parameter '" + name + "' not found.");
			return;
		}

		for (String constraint : constraints)
		{
			target.constraints.add(typeConstraint(span, constraint));
		}
	}

	private static TypeConstraint typeConstraint(Span span, String text)
	{
		switch (text.toLowerCase(Locale.ROOT))
		{
			case "class":
				return new TypeConstraint(span, ConstraintKind.CLASS, null);
			case "struct":
				return new TypeConstraint(span, ConstraintKind.STRUCT, null);
			case "new":
			case "new()":
				return new TypeConstraint(span, ConstraintKind.NEW, null);
			default:
				return new TypeConstraint(span, ConstraintKind.TYPE, text);
		}
	}

	private List<String> constraintList()
	{
		List<String> constraints = new ArrayList<>();
		do
		{
			String constraint = constraintTypeName();
			if (!constraint.isEmpty())
			{
				constraints.add(constraint);
			}
		}
		while (match(TokenType.COMMA));
		return constraints;
	}

	/**
	 * Reads {@code class}, {@code struct}, {@code new()} or a type name with optional
	 * generic arguments such as {@code IComparable<T>}.
	 */
	private String constraintTypeName()
	{
		if (!check(TokenType.IDENTIFIER))
		{
			reportUnexpected("constraint type name");
			return "";
		}

		String first = advance().getText();
		if (first.equals("new") && match(TokenType.OPEN_PAREN))
		{
			expect(TokenType.CLOSE_PAREN, "')'");
			return "new()";
		}

		StringBuilder name = new StringBuilder(first);
		if (check(TokenType.LESS))
		{
			int depth = 0;
			do
			{
				Token token = peek();
				switch (token.getType())
				{
					case LESS -> depth++;
					case GREATER -> depth--;
					case COMMA, IDENTIFIER ->
					{
					}
					default ->
					{
						return name.toString();
					}
				}
				name.append(token.getType() == TokenType.COMMA ? ", " : token.getText());
				advance();
			}
			while (depth > 0 && !isAtEnd());
		}
		return name.toString();
	}

	private Parameter parameter()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.ParameterAttributes attributes = Reconciler.parameter(bag);
		String name = requireAttribute(start, "IN", "name", attributes.name());
		String type = requireAttribute(start, "IN", "type", attributes.type());
		return new Parameter(spanFrom(start), type, name, attributes.semantic(), bag.asMap());
	}

	private OutputDeclaration outputDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String type = requireAttribute(start, "OUT", "type", Reconciler.output(bag));
		return new OutputDeclaration(spanFrom(start), type, bag.asMap());
	}

	private EffectsDeclaration effectsDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Map<String, String> effects = Reconciler.effects(bag);
		return new EffectsDeclaration(spanFrom(start), effects, bag.asMap());
	}

	private RequiresClause requiresClause()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String message = Reconciler.message(bag);
		Expression condition = expression();
		return new RequiresClause(spanFrom(start), condition, message, bag.asMap());
	}

	private EnsuresClause ensuresClause()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String message = Reconciler.message(bag);
		Expression condition = expression();
		return new EnsuresClause(spanFrom(start), condition, message, bag.asMap());
	}

	// --- Metadata ---

	private IssueDeclaration issueDeclaration()
	{
		Token start = advance();
		IssueKind kind = switch (start.getType())
		{
			case FIXME -> IssueKind.FIXME;
			case HACK -> IssueKind.HACK;
			default -> IssueKind.TODO;
		};
		AttributeBag bag = readAttributes();
		Reconciler.IssueAttributes attributes = Reconciler.issue(bag);
		String description = requiredString(start, kind.name(), "description");
		return new IssueDeclaration(spanFrom(start), kind, attributes.id(), attributes.category(), attributes.priority(),
				description, bag.asMap());
	}

	private AssumptionDeclaration assumptionDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		AssumptionCategory category = Reconciler.assumption(bag);
		String text = requiredString(start, "ASSUME", "description");
		return new AssumptionDeclaration(spanFrom(start), category, text, bag.asMap());
	}

	private LockDeclaration lockDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String agent = Reconciler.lock(bag);
		Span span = spanFrom(start);
		if (agent.isEmpty())
		{
			diagnostics.reportMissingRequiredAttribute(start.getSpan(), "LOCK", "agent");
			agent = "unknown";
		}
		return new LockDeclaration(span, agent, bag.asMap());
	}

	private AuthorDeclaration authorDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.AuthorAttributes attributes = Reconciler.author(bag);
		Span span = spanFrom(start);
		String agent = attributes.agent();
		if (agent.isEmpty())
		{
			diagnostics.reportMissingRequiredAttribute(start.getSpan(), "AUTHOR", "agent");
			agent = "unknown";
		}
		return new AuthorDeclaration(span, agent, attributes.task(), bag.asMap());
	}

	/**
	 * Parses an inline example.
	 * Grammar: `§EX[id?:msg?] expr → expected`
	 */
	private ExampleDeclaration exampleDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.ExampleAttributes attributes = Reconciler.example(bag);
		Expression expression = expression();
		expect(TokenType.ARROW, "'→'");
		Expression expected = expression();
		return new ExampleDeclaration(spanFrom(start), attributes.id(), expression, expected, attributes.message(),
				bag.asMap());
	}

	/**
	 * Parses a uses list. {@code name?} is an optional dependency and {@code name@1.2} pins a version.
	 */
	private UsesDeclaration usesDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Span span = spanFrom(start);
		List<Dependency> dependencies = new ArrayList<>();
		for (String target : Reconciler.uses(bag))
		{
			boolean optional = target.endsWith("?");
			if (optional)
			{
				target = target.substring(0, target.length() - 1);
			}
			String version = null;
			int at = target.indexOf('@');
			if (at > 0)
			{
				version = target.substring(at + 1);
				target = target.substring(0, at);
			}
			dependencies.add(new Dependency(span, target, version, optional));
		}
		return new UsesDeclaration(span, dependencies, bag.asMap());
	}

	private SinceDeclaration sinceDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String version = Reconciler.since(bag);
		if (version.isEmpty())
		{
			diagnostics.reportMissingRequiredAttribute(start.getSpan(), "SINCE", "version");
			version = "0.0.0";
		}
		return new SinceDeclaration(spanFrom(start), version, bag.asMap());
	}

	private DeprecatedDeclaration deprecatedDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.DeprecatedAttributes attributes = Reconciler.deprecated(bag);
		String since = attributes.since();
		if (since.isEmpty())
		{
			diagnostics.reportMissingRequiredAttribute(start.getSpan(), "DEPRECATED", "since");
			since = "0.0.0";
		}
		return new DeprecatedDeclaration(spanFrom(start), since, attributes.replacement(), bag.asMap());
	}

	/**
	 * Parses a decision record.
	 * Grammar: `§DC[id] "title"? (§CHOSEN "x" | §REASON "r" | §REJECTED "y" §REASON "r"* | §CT "ctx" | §AU "who")* §/DC[id]`
	 */
	private DecisionDeclaration decisionDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String id = requireAttribute(start, "DECISION", "id", Reconciler.id(bag));
		String title = optionalString();
		if (title == null)
		{
			title = "";
		}

		String chosen = null;
		String chosenReason = null;
		List<RejectedOption> rejected = new ArrayList<>();
		String context = null;
		String author = null;

		while (!isAtEnd() && !check(TokenType.END_DECISION))
		{
			switch (peek().getType())
			{
				case CHOSEN ->
				{
					advance();
					chosen = optionalString();
				}
				case REASON ->
				{
					advance();
					String reason = optionalString();
					// A reason before any rejected option explains the chosen one
					if (chosen != null && chosenReason == null && rejected.isEmpty())
					{
						chosenReason = reason;
					}
				}
				case REJECTED -> rejected.add(rejectedOption());
				case CONTEXT ->
				{
					advance();
					context = optionalString();
				}
				case AUTHOR ->
				{
					advance();
					author = optionalString();
					if (author == null)
					{
						author = Reconciler.author(readAttributes()).agent();
					}
				}
				default ->
				{
					reportUnexpected("§CHOSEN, §REASON, §REJECTED, §CT, §AU or §/DC");
					advance();
				}
			}
		}

		Span span = closeConstruct(start, TokenType.END_DECISION, "DECISION", id);
		return new DecisionDeclaration(span, id, title, chosen, chosenReason, rejected, context, author, bag.asMap());
	}

	private RejectedOption rejectedOption()
	{
		Token start = advance();
		String name = optionalString();
		List<String> reasons = new ArrayList<>();
		while (match(TokenType.REASON))
		{
			String reason = optionalString();
			if (reason != null)
			{
				reasons.add(reason);
			}
		}
		return new RejectedOption(spanFrom(start), name == null ? "" : name, reasons);
	}

	/**
	 * Parses a context block.
	 * Grammar: `§CT[partial]? (§VS file* §/VS | §HD file* §/HD | §FC[target] | file)* §/CT`
	 */
	private ContextDeclaration contextDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		boolean partial = Reconciler.partialContext(bag);
		List<FileReference> visibleFiles = new ArrayList<>();
		List<FileReference> hiddenFiles = new ArrayList<>();
		List<FileReference> files = new ArrayList<>();
		String focus = null;

		while (!isAtEnd() && !check(TokenType.END_CONTEXT))
		{
			switch (peek().getType())
			{
				case VISIBLE ->
				{
					advance();
					fileSection(visibleFiles, TokenType.END_VISIBLE, "§/VS");
				}
				case HIDDEN ->
				{
					advance();
					fileSection(hiddenFiles, TokenType.END_HIDDEN, "§/HD");
				}
				case FOCUS ->
				{
					advance();
					focus = Reconciler.path(readAttributes());
				}
				case FILE_REF -> files.add(fileReference());
				default ->
				{
					reportUnexpected("§VS, §HD, §FC, §FILE or §/CT");
					advance();
				}
			}
		}

		expect(TokenType.END_CONTEXT, "§/CT");
		return new ContextDeclaration(spanFrom(start), partial, visibleFiles, hiddenFiles, focus, files, bag.asMap());
	}

	private void fileSection(List<FileReference> files, TokenType closeType, String closeSpelling)
	{
		while (!isAtEnd() && !check(closeType))
		{
			if (check(TokenType.FILE_REF))
			{
				files.add(fileReference());
			}
			else
			{
				reportUnexpected("§FILE or " + closeSpelling);
				advance();
			}
		}
		expect(closeType, closeSpelling);
	}

	private FileReference fileReference()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String path = requireAttribute(start, "FILE", "path", Reconciler.path(bag));
		String description = optionalString();
		return new FileReference(spanFrom(start), path, description, bag.asMap());
	}

	// --- Classes and interfaces ---

	/**
	 * Parses a class.
	 * Grammar: `§CL[id:name:base?:mods?] <T,...>? (§TP | §WR | §EXT | §IMPL | §FLD | §PROP | §CTOR | §MT | §EVT)* §/CL[id]`
	 */
	private ClassDeclaration classDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.ClassAttributes attributes = Reconciler.classDefinition(bag);
		Span header = spanFrom(start);
		String id = requireAttribute(start, "CLASS", "id", attributes.id());
		String name = requireAttribute(start, "CLASS", "name", attributes.name());
		String baseClass = attributes.baseClass();
		debug.log("Class '%s' (%s)", name, id);
		debug.indent();

		List<PendingTypeParameter> typeParameters = new ArrayList<>();
		typeParameterList(typeParameters);

		// Type parameters may also ride on the name: [c1:Box<T,U>]
		int angle = name.indexOf('<');
		if (typeParameters.isEmpty() && angle > 0 && name.endsWith(">"))
		{
			for (String typeParameter : Reconciler.splitList(name.substring(angle + 1, name.length() - 1)))
			{
				typeParameters.add(new PendingTypeParameter(header, typeParameter, Map.of()));
			}
			name = name.substring(0, angle);
		}

		List<String> interfaces = new ArrayList<>();
		List<FieldDeclaration> fields = new ArrayList<>();
		List<PropertyDeclaration> properties = new ArrayList<>();
		List<ConstructorDeclaration> constructors = new ArrayList<>();
		List<MethodDeclaration> methods = new ArrayList<>();
		List<EventDefinition> events = new ArrayList<>();

		int scope = openScope(TokenType.END_CLASS);
		while (!isAtEnd() && !check(TokenType.END_CLASS))
		{
			switch (peek().getType())
			{
				case TYPE_PARAM -> typeParameters.add(typeParameter());
				case WHERE -> whereClause(typeParameters);
				case EXTENDS ->
				{
					advance();
					String extended = Reconciler.typeName(readAttributes());
					baseClass = extended.isEmpty() ? baseClass : extended;
				}
				case IMPLEMENTS ->
				{
					advance();
					String implemented = Reconciler.typeName(readAttributes());
					if (!implemented.isEmpty())
					{
						interfaces.add(implemented);
					}
				}
				case FIELD_DEF -> fields.add(fieldDeclaration());
				case PROPERTY -> properties.add(propertyDeclaration());
				case CONSTRUCTOR -> constructors.add(constructorDeclaration());
				case METHOD -> methods.add(methodDeclaration());
				case EVENT -> events.add(eventDefinition());
				default ->
				{
					reportUnexpected("§TP, §WR, §EXT, §IMPL, §FLD, §PROP, §CTOR, §MT, §EVT or §/CL");
					advance();
				}
			}
		}

		closeScope(scope);
		debug.dedent();
		Span span = closeConstruct(start, TokenType.END_CLASS, "CLASS", id);
		return new ClassDeclaration(span, id, name, baseClass, interfaces, attributes.modifiers(),
				buildTypeParameters(typeParameters), fields, properties, constructors, methods, events, bag.asMap());
	}

	private FieldDeclaration fieldDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.FieldAttributes attributes = Reconciler.field(bag);
		String name = requireAttribute(start, "FLD", "name", attributes.name());
		String type = attributes.type().isEmpty() ? "object" : attributes.type();

		Expression defaultValue = null;
		if (match(TokenType.EQUALS) || isExpressionStart())
		{
			defaultValue = expression();
		}
		return new FieldDeclaration(spanFrom(start), name, type, attributes.visibility(), attributes.modifiers(),
				defaultValue, bag.asMap());
	}

	/**
	 * Parses a property with its accessors.
	 * Grammar: `§PROP[id:name:type:vis?:mods?] (§GET ... §/GET? | §SET ... §/SET? | §INIT ... | = expr | expr)* §/PROP[id]`
	 */
	private PropertyDeclaration propertyDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.PropertyAttributes attributes = Reconciler.property(bag);
		String id = requireAttribute(start, "PROP", "id", attributes.id());
		String type = attributes.type().isEmpty() ? "object" : attributes.type();

		AccessorDeclaration getter = null;
		AccessorDeclaration setter = null;
		AccessorDeclaration initAccessor = null;
		Expression defaultValue = null;

		int scope = openScope(TokenType.END_PROPERTY);
		boolean reading = true;
		while (reading && !isAtEnd() && !check(TokenType.END_PROPERTY))
		{
			switch (peek().getType())
			{
				case GET -> getter = accessorDeclaration(AccessorKind.GET, TokenType.END_GET);
				case SET -> setter = accessorDeclaration(AccessorKind.SET, TokenType.END_SET);
				case INIT -> initAccessor = accessorDeclaration(AccessorKind.INIT, null);
				case EQUALS ->
				{
					advance();
					defaultValue = expression();
				}
				default ->
				{
					if (isExpressionStart())
					{
						defaultValue = expression();
					}
					else
					{
						reading = false;
					}
				}
			}
		}

		closeScope(scope);
		Span span = closeConstruct(start, TokenType.END_PROPERTY, "PROP", id);
		return new PropertyDeclaration(span, id, attributes.name(), type, attributes.visibility(),
				attributes.modifiers(), getter, setter, initAccessor, defaultValue, bag.asMap());
	}

	/**
	 * Parses one accessor. Its body runs until the next accessor, the property's closing
	 * tag or its own optional closing tag.
	 *
	 * @param closeType The accessor's own closing tag, or null when it has none.
	 */
	private AccessorDeclaration accessorDeclaration(AccessorKind kind, TokenType closeType)
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Visibility visibility = Reconciler.accessorVisibility(bag);
		List<RequiresClause> preconditions = new ArrayList<>();
		List<Statement> body = new ArrayList<>();

		while (!isAtEnd() && !check(TokenType.GET, TokenType.SET, TokenType.INIT, TokenType.END_PROPERTY,
				TokenType.EQUALS, TokenType.END_GET, TokenType.END_SET) && !isEnclosingCloser())
		{
			if (check(TokenType.REQUIRES))
			{
				preconditions.add(requiresClause());
			}
			else
			{
				addStatement(body);
			}
		}
		if (closeType != null)
		{
			match(closeType);
		}
		return new AccessorDeclaration(spanFrom(start), kind, visibility, preconditions, body, bag.asMap());
	}

	/**
	 * Parses a constructor.
	 * Grammar: `§CTOR[id:vis?] (§I | §Q | §BASE §A* §/BASE? | §THIS §A* §/THIS? | stmt)* §/CTOR[id]`
	 */
	private ConstructorDeclaration constructorDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.ConstructorAttributes attributes = Reconciler.constructor(bag);
		String id = requireAttribute(start, "CTOR", "id", attributes.id());

		List<Parameter> parameters = new ArrayList<>();
		List<RequiresClause> preconditions = new ArrayList<>();
		ConstructorInitializer initializer = null;
		List<Statement> body = new ArrayList<>();

		int scope = openScope(TokenType.END_CONSTRUCTOR);
		while (!isAtEnd() && !isEnclosingCloser())
		{
			switch (peek().getType())
			{
				case IN -> parameters.add(parameter());
				case REQUIRES -> preconditions.add(requiresClause());
				case BASE -> initializer = constructorInitializer(true);
				case THIS -> initializer = constructorInitializer(false);
				default -> addStatement(body);
			}
		}

		closeScope(scope);
		Span span = closeConstruct(start, TokenType.END_CONSTRUCTOR, "CTOR", id);
		return new ConstructorDeclaration(span, id, attributes.visibility(), parameters, preconditions, initializer,
				body, bag.asMap());
	}

	private ConstructorInitializer constructorInitializer(boolean isBase)
	{
		Token start = advance();
		List<Expression> arguments = new ArrayList<>();
		while (check(TokenType.ARG))
		{
			arguments.add(argument());
		}
		match(isBase ? TokenType.END_BASE : TokenType.END_THIS);
		return new ConstructorInitializer(spanFrom(start), isBase, arguments);
	}

	/**
	 * Parses a method; the same shape as a function, closed by {@code §/MT}.
	 */
	private MethodDeclaration methodDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.FunctionAttributes attributes = Reconciler.function(bag);
		String id = requireAttribute(start, "METHOD", "id", attributes.id());
		debug.log("Method '%s' (%s)", attributes.name(), id);

		HeaderBuilder header = new HeaderBuilder();
		typeParameterList(header.typeParameters);
		declarationPrefix(header);
		List<Statement> body = callableBody(TokenType.END_METHOD);

		Span span = closeConstruct(start, TokenType.END_METHOD, "METHOD", id);
		return new MethodDeclaration(span, id, attributes.name(), attributes.visibility(), attributes.modifiers(),
				header.build(), body, bag.asMap());
	}

	private InterfaceDeclaration interfaceDeclaration()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.InterfaceAttributes attributes = Reconciler.interfaceDefinition(bag);
		String id = requireAttribute(start, "IFACE", "id", attributes.id());
		String name = requireAttribute(start, "IFACE", "name", attributes.name());

		List<String> baseInterfaces = new ArrayList<>();
		List<MethodSignature> methods = new ArrayList<>();
		while (!isAtEnd() && !check(TokenType.END_INTERFACE))
		{
			if (match(TokenType.EXTENDS))
			{
				String extended = Reconciler.typeName(readAttributes());
				if (!extended.isEmpty())
				{
					baseInterfaces.add(extended);
				}
			}
			else if (check(TokenType.METHOD))
			{
				methods.add(methodSignature());
			}
			else
			{
				reportUnexpected("§EXT, §MT or §/IFACE");
				advance();
			}
		}

		Span span = closeConstruct(start, TokenType.END_INTERFACE, "IFACE", id);
		return new InterfaceDeclaration(span, id, name, baseInterfaces, methods, bag.asMap());
	}

	private MethodSignature methodSignature()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.FunctionAttributes attributes = Reconciler.function(bag);
		String id = requireAttribute(start, "METHOD", "id", attributes.id());

		HeaderBuilder header = new HeaderBuilder();
		typeParameterList(header.typeParameters);
		declarationPrefix(header);

		Span span = closeConstruct(start, TokenType.END_METHOD, "METHOD", id);
		return new MethodSignature(span, id, attributes.name(), header.build(), bag.asMap());
	}

	private EventDefinition eventDefinition()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.EventAttributes attributes = Reconciler.event(bag);
		String id = requireAttribute(start, "EVT", "id", attributes.id());
		String name = requireAttribute(start, "EVT", "name", attributes.name());
		String delegateType = requireAttribute(start, "EVT", "delegateType", attributes.delegateType());
		return new EventDefinition(spanFrom(start), id, name, attributes.visibility(), delegateType, bag.asMap());
	}

	// --- Type definitions ---

	/**
	 * Parses a record type.
	 * Grammar: `§D[id:name] (§FL[name:type] (= expr)?)* §/D[id]`
	 */
	private RecordDefinition recordDefinition()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.DefinitionAttributes attributes = Reconciler.definition(bag);
		String id = requireAttribute(start, "RECORD", "id", attributes.id());
		String name = requireAttribute(start, "RECORD", "name", attributes.name());
		debug.log("Record '%s' (%s)", name, id);

		List<FieldDefinition> fields = new ArrayList<>();
		int scope = openScope(TokenType.END_RECORD);
		while (!isAtEnd() && !isEnclosingCloser())
		{
			if (check(TokenType.FIELD))
			{
				fields.add(fieldDefinition());
			}
			else
			{
				reportUnexpected("§FL or §/D");
				advance();
			}
		}
		closeScope(scope);

		Span span = closeConstruct(start, TokenType.END_RECORD, "RECORD", id);
		return new RecordDefinition(span, id, name, fields, bag.asMap());
	}

	private FieldDefinition fieldDefinition()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.FieldDefinitionAttributes attributes = Reconciler.fieldDefinition(bag);
		String name = requireAttribute(start, "FIELD", "name", attributes.name());
		String type = requireAttribute(start, "FIELD", "type", attributes.type());
		Expression defaultValue = match(TokenType.EQUALS) ? expression() : null;
		return new FieldDefinition(spanFrom(start), name, type, defaultValue, bag.asMap());
	}

	/**
	 * Parses a tagged union.
	 * Grammar: `§T[id:name] (§V[name] §FL[name:type]*)* §/T[id]`
	 */
	private UnionDefinition unionDefinition()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.DefinitionAttributes attributes = Reconciler.definition(bag);
		String id = requireAttribute(start, "TYPE", "id", attributes.id());
		String name = requireAttribute(start, "TYPE", "name", attributes.name());
		debug.log("Union '%s' (%s)", name, id);

		List<VariantDefinition> variants = new ArrayList<>();
		int scope = openScope(TokenType.END_TYPE_DEF);
		while (!isAtEnd() && !isEnclosingCloser())
		{
			if (check(TokenType.VARIANT))
			{
				variants.add(variantDefinition());
			}
			else
			{
				reportUnexpected("§V or §/T");
				advance();
			}
		}
		closeScope(scope);

		Span span = closeConstruct(start, TokenType.END_TYPE_DEF, "TYPE", id);
		return new UnionDefinition(span, id, name, variants, bag.asMap());
	}

	private VariantDefinition variantDefinition()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String name = requireAttribute(start, "VARIANT", "name", Reconciler.name(bag));
		List<FieldDefinition> fields = new ArrayList<>();
		while (check(TokenType.FIELD))
		{
			fields.add(fieldDefinition());
		}
		return new VariantDefinition(spanFrom(start), name, fields, bag.asMap());
	}

	/**
	 * Parses an enum. Each member is a name, optionally followed by {@code = value} where the
	 * value is an integer (possibly negative) or the name of another member.
	 * Grammar: `§EN[id:name:underlying?] (name (= value)?)* §/EN[id]`
	 */
	private EnumDefinition enumDefinition()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.EnumAttributes attributes = Reconciler.enumDefinition(bag);
		String id = requireAttribute(start, "ENUM", "id", attributes.id());
		String name = requireAttribute(start, "ENUM", "name", attributes.name());
		debug.log("Enum '%s' (%s)", name, id);

		List<EnumMember> members = new ArrayList<>();
		int scope = openScope(TokenType.END_ENUM);
		while (!isAtEnd() && !isEnclosingCloser())
		{
			if (check(TokenType.IDENTIFIER))
			{
				members.add(enumMember());
			}
			else
			{
				reportUnexpected("enum member name");
				advance();
			}
		}
		closeScope(scope);

		Span span = closeConstruct(start, TokenType.END_ENUM, "ENUM", id);
		return new EnumDefinition(span, id, name, attributes.underlyingType(), members, bag.asMap());
	}

	private EnumMember enumMember()
	{
		Token start = advance();
		String value = null;
		if (match(TokenType.EQUALS))
		{
			if (check(TokenType.INT_LITERAL))
			{
				value = advance().getLiteral().toString();
			}
			else if (check(TokenType.IDENTIFIER))
			{
				value = advance().getText();
			}
			else if (check(TokenType.MINUS) && check(1, TokenType.INT_LITERAL))
			{
				advance();
				value = "-" + advance().getLiteral();
			}
			else
			{
				reportUnexpected("enum member value");
			}
		}
		return new EnumMember(spanFrom(start), start.getText(), value);
	}

	/**
	 * Parses functions attached to an enum.
	 * Grammar: `§EEXT[id:enumName] func* §/EEXT[id]`
	 */
	private EnumExtension enumExtension()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.DefinitionAttributes attributes = Reconciler.definition(bag);
		String id = requireAttribute(start, "EEXT", "id", attributes.id());
		String enumName = requireAttribute(start, "EEXT", "enumName", attributes.name());

		List<FunctionDeclaration> functions = new ArrayList<>();
		int scope = openScope(TokenType.END_ENUM_EXTENSION);
		while (!isAtEnd() && !isEnclosingCloser())
		{
			if (check(TokenType.FUNC))
			{
				functions.add(functionDeclaration());
			}
			else
			{
				reportUnexpected("§F or §/EEXT");
				advance();
			}
		}
		closeScope(scope);

		Span span = closeConstruct(start, TokenType.END_ENUM_EXTENSION, "EEXT", id);
		return new EnumExtension(span, id, enumName, functions, bag.asMap());
	}

	/**
	 * Parses a delegate type.
	 * Grammar: `§DEL[id:name] (§I | §O | §E)* §/DEL[id]`
	 */
	private DelegateDefinition delegateDefinition()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.DefinitionAttributes attributes = Reconciler.definition(bag);
		String id = requireAttribute(start, "DEL", "id", attributes.id());
		String name = requireAttribute(start, "DEL", "name", attributes.name());

		List<Parameter> parameters = new ArrayList<>();
		OutputDeclaration output = null;
		EffectsDeclaration effects = null;
		int scope = openScope(TokenType.END_DELEGATE);
		while (!isAtEnd() && !isEnclosingCloser())
		{
			switch (peek().getType())
			{
				case IN -> parameters.add(parameter());
				case OUT -> output = outputDeclaration();
				case EFFECTS -> effects = effectsDeclaration();
				default ->
				{
					reportUnexpected("§I, §O, §E or §/DEL");
					advance();
				}
			}
		}
		closeScope(scope);

		Span span = closeConstruct(start, TokenType.END_DELEGATE, "DEL", id);
		return new DelegateDefinition(span, id, name, parameters, output, effects, bag.asMap());
	}

	// --- Statements ---

	/**
	 * Reads statements up to one of {@code terminators}. Also stops at the closing tag of
	 * any enclosing construct, so a missing closing tag is reported once by its owner.
	 */
	private List<Statement> statementsUntil(TokenType... terminators)
	{
		int scope = openScope(terminators);
		List<Statement> statements = new ArrayList<>();
		while (!isAtEnd() && !isEnclosingCloser())
		{
			addStatement(statements);
		}
		closeScope(scope);
		return statements;
	}

	private int openScope(TokenType... closers)
	{
		int mark = enclosingClosers.size();
		Collections.addAll(enclosingClosers, closers);
		return mark;
	}

	private void closeScope(int mark)
	{
		enclosingClosers.subList(mark, enclosingClosers.size()).clear();
	}

	private boolean isEnclosingCloser()
	{
		return enclosingClosers.contains(peek().getType());
	}

	private void addStatement(List<Statement> statements)
	{
		Statement statement = statement();
		if (statement != null)
		{
			statements.add(statement);
		}
	}

	/**
	 * Parses a single statement, dispatching on the current token.
	 *
	 * @return The statement, or null when the token starts none; it is reported and skipped.
	 */
	private Statement statement()
	{
		switch (peek().getType())
		{
			case CALL:
				return callStatement();
			case RETURN:
				return returnStatement();
			case FOR:
				return forStatement();
			case WHILE:
				return whileStatement();
			case DO:
				return doWhileStatement();
			case IF:
				return ifStatement();
			case BIND:
				return bindStatement();
			case MATCH:
				return matchStatement();
			case FOREACH:
				return foreachStatement();
			case ASSIGN:
				return assignmentStatement();
			case TRY:
				return tryStatement();
			case THROW:
				return throwStatement();
			case RETHROW:
				return new RethrowStatement(advance().getSpan());
			case SUBSCRIBE:
			case UNSUBSCRIBE:
				return eventSubscription();
			case BREAK:
				return new BreakStatement(advance().getSpan());
			case CONTINUE:
				return new ContinueStatement(advance().getSpan());
			case PRINT:
			case PRINTF:
				return printStatement();
			case YIELD:
			{
				Token start = advance();
				Expression value = expression();
				return new YieldStatement(spanFrom(start), value);
			}
			case YIELD_BREAK:
				return new YieldBreakStatement(advance().getSpan());
			case LIST:
			{
				ListCreation list = listCreation();
				return new BindStatement(list.getSpan(), list.getId(), "List<" + list.getElementType() + ">", false,
						list, Map.of());
			}
			case HASH_SET:
			{
				SetCreation set = setCreation();
				return new BindStatement(set.getSpan(), set.getId(), "HashSet<" + set.getElementType() + ">", false,
						set, Map.of());
			}
			case DICT:
			{
				DictionaryCreation dictionary = dictionaryCreation();
				return new BindStatement(dictionary.getSpan(), dictionary.getId(),
						"Dictionary<" + dictionary.getKeyType() + "," + dictionary.getValueType() + ">", false,
						dictionary, Map.of());
			}
			case PUSH:
			case ADD:
			case PUT:
			case REMOVE:
			case SET_INDEX:
			case CLEAR:
			case INSERT:
				return collectionStatement();
			case OPEN_PAREN:
				Expression expression = expression();
				return new ExpressionStatement(expression.getSpan(), expression);
			default:
				reportUnexpected("statement");
				advance();
				return null;
		}
	}

	/**
	 * Parses a call statement.
	 * Grammar: `§C[target] (§A expr)* §/C`, or `§C[target] expr` with one implicit argument,
	 * or `§C[] targetExpr (§A expr | expr)* §/C` when the target is an expression.
	 */
	private CallStatement callStatement()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.CallAttributes attributes = Reconciler.call(bag);
		List<Expression> arguments = new ArrayList<>();

		if (attributes.target().isEmpty() && isExpressionStart())
		{
			Expression targetExpression = expression();
			callArguments(arguments);
			expect(TokenType.END_CALL, "§/C");
			return new CallStatement(spanFrom(start), "", targetExpression, attributes.fallible(), arguments,
					bag.asMap());
		}

		requireAttribute(start, "CALL", "target", attributes.target());
		if (isExpressionStart() && !check(TokenType.ARG))
		{
			arguments.add(expression());
			return new CallStatement(spanFrom(start), attributes.target(), null, attributes.fallible(), arguments,
					bag.asMap());
		}

		while (check(TokenType.ARG))
		{
			arguments.add(argument());
		}
		expect(TokenType.END_CALL, "§/C");
		return new CallStatement(spanFrom(start), attributes.target(), null, attributes.fallible(), arguments,
				bag.asMap());
	}

	/**
	 * Reads arguments up to {@code §/C}; each is either {@code §A expr} or a bare expression.
	 */
	private void callArguments(List<Expression> arguments)
	{
		while (!isAtEnd() && !check(TokenType.END_CALL))
		{
			if (check(TokenType.ARG))
			{
				arguments.add(argument());
			}
			else if (isExpressionStart())
			{
				arguments.add(expression());
			}
			else
			{
				break;
			}
		}
	}

	private Expression argument()
	{
		advance();
		boolean saved = insideArgContext;
		insideArgContext = true;
		try
		{
			return expression();
		}
		finally
		{
			insideArgContext = saved;
		}
	}

	private ReturnStatement returnStatement()
	{
		Token start = advance();
		Expression value = isExpressionStart() ? expression() : null;
		return new ReturnStatement(spanFrom(start), value);
	}

	/**
	 * Parses a numeric for loop.
	 * Grammar: `§L[id:var:from:to:step?] from? to? stmt* §/L[id]`; bounds missing from the
	 * attributes are read as expressions.
	 */
	private ForStatement forStatement()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Span header = spanFrom(start);
		Reconciler.ForAttributes attributes = Reconciler.forLoop(bag);
		String id = requireAttribute(start, "FOR", "id", attributes.id());
		String variable = requireAttribute(start, "FOR", "var", attributes.variable());

		Expression from = attributes.from().isEmpty()
				? expression()
				: attributeExpression(bag.source("from", 2), attributes.from(), header);
		Expression to = attributes.to().isEmpty()
				? expression()
				: attributeExpression(bag.source("to", 3), attributes.to(), header);
		Expression step = attributeExpression(bag.source("step", 4), attributes.step(), header);

		List<Statement> body = statementsUntil(TokenType.END_FOR);
		Span span = closeConstruct(start, TokenType.END_FOR, "FOR", id);
		return new ForStatement(span, id, variable, from, to, step, body, bag.asMap());
	}

	private WhileStatement whileStatement()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String id = requireAttribute(start, "WHILE", "id", Reconciler.id(bag));
		Expression condition = expression();
		List<Statement> body = statementsUntil(TokenType.END_WHILE);
		Span span = closeConstruct(start, TokenType.END_WHILE, "WHILE", id);
		return new WhileStatement(span, id, condition, body, bag.asMap());
	}

	/**
	 * Parses a do-while loop; its condition follows the closing tag.
	 * Grammar: `§DO[id] stmt* §/DO[id] condition`
	 */
	private DoWhileStatement doWhileStatement()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String id = requireAttribute(start, "DO", "id", Reconciler.id(bag));
		List<Statement> body = statementsUntil(TokenType.END_DO);
		closeConstruct(start, TokenType.END_DO, "DO", id);
		Expression condition = expression();
		return new DoWhileStatement(spanFrom(start), id, body, condition, bag.asMap());
	}

	/**
	 * Parses an if statement in either of its forms.
	 * Arrow form: `§IF[id] cond → stmt (§EI cond → stmt)* (§EL → stmt)? §/I[id]`.
	 * Block form: `§IF[id] cond stmt* (§EI cond stmt*)* (§EL stmt*)? §/I[id]`.
	 */
	private IfStatement ifStatement()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String id = requireAttribute(start, "IF", "id", Reconciler.id(bag));
		Expression condition = expression();

		List<Statement> thenBody;
		List<ElseIfClause> elseIfClauses = new ArrayList<>();
		List<Statement> elseBody = null;

		boolean arrowForm = check(TokenType.ARROW);
		if (arrowForm)
		{
			thenBody = arrowBranch();
		}
		else
		{
			thenBody = statementsUntil(TokenType.END_IF, TokenType.ELSE, TokenType.ELSE_IF);
		}

		while (check(TokenType.ELSE_IF))
		{
			Token elseIf = advance();
			Expression elseIfCondition = expression();
			List<Statement> elseIfBody = arrowForm && check(TokenType.ARROW)
					? arrowBranch()
					: statementsUntil(TokenType.END_IF, TokenType.ELSE, TokenType.ELSE_IF);
			elseIfClauses.add(new ElseIfClause(spanFrom(elseIf), elseIfCondition, elseIfBody));
		}

		if (match(TokenType.ELSE))
		{
			elseBody = arrowForm && check(TokenType.ARROW) ? arrowBranch() : statementsUntil(TokenType.END_IF);
		}

		Span span = closeConstruct(start, TokenType.END_IF, "IF", id);
		return new IfStatement(span, id, condition, thenBody, elseIfClauses, elseBody, bag.asMap());
	}

	private List<Statement> arrowBranch()
	{
		advance();
		List<Statement> body = new ArrayList<>();
		if (!isAtEnd())
		{
			addStatement(body);
		}
		return body;
	}

	private BindStatement bindStatement()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.BindAttributes attributes = Reconciler.bind(bag);
		String name = requireAttribute(start, "BIND", "name", attributes.name());
		Expression initializer = isExpressionStart() ? expression() : null;
		return new BindStatement(spanFrom(start), name, attributes.type(), attributes.mutable(), initializer,
				bag.asMap());
	}

	/**
	 * A match in statement position; the {@code [id:expr]} form becomes a return of the match.
	 */
	private Statement matchStatement()
	{
		MatchParts parts = matchParts();
		if (parts.expressionForm())
		{
			return new ReturnStatement(parts.span(),
					new MatchExpression(parts.span(), parts.id(), parts.target(), parts.cases(), parts.attributes()));
		}
		return new MatchStatement(parts.span(), parts.id(), parts.target(), parts.cases(), parts.attributes());
	}

	private ForeachStatement foreachStatement()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.ForeachAttributes attributes = Reconciler.foreach(bag);
		String id = requireAttribute(start, "EACH", "id", attributes.id());
		Expression collection = expression();
		List<Statement> body = statementsUntil(TokenType.END_FOREACH);
		Span span = closeConstruct(start, TokenType.END_FOREACH, "EACH", id);
		return new ForeachStatement(span, id, attributes.variable(), attributes.type(), collection, body, bag.asMap());
	}

	private AssignmentStatement assignmentStatement()
	{
		Token start = advance();
		Expression target = expression();
		Expression value = expression();
		return new AssignmentStatement(spanFrom(start), target, value);
	}

	/**
	 * Parses a try statement.
	 * Grammar: `§TR[id] stmt* (§CA[type:var]? (§WHEN expr)? stmt*)* (§FI stmt*)? §/TR[id]`
	 */
	private TryStatement tryStatement()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String id = requireAttribute(start, "TRY", "id", Reconciler.id(bag));
		List<Statement> body = statementsUntil(TokenType.CATCH, TokenType.FINALLY, TokenType.END_TRY);

		List<CatchClause> catchClauses = new ArrayList<>();
		while (check(TokenType.CATCH))
		{
			Token catchToken = advance();
			AttributeBag catchBag = readAttributes();
			Reconciler.CatchAttributes attributes = Reconciler.catchClause(catchBag);
			Expression filter = match(TokenType.WHEN) ? expression() : null;
			List<Statement> catchBody = statementsUntil(TokenType.CATCH, TokenType.FINALLY, TokenType.END_TRY);
			catchClauses.add(new CatchClause(spanFrom(catchToken), attributes.exceptionType(), attributes.variable(),
					filter, catchBody, catchBag.asMap()));
		}

		List<Statement> finallyBody = null;
		if (match(TokenType.FINALLY))
		{
			finallyBody = statementsUntil(TokenType.END_TRY);
		}

		Span span = closeConstruct(start, TokenType.END_TRY, "TRY", id);
		return new TryStatement(span, id, body, catchClauses, finallyBody, bag.asMap());
	}

	private ThrowStatement throwStatement()
	{
		Token start = advance();
		Expression exception = isExpressionStart() ? expression() : null;
		return new ThrowStatement(spanFrom(start), exception);
	}

	private EventSubscriptionStatement eventSubscription()
	{
		Token start = advance();
		Expression event = expression();
		Expression handler = expression();
		return new EventSubscriptionStatement(spanFrom(start), event, handler,
				start.getType() == TokenType.SUBSCRIBE);
	}

	private PrintStatement printStatement()
	{
		Token start = advance();
		Expression value = expression();
		return new PrintStatement(spanFrom(start), value, start.getType() == TokenType.PRINT);
	}

	// --- Expressions ---

	/**
	 * Checks whether the current token can start an expression.
	 */
	private boolean isExpressionStart()
	{
		switch (peek().getType())
		{
			case INT_LITERAL:
			case STR_LITERAL:
			case BOOL_LITERAL:
			case FLOAT_LITERAL:
			case IDENTIFIER:
			case OPEN_PAREN:
			case SOME:
			case NONE:
			case OK:
			case ERR:
			case MATCH:
			case RECORD:
			case ARRAY:
			case INDEX:
			case LENGTH:
			case GENERIC:
			case NEW:
			case THIS:
			case BASE:
			case CALL:
			case LAMBDA:
			case AWAIT:
			case INTERPOLATE:
			case NULL_COALESCE:
			case NULL_CONDITIONAL:
			case RANGE:
			case INDEX_END:
			case WITH:
			case LIST:
			case DICT:
			case HASH_SET:
			case HAS:
			case COUNT:
				return true;
			default:
				return false;
		}
	}

	/**
	 * Parses one expression, dispatching on the current token.
	 * A token that starts no expression is reported and replaced by a {@link MissingExpression};
	 * it is skipped unless it is a tag, which belongs to an enclosing construct.
	 */
	private Expression expression()
	{
		Token token = peek();
		switch (token.getType())
		{
			case INT_LITERAL:
				advance();
				return new IntLiteral(token.getSpan(), (Long) token.getLiteral());
			case FLOAT_LITERAL:
				advance();
				return new FloatLiteral(token.getSpan(), (Double) token.getLiteral());
			case STR_LITERAL:
				advance();
				return new StringLiteral(token.getSpan(), (String) token.getLiteral());
			case BOOL_LITERAL:
				advance();
				return new BoolLiteral(token.getSpan(), (Boolean) token.getLiteral());
			case IDENTIFIER:
				advance();
				return trailingMemberAccess(new ReferenceExpression(token.getSpan(), token.getText()));
			case OPEN_PAREN:
				return trailingMemberAccess(lispForm());
			case SOME:
				advance();
				Expression someValue = expression();
				return new SomeExpression(spanFrom(token), someValue);
			case NONE:
			{
				advance();
				AttributeBag bag = readAttributes();
				return new NoneExpression(spanFrom(token), Reconciler.optionalType(bag), bag.asMap());
			}
			case OK:
				advance();
				Expression okValue = expression();
				return new OkExpression(spanFrom(token), okValue);
			case ERR:
				advance();
				Expression error = expression();
				return new ErrExpression(spanFrom(token), error);
			case MATCH:
				MatchParts parts = matchParts();
				return new MatchExpression(parts.span(), parts.id(), parts.target(), parts.cases(), parts.attributes());
			case RECORD:
				return recordCreation();
			case ARRAY:
				return arrayCreation();
			case INDEX:
				return arrayAccess();
			case LENGTH:
				return arrayLength();
			case GENERIC:
			{
				advance();
				AttributeBag bag = readAttributes();
				Reconciler.TypeAttributes generic = Reconciler.generic(bag);
				return new GenericInstantiation(spanFrom(token), generic.type(), generic.typeArguments(), bag.asMap());
			}
			case NEW:
				return newExpression();
			case THIS:
				advance();
				return trailingMemberAccess(new ThisExpression(token.getSpan()));
			case BASE:
				advance();
				return trailingMemberAccess(new BaseExpression(token.getSpan()));
			case CALL:
				return callExpression();
			case LAMBDA:
				return lambdaExpression();
			case AWAIT:
			{
				advance();
				AttributeBag bag = readAttributes();
				Boolean continueOnCapturedContext = Reconciler.await(bag);
				Expression awaited = expression();
				return new AwaitExpression(spanFrom(token), awaited, continueOnCapturedContext, bag.asMap());
			}
			case INTERPOLATE:
				return interpolatedString();
			case NULL_COALESCE:
				advance();
				Expression left = expression();
				Expression right = expression();
				return new NullCoalesce(spanFrom(token), left, right);
			case NULL_CONDITIONAL:
				advance();
				Expression target = expression();
				Token member = expect(TokenType.IDENTIFIER, "member name");
				return new NullConditional(spanFrom(token), target, member == null ? "" : member.getText());
			case RANGE:
				advance();
				Expression rangeStart = isExpressionStart() ? expression() : null;
				Expression rangeEnd = isExpressionStart() ? expression() : null;
				return new RangeExpression(spanFrom(token), rangeStart, rangeEnd);
			case INDEX_END:
				advance();
				Expression offset = expression();
				return new IndexFromEnd(spanFrom(token), offset);
			case WITH:
				return withExpression();
			case LIST:
				return listCreation();
			case HASH_SET:
				return setCreation();
			case DICT:
				return dictionaryCreation();
			case HAS:
				return collectionContains();
			case COUNT:
				return collectionCount();
			default:
				reportUnexpected("expression");
				if (!isAtEnd() && !token.isSectionMarker())
				{
					advance();
				}
				return new MissingExpression(token.getSpan());
		}
	}

	/**
	 * Wraps {@code expression} in member accesses for every {@code .name} or {@code ?.name} that follows.
	 */
	private Expression trailingMemberAccess(Expression expression)
	{
		while ((check(TokenType.DOT) || (check(TokenType.NULL_CONDITIONAL) && !peek().isSectionMarker()))
				&& check(1, TokenType.IDENTIFIER))
		{
			boolean nullConditional = advance().getType() == TokenType.NULL_CONDITIONAL;
			Token member = advance();
			Span span = expression.getSpan().union(member.getSpan());
			expression = nullConditional
					? new NullConditional(span, expression, member.getText())
					: new FieldAccess(span, expression, member.getText());
		}
		return expression;
	}

	/**
	 * Parses a Lisp-style prefix form {@code (op arg...)}.
	 * <p>
	 * One operand with {@code ! ~ - not} is a unary operation; two or more operands with a
	 * binary operator fold to the left, {@code (+ a b c)} being {@code (a + b) + c}, with every
	 * node spanning the whole form. {@code (? c a b)} is a conditional and {@code (?? a b)} a
	 * null-coalesce. A wrong operand count or an unknown operator is reported and the first
	 * operand (or {@code 0}) stands in for the form.
	 */
	private Expression lispForm()
	{
		Token open = advance();
		String operator = lispOperator();

		List<Expression> operands = new ArrayList<>();
		while (!isAtEnd() && !check(TokenType.CLOSE_PAREN) && isExpressionStart())
		{
			operands.add(expression());
		}
		expect(TokenType.CLOSE_PAREN, "')'");
		Span span = spanFrom(open);

		if (operator == null)
		{
			return fallbackOperand(span, operands);
		}
		if (operator.equals("?"))
		{
			if (operands.size() == 3)
			{
				return new ConditionalExpression(span, operands.get(0), operands.get(1), operands.get(2));
			}
			reportOperandCount(span, operator, "exactly three", operands.size());
			return fallbackOperand(span, operands);
		}
		if (operator.equals("??"))
		{
			if (operands.size() >= 2)
			{
				Expression result = operands.get(0);
				for (int i = 1; i < operands.size(); i++)
				{
					result = new NullCoalesce(span, result, operands.get(i));
				}
				return result;
			}
			reportOperandCount(span, operator, "at least two", operands.size());
			return fallbackOperand(span, operands);
		}

		UnaryOperator unary = UnaryOperator.fromSpelling(operator);
		BinaryOperator binary = BinaryOperator.fromSpelling(operator);
		if (operands.size() == 1 && unary != null)
		{
			return new UnaryOperation(span, unary, operands.get(0));
		}
		if (operands.size() >= 2 && binary != null)
		{
			Expression result = operands.get(0);
			for (int i = 1; i < operands.size(); i++)
			{
				result = new BinaryOperation(span, binary, result, operands.get(i));
			}
			return result;
		}
		if (binary != null)
		{
			reportOperandCount(span, operator, "at least two", operands.size());
		}
		else if (unary != null)
		{
			reportOperandCount(span, operator, "exactly one", operands.size());
		}
		else
		{
			diagnostics.reportError(span, DiagnosticCode.INVALID_OPERATOR, "Unknown operator '" + operator + "'.");
		}
		return fallbackOperand(span, operands);
	}

	/**
	 * Reads the operator token of a Lisp form.
	 *
	 * @return Its spelling, or null when the token is no operator (it is then left in place).
	 */
	private String lispOperator()
	{
		Token token = peek();
		switch (token.getType())
		{
			case PLUS:
			case MINUS:
			case STAR:
			case STAR_STAR:
			case SLASH:
			case PERCENT:
			case EQUAL_EQUAL:
			case BANG_EQUAL:
			case LESS:
			case LESS_EQUAL:
			case GREATER:
			case GREATER_EQUAL:
			case AMP_AMP:
			case PIPE_PIPE:
			case AMP:
			case PIPE:
			case CARET:
			case LESS_LESS:
			case GREATER_GREATER:
			case BANG:
			case TILDE:
				advance();
				return token.getLexeme();
			case NULL_COALESCE:
				advance();
				return "??";
			case QUESTION:
				advance();
				return "?";
			case IDENTIFIER:
				advance();
				return token.getText();
			default:
				reportUnexpected("operator");
				return null;
		}
	}

	private void reportOperandCount(Span span, String operator, String expected, int found)
	{
		diagnostics.reportError(span, DiagnosticCode.OPERATOR_ARGUMENT_COUNT,
				"Operator '" + operator + "' takes " + expected + " operands but got " + found + ".");
	}

	private static Expression fallbackOperand(Span span, List<Expression> operands)
	{
		return operands.isEmpty() ? new IntLiteral(span, 0) : operands.get(0);
	}

	/**
	 * Parses a call in expression position; arguments always run up to {@code §/C}.
	 */
	private Expression callExpression()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.CallAttributes attributes = Reconciler.call(bag);
		Expression targetExpression = null;

		if (attributes.target().isEmpty() && !check(TokenType.ARG) && isExpressionStart())
		{
			targetExpression = expression();
		}
		else
		{
			requireAttribute(start, "CALL", "target", attributes.target());
		}

		List<Expression> arguments = new ArrayList<>();
		callArguments(arguments);
		expect(TokenType.END_CALL, "§/C");
		return trailingMemberAccess(new CallExpression(spanFrom(start), attributes.target(), targetExpression,
				arguments, bag.asMap()));
	}

	/**
	 * Parses object construction.
	 * Grammar: `§NEW[Type:Arg...] (§A expr)* (§INIT[prop] expr | name = expr)* §/NEW?`
	 */
	private Expression newExpression()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.TypeAttributes attributes = Reconciler.newObject(bag);

		List<Expression> arguments = new ArrayList<>();
		if (!insideArgContext)
		{
			while (check(TokenType.ARG))
			{
				arguments.add(argument());
			}
		}

		List<PropertyAssignment> initializers = new ArrayList<>();
		while (true)
		{
			if (check(TokenType.INIT))
			{
				Token init = advance();
				AttributeBag initBag = readAttributes();
				Expression value = expression();
				initializers.add(new PropertyAssignment(spanFrom(init), Reconciler.name(initBag), value, initBag.asMap()));
			}
			else if (check(TokenType.IDENTIFIER) && check(1, TokenType.EQUALS))
			{
				Token property = advance();
				advance();
				Expression value = expression();
				initializers.add(new PropertyAssignment(spanFrom(property), property.getText(), value, Map.of()));
			}
			else
			{
				break;
			}
		}
		match(TokenType.END_NEW);

		return trailingMemberAccess(new NewExpression(spanFrom(start), attributes.type(), attributes.typeArguments(),
				arguments, initializers, bag.asMap()));
	}

	private RecordCreation recordCreation()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String typeName = requireAttribute(start, "RECORD", "type", Reconciler.typeName(bag));
		List<FieldAssignment> fields = new ArrayList<>();
		while (check(TokenType.FIELD))
		{
			Token field = advance();
			AttributeBag fieldBag = readAttributes();
			String name = requireAttribute(field, "FIELD", "name", Reconciler.name(fieldBag));
			Expression value = expression();
			fields.add(new FieldAssignment(spanFrom(field), name, value, fieldBag.asMap()));
		}
		match(TokenType.END_RECORD);
		return new RecordCreation(spanFrom(start), typeName, fields, bag.asMap());
	}

	/**
	 * Parses an array creation: fixed size ({@code §ARR[a1:i32:10]}) or initializer list
	 * ({@code §ARR[a1:i32] §A 1 §A 2 §/ARR[a1]}). A lone element with no closing tag is the size.
	 */
	private ArrayCreation arrayCreation()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.ArrayAttributes attributes = Reconciler.array(bag);
		String id = attributes.id().isEmpty() ? "_arr" + start.getSpan().getStart() : attributes.id();
		String elementType = attributes.elementType().isEmpty() ? "INT" : attributes.elementType();

		Expression size = null;
		List<Expression> elements = new ArrayList<>();
		if (attributes.size() != null)
		{
			size = attributeExpression(bag.source("size", 2), attributes.size(), spanFrom(start));
		}
		else
		{
			while (check(TokenType.ARG))
			{
				elements.add(argument());
			}
			if (elements.isEmpty())
			{
				while (!isAtEnd() && !check(TokenType.END_ARRAY) && isExpressionStart())
				{
					elements.add(expression());
				}
			}
			if (elements.size() == 1 && !check(TokenType.END_ARRAY))
			{
				size = elements.remove(0);
			}
		}

		Span span = check(TokenType.END_ARRAY)
				? closeConstruct(start, TokenType.END_ARRAY, "ARR", id)
				: spanFrom(start);
		return new ArrayCreation(span, id, elementType, size, elements, bag.asMap());
	}

	/**
	 * Parses element access, {@code §IDX[arr] index} or {@code §IDX array index}.
	 */
	private ArrayAccess arrayAccess()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String name = Reconciler.name(bag);
		Expression array = name.isEmpty() ? expression() : new ReferenceExpression(spanFrom(start), name);
		Expression index = expression();
		return new ArrayAccess(spanFrom(start), array, index, bag.asMap());
	}

	private ArrayLength arrayLength()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String name = Reconciler.name(bag);
		Expression array = name.isEmpty() ? expression() : new ReferenceExpression(spanFrom(start), name);
		return new ArrayLength(spanFrom(start), array, bag.asMap());
	}

	/**
	 * Parses a lambda.
	 * Grammar: `§LAM[id:async?:name:type...] §E[...]? (expr | stmt*) §/LAM[id]`
	 */
	private LambdaExpression lambdaExpression()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.LambdaAttributes attributes = Reconciler.lambda(bag);
		Span header = spanFrom(start);
		String id = requireAttribute(start, "LAM", "id", attributes.id());

		List<LambdaParameter> parameters = new ArrayList<>();
		for (Reconciler.LambdaParameterAttributes parameter : attributes.parameters())
		{
			parameters.add(new LambdaParameter(header, parameter.name(), parameter.type()));
		}
		EffectsDeclaration effects = check(TokenType.EFFECTS) ? effectsDeclaration() : null;

		boolean saved = insideArgContext;
		insideArgContext = false;
		Expression expressionBody = null;
		List<Statement> statementBody;
		try
		{
			if (isExpressionStart())
			{
				expressionBody = expression();
			}
			statementBody = statementsUntil(TokenType.END_LAMBDA);
		}
		finally
		{
			insideArgContext = saved;
		}

		Span span = closeConstruct(start, TokenType.END_LAMBDA, "LAM", id);
		return new LambdaExpression(span, id, attributes.async(), parameters, effects, expressionBody, statementBody,
				bag.asMap());
	}

	/**
	 * Parses an interpolated string: literal text parts and {@code §EXP expr} or bare expression parts.
	 */
	private InterpolatedString interpolatedString()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		List<InterpolationPart> parts = new ArrayList<>();

		while (!isAtEnd() && !check(TokenType.END_INTERPOLATE))
		{
			if (check(TokenType.STR_LITERAL))
			{
				Token text = advance();
				parts.add(new InterpolationPart(text.getSpan(), (String) text.getLiteral(), null));
			}
			else if (match(TokenType.EXPRESSION) || isExpressionStart())
			{
				Expression expression = expression();
				parts.add(new InterpolationPart(expression.getSpan(), null, expression));
			}
			else
			{
				reportUnexpected("string, §EXP or §/INTERP");
				advance();
			}
		}

		expect(TokenType.END_INTERPOLATE, "§/INTERP");
		return new InterpolatedString(spanFrom(start), parts, bag.asMap());
	}

	/**
	 * Parses a non-destructive update: {@code §WITH target (§SET[prop] expr)* §/WITH}.
	 */
	private WithExpression withExpression()
	{
		Token start = advance();
		Expression target = expression();
		List<PropertyAssignment> assignments = new ArrayList<>();

		while (!isAtEnd() && !check(TokenType.END_WITH))
		{
			if (check(TokenType.SET))
			{
				Token set = advance();
				AttributeBag setBag = readAttributes();
				Expression value = expression();
				assignments.add(new PropertyAssignment(spanFrom(set), Reconciler.name(setBag), value, setBag.asMap()));
			}
			else
			{
				reportUnexpected("§SET or §/WITH");
				advance();
			}
		}

		expect(TokenType.END_WITH, "§/WITH");
		return new WithExpression(spanFrom(start), target, assignments);
	}

	/**
	 * Turns an attribute value into an expression by parsing the tokens it was read from,
	 * so nested forms such as {@code (- n 1)} and literals keep their own source spans.
	 *
	 * @param source   The value's tokens; empty for a default the reconciler filled in.
	 * @param text     The value text.
	 * @param fallback The span given to a default value.
	 */
	private Expression attributeExpression(List<Token> source, String text, Span fallback)
	{
		if (source.isEmpty())
		{
			try
			{
				return new IntLiteral(fallback, Long.parseLong(text));
			}
			catch (NumberFormatException e)
			{
				return new ReferenceExpression(fallback, text);
			}
		}

		Span last = source.get(source.size() - 1).getSpan();
		List<Token> tokens = new ArrayList<>(source);
		tokens.add(new Token(TokenType.EOF, "", null,
				new Span(last.getEnd(), 0, last.getLine(), last.getColumn() + last.getLength())));
		return new OpalParser(tokens, diagnostics, debug.isEnabled()).parseStandaloneExpression();
	}

	// --- Collections ---

	/**
	 * Parses a list literal.
	 * Grammar: `§LIST[id:type] expr* §/LIST[id]`, element type defaulting to i32.
	 */
	private ListCreation listCreation()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.CollectionAttributes attributes = Reconciler.collectionCreation(bag, "i32");
		String id = requireAttribute(start, "LIST", "id", attributes.id());
		List<Expression> elements = collectionElements(TokenType.END_LIST);
		Span span = closeConstruct(start, TokenType.END_LIST, "LIST", id);
		return new ListCreation(span, id, attributes.elementType(), elements, bag.asMap());
	}

	/**
	 * Parses a hash set literal.
	 * Grammar: `§HSET[id:type] expr* §/HSET[id]`, element type defaulting to str.
	 */
	private SetCreation setCreation()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.CollectionAttributes attributes = Reconciler.collectionCreation(bag, "str");
		String id = requireAttribute(start, "HSET", "id", attributes.id());
		List<Expression> elements = collectionElements(TokenType.END_HASH_SET);
		Span span = closeConstruct(start, TokenType.END_HASH_SET, "HSET", id);
		return new SetCreation(span, id, attributes.elementType(), elements, bag.asMap());
	}

	private List<Expression> collectionElements(TokenType closeType)
	{
		List<Expression> elements = new ArrayList<>();
		while (!isAtEnd() && !check(closeType) && isExpressionStart())
		{
			elements.add(expression());
		}
		return elements;
	}

	/**
	 * Parses a dictionary literal.
	 * Grammar: `§DICT[id:keyType:valueType] (§KV key value)* §/DICT[id]`
	 */
	private DictionaryCreation dictionaryCreation()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.DictionaryAttributes attributes = Reconciler.dictionary(bag);
		String id = requireAttribute(start, "DICT", "id", attributes.id());

		List<KeyValuePair> entries = new ArrayList<>();
		while (check(TokenType.KEY_VALUE))
		{
			Token entry = advance();
			AttributeBag entryBag = readAttributes();
			Expression key = expression();
			Expression value = expression();
			entries.add(new KeyValuePair(spanFrom(entry), key, value, entryBag.asMap()));
		}

		Span span = closeConstruct(start, TokenType.END_DICT, "DICT", id);
		return new DictionaryCreation(span, id, attributes.keyType(), attributes.valueType(), entries, bag.asMap());
	}

	/**
	 * Parses the collection mutations {@code §PUSH}, {@code §ADD}, {@code §PUT}, {@code §REM},
	 * {@code §SETIDX}, {@code §CLR} and {@code §INS}. Each names its collection in the brackets.
	 */
	private Statement collectionStatement()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String construct = start.getLexeme().substring(1);
		String collection = requireAttribute(start, construct, "collection", Reconciler.collection(bag));

		switch (start.getType())
		{
			case PUT:
			{
				Expression key = expression();
				Expression value = expression();
				return new DictionaryPut(spanFrom(start), collection, key, value, bag.asMap());
			}
			case REMOVE:
			{
				Expression value = expression();
				return new CollectionRemove(spanFrom(start), collection, value, bag.asMap());
			}
			case SET_INDEX:
			{
				Expression index = expression();
				Expression value = expression();
				return new CollectionSetIndex(spanFrom(start), collection, index, value, bag.asMap());
			}
			case INSERT:
			{
				Expression index = expression();
				Expression value = expression();
				return new CollectionInsert(spanFrom(start), collection, index, value, bag.asMap());
			}
			case CLEAR:
				return new CollectionClear(spanFrom(start), collection, bag.asMap());
			default:
			{
				Expression value = expression();
				return new CollectionPush(spanFrom(start), collection, value, bag.asMap());
			}
		}
	}

	/**
	 * Parses a membership test.
	 * Grammar: `§HAS[coll] (§KEY | §VAL)? expr`
	 */
	private CollectionContains collectionContains()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		String collection = requireAttribute(start, "HAS", "collection", Reconciler.collection(bag));
		ContainsMode mode = ContainsMode.VALUE;
		if (match(TokenType.KEY))
		{
			mode = ContainsMode.KEY;
		}
		else if (match(TokenType.VAL))
		{
			mode = ContainsMode.DICT_VALUE;
		}
		Expression value = expression();
		return new CollectionContains(spanFrom(start), collection, mode, value, bag.asMap());
	}

	/**
	 * Parses an element count, {@code §CNT[coll]} or {@code §CNT expr}.
	 */
	private CollectionCount collectionCount()
	{
		Token start = advance();
		boolean bracketed = check(TokenType.OPEN_BRACKET);
		AttributeBag bag = readAttributes();
		Expression collection;
		if (bracketed)
		{
			String name = requireAttribute(start, "CNT", "collection", Reconciler.collection(bag));
			collection = new ReferenceExpression(spanFrom(start), name);
		}
		else
		{
			collection = expression();
		}
		return new CollectionCount(spanFrom(start), collection, bag.asMap());
	}

	// --- Match and patterns ---

	/**
	 * Parses {@code §W[id:expr?] target case* §/W[id]}.
	 */
	private MatchParts matchParts()
	{
		Token start = advance();
		AttributeBag bag = readAttributes();
		Reconciler.MatchAttributes attributes = Reconciler.match(bag);
		String id = requireAttribute(start, "MATCH", "id", attributes.id());
		Expression target = expression();

		List<MatchCase> cases = new ArrayList<>();
		while (check(TokenType.CASE))
		{
			cases.add(matchCase());
		}

		Span span = closeConstruct(start, TokenType.END_MATCH, "MATCH", id);
		return new MatchParts(span, id, attributes.expressionForm(), target, cases, bag.asMap());
	}

	/**
	 * Parses one arm: {@code §K pattern → expr} or {@code §K pattern stmt* §/K?}.
	 * Guards are not part of the grammar; the guard slot stays empty.
	 */
	private MatchCase matchCase()
	{
		Token start = advance();
		Pattern pattern = pattern();
		List<Statement> body = new ArrayList<>();

		if (match(TokenType.ARROW))
		{
			Expression value = expression();
			body.add(new ReturnStatement(value.getSpan(), value));
		}
		else
		{
			body.addAll(statementsUntil(TokenType.CASE, TokenType.END_MATCH, TokenType.END_CASE));
			match(TokenType.END_CASE);
		}
		return new MatchCase(spanFrom(start), pattern, null, body);
	}

	private boolean isPatternStart()
	{
		switch (peek().getType())
		{
			case VAR:
			case RELATIONAL_PATTERN:
			case POSITIONAL_PATTERN:
			case PROPERTY_PATTERN:
			case LIST_PATTERN:
			case IDENTIFIER:
			case SOME:
			case NONE:
			case OK:
			case ERR:
				return true;
			default:
				return peek().getType().isLiteral();
		}
	}

	/**
	 * Parses a pattern. Anything that starts no pattern becomes a wildcard and consumes nothing.
	 */
	private Pattern pattern()
	{
		Token token = peek();
		if (token.getType().isLiteral())
		{
			Expression literal = expression();
			return new LiteralPattern(literal.getSpan(), literal);
		}
		switch (token.getType())
		{
			case VAR:
			{
				advance();
				AttributeBag bag = readAttributes();
				String name = Reconciler.name(bag);
				return new VarPattern(spanFrom(token), name.isEmpty() ? "_" : name, bag.asMap());
			}
			case RELATIONAL_PATTERN:
			{
				advance();
				AttributeBag bag = readAttributes();
				BinaryOperator operator = relationalOperator(Reconciler.name(bag));
				Expression value = expression();
				return new RelationalPattern(spanFrom(token), operator == null ? BinaryOperator.GREATER_OR_EQUAL
						: operator, value, bag.asMap());
			}
			case IDENTIFIER:
				return identifierPattern(token);
			case SOME:
			{
				advance();
				Pattern inner = pattern();
				return new SomePattern(spanFrom(token), inner);
			}
			case NONE:
				advance();
				return new NonePattern(token.getSpan());
			case OK:
			{
				advance();
				Pattern inner = pattern();
				return new OkPattern(spanFrom(token), inner);
			}
			case ERR:
			{
				advance();
				Pattern inner = pattern();
				return new ErrPattern(spanFrom(token), inner);
			}
			case POSITIONAL_PATTERN:
			{
				advance();
				AttributeBag bag = readAttributes();
				List<Pattern> patterns = new ArrayList<>();
				while (isPatternStart())
				{
					patterns.add(pattern());
				}
				return new PositionalPattern(spanFrom(token), Reconciler.typeName(bag), patterns, bag.asMap());
			}
			case PROPERTY_PATTERN:
			{
				advance();
				AttributeBag bag = readAttributes();
				List<PropertyMatch> matches = new ArrayList<>();
				while (check(TokenType.PROPERTY_MATCH))
				{
					Token matchToken = advance();
					AttributeBag matchBag = readAttributes();
					Pattern inner = pattern();
					matches.add(new PropertyMatch(spanFrom(matchToken), Reconciler.name(matchBag), inner,
							matchBag.asMap()));
				}
				return new PropertyPattern(spanFrom(token), Reconciler.typeName(bag), matches, bag.asMap());
			}
			case LIST_PATTERN:
			{
				advance();
				AttributeBag bag = readAttributes();
				List<Pattern> patterns = new ArrayList<>();
				String restName = null;
				while (true)
				{
					if (match(TokenType.REST))
					{
						String name = Reconciler.name(readAttributes());
						restName = name.isEmpty() ? "_" : name;
					}
					else if (isPatternStart())
					{
						patterns.add(pattern());
					}
					else
					{
						break;
					}
				}
				return new ListPattern(spanFrom(token), patterns, restName, bag.asMap());
			}
			default:
				return new WildcardPattern(token.getSpan());
		}
	}

	/**
	 * Bare identifiers: {@code gte/lte/gt/lt expr} are relational, {@code _} is a wildcard,
	 * {@code var name} binds, {@code null} is a literal, anything else a variable pattern.
	 */
	private Pattern identifierPattern(Token token)
	{
		String text = token.getText();
		BinaryOperator operator = relationalOperator(text);
		if (operator != null)
		{
			advance();
			Expression value = expression();
			return new RelationalPattern(spanFrom(token), operator, value, Map.of());
		}

		advance();
		if (text.equals("var") && check(TokenType.IDENTIFIER))
		{
			Token name = advance();
			return new VarPattern(spanFrom(token), name.getText(), Map.of());
		}
		if (text.equals("_"))
		{
			return new WildcardPattern(token.getSpan());
		}
		if (text.equals("null"))
		{
			return new LiteralPattern(token.getSpan(), new ReferenceExpression(token.getSpan(), "null"));
		}
		return new VariablePattern(token.getSpan(), text);
	}

	private static BinaryOperator relationalOperator(String code)
	{
		switch (code)
		{
			case "gte":
				return BinaryOperator.GREATER_OR_EQUAL;
			case "lte":
				return BinaryOperator.LESS_OR_EQUAL;
			case "gt":
				return BinaryOperator.GREATER;
			case "lt":
				return BinaryOperator.LESS;
			default:
				return null;
		}
	}

	// --- Shared helpers ---

	private AttributeBag readAttributes()
	{
		return attributeReader.read();
	}

	/**
	 * Reports a missing required attribute when {@code value} is empty.
	 *
	 * @return The value, unchanged.
	 */
	private String requireAttribute(Token tag, String construct, String attribute, String value)
	{
		if (value == null || value.isEmpty())
		{
			diagnostics.reportMissingRequiredAttribute(tag.getSpan(), construct, attribute);
			return "";
		}
		return value;
	}

	private String requiredString(Token tag, String construct, String attribute)
	{
		String value = optionalString();
		if (value == null)
		{
			diagnostics.reportMissingRequiredAttribute(tag.getSpan(), construct, attribute);
			return "";
		}
		return value;
	}

	private String optionalString()
	{
		return check(TokenType.STR_LITERAL) ? (String) advance().getLiteral() : null;
	}

	/**
	 * Consumes a construct's closing tag and its attributes, then compares the ids.
	 *
	 * @return The span from the opening tag to the last consumed token.
	 */
	private Span closeConstruct(Token start, TokenType closeType, String construct, String openId)
	{
		Token close = expect(closeType, "closing tag of " + construct);
		if (close != null)
		{
			checkCloseId(construct, openId, Reconciler.id(readAttributes()), close.getSpan());
		}
		return spanFrom(start);
	}

	/**
	 * Reports one mismatched-id diagnostic when a closing tag's id differs from the opening one.
	 * The caller keeps the opening id either way.
	 */
	private void checkCloseId(String construct, String openId, String closeId, Span span)
	{
		if (!openId.equals(closeId))
		{
			diagnostics.reportMismatchedId(span, construct, openId, closeId);
		}
	}

	private static List<TypeParameter> buildTypeParameters(List<PendingTypeParameter> pending)
	{
		List<TypeParameter> typeParameters = new ArrayList<>(pending.size());
		for (PendingTypeParameter typeParameter : pending)
		{
			typeParameters.add(typeParameter.build());
		}
		return typeParameters;
	}

	private Span spanFrom(Token start)
	{
		return start.getSpan().union(previous().getSpan());
	}

	private void reportUnexpected(String expected)
	{
		diagnostics.reportUnexpectedToken(peek().getSpan(), expected, AttributeReader.describe(peek()));
	}

	/**
	 * Consumes the current token if it has the expected type; otherwise reports it and leaves it in place.
	 *
	 * @return The consumed token, or null.
	 */
	private Token expect(TokenType type, String expected)
	{
		if (check(type))
		{
			return advance();
		}
		reportUnexpected(expected);
		return null;
	}

	private boolean match(TokenType... types)
	{
		return stream.match(types);
	}

	private boolean check(TokenType... types)
	{
		return stream.check(types);
	}

	private boolean check(int offset, TokenType type)
	{
		return stream.check(offset, type);
	}

	private Token advance()
	{
		return stream.advance();
	}

	private Token peek()
	{
		return stream.peek();
	}

	private Token previous()
	{
		return stream.previous();
	}

	private boolean isAtEnd()
	{
		return stream.isAtEnd();
	}
}
