package org.lokray.opal.parser;

import org.lokray.opal.ast.declarations.AssumptionCategory;
import org.lokray.opal.ast.declarations.IssuePriority;
import org.lokray.opal.ast.declarations.Modifier;
import org.lokray.opal.ast.declarations.Visibility;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns the attributes of one tag into canonical fields, whichever attribute syntax
 * produced them. Every method prefers the named form ({@code [id=f1 name=Main]}) when its
 * key is non-empty and otherwise decodes the construct's positional layout
 * ({@code [f1:Main]}). All methods are pure.
 */
public final class Reconciler
{
	public record ModuleAttributes(String id, String name)
	{
	}

	public record FunctionAttributes(String id, String name, Visibility visibility, Set<Modifier> modifiers)
	{
	}

	public record ParameterAttributes(String type, String name, String semantic)
	{
	}

	public record CallAttributes(String target, boolean fallible)
	{
	}

	public record BindAttributes(String name, String type, boolean mutable)
	{
	}

	public record ForAttributes(String id, String variable, String from, String to, String step)
	{
	}

	public record ForeachAttributes(String id, String variable, String type)
	{
	}

	public record MatchAttributes(String id, boolean expressionForm)
	{
	}

	public record ArrayAttributes(String id, String elementType, String size)
	{
	}

	public record TypeAttributes(String type, List<String> typeArguments)
	{
	}

	public record ClassAttributes(String id, String name, String baseClass, Set<Modifier> modifiers)
	{
	}

	public record InterfaceAttributes(String id, String name)
	{
	}

	public record FieldAttributes(String type, String name, Visibility visibility, Set<Modifier> modifiers)
	{
	}

	public record PropertyAttributes(String id, String name, String type, Visibility visibility, Set<Modifier> modifiers)
	{
	}

	public record ConstructorAttributes(String id, Visibility visibility)
	{
	}

	public record LambdaParameterAttributes(String name, String type)
	{
	}

	public record LambdaAttributes(String id, boolean async, List<LambdaParameterAttributes> parameters)
	{
	}

	public record CatchAttributes(String exceptionType, String variable)
	{
	}

	public record WhereAttributes(String typeParameter, List<String> constraints)
	{
	}

	public record IssueAttributes(String id, String category, IssuePriority priority)
	{
	}

	public record AuthorAttributes(String agent, String task)
	{
	}

	public record UsingAttributes(String namespace, String alias, boolean isStatic)
	{
	}

	public record DefinitionAttributes(String id, String name)
	{
	}

	public record FieldDefinitionAttributes(String name, String type)
	{
	}

	public record EnumAttributes(String id, String name, String underlyingType)
	{
	}

	public record EventAttributes(String id, String name, Visibility visibility, String delegateType)
	{
	}

	public record CollectionAttributes(String id, String elementType)
	{
	}

	public record DictionaryAttributes(String id, String keyType, String valueType)
	{
	}

	public record ExampleAttributes(String id, String message)
	{
	}

	public record DeprecatedAttributes(String since, String replacement)
	{
	}

	private Reconciler()
	{
	}

	// --- Shared helpers ---

	private static String named(AttributeBag bag, String key)
	{
		return bag.has(key) ? bag.get(key) : null;
	}

	private static String namedOrPositional(AttributeBag bag, String key, int index)
	{
		String value = named(bag, key);
		return value != null ? value : bag.positionalOrEmpty(index);
	}

	private static boolean isTrue(String value)
	{
		return value != null && value.equalsIgnoreCase("true");
	}

	private static String orDefault(String value, String fallback)
	{
		return value == null || value.isEmpty() ? fallback : value;
	}

	/**
	 * Maps {@code pub/public}, {@code pri/priv/private} and {@code int/internal}.
	 *
	 * @param value    The written visibility, may be null or empty.
	 * @param fallback Used when nothing is written or the word is unknown.
	 * @return The visibility.
	 */
	public static Visibility visibility(String value, Visibility fallback)
	{
		if (value == null || value.isEmpty())
		{
			return fallback;
		}
		switch (value.toLowerCase(Locale.ROOT))
		{
			case "pub":
			case "public":
				return Visibility.PUBLIC;
			case "pri":
			case "priv":
			case "private":
				return Visibility.PRIVATE;
			case "int":
			case "internal":
				return Visibility.INTERNAL;
			default:
				return fallback;
		}
	}

	/**
	 * Modifiers are matched by substring: {@code virt}, {@code over}, {@code abs},
	 * {@code seal}, {@code stat}.
	 *
	 * @param text The written modifiers, e.g. {@code "abs,seal"}; may be null.
	 * @return The modifiers found.
	 */
	public static Set<Modifier> modifiers(String text)
	{
		EnumSet<Modifier> result = EnumSet.noneOf(Modifier.class);
		if (text == null)
		{
			return result;
		}
		String lower = text.toLowerCase(Locale.ROOT);
		for (Modifier modifier : Modifier.values())
		{
			if (lower.contains(modifier.getCode()))
			{
				result.add(modifier);
			}
		}
		return result;
	}

	private static boolean isModifierList(String text)
	{
		if (text == null || text.isEmpty())
		{
			return false;
		}
		for (String word : text.split("[,\\s]+"))
		{
			if (word.isEmpty())
			{
				continue;
			}
			if (modifiers(word).isEmpty() && visibility(word, null) == null)
			{
				return false;
			}
		}
		return true;
	}

	/**
	 * Splits a comma-separated list, trimming entries and dropping empty ones.
	 */
	static List<String> splitList(String text)
	{
		List<String> items = new ArrayList<>();
		if (text == null)
		{
			return items;
		}
		for (String item : text.split(","))
		{
			String trimmed = item.trim();
			if (!trimmed.isEmpty())
			{
				items.add(trimmed);
			}
		}
		return items;
	}

	// --- Modules and functions ---

	/**
	 * Module: {@code [id:name]}.
	 */
	public static ModuleAttributes module(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new ModuleAttributes(bag.get("id"), bag.getOrEmpty("name"));
		}
		return new ModuleAttributes(bag.positionalOrEmpty(0), bag.positionalOrEmpty(1));
	}

	/**
	 * The single id carried by closing tags and by if/while/do/try/decision tags: {@code [id]}.
	 */
	public static String id(AttributeBag bag)
	{
		return namedOrPositional(bag, "id", 0);
	}

	/**
	 * Function or method: {@code [id:name:visibility:modifiers]}, visibility defaults to private.
	 */
	public static FunctionAttributes function(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new FunctionAttributes(bag.get("id"), bag.getOrEmpty("name"),
					visibility(bag.get("visibility"), Visibility.PRIVATE), modifiers(bag.get("modifiers")));
		}
		return new FunctionAttributes(bag.positionalOrEmpty(0), bag.positionalOrEmpty(1),
				visibility(bag.positional(2), Visibility.PRIVATE), modifiers(bag.positional(3)));
	}

	/**
	 * Parameter: {@code [type:name:semantic]}; the positional type and semantic hint are expanded.
	 */
	public static ParameterAttributes parameter(AttributeBag bag)
	{
		if (bag.has("type"))
		{
			return new ParameterAttributes(bag.get("type"), bag.getOrEmpty("name"), named(bag, "semantic"));
		}
		return new ParameterAttributes(TypeShorthand.expand(bag.positionalOrEmpty(0)), bag.positionalOrEmpty(1),
				SemanticShorthand.expand(bag.positional(2)));
	}

	/**
	 * Output: {@code [type]}.
	 */
	public static String output(AttributeBag bag)
	{
		if (bag.has("type"))
		{
			return bag.get("type");
		}
		return TypeShorthand.expand(bag.positionalOrEmpty(0));
	}

	/**
	 * Effects: named {@code [io=console_write]} pairs, or positional codes ({@code [cw,fr:db]}).
	 *
	 * @return Category to comma-joined values, in declaration order.
	 */
	public static Map<String, String> effects(AttributeBag bag)
	{
		Map<String, String> effects = new LinkedHashMap<>();
		for (Map.Entry<String, List<String>> entry : bag.asMap().entrySet())
		{
			String key = entry.getKey();
			if (!key.startsWith(AttributeBag.POSITION_PREFIX))
			{
				for (String value : entry.getValue())
				{
					effects.merge(key, value, (existing, added) -> existing + "," + added);
				}
			}
		}
		if (!effects.isEmpty())
		{
			return Collections.unmodifiableMap(effects);
		}

		List<String> codes = new ArrayList<>();
		for (String value : bag.positionals())
		{
			codes.addAll(splitList(value));
		}
		return Collections.unmodifiableMap(EffectShorthand.expandAll(codes));
	}

	/**
	 * Precondition or postcondition message: {@code [message]}.
	 */
	public static String message(AttributeBag bag)
	{
		String message = namedOrPositional(bag, "message", 0);
		return message.isEmpty() ? null : message;
	}

	/**
	 * Type parameter: {@code [name]}.
	 */
	public static String typeParameter(AttributeBag bag)
	{
		return namedOrPositional(bag, "name", 0);
	}

	/**
	 * Where clause: {@code [T:constraint:constraint]}; each slot may also hold a comma list.
	 */
	public static WhereAttributes where(AttributeBag bag)
	{
		if (bag.has("param"))
		{
			return new WhereAttributes(bag.get("param"), splitList(bag.get("constraints")));
		}
		List<String> constraints = new ArrayList<>();
		List<String> values = bag.positionals();
		for (int i = 1; i < values.size(); i++)
		{
			constraints.addAll(splitList(values.get(i)));
		}
		return new WhereAttributes(bag.positionalOrEmpty(0), constraints);
	}

	/**
	 * Using directive: {@code [ns]}, {@code [alias:ns]} or {@code [static:ns]}.
	 */
	public static UsingAttributes using(AttributeBag bag)
	{
		if (bag.has("namespace"))
		{
			return new UsingAttributes(bag.get("namespace"), named(bag, "alias"), isTrue(bag.get("static")));
		}
		if (bag.positionalCount() >= 2)
		{
			String first = bag.positionalOrEmpty(0);
			if (first.equals("static"))
			{
				return new UsingAttributes(bag.positionalOrEmpty(1), null, true);
			}
			return new UsingAttributes(bag.positionalOrEmpty(1), first, false);
		}
		return new UsingAttributes(bag.positionalOrEmpty(0), null, false);
	}

	// --- Statements ---

	/**
	 * Call: {@code [target]}, or {@code [target!]} for a fallible call.
	 */
	public static CallAttributes call(AttributeBag bag)
	{
		if (bag.has("target"))
		{
			return new CallAttributes(bag.get("target"), isTrue(bag.get("fallible")));
		}
		String target = bag.positionalOrEmpty(0);
		boolean fallible = target.endsWith("!");
		if (fallible)
		{
			target = target.substring(0, target.length() - 1);
		}
		return new CallAttributes(target, fallible);
	}

	/**
	 * Bind: {@code [name:type]}, {@code ~} before the name marks it mutable.
	 */
	public static BindAttributes bind(AttributeBag bag)
	{
		if (bag.has("name"))
		{
			return new BindAttributes(bag.get("name"), named(bag, "type"), isTrue(bag.get("mutable")));
		}
		String name = bag.positionalOrEmpty(0);
		boolean mutable = name.startsWith("~");
		if (mutable)
		{
			name = name.substring(1);
		}
		String type = bag.positional(1);
		return new BindAttributes(name, type == null || type.isEmpty() ? null : TypeShorthand.expand(type), mutable);
	}

	/**
	 * For loop: {@code [id:var:from:to:step]}, step defaults to {@code 1}.
	 */
	public static ForAttributes forLoop(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new ForAttributes(bag.get("id"), bag.getOrEmpty("var"), bag.getOrEmpty("from"),
					bag.getOrEmpty("to"), orDefault(bag.get("step"), "1"));
		}
		return new ForAttributes(bag.positionalOrEmpty(0), bag.positionalOrEmpty(1), bag.positionalOrEmpty(2),
				bag.positionalOrEmpty(3), orDefault(bag.positional(4), "1"));
	}

	/**
	 * Foreach: {@code [id:var:type]}, defaulting to {@code item} and {@code var}.
	 */
	public static ForeachAttributes foreach(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new ForeachAttributes(bag.get("id"), orDefault(bag.get("var"), "item"),
					orDefault(bag.get("type"), "var"));
		}
		String type = orDefault(bag.positional(2), "var");
		return new ForeachAttributes(bag.positionalOrEmpty(0), orDefault(bag.positional(1), "item"),
				type.equals("var") ? type : TypeShorthand.expand(type));
	}

	/**
	 * Match: {@code [id]}, or {@code [id:expr]} for the expression form.
	 */
	public static MatchAttributes match(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new MatchAttributes(bag.get("id"), isTrue(bag.get("expr")));
		}
		return new MatchAttributes(bag.positionalOrEmpty(0), "expr".equals(bag.positional(1)));
	}

	/**
	 * Catch: {@code [type:var]}, both optional.
	 */
	public static CatchAttributes catchClause(AttributeBag bag)
	{
		if (bag.has("type"))
		{
			return new CatchAttributes(bag.get("type"), named(bag, "var"));
		}
		String type = bag.positional(0);
		String variable = bag.positional(1);
		return new CatchAttributes(type == null || type.isEmpty() ? null : type,
				variable == null || variable.isEmpty() ? null : variable);
	}

	/**
	 * The one name a simple tag carries: field, property match, initializer, variable pattern.
	 */
	public static String name(AttributeBag bag)
	{
		return namedOrPositional(bag, "name", 0);
	}

	/**
	 * The user type a record, extends or implements tag names: {@code [type]}, kept verbatim.
	 */
	public static String typeName(AttributeBag bag)
	{
		return namedOrPositional(bag, "type", 0);
	}

	// --- Expressions ---

	/**
	 * None: {@code [type]}, expanded.
	 *
	 * @return The type, or null when the tag leaves it out.
	 */
	public static String optionalType(AttributeBag bag)
	{
		String type = namedOrPositional(bag, "type", 0);
		return type.isEmpty() ? null : TypeShorthand.expand(type);
	}

	/**
	 * Array: {@code [id:type:size]}. When the first slot is a primitive type code and the
	 * second is not, the two slots are read the other way round.
	 */
	public static ArrayAttributes array(AttributeBag bag)
	{
		if (bag.has("id") || bag.has("type"))
		{
			return new ArrayAttributes(bag.getOrEmpty("id"), TypeShorthand.expand(bag.getOrEmpty("type")),
					named(bag, "size"));
		}
		String id = bag.positionalOrEmpty(0);
		String type = bag.positionalOrEmpty(1);
		if (TypeShorthand.isPrimitive(id) && !TypeShorthand.isPrimitive(type))
		{
			String swap = id;
			id = type;
			type = swap;
		}
		String size = bag.positional(2);
		return new ArrayAttributes(id, TypeShorthand.expand(type), size == null || size.isEmpty() ? null : size);
	}

	/**
	 * Generic instantiation: {@code [Type:Arg1:Arg2]}.
	 */
	public static TypeAttributes generic(AttributeBag bag)
	{
		if (bag.has("type"))
		{
			return new TypeAttributes(bag.get("type"), splitList(bag.get("args")));
		}
		List<String> values = bag.positionals();
		List<String> typeArguments = values.size() > 1 ? values.subList(1, values.size()) : Collections.emptyList();
		return new TypeAttributes(bag.positionalOrEmpty(0), new ArrayList<>(typeArguments));
	}

	/**
	 * Object creation: {@code [Type:Arg1:Arg2]} or {@code [Type<Arg1,Arg2>]}; the type defaults to
	 * {@code object}.
	 */
	public static TypeAttributes newObject(AttributeBag bag)
	{
		String raw = bag.has("type") ? bag.get("type") : orDefault(bag.positional(0), "object");
		int angle = raw.indexOf('<');
		if (angle > 0 && raw.endsWith(">"))
		{
			return new TypeAttributes(raw.substring(0, angle), splitList(raw.substring(angle + 1, raw.length() - 1)));
		}
		if (bag.has("type"))
		{
			return new TypeAttributes(raw, splitList(bag.get("args")));
		}
		List<String> typeArguments = new ArrayList<>();
		List<String> values = bag.positionals();
		for (int i = 1; i < values.size(); i++)
		{
			if (!values.get(i).isEmpty())
			{
				typeArguments.add(values.get(i));
			}
		}
		return new TypeAttributes(raw, typeArguments);
	}

	/**
	 * Lambda: {@code [id:name:type:name:type]} or {@code [id:async:name:type]}.
	 */
	public static LambdaAttributes lambda(AttributeBag bag)
	{
		List<LambdaParameterAttributes> parameters = new ArrayList<>();
		if (bag.has("id"))
		{
			return new LambdaAttributes(bag.get("id"), isTrue(bag.get("async")), parameters);
		}

		List<String> values = bag.positionals();
		int index = 1;
		boolean async = values.size() > 1 && values.get(1).equalsIgnoreCase("async");
		if (async)
		{
			index = 2;
		}
		for (; index < values.size(); index += 2)
		{
			String name = values.get(index);
			String type = index + 1 < values.size() ? values.get(index + 1) : "";
			if (!name.isEmpty())
			{
				parameters.add(new LambdaParameterAttributes(name, type.isEmpty() ? null : TypeShorthand.expand(type)));
			}
		}
		return new LambdaAttributes(bag.positionalOrEmpty(0), async, parameters);
	}

	/**
	 * Await: {@code [true]} or {@code [false]} sets the continuation-context flag.
	 *
	 * @return The flag, or null when the tag leaves it unspecified.
	 */
	public static Boolean await(AttributeBag bag)
	{
		String value = namedOrPositional(bag, "configure", 0);
		if (value.equalsIgnoreCase("true"))
		{
			return Boolean.TRUE;
		}
		if (value.equalsIgnoreCase("false"))
		{
			return Boolean.FALSE;
		}
		return null;
	}

	// --- Classes ---

	/**
	 * Class: {@code [id:name:base:modifiers]}; with three slots the third is read as
	 * modifiers when it only holds modifier or visibility words, otherwise as the base class.
	 */
	public static ClassAttributes classDefinition(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new ClassAttributes(bag.get("id"), bag.getOrEmpty("name"), named(bag, "base"),
					modifiers(bag.get("modifiers")));
		}

		String third = bag.positionalOrEmpty(2);
		String fourth = bag.positional(3);
		String baseClass = null;
		Set<Modifier> modifiers;
		if (fourth != null)
		{
			baseClass = third.isEmpty() || visibility(third, null) != null ? null : third;
			modifiers = modifiers(fourth);
		}
		else if (isModifierList(third))
		{
			modifiers = modifiers(third);
		}
		else
		{
			baseClass = third.isEmpty() ? null : third;
			modifiers = EnumSet.noneOf(Modifier.class);
		}
		return new ClassAttributes(bag.positionalOrEmpty(0), bag.positionalOrEmpty(1), baseClass, modifiers);
	}

	/**
	 * Interface: {@code [id:name]}.
	 */
	public static InterfaceAttributes interfaceDefinition(AttributeBag bag)
	{
		ModuleAttributes pair = module(bag);
		return new InterfaceAttributes(pair.id(), pair.name());
	}

	/**
	 * Field: {@code [type:name:visibility:modifiers]}, visibility defaults to private.
	 */
	public static FieldAttributes field(AttributeBag bag)
	{
		if (bag.has("type"))
		{
			return new FieldAttributes(bag.get("type"), bag.getOrEmpty("name"),
					visibility(bag.get("visibility"), Visibility.PRIVATE), modifiers(bag.get("modifiers")));
		}
		return new FieldAttributes(TypeShorthand.expand(bag.positionalOrEmpty(0)), bag.positionalOrEmpty(1),
				visibility(bag.positional(2), Visibility.PRIVATE), modifiers(bag.positional(3)));
	}

	/**
	 * Property: {@code [id:name:type:visibility:modifiers]}, visibility defaults to public.
	 */
	public static PropertyAttributes property(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new PropertyAttributes(bag.get("id"), bag.getOrEmpty("name"), bag.getOrEmpty("type"),
					visibility(bag.get("visibility"), Visibility.PUBLIC), modifiers(bag.get("modifiers")));
		}
		return new PropertyAttributes(bag.positionalOrEmpty(0), bag.positionalOrEmpty(1),
				TypeShorthand.expand(bag.positionalOrEmpty(2)), visibility(bag.positional(3), Visibility.PUBLIC),
				modifiers(bag.positional(4)));
	}

	/**
	 * Constructor: {@code [id:visibility]}, visibility defaults to public.
	 */
	public static ConstructorAttributes constructor(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new ConstructorAttributes(bag.get("id"), visibility(bag.get("visibility"), Visibility.PUBLIC));
		}
		return new ConstructorAttributes(bag.positionalOrEmpty(0), visibility(bag.positional(1), Visibility.PUBLIC));
	}

	/**
	 * Accessor: {@code [visibility]}.
	 *
	 * @return The visibility, or null when the accessor does not restrict it.
	 */
	public static Visibility accessorVisibility(AttributeBag bag)
	{
		return visibility(namedOrPositional(bag, "visibility", 0), null);
	}

	// --- Metadata ---

	/**
	 * Issue: {@code [id:category:priority]}, all optional; priority defaults to medium.
	 */
	public static IssueAttributes issue(AttributeBag bag)
	{
		if (bag.has("id") || bag.has("category") || bag.has("priority"))
		{
			return new IssueAttributes(named(bag, "id"), named(bag, "category"), priority(bag.get("priority")));
		}
		String id = bag.positional(0);
		String category = bag.positional(1);
		return new IssueAttributes(id == null || id.isEmpty() ? null : id,
				category == null || category.isEmpty() ? null : category, priority(bag.positional(2)));
	}

	public static IssuePriority priority(String value)
	{
		if (value == null)
		{
			return IssuePriority.MEDIUM;
		}
		switch (value.toLowerCase(Locale.ROOT))
		{
			case "low":
				return IssuePriority.LOW;
			case "high":
				return IssuePriority.HIGH;
			case "critical":
			case "crit":
				return IssuePriority.CRITICAL;
			default:
				return IssuePriority.MEDIUM;
		}
	}

	/**
	 * Assumption: {@code [category]}.
	 *
	 * @return The category, or null when absent or unknown.
	 */
	public static AssumptionCategory assumption(AttributeBag bag)
	{
		String value = namedOrPositional(bag, "category", 0);
		switch (value.toLowerCase(Locale.ROOT))
		{
			case "env":
			case "environment":
				return AssumptionCategory.ENVIRONMENT;
			case "auth":
			case "authentication":
				return AssumptionCategory.AUTHENTICATION;
			case "data":
				return AssumptionCategory.DATA;
			case "timing":
			case "time":
				return AssumptionCategory.TIMING;
			case "resource":
			case "res":
				return AssumptionCategory.RESOURCE;
			default:
				return null;
		}
	}

	/**
	 * Context block: {@code [partial]}.
	 */
	public static boolean partialContext(AttributeBag bag)
	{
		return isTrue(bag.get("partial")) || "partial".equalsIgnoreCase(bag.positional(0));
	}

	/**
	 * File reference or focus target: {@code [path]}.
	 */
	public static String path(AttributeBag bag)
	{
		String value = named(bag, "path");
		return value != null ? value : namedOrPositional(bag, "target", 0);
	}

	/**
	 * Lock: {@code [agent]}.
	 */
	public static String lock(AttributeBag bag)
	{
		return namedOrPositional(bag, "agent", 0);
	}

	/**
	 * Author: {@code [agent:task]}.
	 */
	public static AuthorAttributes author(AttributeBag bag)
	{
		if (bag.has("agent"))
		{
			return new AuthorAttributes(bag.get("agent"), named(bag, "task"));
		}
		String task = bag.positional(1);
		return new AuthorAttributes(bag.positionalOrEmpty(0), task == null || task.isEmpty() ? null : task);
	}

	// --- Type definitions ---

	/**
	 * Record, union, enum extension or delegate: {@code [id:name]}.
	 */
	public static DefinitionAttributes definition(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new DefinitionAttributes(bag.get("id"), bag.getOrEmpty("name"));
		}
		return new DefinitionAttributes(bag.positionalOrEmpty(0), bag.positionalOrEmpty(1));
	}

	/**
	 * Field of a record or variant: {@code [name:type]}; the positional type is expanded.
	 */
	public static FieldDefinitionAttributes fieldDefinition(AttributeBag bag)
	{
		if (bag.has("name"))
		{
			return new FieldDefinitionAttributes(bag.get("name"), bag.getOrEmpty("type"));
		}
		return new FieldDefinitionAttributes(bag.positionalOrEmpty(0), TypeShorthand.expand(bag.positionalOrEmpty(1)));
	}

	/**
	 * Enum: {@code [id:name:underlying]}, the underlying type being optional.
	 */
	public static EnumAttributes enumDefinition(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new EnumAttributes(bag.get("id"), bag.getOrEmpty("name"), named(bag, "type"));
		}
		String underlying = bag.positional(2);
		return new EnumAttributes(bag.positionalOrEmpty(0), bag.positionalOrEmpty(1),
				underlying == null || underlying.isEmpty() ? null : TypeShorthand.expand(underlying));
	}

	/**
	 * Event: {@code [id:name:visibility:delegateType]}, visibility defaults to private.
	 */
	public static EventAttributes event(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new EventAttributes(bag.get("id"), bag.getOrEmpty("name"),
					visibility(bag.get("visibility"), Visibility.PRIVATE), bag.getOrEmpty("type"));
		}
		return new EventAttributes(bag.positionalOrEmpty(0), bag.positionalOrEmpty(1),
				visibility(bag.positional(2), Visibility.PRIVATE), bag.positionalOrEmpty(3));
	}

	// --- Collections ---

	/**
	 * List or hash set: {@code [id:type]}, the element type falling back to {@code fallbackType}.
	 */
	public static CollectionAttributes collectionCreation(AttributeBag bag, String fallbackType)
	{
		if (bag.has("id"))
		{
			return new CollectionAttributes(bag.get("id"), orDefault(bag.get("type"), TypeShorthand.expand(fallbackType)));
		}
		return new CollectionAttributes(bag.positionalOrEmpty(0),
				TypeShorthand.expand(orDefault(bag.positional(1), fallbackType)));
	}

	/**
	 * Dictionary: {@code [id:keyType:valueType]}, defaulting to {@code str} keys and {@code i32} values.
	 */
	public static DictionaryAttributes dictionary(AttributeBag bag)
	{
		if (bag.has("id"))
		{
			return new DictionaryAttributes(bag.get("id"), orDefault(bag.get("key"), TypeShorthand.expand("str")),
					orDefault(bag.get("value"), TypeShorthand.expand("i32")));
		}
		return new DictionaryAttributes(bag.positionalOrEmpty(0),
				TypeShorthand.expand(orDefault(bag.positional(1), "str")),
				TypeShorthand.expand(orDefault(bag.positional(2), "i32")));
	}

	/**
	 * The collection a push, put, remove, set-index, clear, insert, has or count tag works on: {@code [name]}.
	 */
	public static String collection(AttributeBag bag)
	{
		return namedOrPositional(bag, "collection", 0);
	}

	// --- Function metadata ---

	/**
	 * Example: {@code [id:message]}, both optional; the message may carry a {@code msg} label.
	 */
	public static ExampleAttributes example(AttributeBag bag)
	{
		if (bag.has("id") || bag.has("msg"))
		{
			return new ExampleAttributes(named(bag, "id"), named(bag, "msg"));
		}
		String id = bag.positional(0);
		String message = bag.positional(1);
		if ("msg".equals(message))
		{
			message = bag.positional(2);
		}
		else if (message != null && message.startsWith("msg:"))
		{
			message = message.substring(4);
		}
		return new ExampleAttributes(id == null || id.isEmpty() ? null : id,
				message == null || message.isEmpty() ? null : message);
	}

	/**
	 * Uses list: every positional slot, each of which may hold a comma list.
	 */
	public static List<String> uses(AttributeBag bag)
	{
		if (bag.has("targets"))
		{
			return splitList(bag.get("targets"));
		}
		List<String> targets = new ArrayList<>();
		for (String value : bag.positionals())
		{
			targets.addAll(splitList(value));
		}
		return targets;
	}

	/**
	 * Since: {@code [version]}.
	 */
	public static String since(AttributeBag bag)
	{
		return namedOrPositional(bag, "version", 0);
	}

	/**
	 * Deprecated: {@code [since:replacement]}, the replacement being optional.
	 */
	public static DeprecatedAttributes deprecated(AttributeBag bag)
	{
		if (bag.has("since"))
		{
			return new DeprecatedAttributes(bag.get("since"), named(bag, "use"));
		}
		String replacement = bag.positional(1);
		return new DeprecatedAttributes(bag.positionalOrEmpty(0),
				replacement == null || replacement.isEmpty() ? null : replacement);
	}
}
