package org.lokray.plain.semantics;

import org.lokray.plain.ast.TypeHint;
import org.lokray.plain.util.Suggestions;
import org.lokray.plain.util.TypeHintError;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Validates Plain type hints and renders them as Python annotations.
 * <p>
 * Known forms: the primitive words, {@code list of T}, {@code set of T}, {@code dictionary from K to V},
 * {@code optional T}, classes declared in the program, and classes the import table can bring in.
 */
public class TypeVocabulary
{
	private static final Map<String, String> PRIMITIVES = Map.ofEntries(
			Map.entry("integer", "int"),
			Map.entry("integers", "int"),
			Map.entry("int", "int"),
			Map.entry("number", "float"),
			Map.entry("numbers", "float"),
			Map.entry("decimal", "float"),
			Map.entry("decimals", "float"),
			Map.entry("float", "float"),
			Map.entry("text", "str"),
			Map.entry("texts", "str"),
			Map.entry("string", "str"),
			Map.entry("strings", "str"),
			Map.entry("str", "str"),
			Map.entry("boolean", "bool"),
			Map.entry("booleans", "bool"),
			Map.entry("bool", "bool"),
			Map.entry("nothing", "None"),
			Map.entry("anything", "object"));

	private final AnalysisContext context;

	public TypeVocabulary(AnalysisContext context)
	{
		this.context = context;
	}

	/**
	 * Resolves a hint and its arguments, recording their Python rendering on the nodes.
	 *
	 * @param hint  The hint to resolve.
	 * @param scope The scope the hint is written in.
	 * @return The Python rendering.
	 * @throws TypeHintError if the hint names no known type.
	 */
	public String resolve(TypeHint hint, Scope scope)
	{
		String python = render(hint, scope);
		hint.setPythonForm(python);
		return python;
	}

	private String render(TypeHint hint, Scope scope)
	{
		String word = hint.getName().toLowerCase(Locale.ROOT);
		String primitive = PRIMITIVES.get(word);
		if(primitive != null)
		{
			return primitive;
		}
		switch(word)
		{
			case "list":
			case "set":
				return hint.getArguments().isEmpty() ? word : word + "[" + resolve(hint.getArguments().get(0), scope) + "]";
			case "dictionary":
				if(hint.getArguments().isEmpty())
				{
					return "dict";
				}
				return "dict[" + resolve(hint.getArguments().get(0), scope) + ", " + resolve(hint.getArguments().get(1), scope) + "]";
			case "optional":
				String inner = resolve(hint.getArguments().get(0), scope);
				if(scope.resolve("Optional") == null)
				{
					context.autoImport("Optional", hint.getNameToken());
				}
				return "Optional[" + inner + "]";
			default:
				return className(hint, scope);
		}
	}

	private String className(TypeHint hint, Scope scope)
	{
		String name = hint.getName();
		Symbol symbol = scope.resolve(name);
		if(symbol != null)
		{
			if(symbol.getKind() == SymbolKind.CLASS || symbol.getKind() == SymbolKind.MODULE_ALIAS)
			{
				return name;
			}
			throw new TypeHintError(hint.getNameToken().getLine(), hint.getNameToken().getColumn(),
					"'" + name + "' is a " + symbol.getKind().name().toLowerCase(Locale.ROOT).replace('_', ' ') + ", not a type", null);
		}
		Optional<Symbol> imported = context.autoImport(name, hint.getNameToken());
		if(imported.isPresent())
		{
			return name;
		}
		List<String> candidates = new ArrayList<>(PRIMITIVES.keySet());
		candidates.addAll(List.of("list", "set", "dictionary", "optional"));
		for(Symbol visible : scope.getSymbols())
		{
			if(visible.getKind() == SymbolKind.CLASS)
			{
				candidates.add(visible.getName());
			}
		}
		String nearest = Suggestions.nearest(name, candidates);
		throw new TypeHintError(hint.getNameToken().getLine(), hint.getNameToken().getColumn(),
				"Unknown type '" + name + "'", nearest != null ? "did you mean '" + nearest + "'?" : null);
	}
}
