package org.lokray.plain.semantics;

import java.util.List;

/**
 * The names Python provides without an import.
 */
public final class Builtins
{
	private static final List<String> FUNCTIONS = List.of(
			"print", "len", "range", "input", "open", "sum", "max", "min", "abs", "round", "sorted",
			"reversed", "enumerate", "zip", "map", "filter", "isinstance", "issubclass", "type", "any", "all",
			"repr", "id", "hash", "iter", "next", "super", "format", "chr", "ord", "divmod", "pow", "hex",
			"bin", "oct", "callable", "getattr", "setattr", "hasattr", "delattr", "vars", "dir", "globals",
			"locals", "exit", "quit", "staticmethod", "classmethod", "property", "help", "ascii", "aiter", "anext");

	private static final List<String> CLASSES = List.of(
			"int", "float", "str", "bool", "list", "dict", "set", "tuple", "frozenset", "bytes", "bytearray",
			"complex", "object", "slice", "memoryview",
			"BaseException", "Exception", "ValueError", "TypeError", "KeyError", "IndexError", "ZeroDivisionError",
			"RuntimeError", "FileNotFoundError", "NotImplementedError", "StopIteration", "StopAsyncIteration",
			"AttributeError", "OSError", "IOError", "ArithmeticError", "AssertionError", "PermissionError",
			"TimeoutError", "LookupError", "NameError", "ImportError", "ModuleNotFoundError", "OverflowError",
			"RecursionError", "UnicodeError", "UnicodeDecodeError", "ConnectionError", "KeyboardInterrupt",
			"Warning", "DeprecationWarning", "UserWarning");

	private static final List<String> VARIABLES = List.of("__name__", "__doc__");

	private Builtins()
	{
	}

	/**
	 * Creates a fresh builtin scope, the root of every scope chain.
	 */
	public static Scope createScope()
	{
		Scope scope = new Scope(null, "builtins", ScopeKind.BUILTIN);
		for(String name : FUNCTIONS)
		{
			scope.define(FunctionSymbol.builtin(name));
		}
		for(String name : CLASSES)
		{
			scope.define(ClassSymbol.builtin(name));
		}
		for(String name : VARIABLES)
		{
			scope.define(new VariableSymbol(name, null));
		}
		return scope;
	}

	public static boolean isBuiltin(String name)
	{
		return FUNCTIONS.contains(name) || CLASSES.contains(name) || VARIABLES.contains(name);
	}
}
