package org.lokray.plain.semantics;

import org.lokray.plain.ast.TypeHint;
import org.lokray.plain.imports.ImportTable;
import org.lokray.plain.lexer.Token;
import org.lokray.plain.lexer.TokenType;
import org.lokray.plain.util.TypeHintError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TypeVocabularyTest
{
	private AnalysisContext context;
	private TypeVocabulary types;

	@BeforeEach
	void setUp()
	{
		context = new AnalysisContext(new Scope(Builtins.createScope(), "global", ScopeKind.GLOBAL), ImportTable.standard(), Set.of());
		types = new TypeVocabulary(context);
	}

	private static TypeHint hint(String name, TypeHint... arguments)
	{
		return new TypeHint(new Token(TokenType.WORD, name, null, 1, 1), name, List.of(arguments));
	}

	@Test
	void primitivesMapToPythonBuiltins()
	{
		assertEquals("int", types.resolve(hint("integer"), context.getGlobals()));
		assertEquals("str", types.resolve(hint("text"), context.getGlobals()));
		assertEquals("float", types.resolve(hint("number"), context.getGlobals()));
		assertEquals("bool", types.resolve(hint("boolean"), context.getGlobals()));
	}

	@Test
	void genericFormsNestTheirArguments()
	{
		assertEquals("list[str]", types.resolve(hint("list", hint("strings")), context.getGlobals()));
		assertEquals("dict[str, list[int]]",
				types.resolve(hint("dictionary", hint("text"), hint("list", hint("integers"))), context.getGlobals()));
		assertEquals("dict", types.resolve(hint("dictionary"), context.getGlobals()));
	}

	@Test
	void optionalBringsInTyping()
	{
		TypeHint optional = hint("optional", hint("text"));

		assertEquals("Optional[str]", types.resolve(optional, context.getGlobals()));
		assertEquals("Optional[str]", optional.getPythonForm());
		assertEquals(Set.of("from typing import Optional"), context.getRequiredImports());
	}

	@Test
	void declaredClassesAreTypes()
	{
		context.getGlobals().define(new ClassSymbol("Invoice", new Token(TokenType.WORD, "Invoice", null, 1, 1)));

		assertEquals("Invoice", types.resolve(hint("Invoice"), context.getGlobals()));
	}

	@Test
	void importableClassesAreTypes()
	{
		assertEquals("Path", types.resolve(hint("Path"), context.getGlobals()));
		assertTrue(context.getRequiredImports().contains("from pathlib import Path"));
	}

	@Test
	void variablesAreNotTypes()
	{
		context.getGlobals().define(new VariableSymbol("count", new Token(TokenType.WORD, "count", null, 1, 1)));

		TypeHintError error = assertThrows(TypeHintError.class, () -> types.resolve(hint("count"), context.getGlobals()));
		assertEquals("'count' is a variable, not a type", error.getDetail());
	}

	@Test
	void unknownTypeSuggestsTheNearestKnownOne()
	{
		TypeHintError error = assertThrows(TypeHintError.class, () -> types.resolve(hint("integr"), context.getGlobals()));

		assertEquals("Unknown type 'integr'", error.getDetail());
		assertEquals("did you mean 'integer'?", error.getHint());
	}
}
