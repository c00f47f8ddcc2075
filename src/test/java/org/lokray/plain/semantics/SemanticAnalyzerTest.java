package org.lokray.plain.semantics;

import org.lokray.plain.ast.Program;
import org.lokray.plain.ast.statements.*;
import org.lokray.plain.grammar.GrammarResolver;
import org.lokray.plain.imports.ImportTable;
import org.lokray.plain.lexer.Lexer;
import org.lokray.plain.parser.PlainParser;
import org.lokray.plain.util.SyntaxError;
import org.lokray.plain.util.UnboundNameError;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SemanticAnalyzerTest
{
	private static final ImportTable IMPORTS = ImportTable.standard();
	private static final GrammarResolver GRAMMAR = GrammarResolver.standard();

	private AnalysisContext context;

	private Program analyze(String source)
	{
		context = new AnalysisContext(new Scope(Builtins.createScope(), "global", ScopeKind.GLOBAL), IMPORTS, Set.of());
		Program program = new PlainParser(new Lexer(source), GRAMMAR).parse();
		new SemanticAnalyzer(context).analyze(program);
		return program;
	}

	private List<Statement> body(String source)
	{
		return analyze(source).getBody().getStatements();
	}

	@Test
	void registersDeclarationsInTheGlobalScope()
	{
		analyze("let total be 0\ndefine a function called greet\n    say 1\ndefine a class called Box\n    let size be 0\n");

		assertEquals(SymbolKind.VARIABLE, context.getGlobals().resolveLocally("total").getKind());
		assertEquals(SymbolKind.FUNCTION, context.getGlobals().resolveLocally("greet").getKind());
		assertEquals(SymbolKind.CLASS, context.getGlobals().resolveLocally("Box").getKind());
	}

	@Test
	void functionsMayBeCalledBeforeTheirDefinition()
	{
		assertDoesNotThrow(() -> analyze("greet()\ndefine a function called greet\n    say \"hi\"\n"));
	}

	@Test
	void unknownNameRaisesWithNearestHint()
	{
		UnboundNameError error = assertThrows(UnboundNameError.class, () -> analyze("let why be 1\nsay wgy\n"));

		assertEquals("wgy", error.getName());
		assertEquals(2, error.getLine());
		assertEquals("did you mean 'why'?", error.getHint());
	}

	@Test
	void libraryNamesAreAutoImported()
	{
		analyze("let frame be pd.DataFrame()\n");

		assertEquals(Set.of("import pandas as pd"), context.getRequiredImports());
		assertEquals(SymbolKind.MODULE_ALIAS, context.getGlobals().resolveLocally("pd").getKind());
	}

	@Test
	void explicitImportUsesTheCanonicalStatement()
	{
		analyze("use requests\nimport numpy as np\nfrom collections import Counter\n");

		assertEquals(List.of("import requests", "import numpy as np", "from collections import Counter"),
				List.copyOf(context.getRequiredImports()));
	}

	@Test
	void repeatBecomesForOverRange()
	{
		ForEachStatement loop = assertInstanceOf(ForEachStatement.class, body("repeat 3 times\n    say 1\n").get(0));

		assertEquals("_", loop.getVariable().getLexeme());
	}

	@Test
	void repeatUntilBecomesNegatedWhile()
	{
		assertInstanceOf(WhileStatement.class, body("let done be no\nrepeat until done\n    set done to yes\n").get(1));
	}

	@Test
	void usingBecomesWith()
	{
		assertInstanceOf(WithStatement.class, body("using open file \"a.txt\" for reading as f do\n    say f.read()\n").get(0));
	}

	@Test
	void pauseOutsideAsyncUsesTimeSleep()
	{
		assertInstanceOf(ExpressionStatement.class, body("wait 2 seconds").get(0));
		assertEquals(Set.of("import time"), context.getRequiredImports());
	}

	@Test
	void functionInClassBecomesMethodWithSelf()
	{
		ClassDeclaration declaration = assertInstanceOf(ClassDeclaration.class,
				body("define a class called Dog\n    define a function called bark\n        say \"woof\"\n").get(0));

		FunctionDeclaration bark = assertInstanceOf(FunctionDeclaration.class, declaration.getBody().getStatements().get(0));
		assertEquals(FunctionKind.METHOD, bark.getKind());
		assertEquals("self", bark.getParameters().get(0).getName());
	}

	@Test
	void classMethodsTakeClsAndADecorator()
	{
		ClassDeclaration declaration = assertInstanceOf(ClassDeclaration.class,
				body("define a class called Maker\n    define a class method called build\n        return cls()\n"
						+ "    define a static method called helper\n        return 1\n").get(0));

		FunctionDeclaration build = (FunctionDeclaration) declaration.getBody().getStatements().get(0);
		FunctionDeclaration helper = (FunctionDeclaration) declaration.getBody().getStatements().get(1);
		assertEquals("cls", build.getParameters().get(0).getName());
		assertEquals(1, build.getDecorators().size());
		assertTrue(helper.getParameters().isEmpty());
		assertEquals(1, helper.getDecorators().size());
	}

	@Test
	void methodsDoNotSeeClassLevelNames()
	{
		assertThrows(UnboundNameError.class,
				() -> analyze("define a class called Tally\n    let start be 0\n    define a method called report\n        say start\n"));
	}

	@Test
	void endpointBecomesDecoratedFunctionWithFlaskApp()
	{
		List<Statement> statements = body("create an api endpoint at \"/hello/<name>\" that gets and returns name\n");

		assertInstanceOf(AssignmentStatement.class, statements.get(0));
		FunctionDeclaration handler = assertInstanceOf(FunctionDeclaration.class, statements.get(1));
		assertEquals("get_hello_name", handler.getName());
		assertEquals("name", handler.getParameters().get(0).getName());
		assertEquals(1, handler.getDecorators().size());
		assertEquals(Set.of("from flask import Flask"), context.getRequiredImports());
	}

	@Test
	void endpointNamesComeFromMethodAndPath()
	{
		assertEquals("get_index", SemanticAnalyzer.endpointFunctionName("GET", "/"));
		assertEquals("post_users_id", SemanticAnalyzer.endpointFunctionName("POST", "/users/<int:id>"));
	}

	@Test
	void returnOutsideFunction()
	{
		SyntaxError error = assertThrows(SyntaxError.class, () -> analyze("return 5"));

		assertEquals("'return' can only be used inside a function", error.getDetail());
	}

	@Test
	void yieldOutsideFunction()
	{
		assertThrows(SyntaxError.class, () -> analyze("yield 1"));
	}

	@Test
	void loopControlOutsideLoop()
	{
		assertEquals("'stop the loop' can only be used inside a loop",
				assertThrows(SyntaxError.class, () -> analyze("stop the loop")).getDetail());
		assertEquals("'skip to the next' can only be used inside a loop",
				assertThrows(SyntaxError.class, () -> analyze("skip to the next")).getDetail());
	}

	@Test
	void loopControlInsideFunctionInsideLoopIsRejected()
	{
		assertThrows(SyntaxError.class,
				() -> analyze("for each n in [1] do\n    define a function called f\n        stop the loop\n"));
	}

	@Test
	void awaitOutsideAsyncFunction()
	{
		SyntaxError error = assertThrows(SyntaxError.class,
				() -> analyze("define a function called g\n    return 1\ndefine a function called f\n    let x be wait for g()\n"));

		assertEquals("'wait for' can only be used inside an asynchronous function", error.getDetail());
	}

	@Test
	void methodOutsideClass()
	{
		assertThrows(SyntaxError.class, () -> analyze("define a method called bark\n    say 1\n"));
	}

	@Test
	void shadowedLibraryNameIsReported()
	{
		SyntaxError error = assertThrows(SyntaxError.class, () -> analyze("let time be 5\nwait 2 seconds\n"));

		assertTrue(error.getDetail().contains("'time'"));
	}

	@Test
	void localVariableShadowingALibraryIsReported()
	{
		SyntaxError error = assertThrows(SyntaxError.class,
				() -> analyze("define a function called f\n    let time be 3\n    wait 1 second\n"));

		assertEquals("'time' is already used as a name, so the library 'time' cannot be used here", error.getDetail());
		assertEquals(3, error.getLine());
	}

	@Test
	void parameterShadowingALibraryIsReported()
	{
		assertThrows(SyntaxError.class, () -> analyze("define a function called f that takes time\n    wait 1 second\n"));
	}

	@Test
	void assigningOverAnImportedLibraryIsReported()
	{
		SyntaxError global = assertThrows(SyntaxError.class, () -> analyze("wait 1 second\nlet time be 5\n"));
		SyntaxError local = assertThrows(SyntaxError.class,
				() -> analyze("define a function called f\n    wait 1 second\n    let time be 3\n"));

		assertEquals("'time' already refers to the library 'time' and cannot be assigned", global.getDetail());
		assertEquals(3, local.getLine());
	}

	@Test
	void userAppBlocksTheEndpointApplication()
	{
		SyntaxError error = assertThrows(SyntaxError.class,
				() -> analyze("let app be 5\ncreate an api endpoint at \"/\" that gets and returns \"hi\"\n"));

		assertTrue(error.getDetail().startsWith("'app' is already used as a name"));
	}

	@Test
	void endpointApplicationCannotBeReassigned()
	{
		SyntaxError error = assertThrows(SyntaxError.class,
				() -> analyze("create an api endpoint at \"/\" that gets and returns \"hi\"\nlet app be 5\n"));

		assertEquals("'app' already refers to the web application and cannot be assigned", error.getDetail());
	}

	@Test
	void secondEndpointReusesTheApplication()
	{
		List<Statement> statements = body("create an api endpoint at \"/a\" that gets and returns 1\n"
				+ "create an api endpoint at \"/b\" that posts and returns 2\n");

		assertEquals(3, statements.size());
		assertInstanceOf(AssignmentStatement.class, statements.get(0));
		assertTrue(((VariableSymbol) context.getGlobals().resolveLocally("app")).isGenerated());
	}

	@Test
	void propertyNeedsAClass()
	{
		SyntaxError error = assertThrows(SyntaxError.class, () -> analyze("create a property named area that returns 1"));

		assertEquals("A property must be defined inside a class, or name its class with 'in class'", error.getDetail());
	}

	@Test
	void propertyFromOutsideNeedsAnInlineValue()
	{
		SyntaxError error = assertThrows(SyntaxError.class,
				() -> analyze("define a class called Box\n    pass\ncreate a property named size in class Box\n    say 1\n"));

		assertEquals("A property added from outside its class needs a value after 'that returns'", error.getDetail());
		assertEquals(3, error.getLine());
	}

	@Test
	void propertyForAnUnknownClassIsUnbound()
	{
		UnboundNameError error = assertThrows(UnboundNameError.class,
				() -> analyze("create a property named size in class Box that returns 1"));

		assertEquals(1, error.getLine());
	}

	@Test
	void propertyInsideAClassGetsTheReceiver()
	{
		List<Statement> statements = body("define a class called Box\n    create a property named size that returns 1\n");

		ClassDeclaration box = assertInstanceOf(ClassDeclaration.class, statements.get(0));
		FunctionDeclaration size = assertInstanceOf(FunctionDeclaration.class, box.getBody().getStatements().get(0));
		assertEquals(FunctionKind.PROPERTY, size.getKind());
		assertEquals("self", size.getParameters().get(0).getName());
		assertEquals(1, size.getDecorators().size());
	}
}
