package org.lokray.plain.parser;

import org.lokray.plain.ast.Parameter;
import org.lokray.plain.ast.Program;
import org.lokray.plain.ast.TypeHint;
import org.lokray.plain.ast.expressions.*;
import org.lokray.plain.ast.statements.*;
import org.lokray.plain.grammar.ExpressionForm;
import org.lokray.plain.grammar.GrammarResolver;
import org.lokray.plain.grammar.Operator;
import org.lokray.plain.grammar.Production;
import org.lokray.plain.grammar.RuleMatch;
import org.lokray.plain.grammar.Vocabulary;
import org.lokray.plain.lexer.Token;
import org.lokray.plain.lexer.TokenType;
import org.lokray.plain.util.SyntaxError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The PlainParser is responsible for syntactic analysis.
 * It consumes the token stream lazily and builds an Abstract Syntax Tree (AST) by recursive descent.
 * At every statement start, and wherever an operator phrase or an expression phrase may begin,
 * it asks the {@link GrammarResolver} which production applies.
 * <p>
 * Parsing fails fast: the first problem raises a {@link SyntaxError} and no partial tree is returned.
 */
public class PlainParser
{
	private static final Logger logger = LoggerFactory.getLogger(PlainParser.class);

	private static final Map<String, String> CONVERSIONS = Map.ofEntries(
			Map.entry("text", "str"),
			Map.entry("string", "str"),
			Map.entry("integer", "int"),
			Map.entry("int", "int"),
			Map.entry("number", "float"),
			Map.entry("decimal", "float"),
			Map.entry("float", "float"),
			Map.entry("boolean", "bool"),
			Map.entry("bool", "bool"),
			Map.entry("list", "list"));

	private static final Map<String, String> TIME_UNITS = Map.ofEntries(
			Map.entry("second", "seconds"),
			Map.entry("seconds", "seconds"),
			Map.entry("sec", "seconds"),
			Map.entry("secs", "seconds"),
			Map.entry("millisecond", "milliseconds"),
			Map.entry("milliseconds", "milliseconds"),
			Map.entry("ms", "milliseconds"),
			Map.entry("minute", "minutes"),
			Map.entry("minutes", "minutes"),
			Map.entry("hour", "hours"),
			Map.entry("hours", "hours"));

	private static final Map<String, String> HTTP_METHODS = Map.of(
			"gets", "GET", "get", "GET",
			"posts", "POST", "post", "POST",
			"puts", "PUT", "put", "PUT",
			"deletes", "DELETE", "delete", "DELETE",
			"patches", "PATCH", "patch", "PATCH");

	private final Iterator<Token> source;
	private final List<Token> tokens = new ArrayList<>(); // tokens pulled from the source so far
	private final GrammarResolver grammar;
	private final Vocabulary vocabulary;
	private int current = 0;
	private int inlineDepth = 0; // > 0 while parsing a statement written on the same line as its header

	/**
	 * Constructs a PlainParser.
	 *
	 * @param tokens  The token stream, typically a {@link org.lokray.plain.lexer.Lexer}.
	 * @param grammar The grammar resolver consulted for every phrase decision.
	 */
	public PlainParser(Iterable<Token> tokens, GrammarResolver grammar)
	{
		this.source = tokens.iterator();
		this.grammar = grammar;
		this.vocabulary = grammar.getVocabulary();
	}

	/**
	 * Parses the whole token stream.
	 *
	 * @return The root of the AST.
	 * @throws SyntaxError on the first statement that cannot be parsed.
	 */
	public Program parse()
	{
		Token first = peek();
		List<Statement> statements = new ArrayList<>();
		while(!isAtEnd())
		{
			if(match(TokenType.NEWLINE))
			{
				continue;
			}
			statements.add(statement());
		}
		logger.debug("Parsed {} top-level statements", statements.size());
		return new Program(first, new BlockStatement(first, statements));
	}

	// --- Statements ---

	private Statement statement()
	{
		Token start = peek();
		if(check(TokenType.INDENT))
		{
			throw error(start, "Unexpected indentation");
		}
		Optional<RuleMatch<Production>> resolved = grammar.resolveStatement(this::peekAt);
		if(resolved.isEmpty())
		{
			throw unmatched(start);
		}
		RuleMatch<Production> rule = resolved.get();
		Production production = rule.getProduction();

		switch(production)
		{
			case ASSIGN:
			case EXPRESSION:
				return expressionStatement();
			case CALL_WITH:
				return callWithStatement();
			default:
				skip(rule.getConsumed());
		}

		switch(production)
		{
			case LET:
				return letStatement(start);
			case SET:
				return setStatement(start);
			case CREATE_VARIABLE:
				return createVariable(start);
			case CREATE_LIST:
				return createList(start);
			case CREATE_DICTIONARY:
				return createDictionary(start);
			case INCREASE:
				return augmented(start, BinaryOperator.ADD, false);
			case DECREASE:
				return augmented(start, BinaryOperator.SUBTRACT, false);
			case MULTIPLY:
				return augmented(start, BinaryOperator.MULTIPLY, true);
			case DIVIDE:
				return augmented(start, BinaryOperator.DIVIDE, true);
			case APPEND:
				return collectionUpdate(start, "to", "append");
			case PREPEND:
				return prependStatement(start);
			case REMOVE:
				return collectionUpdate(start, "from", "remove");
			case POP:
				return methodOnTarget(start, "pop");
			case SORT:
				return sortStatement(start);
			case REVERSE:
				return methodOnTarget(start, "reverse");
			case CLEAR:
				return methodOnTarget(start, "clear");
			case DECORATE:
				return decorateStatement(start);
			case SAY:
				return sayStatement(start);
			case PRINT_NUMBERS:
				return printRange(start);
			case LOG:
				return logStatement(start);
			case IF:
				return ifStatement(start, false);
			case WHILE:
				return whileStatement(start);
			case FOR_EACH:
				return forEachStatement(start);
			case REPEAT_TIMES:
				return repeatTimes(start);
			case REPEAT_UNTIL:
				return repeatConditional(start, RepeatStatement.Mode.UNTIL);
			case REPEAT_WHILE:
				return repeatConditional(start, RepeatStatement.Mode.WHILE);
			case REPEAT_FOREVER:
				return new RepeatStatement(start, RepeatStatement.Mode.FOREVER, null, body("repeat forever"));
			case BREAK:
				endOfStatement();
				return new BreakStatement(start);
			case CONTINUE:
				endOfStatement();
				return new ContinueStatement(start);
			case PASS:
				endOfStatement();
				return new PassStatement(start);
			case RETURN:
				return returnStatement(start);
			case YIELD:
				return yieldStatement(start);
			case EXIT:
				return exitStatement(start);
			case DEFINE_FUNCTION:
				return functionDeclaration(start, FunctionKind.FUNCTION, false, false);
			case DEFINE_ASYNC_FUNCTION:
				return functionDeclaration(start, FunctionKind.FUNCTION, true, false);
			case DEFINE_GENERATOR:
				return functionDeclaration(start, FunctionKind.FUNCTION, false, true);
			case DEFINE_METHOD:
				return functionDeclaration(start, FunctionKind.METHOD, false, false);
			case DEFINE_ASYNC_METHOD:
				return functionDeclaration(start, FunctionKind.METHOD, true, false);
			case DEFINE_STATIC_METHOD:
				return functionDeclaration(start, FunctionKind.STATIC_METHOD, false, false);
			case DEFINE_CLASS_METHOD:
				return functionDeclaration(start, FunctionKind.CLASS_METHOD, false, false);
			case DEFINE_CONSTRUCTOR:
				return constructorDeclaration(start);
			case DEFINE_PROPERTY:
				return propertyDeclaration(start);
			case DEFINE_CLASS:
				return classDeclaration(start);
			case API_ENDPOINT:
				return endpointDeclaration(start, false);
			case ASYNC_API_ENDPOINT:
				return endpointDeclaration(start, true);
			case TRY:
				return tryStatement(start);
			case RAISE:
			case FAIL:
				return raiseStatement(start);
			case USING:
				return usingStatement(start);
			case WAIT_FOR:
				return waitStatement(start, true);
			case WAIT:
				return waitStatement(start, false);
			case IMPORT:
			case USE:
				return importStatement(start);
			case FROM_IMPORT:
				return fromImportStatement(start);
			case CALL:
				return callStatement(start);
			case ELSE:
			case ELSE_IF:
				throw error(start, "'" + start.getLexeme() + "' without a matching 'if'");
			case CATCH:
			case FINALLY:
				throw error(start, "'" + start.getLexeme() + "' must follow a 'try' block");
			default:
				throw error(start, "Unsupported statement form " + production);
		}
	}

	private Statement letStatement(Token start)
	{
		Expression target = assignmentTarget();
		TypeHint hint = matchWord("as") ? typeHint() : null;
		expectWord("be");
		Expression value = requiredExpression("be");
		endOfStatement();
		return new AssignmentStatement(start, target, hint, null, value);
	}

	private Statement setStatement(Token start)
	{
		Expression target = assignmentTarget();
		if(!matchWord("to") && !matchWords("equal", "to"))
		{
			throw error(peek(), "Expected 'to' after the name in a 'set' statement");
		}
		Expression value = requiredExpression("to");
		endOfStatement();
		return new AssignmentStatement(start, target, value);
	}

	private Statement createVariable(Token start)
	{
		Token name = identifierToken();
		TypeHint hint = null;
		if(matchWords("of", "type") || matchWord("as"))
		{
			hint = typeHint();
		}
		Expression value;
		if(matchWord("with"))
		{
			matchWord("value");
			value = expression();
		}
		else if(matchWords("set", "to") || matchWords("equal", "to"))
		{
			value = expression();
		}
		else
		{
			value = new LiteralExpression(name, LiteralExpression.Kind.NONE, null);
		}
		endOfStatement();
		return new AssignmentStatement(start, new IdentifierExpression(name), hint, null, value);
	}

	private Statement createList(Token start)
	{
		Token name = identifierToken();
		List<Expression> items = new ArrayList<>();
		if(matchWord("with", "containing"))
		{
			items = separatedOperands();
		}
		endOfStatement();
		return new AssignmentStatement(start, new IdentifierExpression(name), new ListExpression(start, items));
	}

	private Statement createDictionary(Token start)
	{
		Token name = identifierToken();
		List<Expression> keys = new ArrayList<>();
		List<Expression> values = new ArrayList<>();
		if(matchWord("with", "containing"))
		{
			do
			{
				keys.add(additive());
				if(!match(TokenType.COLON) && !matchWord("as") && !matchWords("mapped", "to"))
				{
					throw error(peek(), "Expected 'as' between a dictionary key and its value");
				}
				values.add(additive());
			}
			while(matchSeparator());
		}
		endOfStatement();
		return new AssignmentStatement(start, new IdentifierExpression(name), new DictExpression(start, keys, values));
	}

	private Statement augmented(Token start, BinaryOperator operator, boolean requiresAmount)
	{
		Expression target = assignmentTarget();
		Expression amount;
		if(matchWord("by"))
		{
			amount = expression();
		}
		else if(requiresAmount)
		{
			throw error(peek(), "Expected 'by' and an amount");
		}
		else
		{
			amount = LiteralExpression.number(start, 1);
		}
		endOfStatement();
		return new AssignmentStatement(start, target, null, operator, amount);
	}

	private Statement collectionUpdate(Token start, String preposition, String method)
	{
		Expression value = expression();
		expectWord(preposition);
		Expression target = assignmentTarget();
		endOfStatement();
		return new ExpressionStatement(start, new CallExpression(start, new AttributeExpression(target, method), List.of(value)));
	}

	private Statement prependStatement(Token start)
	{
		Expression value = expression();
		expectWord("to");
		Expression target = assignmentTarget();
		endOfStatement();
		List<Expression> arguments = List.of(LiteralExpression.number(start, 0), value);
		return new ExpressionStatement(start, new CallExpression(start, new AttributeExpression(target, "insert"), arguments));
	}

	private Statement sortStatement(Token start)
	{
		Expression target = assignmentTarget();
		List<KeywordArgument> keywords = new ArrayList<>();
		if(matchWords("in", "reverse", "order") || matchWord("descending"))
		{
			keywords.add(new KeywordArgument(synthetic(start, "reverse"), new LiteralExpression(start, LiteralExpression.Kind.BOOLEAN, Boolean.TRUE)));
		}
		endOfStatement();
		return new ExpressionStatement(start, new CallExpression(start, new AttributeExpression(target, "sort"), List.of(), keywords));
	}

	private Statement methodOnTarget(Token start, String method)
	{
		Expression target = assignmentTarget();
		endOfStatement();
		return new ExpressionStatement(start, new CallExpression(start, new AttributeExpression(target, method), List.of()));
	}

	private Statement decorateStatement(Token start)
	{
		Token name = identifierToken();
		expectWord("with");
		Expression decorator = postfix();
		endOfStatement();
		Expression call = new CallExpression(start, decorator, List.of(new IdentifierExpression(name)));
		return new AssignmentStatement(start, new IdentifierExpression(name), call);
	}

	private Statement sayStatement(Token start)
	{
		List<Expression> arguments = new ArrayList<>();
		if(!isLineEnd())
		{
			arguments.add(expression());
			while(check(TokenType.COMMA) && !peekAt(1).isWord("otherwise", "else"))
			{
				advance();
				arguments.add(expression());
			}
		}
		endOfStatement();
		return new ExpressionStatement(start, new CallExpression(start, builtin(start, "print"), arguments));
	}

	private Statement printRange(Token start)
	{
		Expression from = additive();
		expectWord("to");
		Expression to = additive();
		endOfStatement();
		return new PrintRangeStatement(start, from, to);
	}

	private Statement logStatement(Token start)
	{
		String level = "info";
		if(peek().isWord("debug", "info", "warning", "warn", "error", "critical"))
		{
			level = advance().normalized();
			if(level.equals("warn"))
			{
				level = "warning";
			}
		}
		Expression message = requiredExpression("log");
		endOfStatement();
		Expression logger = new AttributeExpression(IdentifierExpression.library(start, "logging"), level);
		return new ExpressionStatement(start, new CallExpression(start, logger, List.of(message)));
	}

	private IfStatement ifStatement(Token start, boolean elseIf)
	{
		Expression condition = expression();
		skipHeaderEnd();
		BlockStatement thenBranch = body("if");
		BlockStatement elseBranch = elseClause();
		return new IfStatement(start, condition, thenBranch, elseBranch, elseIf);
	}

	private BlockStatement elseClause()
	{
		if(!peek().isWord("otherwise", "else", "elif"))
		{
			return null;
		}
		RuleMatch<Production> rule = grammar.resolveStatement(this::peekAt)
				.orElseThrow(() -> unmatched(peek()));
		Token start = peek();
		skip(rule.getConsumed());
		if(rule.getProduction() == Production.ELSE_IF)
		{
			IfStatement nested = ifStatement(start, true);
			return new BlockStatement(start, List.of(nested));
		}
		match(TokenType.COMMA);
		skipHeaderEnd();
		return body("otherwise");
	}

	private Statement whileStatement(Token start)
	{
		Expression condition = expression();
		skipHeaderEnd();
		return new WhileStatement(start, condition, body("while"));
	}

	private Statement forEachStatement(Token start)
	{
		Token variable = identifierToken();
		Expression iterable;
		if(matchWord("from"))
		{
			Expression low = additive();
			expectWord("to");
			Expression high = additive();
			Expression end = new BinaryExpression(high, BinaryOperator.ADD, LiteralExpression.number(start, 1));
			iterable = new CallExpression(start, builtin(start, "range"), List.of(low, end));
		}
		else
		{
			expectWord("in", "of");
			iterable = expression();
		}
		skipHeaderEnd();
		return new ForEachStatement(start, variable, iterable, body("for each"));
	}

	private Statement repeatTimes(Token start)
	{
		Expression count = additive();
		expectWord("times");
		skipHeaderEnd();
		return new RepeatStatement(start, RepeatStatement.Mode.TIMES, count, body("repeat"));
	}

	private Statement repeatConditional(Token start, RepeatStatement.Mode mode)
	{
		Expression condition = expression();
		skipHeaderEnd();
		return new RepeatStatement(start, mode, condition, body("repeat"));
	}

	private Statement returnStatement(Token start)
	{
		Expression value = isLineEnd() ? null : expression();
		endOfStatement();
		return new ReturnStatement(start, value);
	}

	private Statement yieldStatement(Token start)
	{
		Expression value = isLineEnd() ? null : expression();
		endOfStatement();
		return new ExpressionStatement(start, new YieldExpression(start, value));
	}

	private Statement exitStatement(Token start)
	{
		List<Expression> arguments = new ArrayList<>();
		if(matchWords("with", "code") || matchWord("with"))
		{
			arguments.add(expression());
		}
		endOfStatement();
		Expression exit = new AttributeExpression(IdentifierExpression.library(start, "sys"), "exit");
		return new ExpressionStatement(start, new CallExpression(start, exit, arguments));
	}

	// --- Definitions ---

	private Statement functionDeclaration(Token start, FunctionKind kind, boolean async, boolean generator)
	{
		Token name = identifierToken();
		List<Parameter> parameters = new ArrayList<>();
		if(matchWords("that", "takes") || matchWord("taking"))
		{
			parameters = parameters();
		}
		TypeHint returnHint = matchWord("returning") ? typeHint() : null;
		BlockStatement body = functionBody(start, "define");
		return new FunctionDeclaration(start, name, kind, parameters, returnHint, body, async, generator);
	}

	private Statement constructorDeclaration(Token start)
	{
		List<Parameter> parameters = new ArrayList<>();
		if(matchWords("that", "takes") || matchWord("with"))
		{
			parameters = parameters();
		}
		BlockStatement body = functionBody(start, "constructor");
		return new FunctionDeclaration(start, start, FunctionKind.CONSTRUCTOR, parameters, null, body, false, false);
	}

	private Statement propertyDeclaration(Token start)
	{
		Token name = identifierToken();
		Token owner = null;
		if(matchWords("in", "class") || matchWords("of", "class") || matchWords("for", "class"))
		{
			owner = identifierToken();
		}
		return new PropertyDeclaration(start, name, owner, functionBody(start, "property"));
	}

	/**
	 * The body of a function: an inline "and returns E", "and does S", "and yields E", or an indented block.
	 */
	private BlockStatement functionBody(Token start, String construct)
	{
		Token clause = peek();
		if(matchWords("and", "returns") || matchWords("that", "returns") || matchWords("and", "gives", "back"))
		{
			Expression value = expression();
			endOfStatement();
			return new BlockStatement(clause, List.of(new ReturnStatement(clause, value)));
		}
		if(matchWords("and", "yields") || matchWords("that", "yields"))
		{
			Expression value = expression();
			endOfStatement();
			return new BlockStatement(clause, List.of(new ExpressionStatement(clause, new YieldExpression(clause, value))));
		}
		if(matchWords("and", "does") || matchWords("that", "does"))
		{
			if(matchWord("nothing"))
			{
				endOfStatement();
				return new BlockStatement(clause, List.of(new PassStatement(clause)));
			}
			return inlineBody();
		}
		skipHeaderEnd();
		return body(construct);
	}

	private List<Parameter> parameters()
	{
		List<Parameter> parameters = new ArrayList<>();
		if(matchWord("nothing") || matchWords("no", "parameters") || matchWords("no", "arguments"))
		{
			return parameters;
		}
		Integer count = peek().getType() == TokenType.WORD ? vocabulary.numberWord(peek().getLexeme()) : null;
		if(count != null && peekAt(1).isWord("numbers", "values", "arguments", "things", "items"))
		{
			Token at = advance();
			advance();
			for(int i = 0; i < count; i++)
			{
				parameters.add(new Parameter(synthetic(at, String.valueOf((char) ('a' + i))), null, null));
			}
			return parameters;
		}
		while(true)
		{
			Token name = identifierToken();
			TypeHint hint = matchWord("as") ? typeHint() : null;
			Expression defaultValue = null;
			if(matchWords("defaulting", "to") || matchWords("with", "default"))
			{
				defaultValue = additive();
			}
			parameters.add(new Parameter(name, hint, defaultValue));
			if(match(TokenType.COMMA))
			{
				if(peek().isWord("and") && !isClauseAfterAnd())
				{
					advance();
				}
				continue;
			}
			if(peek().isWord("and") && !isClauseAfterAnd())
			{
				advance();
				continue;
			}
			return parameters;
		}
	}

	private boolean isClauseAfterAnd()
	{
		return peekAt(1).isWord("returns", "does", "yields", "gives", "returning");
	}

	private Statement classDeclaration(Token start)
	{
		Token name = identifierToken();
		List<Expression> superclasses = new ArrayList<>();
		if(matchWords("that", "extends") || matchWords("that", "inherits", "from") || matchWord("extends")
				|| matchWords("inherits", "from"))
		{
			do
			{
				superclasses.add(postfix());
			}
			while(matchSeparator());
		}
		skipHeaderEnd();
		BlockStatement body;
		if(check(TokenType.NEWLINE) && !peekAt(1).getType().equals(TokenType.INDENT))
		{
			Token end = advance();
			body = new BlockStatement(end, List.of(new PassStatement(end)));
		}
		else
		{
			body = body("class");
		}
		return new ClassDeclaration(start, name, superclasses, body);
	}

	private Statement endpointDeclaration(Token start, boolean async)
	{
		Token path = consume(TokenType.STRING, "Expected the endpoint path as text, e.g. \"/users\"");
		expectWord("that");
		Token methodWord = advance();
		String method = HTTP_METHODS.get(methodWord.normalized());
		if(method == null)
		{
			throw error(methodWord, "Expected an HTTP verb such as 'gets' or 'posts'");
		}
		BlockStatement body = functionBody(start, "api endpoint");
		return new EndpointDeclaration(start, path, method, async, body);
	}

	// --- Exceptions, resources, concurrency ---

	private Statement tryStatement(Token start)
	{
		skipHeaderEnd();
		BlockStatement body = body("try");
		List<ExceptClause> handlers = new ArrayList<>();
		BlockStatement finallyBlock = null;
		while(true)
		{
			Optional<RuleMatch<Production>> clause = grammar.resolveStatement(this::peekAt);
			if(clause.isEmpty())
			{
				break;
			}
			Production production = clause.get().getProduction();
			if(production == Production.CATCH && finallyBlock == null)
			{
				Token handlerStart = peek();
				skip(clause.get().getConsumed());
				handlers.add(exceptClause(handlerStart));
			}
			else if(production == Production.FINALLY && finallyBlock == null)
			{
				skip(clause.get().getConsumed());
				skipHeaderEnd();
				finallyBlock = body("finally");
			}
			else
			{
				break;
			}
		}
		if(handlers.isEmpty() && finallyBlock == null)
		{
			throw error(peek(), "A 'try' block needs an 'if something goes wrong' or 'finally' clause");
		}
		return new TryStatement(start, body, handlers, finallyBlock);
	}

	private ExceptClause exceptClause(Token start)
	{
		Expression exceptionType = null;
		Token alias = null;
		matchWord("any", "an", "a");
		if(peek().isWord("error", "exception", "problem"))
		{
			advance();
		}
		else if(peek().getType() == TokenType.WORD && vocabulary.isIdentifier(peek().getLexeme()))
		{
			exceptionType = qualifiedName();
		}
		if(matchWord("as"))
		{
			alias = identifierToken();
		}
		skipHeaderEnd();
		return new ExceptClause(start, exceptionType, alias, body("if something goes wrong"));
	}

	private Statement raiseStatement(Token start)
	{
		Expression value = isLineEnd() ? null : expression();
		endOfStatement();
		if(value instanceof LiteralExpression && ((LiteralExpression) value).getKind() == LiteralExpression.Kind.TEXT)
		{
			value = new CallExpression(start, builtin(start, "Exception"), List.of(value));
		}
		return new RaiseStatement(start, value);
	}

	private Statement usingStatement(Token start)
	{
		Expression resource = expression();
		Token alias = matchWord("as") ? identifierToken() : null;
		skipHeaderEnd();
		return new UsingStatement(start, resource, alias, body("using"));
	}

	private Statement waitStatement(Token start, boolean awaitForm)
	{
		Expression value = awaitForm ? callable() : additive();
		String unit = timeUnit();
		endOfStatement();
		return new WaitStatement(start, value, unit, awaitForm);
	}

	private String timeUnit()
	{
		if(peek().getType() == TokenType.WORD && TIME_UNITS.containsKey(peek().normalized()))
		{
			return TIME_UNITS.get(advance().normalized());
		}
		return null;
	}

	// --- Imports and calls ---

	private Statement importStatement(Token start)
	{
		matchWord("the");
		String module = dottedName();
		matchWord("library", "module", "package");
		String alias = matchWord("as") ? identifierToken().getLexeme() : null;
		endOfStatement();
		return new ImportStatement(start, module, alias, List.of());
	}

	private Statement fromImportStatement(Token start)
	{
		String module = dottedName();
		expectWord("import");
		List<String> names = new ArrayList<>();
		do
		{
			names.add(identifierToken().getLexeme());
		}
		while(matchSeparator());
		endOfStatement();
		return new ImportStatement(start, module, null, names);
	}

	private Statement callStatement(Token start)
	{
		Expression callee = postfix();
		Expression call;
		if(matchWord("with"))
		{
			call = withArguments(start, callee);
		}
		else if(callee instanceof CallExpression)
		{
			call = callee;
		}
		else
		{
			call = new CallExpression(start, callee, List.of());
		}
		if(matchWord("asynchronously"))
		{
			Expression run = new AttributeExpression(IdentifierExpression.library(start, "asyncio"), "run");
			call = new CallExpression(start, run, List.of(call));
		}
		endOfStatement();
		return new ExpressionStatement(start, call);
	}

	private Statement callWithStatement()
	{
		Token start = peek();
		Expression callee = new IdentifierExpression(identifierToken());
		expectWord("with");
		Expression call = withArguments(start, callee);
		endOfStatement();
		return new ExpressionStatement(start, call);
	}

	private Statement expressionStatement()
	{
		Token start = peek();
		Expression expression = expression();
		if(match(TokenType.ASSIGN))
		{
			if(!(expression instanceof IdentifierExpression || expression instanceof AttributeExpression
					|| expression instanceof IndexExpression))
			{
				throw error(start, "Cannot assign to this expression");
			}
			Expression value = requiredExpression("=");
			endOfStatement();
			return new AssignmentStatement(start, expression, value);
		}
		endOfStatement();
		return new ExpressionStatement(start, expression);
	}

	// --- Blocks ---

	/**
	 * Parses the body following a header: an indented block on the next lines,
	 * or a single statement written on the same line.
	 */
	private BlockStatement body(String construct)
	{
		if(match(TokenType.NEWLINE))
		{
			if(!check(TokenType.INDENT))
			{
				throw error(peek(), "Expected an indented block after '" + construct + "'");
			}
			return indentedBlock();
		}
		if(isAtEnd())
		{
			throw error(peek(), "Expected a body after '" + construct + "'");
		}
		return inlineBody();
	}

	private BlockStatement inlineBody()
	{
		Token first = peek();
		inlineDepth++;
		try
		{
			return new BlockStatement(first, List.of(statement()));
		}
		finally
		{
			inlineDepth--;
		}
	}

	private BlockStatement indentedBlock()
	{
		Token indent = consume(TokenType.INDENT, "Expected an indented block");
		int savedInline = inlineDepth;
		inlineDepth = 0;
		List<Statement> statements = new ArrayList<>();
		try
		{
			while(!check(TokenType.DEDENT) && !isAtEnd())
			{
				if(match(TokenType.NEWLINE))
				{
					continue;
				}
				statements.add(statement());
			}
			match(TokenType.DEDENT);
		}
		finally
		{
			inlineDepth = savedInline;
		}
		return new BlockStatement(indent, statements);
	}

	private void skipHeaderEnd()
	{
		if(!match(TokenType.COLON))
		{
			matchWord("then", "do");
		}
		match(TokenType.COLON);
	}

	private void endOfStatement()
	{
		if(match(TokenType.NEWLINE) || check(TokenType.EOF))
		{
			return;
		}
		if(inlineDepth > 0)
		{
			if(peek().isWord("otherwise", "else"))
			{
				return;
			}
			if(check(TokenType.COMMA) && peekAt(1).isWord("otherwise", "else"))
			{
				advance();
				return;
			}
		}
		throw error(peek(), "Unexpected '" + peek().getLexeme() + "' after the end of the statement");
	}

	private boolean isLineEnd()
	{
		return check(TokenType.NEWLINE) || check(TokenType.EOF)
				|| (inlineDepth > 0 && peek().isWord("otherwise", "else"));
	}

	// --- Expressions ---

	/**
	 * Parses an expression at the lowest precedence level.
	 */
	public Expression expression()
	{
		return or();
	}

	private Expression requiredExpression(String after)
	{
		if(isLineEnd())
		{
			throw error(peek(), "Expected a value after '" + after + "'");
		}
		return expression();
	}

	private Expression or()
	{
		Expression left = and();
		while(operatorAt(Operator.Level.OR) != null)
		{
			skip(1);
			left = new BinaryExpression(left, BinaryOperator.OR, and());
		}
		return left;
	}

	private Expression and()
	{
		Expression left = not();
		while(operatorAt(Operator.Level.AND) != null)
		{
			skip(1);
			left = new BinaryExpression(left, BinaryOperator.AND, not());
		}
		return left;
	}

	private Expression not()
	{
		if(peek().isWord("not"))
		{
			Token operator = advance();
			return new UnaryExpression(operator, UnaryOperator.NOT, not());
		}
		return comparison();
	}

	private Expression comparison()
	{
		Expression left = additive();
		RuleMatch<Operator> rule;
		while((rule = operatorAt(Operator.Level.COMPARISON)) != null)
		{
			Token at = peek();
			skip(rule.getConsumed());
			Operator operator = rule.getProduction();
			switch(operator)
			{
				case IS_EMPTY:
				case IS_NOT_EMPTY:
					Expression length = new CallExpression(at, builtin(at, "len"), List.of(left));
					BinaryOperator test = operator == Operator.IS_EMPTY ? BinaryOperator.EQUAL : BinaryOperator.GREATER;
					left = new BinaryExpression(length, test, LiteralExpression.number(at, 0));
					break;
				case BETWEEN:
					Expression low = additive();
					expectWord("and");
					Expression high = additive();
					left = new ComparisonChain(List.of(low, left, high), List.of(BinaryOperator.LESS_EQUAL, BinaryOperator.LESS_EQUAL));
					break;
				case CONTAINS:
					left = new BinaryExpression(additive(), BinaryOperator.IN, left);
					break;
				case NOT_CONTAINS:
					left = new BinaryExpression(additive(), BinaryOperator.NOT_IN, left);
					break;
				case STARTS_WITH:
					left = new CallExpression(at, new AttributeExpression(left, "startswith"), List.of(additive()));
					break;
				case ENDS_WITH:
					left = new CallExpression(at, new AttributeExpression(left, "endswith"), List.of(additive()));
					break;
				case IS_INSTANCE:
					left = new CallExpression(at, builtin(at, "isinstance"), List.of(left, qualifiedName()));
					break;
				case LONGER:
				case SHORTER:
				case SAME_LENGTH:
					Expression other = new CallExpression(at, builtin(at, "len"), List.of(additive()));
					left = new BinaryExpression(new CallExpression(at, builtin(at, "len"), List.of(left)), lengthTest(operator), other);
					break;
				default:
					left = new BinaryExpression(left, binaryOperator(operator), additive());
			}
		}
		return left;
	}

	private Expression additive()
	{
		Expression left = multiplicative();
		RuleMatch<Operator> rule;
		while((rule = operatorAt(Operator.Level.ADDITIVE)) != null)
		{
			skip(rule.getConsumed());
			left = new BinaryExpression(left, binaryOperator(rule.getProduction()), multiplicative());
		}
		return left;
	}

	private Expression multiplicative()
	{
		Expression left = unary();
		RuleMatch<Operator> rule;
		while((rule = operatorAt(Operator.Level.MULTIPLICATIVE)) != null)
		{
			skip(rule.getConsumed());
			left = new BinaryExpression(left, binaryOperator(rule.getProduction()), unary());
		}
		return left;
	}

	private Expression unary()
	{
		if((check(TokenType.MINUS) || peek().isWord("minus", "negative")) && isOperandStart(peekAt(1)))
		{
			Token operator = advance();
			return new UnaryExpression(operator, UnaryOperator.NEGATE, unary());
		}
		return power();
	}

	private Expression power()
	{
		Expression base = postfix();
		RuleMatch<Operator> rule = operatorAt(Operator.Level.POWER);
		if(rule != null)
		{
			skip(rule.getConsumed());
			return new BinaryExpression(base, BinaryOperator.POWER, unary()); // right-associative
		}
		return base;
	}

	private Expression postfix()
	{
		Expression expression = primary();
		while(true)
		{
			if(match(TokenType.DOT))
			{
				Token name = consume(TokenType.WORD, "Expected an attribute name after '.'");
				expression = new AttributeExpression(expression, name.getLexeme());
			}
			else if(check(TokenType.LEFT_PAREN))
			{
				expression = parenthesizedArguments(expression);
			}
			else if(match(TokenType.LEFT_BRACKET))
			{
				Expression index = expression();
				consume(TokenType.RIGHT_BRACKET, "Expected ']' after index");
				expression = new IndexExpression(expression, index);
			}
			else if(peek().isWord("as") && peekAt(1).getType() == TokenType.WORD
					&& CONVERSIONS.containsKey(peekAt(1).normalized()))
			{
				Token at = advance();
				String conversion = CONVERSIONS.get(advance().normalized());
				expression = new CallExpression(at, builtin(at, conversion), List.of(expression));
			}
			else
			{
				return expression;
			}
		}
	}

	private Expression primary()
	{
		Token token = peek();
		switch(token.getType())
		{
			case NUMBER:
				advance();
				return new LiteralExpression(token, LiteralExpression.Kind.NUMBER, token.getLiteral());
			case STRING:
				advance();
				return new LiteralExpression(token, LiteralExpression.Kind.TEXT, token.getLiteral());
			case LEFT_PAREN:
				advance();
				Expression inner = expression();
				consume(TokenType.RIGHT_PAREN, "Expected ')' to close the group");
				return new GroupingExpression(token, inner);
			case LEFT_BRACKET:
				return listLiteral();
			case LEFT_BRACE:
				return dictLiteral();
			case WORD:
				return wordPrimary();
			default:
				throw error(token, "Expected a value but found '" + describe(token) + "'");
		}
	}

	private Expression wordPrimary()
	{
		Optional<RuleMatch<ExpressionForm>> form = grammar.resolveExpressionForm(this::peekAt);
		if(form.isPresent())
		{
			Token start = peek();
			skip(form.get().getConsumed());
			return expressionForm(start, form.get().getProduction());
		}
		Token token = peek();
		String word = token.normalized();
		if(word.equals("true") || word.equals("yes"))
		{
			advance();
			return new LiteralExpression(token, LiteralExpression.Kind.BOOLEAN, Boolean.TRUE);
		}
		if(word.equals("false") || word.equals("no"))
		{
			advance();
			return new LiteralExpression(token, LiteralExpression.Kind.BOOLEAN, Boolean.FALSE);
		}
		if(word.equals("nothing") || word.equals("none") || word.equals("null"))
		{
			advance();
			return new LiteralExpression(token, LiteralExpression.Kind.NONE, null);
		}
		Integer number = vocabulary.numberWord(word);
		if(number != null)
		{
			advance();
			return LiteralExpression.number(token, number);
		}
		if(word.equals("the") && peekAt(1).getType() == TokenType.WORD && vocabulary.isIdentifier(peekAt(1).getLexeme()))
		{
			advance();
		}
		return new IdentifierExpression(identifierToken());
	}

	private Expression expressionForm(Token start, ExpressionForm form)
	{
		switch(form)
		{
			case LENGTH:
				return call(start, builtin(start, "len"), unary());
			case SUM:
				return call(start, builtin(start, "sum"), collapsed(start, separatedOperands()));
			case AVERAGE:
				Expression mean = new AttributeExpression(IdentifierExpression.library(start, "statistics"), "mean");
				return call(start, mean, collapsed(start, separatedOperands()));
			case MAXIMUM:
				return new CallExpression(start, builtin(start, "max"), separatedOperands());
			case MINIMUM:
				return new CallExpression(start, builtin(start, "min"), separatedOperands());
			case SQUARE_ROOT:
				return call(start, new AttributeExpression(IdentifierExpression.library(start, "math"), "sqrt"), unary());
			case ABSOLUTE_VALUE:
				return call(start, builtin(start, "abs"), unary());
			case ROUNDED:
				return rounded(start);
			case UPPERCASE:
				return new CallExpression(start, new AttributeExpression(unary(), "upper"), List.of());
			case LOWERCASE:
				return new CallExpression(start, new AttributeExpression(unary(), "lower"), List.of());
			case TRIMMED:
				return new CallExpression(start, new AttributeExpression(unary(), "strip"), List.of());
			case RANDOM_NUMBER:
				Expression low = additive();
				expectWord("and");
				Expression high = additive();
				Expression randint = new AttributeExpression(IdentifierExpression.library(start, "random"), "randint");
				return new CallExpression(start, randint, List.of(low, high));
			case RANDOM_CHOICE:
				return call(start, new AttributeExpression(IdentifierExpression.library(start, "random"), "choice"), unary());
			case CURRENT_TIME:
				return new CallExpression(start, new AttributeExpression(IdentifierExpression.library(start, "datetime"), "now"), List.of());
			case ASK:
				List<Expression> prompt = isOperandStart(peek()) ? List.of(unary()) : List.of();
				return new CallExpression(start, builtin(start, "input"), prompt);
			case NEW_INSTANCE:
			case CALL:
				Expression callee = qualifiedName();
				if(matchWord("with"))
				{
					return withArguments(start, callee);
				}
				if(check(TokenType.LEFT_PAREN))
				{
					return parenthesizedArguments(callee);
				}
				return new CallExpression(start, callee, List.of());
			case COMPREHENSION:
				return comprehension(start);
			case LAMBDA:
				List<Parameter> parameters = parameters();
				if(!matchWords("and", "returns") && !matchWord("returns"))
				{
					throw error(peek(), "Expected 'and returns' in a function value");
				}
				return new LambdaExpression(start, parameters, expression());
			case OPEN_FILE:
				return openFile(start);
			case READ_FILE:
				Expression file = new CallExpression(start, builtin(start, "open"), List.of(additive()));
				return new CallExpression(start, new AttributeExpression(file, "read"), List.of());
			case AWAIT:
				return new AwaitExpression(start, callable());
			default:
				throw error(start, "Unsupported expression form " + form);
		}
	}

	private Expression rounded(Token start)
	{
		Expression value = unary();
		if(peek().isWord("to") && isOperandStart(peekAt(1)))
		{
			advance();
			Expression places = additive();
			matchWord("decimal");
			matchWord("places", "place");
			return new CallExpression(start, builtin(start, "round"), List.of(value, places));
		}
		return call(start, builtin(start, "round"), value);
	}

	private Expression openFile(Token start)
	{
		Expression path = additive();
		String mode = null;
		if(matchWords("for", "reading"))
		{
			mode = "r";
		}
		else if(matchWords("for", "writing"))
		{
			mode = "w";
		}
		else if(matchWords("for", "appending"))
		{
			mode = "a";
		}
		List<Expression> arguments = new ArrayList<>();
		arguments.add(path);
		if(mode != null)
		{
			arguments.add(LiteralExpression.text(start, mode));
		}
		return new CallExpression(start, builtin(start, "open"), arguments);
	}

	private Expression comprehension(Token start)
	{
		Expression element = expression();
		if(!matchWords("for", "each") && !matchWords("for", "every"))
		{
			throw error(peek(), "Expected 'for each' in a list description");
		}
		Token variable = identifierToken();
		expectWord("in", "of");
		Expression iterable = expression();
		Expression condition = matchWord("where", "if", "when") ? expression() : null;
		return new ComprehensionExpression(start, element, variable, iterable, condition);
	}

	/**
	 * A value that may be followed by "with" arguments, as in "wait for fetch with url".
	 */
	private Expression callable()
	{
		Token start = peek();
		Expression value = postfix();
		if(matchWord("with"))
		{
			return withArguments(start, value);
		}
		return value;
	}

	private Expression withArguments(Token start, Expression callee)
	{
		List<Expression> arguments = new ArrayList<>();
		List<KeywordArgument> keywords = new ArrayList<>();
		do
		{
			if(peek().getType() == TokenType.WORD && peekAt(1).getType() == TokenType.ASSIGN)
			{
				Token name = identifierToken();
				advance();
				keywords.add(new KeywordArgument(name, not()));
			}
			else
			{
				arguments.add(not());
			}
		}
		while(matchSeparator());
		return new CallExpression(start, callee, arguments, keywords);
	}

	private Expression parenthesizedArguments(Expression callee)
	{
		Token paren = consume(TokenType.LEFT_PAREN, "Expected '('");
		List<Expression> arguments = new ArrayList<>();
		List<KeywordArgument> keywords = new ArrayList<>();
		if(!check(TokenType.RIGHT_PAREN))
		{
			do
			{
				if(check(TokenType.RIGHT_PAREN))
				{
					break; // trailing comma
				}
				if(peek().getType() == TokenType.WORD && peekAt(1).getType() == TokenType.ASSIGN)
				{
					Token name = identifierToken();
					advance();
					keywords.add(new KeywordArgument(name, expression()));
				}
				else
				{
					arguments.add(expression());
				}
			}
			while(match(TokenType.COMMA));
		}
		consume(TokenType.RIGHT_PAREN, "Expected ')' after arguments");
		return new CallExpression(paren, callee, arguments, keywords);
	}

	private Expression listLiteral()
	{
		Token bracket = advance();
		List<Expression> elements = new ArrayList<>();
		while(!check(TokenType.RIGHT_BRACKET))
		{
			elements.add(expression());
			if(!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_BRACKET, "Expected ']' to close the list");
		return new ListExpression(bracket, elements);
	}

	private Expression dictLiteral()
	{
		Token brace = advance();
		List<Expression> keys = new ArrayList<>();
		List<Expression> values = new ArrayList<>();
		while(!check(TokenType.RIGHT_BRACE))
		{
			keys.add(expression());
			consume(TokenType.COLON, "Expected ':' between a dictionary key and its value");
			values.add(expression());
			if(!match(TokenType.COMMA))
			{
				break;
			}
		}
		consume(TokenType.RIGHT_BRACE, "Expected '}' to close the dictionary");
		return new DictExpression(brace, keys, values);
	}

	/**
	 * Operands separated by commas or "and", each parsed above the level of "and".
	 */
	private List<Expression> separatedOperands()
	{
		List<Expression> operands = new ArrayList<>();
		do
		{
			operands.add(not());
		}
		while(matchSeparator());
		return operands;
	}

	private boolean matchSeparator()
	{
		if(match(TokenType.COMMA))
		{
			if(peek().isWord("and") && isOperandStart(peekAt(1)))
			{
				advance();
			}
			return true;
		}
		if(peek().isWord("and") && isOperandStart(peekAt(1)) && !isClauseAfterAnd())
		{
			advance();
			return true;
		}
		return false;
	}

	private Expression collapsed(Token at, List<Expression> operands)
	{
		return operands.size() == 1 ? operands.get(0) : new ListExpression(at, operands);
	}

	private Expression call(Token at, Expression callee, Expression argument)
	{
		return new CallExpression(at, callee, List.of(argument));
	}

	private Expression qualifiedName()
	{
		Expression name = new IdentifierExpression(identifierToken());
		while(check(TokenType.DOT) && peekAt(1).getType() == TokenType.WORD)
		{
			advance();
			name = new AttributeExpression(name, advance().getLexeme());
		}
		return name;
	}

	private Expression assignmentTarget()
	{
		if(peek().isWord("the") && peekAt(1).getType() == TokenType.WORD && vocabulary.isIdentifier(peekAt(1).getLexeme()))
		{
			advance();
		}
		Expression target = new IdentifierExpression(identifierToken());
		while(true)
		{
			if(check(TokenType.DOT) && peekAt(1).getType() == TokenType.WORD)
			{
				advance();
				target = new AttributeExpression(target, advance().getLexeme());
			}
			else if(match(TokenType.LEFT_BRACKET))
			{
				Expression index = expression();
				consume(TokenType.RIGHT_BRACKET, "Expected ']' after index");
				target = new IndexExpression(target, index);
			}
			else
			{
				return target;
			}
		}
	}

	private TypeHint typeHint()
	{
		matchWord("a", "an");
		Token token = consume(TokenType.WORD, "Expected a type");
		String word = token.normalized();
		if((word.equals("list") || word.equals("set")) && matchWord("of"))
		{
			return new TypeHint(token, word, List.of(typeHint()));
		}
		if(word.equals("dictionary") || word.equals("dict") || word.equals("map"))
		{
			if(matchWord("from", "of"))
			{
				TypeHint key = typeHint();
				expectWord("to");
				TypeHint value = typeHint();
				return new TypeHint(token, "dictionary", List.of(key, value));
			}
			return new TypeHint(token, "dictionary", List.of());
		}
		if(word.equals("optional"))
		{
			return new TypeHint(token, word, List.of(typeHint()));
		}
		return new TypeHint(token, token.getLexeme(), List.of());
	}

	private String dottedName()
	{
		StringBuilder name = new StringBuilder(consume(TokenType.WORD, "Expected a module name").getLexeme());
		while(check(TokenType.DOT) && peekAt(1).getType() == TokenType.WORD)
		{
			advance();
			name.append('.').append(advance().getLexeme());
		}
		return name.toString();
	}

	private Token identifierToken()
	{
		Token token = peek();
		if(token.getType() != TokenType.WORD)
		{
			throw error(token, "Expected a name but found '" + describe(token) + "'");
		}
		if(vocabulary.isPythonKeyword(token.getLexeme()) || !vocabulary.isIdentifier(token.getLexeme()))
		{
			throw error(token, "'" + token.getLexeme() + "' is a reserved word and cannot be used as a name");
		}
		return advance();
	}

	private RuleMatch<Operator> operatorAt(Operator.Level level)
	{
		Optional<RuleMatch<Operator>> resolved = grammar.resolveOperator(this::peekAt);
		if(resolved.isEmpty() || resolved.get().getProduction().getLevel() != level)
		{
			return null;
		}
		RuleMatch<Operator> rule = resolved.get();
		if(!rule.getProduction().isPostfix() && !isOperandStart(peekAt(rule.getConsumed())))
		{
			return null; // e.g. the "times" of "repeat 3 times"
		}
		return rule;
	}

	private boolean isOperandStart(Token token)
	{
		switch(token.getType())
		{
			case NUMBER:
			case STRING:
			case LEFT_PAREN:
			case LEFT_BRACKET:
			case LEFT_BRACE:
			case MINUS:
				return true;
			case WORD:
				return !vocabulary.isConnector(token.getLexeme())
						|| token.isWord("not", "true", "false", "nothing", "none", "null", "yes", "no", "minus");
			default:
				return false;
		}
	}

	private static BinaryOperator lengthTest(Operator operator)
	{
		if(operator == Operator.LONGER)
		{
			return BinaryOperator.GREATER;
		}
		return operator == Operator.SHORTER ? BinaryOperator.LESS : BinaryOperator.EQUAL;
	}

	private static BinaryOperator binaryOperator(Operator operator)
	{
		switch(operator)
		{
			case EQUAL:
				return BinaryOperator.EQUAL;
			case NOT_EQUAL:
				return BinaryOperator.NOT_EQUAL;
			case LESS:
				return BinaryOperator.LESS;
			case LESS_EQUAL:
				return BinaryOperator.LESS_EQUAL;
			case GREATER:
				return BinaryOperator.GREATER;
			case GREATER_EQUAL:
				return BinaryOperator.GREATER_EQUAL;
			case IN:
				return BinaryOperator.IN;
			case NOT_IN:
				return BinaryOperator.NOT_IN;
			case ADD:
				return BinaryOperator.ADD;
			case SUBTRACT:
				return BinaryOperator.SUBTRACT;
			case MULTIPLY:
				return BinaryOperator.MULTIPLY;
			case DIVIDE:
				return BinaryOperator.DIVIDE;
			case MODULO:
				return BinaryOperator.MODULO;
			case POWER:
				return BinaryOperator.POWER;
			default:
				throw new IllegalArgumentException("No binary operator for " + operator);
		}
	}

	private static IdentifierExpression builtin(Token at, String name)
	{
		return new IdentifierExpression(at, name, false);
	}

	private static Token synthetic(Token at, String name)
	{
		return new Token(TokenType.WORD, name, null, at.getLine(), at.getColumn());
	}

	// --- Token helpers ---

	private Token peek()
	{
		return peekAt(0);
	}

	private Token peekAt(int offset)
	{
		int index = current + offset;
		while(tokens.size() <= index && source.hasNext())
		{
			tokens.add(source.next());
		}
		if(index < tokens.size())
		{
			return tokens.get(index);
		}
		return tokens.get(tokens.size() - 1); // EOF
	}

	private Token advance()
	{
		Token token = peek();
		if(!isAtEnd())
		{
			current++;
		}
		return token;
	}

	private void skip(int count)
	{
		for(int i = 0; i < count; i++)
		{
			advance();
		}
	}

	private boolean isAtEnd()
	{
		return peek().getType() == TokenType.EOF;
	}

	private boolean check(TokenType type)
	{
		return peek().getType() == type;
	}

	private boolean match(TokenType type)
	{
		if(check(type))
		{
			advance();
			return true;
		}
		return false;
	}

	private boolean matchWord(String... alternatives)
	{
		if(peek().isWord(alternatives))
		{
			advance();
			return true;
		}
		return false;
	}

	/**
	 * Matches an exact sequence of words, consuming them only if all match.
	 */
	private boolean matchWords(String... sequence)
	{
		for(int i = 0; i < sequence.length; i++)
		{
			if(!peekAt(i).isWord(sequence[i]))
			{
				return false;
			}
		}
		skip(sequence.length);
		return true;
	}

	private Token expectWord(String... alternatives)
	{
		if(!peek().isWord(alternatives))
		{
			throw error(peek(), "Expected '" + String.join("' or '", alternatives) + "' but found '" + describe(peek()) + "'");
		}
		return advance();
	}

	private Token consume(TokenType type, String message)
	{
		if(check(type))
		{
			return advance();
		}
		throw error(peek(), message);
	}

	private static String describe(Token token)
	{
		switch(token.getType())
		{
			case NEWLINE:
				return "end of line";
			case EOF:
				return "end of input";
			case INDENT:
				return "indentation";
			case DEDENT:
				return "end of block";
			default:
				return token.getLexeme();
		}
	}

	// --- Errors ---

	private List<Token> lineWindow()
	{
		List<Token> window = new ArrayList<>();
		for(int i = 0; ; i++)
		{
			Token token = peekAt(i);
			if(token.getType() == TokenType.NEWLINE || token.getType() == TokenType.EOF)
			{
				return window;
			}
			window.add(token);
		}
	}

	private SyntaxError unmatched(Token start)
	{
		List<Token> window = lineWindow();
		List<String> lexemes = new ArrayList<>();
		for(Token token : window)
		{
			lexemes.add(token.getLexeme());
		}
		String suggestion = grammar.suggestStatement(window);
		String hint = suggestion != null ? "did you mean '" + suggestion + "'?" : null;
		return new SyntaxError(start.getLine(), start.getColumn(),
				"I don't understand '" + String.join(" ", lexemes) + "'", lexemes, hint);
	}

	private SyntaxError error(Token token, String message)
	{
		List<String> lexemes = new ArrayList<>();
		for(Token t : lineWindow())
		{
			lexemes.add(t.getLexeme());
		}
		return new SyntaxError(token.getLine(), token.getColumn(), message, lexemes, null);
	}
}
