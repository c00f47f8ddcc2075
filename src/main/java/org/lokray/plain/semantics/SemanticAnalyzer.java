package org.lokray.plain.semantics;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.Parameter;
import org.lokray.plain.ast.Program;
import org.lokray.plain.ast.TypeHint;
import org.lokray.plain.ast.expressions.*;
import org.lokray.plain.ast.statements.*;
import org.lokray.plain.lexer.Token;
import org.lokray.plain.lexer.TokenType;
import org.lokray.plain.util.Suggestions;
import org.lokray.plain.util.SyntaxError;
import org.lokray.plain.util.UnboundNameError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Performs semantic analysis in two passes per block:
 * Pass 1: Register the functions and classes a block declares, so they may be used before their definition.
 * Pass 2: Resolve every name, validate type hints and structure, and desugar Plain-shaped statements
 * into Python-shaped ones in place.
 * <p>
 * Unbound names are looked up in the import table before an {@link UnboundNameError} is raised.
 */
public class SemanticAnalyzer implements ASTVisitor<Void>
{
	private static final Logger logger = LoggerFactory.getLogger(SemanticAnalyzer.class);

	private static final Pattern ROUTE_PARAMETER = Pattern.compile("<(?:[^:>]+:)?([A-Za-z_][A-Za-z0-9_]*)>");
	private static final String FLASK_APP = "app";

	private final AnalysisContext context;
	private final TypeVocabulary types;
	private final List<Statement> prelude = new ArrayList<>(); // synthesized statements placed at the program start
	private Scope currentScope;
	private FunctionDeclaration currentFunction; // innermost function, null at module and class level
	private int loopDepth;

	public SemanticAnalyzer(AnalysisContext context)
	{
		this.context = context;
		this.types = new TypeVocabulary(context);
		this.currentScope = context.getGlobals();
	}

	/**
	 * Analyzes and desugars a program in place.
	 *
	 * @param program The parsed program.
	 * @throws org.lokray.plain.util.CompileError on the first semantic problem.
	 */
	public void analyze(Program program)
	{
		program.accept(this);
	}

	@Override
	public Void visitProgram(Program program)
	{
		BlockStatement body = program.getBody();
		body.accept(this);
		for(int i = prelude.size() - 1; i >= 0; i--)
		{
			body.insert(0, prelude.get(i));
		}
		logger.debug("Analysis complete; {} new imports required", context.getRequiredImports().size());
		return null;
	}

	// --- Pass 1 ---

	private void predeclare(BlockStatement block)
	{
		for(Statement statement : block.getStatements())
		{
			if(statement instanceof FunctionDeclaration)
			{
				FunctionDeclaration function = (FunctionDeclaration) statement;
				currentScope.define(new FunctionSymbol(function.getName(), function.getNameToken(),
						function.getReturnHint(), function.getKind(), function.isAsync()));
			}
			else if(statement instanceof ClassDeclaration)
			{
				ClassDeclaration declaration = (ClassDeclaration) statement;
				currentScope.define(new ClassSymbol(declaration.getName(), declaration.getNameToken()));
			}
			else
			{
				for(BlockStatement nested : nestedBlocks(statement))
				{
					predeclare(nested);
				}
			}
		}
	}

	/**
	 * The blocks of a compound statement that share the scope of the statement itself.
	 */
	private static List<BlockStatement> nestedBlocks(Statement statement)
	{
		List<BlockStatement> blocks = new ArrayList<>();
		if(statement instanceof IfStatement)
		{
			blocks.add(((IfStatement) statement).getThenBranch());
			blocks.add(((IfStatement) statement).getElseBranch());
		}
		else if(statement instanceof WhileStatement)
		{
			blocks.add(((WhileStatement) statement).getBody());
		}
		else if(statement instanceof ForEachStatement)
		{
			blocks.add(((ForEachStatement) statement).getBody());
		}
		else if(statement instanceof RepeatStatement)
		{
			blocks.add(((RepeatStatement) statement).getBody());
		}
		else if(statement instanceof WithStatement)
		{
			blocks.add(((WithStatement) statement).getBody());
		}
		else if(statement instanceof UsingStatement)
		{
			blocks.add(((UsingStatement) statement).getBody());
		}
		else if(statement instanceof TryStatement)
		{
			TryStatement tryStatement = (TryStatement) statement;
			blocks.add(tryStatement.getBody());
			for(ExceptClause handler : tryStatement.getHandlers())
			{
				blocks.add(handler.getBody());
			}
			blocks.add(tryStatement.getFinallyBlock());
		}
		blocks.removeIf(block -> block == null);
		return blocks;
	}

	// --- Pass 2: statements ---

	@Override
	public Void visitBlockStatement(BlockStatement block)
	{
		predeclare(block);
		for(int i = 0; i < block.getStatements().size(); i++)
		{
			Statement statement = block.getStatements().get(i);
			if(statement.isPlainShaped())
			{
				statement = desugar(statement);
				block.replace(i, statement);
			}
			statement.accept(this);
		}
		return null;
	}

	@Override
	public Void visitAssignmentStatement(AssignmentStatement statement)
	{
		statement.getValue().accept(this);
		TypeHint hint = statement.getTypeHint();
		if(hint != null)
		{
			types.resolve(hint, currentScope);
		}
		Expression target = statement.getTarget();
		if(target instanceof IdentifierExpression && !statement.isAugmented())
		{
			IdentifierExpression identifier = (IdentifierExpression) target;
			Symbol visible = currentScope.resolve(identifier.getName());
			if(visible != null && isReservedBinding(visible))
			{
				throw shadowed(identifier.getName(), identifier.getFirstToken(), visible);
			}
			Symbol existing = currentScope.resolveLocally(identifier.getName());
			if(existing == null || hint != null)
			{
				existing = new VariableSymbol(identifier.getName(), identifier.getFirstToken(), hint);
				currentScope.define(existing);
			}
			identifier.setSymbol(existing);
		}
		else
		{
			target.accept(this);
		}
		return null;
	}

	@Override
	public Void visitExpressionStatement(ExpressionStatement statement)
	{
		statement.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visitIfStatement(IfStatement statement)
	{
		statement.getCondition().accept(this);
		statement.getThenBranch().accept(this);
		if(statement.getElseBranch() != null)
		{
			statement.getElseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Void visitWhileStatement(WhileStatement statement)
	{
		statement.getCondition().accept(this);
		loopBody(statement.getBody());
		return null;
	}

	@Override
	public Void visitForEachStatement(ForEachStatement statement)
	{
		statement.getIterable().accept(this);
		Token variable = statement.getVariable();
		currentScope.define(new VariableSymbol(variable.getLexeme(), variable));
		loopBody(statement.getBody());
		return null;
	}

	private void loopBody(BlockStatement body)
	{
		loopDepth++;
		try
		{
			body.accept(this);
		}
		finally
		{
			loopDepth--;
		}
	}

	@Override
	public Void visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		boolean inClassBody = currentScope.getKind() == ScopeKind.CLASS;
		if(declaration.getKind() == FunctionKind.FUNCTION && inClassBody)
		{
			declaration.setKind(FunctionKind.METHOD);
		}
		if(declaration.getKind().isMember() && !inClassBody)
		{
			throw structural(declaration.getFirstToken(), "Methods and constructors can only be defined inside a class");
		}
		completeMember(declaration);

		for(Expression decorator : declaration.getDecorators())
		{
			decorator.accept(this);
		}
		for(Parameter parameter : declaration.getParameters())
		{
			if(parameter.getDefaultValue() != null)
			{
				parameter.getDefaultValue().accept(this);
			}
			if(parameter.getTypeHint() != null)
			{
				types.resolve(parameter.getTypeHint(), currentScope);
			}
		}
		if(declaration.getReturnHint() != null)
		{
			types.resolve(declaration.getReturnHint(), currentScope);
		}
		currentScope.define(new FunctionSymbol(declaration.getName(), declaration.getNameToken(),
				declaration.getReturnHint(), declaration.getKind(), declaration.isAsync()));

		Scope functionScope = new Scope(currentScope, "function:" + declaration.getName(), ScopeKind.FUNCTION);
		for(Parameter parameter : declaration.getParameters())
		{
			functionScope.define(new VariableSymbol(parameter.getName(), parameter.getNameToken(), parameter.getTypeHint()));
		}

		Scope savedScope = currentScope;
		FunctionDeclaration savedFunction = currentFunction;
		int savedLoopDepth = loopDepth;
		currentScope = functionScope;
		currentFunction = declaration;
		loopDepth = 0;
		try
		{
			declaration.getBody().accept(this);
		}
		finally
		{
			currentScope = savedScope;
			currentFunction = savedFunction;
			loopDepth = savedLoopDepth;
		}
		return null;
	}

	/**
	 * Adds the receiver parameter and decorators that Python requires of class members.
	 */
	private void completeMember(FunctionDeclaration declaration)
	{
		Token at = declaration.getFirstToken();
		switch(declaration.getKind())
		{
			case METHOD:
			case CONSTRUCTOR:
				addReceiver(declaration, "self");
				break;
			case CLASS_METHOD:
				addReceiver(declaration, "cls");
				declaration.addDecorator(new IdentifierExpression(at, "classmethod", false));
				break;
			case STATIC_METHOD:
				declaration.addDecorator(new IdentifierExpression(at, "staticmethod", false));
				break;
			case PROPERTY:
				addReceiver(declaration, "self");
				declaration.addDecorator(new IdentifierExpression(at, "property", false));
				break;
			default:
				break;
		}
	}

	private static void addReceiver(FunctionDeclaration declaration, String receiver)
	{
		List<Parameter> parameters = declaration.getParameters();
		if(!parameters.isEmpty() && parameters.get(0).getName().equals(receiver))
		{
			return;
		}
		declaration.addReceiver(new Parameter(synthetic(declaration.getFirstToken(), receiver), null, null));
	}

	@Override
	public Void visitClassDeclaration(ClassDeclaration declaration)
	{
		for(Expression superclass : declaration.getSuperclasses())
		{
			superclass.accept(this);
		}
		currentScope.define(new ClassSymbol(declaration.getName(), declaration.getNameToken()));

		Scope savedScope = currentScope;
		FunctionDeclaration savedFunction = currentFunction;
		int savedLoopDepth = loopDepth;
		currentScope = new Scope(currentScope, "class:" + declaration.getName(), ScopeKind.CLASS);
		currentFunction = null;
		loopDepth = 0;
		try
		{
			declaration.getBody().accept(this);
		}
		finally
		{
			currentScope = savedScope;
			currentFunction = savedFunction;
			loopDepth = savedLoopDepth;
		}
		return null;
	}

	@Override
	public Void visitTryStatement(TryStatement statement)
	{
		statement.getBody().accept(this);
		for(ExceptClause handler : statement.getHandlers())
		{
			if(handler.getExceptionType() != null)
			{
				handler.getExceptionType().accept(this);
			}
			if(handler.getAlias() != null)
			{
				currentScope.define(new VariableSymbol(handler.getAlias().getLexeme(), handler.getAlias()));
			}
			handler.getBody().accept(this);
		}
		if(statement.getFinallyBlock() != null)
		{
			statement.getFinallyBlock().accept(this);
		}
		return null;
	}

	@Override
	public Void visitWithStatement(WithStatement statement)
	{
		statement.getResource().accept(this);
		if(statement.getAlias() != null)
		{
			currentScope.define(new VariableSymbol(statement.getAlias().getLexeme(), statement.getAlias()));
		}
		statement.getBody().accept(this);
		return null;
	}

	@Override
	public Void visitImportStatement(ImportStatement statement)
	{
		String line;
		List<String> bound;
		Optional<String> canonical = statement.isFromImport() || statement.getAlias() != null
				? Optional.empty()
				: context.canonicalImport(statement.getModule());
		if(canonical.isPresent())
		{
			line = canonical.get();
			bound = List.of(statement.getModule());
		}
		else
		{
			line = statement.toPython();
			bound = statement.boundNames();
		}
		context.requireImport(line);
		for(String name : bound)
		{
			context.getGlobals().define(new ModuleAliasSymbol(name, statement.getFirstToken(), line));
		}
		logger.debug("Hoisted explicit import '{}'", line);
		return null;
	}

	@Override
	public Void visitReturnStatement(ReturnStatement statement)
	{
		if(currentFunction == null)
		{
			throw structural(statement.getFirstToken(), "'return' can only be used inside a function");
		}
		if(statement.getValue() != null)
		{
			statement.getValue().accept(this);
		}
		return null;
	}

	@Override
	public Void visitRaiseStatement(RaiseStatement statement)
	{
		if(statement.getException() != null)
		{
			statement.getException().accept(this);
		}
		return null;
	}

	@Override
	public Void visitPassStatement(PassStatement statement)
	{
		return null;
	}

	@Override
	public Void visitBreakStatement(BreakStatement statement)
	{
		if(loopDepth == 0)
		{
			throw structural(statement.getFirstToken(), "'stop the loop' can only be used inside a loop");
		}
		return null;
	}

	@Override
	public Void visitContinueStatement(ContinueStatement statement)
	{
		if(loopDepth == 0)
		{
			throw structural(statement.getFirstToken(), "'skip to the next' can only be used inside a loop");
		}
		return null;
	}

	// --- Desugaring ---

	private Statement desugar(Statement statement)
	{
		Statement replacement;
		if(statement instanceof RepeatStatement)
		{
			replacement = desugarRepeat((RepeatStatement) statement);
		}
		else if(statement instanceof UsingStatement)
		{
			UsingStatement using = (UsingStatement) statement;
			replacement = new WithStatement(using.getFirstToken(), using.getResource(), using.getAlias(), using.getBody());
		}
		else if(statement instanceof WaitStatement)
		{
			replacement = desugarWait((WaitStatement) statement);
		}
		else if(statement instanceof PrintRangeStatement)
		{
			replacement = desugarPrintRange((PrintRangeStatement) statement);
		}
		else if(statement instanceof EndpointDeclaration)
		{
			replacement = desugarEndpoint((EndpointDeclaration) statement);
		}
		else if(statement instanceof PropertyDeclaration)
		{
			replacement = desugarProperty((PropertyDeclaration) statement);
		}
		else
		{
			throw new IllegalStateException("No desugaring for " + statement.getClass().getSimpleName());
		}
		logger.debug("Desugared {} at line {}", statement.getClass().getSimpleName(), statement.getFirstToken().getLine());
		return replacement;
	}

	private Statement desugarRepeat(RepeatStatement repeat)
	{
		Token at = repeat.getFirstToken();
		switch(repeat.getMode())
		{
			case TIMES:
				Expression range = new CallExpression(at, builtin(at, "range"), List.of(repeat.getOperand()));
				return new ForEachStatement(at, synthetic(at, "_"), range, repeat.getBody());
			case UNTIL:
				Expression negated = new UnaryExpression(at, UnaryOperator.NOT, repeat.getOperand());
				return new WhileStatement(at, negated, repeat.getBody());
			case WHILE:
				return new WhileStatement(at, repeat.getOperand(), repeat.getBody());
			case FOREVER:
				return new WhileStatement(at, new LiteralExpression(at, LiteralExpression.Kind.BOOLEAN, Boolean.TRUE), repeat.getBody());
			default:
				throw new IllegalStateException("Unknown repeat mode " + repeat.getMode());
		}
	}

	private Statement desugarWait(WaitStatement wait)
	{
		Token at = wait.getFirstToken();
		boolean inAsync = currentFunction != null && currentFunction.isAsync();
		if(!wait.isPause())
		{
			if(!inAsync)
			{
				throw structural(at, "'wait for' can only be used inside an asynchronous function");
			}
			return new ExpressionStatement(at, new AwaitExpression(at, wait.getValue()));
		}
		Expression seconds = duration(wait.getValue(), wait.getUnit(), at);
		if(inAsync)
		{
			Expression sleep = new AttributeExpression(IdentifierExpression.library(at, "asyncio"), "sleep");
			return new ExpressionStatement(at, new AwaitExpression(at, new CallExpression(at, sleep, List.of(seconds))));
		}
		Expression sleep = new AttributeExpression(IdentifierExpression.library(at, "time"), "sleep");
		return new ExpressionStatement(at, new CallExpression(at, sleep, List.of(seconds)));
	}

	private static Expression duration(Expression value, String unit, Token at)
	{
		if(unit == null)
		{
			return value;
		}
		switch(unit)
		{
			case "milliseconds":
				return new BinaryExpression(value, BinaryOperator.DIVIDE, LiteralExpression.number(at, 1000));
			case "minutes":
				return new BinaryExpression(value, BinaryOperator.MULTIPLY, LiteralExpression.number(at, 60));
			case "hours":
				return new BinaryExpression(value, BinaryOperator.MULTIPLY, LiteralExpression.number(at, 3600));
			default:
				return value;
		}
	}

	private Statement desugarPrintRange(PrintRangeStatement print)
	{
		Token at = print.getFirstToken();
		Token variable = synthetic(at, "number");
		Expression end = new BinaryExpression(print.getTo(), BinaryOperator.ADD, LiteralExpression.number(at, 1));
		Expression range = new CallExpression(at, builtin(at, "range"), List.of(print.getFrom(), end));
		Statement body = new ExpressionStatement(at, new CallExpression(at, builtin(at, "print"), List.of(new IdentifierExpression(variable))));
		return new ForEachStatement(at, variable, range, new BlockStatement(at, List.of(body)));
	}

	private Statement desugarEndpoint(EndpointDeclaration endpoint)
	{
		Token at = endpoint.getFirstToken();
		String path = endpoint.getPath();
		List<Parameter> parameters = new ArrayList<>();
		Matcher matcher = ROUTE_PARAMETER.matcher(path);
		while(matcher.find())
		{
			parameters.add(new Parameter(synthetic(endpoint.getPathToken(), matcher.group(1)), null, null));
		}
		Token name = synthetic(at, endpointFunctionName(endpoint.getMethod(), path));
		FunctionDeclaration function = new FunctionDeclaration(at, name, FunctionKind.FUNCTION, parameters, null,
				endpoint.getBody(), endpoint.isAsync(), false);

		ensureFlaskApp(at);
		Expression route = new AttributeExpression(new IdentifierExpression(synthetic(at, "app")), "route");
		KeywordArgument methods = new KeywordArgument(synthetic(at, "methods"),
				new ListExpression(at, List.of(LiteralExpression.text(at, endpoint.getMethod()))));
		function.addDecorator(new CallExpression(at, route, List.of(LiteralExpression.text(endpoint.getPathToken(), path)), List.of(methods)));
		return function;
	}

	/**
	 * Inside the named class (or any class, when none is named) a property is a method decorated with {@code @property}.
	 * Elsewhere it is attached to its class as {@code C.name = property(lambda self: value)}.
	 */
	private Statement desugarProperty(PropertyDeclaration property)
	{
		Token at = property.getFirstToken();
		Token owner = property.getOwnerToken();
		boolean inOwner = currentScope.getKind() == ScopeKind.CLASS
				&& (owner == null || currentScope.getScopeName().equals("class:" + owner.getLexeme()));
		if(inOwner)
		{
			return new FunctionDeclaration(at, property.getNameToken(), FunctionKind.PROPERTY, List.of(), null,
					property.getBody(), false, false);
		}
		if(owner == null)
		{
			throw structural(at, "A property must be defined inside a class, or name its class with 'in class'");
		}
		List<Statement> body = property.getBody().getStatements();
		if(body.size() != 1 || !(body.get(0) instanceof ReturnStatement) || ((ReturnStatement) body.get(0)).getValue() == null)
		{
			throw new SyntaxError(at.getLine(), at.getColumn(),
					"A property added from outside its class needs a value after 'that returns'",
					List.of(at.getLexeme()), "write 'that returns <value>' on the same line");
		}
		Expression value = ((ReturnStatement) body.get(0)).getValue();
		LambdaExpression getter = new LambdaExpression(at, List.of(new Parameter(synthetic(at, "self"), null, null)), value);
		Expression target = new AttributeExpression(new IdentifierExpression(owner), property.getName());
		return new AssignmentStatement(at, target, new CallExpression(at, builtin(at, "property"), List.of(getter)));
	}

	static String endpointFunctionName(String method, String path)
	{
		String stem = ROUTE_PARAMETER.matcher(path).replaceAll("$1")
				.replaceAll("[^A-Za-z0-9]+", "_")
				.replaceAll("^_+|_+$", "");
		if(stem.isEmpty())
		{
			stem = "index";
		}
		return method.toLowerCase(Locale.ROOT) + "_" + stem;
	}

	/**
	 * Binds {@code app = Flask(__name__)} once, at the start of the program.
	 */
	private void ensureFlaskApp(Token at)
	{
		Symbol existing = currentScope.resolve(FLASK_APP);
		if(existing instanceof VariableSymbol && ((VariableSymbol) existing).isGenerated())
		{
			return;
		}
		if(existing != null)
		{
			throw new SyntaxError(at.getLine(), at.getColumn(),
					"'" + FLASK_APP + "' is already used as a name, so the web application for this endpoint cannot be created",
					List.of(at.getLexeme()), "rename your '" + FLASK_APP + "'");
		}
		Expression flask = new CallExpression(at, IdentifierExpression.library(at, "Flask"),
				List.of(new IdentifierExpression(at, "__name__", false)));
		Token name = synthetic(at, FLASK_APP);
		IdentifierExpression target = new IdentifierExpression(name);
		Statement binding = new AssignmentStatement(at, target, flask);
		Scope savedScope = currentScope;
		currentScope = context.getGlobals();
		try
		{
			flask.accept(this);
		}
		finally
		{
			currentScope = savedScope;
		}
		VariableSymbol app = VariableSymbol.generated(FLASK_APP, name);
		context.getGlobals().define(app);
		target.setSymbol(app);
		prelude.add(binding);
	}

	@Override
	public Void visitRepeatStatement(RepeatStatement statement)
	{
		throw new IllegalStateException("repeat must be desugared before it is visited");
	}

	@Override
	public Void visitUsingStatement(UsingStatement statement)
	{
		throw new IllegalStateException("using must be desugared before it is visited");
	}

	@Override
	public Void visitWaitStatement(WaitStatement statement)
	{
		throw new IllegalStateException("wait must be desugared before it is visited");
	}

	@Override
	public Void visitPrintRangeStatement(PrintRangeStatement statement)
	{
		throw new IllegalStateException("print numbers must be desugared before it is visited");
	}

	@Override
	public Void visitEndpointDeclaration(EndpointDeclaration declaration)
	{
		throw new IllegalStateException("api endpoint must be desugared before it is visited");
	}

	@Override
	public Void visitPropertyDeclaration(PropertyDeclaration declaration)
	{
		throw new IllegalStateException("property must be desugared before it is visited");
	}

	// --- Pass 2: expressions ---

	@Override
	public Void visitLiteralExpression(LiteralExpression expression)
	{
		return null;
	}

	@Override
	public Void visitIdentifierExpression(IdentifierExpression expression)
	{
		String name = expression.getName();
		Token token = expression.getFirstToken();
		if(expression.isSynthetic())
		{
			expression.setSymbol(resolveLibrary(name, token));
			return null;
		}
		Symbol symbol = currentScope.resolve(name);
		if(symbol == null)
		{
			symbol = context.autoImport(name, token).orElseThrow(() -> unbound(name, token));
		}
		expression.setSymbol(symbol);
		return null;
	}

	private Symbol resolveLibrary(String name, Token token)
	{
		Symbol existing = currentScope.resolve(name);
		if(existing != null)
		{
			if(existing.getKind() != SymbolKind.MODULE_ALIAS)
			{
				throw new SyntaxError(token.getLine(), token.getColumn(),
						"'" + name + "' is already used as a name, so the library '" + name + "' cannot be used here",
						List.of(token.getLexeme()), "rename your '" + name + "'");
			}
			return existing;
		}
		return context.autoImport(name, token)
				.orElseThrow(() -> new IllegalStateException("Import table has no entry for library name '" + name + "'"));
	}

	/**
	 * Names the generated code relies on: imported libraries and the compiler's own bindings.
	 */
	private static boolean isReservedBinding(Symbol symbol)
	{
		return symbol.getKind() == SymbolKind.MODULE_ALIAS
				|| symbol instanceof VariableSymbol && ((VariableSymbol) symbol).isGenerated();
	}

	private static SyntaxError shadowed(String name, Token token, Symbol existing)
	{
		String owner = existing.getKind() == SymbolKind.MODULE_ALIAS ? "the library '" + name + "'" : "the web application";
		return new SyntaxError(token.getLine(), token.getColumn(),
				"'" + name + "' already refers to " + owner + " and cannot be assigned",
				List.of(token.getLexeme()), "choose another name");
	}

	private UnboundNameError unbound(String name, Token token)
	{
		String nearest = Suggestions.nearest(name, currentScope.visibleNames());
		return new UnboundNameError(token.getLine(), token.getColumn(), name,
				nearest != null ? "did you mean '" + nearest + "'?" : null);
	}

	@Override
	public Void visitBinaryExpression(BinaryExpression expression)
	{
		expression.getLeft().accept(this);
		expression.getRight().accept(this);
		return null;
	}

	@Override
	public Void visitUnaryExpression(UnaryExpression expression)
	{
		expression.getOperand().accept(this);
		return null;
	}

	@Override
	public Void visitComparisonChain(ComparisonChain expression)
	{
		for(Expression operand : expression.getOperands())
		{
			operand.accept(this);
		}
		return null;
	}

	@Override
	public Void visitCallExpression(CallExpression expression)
	{
		expression.getCallee().accept(this);
		for(Expression argument : expression.getArguments())
		{
			argument.accept(this);
		}
		for(KeywordArgument keyword : expression.getKeywordArguments())
		{
			keyword.getValue().accept(this);
		}
		return null;
	}

	@Override
	public Void visitAttributeExpression(AttributeExpression expression)
	{
		expression.getObject().accept(this);
		return null;
	}

	@Override
	public Void visitIndexExpression(IndexExpression expression)
	{
		expression.getObject().accept(this);
		expression.getIndex().accept(this);
		return null;
	}

	@Override
	public Void visitListExpression(ListExpression expression)
	{
		for(Expression element : expression.getElements())
		{
			element.accept(this);
		}
		return null;
	}

	@Override
	public Void visitDictExpression(DictExpression expression)
	{
		for(int i = 0; i < expression.getKeys().size(); i++)
		{
			expression.getKeys().get(i).accept(this);
			expression.getValues().get(i).accept(this);
		}
		return null;
	}

	@Override
	public Void visitGroupingExpression(GroupingExpression expression)
	{
		expression.getExpression().accept(this);
		return null;
	}

	@Override
	public Void visitComprehensionExpression(ComprehensionExpression expression)
	{
		expression.getIterable().accept(this);
		Scope savedScope = currentScope;
		currentScope = new Scope(currentScope, "comprehension", ScopeKind.COMPREHENSION);
		try
		{
			Token variable = expression.getVariable();
			currentScope.define(new VariableSymbol(variable.getLexeme(), variable));
			expression.getElement().accept(this);
			if(expression.getCondition() != null)
			{
				expression.getCondition().accept(this);
			}
		}
		finally
		{
			currentScope = savedScope;
		}
		return null;
	}

	@Override
	public Void visitLambdaExpression(LambdaExpression expression)
	{
		Scope lambdaScope = new Scope(currentScope, "lambda", ScopeKind.FUNCTION);
		for(Parameter parameter : expression.getParameters())
		{
			if(parameter.getDefaultValue() != null)
			{
				parameter.getDefaultValue().accept(this);
			}
			lambdaScope.define(new VariableSymbol(parameter.getName(), parameter.getNameToken()));
		}
		Scope savedScope = currentScope;
		currentScope = lambdaScope;
		try
		{
			expression.getBody().accept(this);
		}
		finally
		{
			currentScope = savedScope;
		}
		return null;
	}

	@Override
	public Void visitAwaitExpression(AwaitExpression expression)
	{
		if(currentFunction == null || !currentFunction.isAsync())
		{
			throw structural(expression.getFirstToken(), "'wait for' can only be used inside an asynchronous function");
		}
		expression.getValue().accept(this);
		return null;
	}

	@Override
	public Void visitYieldExpression(YieldExpression expression)
	{
		if(currentFunction == null)
		{
			throw structural(expression.getFirstToken(), "'yield' can only be used inside a function");
		}
		if(expression.getValue() != null)
		{
			expression.getValue().accept(this);
		}
		return null;
	}

	// --- Helpers ---

	private static SyntaxError structural(Token token, String message)
	{
		return new SyntaxError(token.getLine(), token.getColumn(), message);
	}

	private static IdentifierExpression builtin(Token at, String name)
	{
		return new IdentifierExpression(at, name, false);
	}

	private static Token synthetic(Token at, String name)
	{
		return new Token(TokenType.WORD, name, null, at.getLine(), at.getColumn());
	}
}
