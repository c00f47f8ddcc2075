package org.lokray.plain.codegen;

import org.lokray.plain.ast.ASTNode;
import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.Parameter;
import org.lokray.plain.ast.Program;
import org.lokray.plain.ast.expressions.*;
import org.lokray.plain.ast.statements.*;
import org.lokray.plain.util.InternalGeneratorError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * PythonGenerator is responsible for traversing the analyzed Abstract Syntax Tree (AST)
 * and generating the corresponding Python source code.
 * <p>
 * Statements are appended line by line; expressions are returned as strings and parenthesized
 * only where Python's precedence requires it. Only Python-shaped nodes can be rendered.
 */
public class PythonGenerator implements ASTVisitor<String>
{
	private static final Logger logger = LoggerFactory.getLogger(PythonGenerator.class);

	// Python binding strength, loosest first
	private static final int LAMBDA = 0;
	private static final int OR = 1;
	private static final int AND = 2;
	private static final int NOT = 3;
	private static final int COMPARISON = 4;
	private static final int ADDITIVE = 6;
	private static final int MULTIPLICATIVE = 7;
	private static final int UNARY = 8;
	private static final int POWER = 9;
	private static final int AWAIT = 10;
	private static final int POSTFIX = 11;
	private static final int ATOM = 12;

	private final String indentUnit;
	private StringBuilder out;
	private LineMap lineMap;
	private int indentLevel;
	private int lineCount;
	private int originLine; // Plain line of the statement being rendered

	/**
	 * @param indentWidth Number of spaces per indentation level.
	 */
	public PythonGenerator(int indentWidth)
	{
		this.indentUnit = " ".repeat(indentWidth);
	}

	public PythonGenerator()
	{
		this(4);
	}

	/**
	 * Renders a program.
	 *
	 * @param program The analyzed program.
	 * @param imports The import lines to place in the header, in order.
	 * @return The Python source and its line map.
	 * @throws InternalGeneratorError if the tree still holds a node with no Python rendering.
	 */
	public GeneratedCode generate(Program program, Collection<String> imports)
	{
		out = new StringBuilder();
		lineMap = new LineMap();
		indentLevel = 0;
		lineCount = 0;
		originLine = program.getFirstToken().getLine();

		for(String line : imports)
		{
			appendLine(line);
		}
		if(!imports.isEmpty() && hasRenderedBody(program))
		{
			appendLine("");
		}
		program.accept(this);
		logger.debug("Generated {} lines of Python", lineCount);
		return new GeneratedCode(out.toString(), lineMap);
	}

	/**
	 * Hoisted imports render nothing in the body, so they do not call for the blank line after the header.
	 */
	private static boolean hasRenderedBody(Program program)
	{
		for(Statement statement : program.getBody().getStatements())
		{
			if(!(statement instanceof ImportStatement))
			{
				return true;
			}
		}
		return false;
	}

	private void appendLine(String line)
	{
		lineCount++;
		if(line.isEmpty())
		{
			out.append('\n');
			return;
		}
		lineMap.record(lineCount, originLine);
		for(int i = 0; i < indentLevel; i++)
		{
			out.append(indentUnit);
		}
		out.append(line).append('\n');
	}

	private void indent()
	{
		indentLevel++;
	}

	private void dedent()
	{
		if(indentLevel > 0)
		{
			indentLevel--;
		}
	}

	private void at(ASTNode node)
	{
		originLine = node.getFirstToken().getLine();
	}

	/**
	 * Renders a header line followed by its indented block.
	 */
	private void block(String header, BlockStatement body)
	{
		appendLine(header);
		indent();
		body.accept(this);
		dedent();
	}

	// --- Statements ---

	@Override
	public String visitProgram(Program program)
	{
		for(Statement statement : program.getBody().getStatements())
		{
			statement.accept(this);
		}
		return null;
	}

	@Override
	public String visitBlockStatement(BlockStatement statement)
	{
		int before = lineCount;
		for(Statement child : statement.getStatements())
		{
			child.accept(this);
		}
		if(lineCount == before)
		{
			at(statement);
			appendLine("pass");
		}
		return null;
	}

	@Override
	public String visitAssignmentStatement(AssignmentStatement statement)
	{
		at(statement);
		StringBuilder line = new StringBuilder(expression(statement.getTarget(), POSTFIX));
		if(statement.getTypeHint() != null)
		{
			line.append(": ").append(statement.getTypeHint().getPythonForm());
		}
		if(statement.isAugmented())
		{
			line.append(' ').append(statement.getAugmentedOperator().getSymbol()).append("= ");
		}
		else
		{
			line.append(" = ");
		}
		line.append(expression(statement.getValue(), LAMBDA));
		appendLine(line.toString());
		return null;
	}

	@Override
	public String visitExpressionStatement(ExpressionStatement statement)
	{
		at(statement);
		appendLine(expression(statement.getExpression(), LAMBDA));
		return null;
	}

	@Override
	public String visitIfStatement(IfStatement statement)
	{
		at(statement);
		String keyword = statement.isElseIf() ? "elif " : "if ";
		block(keyword + expression(statement.getCondition(), LAMBDA) + ":", statement.getThenBranch());
		BlockStatement elseBranch = statement.getElseBranch();
		if(elseBranch == null)
		{
			return null;
		}
		List<Statement> statements = elseBranch.getStatements();
		if(statements.size() == 1 && statements.get(0) instanceof IfStatement && ((IfStatement) statements.get(0)).isElseIf())
		{
			statements.get(0).accept(this);
		}
		else
		{
			at(elseBranch);
			block("else:", elseBranch);
		}
		return null;
	}

	@Override
	public String visitWhileStatement(WhileStatement statement)
	{
		at(statement);
		block("while " + expression(statement.getCondition(), LAMBDA) + ":", statement.getBody());
		return null;
	}

	@Override
	public String visitForEachStatement(ForEachStatement statement)
	{
		at(statement);
		block("for " + statement.getVariable().getLexeme() + " in " + expression(statement.getIterable(), OR) + ":", statement.getBody());
		return null;
	}

	@Override
	public String visitFunctionDeclaration(FunctionDeclaration declaration)
	{
		at(declaration);
		for(Expression decorator : declaration.getDecorators())
		{
			appendLine("@" + expression(decorator, POSTFIX));
		}
		StringBuilder header = new StringBuilder();
		if(declaration.isAsync())
		{
			header.append("async ");
		}
		header.append("def ").append(declaration.getName()).append('(').append(parameters(declaration.getParameters(), true)).append(')');
		if(declaration.getReturnHint() != null)
		{
			header.append(" -> ").append(declaration.getReturnHint().getPythonForm());
		}
		block(header.append(':').toString(), declaration.getBody());
		return null;
	}

	private String parameters(List<Parameter> parameters, boolean annotated)
	{
		List<String> rendered = new ArrayList<>();
		for(Parameter parameter : parameters)
		{
			StringBuilder sb = new StringBuilder(parameter.getName());
			boolean hinted = annotated && parameter.getTypeHint() != null;
			if(hinted)
			{
				sb.append(": ").append(parameter.getTypeHint().getPythonForm());
			}
			if(parameter.getDefaultValue() != null)
			{
				sb.append(hinted ? " = " : "=").append(expression(parameter.getDefaultValue(), LAMBDA));
			}
			rendered.add(sb.toString());
		}
		return String.join(", ", rendered);
	}

	@Override
	public String visitClassDeclaration(ClassDeclaration declaration)
	{
		at(declaration);
		StringBuilder header = new StringBuilder("class ").append(declaration.getName());
		if(!declaration.getSuperclasses().isEmpty())
		{
			header.append('(').append(joined(declaration.getSuperclasses())).append(')');
		}
		block(header.append(':').toString(), declaration.getBody());
		return null;
	}

	@Override
	public String visitTryStatement(TryStatement statement)
	{
		at(statement);
		block("try:", statement.getBody());
		for(ExceptClause handler : statement.getHandlers())
		{
			originLine = handler.getFirstToken().getLine();
			String type = handler.getExceptionType() != null ? expression(handler.getExceptionType(), POSTFIX) : "Exception";
			String alias = handler.getAlias() != null ? " as " + handler.getAlias().getLexeme() : "";
			block("except " + type + alias + ":", handler.getBody());
		}
		if(statement.getFinallyBlock() != null)
		{
			at(statement.getFinallyBlock());
			block("finally:", statement.getFinallyBlock());
		}
		return null;
	}

	@Override
	public String visitWithStatement(WithStatement statement)
	{
		at(statement);
		String alias = statement.getAlias() != null ? " as " + statement.getAlias().getLexeme() : "";
		block("with " + expression(statement.getResource(), LAMBDA) + alias + ":", statement.getBody());
		return null;
	}

	@Override
	public String visitImportStatement(ImportStatement statement)
	{
		return null; // hoisted into the import header
	}

	@Override
	public String visitReturnStatement(ReturnStatement statement)
	{
		at(statement);
		appendLine(statement.getValue() == null ? "return" : "return " + expression(statement.getValue(), LAMBDA));
		return null;
	}

	@Override
	public String visitRaiseStatement(RaiseStatement statement)
	{
		at(statement);
		appendLine(statement.getException() == null ? "raise" : "raise " + expression(statement.getException(), LAMBDA));
		return null;
	}

	@Override
	public String visitPassStatement(PassStatement statement)
	{
		at(statement);
		appendLine("pass");
		return null;
	}

	@Override
	public String visitBreakStatement(BreakStatement statement)
	{
		at(statement);
		appendLine("break");
		return null;
	}

	@Override
	public String visitContinueStatement(ContinueStatement statement)
	{
		at(statement);
		appendLine("continue");
		return null;
	}

	@Override
	public String visitRepeatStatement(RepeatStatement statement)
	{
		throw unrendered(statement);
	}

	@Override
	public String visitUsingStatement(UsingStatement statement)
	{
		throw unrendered(statement);
	}

	@Override
	public String visitWaitStatement(WaitStatement statement)
	{
		throw unrendered(statement);
	}

	@Override
	public String visitPrintRangeStatement(PrintRangeStatement statement)
	{
		throw unrendered(statement);
	}

	@Override
	public String visitEndpointDeclaration(EndpointDeclaration declaration)
	{
		throw unrendered(declaration);
	}

	@Override
	public String visitPropertyDeclaration(PropertyDeclaration declaration)
	{
		throw unrendered(declaration);
	}

	private static InternalGeneratorError unrendered(ASTNode node)
	{
		return new InternalGeneratorError(node.getClass().getSimpleName() + " at line " + node.getFirstToken().getLine()
				+ " has no Python rendering; it must be desugared before generation");
	}

	// --- Expressions ---

	/**
	 * Renders an expression, parenthesized if it binds more loosely than {@code minimum}.
	 */
	private String expression(Expression expression, int minimum)
	{
		String rendered = expression.accept(this);
		return precedence(expression) < minimum ? "(" + rendered + ")" : rendered;
	}

	private static int precedence(Expression expression)
	{
		if(expression instanceof BinaryExpression)
		{
			return precedence(((BinaryExpression) expression).getOperator());
		}
		if(expression instanceof UnaryExpression)
		{
			return ((UnaryExpression) expression).getOperator() == UnaryOperator.NOT ? NOT : UNARY;
		}
		if(expression instanceof ComparisonChain)
		{
			return COMPARISON;
		}
		if(expression instanceof LambdaExpression || expression instanceof YieldExpression)
		{
			return LAMBDA;
		}
		if(expression instanceof AwaitExpression)
		{
			return AWAIT;
		}
		if(expression instanceof CallExpression || expression instanceof AttributeExpression || expression instanceof IndexExpression)
		{
			return POSTFIX;
		}
		return ATOM;
	}

	private static int precedence(BinaryOperator operator)
	{
		switch(operator)
		{
			case OR:
				return OR;
			case AND:
				return AND;
			case ADD:
			case SUBTRACT:
				return ADDITIVE;
			case MULTIPLY:
			case DIVIDE:
			case MODULO:
				return MULTIPLICATIVE;
			case POWER:
				return POWER;
			default:
				return COMPARISON;
		}
	}

	@Override
	public String visitLiteralExpression(LiteralExpression expression)
	{
		switch(expression.getKind())
		{
			case NUMBER:
				return ((BigDecimal) expression.getValue()).toPlainString();
			case TEXT:
				return quote((String) expression.getValue());
			case BOOLEAN:
				return Boolean.TRUE.equals(expression.getValue()) ? "True" : "False";
			default:
				return "None";
		}
	}

	/**
	 * Quotes text as a double-quoted Python string literal.
	 */
	static String quote(String text)
	{
		StringBuilder sb = new StringBuilder("\"");
		for(char c : text.toCharArray())
		{
			switch(c)
			{
				case '\\':
					sb.append("\\\\");
					break;
				case '"':
					sb.append("\\\"");
					break;
				case '\n':
					sb.append("\\n");
					break;
				case '\t':
					sb.append("\\t");
					break;
				case '\r':
					sb.append("\\r");
					break;
				default:
					if(c < 0x20)
					{
						sb.append(String.format("\\x%02x", (int) c));
					}
					else
					{
						sb.append(c);
					}
			}
		}
		return sb.append('"').toString();
	}

	@Override
	public String visitIdentifierExpression(IdentifierExpression expression)
	{
		return expression.getName();
	}

	@Override
	public String visitBinaryExpression(BinaryExpression expression)
	{
		BinaryOperator operator = expression.getOperator();
		int level = precedence(operator);
		String left;
		String right;
		if(operator == BinaryOperator.POWER)
		{
			left = expression(expression.getLeft(), AWAIT);
			right = expression(expression.getRight(), UNARY);
		}
		else if(operator.isComparison())
		{
			left = expression(expression.getLeft(), COMPARISON + 1);
			right = expression(expression.getRight(), COMPARISON + 1);
		}
		else
		{
			left = expression(expression.getLeft(), level);
			right = expression(expression.getRight(), level + 1);
		}
		return left + " " + operator.getSymbol() + " " + right;
	}

	@Override
	public String visitUnaryExpression(UnaryExpression expression)
	{
		if(expression.getOperator() == UnaryOperator.NOT)
		{
			return "not " + expression(expression.getOperand(), NOT);
		}
		return "-" + expression(expression.getOperand(), UNARY);
	}

	@Override
	public String visitComparisonChain(ComparisonChain expression)
	{
		List<Expression> operands = expression.getOperands();
		StringBuilder sb = new StringBuilder(expression(operands.get(0), COMPARISON + 1));
		for(int i = 0; i < expression.getOperators().size(); i++)
		{
			sb.append(' ').append(expression.getOperators().get(i).getSymbol()).append(' ')
					.append(expression(operands.get(i + 1), COMPARISON + 1));
		}
		return sb.toString();
	}

	@Override
	public String visitCallExpression(CallExpression expression)
	{
		List<String> arguments = new ArrayList<>();
		for(Expression argument : expression.getArguments())
		{
			arguments.add(argument(argument));
		}
		for(KeywordArgument keyword : expression.getKeywordArguments())
		{
			arguments.add(keyword.getName() + "=" + argument(keyword.getValue()));
		}
		return expression(expression.getCallee(), POSTFIX) + "(" + String.join(", ", arguments) + ")";
	}

	private String argument(Expression argument)
	{
		if(argument instanceof GroupingExpression)
		{
			return argument(((GroupingExpression) argument).getExpression());
		}
		return expression(argument, LAMBDA);
	}

	@Override
	public String visitAttributeExpression(AttributeExpression expression)
	{
		return expression(expression.getObject(), POSTFIX) + "." + expression.getName();
	}

	@Override
	public String visitIndexExpression(IndexExpression expression)
	{
		return expression(expression.getObject(), POSTFIX) + "[" + expression(expression.getIndex(), LAMBDA) + "]";
	}

	@Override
	public String visitListExpression(ListExpression expression)
	{
		return "[" + joined(expression.getElements()) + "]";
	}

	@Override
	public String visitDictExpression(DictExpression expression)
	{
		List<String> entries = new ArrayList<>();
		for(int i = 0; i < expression.getKeys().size(); i++)
		{
			entries.add(expression(expression.getKeys().get(i), LAMBDA) + ": " + expression(expression.getValues().get(i), LAMBDA));
		}
		return "{" + String.join(", ", entries) + "}";
	}

	@Override
	public String visitGroupingExpression(GroupingExpression expression)
	{
		return "(" + expression(expression.getExpression(), LAMBDA) + ")";
	}

	@Override
	public String visitComprehensionExpression(ComprehensionExpression expression)
	{
		StringBuilder sb = new StringBuilder("[").append(expression(expression.getElement(), OR))
				.append(" for ").append(expression.getVariable().getLexeme())
				.append(" in ").append(expression(expression.getIterable(), OR));
		if(expression.getCondition() != null)
		{
			sb.append(" if ").append(expression(expression.getCondition(), OR));
		}
		return sb.append(']').toString();
	}

	@Override
	public String visitLambdaExpression(LambdaExpression expression)
	{
		String parameters = parameters(expression.getParameters(), false);
		return (parameters.isEmpty() ? "lambda" : "lambda " + parameters) + ": " + expression(expression.getBody(), LAMBDA);
	}

	@Override
	public String visitAwaitExpression(AwaitExpression expression)
	{
		return "await " + expression(expression.getValue(), POSTFIX);
	}

	@Override
	public String visitYieldExpression(YieldExpression expression)
	{
		return expression.getValue() == null ? "yield" : "yield " + expression(expression.getValue(), LAMBDA);
	}

	private String joined(List<Expression> expressions)
	{
		List<String> rendered = new ArrayList<>();
		for(Expression expression : expressions)
		{
			rendered.add(expression(expression, LAMBDA));
		}
		return String.join(", ", rendered);
	}
}
