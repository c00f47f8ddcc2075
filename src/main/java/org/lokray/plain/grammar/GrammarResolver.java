package org.lokray.plain.grammar;

import org.lokray.plain.lexer.Token;
import org.lokray.plain.lexer.TokenType;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Maps upcoming token windows to productions. Holds three rule tables: statement openers,
 * operator phrases and expression forms. Every table prefers the longest matching pattern,
 * so "wait for" wins over "wait" and "is greater than or equal to" over "is".
 */
public class GrammarResolver
{
	private final RuleTable<Production> statements;
	private final RuleTable<Operator> operators;
	private final RuleTable<ExpressionForm> expressionForms;
	private final Vocabulary vocabulary;

	public GrammarResolver(RuleTable<Production> statements, RuleTable<Operator> operators, RuleTable<ExpressionForm> expressionForms)
	{
		this.statements = statements;
		this.operators = operators;
		this.expressionForms = expressionForms;
		this.vocabulary = new Vocabulary(headWords(statements));
	}

	/**
	 * Creates a resolver with the full Plain grammar.
	 */
	public static GrammarResolver standard()
	{
		return new GrammarResolver(statementRules(), operatorRules(), expressionFormRules());
	}

	public Optional<RuleMatch<Production>> resolveStatement(TokenWindow window)
	{
		return statements.resolve(window, vocabulary);
	}

	public Optional<RuleMatch<Operator>> resolveOperator(TokenWindow window)
	{
		return operators.resolve(window, vocabulary);
	}

	public Optional<RuleMatch<ExpressionForm>> resolveExpressionForm(TokenWindow window)
	{
		return expressionForms.resolve(window, vocabulary);
	}

	/**
	 * Suggests the statement phrase closest to an unmatched line.
	 */
	public String suggestStatement(List<Token> window)
	{
		List<String> words = new ArrayList<>();
		for(Token token : window)
		{
			if(token.getType() != TokenType.WORD)
			{
				break;
			}
			words.add(token.normalized());
		}
		return statements.suggest(words);
	}

	public Vocabulary getVocabulary()
	{
		return vocabulary;
	}

	public RuleTable<Production> getStatements()
	{
		return statements;
	}

	private static Set<String> headWords(RuleTable<Production> table)
	{
		Set<String> heads = new HashSet<>();
		for(GrammarRule<Production> rule : table.getRules())
		{
			heads.addAll(rule.getElements().get(0).getWords());
		}
		return heads;
	}

	static RuleTable<Production> statementRules()
	{
		return new RuleTable<Production>()
				// declarations and assignment
				.add("let", Production.LET)
				.add("set", Production.SET)
				.add("<name> =", Production.ASSIGN)
				.add("create|make a|an variable called|named", Production.CREATE_VARIABLE)
				.add("create|make variable called|named", Production.CREATE_VARIABLE)
				.add("create|make a|an list called|named", Production.CREATE_LIST)
				.add("create|make an empty list called|named", Production.CREATE_LIST)
				.add("create|make a|an dictionary|dict|map called|named", Production.CREATE_DICTIONARY)
				.add("create|make an empty dictionary|dict|map called|named", Production.CREATE_DICTIONARY)
				.add("increase|increment", Production.INCREASE)
				.add("decrease|decrement", Production.DECREASE)
				.add("multiply", Production.MULTIPLY)
				.add("divide", Production.DIVIDE)
				.add("add|append|push", Production.APPEND)
				.add("prepend", Production.PREPEND)
				.add("remove|delete", Production.REMOVE)
				.add("pop", Production.POP)
				.add("pop from", Production.POP)
				.add("pop the last item from", Production.POP)
				.add("sort", Production.SORT)
				.add("reverse", Production.REVERSE)
				.add("clear", Production.CLEAR)
				.add("decorate", Production.DECORATE)
				// output
				.add("say|print|show|display|tell|echo", Production.SAY)
				.add("print|show|display numbers from", Production.PRINT_NUMBERS)
				.add("log", Production.LOG)
				// control flow
				.add("if", Production.IF)
				.add("otherwise|else if", Production.ELSE_IF)
				.add("elif", Production.ELSE_IF)
				.add("otherwise|else", Production.ELSE)
				.add("while", Production.WHILE)
				.add("for each|every", Production.FOR_EACH)
				.add("repeat", Production.REPEAT_TIMES)
				.add("repeat until", Production.REPEAT_UNTIL)
				.add("repeat while", Production.REPEAT_WHILE)
				.add("repeat forever", Production.REPEAT_FOREVER)
				.add("break", Production.BREAK)
				.add("stop|exit|leave the loop", Production.BREAK)
				.add("continue|skip", Production.CONTINUE)
				.add("skip to the next", Production.CONTINUE)
				.add("pass", Production.PASS)
				.add("do nothing", Production.PASS)
				.add("return", Production.RETURN)
				.add("give|send back", Production.RETURN)
				.add("yield|produce", Production.YIELD)
				.add("exit|quit", Production.EXIT)
				.add("stop|end|exit the program", Production.EXIT)
				// definitions
				.add("define|create|make a|an function called|named", Production.DEFINE_FUNCTION)
				.add("define|create|make function called|named", Production.DEFINE_FUNCTION)
				.add("asynchronously define|create|make a|an function called|named", Production.DEFINE_ASYNC_FUNCTION)
				.add("define|create|make a|an async|asynchronous function called|named", Production.DEFINE_ASYNC_FUNCTION)
				.add("define|create|make a|an generator called|named", Production.DEFINE_GENERATOR)
				.add("define|create|make a|an method called|named", Production.DEFINE_METHOD)
				.add("define|create|make a|an async|asynchronous method called|named", Production.DEFINE_ASYNC_METHOD)
				.add("define|create|make a|an static method called|named", Production.DEFINE_STATIC_METHOD)
				.add("define|create|make a|an class method called|named", Production.DEFINE_CLASS_METHOD)
				.add("define|create the constructor", Production.DEFINE_CONSTRUCTOR)
				.add("when created", Production.DEFINE_CONSTRUCTOR)
				.add("define|create|make a|an property called|named", Production.DEFINE_PROPERTY)
				.add("define|create|make a|an class called|named", Production.DEFINE_CLASS)
				.add("create|define a|an api endpoint at", Production.API_ENDPOINT)
				.add("create|define a|an async|asynchronous api endpoint at", Production.ASYNC_API_ENDPOINT)
				// exceptions
				.add("try|attempt", Production.TRY)
				.add("if something|anything goes wrong", Production.CATCH)
				.add("catch|except", Production.CATCH)
				.add("on error", Production.CATCH)
				.add("finally", Production.FINALLY)
				.add("no matter what", Production.FINALLY)
				.add("in any case", Production.FINALLY)
				.add("raise|throw", Production.RAISE)
				.add("fail with", Production.FAIL)
				// resources and concurrency
				.add("using|with", Production.USING)
				.add("wait|sleep|pause|delay", Production.WAIT)
				.add("wait for", Production.WAIT_FOR)
				.add("await", Production.WAIT_FOR)
				// imports
				.add("import", Production.IMPORT)
				.add("use", Production.USE)
				.add("from", Production.FROM_IMPORT)
				// calls
				.add("call|run|execute", Production.CALL)
				.add("<name> with", Production.CALL_WITH)
				.add("<name> (", Production.EXPRESSION)
				.add("<name> .", Production.EXPRESSION)
				.add("<name> [", Production.EXPRESSION);
	}

	static RuleTable<Operator> operatorRules()
	{
		return new RuleTable<Operator>()
				.add("or", Operator.OR)
				.add("and", Operator.AND)
				.add("is greater than or equal to", Operator.GREATER_EQUAL)
				.add("is at least", Operator.GREATER_EQUAL)
				.add("is no less than", Operator.GREATER_EQUAL)
				.add("is not less than", Operator.GREATER_EQUAL)
				.add("is less than or equal to", Operator.LESS_EQUAL)
				.add("is at most", Operator.LESS_EQUAL)
				.add("is no more than", Operator.LESS_EQUAL)
				.add("is not greater than", Operator.LESS_EQUAL)
				.add("is greater|bigger|larger|more than", Operator.GREATER)
				.add("is less|smaller|fewer than", Operator.LESS)
				.add("is not equal to", Operator.NOT_EQUAL)
				.add("does not equal", Operator.NOT_EQUAL)
				.add("doesn't equal", Operator.NOT_EQUAL)
				.add("is equal to", Operator.EQUAL)
				.add("equals", Operator.EQUAL)
				.add("is the same as", Operator.EQUAL)
				.add("is not in", Operator.NOT_IN)
				.add("is in", Operator.IN)
				.add("is not empty", Operator.IS_NOT_EMPTY)
				.add("is empty", Operator.IS_EMPTY)
				.add("is between", Operator.BETWEEN)
				.add("is a|an", Operator.IS_INSTANCE)
				.add("is longer than", Operator.LONGER)
				.add("is shorter than", Operator.SHORTER)
				.add("is as long as", Operator.SAME_LENGTH)
				.add("has the same length as", Operator.SAME_LENGTH)
				.add("is not", Operator.NOT_EQUAL)
				.add("is", Operator.EQUAL)
				.add("contains|has", Operator.CONTAINS)
				.add("does not contain|have", Operator.NOT_CONTAINS)
				.add("doesn't contain|have", Operator.NOT_CONTAINS)
				.add("starts|begins with", Operator.STARTS_WITH)
				.add("ends with", Operator.ENDS_WITH)
				.add(">=", Operator.GREATER_EQUAL)
				.add("<=", Operator.LESS_EQUAL)
				.add(">", Operator.GREATER)
				.add("<", Operator.LESS)
				.add("==", Operator.EQUAL)
				.add("!=", Operator.NOT_EQUAL)
				.add("plus", Operator.ADD)
				.add("+", Operator.ADD)
				.add("minus", Operator.SUBTRACT)
				.add("-", Operator.SUBTRACT)
				.add("times", Operator.MULTIPLY)
				.add("multiplied by", Operator.MULTIPLY)
				.add("*", Operator.MULTIPLY)
				.add("divided by", Operator.DIVIDE)
				.add("/", Operator.DIVIDE)
				.add("mod|modulo", Operator.MODULO)
				.add("%", Operator.MODULO)
				.add("to the power of", Operator.POWER)
				.add("raised to the power of", Operator.POWER)
				.add("**", Operator.POWER);
	}

	static RuleTable<ExpressionForm> expressionFormRules()
	{
		return new RuleTable<ExpressionForm>()
				.add("the length|size of", ExpressionForm.LENGTH)
				.add("length|size of", ExpressionForm.LENGTH)
				.add("the number of items in", ExpressionForm.LENGTH)
				.add("the sum|total of", ExpressionForm.SUM)
				.add("sum|total of", ExpressionForm.SUM)
				.add("the average|mean of", ExpressionForm.AVERAGE)
				.add("average|mean of", ExpressionForm.AVERAGE)
				.add("the maximum|largest|biggest of", ExpressionForm.MAXIMUM)
				.add("maximum|max of", ExpressionForm.MAXIMUM)
				.add("the minimum|smallest of", ExpressionForm.MINIMUM)
				.add("minimum|min of", ExpressionForm.MINIMUM)
				.add("the square root of", ExpressionForm.SQUARE_ROOT)
				.add("square root of", ExpressionForm.SQUARE_ROOT)
				.add("the absolute value of", ExpressionForm.ABSOLUTE_VALUE)
				.add("rounded", ExpressionForm.ROUNDED)
				.add("uppercase", ExpressionForm.UPPERCASE)
				.add("lowercase", ExpressionForm.LOWERCASE)
				.add("trimmed", ExpressionForm.TRIMMED)
				.add("a random number between", ExpressionForm.RANDOM_NUMBER)
				.add("a random item|choice|element from", ExpressionForm.RANDOM_CHOICE)
				.add("the current time|date", ExpressionForm.CURRENT_TIME)
				.add("the current date and time", ExpressionForm.CURRENT_TIME)
				.add("ask", ExpressionForm.ASK)
				.add("ask for", ExpressionForm.ASK)
				.add("a|an new", ExpressionForm.NEW_INSTANCE)
				.add("new", ExpressionForm.NEW_INSTANCE)
				.add("call|calling", ExpressionForm.CALL)
				.add("the result of calling", ExpressionForm.CALL)
				.add("the|a list of", ExpressionForm.COMPREHENSION)
				.add("a function that takes", ExpressionForm.LAMBDA)
				.add("open file", ExpressionForm.OPEN_FILE)
				.add("the contents of file", ExpressionForm.READ_FILE)
				.add("read file", ExpressionForm.READ_FILE)
				.add("wait for", ExpressionForm.AWAIT)
				.add("await", ExpressionForm.AWAIT);
	}
}
