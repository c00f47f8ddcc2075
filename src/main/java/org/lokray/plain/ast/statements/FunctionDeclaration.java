package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.Parameter;
import org.lokray.plain.ast.TypeHint;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * AST node for a function, method, constructor or generator definition.
 * The semantic analyzer completes it: it adds the receiver parameter of methods,
 * and the decorators of static and class methods.
 */
public class FunctionDeclaration implements Statement
{
	private final Token firstToken;
	private final Token name;
	private final List<Parameter> parameters;
	private final TypeHint returnHint; // optional
	private final BlockStatement body;
	private final boolean async;
	private final boolean generator;
	private final List<Expression> decorators = new ArrayList<>();
	private FunctionKind kind;

	public FunctionDeclaration(Token firstToken, Token name, FunctionKind kind, List<Parameter> parameters,
							   TypeHint returnHint, BlockStatement body, boolean async, boolean generator)
	{
		this.firstToken = firstToken;
		this.name = name;
		this.kind = kind;
		this.parameters = new ArrayList<>(parameters);
		this.returnHint = returnHint;
		this.body = body;
		this.async = async;
		this.generator = generator;
	}

	public Token getNameToken()
	{
		return name;
	}

	/**
	 * @return The Python name of the function; constructors are named {@code __init__}.
	 */
	public String getName()
	{
		return kind == FunctionKind.CONSTRUCTOR ? "__init__" : name.getLexeme();
	}

	public FunctionKind getKind()
	{
		return kind;
	}

	public void setKind(FunctionKind kind)
	{
		this.kind = kind;
	}

	public List<Parameter> getParameters()
	{
		return Collections.unmodifiableList(parameters);
	}

	public void addReceiver(Parameter receiver)
	{
		parameters.add(0, receiver);
	}

	public TypeHint getReturnHint()
	{
		return returnHint;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	public boolean isAsync()
	{
		return async;
	}

	/**
	 * @return True if declared with "define a generator".
	 */
	public boolean isGenerator()
	{
		return generator;
	}

	public List<Expression> getDecorators()
	{
		return Collections.unmodifiableList(decorators);
	}

	public void addDecorator(Expression decorator)
	{
		decorators.add(decorator);
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFunctionDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}

	@Override
	public String toString()
	{
		return (async ? "AsyncDef " : "Def ") + getName() + parameters.size() + " " + body;
	}
}
