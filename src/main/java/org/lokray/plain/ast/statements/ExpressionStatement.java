package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * AST node for an expression evaluated for its effect, typically a call.
 */
public class ExpressionStatement implements Statement
{
	private final Token firstToken;
	private final Expression expression;

	public ExpressionStatement(Token firstToken, Expression expression)
	{
		this.firstToken = firstToken;
		this.expression = expression;
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitExpressionStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}

	@Override
	public String toString()
	{
		return "Expr(" + expression + ")";
	}
}
