package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * Plain-shaped loop: "repeat N times", "repeat until C", "repeat while C" and "repeat forever".
 * Becomes a for or while loop during semantic analysis.
 */
public class RepeatStatement implements Statement
{
	public enum Mode
	{
		TIMES,
		UNTIL,
		WHILE,
		FOREVER
	}

	private final Token repeatKeyword;
	private final Mode mode;
	private final Expression operand; // count or condition; null for FOREVER
	private final BlockStatement body;

	public RepeatStatement(Token repeatKeyword, Mode mode, Expression operand, BlockStatement body)
	{
		this.repeatKeyword = repeatKeyword;
		this.mode = mode;
		this.operand = operand;
		this.body = body;
	}

	public Mode getMode()
	{
		return mode;
	}

	public Expression getOperand()
	{
		return operand;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public boolean isPlainShaped()
	{
		return true;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitRepeatStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return repeatKeyword;
	}
}
