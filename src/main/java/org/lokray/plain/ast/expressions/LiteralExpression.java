package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

import java.math.BigDecimal;

/**
 * AST node representing a literal value: a number, text, a boolean or nothing.
 */
public class LiteralExpression implements Expression
{
	public enum Kind
	{
		NUMBER,
		TEXT,
		BOOLEAN,
		NONE
	}

	private final Token token;
	private final Kind kind;
	private final Object value; // BigDecimal, String, Boolean or null

	public LiteralExpression(Token token, Kind kind, Object value)
	{
		this.token = token;
		this.kind = kind;
		this.value = value;
	}

	public static LiteralExpression number(Token token, long value)
	{
		return new LiteralExpression(token, Kind.NUMBER, BigDecimal.valueOf(value));
	}

	public static LiteralExpression text(Token token, String value)
	{
		return new LiteralExpression(token, Kind.TEXT, value);
	}

	public Kind getKind()
	{
		return kind;
	}

	public Object getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLiteralExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public String toString()
	{
		return kind == Kind.TEXT ? "\"" + value + "\"" : String.valueOf(value);
	}
}
