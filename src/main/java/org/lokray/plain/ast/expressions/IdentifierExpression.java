package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;
import org.lokray.plain.semantics.Symbol;

/**
 * AST node representing a name. Library names introduced by the compiler itself
 * (for example {@code time} in a pause) are marked synthetic and always resolve through the import table.
 */
public class IdentifierExpression implements Expression
{
	private final Token token;
	private final String name;
	private final boolean synthetic;
	private Symbol symbol; // set by the semantic analyzer

	public IdentifierExpression(Token token)
	{
		this(token, token.getLexeme(), false);
	}

	public IdentifierExpression(Token token, String name, boolean synthetic)
	{
		this.token = token;
		this.name = name;
		this.synthetic = synthetic;
	}

	/**
	 * Creates a compiler-introduced library name positioned at {@code at}.
	 */
	public static IdentifierExpression library(Token at, String name)
	{
		return new IdentifierExpression(at, name, true);
	}

	public String getName()
	{
		return name;
	}

	public boolean isSynthetic()
	{
		return synthetic;
	}

	public Symbol getSymbol()
	{
		return symbol;
	}

	public void setSymbol(Symbol symbol)
	{
		this.symbol = symbol;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIdentifierExpression(this);
	}

	@Override
	public Token getFirstToken()
	{
		return token;
	}

	@Override
	public String toString()
	{
		return name;
	}
}
