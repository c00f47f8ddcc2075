package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

/**
 * Plain-shaped computed attribute: "create a property named area in class Square that returns self.side times self.side".
 * Inside its class it becomes a {@code @property} method; from outside, an assignment of {@code property(...)} to the class.
 */
public class PropertyDeclaration implements Statement
{
	private final Token firstToken;
	private final Token name;
	private final Token owner; // optional, from "in class C"
	private final BlockStatement body;

	public PropertyDeclaration(Token firstToken, Token name, Token owner, BlockStatement body)
	{
		this.firstToken = firstToken;
		this.name = name;
		this.owner = owner;
		this.body = body;
	}

	public Token getNameToken()
	{
		return name;
	}

	public String getName()
	{
		return name.getLexeme();
	}

	public Token getOwnerToken()
	{
		return owner;
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
		return visitor.visitPropertyDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}
}
