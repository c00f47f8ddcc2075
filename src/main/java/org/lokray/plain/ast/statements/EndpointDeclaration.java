package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.lexer.Token;

/**
 * Plain-shaped web endpoint: "create an api endpoint at "/users" that gets and returns users".
 * Becomes a Flask route function.
 */
public class EndpointDeclaration implements Statement
{
	private final Token firstToken;
	private final Token path;
	private final String method; // HTTP method, upper case
	private final boolean async;
	private final BlockStatement body;

	public EndpointDeclaration(Token firstToken, Token path, String method, boolean async, BlockStatement body)
	{
		this.firstToken = firstToken;
		this.path = path;
		this.method = method;
		this.async = async;
		this.body = body;
	}

	public Token getPathToken()
	{
		return path;
	}

	public String getPath()
	{
		return (String) path.getLiteral();
	}

	public String getMethod()
	{
		return method;
	}

	public boolean isAsync()
	{
		return async;
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
		return visitor.visitEndpointDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}
}
