package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

import java.util.List;

/**
 * AST node representing a class definition with optional base classes.
 */
public class ClassDeclaration implements Statement
{
	private final Token firstToken;
	private final Token name;
	private final List<Expression> superclasses;
	private final BlockStatement body;

	public ClassDeclaration(Token firstToken, Token name, List<Expression> superclasses, BlockStatement body)
	{
		this.firstToken = firstToken;
		this.name = name;
		this.superclasses = List.copyOf(superclasses);
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

	public List<Expression> getSuperclasses()
	{
		return superclasses;
	}

	public BlockStatement getBody()
	{
		return body;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitClassDeclaration(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}
}
