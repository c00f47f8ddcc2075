package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTVisitor;
import org.lokray.plain.ast.TypeHint;
import org.lokray.plain.ast.expressions.BinaryOperator;
import org.lokray.plain.ast.expressions.Expression;
import org.lokray.plain.lexer.Token;

/**
 * AST node for {@code target = value}, {@code target: hint = value} and augmented forms such as {@code target += value}.
 */
public class AssignmentStatement implements Statement
{
	private final Token firstToken;
	private final Expression target;
	private final TypeHint typeHint;           // optional
	private final BinaryOperator augmentedOperator; // null for plain assignment
	private final Expression value;

	public AssignmentStatement(Token firstToken, Expression target, TypeHint typeHint, BinaryOperator augmentedOperator, Expression value)
	{
		this.firstToken = firstToken;
		this.target = target;
		this.typeHint = typeHint;
		this.augmentedOperator = augmentedOperator;
		this.value = value;
	}

	public AssignmentStatement(Token firstToken, Expression target, Expression value)
	{
		this(firstToken, target, null, null, value);
	}

	public Expression getTarget()
	{
		return target;
	}

	public TypeHint getTypeHint()
	{
		return typeHint;
	}

	public BinaryOperator getAugmentedOperator()
	{
		return augmentedOperator;
	}

	public boolean isAugmented()
	{
		return augmentedOperator != null;
	}

	public Expression getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentStatement(this);
	}

	@Override
	public Token getFirstToken()
	{
		return firstToken;
	}

	@Override
	public String toString()
	{
		return "Assign(" + target + (isAugmented() ? " " + augmentedOperator.getSymbol() + "= " : " = ") + value + ")";
	}
}
