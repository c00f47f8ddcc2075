package org.lokray.plain.ast.statements;

import org.lokray.plain.ast.ASTNode;

/**
 * Marker interface for all statement nodes in the AST.
 */
public interface Statement extends ASTNode
{
	/**
	 * Plain-shaped statements have no direct Python counterpart and must be
	 * desugared by the semantic analyzer before code generation.
	 */
	default boolean isPlainShaped()
	{
		return false;
	}
}
