package org.lokray.plain.ast;

import org.lokray.plain.lexer.Token;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * All elements that form the structured representation of a Plain program
 * will implement this interface.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);

	/**
	 * Gets the first token associated with this AST node. Diagnostics and the line map use its position.
	 *
	 * @return The first token of the node.
	 */
	Token getFirstToken();
}
