package org.lokray.plain.ast.expressions;

import org.lokray.plain.ast.ASTNode;

/**
 * Marker interface for all expression nodes in the AST.
 */
public interface Expression extends ASTNode
{
}
