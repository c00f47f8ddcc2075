package org.lokray.plain.ast;

import org.lokray.plain.ast.expressions.*;
import org.lokray.plain.ast.statements.*;

/**
 * Interface for the Visitor design pattern, used to traverse the AST.
 * Each method corresponds to a specific type of AST node.
 *
 * @param <R> The return type of the visit methods.
 */
public interface ASTVisitor<R>
{
	R visitProgram(Program program);

	// Python-shaped statements
	R visitBlockStatement(BlockStatement statement);

	R visitAssignmentStatement(AssignmentStatement statement);

	R visitExpressionStatement(ExpressionStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitWhileStatement(WhileStatement statement);

	R visitForEachStatement(ForEachStatement statement);

	R visitFunctionDeclaration(FunctionDeclaration declaration);

	R visitClassDeclaration(ClassDeclaration declaration);

	R visitTryStatement(TryStatement statement);

	R visitWithStatement(WithStatement statement);

	R visitImportStatement(ImportStatement statement);

	R visitReturnStatement(ReturnStatement statement);

	R visitRaiseStatement(RaiseStatement statement);

	R visitPassStatement(PassStatement statement);

	R visitBreakStatement(BreakStatement statement);

	R visitContinueStatement(ContinueStatement statement);

	// Plain-shaped statements, replaced during semantic analysis
	R visitRepeatStatement(RepeatStatement statement);

	R visitUsingStatement(UsingStatement statement);

	R visitWaitStatement(WaitStatement statement);

	R visitPrintRangeStatement(PrintRangeStatement statement);

	R visitEndpointDeclaration(EndpointDeclaration declaration);

	R visitPropertyDeclaration(PropertyDeclaration declaration);

	// Expressions
	R visitLiteralExpression(LiteralExpression expression);

	R visitIdentifierExpression(IdentifierExpression expression);

	R visitBinaryExpression(BinaryExpression expression);

	R visitUnaryExpression(UnaryExpression expression);

	R visitComparisonChain(ComparisonChain expression);

	R visitCallExpression(CallExpression expression);

	R visitAttributeExpression(AttributeExpression expression);

	R visitIndexExpression(IndexExpression expression);

	R visitListExpression(ListExpression expression);

	R visitDictExpression(DictExpression expression);

	R visitGroupingExpression(GroupingExpression expression);

	R visitComprehensionExpression(ComprehensionExpression expression);

	R visitLambdaExpression(LambdaExpression expression);

	R visitAwaitExpression(AwaitExpression expression);

	R visitYieldExpression(YieldExpression expression);
}
