package co.fanki.semanticanalyzer.parsing.domain;

import co.fanki.semanticanalyzer.parsing.domain.JsNode.ArrayExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.AssignmentExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.AwaitExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.BinaryExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.BlockStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.BooleanLiteral;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CatchClause;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ClassDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Comment;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ConditionalExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Decorator;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ErrorNode;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FieldDefinition;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ForStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Identifier;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.IfStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ImportDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.JsxElement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.LogicalExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MemberExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MethodDefinition;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.NewExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.NumericLiteral;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ObjectExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.OpaqueNode;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Parameter;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Program;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Property;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ReturnStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.StringLiteral;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.SwitchCase;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.SwitchStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TemplateLiteral;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TryStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TypeAnnotation;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TypeDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.UnaryExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.VariableDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.VariableDeclarator;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.WhileStatement;

/**
 * One callback per {@link JsNode} kind, each a no-op by default.
 *
 * <p>Extractors override only the kinds they care about. Traversal order
 * and child descent are handled by {@link AstTraversal}; a visitor method
 * never needs to recurse by itself.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface JsNodeVisitor {

    default void visitProgram(final Program node) { }

    default void visitImportDeclaration(final ImportDeclaration node) { }

    default void visitClassDeclaration(final ClassDeclaration node) { }

    default void visitMethodDefinition(final MethodDefinition node) { }

    default void visitFieldDefinition(final FieldDefinition node) { }

    default void visitFunctionDeclaration(final FunctionDeclaration node) { }

    default void visitFunctionExpression(final FunctionExpression node) { }

    default void visitParameter(final Parameter node) { }

    default void visitTypeAnnotation(final TypeAnnotation node) { }

    default void visitTypeDeclaration(final TypeDeclaration node) { }

    default void visitVariableDeclaration(final VariableDeclaration node) { }

    default void visitVariableDeclarator(final VariableDeclarator node) { }

    default void visitReturnStatement(final ReturnStatement node) { }

    default void visitIfStatement(final IfStatement node) { }

    default void visitForStatement(final ForStatement node) { }

    default void visitWhileStatement(final WhileStatement node) { }

    default void visitSwitchStatement(final SwitchStatement node) { }

    default void visitSwitchCase(final SwitchCase node) { }

    default void visitTryStatement(final TryStatement node) { }

    default void visitCatchClause(final CatchClause node) { }

    default void visitBlockStatement(final BlockStatement node) { }

    default void visitIdentifier(final Identifier node) { }

    default void visitMemberExpression(final MemberExpression node) { }

    default void visitCallExpression(final CallExpression node) { }

    default void visitNewExpression(final NewExpression node) { }

    default void visitAwaitExpression(final AwaitExpression node) { }

    default void visitAssignmentExpression(
            final AssignmentExpression node) { }

    default void visitBinaryExpression(final BinaryExpression node) { }

    default void visitLogicalExpression(final LogicalExpression node) { }

    default void visitConditionalExpression(
            final ConditionalExpression node) { }

    default void visitUnaryExpression(final UnaryExpression node) { }

    default void visitStringLiteral(final StringLiteral node) { }

    default void visitTemplateLiteral(final TemplateLiteral node) { }

    default void visitNumericLiteral(final NumericLiteral node) { }

    default void visitBooleanLiteral(final BooleanLiteral node) { }

    default void visitArrayExpression(final ArrayExpression node) { }

    default void visitObjectExpression(final ObjectExpression node) { }

    default void visitProperty(final Property node) { }

    default void visitJsxElement(final JsxElement node) { }

    default void visitDecorator(final Decorator node) { }

    default void visitComment(final Comment node) { }

    default void visitErrorNode(final ErrorNode node) { }

    default void visitOpaqueNode(final OpaqueNode node) { }

}
