package co.fanki.semanticanalyzer.parsing.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Closed syntax tree for JavaScript and TypeScript code units.
 *
 * <p>Each node kind is a record nested in this interface, so the set of
 * kinds is fixed at compile time. Every kind dispatches to its own method
 * in {@link JsNodeVisitor}; adding a kind means adding a visitor method,
 * and the compiler points at every place that has to learn about it.</p>
 *
 * <p>Constructs the extractors do not care about are kept as
 * {@link OpaqueNode}s so that the nodes below them are still visited.
 * Regions the parser could not make sense of become {@link ErrorNode}s
 * holding whatever could be recovered.</p>
 *
 * <p>Optional components (a missing else branch, an anonymous function
 * name, an absent type annotation) are {@code null}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public sealed interface JsNode {

    /**
     * Returns where this node sits in the source.
     *
     * @return the node span, never null
     */
    SourceSpan span();

    /**
     * Returns the direct child nodes in source order.
     *
     * @return the children, never null
     */
    List<JsNode> children();

    /**
     * Dispatches to the visitor method for this node kind.
     *
     * @param visitor the visitor, never null
     */
    void accept(JsNodeVisitor visitor);

    /** How a variable was declared. */
    enum DeclarationKind { VAR, LET, CONST }

    /** Which loop form a for statement uses. */
    enum ForKind { CLASSIC, IN, OF }

    // ------------------------------------------------------------------
    // Program and declarations
    // ------------------------------------------------------------------

    /** The root of a parsed code unit. */
    record Program(SourceSpan span, List<JsNode> body) implements JsNode {
        public Program {
            body = List.copyOf(body);
        }
        @Override
        public List<JsNode> children() {
            return body;
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitProgram(this);
        }
    }

    /**
     * An import, or a re-export that names a source module.
     *
     * @param localNames the local bindings introduced by the import
     */
    record ImportDeclaration(SourceSpan span, String source,
            List<String> localNames) implements JsNode {
        public ImportDeclaration {
            localNames = List.copyOf(localNames);
        }
        @Override
        public List<JsNode> children() {
            return List.of();
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitImportDeclaration(this);
        }
    }

    /** A class declaration or class expression. */
    record ClassDeclaration(SourceSpan span, String name, JsNode superClass,
            List<Decorator> decorators, List<JsNode> members)
            implements JsNode {
        public ClassDeclaration {
            decorators = List.copyOf(decorators);
            members = List.copyOf(members);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(decorators, superClass, members);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitClassDeclaration(this);
        }

        /**
         * Returns the methods declared directly in the class body.
         *
         * @return the methods, in source order
         */
        public List<MethodDefinition> methods() {
            final List<MethodDefinition> methods = new ArrayList<>();
            for (final JsNode member : members) {
                if (member instanceof MethodDefinition method) {
                    methods.add(method);
                }
            }
            return methods;
        }
    }

    /** A method in a class body or an object literal. */
    record MethodDefinition(SourceSpan span, String name,
            List<Parameter> params, TypeAnnotation returnType,
            BlockStatement body, List<Decorator> decorators,
            boolean isStatic, boolean async) implements JsNode {
        public MethodDefinition {
            params = List.copyOf(params);
            decorators = List.copyOf(decorators);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(decorators, params, returnType, body);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitMethodDefinition(this);
        }
    }

    /** A class field, with its optional initializer. */
    record FieldDefinition(SourceSpan span, String name, TypeAnnotation type,
            JsNode value, List<Decorator> decorators) implements JsNode {
        public FieldDefinition {
            decorators = List.copyOf(decorators);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(decorators, type, value);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitFieldDefinition(this);
        }
    }

    /** A named function declaration. */
    record FunctionDeclaration(SourceSpan span, String name,
            List<Parameter> params, TypeAnnotation returnType,
            BlockStatement body, boolean async) implements JsNode {
        public FunctionDeclaration {
            params = List.copyOf(params);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(params, returnType, body);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitFunctionDeclaration(this);
        }
    }

    /**
     * A function or arrow function used as an expression.
     *
     * @param body a block, or the expression of a concise arrow body
     */
    record FunctionExpression(SourceSpan span, String name,
            List<Parameter> params, TypeAnnotation returnType, JsNode body,
            boolean arrow, boolean async) implements JsNode {
        public FunctionExpression {
            params = List.copyOf(params);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(params, returnType, body);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitFunctionExpression(this);
        }
    }

    /**
     * A formal parameter.
     *
     * @param name the bound identifier, or the pattern text when
     *             destructured
     */
    record Parameter(SourceSpan span, String name, boolean destructured,
            boolean rest, TypeAnnotation type, JsNode defaultValue)
            implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(type, defaultValue);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitParameter(this);
        }
    }

    /**
     * An explicit type annotation.
     *
     * @param text the annotated type without the leading colon
     */
    record TypeAnnotation(SourceSpan span, String text) implements JsNode {
        @Override
        public List<JsNode> children() {
            return List.of();
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitTypeAnnotation(this);
        }
    }

    /**
     * A type-only declaration: interface, type alias or enum.
     *
     * @param kind the declaration keyword
     */
    record TypeDeclaration(SourceSpan span, String kind, String name)
            implements JsNode {
        @Override
        public List<JsNode> children() {
            return List.of();
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitTypeDeclaration(this);
        }
    }

    /** A var, let or const statement. */
    record VariableDeclaration(SourceSpan span, DeclarationKind kind,
            List<VariableDeclarator> declarators) implements JsNode {
        public VariableDeclaration {
            declarators = List.copyOf(declarators);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(declarators);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitVariableDeclaration(this);
        }
    }

    /**
     * A single binding of a variable declaration.
     *
     * @param name the bound identifier, or the pattern text when
     *             destructured
     */
    record VariableDeclarator(SourceSpan span, String name,
            boolean destructured, TypeAnnotation type, JsNode init)
            implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(type, init);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitVariableDeclarator(this);
        }
    }

    // ------------------------------------------------------------------
    // Statements
    // ------------------------------------------------------------------

    /** A return statement; the argument is null for a bare return. */
    record ReturnStatement(SourceSpan span, JsNode argument)
            implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(argument);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitReturnStatement(this);
        }
    }

    /** An if statement; the alternate is null without an else. */
    record IfStatement(SourceSpan span, JsNode test, JsNode consequent,
            JsNode alternate) implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(test, consequent, alternate);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitIfStatement(this);
        }
    }

    /**
     * Any for loop.
     *
     * @param head the initializer, condition and update, or the left and
     *             right sides of a for-in/for-of
     */
    record ForStatement(SourceSpan span, ForKind kind, List<JsNode> head,
            JsNode body) implements JsNode {
        public ForStatement {
            head = List.copyOf(head);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(head, body);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitForStatement(this);
        }
    }

    /** A while or do-while loop. */
    record WhileStatement(SourceSpan span, JsNode test, JsNode body,
            boolean doWhile) implements JsNode {
        @Override
        public List<JsNode> children() {
            return doWhile ? JsNode.nodes(body, test) : JsNode.nodes(test, body);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitWhileStatement(this);
        }
    }

    /** A switch statement. */
    record SwitchStatement(SourceSpan span, JsNode discriminant,
            List<SwitchCase> cases) implements JsNode {
        public SwitchStatement {
            cases = List.copyOf(cases);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(discriminant, cases);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitSwitchStatement(this);
        }
    }

    /** A case clause; the test is null for the default clause. */
    record SwitchCase(SourceSpan span, JsNode test, List<JsNode> consequent)
            implements JsNode {
        public SwitchCase {
            consequent = List.copyOf(consequent);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(test, consequent);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitSwitchCase(this);
        }

        /**
         * Checks whether this is the default clause.
         *
         * @return true for {@code default:}
         */
        public boolean isDefault() {
            return test == null;
        }
    }

    /** A try statement with optional catch and finally parts. */
    record TryStatement(SourceSpan span, BlockStatement block,
            CatchClause handler, BlockStatement finalizer)
            implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(block, handler, finalizer);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitTryStatement(this);
        }
    }

    /** A catch clause; the parameter is null for {@code catch {}}. */
    record CatchClause(SourceSpan span, String param, BlockStatement body)
            implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(body);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitCatchClause(this);
        }
    }

    /** A braced statement list. */
    record BlockStatement(SourceSpan span, List<JsNode> body)
            implements JsNode {
        public BlockStatement {
            body = List.copyOf(body);
        }
        @Override
        public List<JsNode> children() {
            return body;
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitBlockStatement(this);
        }
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    /** A reference to a name; {@code this} and {@code super} included. */
    record Identifier(SourceSpan span, String name) implements JsNode {
        @Override
        public List<JsNode> children() {
            return List.of();
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitIdentifier(this);
        }
    }

    /**
     * A property access.
     *
     * @param property the property name, or the index text when computed
     * @param index the index expression of {@code a[b]}, null otherwise
     */
    record MemberExpression(SourceSpan span, JsNode object, String property,
            JsNode index) implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(object, index);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitMemberExpression(this);
        }

        /**
         * Checks whether this is a {@code a[b]} access.
         *
         * @return true when the property is computed
         */
        public boolean computed() {
            return index != null;
        }
    }

    /** A function or method call. */
    record CallExpression(SourceSpan span, JsNode callee,
            List<JsNode> arguments) implements JsNode {
        public CallExpression {
            arguments = List.copyOf(arguments);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(callee, arguments);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitCallExpression(this);
        }
    }

    /** A constructor call. */
    record NewExpression(SourceSpan span, JsNode callee,
            List<JsNode> arguments) implements JsNode {
        public NewExpression {
            arguments = List.copyOf(arguments);
        }
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(callee, arguments);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitNewExpression(this);
        }
    }

    /** An await expression. */
    record AwaitExpression(SourceSpan span, JsNode argument)
            implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(argument);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitAwaitExpression(this);
        }
    }

    /** A plain or compound assignment. */
    record AssignmentExpression(SourceSpan span, String operator,
            JsNode left, JsNode right) implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(left, right);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitAssignmentExpression(this);
        }
    }

    /** An arithmetic, comparison or bitwise binary expression. */
    record BinaryExpression(SourceSpan span, String operator, JsNode left,
            JsNode right) implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(left, right);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitBinaryExpression(this);
        }
    }

    /** A short-circuit expression: {@code &&}, {@code ||} or {@code ??}. */
    record LogicalExpression(SourceSpan span, String operator, JsNode left,
            JsNode right) implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(left, right);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitLogicalExpression(this);
        }
    }

    /** A ternary expression. */
    record ConditionalExpression(SourceSpan span, JsNode test,
            JsNode consequent, JsNode alternate) implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(test, consequent, alternate);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitConditionalExpression(this);
        }
    }

    /** A prefix unary expression such as {@code -x} or {@code typeof x}. */
    record UnaryExpression(SourceSpan span, String operator, JsNode argument)
            implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(argument);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitUnaryExpression(this);
        }
    }

    /** A quoted string; the value has the quotes removed. */
    record StringLiteral(SourceSpan span, String value) implements JsNode {
        @Override
        public List<JsNode> children() {
            return List.of();
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitStringLiteral(this);
        }
    }

    /** A template string and the expressions substituted into it. */
    record TemplateLiteral(SourceSpan span, List<JsNode> expressions)
            implements JsNode {
        public TemplateLiteral {
            expressions = List.copyOf(expressions);
        }
        @Override
        public List<JsNode> children() {
            return expressions;
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitTemplateLiteral(this);
        }
    }

    /**
     * A numeric literal.
     *
     * @param raw the literal as written, e.g. {@code 0x1F} or {@code 1_000}
     */
    record NumericLiteral(SourceSpan span, String raw) implements JsNode {
        @Override
        public List<JsNode> children() {
            return List.of();
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitNumericLiteral(this);
        }
    }

    /** {@code true} or {@code false}. */
    record BooleanLiteral(SourceSpan span, boolean value) implements JsNode {
        @Override
        public List<JsNode> children() {
            return List.of();
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitBooleanLiteral(this);
        }
    }

    /** An array literal. */
    record ArrayExpression(SourceSpan span, List<JsNode> elements)
            implements JsNode {
        public ArrayExpression {
            elements = List.copyOf(elements);
        }
        @Override
        public List<JsNode> children() {
            return elements;
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitArrayExpression(this);
        }
    }

    /** An object literal. */
    record ObjectExpression(SourceSpan span, List<JsNode> properties)
            implements JsNode {
        public ObjectExpression {
            properties = List.copyOf(properties);
        }
        @Override
        public List<JsNode> children() {
            return properties;
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitObjectExpression(this);
        }
    }

    /**
     * A key/value pair of an object literal.
     *
     * @param value for shorthand properties, the referenced identifier
     */
    record Property(SourceSpan span, String key, JsNode value,
            boolean shorthand) implements JsNode {
        @Override
        public List<JsNode> children() {
            return JsNode.nodes(value);
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitProperty(this);
        }
    }

    /**
     * A JSX element, self-closing or not.
     *
     * @param content the attribute values and nested content
     */
    record JsxElement(SourceSpan span, String tagName, List<JsNode> content)
            implements JsNode {
        public JsxElement {
            content = List.copyOf(content);
        }
        @Override
        public List<JsNode> children() {
            return content;
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitJsxElement(this);
        }
    }

    /**
     * A decorator.
     *
     * @param name the decorator name, e.g. {@code Get} for
     *             {@code @Get('/users')}
     * @param invoked whether the decorator is called with arguments
     */
    record Decorator(SourceSpan span, String name, boolean invoked,
            List<JsNode> arguments) implements JsNode {
        public Decorator {
            arguments = List.copyOf(arguments);
        }
        @Override
        public List<JsNode> children() {
            return arguments;
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitDecorator(this);
        }
    }

    // ------------------------------------------------------------------
    // Trivia and recovery
    // ------------------------------------------------------------------

    /** A line or block comment. */
    record Comment(SourceSpan span, String text) implements JsNode {
        @Override
        public List<JsNode> children() {
            return List.of();
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitComment(this);
        }
    }

    /** A region the parser could not parse, with recovered sub-trees. */
    record ErrorNode(SourceSpan span, List<JsNode> recovered)
            implements JsNode {
        public ErrorNode {
            recovered = List.copyOf(recovered);
        }
        @Override
        public List<JsNode> children() {
            return recovered;
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitErrorNode(this);
        }
    }

    /**
     * Any construct without a dedicated kind.
     *
     * @param syntaxType the parser's name for the construct
     */
    record OpaqueNode(SourceSpan span, String syntaxType,
            List<JsNode> content) implements JsNode {
        public OpaqueNode {
            content = List.copyOf(content);
        }
        @Override
        public List<JsNode> children() {
            return content;
        }
        @Override
        public void accept(final JsNodeVisitor visitor) {
            visitor.visitOpaqueNode(this);
        }
    }

    /**
     * Flattens nodes and node lists into a child list, skipping nulls.
     *
     * @param parts nodes, lists of nodes or nulls
     * @return the flattened, unmodifiable list
     */
    private static List<JsNode> nodes(final Object... parts) {
        final List<JsNode> result = new ArrayList<>();
        for (final Object part : parts) {
            if (part instanceof JsNode node) {
                result.add(node);
            } else if (part instanceof List<?> list) {
                for (final Object element : list) {
                    if (element instanceof JsNode node) {
                        result.add(node);
                    }
                }
            }
        }
        return Collections.unmodifiableList(result);
    }

}
