package co.fanki.semanticanalyzer.parsing.domain.treesitter;

import co.fanki.semanticanalyzer.parsing.domain.JsNode;
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
import co.fanki.semanticanalyzer.parsing.domain.JsNode.DeclarationKind;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Decorator;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ErrorNode;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FieldDefinition;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ForKind;
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
import co.fanki.semanticanalyzer.parsing.domain.SourceSpan;
import co.fanki.semanticanalyzer.shared.Diagnostic;
import org.treesitter.TSNode;
import org.treesitter.TSPoint;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Converts a tree-sitter concrete syntax tree of the JavaScript, TypeScript
 * or TSX grammar into the {@link JsNode} tree.
 *
 * <p>Grammar nodes with a direct counterpart are mapped to it. Wrappers
 * such as expression statements and parentheses are unwrapped. Anything
 * else becomes an {@link OpaqueNode} that keeps its converted named
 * children, so calls and identifiers nested in unmodelled syntax are
 * still visible to the extractors.</p>
 *
 * <p>A builder holds per-tree state and is used for a single tree.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
final class TreeSitterAstBuilder {

    private static final String FACET = "parser";

    private static final Set<String> LOGICAL_OPERATORS =
            Set.of("&&", "||", "??");

    private static final Set<String> TYPE_DECLARATIONS = Set.of(
            "interface_declaration", "type_alias_declaration",
            "enum_declaration");

    private static final Set<String> FUNCTION_EXPRESSIONS = Set.of(
            "function_expression", "function", "generator_function",
            "arrow_function");

    private static final Set<String> CLASS_NODES = Set.of(
            "class_declaration", "class", "abstract_class_declaration");

    private static final Set<String> METHOD_NODES = Set.of(
            "method_definition", "method_signature",
            "abstract_method_signature");

    private static final Set<String> FIELD_NODES = Set.of(
            "field_definition", "public_field_definition");

    private final byte[] source;

    private final boolean keepDecorators;

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    private int errorBytes;

    private int droppedDecorators;

    private int firstDroppedDecoratorLine;

    /**
     * Creates a builder for one tree.
     *
     * @param theSource the UTF-8 bytes the tree was parsed from
     * @param theKeepDecorators false to drop decorator nodes
     */
    TreeSitterAstBuilder(final byte[] theSource,
            final boolean theKeepDecorators) {
        this.source = theSource;
        this.keepDecorators = theKeepDecorators;
    }

    /**
     * Converts the tree under the given root.
     *
     * @param root the tree-sitter root node
     * @return the conversion result, never null
     */
    Conversion build(final TSNode root) {
        collectProblems(root, false);
        final Program program = new Program(span(root), statements(root));
        if (droppedDecorators > 0) {
            diagnostics.add(Diagnostic.info(FACET, "Decorators are disabled,"
                    + " ignored " + droppedDecorators + " decorator(s)",
                    firstDroppedDecoratorLine));
        }
        return new Conversion(program, diagnostics, errorBytes);
    }

    /**
     * Measures how many source bytes a tree covers with error regions,
     * without converting it.
     *
     * @param root the tree-sitter root node
     * @return the number of bytes inside error regions
     */
    static int errorCoverage(final TSNode root) {
        final TreeSitterAstBuilder probe =
                new TreeSitterAstBuilder(new byte[0], true);
        probe.collectProblems(root, false);
        return probe.errorBytes;
    }

    // ------------------------------------------------------------------
    // Error regions and missing tokens
    // ------------------------------------------------------------------

    private void collectProblems(final TSNode node,
            final boolean insideError) {
        if (isAbsent(node)) {
            return;
        }
        final boolean error = "ERROR".equals(node.getType());
        if (node.isMissing()) {
            diagnostics.add(Diagnostic.warning(FACET,
                    "Missing '" + node.getType() + "' was inserted",
                    line(node)));
        } else if (error && !insideError) {
            errorBytes += node.getEndByte() - node.getStartByte();
            diagnostics.add(Diagnostic.warning(FACET,
                    "Recovered from a syntax error", line(node)));
        }
        if (!error && !node.hasError()) {
            return;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            collectProblems(node.getChild(i), insideError || error);
        }
    }

    // ------------------------------------------------------------------
    // Dispatch
    // ------------------------------------------------------------------

    private JsNode convert(final TSNode node) {
        if (isAbsent(node)) {
            return null;
        }
        final String type = node.getType();
        if (FUNCTION_EXPRESSIONS.contains(type)) {
            return functionExpression(node, null);
        }
        if (CLASS_NODES.contains(type)) {
            return classDeclaration(node, List.of());
        }
        if (TYPE_DECLARATIONS.contains(type)) {
            return new TypeDeclaration(span(node), type,
                    text(field(node, "name")));
        }
        return switch (type) {
            case "comment", "html_comment" ->
                    new Comment(span(node), text(node));
            case "ERROR" -> new ErrorNode(span(node), namedChildren(node));
            case "empty_statement", "hash_bang_line" -> null;
            case "import_statement" -> importStatement(node);
            case "export_statement" -> exportStatement(node);
            case "function_declaration", "generator_function_declaration" ->
                    functionDeclaration(node);
            case "lexical_declaration", "variable_declaration" ->
                    variableDeclaration(node);
            case "expression_statement", "parenthesized_expression",
                    "non_null_expression" -> firstNamed(node);
            case "statement_block" -> block(node);
            case "return_statement" ->
                    new ReturnStatement(span(node), firstNamed(node));
            case "if_statement" -> ifStatement(node);
            case "for_statement" -> forStatement(node);
            case "for_in_statement" -> forInStatement(node);
            case "while_statement" -> new WhileStatement(span(node),
                    convert(field(node, "condition")),
                    convert(field(node, "body")), false);
            case "do_statement" -> new WhileStatement(span(node),
                    convert(field(node, "condition")),
                    convert(field(node, "body")), true);
            case "switch_statement" -> switchStatement(node);
            case "try_statement" -> tryStatement(node);
            case "call_expression" -> callExpression(node);
            case "new_expression" -> new NewExpression(span(node),
                    convert(field(node, "constructor")),
                    arguments(field(node, "arguments")));
            case "member_expression" -> new MemberExpression(span(node),
                    convert(field(node, "object")),
                    text(field(node, "property")), null);
            case "subscript_expression" -> subscript(node);
            case "await_expression" ->
                    new AwaitExpression(span(node), firstNamed(node));
            case "assignment_expression" -> new AssignmentExpression(
                    span(node), "=", convert(field(node, "left")),
                    convert(field(node, "right")));
            case "augmented_assignment_expression" ->
                    new AssignmentExpression(span(node),
                            text(field(node, "operator")),
                            convert(field(node, "left")),
                            convert(field(node, "right")));
            case "binary_expression" -> binary(node);
            case "ternary_expression" -> new ConditionalExpression(
                    span(node), convert(field(node, "condition")),
                    convert(field(node, "consequence")),
                    convert(field(node, "alternative")));
            case "unary_expression", "update_expression" ->
                    new UnaryExpression(span(node),
                            text(field(node, "operator")),
                            convert(field(node, "argument")));
            case "identifier", "shorthand_property_identifier", "this",
                    "super", "undefined", "import" ->
                    new Identifier(span(node), text(node));
            case "string" -> new StringLiteral(span(node), unquote(node));
            case "template_string" -> templateString(node);
            case "number" -> new NumericLiteral(span(node), text(node));
            case "true" -> new BooleanLiteral(span(node), true);
            case "false" -> new BooleanLiteral(span(node), false);
            case "array" -> new ArrayExpression(span(node),
                    namedChildren(node));
            case "object" -> objectExpression(node);
            case "jsx_element", "jsx_self_closing_element" ->
                    jsxElement(node);
            case "decorator" -> decorator(node);
            default -> new OpaqueNode(span(node), type, namedChildren(node));
        };
    }

    // ------------------------------------------------------------------
    // Modules
    // ------------------------------------------------------------------

    private JsNode importStatement(final TSNode node) {
        final List<String> names = new ArrayList<>();
        String specifier = unquote(field(node, "source"));
        for (final TSNode child : named(node)) {
            if ("import_clause".equals(child.getType())) {
                collectImportNames(child, names);
            } else if ("import_require_clause".equals(child.getType())) {
                for (final TSNode part : named(child)) {
                    if ("identifier".equals(part.getType())) {
                        names.add(text(part));
                    } else if ("string".equals(part.getType())) {
                        specifier = unquote(part);
                    }
                }
            }
        }
        if (specifier == null) {
            return new OpaqueNode(span(node), node.getType(), List.of());
        }
        return new ImportDeclaration(span(node), specifier, names);
    }

    private void collectImportNames(final TSNode clause,
            final List<String> names) {
        for (final TSNode child : named(clause)) {
            switch (child.getType()) {
                case "identifier" -> names.add(text(child));
                case "namespace_import" -> {
                    final TSNode alias = firstNamedOfType(child,
                            "identifier");
                    if (alias != null) {
                        names.add(text(alias));
                    }
                }
                case "named_imports" -> {
                    for (final TSNode specifier : named(child)) {
                        if (!"import_specifier".equals(specifier.getType())) {
                            continue;
                        }
                        final TSNode alias = field(specifier, "alias");
                        names.add(text(alias != null ? alias
                                : field(specifier, "name")));
                    }
                }
                default -> {
                }
            }
        }
    }

    private JsNode exportStatement(final TSNode node) {
        final TSNode from = field(node, "source");
        if (from != null) {
            return new ImportDeclaration(span(node), unquote(from),
                    List.of());
        }
        final TSNode declaration = field(node, "declaration");
        if (declaration != null) {
            if (CLASS_NODES.contains(declaration.getType())) {
                return classDeclaration(declaration, decorators(node));
            }
            return convert(declaration);
        }
        return new OpaqueNode(span(node), node.getType(),
                namedChildren(node));
    }

    // ------------------------------------------------------------------
    // Classes
    // ------------------------------------------------------------------

    private ClassDeclaration classDeclaration(final TSNode node,
            final List<Decorator> inherited) {
        final List<Decorator> decorators = new ArrayList<>(inherited);
        decorators.addAll(decorators(node));

        JsNode superClass = null;
        final TSNode heritage = firstNamedOfType(node, "class_heritage");
        if (heritage != null) {
            final TSNode extendsClause = firstNamedOfType(heritage,
                    "extends_clause");
            if (extendsClause != null) {
                final TSNode value = field(extendsClause, "value");
                superClass = convert(value != null ? value
                        : firstNamedNode(extendsClause));
            } else if (firstNamedOfType(heritage, "implements_clause")
                    == null) {
                superClass = convert(firstNamedNode(heritage));
            }
        }

        final List<JsNode> members = new ArrayList<>();
        final TSNode body = field(node, "body");
        if (body != null) {
            final List<Decorator> pending = new ArrayList<>();
            for (final TSNode member : named(body)) {
                final String type = member.getType();
                if ("decorator".equals(type)) {
                    addDecorator(pending, member);
                } else if (METHOD_NODES.contains(type)) {
                    members.add(method(member, pending));
                    pending.clear();
                } else if (FIELD_NODES.contains(type)) {
                    members.add(fieldDefinition(member, pending));
                    pending.clear();
                } else {
                    addIfPresent(members, convert(member));
                }
            }
        }
        return new ClassDeclaration(span(node), text(field(node, "name")),
                superClass, decorators, members);
    }

    private MethodDefinition method(final TSNode node,
            final List<Decorator> leading) {
        final List<Decorator> decorators = new ArrayList<>(leading);
        decorators.addAll(decorators(node));
        return new MethodDefinition(span(node), text(field(node, "name")),
                parameters(field(node, "parameters")),
                typeAnnotation(field(node, "return_type")),
                block(field(node, "body")), decorators,
                hasToken(node, "static"), hasToken(node, "async"));
    }

    private FieldDefinition fieldDefinition(final TSNode node,
            final List<Decorator> leading) {
        final List<Decorator> decorators = new ArrayList<>(leading);
        decorators.addAll(decorators(node));
        TSNode name = field(node, "name");
        if (name == null) {
            name = field(node, "property");
        }
        final TSNode value = field(node, "value");
        final String fieldName = text(name);
        final JsNode converted = value != null
                && FUNCTION_EXPRESSIONS.contains(value.getType())
                ? functionExpression(value, fieldName) : convert(value);
        return new FieldDefinition(span(node), fieldName,
                typeAnnotation(field(node, "type")), converted, decorators);
    }

    private List<Decorator> decorators(final TSNode node) {
        final List<Decorator> result = new ArrayList<>();
        for (final TSNode child : named(node)) {
            if ("decorator".equals(child.getType())) {
                addDecorator(result, child);
            }
        }
        return result;
    }

    private void addDecorator(final List<Decorator> target,
            final TSNode node) {
        if (keepDecorators) {
            target.add(decorator(node));
            return;
        }
        if (droppedDecorators == 0) {
            firstDroppedDecoratorLine = line(node);
        }
        droppedDecorators++;
    }

    private Decorator decorator(final TSNode node) {
        final TSNode expression = firstNamedNode(node);
        if (expression != null
                && "call_expression".equals(expression.getType())) {
            return new Decorator(span(node),
                    decoratorName(field(expression, "function")), true,
                    arguments(field(expression, "arguments")));
        }
        return new Decorator(span(node), decoratorName(expression), false,
                List.of());
    }

    private String decoratorName(final TSNode expression) {
        if (expression == null) {
            return "";
        }
        if ("member_expression".equals(expression.getType())) {
            return text(field(expression, "property"));
        }
        return text(expression);
    }

    // ------------------------------------------------------------------
    // Functions
    // ------------------------------------------------------------------

    private FunctionDeclaration functionDeclaration(final TSNode node) {
        return new FunctionDeclaration(span(node),
                text(field(node, "name")),
                parameters(field(node, "parameters")),
                typeAnnotation(field(node, "return_type")),
                block(field(node, "body")), hasToken(node, "async"));
    }

    private FunctionExpression functionExpression(final TSNode node,
            final String boundName) {
        final boolean arrow = "arrow_function".equals(node.getType());
        final TSNode ownName = field(node, "name");
        final String name = ownName != null ? text(ownName) : boundName;

        final List<Parameter> params;
        final TSNode single = field(node, "parameter");
        if (single != null) {
            params = List.of(new Parameter(span(single), text(single),
                    false, false, null, null));
        } else {
            params = parameters(field(node, "parameters"));
        }
        return new FunctionExpression(span(node), name, params,
                typeAnnotation(field(node, "return_type")),
                convert(field(node, "body")), arrow,
                hasToken(node, "async"));
    }

    private List<Parameter> parameters(final TSNode node) {
        final List<Parameter> result = new ArrayList<>();
        if (node == null) {
            return result;
        }
        for (final TSNode child : named(node)) {
            final Parameter parameter = parameter(child);
            if (parameter != null) {
                result.add(parameter);
            }
        }
        return result;
    }

    private Parameter parameter(final TSNode node) {
        switch (node.getType()) {
            case "identifier":
                return new Parameter(span(node), text(node), false, false,
                        null, null);
            case "assignment_pattern": {
                final TSNode left = field(node, "left");
                return new Parameter(span(node), text(left),
                        !isIdentifier(left), false, null,
                        convert(field(node, "right")));
            }
            case "rest_pattern": {
                final TSNode target = firstNamedNode(node);
                return new Parameter(span(node), text(target),
                        !isIdentifier(target), true, null, null);
            }
            case "object_pattern", "array_pattern":
                return new Parameter(span(node), text(node), true, false,
                        null, null);
            case "required_parameter", "optional_parameter": {
                TSNode pattern = field(node, "pattern");
                boolean rest = false;
                if (pattern != null
                        && "rest_pattern".equals(pattern.getType())) {
                    rest = true;
                    pattern = firstNamedNode(pattern);
                }
                if (pattern == null) {
                    return null;
                }
                return new Parameter(span(node), text(pattern),
                        !isIdentifier(pattern) && !"this".equals(
                                pattern.getType()), rest,
                        typeAnnotation(field(node, "type")),
                        convert(field(node, "value")));
            }
            default:
                return null;
        }
    }

    private TypeAnnotation typeAnnotation(final TSNode node) {
        if (node == null) {
            return null;
        }
        String annotation = text(node).trim();
        if (annotation.startsWith(":")) {
            annotation = annotation.substring(1).trim();
        }
        return new TypeAnnotation(span(node), annotation);
    }

    // ------------------------------------------------------------------
    // Declarations and statements
    // ------------------------------------------------------------------

    private VariableDeclaration variableDeclaration(final TSNode node) {
        final DeclarationKind kind;
        if ("variable_declaration".equals(node.getType())) {
            kind = DeclarationKind.VAR;
        } else {
            kind = hasToken(node, "const") ? DeclarationKind.CONST
                    : DeclarationKind.LET;
        }
        final List<VariableDeclarator> declarators = new ArrayList<>();
        for (final TSNode child : named(node)) {
            if (!"variable_declarator".equals(child.getType())) {
                continue;
            }
            final TSNode name = field(child, "name");
            final TSNode value = field(child, "value");
            final String variable = text(name);
            final JsNode init = value != null
                    && FUNCTION_EXPRESSIONS.contains(value.getType())
                    ? functionExpression(value, variable) : convert(value);
            declarators.add(new VariableDeclarator(span(child), variable,
                    !isIdentifier(name), typeAnnotation(field(child, "type")),
                    init));
        }
        return new VariableDeclaration(span(node), kind, declarators);
    }

    private BlockStatement block(final TSNode node) {
        if (node == null) {
            return null;
        }
        return new BlockStatement(span(node), statements(node));
    }

    private JsNode ifStatement(final TSNode node) {
        final TSNode elseClause = field(node, "alternative");
        return new IfStatement(span(node),
                convert(field(node, "condition")),
                convert(field(node, "consequence")),
                elseClause == null ? null : firstNamed(elseClause));
    }

    private JsNode forStatement(final TSNode node) {
        final List<JsNode> head = new ArrayList<>();
        final TSNode body = field(node, "body");
        for (final TSNode child : named(node)) {
            if (!sameNode(child, body)) {
                addIfPresent(head, convert(child));
            }
        }
        return new ForStatement(span(node), ForKind.CLASSIC, head,
                convert(body));
    }

    private JsNode forInStatement(final TSNode node) {
        final List<JsNode> head = new ArrayList<>();
        addIfPresent(head, convert(field(node, "left")));
        addIfPresent(head, convert(field(node, "right")));
        final ForKind kind = hasToken(node, "of") ? ForKind.OF : ForKind.IN;
        return new ForStatement(span(node), kind, head,
                convert(field(node, "body")));
    }

    private JsNode switchStatement(final TSNode node) {
        final List<SwitchCase> cases = new ArrayList<>();
        final TSNode body = field(node, "body");
        if (body != null) {
            for (final TSNode clause : named(body)) {
                final String type = clause.getType();
                if (!"switch_case".equals(type)
                        && !"switch_default".equals(type)) {
                    continue;
                }
                final TSNode value = field(clause, "value");
                final List<JsNode> consequent = new ArrayList<>();
                for (final TSNode statement : named(clause)) {
                    if (!sameNode(statement, value)) {
                        addIfPresent(consequent, convert(statement));
                    }
                }
                cases.add(new SwitchCase(span(clause), convert(value),
                        consequent));
            }
        }
        return new SwitchStatement(span(node),
                convert(field(node, "value")), cases);
    }

    private JsNode tryStatement(final TSNode node) {
        CatchClause handler = null;
        final TSNode catchNode = field(node, "handler");
        if (catchNode != null) {
            final TSNode param = field(catchNode, "parameter");
            handler = new CatchClause(span(catchNode),
                    param == null ? null : text(param),
                    block(field(catchNode, "body")));
        }
        BlockStatement finalizer = null;
        final TSNode finallyNode = field(node, "finalizer");
        if (finallyNode != null) {
            finalizer = block(field(finallyNode, "body"));
        }
        return new TryStatement(span(node), block(field(node, "body")),
                handler, finalizer);
    }

    // ------------------------------------------------------------------
    // Expressions
    // ------------------------------------------------------------------

    private JsNode callExpression(final TSNode node) {
        final TSNode args = field(node, "arguments");
        final List<JsNode> arguments;
        if (args != null && "template_string".equals(args.getType())) {
            arguments = List.of(convert(args));
        } else {
            arguments = arguments(args);
        }
        return new CallExpression(span(node),
                convert(field(node, "function")), arguments);
    }

    private List<JsNode> arguments(final TSNode node) {
        if (node == null) {
            return List.of();
        }
        return namedChildren(node);
    }

    private JsNode subscript(final TSNode node) {
        final TSNode index = field(node, "index");
        final JsNode converted = convert(index);
        final String property = converted instanceof StringLiteral literal
                ? literal.value() : text(index);
        return new MemberExpression(span(node),
                convert(field(node, "object")), property,
                converted == null
                        ? new Identifier(SourceSpan.NONE, property)
                        : converted);
    }

    private JsNode binary(final TSNode node) {
        final String operator = text(field(node, "operator"));
        final JsNode left = convert(field(node, "left"));
        final JsNode right = convert(field(node, "right"));
        if (LOGICAL_OPERATORS.contains(operator)) {
            return new LogicalExpression(span(node), operator, left, right);
        }
        return new BinaryExpression(span(node), operator, left, right);
    }

    private JsNode templateString(final TSNode node) {
        final List<JsNode> expressions = new ArrayList<>();
        for (final TSNode child : named(node)) {
            if ("template_substitution".equals(child.getType())) {
                addIfPresent(expressions, firstNamed(child));
            }
        }
        return new TemplateLiteral(span(node), expressions);
    }

    private JsNode objectExpression(final TSNode node) {
        final List<JsNode> properties = new ArrayList<>();
        for (final TSNode child : named(node)) {
            switch (child.getType()) {
                case "pair" -> {
                    final TSNode key = field(child, "key");
                    final String name = "string".equals(key.getType())
                            ? unquote(key) : text(key);
                    final TSNode value = field(child, "value");
                    final JsNode converted = value != null
                            && FUNCTION_EXPRESSIONS.contains(value.getType())
                            ? functionExpression(value, name)
                            : convert(value);
                    properties.add(new Property(span(child), name,
                            converted, false));
                }
                case "shorthand_property_identifier" ->
                        properties.add(new Property(span(child),
                                text(child), convert(child), true));
                case "method_definition" ->
                        properties.add(method(child, List.of()));
                default -> addIfPresent(properties, convert(child));
            }
        }
        return new ObjectExpression(span(node), properties);
    }

    private JsNode jsxElement(final TSNode node) {
        TSNode tag = node;
        if ("jsx_element".equals(node.getType())) {
            final TSNode open = field(node, "open_tag");
            tag = open != null ? open : firstNamedNode(node);
        }
        final TSNode name = tag == null ? null : field(tag, "name");
        return new JsxElement(span(node), name == null ? "" : text(name),
                namedChildren(node));
    }

    // ------------------------------------------------------------------
    // Tree-sitter helpers
    // ------------------------------------------------------------------

    private List<JsNode> statements(final TSNode node) {
        return namedChildren(node);
    }

    private List<JsNode> namedChildren(final TSNode node) {
        final List<JsNode> result = new ArrayList<>();
        for (final TSNode child : named(node)) {
            if ("decorator".equals(child.getType())) {
                final List<Decorator> kept = new ArrayList<>();
                addDecorator(kept, child);
                result.addAll(kept);
            } else {
                addIfPresent(result, convert(child));
            }
        }
        return result;
    }

    private JsNode firstNamed(final TSNode node) {
        for (final TSNode child : named(node)) {
            if (!"comment".equals(child.getType())) {
                return convert(child);
            }
        }
        return null;
    }

    private static TSNode firstNamedNode(final TSNode node) {
        for (final TSNode child : named(node)) {
            if (!"comment".equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static TSNode firstNamedOfType(final TSNode node,
            final String type) {
        for (final TSNode child : named(node)) {
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    private static List<TSNode> named(final TSNode node) {
        final List<TSNode> result = new ArrayList<>();
        if (isAbsent(node)) {
            return result;
        }
        final int count = node.getNamedChildCount();
        for (int i = 0; i < count; i++) {
            final TSNode child = node.getNamedChild(i);
            if (!isAbsent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    private static TSNode field(final TSNode node, final String name) {
        if (isAbsent(node)) {
            return null;
        }
        final TSNode child = node.getChildByFieldName(name);
        return isAbsent(child) ? null : child;
    }

    private static boolean hasToken(final TSNode node, final String token) {
        for (int i = 0; i < node.getChildCount(); i++) {
            final TSNode child = node.getChild(i);
            if (!isAbsent(child) && token.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }

    private static boolean isAbsent(final TSNode node) {
        return node == null || node.isNull();
    }

    private static boolean isIdentifier(final TSNode node) {
        return node != null && "identifier".equals(node.getType());
    }

    private static boolean sameNode(final TSNode a, final TSNode b) {
        return a != null && b != null
                && a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    private static void addIfPresent(final List<? super JsNode> target,
            final JsNode node) {
        if (node != null) {
            target.add(node);
        }
    }

    private String text(final TSNode node) {
        if (isAbsent(node)) {
            return null;
        }
        final int start = Math.max(0, node.getStartByte());
        final int end = Math.min(source.length, node.getEndByte());
        if (end <= start) {
            return "";
        }
        return new String(source, start, end - start,
                StandardCharsets.UTF_8);
    }

    private String unquote(final TSNode node) {
        final String raw = text(node);
        if (raw == null) {
            return null;
        }
        if (raw.length() >= 2) {
            final char first = raw.charAt(0);
            if ((first == '\'' || first == '"' || first == '`')
                    && raw.charAt(raw.length() - 1) == first) {
                return raw.substring(1, raw.length() - 1);
            }
        }
        return raw;
    }

    private static int line(final TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    private static SourceSpan span(final TSNode node) {
        final TSPoint start = node.getStartPoint();
        final TSPoint end = node.getEndPoint();
        return new SourceSpan(start.getRow() + 1, start.getColumn(),
                end.getRow() + 1, end.getColumn(), node.getStartByte(),
                node.getEndByte());
    }

    /**
     * The converted tree with the parser findings.
     *
     * @param program the converted root
     * @param diagnostics the parser diagnostics
     * @param errorBytes the number of source bytes inside error regions
     */
    record Conversion(Program program, List<Diagnostic> diagnostics,
            int errorBytes) {

        Conversion {
            diagnostics = List.copyOf(diagnostics);
        }
    }

}
