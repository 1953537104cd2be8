package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.DataFlow;
import co.fanki.semanticanalyzer.intent.domain.DataSource;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.Sensitivity;
import co.fanki.semanticanalyzer.intent.domain.registry.KeywordRegistry;
import co.fanki.semanticanalyzer.parsing.domain.AstQueries;
import co.fanki.semanticanalyzer.parsing.domain.AstTraversal;
import co.fanki.semanticanalyzer.parsing.domain.JsNode;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ArrayExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.AssignmentExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.AwaitExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.BinaryExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.BooleanLiteral;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Identifier;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.LogicalExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MemberExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.NumericLiteral;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ObjectExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Parameter;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ReturnStatement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.StringLiteral;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TemplateLiteral;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.TypeAnnotation;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.VariableDeclarator;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Describes the values flowing into and out of a code unit.
 *
 * <p>Inputs are the plain parameters of named functions; destructured
 * parameters are skipped. Outputs are the arguments of return
 * statements. Types come from explicit annotations or literal shapes,
 * there is no inference beyond that.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class DataFlowAnalyzer implements IntentExtractor<DataFlowAnalysis> {

    private static final String UNKNOWN = "unknown";

    private static final Pattern ARRAY_TYPE =
            Pattern.compile(".+\\[\\]|(Readonly)?Array<.+>");

    private static final Map<String, String> PRIMITIVES = Map.of(
            "string", "string",
            "number", "number",
            "boolean", "boolean",
            "object", "object");

    private final KeywordRegistry keywords;

    /**
     * Creates an analyzer.
     *
     * @param theKeywords the keyword tables, never null
     */
    public DataFlowAnalyzer(final KeywordRegistry theKeywords) {
        this.keywords = Preconditions.requireNonNull(theKeywords,
                "Keywords are required");
    }

    @Override
    public String facet() {
        return "dataFlow";
    }

    @Override
    public DataFlowAnalysis extract(final ParsedSource source,
            final AnalysisContext context) {
        final List<DataFlow> inputs = new ArrayList<>();
        for (final FunctionView function : FunctionView.all(
                source.program())) {
            if (function.isNamed()) {
                inputs.addAll(inputsOf(function));
            }
        }
        final Outputs outputs = new Outputs();
        outputs.traverse(source.program());
        return new DataFlowAnalysis(inputs, outputs.flows);
    }

    @Override
    public DataFlowAnalysis fallback() {
        return DataFlowAnalysis.empty();
    }

    /**
     * Classifies a name by the sensitivity keyword tiers, most sensitive
     * tier first.
     *
     * @param name the value name, may be null
     * @return the sensitivity, PUBLIC when nothing matches
     */
    public Sensitivity sensitivityOf(final String name) {
        if (KeywordRegistry.containsAny(name, keywords.criticalKeywords())) {
            return Sensitivity.CRITICAL;
        }
        if (KeywordRegistry.containsAny(name, keywords.sensitiveKeywords())) {
            return Sensitivity.SENSITIVE;
        }
        if (KeywordRegistry.containsAny(name, keywords.privateKeywords())) {
            return Sensitivity.PRIVATE;
        }
        return Sensitivity.PUBLIC;
    }

    // ------------------------------------------------------------------
    // Inputs
    // ------------------------------------------------------------------

    private List<DataFlow> inputsOf(final FunctionView function) {
        final List<DataFlow> flows = new ArrayList<>();
        for (final Parameter param : function.params()) {
            if (param.destructured() || param.name() == null
                    || "this".equals(param.name())) {
                continue;
            }
            flows.add(new DataFlow(param.name(),
                    parameterType(param, function.body()),
                    DataSource.PARAMETER,
                    validations(function.body(), param.name()),
                    assignments(function.body(), param.name()),
                    sensitivityOf(param.name())));
        }
        return flows;
    }

    private String parameterType(final Parameter param, final JsNode body) {
        if (param.type() != null) {
            return normalize(param.type());
        }
        if (param.rest()) {
            return "array";
        }
        final String shape = shapeOf(param.defaultValue());
        if (!UNKNOWN.equals(shape)) {
            return shape;
        }
        for (final CallExpression call : AstQueries.collect(body,
                CallExpression.class)) {
            if (call.callee() instanceof Identifier identifier
                    && identifier.name().equals(param.name())) {
                return "function";
            }
        }
        return UNKNOWN;
    }

    private List<String> validations(final JsNode body, final String name) {
        final Set<String> result = new LinkedHashSet<>();
        for (final CallExpression call : AstQueries.collect(body,
                CallExpression.class)) {
            final String target = AstQueries.calleeName(call);
            if (!KeywordRegistry.containsAny(target,
                    keywords.validationKeywords())) {
                continue;
            }
            boolean applies = call.callee() instanceof MemberExpression member
                    && AstQueries.references(member.object(), name);
            for (final JsNode argument : call.arguments()) {
                applies = applies || AstQueries.references(argument, name);
            }
            if (applies) {
                final String rendered = AstQueries.render(call.callee());
                result.add(rendered != null ? rendered : target);
            }
        }
        return List.copyOf(result);
    }

    private List<String> assignments(final JsNode body, final String name) {
        final List<String> result = new ArrayList<>();
        for (final AssignmentExpression assignment : AstQueries.collect(body,
                AssignmentExpression.class)) {
            if (assignment.left() instanceof Identifier identifier
                    && identifier.name().equals(name)) {
                result.add(describeAssignment(assignment));
            }
        }
        return result;
    }

    // ------------------------------------------------------------------
    // Outputs
    // ------------------------------------------------------------------

    /** Collects one output per return statement with an argument. */
    private final class Outputs extends AstTraversal {

        private final List<DataFlow> flows = new ArrayList<>();

        @Override
        public void visitReturnStatement(final ReturnStatement node) {
            final JsNode argument = node.argument();
            if (argument == null) {
                return;
            }
            final JsNode scope = enclosingScope();
            final String name = valueName(argument);
            flows.add(new DataFlow("return", outputType(argument, scope),
                    DataSource.INTERNAL, List.of(),
                    transformations(argument, scope, node),
                    sensitivityOf(name)));
        }

        private JsNode enclosingScope() {
            for (final JsNode ancestor : ancestors()) {
                if (FunctionView.of(ancestor) != null) {
                    return ancestor;
                }
            }
            JsNode root = null;
            for (final JsNode ancestor : ancestors()) {
                root = ancestor;
            }
            return root;
        }
    }

    private String outputType(final JsNode argument, final JsNode scope) {
        final String shape = shapeOf(argument);
        if (!UNKNOWN.equals(shape) || !(argument instanceof Identifier id)) {
            return shape;
        }
        final FunctionView function = FunctionView.of(scope);
        if (function != null) {
            for (final Parameter param : function.params()) {
                if (id.name().equals(param.name()) && param.type() != null) {
                    return normalize(param.type());
                }
            }
        }
        for (final VariableDeclarator declarator : AstQueries.collect(scope,
                VariableDeclarator.class)) {
            if (id.name().equals(declarator.name())) {
                if (declarator.type() != null) {
                    return normalize(declarator.type());
                }
                return shapeOf(declarator.init());
            }
        }
        return UNKNOWN;
    }

    private List<String> transformations(final JsNode argument,
            final JsNode scope, final ReturnStatement statement) {
        if (!(argument instanceof Identifier id)) {
            return UNKNOWN.equals(shapeOf(argument))
                    ? List.of(describe(argument)) : List.of();
        }
        final List<JsNode> steps = new ArrayList<>();
        for (final VariableDeclarator declarator : AstQueries.collect(scope,
                VariableDeclarator.class)) {
            if (id.name().equals(declarator.name())
                    && declarator.init() != null
                    && declarator.span().startsBefore(statement.span())) {
                steps.add(declarator);
            }
        }
        for (final AssignmentExpression assignment : AstQueries.collect(scope,
                AssignmentExpression.class)) {
            if (assignment.left() instanceof Identifier target
                    && id.name().equals(target.name())
                    && assignment.span().startsBefore(statement.span())) {
                steps.add(assignment);
            }
        }
        steps.sort(Comparator.comparingInt(step -> step.span().startOffset()));
        final List<String> result = new ArrayList<>();
        for (final JsNode step : steps) {
            if (step instanceof VariableDeclarator declarator) {
                result.add(describe(declarator.init()));
            } else {
                result.add(describeAssignment((AssignmentExpression) step));
            }
        }
        return result;
    }

    private static String valueName(final JsNode argument) {
        final JsNode value = argument instanceof AwaitExpression await
                ? await.argument() : argument;
        if (value instanceof Identifier identifier) {
            return identifier.name();
        }
        if (value instanceof MemberExpression member) {
            return member.property();
        }
        return null;
    }

    // ------------------------------------------------------------------
    // Shapes and descriptions
    // ------------------------------------------------------------------

    private static String describeAssignment(
            final AssignmentExpression assignment) {
        final String operator = assignment.operator();
        if (operator != null && operator.length() > 1
                && operator.endsWith("=")) {
            return operator.substring(0, operator.length() - 1)
                    + " operation";
        }
        return describe(assignment.right());
    }

    private static String describe(final JsNode node) {
        if (node instanceof AwaitExpression await) {
            return describe(await.argument());
        }
        if (node instanceof CallExpression call) {
            if (call.callee() instanceof MemberExpression member
                    && !member.computed()) {
                return member.property() + " operation";
            }
            return "function call";
        }
        if (node instanceof BinaryExpression binary) {
            return binary.operator() + " operation";
        }
        if (node instanceof LogicalExpression logical) {
            return logical.operator() + " operation";
        }
        return "transformation";
    }

    private static String shapeOf(final JsNode node) {
        if (node instanceof StringLiteral || node instanceof TemplateLiteral) {
            return "string";
        }
        if (node instanceof NumericLiteral) {
            return "number";
        }
        if (node instanceof BooleanLiteral) {
            return "boolean";
        }
        if (node instanceof ArrayExpression) {
            return "array";
        }
        if (node instanceof ObjectExpression) {
            return "object";
        }
        if (node instanceof FunctionExpression) {
            return "function";
        }
        return UNKNOWN;
    }

    private static String normalize(final TypeAnnotation annotation) {
        final String text = annotation.text().trim();
        final String primitive = PRIMITIVES.get(text);
        if (primitive != null) {
            return primitive;
        }
        if (ARRAY_TYPE.matcher(text).matches()) {
            return "array";
        }
        return text.isEmpty() ? UNKNOWN : text;
    }

}
