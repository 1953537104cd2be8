package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.registry.KeywordLabel;
import co.fanki.semanticanalyzer.intent.domain.registry.KeywordRegistry;
import co.fanki.semanticanalyzer.parsing.domain.AstTraversal;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ClassDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Decorator;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.FunctionDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Identifier;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.JsxElement;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MemberExpression;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;

/**
 * Labels what a code unit is for.
 *
 * <p>Every signal found in the tree appends a label, in visitation
 * order and with repetitions, and the labels are joined with
 * {@code " + "}. Without any signal the file name decides, and without a
 * file name the code is general purpose.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class PurposeDetector implements IntentExtractor<String> {

    /** Purpose of code without any recognizable signal. */
    public static final String GENERAL_PURPOSE = "General purpose code";

    /** Purpose used when detection failed. */
    public static final String UNKNOWN = "unknown";

    private static final String SEPARATOR = " + ";

    private final KeywordRegistry keywords;

    /**
     * Creates a detector.
     *
     * @param theKeywords the keyword tables, never null
     */
    public PurposeDetector(final KeywordRegistry theKeywords) {
        this.keywords = Preconditions.requireNonNull(theKeywords,
                "Keywords are required");
    }

    @Override
    public String facet() {
        return "purpose";
    }

    @Override
    public String extract(final ParsedSource source,
            final AnalysisContext context) {
        final Signals signals = new Signals();
        signals.traverse(source.program());
        if (!signals.labels.isEmpty()) {
            return String.join(SEPARATOR, signals.labels);
        }
        for (final KeywordLabel role : keywords.fileNameRoles()) {
            if (context.fileNameContains(role.keyword())) {
                return role.label();
            }
        }
        return GENERAL_PURPOSE;
    }

    @Override
    public String fallback() {
        return UNKNOWN;
    }

    /**
     * Checks whether a purpose carries information.
     *
     * @param purpose the purpose to check
     * @return false for the general and unknown purposes
     */
    public static boolean isResolved(final String purpose) {
        return purpose != null && !UNKNOWN.equals(purpose)
                && !GENERAL_PURPOSE.equals(purpose);
    }

    /** Collects the labels of one walk. */
    private final class Signals extends AstTraversal {

        private final List<String> labels = new ArrayList<>();

        @Override
        public void visitDecorator(final Decorator node) {
            if (keywords.apiDecorators().contains(node.name())) {
                labels.add("API endpoint");
            }
        }

        @Override
        public void visitCallExpression(final CallExpression node) {
            if (node.callee() instanceof MemberExpression member
                    && !member.computed()
                    && KeywordRegistry.lists(member.property(),
                            keywords.databaseMethods())) {
                labels.add("Database operation");
            }
            if (node.callee() instanceof Identifier identifier) {
                if (keywords.authFunctions().contains(identifier.name())) {
                    labels.add("Authentication");
                }
                if (KeywordRegistry.containsAny(identifier.name(),
                        keywords.validationKeywords())) {
                    labels.add("Input validation");
                }
            }
        }

        @Override
        public void visitJsxElement(final JsxElement node) {
            labels.add("UI component");
        }

        @Override
        public void visitFunctionDeclaration(final FunctionDeclaration node) {
            final String name = node.name();
            if (name != null
                    && (name.startsWith("handle") || name.startsWith("on"))) {
                labels.add("Event handler");
            }
        }

        @Override
        public void visitClassDeclaration(final ClassDeclaration node) {
            if (node.name() == null) {
                return;
            }
            for (final KeywordLabel role : keywords.classRoles()) {
                if (node.name().contains(role.keyword())) {
                    labels.add(role.label());
                }
            }
        }
    }

}
