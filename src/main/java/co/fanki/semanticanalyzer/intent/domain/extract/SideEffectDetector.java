package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.intent.domain.SideEffect;
import co.fanki.semanticanalyzer.intent.domain.SideEffectType;
import co.fanki.semanticanalyzer.intent.domain.registry.KeywordRegistry;
import co.fanki.semanticanalyzer.parsing.domain.AstQueries;
import co.fanki.semanticanalyzer.parsing.domain.AstTraversal;
import co.fanki.semanticanalyzer.parsing.domain.JsNode;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.AssignmentExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.AwaitExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.Identifier;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.ImportDeclaration;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.MemberExpression;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.VariableDeclarator;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Finds the effects a code unit has outside its own scope: writes to a
 * store, filesystem calls, network requests, console output, global
 * mutations and asynchronous waits.
 *
 * <p>Filesystem calls are recognized on {@code fs} and on any local name
 * bound to an import or require of a filesystem module.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class SideEffectDetector implements IntentExtractor<SideEffectReport> {

    private static final String FILESYSTEM = "fs";

    private final KeywordRegistry keywords;

    /**
     * Creates a detector.
     *
     * @param theKeywords the keyword tables, never null
     */
    public SideEffectDetector(final KeywordRegistry theKeywords) {
        this.keywords = Preconditions.requireNonNull(theKeywords,
                "Keywords are required");
    }

    @Override
    public String facet() {
        return "sideEffects";
    }

    @Override
    public SideEffectReport extract(final ParsedSource source,
            final AnalysisContext context) {
        final Effects effects = new Effects(filesystemAliases(
                source.program()));
        effects.traverse(source.program());
        return new SideEffectReport(effects.found, effects.awaits);
    }

    @Override
    public SideEffectReport fallback() {
        return SideEffectReport.empty();
    }

    private Set<String> filesystemAliases(final JsNode program) {
        final Set<String> aliases = new HashSet<>();
        aliases.add(FILESYSTEM);
        for (final ImportDeclaration declaration : AstQueries.collect(program,
                ImportDeclaration.class)) {
            if (keywords.filesystemModules().contains(declaration.source())) {
                aliases.addAll(declaration.localNames());
            }
        }
        for (final VariableDeclarator declarator : AstQueries.collect(program,
                VariableDeclarator.class)) {
            if (!declarator.destructured()
                    && declarator.init() instanceof CallExpression call
                    && isRequire(call)
                    && KeywordRegistry.lists(
                            AstQueries.stringValue(call.arguments().get(0)),
                            keywords.filesystemModules())) {
                aliases.add(declarator.name());
            }
        }
        return aliases;
    }

    private static boolean isRequire(final CallExpression call) {
        return call.callee() instanceof Identifier identifier
                && "require".equals(identifier.name())
                && !call.arguments().isEmpty();
    }

    /** Collects the effects of one walk. */
    private final class Effects extends AstTraversal {

        private final Set<String> filesystem;

        private final List<SideEffect> found = new ArrayList<>();

        private int awaits;

        private Effects(final Set<String> theFilesystem) {
            this.filesystem = theFilesystem;
        }

        @Override
        public void visitCallExpression(final CallExpression node) {
            final JsNode callee = node.callee();
            final String chain = AstQueries.render(callee);

            if (callee instanceof MemberExpression member
                    && !member.computed()) {
                final String method = member.property();
                final String receiver = AstQueries.rootIdentifier(
                        member.object());
                if (KeywordRegistry.lists(method,
                        keywords.databaseWriteMethods())) {
                    found.add(SideEffect.of(SideEffectType.DATABASE, "write",
                            chain));
                }
                if (method != null && receiver != null
                        && filesystem.contains(receiver)) {
                    found.add(SideEffect.of(SideEffectType.FILE, method,
                            chain));
                }
                if (receiver != null
                        && keywords.networkClients().contains(receiver)) {
                    addRequest(node);
                }
                if (member.object() instanceof Identifier object
                        && "console".equals(object.name())
                        && KeywordRegistry.lists(method,
                                keywords.consoleMethods())) {
                    found.add(SideEffect.of(SideEffectType.CONSOLE, method,
                            "console"));
                }
            } else if (callee instanceof Identifier identifier
                    && keywords.networkClients().contains(identifier.name())) {
                addRequest(node);
            }
        }

        @Override
        public void visitAssignmentExpression(
                final AssignmentExpression node) {
            if (!(node.left() instanceof MemberExpression target)) {
                return;
            }
            final String root = AstQueries.rootIdentifier(target);
            if (root != null && keywords.globalRoots().contains(root)) {
                final String chain = AstQueries.render(target);
                found.add(SideEffect.of(SideEffectType.GLOBAL, "mutation",
                        chain != null ? chain : root));
            }
        }

        @Override
        public void visitAwaitExpression(final AwaitExpression node) {
            if (awaits == 0) {
                found.add(SideEffect.of(SideEffectType.ASYNC, "await", null));
            }
            awaits++;
        }

        private void addRequest(final CallExpression call) {
            final String url = call.arguments().isEmpty() ? null
                    : AstQueries.stringValue(call.arguments().get(0));
            found.add(SideEffect.of(SideEffectType.NETWORK, "request", url));
        }
    }

}
