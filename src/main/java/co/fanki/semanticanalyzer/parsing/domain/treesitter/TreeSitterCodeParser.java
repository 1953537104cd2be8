package co.fanki.semanticanalyzer.parsing.domain.treesitter;

import co.fanki.semanticanalyzer.parsing.domain.CodeParser;
import co.fanki.semanticanalyzer.parsing.domain.Dialect;
import co.fanki.semanticanalyzer.parsing.domain.ParseError;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.treesitter.TSLanguage;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterJavascript;
import org.treesitter.TreeSitterTsx;
import org.treesitter.TreeSitterTypescript;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link CodeParser} backed by the tree-sitter JavaScript, TypeScript and
 * TSX grammars.
 *
 * <p>Tree-sitter always produces a tree: syntax errors become error
 * regions and missing tokens instead of exceptions. This parser turns
 * them into diagnostics and only rejects a code unit when error regions
 * cover more than the configured share of its bytes.</p>
 *
 * <p>Native parsers are not thread safe, so each thread keeps its own
 * parser per grammar.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class TreeSitterCodeParser implements CodeParser {

    private static final Logger LOG = LoggerFactory.getLogger(
            TreeSitterCodeParser.class);

    /** Default share of error bytes above which parsing fails. */
    public static final double DEFAULT_MAX_ERROR_RATIO = 0.5;

    private final double maxErrorRatio;

    private final ThreadLocal<Map<Grammar, TSParser>> parsers =
            ThreadLocal.withInitial(() -> new EnumMap<>(Grammar.class));

    /** Creates a parser with the default error tolerance. */
    public TreeSitterCodeParser() {
        this(DEFAULT_MAX_ERROR_RATIO);
    }

    /**
     * Creates a parser.
     *
     * @param theMaxErrorRatio the share of source bytes, between 0 and 1,
     *        that error regions may cover before the input is rejected
     */
    public TreeSitterCodeParser(final double theMaxErrorRatio) {
        Preconditions.require(theMaxErrorRatio >= 0 && theMaxErrorRatio <= 1,
                "Max error ratio must be between 0 and 1");
        this.maxErrorRatio = theMaxErrorRatio;
    }

    /** {@inheritDoc} */
    @Override
    public ParsedSource parse(final String code, final Dialect dialect) {
        Preconditions.requireNonNull(code, "Code is required");
        Preconditions.requireNonNull(dialect, "Dialect is required");

        final byte[] bytes = code.getBytes(StandardCharsets.UTF_8);

        TSNode best = null;
        Grammar bestGrammar = null;
        int bestErrors = Integer.MAX_VALUE;
        for (final Grammar grammar : candidates(dialect)) {
            final TSNode root = parseWith(grammar, code);
            if (root == null) {
                continue;
            }
            final int errors = TreeSitterAstBuilder.errorCoverage(root);
            if (errors < bestErrors) {
                best = root;
                bestGrammar = grammar;
                bestErrors = errors;
            }
            if (errors == 0) {
                break;
            }
        }

        if (best == null) {
            throw new ParseError("The parser produced no syntax tree");
        }
        if (bytes.length > 0 && bestErrors > maxErrorRatio * bytes.length) {
            throw new ParseError("Syntax errors cover " + bestErrors + " of "
                    + bytes.length + " bytes, the input cannot be recovered");
        }

        final TreeSitterAstBuilder.Conversion conversion =
                new TreeSitterAstBuilder(bytes, dialect.decorators())
                        .build(best);

        LOG.debug("Parsed {} bytes with the {} grammar, {} bytes in error"
                + " regions", bytes.length, bestGrammar, bestErrors);

        return new ParsedSource(code, conversion.program(), dialect,
                conversion.diagnostics());
    }

    private TSNode parseWith(final Grammar grammar, final String code) {
        final TSParser parser = parsers.get().computeIfAbsent(grammar,
                Grammar::newParser);
        final TSTree tree;
        try {
            tree = parser.parseString(null, code);
        } catch (final RuntimeException e) {
            throw new ParseError("The " + grammar + " grammar failed to parse"
                    + " the input", e);
        }
        if (tree == null) {
            return null;
        }
        final TSNode root = tree.getRootNode();
        return root == null || root.isNull() ? null : root;
    }

    private static List<Grammar> candidates(final Dialect dialect) {
        if (dialect.typeScript() && dialect.jsx()) {
            return List.of(Grammar.TSX, Grammar.TYPESCRIPT);
        }
        if (dialect.typeScript()) {
            return List.of(Grammar.TYPESCRIPT);
        }
        return List.of(Grammar.JAVASCRIPT);
    }

    /** The grammars this parser can use. */
    enum Grammar {

        /** TypeScript without JSX. */
        TYPESCRIPT(TreeSitterTypescript::new),

        /** TypeScript with JSX. */
        TSX(TreeSitterTsx::new),

        /** JavaScript, including JSX and decorators. */
        JAVASCRIPT(TreeSitterJavascript::new);

        private final Supplier<TSLanguage> language;

        Grammar(final Supplier<TSLanguage> theLanguage) {
            this.language = theLanguage;
        }

        private TSParser newParser() {
            final TSParser parser = new TSParser();
            if (!parser.setLanguage(language.get())) {
                throw new IllegalStateException("Cannot load the " + this
                        + " grammar");
            }
            return parser;
        }
    }

}
