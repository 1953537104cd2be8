package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.AnalysisContext;
import co.fanki.semanticanalyzer.intent.domain.IntentExtractor;
import co.fanki.semanticanalyzer.parsing.domain.AstQueries;
import co.fanki.semanticanalyzer.parsing.domain.JsNode.CallExpression;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Lists what a code unit calls, e.g. {@code validate} or
 * {@code this.repo.save}, first occurrence first.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ActionExtractor implements IntentExtractor<List<String>> {

    private final int maxActions;

    /**
     * Creates an extractor.
     *
     * @param theMaxActions how many distinct actions to keep
     */
    public ActionExtractor(final int theMaxActions) {
        Preconditions.require(theMaxActions > 0,
                "Max actions must be positive");
        this.maxActions = theMaxActions;
    }

    @Override
    public String facet() {
        return "actions";
    }

    @Override
    public List<String> extract(final ParsedSource source,
            final AnalysisContext context) {
        final Set<String> actions = new LinkedHashSet<>();
        for (final CallExpression call : AstQueries.collect(source.program(),
                CallExpression.class)) {
            final String action = AstQueries.render(call.callee());
            if (action != null) {
                actions.add(action);
            }
        }
        return actions.stream().limit(maxActions).toList();
    }

    @Override
    public List<String> fallback() {
        return List.of();
    }

}
