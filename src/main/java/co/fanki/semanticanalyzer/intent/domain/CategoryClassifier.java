package co.fanki.semanticanalyzer.intent.domain;

import java.util.List;

/**
 * Assigns an {@link IntentCategory} from the purpose and patterns.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class CategoryClassifier {

    /**
     * Classifies a code unit. The first matching rule wins: security,
     * then data, business and utility.
     *
     * @param purpose the detected purpose
     * @param patterns the recognized patterns
     * @return the category, INFRASTRUCTURE when no rule matches
     */
    public IntentCategory classify(final String purpose,
            final List<String> patterns) {
        if (purpose.contains("Auth") || patterns.contains("Authentication")) {
            return IntentCategory.SECURITY;
        }
        if (mentionsAny(purpose, "Database", "Repository", "Data access")) {
            return IntentCategory.DATA;
        }
        if (mentionsAny(purpose, "Controller", "API")) {
            return IntentCategory.BUSINESS;
        }
        if (mentionsAny(purpose, "Service", "Helper", "Utility")) {
            return IntentCategory.UTILITY;
        }
        return IntentCategory.INFRASTRUCTURE;
    }

    private static boolean mentionsAny(final String purpose,
            final String... fragments) {
        for (final String fragment : fragments) {
            if (purpose.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

}
