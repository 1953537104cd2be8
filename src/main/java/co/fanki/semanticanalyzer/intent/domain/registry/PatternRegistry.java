package co.fanki.semanticanalyzer.intent.domain.registry;

import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Regular expressions and source markers used to recognize design
 * patterns.
 *
 * @param singleton matched against the whole source
 * @param factoryName matched against function and method names
 * @param observer matched against the whole source
 * @param repositoryClassKeyword class name fragment of a repository
 * @param builderMarkers source fragments that must all be present for a
 *        builder
 * @param middlewareMarkers source fragments of which any marks middleware
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record PatternRegistry(
        Pattern singleton,
        Pattern factoryName,
        Pattern observer,
        String repositoryClassKeyword,
        List<String> builderMarkers,
        List<String> middlewareMarkers
) {

    private static final PatternRegistry DEFAULTS = new PatternRegistry(
            Pattern.compile(
                    "getInstance|instance\\s*=\\s*new|private\\s+constructor"),
            Pattern.compile("create[A-Z]\\w*|factory|make[A-Z]\\w*"),
            Pattern.compile(
                    "addEventListener|on[A-Z]\\w*|emit|subscribe|notify"),
            "Repository",
            List.of(".with", ".build()"),
            List.of("next()", "middleware"));

    /**
     * Creates a registry, validating every entry.
     */
    public PatternRegistry {
        Preconditions.requireNonNull(singleton, "Singleton regex is required");
        Preconditions.requireNonNull(factoryName, "Factory regex is required");
        Preconditions.requireNonNull(observer, "Observer regex is required");
        Preconditions.requireNonBlank(repositoryClassKeyword,
                "Repository keyword is required");
        builderMarkers = List.copyOf(builderMarkers);
        middlewareMarkers = List.copyOf(middlewareMarkers);
    }

    /**
     * Returns the built-in patterns.
     *
     * @return the default registry
     */
    public static PatternRegistry defaults() {
        return DEFAULTS;
    }

}
