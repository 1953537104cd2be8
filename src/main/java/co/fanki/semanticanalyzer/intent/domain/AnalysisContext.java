package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.parsing.domain.Dialect;

import java.util.List;
import java.util.Locale;

/**
 * What the caller knows about the code unit being analysed.
 *
 * @param fileName the file the code comes from, may be null
 * @param projectType the project type, e.g. {@code typescript}, may be
 *        null
 * @param dependencies the declared project dependencies, never null
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record AnalysisContext(
        String fileName,
        String projectType,
        List<String> dependencies
) {

    private static final AnalysisContext EMPTY =
            new AnalysisContext(null, null, List.of());

    /**
     * Creates a context. A null dependency list becomes empty.
     */
    public AnalysisContext {
        dependencies = dependencies == null ? List.of()
                : List.copyOf(dependencies);
    }

    /**
     * Returns a context without any information.
     *
     * @return the empty context
     */
    public static AnalysisContext empty() {
        return EMPTY;
    }

    /**
     * Returns a context that only knows the file name.
     *
     * @param fileName the file name
     * @return the context
     */
    public static AnalysisContext ofFileName(final String fileName) {
        return new AnalysisContext(fileName, null, List.of());
    }

    /**
     * Returns the dialect to parse the code unit with.
     *
     * @return the dialect derived from the file name and project type
     */
    public Dialect dialect() {
        return Dialect.resolve(fileName, projectType);
    }

    /**
     * Checks, ignoring case, whether the file name contains a fragment.
     *
     * @param fragment the fragment to look for
     * @return true if there is a file name and it contains the fragment
     */
    public boolean fileNameContains(final String fragment) {
        return fileName != null && fileName.toLowerCase(Locale.ROOT)
                .contains(fragment.toLowerCase(Locale.ROOT));
    }

    /**
     * Checks whether the file name marks a test.
     *
     * @return true if the file name contains {@code test} or {@code spec}
     */
    public boolean isTestFile() {
        return fileNameContains("test") || fileNameContains("spec");
    }

}
