package co.fanki.semanticanalyzer.parsing.domain;

import java.util.Locale;

/**
 * Syntax flags a code unit is parsed with.
 *
 * @param typeScript whether TypeScript syntax is accepted
 * @param jsx whether JSX elements are accepted
 * @param decorators whether decorators are kept in the tree
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Dialect(boolean typeScript, boolean jsx, boolean decorators) {

    private static final Dialect ALL = new Dialect(true, true, true);

    private static final Dialect TYPESCRIPT = new Dialect(true, false, true);

    private static final Dialect JAVASCRIPT = new Dialect(false, true, true);

    /**
     * Returns the dialect with every flag enabled.
     *
     * @return TypeScript, JSX and decorators
     */
    public static Dialect all() {
        return ALL;
    }

    /**
     * Derives the dialect from a file name extension.
     *
     * @param fileName the file name, may be null
     * @return the dialect for the extension, or {@link #all()} when the
     *         extension is unknown
     */
    public static Dialect forFileName(final String fileName) {
        final Dialect byExtension = byExtension(fileName);
        return byExtension == null ? ALL : byExtension;
    }

    /**
     * Derives the dialect from a file name and a project type.
     *
     * <p>The extension wins. Without a known extension a project type of
     * {@code javascript} turns TypeScript off.</p>
     *
     * @param fileName the file name, may be null
     * @param projectType the project type, may be null
     * @return the resolved dialect, never null
     */
    public static Dialect resolve(final String fileName,
            final String projectType) {
        final Dialect byExtension = byExtension(fileName);
        if (byExtension != null) {
            return byExtension;
        }
        if (projectType != null
                && "javascript".equalsIgnoreCase(projectType.trim())) {
            return JAVASCRIPT;
        }
        return ALL;
    }

    private static Dialect byExtension(final String fileName) {
        if (fileName == null) {
            return null;
        }
        final String name = fileName.toLowerCase(Locale.ROOT);
        if (name.endsWith(".d.ts") || name.endsWith(".ts")
                || name.endsWith(".mts") || name.endsWith(".cts")) {
            return TYPESCRIPT;
        }
        if (name.endsWith(".tsx")) {
            return ALL;
        }
        if (name.endsWith(".js") || name.endsWith(".jsx")
                || name.endsWith(".mjs") || name.endsWith(".cjs")) {
            return JAVASCRIPT;
        }
        return null;
    }

}
