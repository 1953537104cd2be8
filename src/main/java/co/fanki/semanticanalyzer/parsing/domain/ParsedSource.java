package co.fanki.semanticanalyzer.parsing.domain;

import co.fanki.semanticanalyzer.parsing.domain.JsNode.Program;
import co.fanki.semanticanalyzer.shared.Diagnostic;
import co.fanki.semanticanalyzer.shared.Preconditions;

import java.util.List;

/**
 * The outcome of parsing a code unit: the original text, its syntax tree
 * and whatever the parser had to recover from.
 *
 * @param source the source text as given
 * @param program the root of the syntax tree
 * @param dialect the dialect actually used
 * @param diagnostics the parser diagnostics, in source order
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ParsedSource(
        String source,
        Program program,
        Dialect dialect,
        List<Diagnostic> diagnostics
) {

    /**
     * Creates a parsed source, validating the required fields.
     */
    public ParsedSource {
        Preconditions.requireNonNull(source, "Source is required");
        Preconditions.requireNonNull(program, "Program is required");
        Preconditions.requireNonNull(dialect, "Dialect is required");
        diagnostics = diagnostics == null ? List.of()
                : List.copyOf(diagnostics);
    }

    /**
     * Splits the source into lines.
     *
     * @return the lines, without terminators
     */
    public List<String> lines() {
        return source.lines().toList();
    }

}
