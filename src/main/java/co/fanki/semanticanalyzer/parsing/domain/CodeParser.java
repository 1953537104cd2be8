package co.fanki.semanticanalyzer.parsing.domain;

/**
 * Turns source text into a {@link ParsedSource}.
 *
 * <p>Implementations recover from local syntax errors and report them as
 * diagnostics; only input that cannot be recovered is rejected.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface CodeParser {

    /**
     * Parses a code unit.
     *
     * @param code the source text, never null
     * @param dialect the syntax flags, never null
     * @return the parsed source, never null
     * @throws ParseError if the source cannot be recovered
     */
    ParsedSource parse(String code, Dialect dialect);

}
