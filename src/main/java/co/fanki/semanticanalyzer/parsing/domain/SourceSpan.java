package co.fanki.semanticanalyzer.parsing.domain;

/**
 * Position of a syntax node in the analysed source.
 *
 * <p>Lines are 1-based, columns are 0-based byte offsets within the line,
 * as reported by the parser. Offsets are UTF-8 byte offsets into the whole
 * source.</p>
 *
 * @param startLine the first line of the node
 * @param startColumn the column where the node starts
 * @param endLine the last line of the node
 * @param endColumn the column right after the node ends
 * @param startOffset the byte offset where the node starts
 * @param endOffset the byte offset right after the node ends
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SourceSpan(
        int startLine,
        int startColumn,
        int endLine,
        int endColumn,
        int startOffset,
        int endOffset
) {

    /** Span used for synthetic nodes that have no source position. */
    public static final SourceSpan NONE = new SourceSpan(0, 0, 0, 0, 0, 0);

    /**
     * Checks whether this span starts before the given one.
     *
     * @param other the span to compare with
     * @return true if this span starts at a lower offset
     */
    public boolean startsBefore(final SourceSpan other) {
        return startOffset < other.startOffset;
    }

}
