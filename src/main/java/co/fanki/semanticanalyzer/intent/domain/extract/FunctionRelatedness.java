package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.parsing.domain.JsNode;
import co.fanki.semanticanalyzer.parsing.domain.ParsedSource;

/**
 * Decides whether a function works with the same data as the rest of
 * its code unit. Used to compute cohesion.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@FunctionalInterface
public interface FunctionRelatedness {

    /** Treats every function as related. */
    FunctionRelatedness PERMISSIVE = (function, source) -> true;

    /**
     * Checks whether a function is related to its code unit.
     *
     * @param function a function declaration or arrow function
     * @param source the code unit it belongs to
     * @return true if the function is related
     */
    boolean isRelated(JsNode function, ParsedSource source);

}
