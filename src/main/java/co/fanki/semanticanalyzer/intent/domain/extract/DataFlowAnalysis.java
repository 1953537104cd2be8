package co.fanki.semanticanalyzer.intent.domain.extract;

import co.fanki.semanticanalyzer.intent.domain.DataFlow;

import java.util.List;

/**
 * The values entering and leaving a code unit.
 *
 * @param inputs the parameters of named functions
 * @param outputs the returned values
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DataFlowAnalysis(List<DataFlow> inputs,
        List<DataFlow> outputs) {

    /**
     * Creates the analysis, copying both lists.
     */
    public DataFlowAnalysis {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
    }

    /**
     * Returns an analysis without any flow.
     *
     * @return the empty analysis
     */
    public static DataFlowAnalysis empty() {
        return new DataFlowAnalysis(List.of(), List.of());
    }

}
