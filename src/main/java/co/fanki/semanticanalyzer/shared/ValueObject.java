package co.fanki.semanticanalyzer.shared;

import java.io.Serializable;

/**
 * Marker interface for the immutable records that make up an analysis
 * result.
 *
 * <p>Implementations are plain data: no identity, no back references to
 * the syntax tree or to the analyzer, so a result can be serialized,
 * cached or sent over the wire by the host as-is.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ValueObject extends Serializable {

}
