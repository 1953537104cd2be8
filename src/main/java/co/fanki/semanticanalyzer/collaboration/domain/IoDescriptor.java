package co.fanki.semanticanalyzer.collaboration.domain;

import co.fanki.semanticanalyzer.shared.Preconditions;
import co.fanki.semanticanalyzer.shared.ValueObject;

/**
 * Describes the input or output of a tool operation for telemetry.
 *
 * @param type what was consumed or produced, e.g. {@code code}
 * @param size its size, in characters
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record IoDescriptor(String type, long size) implements ValueObject {

    /**
     * Creates a descriptor, validating its fields.
     */
    public IoDescriptor {
        Preconditions.requireNonBlank(type, "IO type is required");
        Preconditions.require(size >= 0, "IO size must not be negative");
    }

}
