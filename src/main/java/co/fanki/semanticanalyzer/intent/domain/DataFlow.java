package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.shared.Preconditions;
import co.fanki.semanticanalyzer.shared.ValueObject;

import java.util.List;

/**
 * A value entering or leaving a code unit.
 *
 * @param name the parameter name, or {@code return} for outputs
 * @param type the annotated or inferred type, {@code unknown} if none
 * @param source where the value comes from
 * @param validation the validation calls applied to the value
 * @param transformations the transformations applied to the value
 * @param sensitivity how sensitive the value is
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record DataFlow(
        String name,
        String type,
        DataSource source,
        List<String> validation,
        List<String> transformations,
        Sensitivity sensitivity
) implements ValueObject {

    /**
     * Creates a data flow, validating the required fields.
     */
    public DataFlow {
        Preconditions.requireNonBlank(name, "Data flow name is required");
        Preconditions.requireNonBlank(type, "Data flow type is required");
        Preconditions.requireNonNull(source, "Data flow source is required");
        Preconditions.requireNonNull(sensitivity,
                "Data flow sensitivity is required");
        validation = validation == null ? List.of() : List.copyOf(validation);
        transformations = transformations == null ? List.of()
                : List.copyOf(transformations);
    }

    /**
     * Checks whether the value is sensitive and nothing validates it.
     *
     * @return true if validation is missing for a sensitive value
     */
    public boolean lacksRequiredValidation() {
        return sensitivity.requiresValidation() && validation.isEmpty();
    }

}
