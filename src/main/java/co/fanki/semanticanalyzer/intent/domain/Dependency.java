package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.shared.Preconditions;
import co.fanki.semanticanalyzer.shared.ValueObject;

/**
 * A module imported by a code unit.
 *
 * @param name the module specifier as written
 * @param type where the module lives
 * @param purpose what the module is typically used for
 * @param critical whether the module touches auth, security, payments or
 *        the database
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record Dependency(
        String name,
        DependencyType type,
        String purpose,
        boolean critical
) implements ValueObject {

    /**
     * Creates a dependency, validating the required fields.
     */
    public Dependency {
        Preconditions.requireNonBlank(name, "Dependency name is required");
        Preconditions.requireNonNull(type, "Dependency type is required");
        Preconditions.requireNonBlank(purpose,
                "Dependency purpose is required");
    }

}
