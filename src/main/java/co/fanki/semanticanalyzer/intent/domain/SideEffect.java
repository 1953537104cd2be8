package co.fanki.semanticanalyzer.intent.domain;

import co.fanki.semanticanalyzer.shared.Preconditions;
import co.fanki.semanticanalyzer.shared.ValueObject;
import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * An observable effect of a code unit outside its own scope.
 *
 * @param type the effect kind
 * @param action what the code does, e.g. {@code write} or {@code request}
 * @param target what the effect is applied to, null when unknown
 * @param risk the risk, always the one fixed by the effect kind
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record SideEffect(
        SideEffectType type,
        String action,
        String target,
        Risk risk
) implements ValueObject {

    /**
     * Creates a side effect. A null risk is taken from the type.
     */
    public SideEffect {
        Preconditions.requireNonNull(type, "Side effect type is required");
        Preconditions.requireNonBlank(action,
                "Side effect action is required");
        if (risk == null) {
            risk = type.risk();
        }
        Preconditions.require(risk == type.risk(),
                "A " + type.label() + " side effect is always "
                        + type.risk().label() + " risk");
    }

    /**
     * Creates a side effect with the risk of its type.
     *
     * @param type the effect kind
     * @param action the action
     * @param target the target, may be null
     * @return the side effect
     */
    public static SideEffect of(final SideEffectType type,
            final String action, final String target) {
        return new SideEffect(type, action, target, type.risk());
    }

    /**
     * Checks whether this effect is high risk.
     *
     * @return true for network and global effects
     */
    @JsonIgnore
    public boolean isHighRisk() {
        return risk == Risk.HIGH;
    }

}
