package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.Preconditions;
import co.fanki.changeimpact.shared.ValueObject;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Caller-provided description of a proposed change.
 *
 * <p>Immutable once built. The change type and the affected contracts
 * bias every propagated score; the expected impact is only used to
 * cross-check the computed scores during validation.</p>
 *
 * @param component the component being changed
 * @param changeType the character of the change
 * @param changes free-form description of the changed fields
 * @param affectedContracts contracts touched by the change, in order
 * @param expectedImpact caller expectation of component scores
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ChangeSpecification(
        String component,
        ChangeType changeType,
        Map<String, Object> changes,
        List<String> affectedContracts,
        Map<String, Double> expectedImpact) implements ValueObject {

    /** Validates and freezes every collection. */
    public ChangeSpecification {
        Preconditions.requireNonBlank(component, "Component is required");
        Preconditions.requireNonNull(changeType, "Change type is required");
        changes = changes == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(changes));
        affectedContracts = affectedContracts == null
                ? List.of()
                : List.copyOf(affectedContracts);
        expectedImpact = expectedImpact == null
                ? Map.of()
                : Collections.unmodifiableMap(
                        new LinkedHashMap<>(expectedImpact));
        expectedImpact.forEach((name, score) -> Preconditions.requireNonNull(
                score, "Expected impact of " + name + " is required"));
    }

    /**
     * Creates a specification with no changed fields and no expectations.
     *
     * @param component the component being changed
     * @param changeType the character of the change
     * @param affectedContracts contracts touched by the change
     * @return the specification
     */
    public static ChangeSpecification of(final String component,
            final ChangeType changeType,
            final List<String> affectedContracts) {
        return new ChangeSpecification(component, changeType, Map.of(),
                affectedContracts, Map.of());
    }

    /**
     * Returns a copy of this specification with the given expectations.
     *
     * @param theExpectedImpact the expected score per component
     * @return the new specification
     */
    public ChangeSpecification withExpectedImpact(
            final Map<String, Double> theExpectedImpact) {
        return new ChangeSpecification(component, changeType, changes,
                affectedContracts, theExpectedImpact);
    }

    /**
     * Checks if the given component is listed as an affected contract.
     *
     * <p>Exact name match, unlike the prefix rule used to attach contracts
     * to risk areas.</p>
     *
     * @param name the component name
     * @return true if listed
     */
    public boolean touchesContract(final String name) {
        return affectedContracts.contains(name);
    }

    /**
     * Checks if any contract is affected by this change.
     *
     * @return true if at least one contract is listed
     */
    public boolean hasAffectedContracts() {
        return !affectedContracts.isEmpty();
    }

}
