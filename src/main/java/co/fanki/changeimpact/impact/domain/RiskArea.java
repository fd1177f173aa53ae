package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.Preconditions;
import co.fanki.changeimpact.shared.ValueObject;

import java.util.List;

/**
 * A component whose predicted impact clears the risk threshold.
 *
 * @param component the component name
 * @param riskType the classification bucket
 * @param riskScore the adjusted impact score
 * @param description a human readable summary
 * @param affectedContracts the affected contracts attached to this
 *        component
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record RiskArea(
        String component,
        RiskType riskType,
        double riskScore,
        String description,
        List<String> affectedContracts) implements ValueObject {

    /** Validates the fields and freezes the contract list. */
    public RiskArea {
        Preconditions.requireNonBlank(component, "Component is required");
        Preconditions.requireNonNull(riskType, "Risk type is required");
        affectedContracts = affectedContracts == null
                ? List.of()
                : List.copyOf(affectedContracts);
    }

}
