package co.fanki.changeimpact.impact.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification bucket of a risk area.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum RiskType {

    /** The component is itself an affected contract. */
    CONTRACT_COMPLIANCE("ContractCompliance"),

    /** Score at or above the high impact threshold. */
    HIGH_IMPACT("HighImpact"),

    /** Score at or above the medium impact threshold. */
    MEDIUM_IMPACT("MediumImpact"),

    /** Anything below the medium impact threshold. */
    LOW_IMPACT("LowImpact");

    private final String label;

    RiskType(final String theLabel) {
        this.label = theLabel;
    }

    /**
     * Returns the name used in serialized results.
     *
     * @return the label, e.g. "HighImpact"
     */
    @JsonValue
    public String label() {
        return label;
    }

}
