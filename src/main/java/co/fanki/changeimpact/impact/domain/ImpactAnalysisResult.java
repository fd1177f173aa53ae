package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.ValueObject;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a change impact analysis.
 *
 * @param impactScores adjusted score per component, in vertex order
 * @param riskAreas components that cleared the risk threshold
 * @param suggestedMitigations deduplicated remediation suggestions
 * @param affectedComponents component names grouped by tier
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@JsonPropertyOrder({"impactScores", "riskAreas", "suggestedMitigations",
        "affectedComponents"})
public record ImpactAnalysisResult(
        Map<String, Double> impactScores,
        List<RiskArea> riskAreas,
        List<String> suggestedMitigations,
        Map<String, List<String>> affectedComponents) implements ValueObject {

    /** Tier of components scoring at or above the high threshold. */
    public static final String HIGH_TIER = "high";

    /** Tier of components scoring in the medium band. */
    public static final String MEDIUM_TIER = "medium";

    /** Tier of components scoring below the medium threshold. */
    public static final String LOW_TIER = "low";

    /** Echo of the affected contracts, present only when any exist. */
    public static final String CONTRACTS_TIER = "contracts";

    /** Freezes every collection, keeping iteration order. */
    public ImpactAnalysisResult {
        impactScores = impactScores == null
                ? Map.of()
                : Collections.unmodifiableMap(
                        new LinkedHashMap<>(impactScores));
        riskAreas = riskAreas == null ? List.of() : List.copyOf(riskAreas);
        suggestedMitigations = suggestedMitigations == null
                ? List.of()
                : List.copyOf(suggestedMitigations);
        affectedComponents = freeze(affectedComponents);
    }

    /**
     * Returns the components of a tier.
     *
     * @param tier one of the tier names
     * @return the component names, empty if the tier is absent
     */
    public List<String> tier(final String tier) {
        return affectedComponents.getOrDefault(tier, List.of());
    }

    private static Map<String, List<String>> freeze(
            final Map<String, List<String>> tiers) {
        if (tiers == null) {
            return Map.of();
        }
        final Map<String, List<String>> copy = new LinkedHashMap<>();
        tiers.forEach((tier, names) -> copy.put(tier, List.copyOf(names)));
        return Collections.unmodifiableMap(copy);
    }

}
