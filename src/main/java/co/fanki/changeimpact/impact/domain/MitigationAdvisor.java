package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.Preconditions;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Maps risk areas to canned remediation suggestions.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class MitigationAdvisor {

    /**
     * Suggests mitigations for the given risk areas.
     *
     * @param riskAreas the classified risk areas
     * @return the suggestions, deduplicated, in first-seen order
     */
    public List<String> advise(final List<RiskArea> riskAreas) {
        Preconditions.requireNonNull(riskAreas, "Risk areas are required");

        final Set<String> mitigations = new LinkedHashSet<>();
        for (final RiskArea area : riskAreas) {
            mitigations.addAll(suggestionsFor(area));
        }
        return new ArrayList<>(mitigations);
    }

    private List<String> suggestionsFor(final RiskArea area) {
        final String component = area.component();
        return switch (area.riskType()) {
            case CONTRACT_COMPLIANCE -> List.of(
                    "Implement compatibility layer for " + component,
                    "Add contract validation tests for " + component);
            case HIGH_IMPACT -> List.of(
                    "Phase implementation for " + component,
                    "Increase test coverage for " + component,
                    "Prepare rollback procedure for " + component);
            case MEDIUM_IMPACT -> List.of(
                    "Monitor " + component + " during deployment",
                    "Add performance tests for " + component);
            case LOW_IMPACT -> List.of();
        };
    }

}
