package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.Preconditions;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Buckets scored components into risk areas using fixed thresholds.
 *
 * <p>Only components scoring at least {@link #RISK_THRESHOLD} are
 * reported, even when they are named as affected contracts.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class RiskClassifier {

    /** Minimum score for a component to become a risk area. */
    public static final double RISK_THRESHOLD = 0.6;

    /** Lower bound of the medium impact band. */
    public static final double MEDIUM_IMPACT_THRESHOLD = 0.4;

    /** Lower bound of the high impact band. */
    public static final double HIGH_IMPACT_THRESHOLD = 0.7;

    /**
     * Derives the risk areas for a set of scores.
     *
     * @param scores the adjusted score per component
     * @param change the change being analyzed
     * @return risk areas in score iteration order
     */
    public List<RiskArea> classify(final Map<String, Double> scores,
            final ChangeSpecification change) {
        Preconditions.requireNonNull(scores, "Scores are required");
        Preconditions.requireNonNull(change, "Change is required");

        final List<RiskArea> areas = new ArrayList<>();

        for (final Map.Entry<String, Double> entry : scores.entrySet()) {
            final String component = entry.getKey();
            final double score = entry.getValue();

            if (score < RISK_THRESHOLD) {
                continue;
            }

            areas.add(new RiskArea(
                    component,
                    riskType(change, component, score),
                    score,
                    describe(component, score),
                    contractsOf(change, component)));
        }
        return areas;
    }

    /**
     * Determines the risk type of a component.
     *
     * @param change the change being analyzed
     * @param component the component name
     * @param score the adjusted score
     * @return the risk type
     */
    public RiskType riskType(final ChangeSpecification change,
            final String component, final double score) {
        if (change.touchesContract(component)) {
            return RiskType.CONTRACT_COMPLIANCE;
        }
        if (score >= HIGH_IMPACT_THRESHOLD) {
            return RiskType.HIGH_IMPACT;
        }
        if (score >= MEDIUM_IMPACT_THRESHOLD) {
            return RiskType.MEDIUM_IMPACT;
        }
        // Unreachable while RISK_THRESHOLD >= MEDIUM_IMPACT_THRESHOLD.
        return RiskType.LOW_IMPACT;
    }

    private String describe(final String component, final double score) {
        if (score >= HIGH_IMPACT_THRESHOLD) {
            return "High risk of breaking changes affecting " + component;
        }
        if (score >= MEDIUM_IMPACT_THRESHOLD) {
            return "Potential indirect effects on " + component;
        }
        return "Minor impact possible on " + component;
    }

    /** Prefix match: "Pay" picks up "PayAPI" and "Pay.v2". */
    private List<String> contractsOf(final ChangeSpecification change,
            final String component) {
        final List<String> contracts = new ArrayList<>();
        for (final String contract : change.affectedContracts()) {
            if (contract.startsWith(component)) {
                contracts.add(contract);
            }
        }
        return contracts;
    }

}
