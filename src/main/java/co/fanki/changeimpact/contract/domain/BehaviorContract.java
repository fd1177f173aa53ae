package co.fanki.changeimpact.contract.domain;

import java.util.ArrayList;
import java.util.List;

import static co.fanki.changeimpact.contract.domain.ContractDocument.missing;
import static co.fanki.changeimpact.contract.domain.ContractDocument.orEmpty;

/**
 * Behavior contract: operations a component performs and the rules they
 * obey.
 *
 * @param name the contract name
 * @param version the contract version
 * @param description optional summary
 * @param operations the published operations
 * @param concurrencyRules rules on concurrent use
 * @param performanceConstraints measurable limits
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record BehaviorContract(
        String name,
        String version,
        String description,
        List<Operation> operations,
        List<ConcurrencyRule> concurrencyRules,
        List<PerformanceConstraint> performanceConstraints)
        implements ContractDocument {

    /**
     * A published operation.
     *
     * @param name the operation name
     * @param description what it does
     * @param parameters its parameters
     * @param returnType the returned type
     */
    public record Operation(String name, String description,
            List<InterfaceContract.Parameter> parameters, String returnType) {
    }

    /**
     * A rule on concurrent use.
     *
     * @param type the rule kind, e.g. "thread-safe"
     * @param description the rule text
     */
    public record ConcurrencyRule(String type, String description) {
    }

    /**
     * A measurable limit.
     *
     * @param metric the metric name
     * @param threshold the limit value
     * @param unit optional unit
     */
    public record PerformanceConstraint(String metric, String threshold,
            String unit) {
    }

    /** {@inheritDoc} */
    @Override
    public List<String> violations() {
        final List<String> errors = new ArrayList<>();

        if (missing(name)) {
            errors.add("Behavior contract must have a name");
        }
        if (missing(version)) {
            errors.add("Behavior contract must have a version");
        }
        for (final Operation operation : orEmpty(operations)) {
            if (operation == null || missing(operation.name())
                    || missing(operation.description())) {
                errors.add("Operations must have name and description");
            }
        }
        for (final ConcurrencyRule rule : orEmpty(concurrencyRules)) {
            if (rule == null || missing(rule.type())
                    || missing(rule.description())) {
                errors.add("Concurrency rules must have type and description");
            }
        }
        for (final PerformanceConstraint constraint
                : orEmpty(performanceConstraints)) {
            if (constraint == null || missing(constraint.metric())
                    || missing(constraint.threshold())) {
                errors.add(
                        "Performance constraints must have metric and threshold");
            }
        }
        return errors;
    }

}
