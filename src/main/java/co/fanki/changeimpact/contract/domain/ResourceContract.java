package co.fanki.changeimpact.contract.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

import static co.fanki.changeimpact.contract.domain.ContractDocument.missing;
import static co.fanki.changeimpact.contract.domain.ContractDocument.orEmpty;

/**
 * Resource contract: what a component consumes and how it scales.
 *
 * @param name the contract name
 * @param version the contract version
 * @param description optional summary
 * @param resourceRequirements consumed resources
 * @param accessPatterns how resources are accessed
 * @param scalingRules how the component scales
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ResourceContract(
        String name,
        String version,
        String description,
        List<ResourceRequirement> resourceRequirements,
        List<AccessPattern> accessPatterns,
        List<ScalingRule> scalingRules) implements ContractDocument {

    /**
     * A consumed resource. The specification is free-form (limits,
     * sizes, counts) and only checked for presence.
     *
     * @param type the resource kind, e.g. "memory"
     * @param specification the requirement details
     */
    public record ResourceRequirement(String type, JsonNode specification) {
    }

    /**
     * How a resource is accessed.
     *
     * @param type the access kind
     * @param description the pattern text
     */
    public record AccessPattern(String type, String description) {
    }

    /**
     * A scaling trigger and its reaction.
     *
     * @param trigger the condition
     * @param action the reaction
     */
    public record ScalingRule(String trigger, String action) {
    }

    /** {@inheritDoc} */
    @Override
    public List<String> violations() {
        final List<String> errors = new ArrayList<>();

        if (missing(name)) {
            errors.add("Resource contract must have a name");
        }
        if (missing(version)) {
            errors.add("Resource contract must have a version");
        }
        for (final ResourceRequirement requirement
                : orEmpty(resourceRequirements)) {
            if (requirement == null || missing(requirement.type())
                    || requirement.specification() == null
                    || requirement.specification().isNull()) {
                errors.add(
                        "Resource requirements must have type and specification");
            }
        }
        for (final AccessPattern pattern : orEmpty(accessPatterns)) {
            if (pattern == null || missing(pattern.type())
                    || missing(pattern.description())) {
                errors.add("Access patterns must have type and description");
            }
        }
        for (final ScalingRule rule : orEmpty(scalingRules)) {
            if (rule == null || missing(rule.trigger())
                    || missing(rule.action())) {
                errors.add("Scaling rules must have trigger and action");
            }
        }
        return errors;
    }

}
