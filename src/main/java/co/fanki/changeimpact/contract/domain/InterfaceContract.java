package co.fanki.changeimpact.contract.domain;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

import static co.fanki.changeimpact.contract.domain.ContractDocument.missing;
import static co.fanki.changeimpact.contract.domain.ContractDocument.orEmpty;

/**
 * Interface contract: what a component accepts and returns.
 *
 * @param name the contract name
 * @param version the contract version
 * @param description optional summary
 * @param inputs accepted parameters
 * @param outputs produced values
 * @param extensionPoints named hooks, must be a list when present
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record InterfaceContract(
        String name,
        String version,
        String description,
        List<Parameter> inputs,
        List<Parameter> outputs,
        JsonNode extensionPoints) implements ContractDocument {

    /**
     * A typed input or output.
     *
     * @param name the parameter name
     * @param type the parameter type
     * @param description optional summary
     * @param required whether callers must supply it
     */
    public record Parameter(String name, String type, String description,
            Boolean required) {
    }

    /** {@inheritDoc} */
    @Override
    public List<String> violations() {
        final List<String> errors = new ArrayList<>();

        if (missing(name)) {
            errors.add("Interface contract must have a name");
        }
        if (missing(version)) {
            errors.add("Interface contract must have a version");
        }
        for (final Parameter input : orEmpty(inputs)) {
            if (input == null || missing(input.name())
                    || missing(input.type())) {
                errors.add("Interface inputs must have name and type");
            }
        }
        for (final Parameter output : orEmpty(outputs)) {
            if (output == null || missing(output.name())
                    || missing(output.type())) {
                errors.add("Interface outputs must have name and type");
            }
        }
        if (extensionPoints != null && !extensionPoints.isNull()
                && !extensionPoints.isArray()) {
            errors.add("Extension points must be a list");
        }
        return errors;
    }

}
