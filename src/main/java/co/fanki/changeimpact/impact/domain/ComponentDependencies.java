package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.Preconditions;
import co.fanki.changeimpact.shared.ValueObject;

import java.util.List;

/**
 * One component reported by a {@link CodeStructureProvider}, with the
 * names of the components it depends on.
 *
 * @param name the unique component name
 * @param dependencies the names this component depends on, duplicates
 *        allowed
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ComponentDependencies(String name, List<String> dependencies)
        implements ValueObject {

    /** Validates the name and freezes the dependency list. */
    public ComponentDependencies {
        Preconditions.requireNonBlank(name, "Component name is required");
        dependencies = dependencies == null
                ? List.of()
                : List.copyOf(dependencies);
    }

    /**
     * Creates a component entry.
     *
     * @param name the component name
     * @param dependencies the dependency names
     * @return the entry
     */
    public static ComponentDependencies of(final String name,
            final String... dependencies) {
        return new ComponentDependencies(name, List.of(dependencies));
    }

}
