package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.Preconditions;

import java.util.List;

/**
 * Turns a flat component snapshot into a {@link DependencyGraph}.
 *
 * <p>All components become vertices first, so components with no
 * dependencies are kept. Each declared dependency then becomes an edge
 * {@code component -> dependency} with the default weight; a dependency
 * that is not itself a listed component becomes a sink vertex.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GraphBuilder {

    /**
     * Builds the graph.
     *
     * @param components the component snapshot, may be empty
     * @return a new graph
     */
    public DependencyGraph build(final List<ComponentDependencies> components) {
        Preconditions.requireNonNull(components, "Components are required");

        final DependencyGraph graph = new DependencyGraph();

        for (final ComponentDependencies component : components) {
            graph.addVertex(component.name());
        }

        for (final ComponentDependencies component : components) {
            for (final String dependency : component.dependencies()) {
                graph.addEdge(component.name(), dependency);
            }
        }

        return graph;
    }

}
