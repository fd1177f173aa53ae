package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.Preconditions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Directed, weighted dependency graph built once per analysis call.
 *
 * <p>Vertices live in an arena indexed by insertion order, and outgoing
 * adjacency is kept per index. Name lookups go through a separate
 * name-to-index map. Adding an edge adds any missing endpoint, so every
 * edge endpoint is always a vertex.</p>
 *
 * <p>Parallel edges between the same pair are kept: each one contributes
 * independently to propagation.</p>
 *
 * <p>Not thread-safe. Each analysis owns its own instance.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class DependencyGraph {

    /** Weight used when an edge is added without an explicit weight. */
    public static final double DEFAULT_WEIGHT = 1.0;

    /**
     * A directed edge between two vertex indices.
     *
     * @param source the index of the dependent vertex
     * @param target the index of the dependency vertex
     * @param weight the positive edge weight
     */
    public record Edge(int source, int target, double weight) {

        /** Validates the weight. */
        public Edge {
            Preconditions.requirePositive(weight,
                    "Edge weight must be positive");
        }
    }

    /** Index to vertex name. */
    private final List<String> names;

    /** Vertex name to index. */
    private final Map<String, Integer> indexByName;

    /** Outgoing edges per source index. */
    private final List<List<Edge>> outgoing;

    private int edgeCount;

    /**
     * Creates an empty graph.
     */
    public DependencyGraph() {
        this.names = new ArrayList<>();
        this.indexByName = new HashMap<>();
        this.outgoing = new ArrayList<>();
    }

    /**
     * Adds a vertex unless it already exists.
     *
     * @param name the component name
     * @return the index of the vertex
     */
    public int addVertex(final String name) {
        Preconditions.requireNonBlank(name, "Vertex name is required");

        final Integer existing = indexByName.get(name);
        if (existing != null) {
            return existing;
        }
        final int index = names.size();
        names.add(name);
        indexByName.put(name, index);
        outgoing.add(new ArrayList<>());
        return index;
    }

    /**
     * Adds an edge with the default weight.
     *
     * @param source the dependent component
     * @param target the dependency
     */
    public void addEdge(final String source, final String target) {
        addEdge(source, target, DEFAULT_WEIGHT);
    }

    /**
     * Adds an edge, creating both endpoints when missing.
     *
     * @param source the dependent component
     * @param target the dependency
     * @param weight the positive weight
     */
    public void addEdge(final String source, final String target,
            final double weight) {
        final int from = addVertex(source);
        final int to = addVertex(target);
        outgoing.get(from).add(new Edge(from, to, weight));
        edgeCount++;
    }

    /** @return the number of vertices */
    public int vertexCount() {
        return names.size();
    }

    /** @return the number of edges, parallel edges counted separately */
    public int edgeCount() {
        return edgeCount;
    }

    /** @return true if the graph has no vertices */
    public boolean isEmpty() {
        return names.isEmpty();
    }

    /**
     * Checks if a vertex exists.
     *
     * @param name the component name
     * @return true if present
     */
    public boolean contains(final String name) {
        return indexByName.containsKey(name);
    }

    /**
     * Returns the index of a vertex.
     *
     * @param name the component name
     * @return the index, or -1 if unknown
     */
    public int indexOf(final String name) {
        final Integer index = indexByName.get(name);
        return index == null ? -1 : index;
    }

    /**
     * Returns the name stored at an index.
     *
     * @param index the vertex index
     * @return the component name
     */
    public String nameOf(final int index) {
        return names.get(index);
    }

    /**
     * Returns every vertex name in insertion order.
     *
     * @return unmodifiable list of names
     */
    public List<String> vertices() {
        return Collections.unmodifiableList(names);
    }

    /**
     * Returns the outgoing edges of a vertex.
     *
     * @param index the vertex index
     * @return unmodifiable list of edges
     */
    public List<Edge> outEdges(final int index) {
        return Collections.unmodifiableList(outgoing.get(index));
    }

    /**
     * Returns the number of outgoing edges of a vertex.
     *
     * @param index the vertex index
     * @return the out-degree
     */
    public int outDegree(final int index) {
        return outgoing.get(index).size();
    }

    /**
     * Returns the names a vertex depends on, in edge order.
     *
     * <p>A name appears once per parallel edge.</p>
     *
     * @param name the component name
     * @return list of dependency names, empty if unknown
     */
    public List<String> dependencies(final String name) {
        final int index = indexOf(name);
        if (index < 0) {
            return List.of();
        }
        final List<String> result = new ArrayList<>();
        for (final Edge edge : outgoing.get(index)) {
            result.add(names.get(edge.target()));
        }
        return result;
    }

}
