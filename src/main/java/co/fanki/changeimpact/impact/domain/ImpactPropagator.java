package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Propagates impact through a dependency graph with a PageRank-style
 * diffusion, then biases the result by the character of the change.
 *
 * <p>Each iteration computes, for every vertex {@code v}:</p>
 * <pre>
 *   incoming(v) = sum over edges u-&gt;v of rank(u) * weight / outDegree(u)
 *   rank'(v)    = (1 - d) + d * incoming(v)
 * </pre>
 * <p>Updates are synchronous. Iteration stops once the summed absolute
 * change drops below the tolerance, or after the iteration cap. Ranks are
 * then normalized to sum to one.</p>
 *
 * <p>Rank held by sink vertices is not redistributed; it leaks each
 * iteration and is only restored by the final normalization.</p>
 *
 * <p>Stateless and thread-safe: every call allocates its own arrays.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImpactPropagator {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImpactPropagator.class);

    /** Default damping factor. */
    public static final double DEFAULT_DAMPING_FACTOR = 0.85;

    /** Default iteration cap. */
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    /** Default convergence tolerance on the summed absolute change. */
    public static final double DEFAULT_TOLERANCE = 1e-4;

    /** Extra factor for components named as affected contracts. */
    public static final double CONTRACT_MULTIPLIER = 1.4;

    /** Upper bound of every adjusted score. */
    public static final double MAX_SCORE = 1.0;

    private final double dampingFactor;

    private final int maxIterations;

    private final double tolerance;

    /**
     * Creates a propagator with the default parameters.
     */
    public ImpactPropagator() {
        this(DEFAULT_DAMPING_FACTOR, DEFAULT_MAX_ITERATIONS,
                DEFAULT_TOLERANCE);
    }

    /**
     * Creates a propagator.
     *
     * @param theDampingFactor the damping factor, in [0, 1)
     * @param theMaxIterations the iteration cap, positive
     * @param theTolerance the convergence tolerance, positive
     */
    public ImpactPropagator(final double theDampingFactor,
            final int theMaxIterations, final double theTolerance) {
        this.dampingFactor = Preconditions.requireFraction(theDampingFactor,
                "Damping factor must be in [0, 1)");
        this.maxIterations = Preconditions.requirePositive(theMaxIterations,
                "Max iterations must be positive");
        this.tolerance = Preconditions.requirePositive(theTolerance,
                "Tolerance must be positive");
    }

    /**
     * Computes the adjusted impact score of every vertex.
     *
     * @param graph the dependency graph
     * @param change the change being analyzed
     * @return score per component in vertex order, each in [0, 1]; empty
     *         for an empty graph
     */
    public Map<String, Double> propagate(final DependencyGraph graph,
            final ChangeSpecification change) {
        Preconditions.requireNonNull(change, "Change is required");

        final Map<String, Double> ranks = rank(graph);
        final Map<String, Double> scores = new LinkedHashMap<>();

        for (final Map.Entry<String, Double> entry : ranks.entrySet()) {
            scores.put(entry.getKey(),
                    adjust(entry.getValue(), change, entry.getKey()));
        }

        if (LOG.isDebugEnabled()) {
            scores.forEach((component, score) ->
                    LOG.debug("Impact score {} = {}", component, score));
        }
        return scores;
    }

    /**
     * Computes the normalized rank of every vertex, before any
     * change-specific adjustment.
     *
     * @param graph the dependency graph
     * @return rank per component in vertex order, summing to one; empty
     *         for an empty graph
     */
    public Map<String, Double> rank(final DependencyGraph graph) {
        Preconditions.requireNonNull(graph, "Graph is required");

        final int n = graph.vertexCount();
        if (n == 0) {
            return Map.of();
        }

        double[] ranks = new double[n];
        Arrays.fill(ranks, 1.0 / n);

        int iteration = 0;
        while (iteration < maxIterations) {
            iteration++;
            final double[] incoming = incoming(graph, ranks);
            final double[] next = new double[n];
            double totalDiff = 0;

            for (int v = 0; v < n; v++) {
                next[v] = (1 - dampingFactor) + dampingFactor * incoming[v];
                totalDiff += Math.abs(next[v] - ranks[v]);
            }

            ranks = next;
            LOG.debug("Iteration {} total difference {}", iteration,
                    totalDiff);

            if (totalDiff < tolerance) {
                break;
            }
        }

        LOG.info("Propagation finished after {} iterations over {}"
                + " vertices", iteration, n);

        double sum = 0;
        for (final double rank : ranks) {
            sum += rank;
        }

        final Map<String, Double> normalized = new LinkedHashMap<>();
        for (int v = 0; v < n; v++) {
            normalized.put(graph.nameOf(v), ranks[v] / sum);
        }
        return normalized;
    }

    /**
     * Biases a normalized rank by the change type and contract
     * involvement, capping the result at {@link #MAX_SCORE}.
     *
     * @param baseScore the normalized rank
     * @param change the change being analyzed
     * @param component the component the rank belongs to
     * @return the adjusted score
     */
    public double adjust(final double baseScore,
            final ChangeSpecification change, final String component) {
        double adjusted = baseScore * change.changeType().multiplier();

        if (change.touchesContract(component)) {
            adjusted *= CONTRACT_MULTIPLIER;
        }

        return Math.min(adjusted, MAX_SCORE);
    }

    private double[] incoming(final DependencyGraph graph,
            final double[] ranks) {
        final double[] incoming = new double[ranks.length];

        for (int u = 0; u < ranks.length; u++) {
            final int outDegree = graph.outDegree(u);
            if (outDegree == 0) {
                continue;
            }
            final List<DependencyGraph.Edge> edges = graph.outEdges(u);
            for (final DependencyGraph.Edge edge : edges) {
                incoming[edge.target()] +=
                        ranks[u] * edge.weight() / outDegree;
            }
        }
        return incoming;
    }

    /** @return the damping factor */
    public double dampingFactor() {
        return dampingFactor;
    }

    /** @return the iteration cap */
    public int maxIterations() {
        return maxIterations;
    }

    /** @return the convergence tolerance */
    public double tolerance() {
        return tolerance;
    }

}
