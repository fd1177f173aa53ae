package co.fanki.changeimpact.impact.application;

import co.fanki.changeimpact.contract.domain.ContractType;
import co.fanki.changeimpact.contract.domain.ContractValidation;
import co.fanki.changeimpact.contract.domain.ContractValidator;
import co.fanki.changeimpact.impact.domain.ChangeSpecification;
import co.fanki.changeimpact.impact.domain.CodeStructureProvider;
import co.fanki.changeimpact.impact.domain.ComponentDependencies;
import co.fanki.changeimpact.impact.domain.ContractComplianceException;
import co.fanki.changeimpact.impact.domain.DependencyGraph;
import co.fanki.changeimpact.impact.domain.GraphBuilder;
import co.fanki.changeimpact.impact.domain.ImpactAnalysisResult;
import co.fanki.changeimpact.impact.domain.ImpactPropagator;
import co.fanki.changeimpact.impact.domain.MitigationAdvisor;
import co.fanki.changeimpact.impact.domain.RiskArea;
import co.fanki.changeimpact.impact.domain.RiskClassifier;
import co.fanki.changeimpact.impact.domain.ToleranceWarning;
import co.fanki.changeimpact.shared.CollaboratorException;
import co.fanki.changeimpact.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Application service that runs change impact analyses.
 *
 * <p>Each call reads a fresh component snapshot, builds its own graph and
 * derives scores, risk areas and mitigations from it. Nothing is shared
 * between calls, so concurrent analyses need no locking.</p>
 *
 * <p>Validation additionally checks every affected contract with the
 * {@link ContractValidator}, issuing the checks concurrently, and compares
 * the caller's expected impact against the computed scores.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Service
public class ChangeImpactService {

    private static final Logger LOG = LoggerFactory.getLogger(
            ChangeImpactService.class);

    private final CodeStructureProvider structureProvider;

    private final ContractValidator contractValidator;

    private final ChangeSpecificationReader specificationReader;

    private final GraphBuilder graphBuilder;

    private final ImpactPropagator propagator;

    private final RiskClassifier riskClassifier;

    private final MitigationAdvisor mitigationAdvisor;

    private final Executor validationExecutor;

    private final double expectedImpactTolerance;

    /**
     * Creates a new ChangeImpactService.
     *
     * @param theStructureProvider source of components and dependencies
     * @param theContractValidator validates affected contracts
     * @param theSpecificationReader loads change specification documents
     * @param theGraphBuilder builds the dependency graph
     * @param thePropagator computes impact scores
     * @param theRiskClassifier derives risk areas
     * @param theMitigationAdvisor derives mitigation suggestions
     * @param theValidationExecutor runs contract validations
     * @param theExpectedImpactTolerance absolute tolerance used when
     *        comparing expected and computed scores
     */
    public ChangeImpactService(
            final CodeStructureProvider theStructureProvider,
            final ContractValidator theContractValidator,
            final ChangeSpecificationReader theSpecificationReader,
            final GraphBuilder theGraphBuilder,
            final ImpactPropagator thePropagator,
            final RiskClassifier theRiskClassifier,
            final MitigationAdvisor theMitigationAdvisor,
            @Qualifier("contractValidationExecutor")
            final Executor theValidationExecutor,
            @Value("${impact.validation.expected-impact-tolerance:0.2}")
            final double theExpectedImpactTolerance) {
        this.structureProvider = Preconditions.requireNonNull(
                theStructureProvider, "Structure provider is required");
        this.contractValidator = Preconditions.requireNonNull(
                theContractValidator, "Contract validator is required");
        this.specificationReader = Preconditions.requireNonNull(
                theSpecificationReader, "Specification reader is required");
        this.graphBuilder = Preconditions.requireNonNull(theGraphBuilder,
                "Graph builder is required");
        this.propagator = Preconditions.requireNonNull(thePropagator,
                "Propagator is required");
        this.riskClassifier = Preconditions.requireNonNull(
                theRiskClassifier, "Risk classifier is required");
        this.mitigationAdvisor = Preconditions.requireNonNull(
                theMitigationAdvisor, "Mitigation advisor is required");
        this.validationExecutor = Preconditions.requireNonNull(
                theValidationExecutor, "Validation executor is required");
        Preconditions.require(theExpectedImpactTolerance >= 0,
                "Expected impact tolerance cannot be negative");
        this.expectedImpactTolerance = theExpectedImpactTolerance;
    }

    /**
     * Analyzes the change described by the document at the given path.
     *
     * @param specificationPath the change specification document
     * @return the analysis result
     */
    public ImpactAnalysisResult analyzeChangeImpact(
            final Path specificationPath) {
        LOG.info("Analyzing change impact from: {}", specificationPath);
        return analyzeChangeImpact(
                specificationReader.read(specificationPath));
    }

    /**
     * Analyzes the impact of a change on the current code structure.
     *
     * @param change the change specification
     * @return scores, risk areas, mitigations and tiers
     */
    public ImpactAnalysisResult analyzeChangeImpact(
            final ChangeSpecification change) {
        Preconditions.requireNonNull(change,
                "Change specification is required");

        LOG.info("Analyzing {} change on: {}", change.changeType().value(),
                change.component());

        final Map<String, Double> scores = calculateImpactScores(change);
        final List<RiskArea> riskAreas = riskClassifier.classify(scores,
                change);
        final List<String> mitigations = mitigationAdvisor.advise(riskAreas);

        LOG.info("Analysis of {} finished: {} components, {} risk areas",
                change.component(), scores.size(), riskAreas.size());

        return new ImpactAnalysisResult(scores, riskAreas, mitigations,
                groupByTier(scores, change));
    }

    /**
     * Validates the change described by the document at the given path.
     *
     * @param specificationPath the change specification document
     * @return the analysis result
     * @see #validateChange(ChangeSpecification)
     */
    public ImpactAnalysisResult validateChange(final Path specificationPath) {
        LOG.info("Validating change from: {}", specificationPath);
        return validateChange(specificationReader.read(specificationPath));
    }

    /**
     * Analyzes the change and validates it.
     *
     * @param change the change specification
     * @return the analysis result
     * @throws ContractComplianceException if any affected contract is
     *         invalid
     * @see #validate(ChangeSpecification)
     */
    public ImpactAnalysisResult validateChange(
            final ChangeSpecification change) {
        return validate(change).result();
    }

    /**
     * Validates the change described by the document at the given path,
     * keeping the tolerance warnings.
     *
     * @param specificationPath the change specification document
     * @return the analysis result with its tolerance warnings
     */
    public Validation validate(final Path specificationPath) {
        LOG.info("Validating change from: {}", specificationPath);
        return validate(specificationReader.read(specificationPath));
    }

    /**
     * Analyzes the change, checks every affected contract as an interface
     * contract and compares the expected impact with the computed scores.
     *
     * <p>Expected-impact mismatches are reported as warnings and never
     * fail the validation.</p>
     *
     * @param change the change specification
     * @return the analysis result with its tolerance warnings
     * @throws ContractComplianceException if any affected contract is
     *         invalid
     * @throws CollaboratorException if a contract cannot be validated
     */
    public Validation validate(final ChangeSpecification change) {
        final ImpactAnalysisResult result = analyzeChangeImpact(change);

        final Map<String, List<String>> failures = validateContracts(change);
        if (!failures.isEmpty()) {
            throw new ContractComplianceException(result, failures);
        }

        final List<ToleranceWarning> warnings =
                compareExpectedImpact(change, result);
        for (final ToleranceWarning warning : warnings) {
            LOG.warn("Impact mismatch for {}: expected {}, actual {}",
                    warning.component(), warning.expected(),
                    warning.actual());
        }

        LOG.info("Change on {} validated with {} warning(s)",
                change.component(), warnings.size());

        return new Validation(result, warnings);
    }

    /**
     * Computes the adjusted impact score of every component.
     *
     * @param change the change specification
     * @return score per component, in graph vertex order
     */
    public Map<String, Double> calculateImpactScores(
            final ChangeSpecification change) {
        Preconditions.requireNonNull(change,
                "Change specification is required");

        final DependencyGraph graph = graphBuilder.build(listComponents());
        LOG.info("Dependency graph built: {} components, {} edges",
                graph.vertexCount(), graph.edgeCount());

        return propagator.propagate(graph, change);
    }

    /**
     * Compares the expected impact of a change with the computed scores.
     *
     * <p>Components without a computed score are skipped.</p>
     *
     * @param change the change specification
     * @param result the computed analysis
     * @return one warning per component outside the tolerance
     */
    public List<ToleranceWarning> compareExpectedImpact(
            final ChangeSpecification change,
            final ImpactAnalysisResult result) {
        final List<ToleranceWarning> warnings = new ArrayList<>();
        change.expectedImpact().forEach((component, expected) -> {
            final Double actual = result.impactScores().get(component);
            if (actual == null) {
                LOG.debug("No computed score for {}, skipping", component);
                return;
            }
            final ToleranceWarning warning = new ToleranceWarning(component,
                    expected, actual);
            if (warning.deviation() > expectedImpactTolerance) {
                warnings.add(warning);
            }
        });
        return warnings;
    }

    private List<ComponentDependencies> listComponents() {
        final List<ComponentDependencies> components;
        try {
            components = structureProvider.listComponents();
        } catch (final IOException e) {
            throw new CollaboratorException(
                    "Cannot read the code structure", e);
        } catch (final CollaboratorException e) {
            throw e;
        } catch (final RuntimeException e) {
            throw new CollaboratorException(
                    "Code structure provider failed: " + e.getMessage(), e);
        }
        if (components == null) {
            throw new CollaboratorException(
                    "Code structure provider returned no snapshot");
        }
        return components;
    }

    private Map<String, List<String>> validateContracts(
            final ChangeSpecification change) {
        final Map<String, CompletableFuture<ContractValidation>> pending =
                new LinkedHashMap<>();
        for (final String contract : change.affectedContracts()) {
            pending.computeIfAbsent(contract, name ->
                    CompletableFuture.supplyAsync(() -> contractValidator
                            .validate(name, ContractType.INTERFACE),
                            validationExecutor));
        }

        final Map<String, List<String>> failures = new LinkedHashMap<>();
        for (final Map.Entry<String, CompletableFuture<ContractValidation>>
                entry : pending.entrySet()) {
            final ContractValidation verdict = await(entry.getKey(),
                    entry.getValue());
            if (!verdict.valid()) {
                LOG.info("Contract {} failed validation: {}",
                        entry.getKey(), verdict.errors());
                failures.put(entry.getKey(), verdict.errors());
            }
        }
        return failures;
    }

    private ContractValidation await(final String contract,
            final CompletableFuture<ContractValidation> future) {
        final ContractValidation verdict;
        try {
            verdict = future.join();
        } catch (final CompletionException e) {
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CollaboratorException(
                    "Contract validation of " + contract + " failed", cause);
        }
        if (verdict == null) {
            throw new CollaboratorException(
                    "Contract validator returned no verdict for "
                            + contract);
        }
        return verdict;
    }

    private Map<String, List<String>> groupByTier(
            final Map<String, Double> scores,
            final ChangeSpecification change) {
        final List<String> high = new ArrayList<>();
        final List<String> medium = new ArrayList<>();
        final List<String> low = new ArrayList<>();

        scores.forEach((component, score) -> {
            if (score >= RiskClassifier.HIGH_IMPACT_THRESHOLD) {
                high.add(component);
            } else if (score >= RiskClassifier.MEDIUM_IMPACT_THRESHOLD) {
                medium.add(component);
            } else {
                low.add(component);
            }
        });

        final Map<String, List<String>> tiers = new LinkedHashMap<>();
        tiers.put(ImpactAnalysisResult.HIGH_TIER, high);
        tiers.put(ImpactAnalysisResult.MEDIUM_TIER, medium);
        tiers.put(ImpactAnalysisResult.LOW_TIER, low);
        if (change.hasAffectedContracts()) {
            tiers.put(ImpactAnalysisResult.CONTRACTS_TIER,
                    change.affectedContracts());
        }
        return tiers;
    }

    /**
     * Outcome of a successful validation.
     *
     * @param result the analysis result
     * @param warnings expected-impact mismatches, possibly empty
     */
    public record Validation(ImpactAnalysisResult result,
            List<ToleranceWarning> warnings) {

        /** Freezes the warning list. */
        public Validation {
            warnings = warnings == null ? List.of() : List.copyOf(warnings);
        }
    }

}
