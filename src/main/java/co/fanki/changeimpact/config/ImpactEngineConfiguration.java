package co.fanki.changeimpact.config;

import co.fanki.changeimpact.contract.application.YamlContractValidator;
import co.fanki.changeimpact.contract.domain.ContractValidator;
import co.fanki.changeimpact.impact.application.ChangeSpecificationReader;
import co.fanki.changeimpact.impact.application.ImpactResultWriter;
import co.fanki.changeimpact.impact.domain.CodeStructureProvider;
import co.fanki.changeimpact.impact.domain.GraphBuilder;
import co.fanki.changeimpact.impact.domain.ImpactPropagator;
import co.fanki.changeimpact.impact.domain.MitigationAdvisor;
import co.fanki.changeimpact.impact.domain.RiskClassifier;
import co.fanki.changeimpact.shared.Preconditions;
import co.fanki.changeimpact.structure.JavaSourceStructureProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires the engine components and binds the {@code impact.*} properties.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class ImpactEngineConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImpactEngineConfiguration.class);

    /**
     * Creates the Code Structure Provider reading Java sources.
     *
     * @param sourceRoot the project root to scan
     * @param includeExternalDependencies whether imports outside the
     *        project count as dependencies
     * @return the structure provider
     */
    @Bean
    CodeStructureProvider codeStructureProvider(
            @Value("${impact.source.root:.}") final String sourceRoot,
            @Value("${impact.source.include-external-dependencies:false}")
            final boolean includeExternalDependencies) {
        LOG.info("Code structure source root: {}", sourceRoot);
        return new JavaSourceStructureProvider(Path.of(sourceRoot),
                includeExternalDependencies);
    }

    /**
     * Creates the Contract Validator backed by YAML documents.
     *
     * @param contractsPath the directory holding contract documents
     * @return the contract validator
     */
    @Bean
    ContractValidator contractValidator(
            @Value("${impact.contracts.path:contracts}")
            final String contractsPath) {
        LOG.info("Contracts directory: {}", contractsPath);
        return new YamlContractValidator(Path.of(contractsPath));
    }

    /**
     * Creates the propagator with the configured diffusion parameters.
     *
     * @param dampingFactor the damping factor, in [0, 1)
     * @param maxIterations the iteration cap
     * @param tolerance the convergence tolerance
     * @return the propagator
     */
    @Bean
    ImpactPropagator impactPropagator(
            @Value("${impact.propagation.damping-factor:0.85}")
            final double dampingFactor,
            @Value("${impact.propagation.max-iterations:100}")
            final int maxIterations,
            @Value("${impact.propagation.tolerance:0.0001}")
            final double tolerance) {
        return new ImpactPropagator(dampingFactor, maxIterations, tolerance);
    }

    @Bean
    GraphBuilder graphBuilder() {
        return new GraphBuilder();
    }

    @Bean
    RiskClassifier riskClassifier() {
        return new RiskClassifier();
    }

    @Bean
    MitigationAdvisor mitigationAdvisor() {
        return new MitigationAdvisor();
    }

    @Bean
    ChangeSpecificationReader changeSpecificationReader() {
        return new ChangeSpecificationReader();
    }

    @Bean
    ImpactResultWriter impactResultWriter() {
        return new ImpactResultWriter();
    }

    /**
     * Creates the pool that runs contract validations concurrently.
     *
     * @param parallelism the number of worker threads
     * @return the executor, shut down with the context
     */
    @Bean(destroyMethod = "shutdown")
    ExecutorService contractValidationExecutor(
            @Value("${impact.validation.parallelism:4}")
            final int parallelism) {
        Preconditions.requirePositive(parallelism,
                "Validation parallelism must be positive");

        final AtomicInteger counter = new AtomicInteger();
        final ThreadFactory threads = runnable -> {
            final Thread thread = new Thread(runnable,
                    "contract-validation-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(parallelism, threads);
    }

}
