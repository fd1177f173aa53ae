package co.fanki.changeimpact.config;

import co.fanki.changeimpact.contract.application.YamlContractValidator;
import co.fanki.changeimpact.contract.domain.ContractValidator;
import co.fanki.changeimpact.impact.application.ChangeImpactService;
import co.fanki.changeimpact.impact.application.ImpactCommand;
import co.fanki.changeimpact.impact.domain.CodeStructureProvider;
import co.fanki.changeimpact.impact.domain.ImpactPropagator;
import co.fanki.changeimpact.structure.JavaSourceStructureProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Verifies the application context wiring and the property binding.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@SpringBootTest(properties = {
        "impact.source.root=build/sample",
        "impact.contracts.path=build/contracts",
        "impact.propagation.max-iterations=50"
})
class ImpactEngineConfigurationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void whenStarting_givenDefaultMode_shouldWireTheCommandLineSurface() {
        assertNotNull(context.getBean(ChangeImpactService.class));
        assertNotNull(context.getBean(ImpactCommand.class));
        assertEquals(0, context.getBeanNamesForType(
                McpStdioServerConfiguration.class).length);
    }

    @Test
    void whenStarting_givenProperties_shouldBindThem() {
        final CodeStructureProvider provider =
                context.getBean(CodeStructureProvider.class);
        assertEquals(Path.of("build/sample"),
                assertInstanceOf(JavaSourceStructureProvider.class, provider)
                        .projectRoot());

        final ContractValidator validator =
                context.getBean(ContractValidator.class);
        assertEquals(Path.of("build/contracts"),
                assertInstanceOf(YamlContractValidator.class, validator)
                        .contractsRoot());

        final ImpactPropagator propagator =
                context.getBean(ImpactPropagator.class);
        assertEquals(0.85, propagator.dampingFactor());
        assertEquals(50, propagator.maxIterations());
        assertEquals(1e-4, propagator.tolerance());
    }

    @Test
    void whenCreatingPropagator_givenInvalidDampingFactor_shouldFailFast() {
        assertThrows(IllegalArgumentException.class,
                () -> new ImpactEngineConfiguration()
                        .impactPropagator(1.5, 100, 1e-4));
    }

    @Test
    void whenCreatingExecutor_givenZeroParallelism_shouldFailFast() {
        assertThrows(IllegalArgumentException.class,
                () -> new ImpactEngineConfiguration()
                        .contractValidationExecutor(0));
    }

}
