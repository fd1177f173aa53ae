package co.fanki.changeimpact.contract.application;

import co.fanki.changeimpact.contract.domain.ContractNotFoundException;
import co.fanki.changeimpact.contract.domain.ContractType;
import co.fanki.changeimpact.contract.domain.ContractValidation;
import co.fanki.changeimpact.shared.CollaboratorException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link YamlContractValidator}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class YamlContractValidatorTest {

    @TempDir
    Path contracts;

    @Test
    void whenValidating_givenWellFormedInterface_shouldPass()
            throws IOException {
        write("PaymentApi.yaml", """
                name: PaymentApi
                version: 2.1.0
                description: Charges and refunds
                inputs:
                  - name: amount
                    type: decimal
                    required: true
                outputs:
                  - name: receipt
                    type: Receipt
                extensionPoints:
                  - beforeCharge
                """);

        final ContractValidation verdict = validator().validate(
                "PaymentApi", ContractType.INTERFACE);

        assertTrue(verdict.valid());
        assertTrue(verdict.errors().isEmpty());
    }

    @Test
    void whenValidating_givenInterfaceWithoutVersionAndUntypedInput_shouldFail()
            throws IOException {
        write("PaymentApi.yml", """
                name: PaymentApi
                inputs:
                  - name: amount
                extensionPoints: beforeCharge
                """);

        final ContractValidation verdict = validator().validate(
                "PaymentApi", ContractType.INTERFACE);

        assertFalse(verdict.valid());
        assertEquals(List.of(
                "Interface contract must have a version",
                "Interface inputs must have name and type",
                "Extension points must be a list"), verdict.errors());
    }

    @Test
    void whenValidating_givenUnknownField_shouldReportMalformedContract()
            throws IOException {
        write("PaymentApi.yaml", """
                name: PaymentApi
                version: 1.0.0
                endpoints: []
                """);

        final ContractValidation verdict = validator().validate(
                "PaymentApi", ContractType.INTERFACE);

        assertFalse(verdict.valid());
        assertTrue(verdict.errors().get(0)
                .startsWith("Malformed interface contract PaymentApi"));
    }

    @Test
    void whenValidating_givenBehaviorContract_shouldCheckEveryRule()
            throws IOException {
        write("Checkout.yaml", """
                name: Checkout
                version: 1.0.0
                operations:
                  - name: placeOrder
                concurrencyRules:
                  - type: thread-safe
                    description: Orders may be placed concurrently
                performanceConstraints:
                  - metric: latency
                    threshold: 200
                    unit: ms
                """);

        final ContractValidation verdict = validator().validate(
                "Checkout", ContractType.BEHAVIOR);

        assertEquals(List.of("Operations must have name and description"),
                verdict.errors());
    }

    @Test
    void whenValidating_givenResourceContract_shouldCheckEveryRule()
            throws IOException {
        write("Cache.yaml", """
                name: Cache
                version: 3.0.0
                resourceRequirements:
                  - type: memory
                    specification:
                      max: 512Mi
                accessPatterns:
                  - type: read-heavy
                scalingRules:
                  - trigger: cpu > 80%
                    action: add replica
                """);

        final ContractValidation verdict = validator().validate(
                "Cache", ContractType.RESOURCE);

        assertEquals(List.of("Access patterns must have type and description"),
                verdict.errors());
    }

    @Test
    void whenValidating_givenMissingDocument_shouldThrowNotFound() {
        final ContractNotFoundException e = assertThrows(
                ContractNotFoundException.class,
                () -> validator().validate("Ghost", ContractType.INTERFACE));

        assertEquals("Ghost", e.contractName());
        assertInstanceOf(CollaboratorException.class, e);
    }

    @Test
    void whenValidating_givenNameEscapingTheDirectory_shouldThrowNotFound()
            throws IOException {
        final Path nested = contracts.resolve("nested");
        Files.createDirectories(nested);
        write("Outside.yaml", """
                name: Outside
                version: 1.0.0
                """);
        final YamlContractValidator validator =
                new YamlContractValidator(nested);

        assertThrows(ContractNotFoundException.class,
                () -> validator.validate("../Outside",
                        ContractType.INTERFACE));
        assertThrows(ContractNotFoundException.class,
                () -> validator.validate(
                        contracts.resolve("Outside").toAbsolutePath()
                                .toString(),
                        ContractType.INTERFACE));
    }

    @Test
    void whenValidating_givenBlankName_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> validator().validate(" ", ContractType.INTERFACE));
    }

    private YamlContractValidator validator() {
        return new YamlContractValidator(contracts);
    }

    private void write(final String fileName, final String content)
            throws IOException {
        Files.writeString(contracts.resolve(fileName), content);
    }

}
