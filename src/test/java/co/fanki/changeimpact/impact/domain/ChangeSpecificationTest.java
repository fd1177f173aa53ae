package co.fanki.changeimpact.impact.domain;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ChangeSpecification}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ChangeSpecificationTest {

    @Test
    void whenCreating_givenNullExpectedImpactValue_shouldThrowException() {
        final Map<String, Double> expected = new HashMap<>();
        expected.put("X", null);
        final ChangeSpecification change = ChangeSpecification.of("X",
                ChangeType.IMPLEMENTATION, List.of());

        assertThrows(IllegalArgumentException.class,
                () -> change.withExpectedImpact(expected));
    }

    @Test
    void whenCreating_givenBlankComponent_shouldThrowException() {
        assertThrows(IllegalArgumentException.class,
                () -> ChangeSpecification.of(" ", ChangeType.OTHER,
                        List.of()));
    }

    @Test
    void whenCheckingContracts_shouldMatchExactNamesOnly() {
        final ChangeSpecification change = ChangeSpecification.of("PayAPI",
                ChangeType.CONTRACT, List.of("PayAPI.v2"));

        assertTrue(change.hasAffectedContracts());
        assertTrue(change.touchesContract("PayAPI.v2"));
        assertFalse(change.touchesContract("PayAPI"));
    }

    @Test
    void whenAddingExpectedImpact_shouldKeepTheRestOfTheChange() {
        final ChangeSpecification change = ChangeSpecification.of("X",
                ChangeType.RESOURCE, List.of("X"))
                .withExpectedImpact(Map.of("X", 0.5));

        assertEquals(ChangeType.RESOURCE, change.changeType());
        assertEquals(List.of("X"), change.affectedContracts());
        assertEquals(0.5, change.expectedImpact().get("X"));
    }

}
