package co.fanki.changeimpact.impact.domain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Unit tests for {@link ChangeType}.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ChangeTypeTest {

    @Test
    void whenResolving_givenMixedCase_shouldMatchIgnoringCase() {
        assertEquals(ChangeType.CONTRACT, ChangeType.fromValue("Contract"));
        assertEquals(ChangeType.IMPLEMENTATION,
                ChangeType.fromValue(" IMPLEMENTATION "));
        assertEquals(ChangeType.RESOURCE, ChangeType.fromValue("resource"));
    }

    @Test
    void whenResolving_givenUnknownValue_shouldFallBackToOther() {
        assertEquals(ChangeType.OTHER, ChangeType.fromValue("refactoring"));
        assertEquals(ChangeType.OTHER, ChangeType.fromValue(null));
        assertEquals(1.0, ChangeType.fromValue("refactoring").multiplier());
    }

    @Test
    void whenCheckingRecognition_givenExplicitOther_shouldBeRecognized() {
        assertTrue(ChangeType.isRecognized("other"));
        assertTrue(ChangeType.isRecognized("Resource"));
        assertFalse(ChangeType.isRecognized("refactoring"));
        assertFalse(ChangeType.isRecognized(null));
    }

    @Test
    void whenReadingMultipliers_shouldMatchChangeCharacter() {
        assertEquals(1.5, ChangeType.CONTRACT.multiplier());
        assertEquals(1.2, ChangeType.IMPLEMENTATION.multiplier());
        assertEquals(1.3, ChangeType.RESOURCE.multiplier());
        assertEquals(1.0, ChangeType.OTHER.multiplier());
    }

}
