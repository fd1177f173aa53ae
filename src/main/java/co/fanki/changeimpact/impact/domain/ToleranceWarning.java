package co.fanki.changeimpact.impact.domain;

import java.util.Locale;

/**
 * A computed score that differs from the caller's expectation by more
 * than the allowed tolerance. Reported, never thrown.
 *
 * @param component the component name
 * @param expected the expected score
 * @param actual the computed score
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ToleranceWarning(String component, double expected,
        double actual) {

    /**
     * Returns the absolute difference between expected and actual.
     *
     * @return the deviation
     */
    public double deviation() {
        return Math.abs(actual - expected);
    }

    /**
     * Renders the warning for logs and tool output.
     *
     * @return the message
     */
    public String message() {
        return String.format(Locale.ROOT,
                "Impact mismatch for %s: Expected %.2f, Actual %.2f",
                component, expected, actual);
    }

}
