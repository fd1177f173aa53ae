package co.fanki.changeimpact.impact.domain;

import co.fanki.changeimpact.shared.DomainException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * One or more affected contracts failed validation.
 *
 * <p>The analysis already computed before the check is kept on the
 * exception so callers can still inspect it, although the operation as a
 * whole failed.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ContractComplianceException extends DomainException {

    private static final long serialVersionUID = 1L;

    /** Error code reported for this failure. */
    public static final String ERROR_CODE = "CONTRACT_COMPLIANCE";

    private final transient ImpactAnalysisResult result;

    private final Map<String, List<String>> failures;

    /**
     * Creates the exception.
     *
     * @param theResult the analysis computed before validation
     * @param theFailures validation errors per failing contract, in the
     *        order the contracts were declared
     */
    public ContractComplianceException(final ImpactAnalysisResult theResult,
            final Map<String, List<String>> theFailures) {
        super(describe(theFailures), ERROR_CODE);
        this.result = theResult;
        this.failures = Collections.unmodifiableMap(
                new LinkedHashMap<>(theFailures));
    }

    /** @return the analysis computed before validation */
    public ImpactAnalysisResult result() {
        return result;
    }

    /** @return the validation errors per failing contract */
    public Map<String, List<String>> failures() {
        return failures;
    }

    private static String describe(final Map<String, List<String>> failures) {
        return failures.entrySet().stream()
                .map(e -> "Contract validation failed for " + e.getKey()
                        + ": " + String.join(", ", e.getValue()))
                .collect(Collectors.joining("; "));
    }

}
