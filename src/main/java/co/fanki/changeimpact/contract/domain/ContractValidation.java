package co.fanki.changeimpact.contract.domain;

import java.util.List;

/**
 * Verdict of a contract validation.
 *
 * @param valid true if no error was found
 * @param errors the violations that make the contract invalid
 * @param warnings observations that do not affect validity
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public record ContractValidation(boolean valid, List<String> errors,
        List<String> warnings) {

    /** Freezes the lists. */
    public ContractValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    /**
     * A passing verdict.
     *
     * @return the verdict
     */
    public static ContractValidation passed() {
        return new ContractValidation(true, List.of(), List.of());
    }

    /**
     * A failing verdict.
     *
     * @param errors the violations, at least one
     * @return the verdict
     */
    public static ContractValidation failed(final List<String> errors) {
        return new ContractValidation(false, errors, List.of());
    }

    /**
     * Builds a verdict from collected violations: valid when none.
     *
     * @param errors the violations found
     * @return the verdict
     */
    public static ContractValidation of(final List<String> errors) {
        return new ContractValidation(errors.isEmpty(), errors, List.of());
    }

}
