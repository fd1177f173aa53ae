package co.fanki.changeimpact.contract.domain;

import java.util.List;

/**
 * A parsed contract document.
 *
 * <p>Each contract type has an explicit schema. Documents are parsed
 * straight into the variant of the requested type, so unknown fields are
 * rejected while parsing instead of being probed afterwards.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public sealed interface ContractDocument
        permits InterfaceContract, BehaviorContract, ResourceContract {

    /** @return the contract name, may be null in a malformed document */
    String name();

    /** @return the contract version, may be null in a malformed document */
    String version();

    /**
     * Checks the document against the rules of its type.
     *
     * @return the violations found, empty when valid
     */
    List<String> violations();

    /**
     * Checks that a required field has a value.
     *
     * @param value the field value
     * @return true if missing or blank
     */
    static boolean missing(final Object value) {
        return value == null
                || value instanceof String s && s.isBlank();
    }

    /**
     * Null-safe view of an optional list field.
     *
     * @param list the list, may be null
     * @param <T> the element type
     * @return the list or an empty one
     */
    static <T> List<T> orEmpty(final List<T> list) {
        return list == null ? List.of() : list;
    }

}
