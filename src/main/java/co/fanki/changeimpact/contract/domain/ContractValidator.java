package co.fanki.changeimpact.contract.domain;

/**
 * Validates a named contract against the schema of its type.
 *
 * <p>Implementations must be safe to call concurrently: the engine may
 * validate several contracts at once.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public interface ContractValidator {

    /**
     * Validates a contract.
     *
     * @param contractName the contract name
     * @param contractType the type to validate it as
     * @return the verdict
     * @throws ContractNotFoundException if no such contract exists
     * @throws co.fanki.changeimpact.shared.CollaboratorException if the
     *         contract cannot be read
     */
    ContractValidation validate(String contractName,
            ContractType contractType);

}
