package co.fanki.changeimpact.contract.domain;

import co.fanki.changeimpact.shared.CollaboratorException;

/**
 * No contract document exists under the requested name.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ContractNotFoundException extends CollaboratorException {

    private static final long serialVersionUID = 1L;

    /** Error code reported for this failure. */
    public static final String ERROR_CODE = "CONTRACT_NOT_FOUND";

    private final String contractName;

    /**
     * Creates the exception.
     *
     * @param theContractName the contract that was not found
     */
    public ContractNotFoundException(final String theContractName) {
        super("Contract not found: " + theContractName, ERROR_CODE);
        this.contractName = theContractName;
    }

    /** @return the contract that was not found */
    public String contractName() {
        return contractName;
    }

}
