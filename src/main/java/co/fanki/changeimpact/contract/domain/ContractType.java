package co.fanki.changeimpact.contract.domain;

/**
 * Kinds of contract a component can publish.
 *
 * <p>Each kind has its own document schema, see
 * {@link ContractDocument}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum ContractType {

    /** Inputs, outputs and extension points. */
    INTERFACE("interface", InterfaceContract.class),

    /** Operations, concurrency rules and performance constraints. */
    BEHAVIOR("behavior", BehaviorContract.class),

    /** Resource requirements, access patterns and scaling rules. */
    RESOURCE("resource", ResourceContract.class);

    private final String value;

    private final Class<? extends ContractDocument> documentType;

    ContractType(final String theValue,
            final Class<? extends ContractDocument> theDocumentType) {
        this.value = theValue;
        this.documentType = theDocumentType;
    }

    /** @return the lowercase name, e.g. "interface" */
    public String value() {
        return value;
    }

    /** @return the schema documents of this type are parsed into */
    public Class<? extends ContractDocument> documentType() {
        return documentType;
    }

}
