package co.fanki.changeimpact.contract.application;

import co.fanki.changeimpact.contract.domain.ContractDocument;
import co.fanki.changeimpact.contract.domain.ContractNotFoundException;
import co.fanki.changeimpact.contract.domain.ContractType;
import co.fanki.changeimpact.contract.domain.ContractValidation;
import co.fanki.changeimpact.contract.domain.ContractValidator;
import co.fanki.changeimpact.shared.CollaboratorException;
import co.fanki.changeimpact.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * {@link ContractValidator} backed by YAML documents on disk.
 *
 * <p>A contract named {@code PaymentApi} lives in
 * {@code <contractsRoot>/PaymentApi.yaml} (or {@code .yml}). The document
 * is parsed into the schema of the requested {@link ContractType};
 * fields the schema does not define make the contract invalid.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class YamlContractValidator implements ContractValidator {

    private static final Logger LOG = LoggerFactory.getLogger(
            YamlContractValidator.class);

    private static final List<String> EXTENSIONS = List.of(".yaml", ".yml");

    private final Path contractsRoot;

    private final ObjectMapper mapper;

    /**
     * Creates a new YamlContractValidator.
     *
     * @param theContractsRoot the directory holding contract documents
     */
    public YamlContractValidator(final Path theContractsRoot) {
        this.contractsRoot = Preconditions.requireNonNull(theContractsRoot,
                "Contracts root is required");
        this.mapper = YAMLMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /** {@inheritDoc} */
    @Override
    public ContractValidation validate(final String contractName,
            final ContractType contractType) {
        Preconditions.requireNonBlank(contractName,
                "Contract name is required");
        Preconditions.requireNonNull(contractType,
                "Contract type is required");

        LOG.info("Validating contract: {} of type: {}", contractName,
                contractType.value());

        final Path document = locate(contractName);

        final ContractDocument contract;
        try {
            contract = mapper.readValue(document.toFile(),
                    contractType.documentType());
        } catch (final JsonProcessingException e) {
            LOG.debug("Contract {} does not match the {} schema",
                    contractName, contractType.value(), e);
            return ContractValidation.failed(List.of("Malformed "
                    + contractType.value() + " contract " + contractName
                    + ": " + e.getOriginalMessage()));
        } catch (final IOException e) {
            throw new CollaboratorException(
                    "Cannot read contract " + contractName + " at "
                            + document, e);
        }

        if (contract == null) {
            return ContractValidation.failed(List.of(
                    "Contract " + contractName + " is empty"));
        }

        final ContractValidation verdict =
                ContractValidation.of(contract.violations());
        if (!verdict.valid()) {
            LOG.info("Contract {} has {} violation(s)", contractName,
                    verdict.errors().size());
        }
        return verdict;
    }

    private Path locate(final String contractName) {
        final Path root = contractsRoot.toAbsolutePath().normalize();
        for (final String extension : EXTENSIONS) {
            final Path candidate = root.resolve(contractName + extension)
                    .normalize();
            if (!candidate.startsWith(root)) {
                LOG.warn("Contract name {} resolves outside {}",
                        contractName, root);
                throw new ContractNotFoundException(contractName);
            }
            if (Files.isRegularFile(candidate)) {
                return candidate;
            }
        }
        throw new ContractNotFoundException(contractName);
    }

    /** @return the directory holding contract documents */
    public Path contractsRoot() {
        return contractsRoot;
    }

}
