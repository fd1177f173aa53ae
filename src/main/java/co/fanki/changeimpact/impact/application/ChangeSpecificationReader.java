package co.fanki.changeimpact.impact.application;

import co.fanki.changeimpact.impact.domain.ChangeSpecification;
import co.fanki.changeimpact.impact.domain.ChangeSpecificationException;
import co.fanki.changeimpact.impact.domain.ChangeType;
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
import java.util.Map;

/**
 * Loads a {@link ChangeSpecification} from a YAML document.
 *
 * <p>Example document:</p>
 * <pre>
 * component: PaymentService
 * changeType: contract
 * changes:
 *   method: charge
 * affectedContracts: [PaymentService.api]
 * expectedImpact:
 *   PaymentService: 0.8
 * </pre>
 *
 * <p>Unknown top-level fields are rejected. The change type is matched
 * case-insensitively; values outside the known set fall back to
 * {@link ChangeType#OTHER}.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ChangeSpecificationReader {

    private static final Logger LOG = LoggerFactory.getLogger(
            ChangeSpecificationReader.class);

    private final ObjectMapper mapper;

    /** Creates a new ChangeSpecificationReader. */
    public ChangeSpecificationReader() {
        this.mapper = YAMLMapper.builder()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
    }

    /**
     * Reads and validates the specification stored at the given path.
     *
     * @param path the YAML document path
     * @return the specification, never null
     * @throws ChangeSpecificationException if the document is missing,
     *         unreadable or malformed
     */
    public ChangeSpecification read(final Path path) {
        if (path == null) {
            throw new ChangeSpecificationException(
                    "Change specification path is required");
        }
        if (!Files.isRegularFile(path)) {
            throw new ChangeSpecificationException(
                    "Change specification not found: " + path);
        }

        LOG.debug("Reading change specification from: {}", path);

        final Document document;
        try {
            document = mapper.readValue(path.toFile(), Document.class);
        } catch (final JsonProcessingException e) {
            throw new ChangeSpecificationException(
                    "Malformed change specification " + path + ": "
                            + e.getOriginalMessage(), e);
        } catch (final IOException e) {
            throw new ChangeSpecificationException(
                    "Cannot read change specification " + path, e);
        }

        if (document == null) {
            throw new ChangeSpecificationException(
                    "Change specification is empty: " + path);
        }
        return toSpecification(document, path);
    }

    private ChangeSpecification toSpecification(final Document document,
            final Path path) {
        if (isBlank(document.component())) {
            throw new ChangeSpecificationException(
                    "Missing component in " + path);
        }
        if (isBlank(document.changeType())) {
            throw new ChangeSpecificationException(
                    "Missing changeType in " + path);
        }
        if (document.affectedContracts() != null
                && document.affectedContracts().stream()
                        .anyMatch(ChangeSpecificationReader::isBlank)) {
            throw new ChangeSpecificationException(
                    "Blank entry in affectedContracts of " + path);
        }
        if (document.expectedImpact() != null) {
            for (final Map.Entry<String, Double> entry
                    : document.expectedImpact().entrySet()) {
                if (entry.getValue() == null) {
                    throw new ChangeSpecificationException(
                            "Missing expected impact for "
                                    + entry.getKey() + " in " + path);
                }
            }
        }

        if (!ChangeType.isRecognized(document.changeType())) {
            LOG.warn("Unrecognized changeType '{}' in {}, using multiplier"
                    + " {}", document.changeType(), path,
                    ChangeType.OTHER.multiplier());
        }

        return new ChangeSpecification(
                document.component().trim(),
                ChangeType.fromValue(document.changeType()),
                document.changes(),
                document.affectedContracts(),
                document.expectedImpact());
    }

    private static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

    /** Raw shape of the YAML document. */
    record Document(
            String component,
            String changeType,
            Map<String, Object> changes,
            List<String> affectedContracts,
            Map<String, Double> expectedImpact) {
    }

}
