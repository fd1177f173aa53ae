package co.fanki.changeimpact.impact.application;

import co.fanki.changeimpact.impact.domain.ImpactAnalysisResult;
import co.fanki.changeimpact.shared.Preconditions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Serializes an {@link ImpactAnalysisResult} back to YAML.
 *
 * <p>Output is stable: keys follow the result's declared order and maps
 * keep their insertion order, so the same result always renders to the
 * same text.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ImpactResultWriter {

    private final ObjectMapper mapper;

    /** Creates a new ImpactResultWriter. */
    public ImpactResultWriter() {
        this.mapper = YAMLMapper.builder()
                .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
                .enable(YAMLGenerator.Feature.MINIMIZE_QUOTES)
                .enable(YAMLGenerator.Feature.ALWAYS_QUOTE_NUMBERS_AS_STRINGS)
                .build();
    }

    /**
     * Renders the result as a YAML document.
     *
     * @param result the analysis result
     * @return the YAML text
     */
    public String write(final ImpactAnalysisResult result) {
        Preconditions.requireNonNull(result, "Result is required");
        try {
            return mapper.writeValueAsString(result);
        } catch (final JsonProcessingException e) {
            throw new IllegalStateException(
                    "Cannot serialize impact analysis result", e);
        }
    }

    /**
     * Writes the result as YAML to a file, replacing its content.
     *
     * @param result the analysis result
     * @param target the output file
     * @throws UncheckedIOException if the file cannot be written
     */
    public void write(final ImpactAnalysisResult result, final Path target) {
        Preconditions.requireNonNull(target, "Target is required");
        final String yaml = write(result);
        try {
            final Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, yaml, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new UncheckedIOException(
                    "Cannot write impact analysis result to " + target, e);
        }
    }

}
