package co.fanki.changeimpact.structure;

import co.fanki.changeimpact.impact.domain.CodeStructureProvider;
import co.fanki.changeimpact.impact.domain.ComponentDependencies;
import co.fanki.changeimpact.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Abstract {@link CodeStructureProvider} that reads components from the
 * source files of a local project.
 *
 * <p>Each language has its own conventions for file discovery, naming and
 * dependency extraction. Subclasses implement those; this class provides
 * the template method {@link #listComponents()} that wires them together
 * into a component snapshot.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public abstract class SourceStructureProvider implements CodeStructureProvider {

    private static final Logger LOG = LoggerFactory.getLogger(
            SourceStructureProvider.class);

    private final Path projectRoot;

    /**
     * Creates a provider rooted at a local project directory.
     *
     * @param theProjectRoot the project root
     */
    protected SourceStructureProvider(final Path theProjectRoot) {
        this.projectRoot = Preconditions.requireNonNull(theProjectRoot,
                "Project root is required");
    }

    /**
     * Returns the source root path relative to the project root.
     *
     * @return the source root (e.g., "src/main/java" for Java)
     */
    public abstract String sourceRoot();

    /**
     * Discovers all production source files under the source root.
     *
     * @param root the local project root directory
     * @return source files in a stable order
     * @throws IOException if file discovery fails
     */
    protected abstract List<Path> discoverFiles(Path root) throws IOException;

    /**
     * Converts a source file path to a component name.
     *
     * @param file the source file
     * @param sourceRootPath the resolved source root path
     * @return the component name (e.g., FQCN for Java)
     */
    protected abstract String extractIdentifier(Path file,
            Path sourceRootPath);

    /**
     * Extracts the names a source file depends on.
     *
     * @param file the source file to analyze
     * @param knownIdentifiers every component name in the project
     * @return dependency names, in source order
     * @throws IOException if file reading fails
     */
    protected abstract List<String> extractDependencies(Path file,
            Set<String> knownIdentifiers) throws IOException;

    /**
     * Lists every component of the project with its dependencies.
     *
     * @return the component snapshot, empty if no source file is found
     * @throws IOException if any file operation fails
     */
    @Override
    public List<ComponentDependencies> listComponents() throws IOException {
        LOG.info("Reading component structure from: {}", projectRoot);

        final List<Path> files = discoverFiles(projectRoot);
        LOG.info("Discovered {} source files", files.size());

        if (files.isEmpty()) {
            LOG.warn("No source files found in {}", projectRoot);
            return List.of();
        }

        final Path sourceRootPath = projectRoot.resolve(sourceRoot());

        final Map<Path, String> identifiers = new LinkedHashMap<>();
        for (final Path file : files) {
            identifiers.put(file, extractIdentifier(file, sourceRootPath));
        }

        final Set<String> known = Set.copyOf(identifiers.values());
        final List<ComponentDependencies> components = new ArrayList<>();
        int edges = 0;

        for (final Map.Entry<Path, String> entry : identifiers.entrySet()) {
            final List<String> deps = extractDependencies(entry.getKey(),
                    known);
            edges += deps.size();
            components.add(new ComponentDependencies(entry.getValue(), deps));
        }

        LOG.info("Component structure read: {} components, {} dependencies",
                components.size(), edges);

        return components;
    }

    /** @return the local project root */
    public Path projectRoot() {
        return projectRoot;
    }

}
