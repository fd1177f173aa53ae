package co.fanki.changeimpact.structure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Java implementation of {@link SourceStructureProvider}.
 *
 * <p>Discovers .java files under src/main/java, names each component by
 * its fully-qualified class name and derives dependencies from import
 * statements. Wildcard imports are skipped; static imports count as a
 * dependency on their declaring class.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class JavaSourceStructureProvider extends SourceStructureProvider {

    private static final Logger LOG = LoggerFactory.getLogger(
            JavaSourceStructureProvider.class);

    private static final String SOURCE_ROOT = "src/main/java";

    private final boolean includeExternalDependencies;

    /**
     * Creates a provider that only keeps imports of project classes.
     *
     * @param projectRoot the project root
     */
    public JavaSourceStructureProvider(final Path projectRoot) {
        this(projectRoot, false);
    }

    /**
     * Creates a provider.
     *
     * @param projectRoot the project root
     * @param theIncludeExternalDependencies when true, imports of classes
     *        outside the project are kept as dependencies too
     */
    public JavaSourceStructureProvider(final Path projectRoot,
            final boolean theIncludeExternalDependencies) {
        super(projectRoot);
        this.includeExternalDependencies = theIncludeExternalDependencies;
    }

    /** {@inheritDoc} */
    @Override
    public String sourceRoot() {
        return SOURCE_ROOT;
    }

    /**
     * Discovers all .java files under src/main/java, sorted by path.
     *
     * @param root the local project root directory
     * @return list of .java file paths
     * @throws IOException if file discovery fails
     */
    @Override
    protected List<Path> discoverFiles(final Path root) throws IOException {
        final Path sourceDir = root.resolve(SOURCE_ROOT);

        if (!Files.isDirectory(sourceDir)) {
            LOG.warn("Source root not found: {}", sourceDir);
            return List.of();
        }

        try (Stream<Path> walk = Files.walk(sourceDir)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> p.toString().endsWith(".java"))
                    .filter(p -> !p.getFileName().toString()
                            .equals("package-info.java"))
                    .sorted()
                    .toList();
        }
    }

    /**
     * Converts a .java file path to a fully-qualified class name.
     *
     * @param file the .java file path
     * @param sourceRootPath the resolved source root path
     * @return the FQCN (e.g., "co.fanki.checkout.Cart")
     */
    @Override
    protected String extractIdentifier(final Path file,
            final Path sourceRootPath) {
        String result = sourceRootPath.relativize(file).toString();

        if (result.endsWith(".java")) {
            result = result.substring(0, result.length() - 5);
        }

        return result.replace('/', '.').replace('\\', '.');
    }

    /**
     * Extracts import dependencies from a Java source file.
     *
     * <p>Scanning stops at the first type declaration. Each imported class
     * is listed once.</p>
     *
     * @param file the Java source file
     * @param knownIdentifiers all component names in the project
     * @return dependency FQCNs in import order
     * @throws IOException if file reading fails
     */
    @Override
    protected List<String> extractDependencies(final Path file,
            final Set<String> knownIdentifiers) throws IOException {

        final Set<String> deps = new LinkedHashSet<>();

        for (final String line : Files.readAllLines(file)) {
            final String trimmed = line.trim();

            if (isTypeDeclaration(trimmed)) {
                break;
            }

            final String imported = parseImportLine(trimmed);
            if (imported == null) {
                continue;
            }
            if (includeExternalDependencies
                    || knownIdentifiers.contains(imported)) {
                deps.add(imported);
            }
        }

        return new ArrayList<>(deps);
    }

    /**
     * Parses a single import line into the imported class name.
     *
     * @param importLine a trimmed source line
     * @return the class FQCN, or null for non-import and wildcard lines
     */
    String parseImportLine(final String importLine) {
        if (importLine == null || !importLine.startsWith("import ")) {
            return null;
        }

        String line = importLine.substring("import ".length()).trim();

        final boolean isStatic = line.startsWith("static ");
        if (isStatic) {
            line = line.substring("static ".length()).trim();
        }

        if (line.endsWith(";")) {
            line = line.substring(0, line.length() - 1).trim();
        }

        if (line.endsWith(".*")) {
            return null;
        }

        // static imports name a member; keep its declaring class
        if (isStatic) {
            final int lastDot = line.lastIndexOf('.');
            if (lastDot > 0) {
                line = line.substring(0, lastDot);
            }
        }

        return line.isBlank() ? null : line;
    }

    private boolean isTypeDeclaration(final String line) {
        if (line.startsWith("//") || line.startsWith("*")
                || line.startsWith("/*")) {
            return false;
        }
        return line.contains("class ")
                || line.contains("interface ")
                || line.contains("enum ")
                || line.contains("record ");
    }

}
