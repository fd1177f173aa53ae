package co.fanki.changeimpact.impact.application;

import co.fanki.changeimpact.impact.domain.ContractComplianceException;
import co.fanki.changeimpact.impact.domain.ImpactAnalysisResult;
import co.fanki.changeimpact.impact.domain.ToleranceWarning;
import co.fanki.changeimpact.shared.DomainException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Command line surface of the engine.
 *
 * <p>Usage: {@code --change=<path> [--validate] [--output=<path>]}.
 * Exits with 0 on success, 1 when the analysis fails and 2 on usage
 * errors. Not active when the MCP stdio server runs.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Component
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "false",
        matchIfMissing = true)
public class ImpactCommand implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(
            ImpactCommand.class);

    /** Exit code on success. */
    static final int EXIT_OK = 0;

    /** Exit code when the analysis or its output fails. */
    static final int EXIT_FAILURE = 1;

    /** Exit code on invalid arguments. */
    static final int EXIT_USAGE = 2;

    static final String RESULTS_HEADER = "Impact Analysis Results:";

    private static final Set<String> OPTIONS = Set.of("change", "validate",
            "output", "help");

    private final ChangeImpactService service;

    private final ImpactResultWriter writer;

    private final PrintStream out;

    private final PrintStream err;

    private int exitCode = EXIT_OK;

    /**
     * Creates a command writing to the process standard streams.
     *
     * @param theService the analysis service
     * @param theWriter the result serializer
     */
    @Autowired
    public ImpactCommand(final ChangeImpactService theService,
            final ImpactResultWriter theWriter) {
        this(theService, theWriter, System.out, System.err);
    }

    ImpactCommand(final ChangeImpactService theService,
            final ImpactResultWriter theWriter, final PrintStream theOut,
            final PrintStream theErr) {
        this.service = theService;
        this.writer = theWriter;
        this.out = theOut;
        this.err = theErr;
    }

    /** {@inheritDoc} */
    @Override
    public void run(final ApplicationArguments args) {
        exitCode = execute(args);
    }

    /** {@inheritDoc} */
    @Override
    public int getExitCode() {
        return exitCode;
    }

    int execute(final ApplicationArguments args) {
        if (args.containsOption("help")
                || args.getNonOptionArgs().contains("-h")) {
            printUsage();
            return EXIT_OK;
        }

        for (final String name : args.getOptionNames()) {
            // dotted names are property overrides, e.g. --impact.source.root
            if (!OPTIONS.contains(name) && !name.contains(".")) {
                err.println("ERROR: unknown argument: --" + name);
                printUsage();
                return EXIT_USAGE;
            }
        }
        if (!args.getNonOptionArgs().isEmpty()) {
            err.println("ERROR: unexpected argument: "
                    + args.getNonOptionArgs().get(0));
            printUsage();
            return EXIT_USAGE;
        }

        final String change = singleValue(args, "change");
        if (change == null) {
            err.println("ERROR: --change=<path> is required");
            printUsage();
            return EXIT_USAGE;
        }
        final String output = singleValue(args, "output");
        if (args.containsOption("output") && output == null) {
            err.println("ERROR: --output requires a path");
            printUsage();
            return EXIT_USAGE;
        }

        try {
            final ImpactAnalysisResult result;
            if (args.containsOption("validate")) {
                final ChangeImpactService.Validation validation =
                        service.validate(Path.of(change));
                for (final ToleranceWarning warning : validation.warnings()) {
                    err.println("WARN: " + warning.message());
                }
                result = validation.result();
            } else {
                result = service.analyzeChangeImpact(Path.of(change));
            }

            if (output != null) {
                writer.write(result, Path.of(output));
                out.println("Impact analysis written to: " + output);
            } else {
                out.println(RESULTS_HEADER);
                out.print(writer.write(result));
            }
            return EXIT_OK;

        } catch (final ContractComplianceException e) {
            LOG.error("Change validation failed for {}", change, e);
            err.println("ERROR: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (final DomainException e) {
            LOG.error("Impact analysis failed for {}", change, e);
            err.println("ERROR: " + e.getMessage());
            return EXIT_FAILURE;
        } catch (final UncheckedIOException e) {
            LOG.error("Cannot write impact analysis to {}", output, e);
            err.println("ERROR: IO failure: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static String singleValue(final ApplicationArguments args,
            final String name) {
        final List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        final String value = values.get(values.size() - 1);
        return value == null || value.isBlank() ? null : value;
    }

    private void printUsage() {
        out.println("Usage: change-impact-engine --change=<path> [options]");
        out.println("Options:");
        out.println("  --change=<path>   Change specification document (YAML)");
        out.println("  --validate        Also validate affected contracts"
                + " and expected impact");
        out.println("  --output=<path>   Write the result to a file instead"
                + " of stdout");
        out.println("  --help, -h        Show this help");
    }

}
