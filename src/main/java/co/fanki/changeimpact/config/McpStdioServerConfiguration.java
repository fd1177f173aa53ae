package co.fanki.changeimpact.config;

import co.fanki.changeimpact.impact.application.ChangeImpactService;
import co.fanki.changeimpact.impact.domain.ChangeSpecification;
import co.fanki.changeimpact.impact.domain.ChangeSpecificationException;
import co.fanki.changeimpact.impact.domain.ChangeType;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpSchema.CallToolResult;
import io.modelcontextprotocol.spec.McpSchema.ServerCapabilities;
import io.modelcontextprotocol.spec.McpSchema.Tool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Configures the MCP stdio server that exposes the engine as tools.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * the command line runner is disabled and an MCP server communicates via
 * stdin/stdout using the JSON-RPC protocol.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String CHANGE_SPEC_PATH_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "changeSpecPath": {
                  "type": "string",
                  "description": "Path to the change specification YAML"
                }
              },
              "required": ["changeSpecPath"]
            }
            """;

    private static final String CALCULATE_IMPACT_SCORES_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "component": {
                  "type": "string",
                  "description": "The component being changed"
                },
                "changeType": {
                  "type": "string",
                  "description": "contract, implementation, resource or other"
                },
                "affectedContracts": {
                  "type": "array",
                  "description": "Contracts touched by the change",
                  "items": {
                    "type": "string"
                  }
                }
              },
              "required": ["component", "changeType"]
            }
            """;

    /**
     * Creates the stdio transport provider for MCP communication.
     *
     * @param objectMapper the Jackson ObjectMapper for JSON serialization
     * @return the stdio server transport provider
     */
    @Bean
    StdioServerTransportProvider stdioServerTransportProvider(
            final ObjectMapper objectMapper) {
        return new StdioServerTransportProvider(objectMapper);
    }

    /**
     * Creates and configures the MCP synchronous server with all tools.
     *
     * @param transportProvider the stdio transport provider
     * @param changeImpactService the service that handles all tool calls
     * @param objectMapper the Jackson ObjectMapper for response serialization
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final ChangeImpactService changeImpactService,
            final ObjectMapper objectMapper) {

        // registered before build(): no list_changed ahead of initialize
        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("change-impact-engine", "1.0.0")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .tools(analyzeChangeImpactTool(changeImpactService,
                                objectMapper),
                        validateChangeTool(changeImpactService, objectMapper),
                        calculateImpactScoresTool(changeImpactService,
                                objectMapper))
                .build();

        LOG.info("MCP stdio server initialized with 3 tools");

        return server;
    }

    /**
     * Keeps the JVM alive while the MCP server is running.
     *
     * @return the command line runner that blocks on a latch
     */
    @Bean
    CommandLineRunner mcpServerRunner() {
        return args -> {
            LOG.info("MCP stdio server is running. Waiting for input...");
            new CountDownLatch(1).await();
        };
    }

    private McpServerFeatures.SyncToolSpecification analyzeChangeImpactTool(
            final ChangeImpactService service,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("analyze_change_impact",
                        "Predict which components are affected by the"
                                + " change described in a change"
                                + " specification YAML. Returns impact"
                                + " scores, risk areas, suggested"
                                + " mitigations and components grouped"
                                + " by impact tier.",
                        CHANGE_SPEC_PATH_SCHEMA),
                (exchange, arguments) -> {
                    final String path =
                            (String) arguments.get("changeSpecPath");

                    try {
                        final var result = service.analyzeChangeImpact(
                                Path.of(path));
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private McpServerFeatures.SyncToolSpecification validateChangeTool(
            final ChangeImpactService service,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("validate_change",
                        "Analyze a change and validate every affected"
                                + " contract. Fails when a contract is"
                                + " invalid or unknown. Expected impact"
                                + " mismatches are returned as warnings.",
                        CHANGE_SPEC_PATH_SCHEMA),
                (exchange, arguments) -> {
                    final String path =
                            (String) arguments.get("changeSpecPath");

                    try {
                        final var result = service.validate(Path.of(path));
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private McpServerFeatures.SyncToolSpecification calculateImpactScoresTool(
            final ChangeImpactService service,
            final ObjectMapper objectMapper) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool("calculate_impact_scores",
                        "Compute the raw impact score of every component"
                                + " for a change, without risk"
                                + " classification.",
                        CALCULATE_IMPACT_SCORES_SCHEMA),
                (exchange, arguments) -> {
                    try {
                        final String component =
                                (String) arguments.get("component");
                        final String changeType =
                                (String) arguments.get("changeType");
                        final List<String> contracts = new ArrayList<>();
                        if (arguments.get("affectedContracts")
                                instanceof List<?> raw) {
                            for (final Object contract : raw) {
                                contracts.add(String.valueOf(contract));
                            }
                        }

                        if (changeType == null || changeType.isBlank()) {
                            throw new ChangeSpecificationException(
                                    "Missing changeType");
                        }
                        if (!ChangeType.isRecognized(changeType)) {
                            LOG.warn("Unrecognized changeType '{}', using"
                                    + " multiplier {}", changeType,
                                    ChangeType.OTHER.multiplier());
                        }

                        final ChangeSpecification change =
                                ChangeSpecification.of(component,
                                        ChangeType.fromValue(changeType),
                                        contracts);

                        final var result = service
                                .calculateImpactScores(change);
                        return toCallToolResult(objectMapper, result);
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private CallToolResult toCallToolResult(final ObjectMapper objectMapper,
            final Object result) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), false);
        } catch (final Exception e) {
            return errorResult(e);
        }
    }

    private CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
