package co.fanki.changeimpact.config;

import co.fanki.changeimpact.contract.domain.ContractValidator;
import co.fanki.changeimpact.impact.application.ChangeImpactService;
import co.fanki.changeimpact.impact.application.ChangeSpecificationReader;
import co.fanki.changeimpact.impact.domain.CodeStructureProvider;
import co.fanki.changeimpact.impact.domain.ComponentDependencies;
import co.fanki.changeimpact.impact.domain.GraphBuilder;
import co.fanki.changeimpact.impact.domain.ImpactPropagator;
import co.fanki.changeimpact.impact.domain.MitigationAdvisor;
import co.fanki.changeimpact.impact.domain.RiskClassifier;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PipedInputStream;
import java.io.PipedOutputStream;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Integration tests for the change impact MCP tools.
 *
 * <p>Simulates an LLM client communicating with the MCP server via the
 * stdio transport using in-process pipes. Validates the full JSON-RPC
 * protocol: initialize handshake, tool listing, and tool invocation.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
class ChangeImpactMcpToolTest {

    private McpSyncServer server;
    private PrintWriter clientWriter;
    private BufferedReader clientReader;
    private PipedOutputStream clientToServer;

    @TempDir
    Path dir;

    @BeforeEach
    void setUp() throws Exception {
        final ObjectMapper objectMapper = new ObjectMapper();

        // Wire pipes: client writes → serverIn; server writes → serverToClient.
        clientToServer = new PipedOutputStream();
        final PipedInputStream serverIn =
                new PipedInputStream(clientToServer);
        final PipedOutputStream serverOut = new PipedOutputStream();
        final PipedInputStream serverToClient =
                new PipedInputStream(serverOut);

        final CodeStructureProvider structureProvider =
                mock(CodeStructureProvider.class);
        when(structureProvider.listComponents()).thenReturn(List.of(
                ComponentDependencies.of("Checkout", "PayAPI"),
                ComponentDependencies.of("PayAPI")));

        final ChangeImpactService service = new ChangeImpactService(
                structureProvider,
                mock(ContractValidator.class),
                new ChangeSpecificationReader(),
                new GraphBuilder(),
                new ImpactPropagator(),
                new RiskClassifier(),
                new MitigationAdvisor(),
                Runnable::run,
                0.2);

        final StdioServerTransportProvider transport =
                new StdioServerTransportProvider(
                        objectMapper, serverIn, serverOut);

        server = new McpStdioServerConfiguration()
                .mcpSyncServer(transport, service, objectMapper);

        clientWriter = new PrintWriter(
                new OutputStreamWriter(clientToServer));
        clientReader = new BufferedReader(
                new InputStreamReader(serverToClient));

        performHandshake();
    }

    @AfterEach
    void tearDown() {
        try {
            clientToServer.close();
        } catch (final Exception ignored) {}
        if (server != null) {
            server.close();
        }
    }

    @Test
    void whenListingTools_shouldIncludeEveryImpactTool() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":10,\"method\":\"tools/list\","
                + "\"params\":{}}");

        final JsonNode tools = readJson().path("result").path("tools");
        assertTrue(tools.isArray());

        final Set<String> names = new HashSet<>();
        for (final JsonNode tool : tools) {
            names.add(tool.path("name").asText());
        }
        assertEquals(Set.of("analyze_change_impact", "validate_change",
                "calculate_impact_scores"), names);
    }

    @Test
    void whenCallingAnalyze_givenSpecificationPath_shouldReturnResult()
            throws Exception {
        final Path spec = dir.resolve("change.yaml");
        Files.writeString(spec, """
                component: PayAPI
                changeType: implementation
                """);

        callTool(20, "analyze_change_impact",
                "{\"changeSpecPath\":\"" + jsonPath(spec) + "\"}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode body = new ObjectMapper().readTree(
                result.path("content").get(0).path("text").asText());
        assertTrue(body.path("impactScores").has("PayAPI"));
        assertTrue(body.path("affectedComponents").has("high"));
    }

    @Test
    void whenCallingValidate_givenMissingSpecification_shouldReturnError()
            throws Exception {
        callTool(21, "validate_change",
                "{\"changeSpecPath\":\""
                        + jsonPath(dir.resolve("absent.yaml")) + "\"}");

        final JsonNode result = readJson().path("result");
        assertTrue(result.path("isError").asBoolean(),
                "Missing specification should return isError=true");
    }

    @Test
    void whenCallingCalculateScores_givenComponent_shouldReturnScores()
            throws Exception {
        callTool(22, "calculate_impact_scores",
                "{\"component\":\"PayAPI\",\"changeType\":\"other\","
                        + "\"affectedContracts\":[]}");

        final JsonNode result = readJson().path("result");
        assertFalse(result.path("isError").asBoolean());
        final JsonNode scores = new ObjectMapper().readTree(
                result.path("content").get(0).path("text").asText());
        assertTrue(scores.path("PayAPI").asDouble()
                > scores.path("Checkout").asDouble());
    }

    @Test
    void whenConnecting_shouldAnswerInitializeBeforeAnyNotification()
            throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":11,\"method\":\"tools/list\","
                + "\"params\":{}}");

        final JsonNode response = readJson();
        assertEquals(11, response.path("id").asInt(),
                "Unexpected frame: " + response);
        assertEquals(3, response.path("result").path("tools").size());
    }

    @Test
    void whenCallingCalculateScores_givenMissingChangeType_shouldReturnError()
            throws Exception {
        callTool(23, "calculate_impact_scores",
                "{\"component\":\"PayAPI\"}");

        final JsonNode result = readJson().path("result");
        assertTrue(result.path("isError").asBoolean(),
                "Missing changeType should return isError=true");
        assertTrue(result.path("content").get(0).path("text").asText()
                .contains("Missing changeType"));
    }

    // --- private helpers ---

    private void callTool(final int id, final String name,
            final String arguments) {
        send("{\"jsonrpc\":\"2.0\",\"id\":" + id
                + ",\"method\":\"tools/call\","
                + "\"params\":{\"name\":\"" + name + "\","
                + "\"arguments\":" + arguments + "}}");
    }

    private static String jsonPath(final Path path) {
        return path.toAbsolutePath().toString().replace("\\", "\\\\");
    }

    private void performHandshake() throws Exception {
        send("{\"jsonrpc\":\"2.0\",\"id\":1,\"method\":\"initialize\","
                + "\"params\":{\"protocolVersion\":\"2024-11-05\","
                + "\"capabilities\":{},"
                + "\"clientInfo\":{\"name\":\"test-llm\","
                + "\"version\":\"1.0\"}}}");

        final JsonNode initialized = readJson();
        assertEquals(1, initialized.path("id").asInt(),
                "First frame must answer initialize: " + initialized);
        assertEquals("change-impact-engine", initialized.path("result")
                .path("serverInfo").path("name").asText());

        send("{\"jsonrpc\":\"2.0\","
                + "\"method\":\"notifications/initialized\","
                + "\"params\":{}}");

        // Brief pause to let the server register the initialized state
        Thread.sleep(50);
    }

    private void send(final String json) {
        clientWriter.println(json);
        clientWriter.flush();
    }

    private JsonNode readJson() throws Exception {
        final ObjectMapper objectMapper = new ObjectMapper();
        final CompletableFuture<String> future =
                CompletableFuture.supplyAsync(() -> {
                    try {
                        return clientReader.readLine();
                    } catch (final Exception e) {
                        throw new RuntimeException(e);
                    }
                });
        final String line = future.get(5, TimeUnit.SECONDS);
        assertNotNull(line, "Server did not respond within 5 seconds");
        return objectMapper.readTree(line);
    }

}
