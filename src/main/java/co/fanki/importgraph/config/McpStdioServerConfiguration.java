package co.fanki.importgraph.config;

import co.fanki.importgraph.analysis.application.DependencyAnalysisService;
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

import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.function.Function;

/**
 * Configures the MCP stdio server that exposes the dependency analyses
 * as tools.
 *
 * <p>When the {@code mcp.server.stdio} property is set to {@code true},
 * this configuration starts an MCP server that communicates via
 * stdin/stdout using the JSON-RPC protocol. Run it with the
 * {@code stdio} profile so that nothing but protocol messages reaches
 * stdout.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
@ConditionalOnProperty(name = "mcp.server.stdio", havingValue = "true")
public class McpStdioServerConfiguration {

    private static final Logger LOG = LoggerFactory.getLogger(
            McpStdioServerConfiguration.class);

    private static final String ROOT_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "root": {
                  "type": "string",
                  "description": "Absolute path of the directory to analyze"
                }
              },
              "required": ["root"]
            }
            """;

    private static final String GRAPH_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "root": {
                  "type": "string",
                  "description": "Absolute path of the directory to analyze"
                },
                "focus": {
                  "type": "string",
                  "description": "Keep only dependencies where either file path contains this text, for example src/billing"
                }
              },
              "required": ["root"]
            }
            """;

    private static final String BLAST_RADIUS_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "root": {
                  "type": "string",
                  "description": "Absolute path of the directory to analyze"
                },
                "target": {
                  "type": "string",
                  "description": "The changed file, absolute or relative to root"
                },
                "maxDepth": {
                  "type": "integer",
                  "description": "Deepest import hop to report (unbounded if absent)"
                }
              },
              "required": ["root", "target"]
            }
            """;

    private static final String DEAD_EXPORTS_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "root": {
                  "type": "string",
                  "description": "Absolute path of the directory to analyze"
                },
                "ignorePattern": {
                  "type": "string",
                  "description": "File name glob to skip, for example *.d.ts"
                }
              },
              "required": ["root"]
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
     * @param analysisService the service that runs every analysis
     * @param objectMapper the Jackson ObjectMapper for response serialization
     * @return the configured MCP sync server
     */
    @Bean
    McpSyncServer mcpSyncServer(
            final StdioServerTransportProvider transportProvider,
            final DependencyAnalysisService analysisService,
            final ObjectMapper objectMapper) {

        final McpSyncServer server = McpServer.sync(transportProvider)
                .serverInfo("import-graph-mcp-server", "0.0.1")
                .capabilities(ServerCapabilities.builder()
                        .tools(true)
                        .build())
                .build();

        for (final McpServerFeatures.SyncToolSpecification tool
                : tools(analysisService, objectMapper)) {
            server.addTool(tool);
        }

        LOG.info("MCP stdio server initialized with 5 tools");

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

    /**
     * Builds the tool specifications backed by the analysis service.
     *
     * @param analysisService the analysis service
     * @param objectMapper the mapper that renders tool results
     * @return the five analysis tools
     */
    static List<McpServerFeatures.SyncToolSpecification> tools(
            final DependencyAnalysisService analysisService,
            final ObjectMapper objectMapper) {
        return List.of(
                tool("dependency_graph",
                        "Build the module import graph of a JS/TS source"
                                + " tree. Returns each file with the files"
                                + " it imports and the files importing it,"
                                + " plus relative imports that did not"
                                + " resolve. Pass focus to narrow the graph"
                                + " to one module or directory.",
                        GRAPH_SCHEMA, objectMapper,
                        arguments -> analysisService.graph(
                                string(arguments, "root"),
                                string(arguments, "focus"))),
                tool("find_cycles",
                        "Find circular imports. Each cycle is a closed"
                                + " path whose first file is repeated at the"
                                + " end. Run before refactors that move code"
                                + " between modules.",
                        ROOT_SCHEMA, objectMapper,
                        arguments -> analysisService.cycles(
                                string(arguments, "root"))),
                tool("blast_radius",
                        "Compute which files are affected by changing a"
                                + " file: every transitive importer with its"
                                + " distance in import hops, the entry"
                                + " points reached and a narrow/medium/wide"
                                + " risk classification. Use this BEFORE"
                                + " editing a shared module.",
                        BLAST_RADIUS_SCHEMA, objectMapper,
                        arguments -> analysisService.blastRadius(
                                string(arguments, "root"),
                                string(arguments, "target"),
                                integer(arguments, "maxDepth"))),
                tool("dead_exports",
                        "Find exported symbols that no other file imports."
                                + " Conservative: a namespace, dynamic or"
                                + " require import keeps every export of the"
                                + " file alive.",
                        DEAD_EXPORTS_SCHEMA, objectMapper,
                        arguments -> analysisService.deadExports(
                                string(arguments, "root"),
                                string(arguments, "ignorePattern"))),
                tool("coupling_report",
                        "Report the most imported files and the files whose"
                                + " fan-in or fan-out is above the"
                                + " configured threshold.",
                        ROOT_SCHEMA, objectMapper,
                        arguments -> analysisService.coupling(
                                string(arguments, "root"))));
    }

    private static McpServerFeatures.SyncToolSpecification tool(
            final String name, final String description, final String schema,
            final ObjectMapper objectMapper,
            final Function<Map<String, Object>, Object> call) {

        return new McpServerFeatures.SyncToolSpecification(
                new Tool(name, description, schema),
                (exchange, arguments) -> {
                    try {
                        return toCallToolResult(objectMapper,
                                call.apply(arguments));
                    } catch (final Exception e) {
                        return errorResult(e);
                    }
                }
        );
    }

    private static String string(final Map<String, Object> arguments,
            final String name) {
        final Object value = arguments.get(name);
        return value == null ? null : value.toString();
    }

    private static Integer integer(final Map<String, Object> arguments,
            final String name) {
        return arguments.get(name) instanceof Number n ? n.intValue() : null;
    }

    private static CallToolResult toCallToolResult(
            final ObjectMapper objectMapper, final Object result) {
        try {
            final String json = objectMapper.writeValueAsString(result);
            return new CallToolResult(
                    List.of(new McpSchema.TextContent(json)), false);
        } catch (final Exception e) {
            return errorResult(e);
        }
    }

    private static CallToolResult errorResult(final Exception e) {
        LOG.error("Tool execution error", e);
        return new CallToolResult(
                List.of(new McpSchema.TextContent(
                        "Error: " + e.getMessage())), true);
    }

}
