package no.cantara.worldview.mcp;

import io.modelcontextprotocol.server.McpServer;
import io.modelcontextprotocol.server.McpServerFeatures;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.spec.McpSchema;
import io.modelcontextprotocol.spec.McpServerTransportProvider;
import no.cantara.worldview.TokenTable;
import no.cantara.worldview.WorldviewValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.*;

/**
 * Builds and returns a configured MCP server for one Worldview file.
 *
 * <p>The edit tool is the only writer, and it writes only text that validates without errors.
 */
public final class WorldviewServer {

    private static final Logger log = LoggerFactory.getLogger(WorldviewServer.class);

    static final String SERVER_VERSION = "0.1.0";

    private WorldviewServer() {}

    // ── Internal helpers (package-private for tests) ──────────────────────────────

    /**
     * Tool definitions and their call handlers, keyed by tool name.
     * Package-private so tests can invoke handlers directly without a transport.
     */
    record ToolSet(
        List<McpSchema.Tool> tools,
        Map<String, ToolHandler> handlers
    ) {}

    @FunctionalInterface
    interface ToolHandler {
        McpSchema.CallToolResult handle(Map<String, Object> arguments);
    }

    static ToolSet buildTools(Path file, boolean readOnly, TokenTable tokens) {
        List<McpSchema.Tool>     tools    = new ArrayList<>();
        Map<String, ToolHandler> handlers = new LinkedHashMap<>();

        // ── read ──────────────────────────────────────────────────────────────────
        tools.add(WorldviewMapper.buildReadTool());
        handlers.put(WorldviewMapper.READ_TOOL, args -> {
            try {
                return WorldviewMapper.textResult(WorldviewContent.readNumbered(file), false);
            } catch (IOException e) {
                log.warn("Could not read {}", file, e);
                return WorldviewMapper.textResult("Error reading file: " + e.getMessage(), true);
            }
        });

        // ── edit ──────────────────────────────────────────────────────────────────
        if (!readOnly) {
            tools.add(WorldviewMapper.buildEditTool());
            handlers.put(WorldviewMapper.EDIT_TOOL, args -> edit(file, args, tokens));
        }

        // ── validate ──────────────────────────────────────────────────────────────
        tools.add(WorldviewMapper.buildValidateTool());
        handlers.put(WorldviewMapper.VALIDATE_TOOL, args -> {
            Object text = args != null ? args.get("text") : null;
            try {
                String content = text instanceof String s ? s : WorldviewContent.readOrEmpty(file);
                WorldviewValidator.ValidationResult result = WorldviewValidator.validate(content, tokens);
                return WorldviewMapper.textResult(WorldviewMapper.buildReportJson(result), false);
            } catch (IOException e) {
                log.warn("Could not read {}", file, e);
                return WorldviewMapper.textResult("Error reading file: " + e.getMessage(), true);
            }
        });

        return new ToolSet(tools, handlers);
    }

    private static McpSchema.CallToolResult edit(Path file, Map<String, Object> args, TokenTable tokens) {
        List<WorldviewEditor.Edit> edits;
        WorldviewEditor.Proposal proposal;
        try {
            edits = WorldviewMapper.parseEdits(args);
            proposal = WorldviewEditor.propose(WorldviewContent.readOrEmpty(file), edits, tokens);
        } catch (WorldviewEditor.EditException e) {
            return WorldviewMapper.textResult(e.getMessage(), true);
        } catch (IOException e) {
            log.warn("Could not read {}", file, e);
            return WorldviewMapper.textResult("Error reading file: " + e.getMessage(), true);
        }

        if (!proposal.accepted()) {
            log.info("Rejected edit of {}: {} error(s)", file, proposal.validation().errors().size());
            return WorldviewMapper.textResult(WorldviewMapper.rejection(proposal.validation()), true);
        }

        try {
            WorldviewContent.write(file, proposal.content());
        } catch (IOException e) {
            log.error("Could not write {}", file, e);
            return WorldviewMapper.textResult("Error writing file: " + e.getMessage(), true);
        }
        log.info("Applied {} edit(s) to {}", edits.size(), file);
        return WorldviewMapper.textResult(WorldviewMapper.editSummary(edits.size(), proposal.validation()), false);
    }

    static McpSchema.ReadResourceResult readDocument(Path file, String uri) {
        try {
            return new McpSchema.ReadResourceResult(
                List.of(new McpSchema.TextResourceContents(uri, "text/plain", WorldviewContent.readOrEmpty(file), null)),
                null
            );
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    // ── Public factory ────────────────────────────────────────────────────────────

    /**
     * Returns a configured MCP sync server for the Worldview file at {@code file}.
     * The file does not have to exist yet; the edit tool creates it.
     *
     * @param file      path to the .wvf file
     * @param transport MCP transport provider (e.g. StdioServerTransportProvider)
     * @param readOnly  if true, the edit tool is not offered
     * @param tokens    token table used for every validation
     */
    public static McpSyncServer createServer(
            Path file,
            McpServerTransportProvider transport,
            boolean readOnly,
            TokenTable tokens) {

        ToolSet ts  = buildTools(file, readOnly, tokens);
        String slug = WorldviewMapper.documentSlug(file);

        log.info("Serving '{}' with {} tool(s){}", file, ts.tools().size(), readOnly ? " (read-only)" : "");

        McpSyncServer server = McpServer.sync(transport)
            .serverInfo("worldview-" + slug, SERVER_VERSION)
            .capabilities(McpSchema.ServerCapabilities.builder()
                .tools(true)
                .resources(null, null)
                .build())
            .build();

        for (McpSchema.Tool tool : ts.tools()) {
            ToolHandler handler = ts.handlers().get(tool.name());
            server.addTool(McpServerFeatures.SyncToolSpecification.builder()
                .tool(tool)
                .callHandler((exchange, request) -> handler.handle(request.arguments()))
                .build());
        }

        McpSchema.Resource document = WorldviewMapper.buildDocumentResource(slug, file);
        server.addResource(new McpServerFeatures.SyncResourceSpecification(
            document,
            (exchange, request) -> readDocument(file, request.uri())
        ));

        return server;
    }
}
