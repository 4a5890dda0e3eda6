package no.cantara.worldview.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.modelcontextprotocol.json.jackson.JacksonMcpJsonMapper;
import io.modelcontextprotocol.server.McpSyncServer;
import io.modelcontextprotocol.server.transport.StdioServerTransportProvider;
import no.cantara.worldview.TokenTable;

import java.nio.file.Path;
import java.util.concurrent.CountDownLatch;

/**
 * CLI entry point for worldview-mcp.
 *
 * <pre>
 * Usage: worldview-mcp [worldview.wvf] [--read-only] [--tokens tokens.yaml]
 * </pre>
 */
public class WorldviewMcpCli {

    public static void main(String[] args) {
        Path    file       = Path.of("worldview.wvf");
        Path    tokensPath = null;
        boolean readOnly   = false;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--read-only" -> readOnly = true;
                case "--tokens"    -> {
                    if (i + 1 < args.length) tokensPath = Path.of(args[++i]);
                }
                default -> {
                    if (!args[i].startsWith("-")) {
                        file = Path.of(args[i]);
                    }
                }
            }
        }

        if (readOnly && !file.toFile().exists()) {
            System.err.println("[worldview-mcp] Error: " + file + " not found");
            System.exit(1);
        }

        StdioServerTransportProvider transport =
            new StdioServerTransportProvider(new JacksonMcpJsonMapper(new ObjectMapper()));

        McpSyncServer server;
        try {
            TokenTable tokens = tokensPath != null ? TokenTable.load(tokensPath) : TokenTable.defaults();
            server = WorldviewServer.createServer(file.toAbsolutePath(), transport, readOnly, tokens);
        } catch (Exception e) {
            System.err.println("[worldview-mcp] Startup error: " + e.getMessage());
            System.exit(1);
            return;
        }

        // Block the main thread; transport handles I/O on daemon threads.
        // The process exits when stdin is closed (e.g. MCP client disconnects).
        CountDownLatch latch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            server.close();
            latch.countDown();
        }));
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
