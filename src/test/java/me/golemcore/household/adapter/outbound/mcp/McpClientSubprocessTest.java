package me.golemcore.household.adapter.outbound.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.household.domain.exception.HandshakeException;
import me.golemcore.household.domain.model.ToolCallResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Drives {@link McpClient} against a real child process: a shell script that
 * rejects the newest protocol version and prints noise before each response.
 */
@EnabledOnOs({ OS.LINUX, OS.MAC })
class McpClientSubprocessTest {

    private static final String SERVER_SCRIPT = """
            while IFS= read -r line; do
              id=$(printf '%s' "$line" | sed -n 's/.*"id":\\([0-9][0-9]*\\).*/\\1/p')
              [ -z "$id" ] && continue
              case "$line" in
                *'"method":"initialize"'*'"2025-06-18"'*)
                  echo "{\\"jsonrpc\\":\\"2.0\\",\\"id\\":$id,\\"error\\":{\\"code\\":-32602,\\"message\\":\\"unsupported\\"}}" ;;
                *'"method":"initialize"'*)
                  echo "{\\"jsonrpc\\":\\"2.0\\",\\"id\\":$id,\\"result\\":{\\"protocolVersion\\":\\"2025-03-26\\"}}" ;;
                *'"method":"tools/call"'*)
                  echo "connecting to spreadsheet..."
                  echo "{\\"jsonrpc\\":\\"2.0\\",\\"id\\":$id,\\"result\\":{\\"content\\":[{\\"type\\":\\"text\\",\\"text\\":\\"4\\"}]}}" ;;
              esac
            done
            """;

    @TempDir
    Path workDir;

    private final List<StdioProcessTransport> transports = new ArrayList<>();

    private McpClient client(String script, List<String> versions) {
        McpClientSettings settings = new McpClientSettings(versions, Duration.ofSeconds(10), Duration.ofSeconds(10),
                Duration.ofSeconds(2));
        McpServerLaunch launch = new McpServerLaunch(List.of("/bin/sh", "-c", script), workDir, Map.of());
        return new McpClient("shell_server", launch, settings, new ObjectMapper(), id -> {
            StdioProcessTransport transport = new StdioProcessTransport(id);
            transports.add(transport);
            return transport;
        });
    }

    @Test
    void shouldNegotiateOlderVersionAndCallToolOverRealPipes() throws Exception {
        McpClient client = client(SERVER_SCRIPT, List.of("2025-06-18", "2025-03-26", "2024-11-05"));
        try {
            client.start();

            assertEquals("2025-03-26", client.getNegotiatedProtocolVersion());
            ToolCallResult result = client.callTool("add_numbers", Map.of("a", 2, "b", 2));
            assertTrue(result.isSuccess());
            assertEquals("4", result.getRawText());
        } finally {
            client.stop();
        }
        assertFalse(transports.get(0).isAlive());
    }

    @Test
    void shouldKillProcessWhenHandshakeFails() {
        McpClient client = client(SERVER_SCRIPT, List.of("2025-06-18"));

        assertThrows(HandshakeException.class, client::start);

        assertEquals(McpClientState.FAILED, client.getState());
        assertFalse(transports.get(0).isAlive());
    }

    @Test
    void shouldFailHandshakeWhenServerDiesImmediately() {
        McpClient client = client("echo 'ImportError: no module named household_mcp' >&2; exit 1",
                List.of("2025-06-18"));

        HandshakeException error = assertThrows(HandshakeException.class, client::start);

        assertTrue(error.getMessage().contains("failed during initialize"));
        assertEquals(McpClientState.FAILED, client.getState());
    }
}
