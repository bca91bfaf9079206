package com.example.clustermonitor.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Minimal MCP server used by the process-level tests. Reads one JSON-RPC request per
 * line on stdin and answers on stdout; behaviour is chosen by method or tool name.
 */
public final class StubMcpServer {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final Map<String, Integer> CALLS = new HashMap<>();

    private StubMcpServer() {
    }

    /**
     * Command line that starts this stub with the current JVM and classpath.
     */
    public static List<String> command() {
        String java = Path.of(System.getProperty("java.home"), "bin", "java").toString();
        return List.of(java, "-cp", System.getProperty("java.class.path"), StubMcpServer.class.getName());
    }

    public static void main(String[] args) throws Exception {
        PrintStream out = new PrintStream(System.out, true, StandardCharsets.UTF_8);
        System.err.println("stub mcp server ready");
        BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        String line;
        while ((line = in.readLine()) != null) {
            JsonNode request = MAPPER.readTree(line);
            long id = request.path("id").asLong();
            String method = request.path("method").asText();
            JsonNode params = request.path("params");
            int calls = CALLS.merge(method + ":" + params.path("name").asText(), 1, Integer::sum);

            switch (method) {
                case "ping" -> out.println(result(id, MAPPER.getNodeFactory().textNode("pong")));
                case "silent" -> { }
                case "slow" -> {
                    Thread.sleep(params.path("millis").asLong(200));
                    out.println(result(id, MAPPER.getNodeFactory().textNode("late")));
                }
                case "garbage" -> out.println("this is not json");
                case "wrong_id" -> out.println(result(id + 1000, MAPPER.getNodeFactory().textNode("pong")));
                case "exit" -> System.exit(3);
                case "tools/list" -> out.println(result(id, toolList(calls)));
                case "tools/call" -> out.println(toolCall(id, params, calls));
                default -> {
                    ObjectNode echo = MAPPER.createObjectNode();
                    echo.set("echo", params);
                    out.println(result(id, echo));
                }
            }
        }
    }

    private static JsonNode toolList(int generation) {
        ObjectNode result = MAPPER.createObjectNode();
        result.put("generation", generation);
        var tools = result.putArray("tools");
        tools.addObject().put("name", "get_cluster_health").put("description", "Cluster health summary")
                .putObject("inputSchema").put("type", "object");
        tools.addObject().put("name", "list_pods").put("description", "List pods")
                .putObject("inputSchema").put("type", "object");
        return result;
    }

    private static String toolCall(long id, JsonNode params, int calls) throws Exception {
        String name = params.path("name").asText();
        JsonNode arguments = params.path("arguments");
        return switch (name) {
            case "get_cluster_health" -> {
                ObjectNode health = MAPPER.createObjectNode();
                health.put("status", "healthy");
                health.put("nodes_ready", 1);
                health.put("nodes_count", 1);
                health.put("pods_running", 3);
                health.put("pods_failed", 0);
                yield result(id, health);
            }
            case "list_pods" -> {
                var pods = MAPPER.createArrayNode();
                pods.addObject().put("name", "web-1")
                        .put("namespace", arguments.path("namespace").asText("default"))
                        .put("status", "Running");
                yield result(id, pods);
            }
            case "flaky" -> {
                if (calls <= arguments.path("failures").asInt(0)) {
                    yield error(id, -32000, "Server busy");
                }
                ObjectNode ok = MAPPER.createObjectNode();
                ok.put("ok", true);
                ok.put("attempts", calls);
                yield result(id, ok);
            }
            case "broken" -> error(id, -32601, "Tool not found: broken");
            default -> {
                ObjectNode echo = MAPPER.createObjectNode();
                echo.set("echo", arguments);
                yield result(id, echo);
            }
        };
    }

    private static String result(long id, JsonNode value) throws Exception {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.set("result", value);
        return MAPPER.writeValueAsString(response);
    }

    private static String error(long id, int code, String message) throws Exception {
        ObjectNode response = MAPPER.createObjectNode();
        response.put("jsonrpc", "2.0");
        response.put("id", id);
        response.putObject("error").put("code", code).put("message", message);
        return MAPPER.writeValueAsString(response);
    }
}
