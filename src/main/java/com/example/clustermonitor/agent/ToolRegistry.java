package com.example.clustermonitor.agent;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Registry for the tools the agent layer may call.
 * Cluster tools are discovered from the MCP server and registered here at runtime.
 */
@Slf4j
@Component
public class ToolRegistry {

    private final Map<String, AgentTool> tools = new ConcurrentHashMap<>();

    /**
     * Register a tool, replacing any tool of the same name.
     */
    public void register(AgentTool tool) {
        tools.put(tool.getName(), tool);
        log.info("Registered tool: {} ({})", tool.getName(), tool.getCategory());
    }

    /**
     * Unregister a tool.
     */
    public void unregister(String toolName) {
        tools.remove(toolName);
        log.info("Unregistered tool: {}", toolName);
    }

    /**
     * Get a tool by name.
     */
    public Optional<AgentTool> getTool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    /**
     * Get tools by category.
     */
    public List<AgentTool> getToolsByCategory(String category) {
        return tools.values().stream()
                .filter(tool -> tool.getCategory().equalsIgnoreCase(category))
                .collect(Collectors.toList());
    }

    /**
     * List all tool names with category and description.
     */
    public Map<String, String> listTools() {
        Map<String, String> toolList = new LinkedHashMap<>();
        tools.values().stream()
                .sorted(Comparator.comparing(AgentTool::getCategory).thenComparing(AgentTool::getName))
                .forEach(tool -> toolList.put(tool.getName(), tool.getCategory() + " - " + tool.getDescription()));
        return toolList;
    }

    public int getToolCount() {
        return tools.size();
    }
}
