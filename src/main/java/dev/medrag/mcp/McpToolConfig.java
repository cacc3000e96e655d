package dev.medrag.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Publishes the {@code @Tool} methods of {@link McpToolService} to Spring AI's MCP server, which
 * serves them over the active transport (stdio or SSE).
 */
@Configuration
public class McpToolConfig {

    @Bean
    public ToolCallbackProvider medicalEvidenceTools(McpToolService toolService) {
        return MethodToolCallbackProvider.builder()
                .toolObjects(toolService)
                .build();
    }
}
