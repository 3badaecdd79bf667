package org.resourcefinder.mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * MCP 工具注册配置。
 * <p>
 * Spring AI MCP Server 会从容器中收集 {@link ToolCallback}，通过 stdio 把
 * {@code find_resources}、{@code list_project_roots} 暴露给调用方。
 */
@Configuration(proxyBeanMethods = false)
public class McpToolConfiguration {

    @Bean
    public List<ToolCallback> resourceFinderToolCallbacks(ResourceFinderMcpTools tools) {
        return Arrays.asList(ToolCallbacks.from(tools));
    }
}
