package org.tanzu.context7mcp;

import org.springframework.ai.support.ToolCallbacks;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.tanzu.context7mcp.context7.Context7Service;

import java.util.List;

/**
 * Main Spring Boot application class for the Context7 MCP (Model Context Protocol) Server.
 * 
 * This application exposes the Context7 documentation catalog as MCP tools that
 * AI assistants can call to resolve library names to Context7 library IDs and to
 * fetch documentation text, for one library or several at once.
 * 
 * Key features:
 * - Calls the Context7 catalog REST API with encrypted caller identity and bearer authentication
 * - Concurrent, order-preserving multi-library lookups
 * - Supports Cloud Foundry deployment with service binding
 * 
 * @author Context7 MCP Team
 * @version 1.0.0
 */
@SpringBootApplication
@EnableConfigurationProperties
public class Context7McpApplication {

    /**
     * Main application entry point.
     * 
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(Context7McpApplication.class, args);
    }

    /**
     * Registers the Context7 tools with the MCP server.
     * 
     * The ToolCallbacks are discovered from the @Tool methods of Context7Service
     * and picked up by Spring AI's MCP server auto-configuration.
     * 
     * @param context7Service The service containing the Context7 tools
     * @return List of ToolCallback objects representing the available MCP tools
     */
    @Bean
    public List<ToolCallback> registerTools(Context7Service context7Service) {
        return List.of(ToolCallbacks.from(context7Service));
    }
}
