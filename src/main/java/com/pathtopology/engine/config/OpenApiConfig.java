package com.pathtopology.engine.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI documentation, served at /swagger-ui.html and /v3/api-docs.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI pathTopologyOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Path Topology Engine API")
                        .description("Dynamic segmentation over a network of path segments.\n\n" +
                                "## Segment writes\n\n" +
                                "Every insert or geometry update runs, in one transaction:\n" +
                                "1. overlap check against the other segments (409 on overlap, 422 on non-simple lines)\n" +
                                "2. elevation draping through the elevation API (503 when unavailable)\n" +
                                "3. boundary events against cities, districts and restricted areas\n" +
                                "4. geometry resynchronization of every linked event\n\n" +
                                "Deleting a segment orphans the events that lose their last link and " +
                                "unpublishes the routes built on them.\n\n" +
                                "## Notifications\n\n" +
                                "STOMP endpoint `/ws/topology`, topic `/topic/topology`: one notice per committed " +
                                "segment write, carrying the regenerated boundary event ids.")
                        .version("1.0.0"))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")
                ));
    }
}
