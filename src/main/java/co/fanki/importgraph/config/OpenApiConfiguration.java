package co.fanki.importgraph.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * OpenAPI/Swagger configuration for the Import Graph MCP Server.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
@Configuration
public class OpenApiConfiguration {

    @Value("${server.port:8080}")
    private int serverPort;

    /**
     * Configures the OpenAPI specification.
     *
     * @return the OpenAPI configuration
     */
    @Bean
    public OpenAPI openAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Import Graph MCP Server API")
                        .description("""
                                Import Graph MCP Server - static dependency analysis of
                                JavaScript/TypeScript source trees for AI assistants.

                                ## Features
                                - **Module Graph**: forward and reverse import graph of a tree
                                - **Cycles**: every distinct circular import
                                - **Blast Radius**: transitive importers of a changed file
                                - **Dead Exports**: exported symbols nothing imports
                                - **Coupling**: hotspots and fan-in/fan-out outliers

                                ## MCP Tools
                                - `dependency_graph` - Build the module graph
                                - `find_cycles` - Find circular imports
                                - `blast_radius` - Files affected by a change
                                - `dead_exports` - Unused exports
                                - `coupling_report` - Coupling hotspots
                                """)
                        .version("0.0.1")
                        .contact(new Contact()
                                .name("Fanki")
                                .email("emiliano@fanki.co")
                                .url("https://fanki.co"))
                        .license(new License()
                                .name("Proprietary")
                                .url("https://fanki.co")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")));
    }

}
