package com.pulpulitiko.registryservice.config;

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
 * Configures the global SpringDoc OpenAPI metadata for Swagger UI.
 */
@Configuration
public class OpenApiConfig {

    @Value("${server.port:8082}")
    private String serverPort;

    @Bean
    public OpenAPI registryServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Officeholder Registry API")
                        .description("""
                                Canonical registry of officeholder assignments.
                                
                                At most one assignment is current for a given position and jurisdiction.
                                Conflicting writes are rejected with **409 Conflict**; the `replace` endpoint
                                archives the current holder and installs the successor in a single call.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Pulpulitiko")
                                .url("https://github.com/pulpulitiko/officeholder-import"))
                        .license(new License()
                                .name("MIT")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local development server")
                ));
    }
}
