package com.pulpulitiko.referenceservice.config;

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

    @Value("${server.port:8081}")
    private String serverPort;

    @Bean
    public OpenAPI referenceServiceOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Reference Service API")
                        .description("""
                                Provides the reference data the import-processor validates officeholder rows against.
                                
                                **Exposed resources:**
                                - `/api/v1/reference/positions` - list valid positions
                                - `/api/v1/reference/parties` - list valid parties
                                - `/api/v1/reference/jurisdictions` - look up regions, provinces, cities, barangays and districts
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
