package com.pulpulitiko.importprocessor.config;

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

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI importProcessorOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Import Processor API")
                        .description("""
                                Imports officeholder spreadsheets: every row is validated against the reference-service
                                and valid rows are reconciled into the registry-service, one position holder at a time.
                                
                                **Flow:**
                                1. `POST /api/v1/imports/validate` - optional dry run, returns every row error
                                2. `POST /api/v1/imports` - upload and start the import job (202 + importRunId)
                                3. `GET /api/v1/imports/{id}` - poll the run until `COMPLETED` or `FAILED`
                                4. `GET /api/v1/imports/{id}/error-report` - download the rows that were not imported
                                
                                Downstream calls are protected by Resilience4j bulkheads.
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
