package com.eventspotter.catalog.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API description served at {@code /v3/api-docs}, browsable at {@code /swagger-ui.html}.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI catalogOpenApi(@Value("${eventspotter.api.version:0.1.0}") String version) {
        return new OpenAPI()
                .info(new Info()
                        .title("EventSpotter Catalog API")
                        .description("Community events: discovery, facets, saved events and user profiles. "
                                + "Callers identify themselves with the X-User-Id header.")
                        .version(version));
    }
}
