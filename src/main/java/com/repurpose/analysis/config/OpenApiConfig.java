package com.repurpose.analysis.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {
    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Drug Repurposing Analysis API")
                        .version("0.1.0")
                        .description("Concurrent evidence collection, weighted scoring and Go/No-Go decisions for drug repurposing candidates."))
                .addTagsItem(new Tag().name("analysis").description("Run a repurposing analysis"))
                .addTagsItem(new Tag().name("reference").description("Medicine reference dataset lookups"));
    }
}
