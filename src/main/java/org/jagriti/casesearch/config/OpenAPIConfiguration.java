package org.jagriti.casesearch.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenAPIConfiguration {

    @Bean
    public OpenAPI openAPI(final ApiInfoProperties apiInfo) {
        return new OpenAPI().info(new Info()
                .title(apiInfo.title())
                .version(apiInfo.version())
                .description(apiInfo.description()));
    }
}
