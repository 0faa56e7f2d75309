package org.jstats.confidence_engine.core.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI apiInfo() {
        return new OpenAPI()
                .info(new Info()
                        .title("Confidence Engine API")
                        .description("Adaptive confidence calibration, outcome feedback and ensemble model administration.")
                        .version("v1")
                        .license(new License().name("Apache 2.0")));
    }
}
