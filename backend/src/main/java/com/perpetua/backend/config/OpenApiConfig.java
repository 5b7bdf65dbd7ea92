package com.perpetua.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI perpetuaOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Perpetua Execution Core API")
                        .version("1.0"));
    }
}
