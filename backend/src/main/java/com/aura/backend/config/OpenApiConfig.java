package com.aura.backend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI auraOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("A.U.R.A Prediction Pipeline API")
                        .description("Upload customer data, run churn scoring and download the current batch")
                        .version("1.0"));
    }
}
