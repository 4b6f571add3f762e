package com.postx.pool.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI accountPoolOpenApi() {
        return new OpenAPI()
                .info(
                        new Info()
                                .title("PostX Account Pool API")
                                .version("v1")
                                .description(
                                        "Dispatch posts through rotating account pools and manage pool health"));
    }
}
