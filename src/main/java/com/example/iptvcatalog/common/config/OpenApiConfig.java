package com.example.iptvcatalog.common.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI iptvCatalogOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("IPTV Catalog API")
                        .description("M3U source registration, sync trigger and sync status endpoints")
                        .version("v1")
                        .contact(new Contact().name("iptv-catalog")));
    }
}
