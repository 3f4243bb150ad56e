package com.hospitality.staysync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.info.License;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI staySyncOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Stay Sync Service API")
                        .description("Receives PMS webhooks, triggers the daily pull of tomorrow's check-ins and answers live breakfast lookups for stays.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Guest Platform Team")
                                .email("guest-platform@example.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
