package com.fintech.donations.config;

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
    public OpenAPI donationLedgerOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Donation Webhook Ledger API")
                        .description("Stripe webhook endpoint and operational API for the donation ledger. Records donations, recurring donations and campaign totals exactly once per Stripe payment.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("FinTech Team")
                                .email("fintech@example.com"))
                        .license(new License()
                                .name("MIT License")
                                .url("https://opensource.org/licenses/MIT")))
                .servers(List.of(
                        new Server().url("http://localhost:8080").description("Development server")
                ));
    }
}
