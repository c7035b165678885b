package com.aigreentick.services.merchantonboarding;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Contact;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Merchant Onboarding Service
 *
 * This microservice handles:
 * - Merchant profile submission (write-once after the onboarding link is issued)
 * - Onboarding saga against the payment platform (legal entity → hosted onboarding link)
 * - Webhook ingestion (HMAC authentication, raw payload storage, classification, fan-out)
 * - Capability verification, payout sweep creation and the ONBOARDED transition
 *
 * @author AiGreenTick Team
 * @version 1.0.0
 */
@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Merchant Onboarding Service API",
                version = "1.0.0",
                description = "Merchant onboarding onto the payment platform: entity creation saga, " +
                        "webhook ingestion and capability verification.",
                contact = @Contact(
                        name = "AiGreenTick Support",
                        email = "support@aigreentick.com"
                )
        ),
        servers = {
                @Server(url = "http://localhost:8082", description = "Local Development"),
                @Server(url = "https://api.aigreentick.com", description = "Production")
        }
)
public class MerchantOnboardingServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(MerchantOnboardingServiceApplication.class, args);
    }
}
