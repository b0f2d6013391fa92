package com.adflux.services.adplatforms;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.servers.Server;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Ad Platforms Service
 *
 * This microservice handles:
 * - Token lifecycle for Meta, X, Google Ads, TikTok and Snapchat
 * - Job ad creation across each platform's campaign/ad-set/creative/ad graph
 * - Ad updates, deletion, status and performance reads
 * - Concurrent multi-platform publishing
 */
@SpringBootApplication
@OpenAPIDefinition(
        info = @Info(
                title = "Ad Platforms Service API",
                version = "1.0.0",
                description = "Publishes and manages job ad campaigns on Meta, X, Google Ads, TikTok and Snapchat."
        ),
        servers = {
                @Server(url = "http://localhost:8082", description = "Local Development")
        }
)
public class AdPlatformsServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(AdPlatformsServiceApplication.class, args);
    }
}
