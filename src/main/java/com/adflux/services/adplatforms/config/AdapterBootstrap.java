package com.adflux.services.adplatforms.config;

import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.service.AdPlatformService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Registers an adapter for every platform enabled under adplatforms.platforms.
 * Authentication is deferred to the first operation on each platform.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdapterBootstrap implements ApplicationRunner {

    private final AdPlatformsProperties properties;
    private final AdPlatformService adPlatformService;

    @Override
    public void run(ApplicationArguments args) {
        Map<Platform, PlatformCredentials> enabled = properties.getPlatforms().enabledCredentials();
        if (enabled.isEmpty()) {
            log.warn("No ad platform is enabled; adapters can still be registered at runtime");
            return;
        }
        enabled.forEach((platform, credentials) ->
                adPlatformService.registerAdapter(credentials, properties.getPlatforms().clientOverrides(platform)));
        log.info("Registered adapters at startup: {}", adPlatformService.getRegisteredPlatforms());
    }
}
