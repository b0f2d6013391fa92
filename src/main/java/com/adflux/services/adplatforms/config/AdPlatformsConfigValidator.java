package com.adflux.services.adplatforms.config;

import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.constants.Platform;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Fail-fast validation of the ad platform configuration.
 *
 * An enabled platform must carry every credential its authenticator needs, with
 * real values rather than placeholders (see {@link PlatformCredentials#missingFields()}).
 * Persisted token storage needs a 256-bit encryption key (TOKEN_ENCRYPTION_KEY, 64 hex chars).
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AdPlatformsConfigValidator {

    private static final Pattern HEX_KEY = Pattern.compile("[0-9a-fA-F]{64}");

    private final AdPlatformsProperties properties;

    @PostConstruct
    public void validate() {
        log.info("Validating ad platform configuration...");

        Map<Platform, PlatformCredentials> enabled = properties.getPlatforms().enabledCredentials();
        enabled.forEach(this::validateCredentials);

        String storage = properties.getAuth().getStorage();
        if (!"memory".equalsIgnoreCase(storage) && !"jpa".equalsIgnoreCase(storage)) {
            throw new IllegalStateException(failure("adplatforms.auth.storage", "ADPLATFORMS_TOKEN_STORAGE",
                    "must be 'memory' or 'jpa', was '" + storage + "'"));
        }
        if ("jpa".equalsIgnoreCase(storage)) {
            String key = properties.getAuth().getEncryptionKey();
            if (key == null || !HEX_KEY.matcher(key.trim()).matches()) {
                throw new IllegalStateException(failure("adplatforms.auth.encryption-key", "TOKEN_ENCRYPTION_KEY",
                        "must be 64 hex characters (generate with: openssl rand -hex 32)"));
            }
        }

        if (properties.getAuth().getRefreshThreshold().isNegative()) {
            throw new IllegalStateException(failure("adplatforms.auth.refresh-threshold", "ADPLATFORMS_REFRESH_THRESHOLD",
                    "must not be negative"));
        }

        log.info("Ad platform configuration validated. Enabled platforms: {}, token storage: {}",
                enabled.keySet(), storage);
    }

    private void validateCredentials(Platform platform, PlatformCredentials credentials) {
        List<String> missing = credentials.missingFields();
        if (!missing.isEmpty()) {
            throw new IllegalStateException(failure("adplatforms.platforms." + platform.getValue(),
                    platform.name() + "_*", "enabled but missing or placeholder: " + missing));
        }
        log.debug("{} credentials present", platform.getDisplayName());
    }

    private static String failure(String configKey, String envVar, String problem) {
        return String.format(
                "%n%n" +
                        "╔══════════════════════════════════════════════════════════════╗%n" +
                        "║  STARTUP FAILED - Invalid Ad Platform Configuration          ║%n" +
                        "╠══════════════════════════════════════════════════════════════╣%n" +
                        "║  Config key : %-48s ║%n" +
                        "║  Env var    : %-48s ║%n" +
                        "║  Problem    : %s%n" +
                        "╚══════════════════════════════════════════════════════════════╝%n",
                configKey, envVar, problem
        );
    }
}
