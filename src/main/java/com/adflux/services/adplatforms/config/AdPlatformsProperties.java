package com.adflux.services.adplatforms.config;

import com.adflux.services.adplatforms.auth.credentials.*;
import com.adflux.services.adplatforms.constants.Platform;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed config properties for the ad platform integrations.
 *
 * Bound from application.yml under prefix "adplatforms":
 * ┌─────────────────────────────────────────────────────────────────┐
 * │  adplatforms:                                                   │
 * │    auth:                                                        │
 * │      refresh-threshold: 300s                                    │
 * │      storage:           memory | jpa                            │
 * │      encryption-key:    ${TOKEN_ENCRYPTION_KEY}                 │
 * │    fan-out:                                                     │
 * │      timeout:           120s                                    │
 * │    platforms:                                                   │
 * │      meta:                                                      │
 * │        enabled:      true                                       │
 * │        app-id:       ${META_APP_ID}                             │
 * │        client:                                                  │
 * │          timeout:    30s                                        │
 * └─────────────────────────────────────────────────────────────────┘
 *
 * Secrets come from environment variables. See AdPlatformsConfigValidator
 * for fail-fast startup validation.
 */
@Configuration
@ConfigurationProperties(prefix = "adplatforms")
@Data
public class AdPlatformsProperties {

    private Auth auth = new Auth();

    private FanOut fanOut = new FanOut();

    private Platforms platforms = new Platforms();

    @Data
    public static class Auth {

        /** How long before expiry a token refresh fires */
        private Duration refreshThreshold = Duration.ofSeconds(300);

        /** Schedule refreshes automatically after authenticate/refresh */
        private boolean autoRefresh = true;

        /** Token storage backend: memory or jpa */
        private String storage = "memory";

        /** AES-256 key as 64 hex chars; required when storage = jpa */
        private String encryptionKey;
    }

    @Data
    public static class FanOut {
        private int corePoolSize = 5;
        private int maxPoolSize = 10;
        private int queueCapacity = 50;

        /** Upper bound for one platform's share of a multi-platform call */
        private Duration timeout = Duration.ofSeconds(120);
    }

    /** Transport overrides applied over the fixed platform profile */
    @Data
    public static class ClientOverrides {
        private String baseUrl;
        private Duration timeout;
        private Integer retries;
        private Map<String, String> headers = new LinkedHashMap<>();
        private Boolean withCredentials;
    }

    @Data
    public static class Platforms {
        private Meta meta = new Meta();
        private X x = new X();
        private Google google = new Google();
        private TikTok tiktok = new TikTok();
        private Snapchat snapchat = new Snapchat();

        /** Credentials of every enabled platform, in declaration order */
        public Map<Platform, PlatformCredentials> enabledCredentials() {
            Map<Platform, PlatformCredentials> enabled = new EnumMap<>(Platform.class);
            if (meta.isEnabled()) enabled.put(Platform.META, meta.toCredentials());
            if (x.isEnabled()) enabled.put(Platform.X, x.toCredentials());
            if (google.isEnabled()) enabled.put(Platform.GOOGLE, google.toCredentials());
            if (tiktok.isEnabled()) enabled.put(Platform.TIKTOK, tiktok.toCredentials());
            if (snapchat.isEnabled()) enabled.put(Platform.SNAPCHAT, snapchat.toCredentials());
            return enabled;
        }

        public ClientOverrides clientOverrides(Platform platform) {
            switch (platform) {
                case META: return meta.getClient();
                case X: return x.getClient();
                case GOOGLE: return google.getClient();
                case TIKTOK: return tiktok.getClient();
                case SNAPCHAT: return snapchat.getClient();
                default: return null;
            }
        }
    }

    @Data
    public static class Meta {
        private boolean enabled;
        private String appId;
        private String appSecret;
        private String accessToken;
        private boolean longLivedToken;
        private String adAccountId;
        private String pageId;
        private ClientOverrides client = new ClientOverrides();

        public MetaCredentials toCredentials() {
            return MetaCredentials.builder()
                    .appId(appId).appSecret(appSecret).accessToken(accessToken)
                    .longLivedToken(longLivedToken).adAccountId(adAccountId).pageId(pageId)
                    .build();
        }
    }

    @Data
    public static class X {
        private boolean enabled;
        private String consumerKey;
        private String consumerSecret;
        private String accessToken;
        private String accessTokenSecret;
        private String accountId;
        private String fundingInstrumentId;
        private ClientOverrides client = new ClientOverrides();

        public XCredentials toCredentials() {
            return XCredentials.builder()
                    .consumerKey(consumerKey).consumerSecret(consumerSecret)
                    .accessToken(accessToken).accessTokenSecret(accessTokenSecret)
                    .accountId(accountId).fundingInstrumentId(fundingInstrumentId)
                    .build();
        }
    }

    @Data
    public static class Google {
        private boolean enabled;
        private String clientId;
        private String clientSecret;
        private String refreshToken;
        private String developerToken;
        private String customerId;
        private String managerId;
        private ClientOverrides client = new ClientOverrides();

        public GoogleCredentials toCredentials() {
            return GoogleCredentials.builder()
                    .clientId(clientId).clientSecret(clientSecret).refreshToken(refreshToken)
                    .developerToken(developerToken).customerId(customerId).managerId(managerId)
                    .build();
        }
    }

    @Data
    public static class TikTok {
        private boolean enabled;
        private String appId;
        private String secret;
        private String accessToken;
        private String refreshToken;
        private String advertiserId;
        private ClientOverrides client = new ClientOverrides();

        public TikTokCredentials toCredentials() {
            return TikTokCredentials.builder()
                    .appId(appId).secret(secret).accessToken(accessToken)
                    .refreshToken(refreshToken).advertiserId(advertiserId)
                    .build();
        }
    }

    @Data
    public static class Snapchat {
        private boolean enabled;
        private String clientId;
        private String clientSecret;
        private String accessToken;
        private String refreshToken;
        private String organizationId;
        private String adAccountId;
        private ClientOverrides client = new ClientOverrides();

        public SnapchatCredentials toCredentials() {
            return SnapchatCredentials.builder()
                    .clientId(clientId).clientSecret(clientSecret).accessToken(accessToken)
                    .refreshToken(refreshToken).organizationId(organizationId).adAccountId(adAccountId)
                    .build();
        }
    }
}
