package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.credentials.*;
import com.adflux.services.adplatforms.client.ClientSettings;
import com.adflux.services.adplatforms.client.PlatformClientFactory;
import com.adflux.services.adplatforms.client.PlatformHttpClient;
import com.adflux.services.adplatforms.config.AdPlatformsProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Builds the adapter matching a credentials type, each on its own transport client.
 */
@Component
@RequiredArgsConstructor
public class PlatformAdapterFactory {

    private final PlatformClientFactory clientFactory;
    private final AuthManager authManager;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public PlatformAdapter create(PlatformCredentials credentials, AdPlatformsProperties.ClientOverrides overrides) {
        ClientSettings settings = ClientSettings.resolve(credentials.getPlatform(), overrides);
        return create(credentials, clientFactory.create(settings));
    }

    public PlatformAdapter create(PlatformCredentials credentials, PlatformHttpClient client) {
        switch (credentials.getPlatform()) {
            case META:
                return new MetaAdapter(client, authManager, clock, (MetaCredentials) credentials);
            case X:
                return new XAdapter(client, authManager, clock, (XCredentials) credentials);
            case GOOGLE:
                return new GoogleAdsAdapter(client, authManager, clock, (GoogleCredentials) credentials);
            case TIKTOK:
                return new TikTokAdapter(client, authManager, clock, (TikTokCredentials) credentials, objectMapper);
            case SNAPCHAT:
                return new SnapchatAdapter(client, authManager, clock, (SnapchatCredentials) credentials);
            default:
                throw new IllegalArgumentException("Unsupported platform: " + credentials.getPlatform());
        }
    }
}
