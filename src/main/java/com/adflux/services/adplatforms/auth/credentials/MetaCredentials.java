package com.adflux.services.adplatforms.auth.credentials;

import com.adflux.services.adplatforms.constants.Platform;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * App id/secret plus a user or system-user access token.
 * Ad account and page ids are resolved from the token when not given.
 */
@Getter
@Builder(toBuilder = true)
@ToString(onlyExplicitlyIncluded = true)
public class MetaCredentials extends PlatformCredentials {

    @ToString.Include
    private final String appId;
    private final String appSecret;
    private final String accessToken;
    @ToString.Include
    private final boolean longLivedToken;
    @ToString.Include
    private final String adAccountId;
    @ToString.Include
    private final String pageId;

    @Override
    public Platform getPlatform() {
        return Platform.META;
    }

    @Override
    public List<String> missingFields() {
        return missing("appId", appId, "appSecret", appSecret, "accessToken", accessToken);
    }
}
