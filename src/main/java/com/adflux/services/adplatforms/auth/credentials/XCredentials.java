package com.adflux.services.adplatforms.auth.credentials;

import com.adflux.services.adplatforms.constants.Platform;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * OAuth 1.0a consumer and access token pairs. X tokens never expire.
 */
@Getter
@Builder(toBuilder = true)
@ToString(onlyExplicitlyIncluded = true)
public class XCredentials extends PlatformCredentials {

    @ToString.Include
    private final String consumerKey;
    private final String consumerSecret;
    private final String accessToken;
    private final String accessTokenSecret;
    @ToString.Include
    private final String accountId;
    @ToString.Include
    private final String fundingInstrumentId;

    @Override
    public Platform getPlatform() {
        return Platform.X;
    }

    @Override
    public List<String> missingFields() {
        return missing("consumerKey", consumerKey, "consumerSecret", consumerSecret,
                "accessToken", accessToken, "accessTokenSecret", accessTokenSecret, "accountId", accountId);
    }
}
