package com.adflux.services.adplatforms.auth.credentials;

import com.adflux.services.adplatforms.constants.Platform;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@Builder(toBuilder = true)
@ToString(onlyExplicitlyIncluded = true)
public class SnapchatCredentials extends PlatformCredentials {

    @ToString.Include
    private final String clientId;
    private final String clientSecret;
    private final String accessToken;
    private final String refreshToken;
    @ToString.Include
    private final String organizationId;
    @ToString.Include
    private final String adAccountId;

    @Override
    public Platform getPlatform() {
        return Platform.SNAPCHAT;
    }

    @Override
    public List<String> missingFields() {
        return missing("accessToken", accessToken, "adAccountId", adAccountId);
    }
}
