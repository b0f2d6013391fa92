package com.adflux.services.adplatforms.auth.credentials;

import com.adflux.services.adplatforms.constants.Platform;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@Builder(toBuilder = true)
@ToString(onlyExplicitlyIncluded = true)
public class TikTokCredentials extends PlatformCredentials {

    @ToString.Include
    private final String appId;
    private final String secret;
    private final String accessToken;
    /** Optional; without it an expired token needs a new authorization */
    private final String refreshToken;
    @ToString.Include
    private final String advertiserId;

    @Override
    public Platform getPlatform() {
        return Platform.TIKTOK;
    }

    @Override
    public List<String> missingFields() {
        return missing("accessToken", accessToken, "advertiserId", advertiserId);
    }
}
