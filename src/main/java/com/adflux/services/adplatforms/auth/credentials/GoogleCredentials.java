package com.adflux.services.adplatforms.auth.credentials;

import com.adflux.services.adplatforms.constants.Platform;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

@Getter
@Builder(toBuilder = true)
@ToString(onlyExplicitlyIncluded = true)
public class GoogleCredentials extends PlatformCredentials {

    @ToString.Include
    private final String clientId;
    private final String clientSecret;
    private final String refreshToken;
    private final String developerToken;
    @ToString.Include
    private final String customerId;
    /** Manager (MCC) account sent as login-customer-id, optional */
    @ToString.Include
    private final String managerId;

    @Override
    public Platform getPlatform() {
        return Platform.GOOGLE;
    }

    @Override
    public List<String> missingFields() {
        return missing("clientId", clientId, "clientSecret", clientSecret, "refreshToken", refreshToken,
                "developerToken", developerToken, "customerId", customerId);
    }
}
