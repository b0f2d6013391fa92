package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.entity.PlatformToken;
import com.adflux.services.adplatforms.repository.PlatformTokenRepository;
import com.adflux.services.adplatforms.service.TokenEncryptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Token store backed by the platform_tokens table. Tokens are encrypted at rest.
 */
@Component
@ConditionalOnProperty(prefix = "adplatforms.auth", name = "storage", havingValue = "jpa")
@RequiredArgsConstructor
@Slf4j
public class JpaTokenStore implements TokenStore {

    private final PlatformTokenRepository repository;
    private final TokenEncryptionService encryptionService;

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredAuth> load(Platform platform) {
        return repository.findById(platform.getValue()).map(this::toStoredAuth);
    }

    @Override
    @Transactional
    public void save(Platform platform, StoredAuth auth) {
        PlatformToken row = repository.findById(platform.getValue())
                .orElseGet(() -> PlatformToken.builder().platform(platform.getValue()).build());
        row.setAccessToken(auth.token() != null ? encryptionService.encrypt(auth.token()) : null);
        row.setAuthenticated(auth.state().isAuthenticated());
        row.setExpiresAt(auth.state().getExpiresAt());
        row.setLastRefreshed(auth.state().getLastRefreshed());
        repository.save(row);
        log.debug("Persisted auth state for {}: authenticated={}", platform.getValue(), auth.state().isAuthenticated());
    }

    @Override
    @Transactional
    public void delete(Platform platform) {
        if (repository.existsById(platform.getValue())) {
            repository.deleteById(platform.getValue());
        }
    }

    @Override
    @Transactional(readOnly = true)
    public Map<Platform, StoredAuth> loadAll() {
        Map<Platform, StoredAuth> all = new EnumMap<>(Platform.class);
        for (PlatformToken row : repository.findAll()) {
            all.put(Platform.fromValue(row.getPlatform()), toStoredAuth(row));
        }
        return all;
    }

    private StoredAuth toStoredAuth(PlatformToken row) {
        AuthState state = AuthState.builder()
                .platform(Platform.fromValue(row.getPlatform()))
                .authenticated(row.isAuthenticated())
                .expiresAt(row.getExpiresAt())
                .lastRefreshed(row.getLastRefreshed())
                .build();
        String token = row.getAccessToken() != null ? encryptionService.decrypt(row.getAccessToken()) : null;
        return new StoredAuth(state, token);
    }
}
