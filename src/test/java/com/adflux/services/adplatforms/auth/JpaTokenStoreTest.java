package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.entity.PlatformToken;
import com.adflux.services.adplatforms.repository.PlatformTokenRepository;
import com.adflux.services.adplatforms.service.TokenEncryptionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("JpaTokenStore")
class JpaTokenStoreTest {

    private static final String KEY = "00112233445566778899aabbccddeeff00112233445566778899aabbccddeeff";
    private static final Instant EXPIRES = Instant.parse("2026-05-01T10:00:00Z");
    private static final Instant REFRESHED = Instant.parse("2026-03-02T10:00:00Z");

    @Mock
    private PlatformTokenRepository repository;

    private final TokenEncryptionService encryption = new TokenEncryptionService(KEY);

    private JpaTokenStore store;

    @BeforeEach
    void setUp() {
        store = new JpaTokenStore(repository, encryption);
    }

    @Test
    @DisplayName("Saved tokens are encrypted and the state columns copied")
    void saveEncryptsTheToken() {
        when(repository.findById("meta")).thenReturn(Optional.empty());

        store.save(Platform.META, new StoredAuth(state(Platform.META), "EAAB-long"));

        ArgumentCaptor<PlatformToken> row = ArgumentCaptor.forClass(PlatformToken.class);
        verify(repository).save(row.capture());
        assertThat(row.getValue().getPlatform()).isEqualTo("meta");
        assertThat(row.getValue().getAccessToken()).startsWith("ENC:").doesNotContain("EAAB-long");
        assertThat(encryption.decrypt(row.getValue().getAccessToken())).isEqualTo("EAAB-long");
        assertThat(row.getValue().isAuthenticated()).isTrue();
        assertThat(row.getValue().getExpiresAt()).isEqualTo(EXPIRES);
        assertThat(row.getValue().getLastRefreshed()).isEqualTo(REFRESHED);
    }

    @Test
    void saveUpdatesTheExistingRow() {
        PlatformToken existing = PlatformToken.builder().platform("tiktok").accessToken("old").authenticated(true).build();
        when(repository.findById("tiktok")).thenReturn(Optional.of(existing));

        store.save(Platform.TIKTOK, new StoredAuth(state(Platform.TIKTOK).toBuilder().authenticated(false).build(), null));

        verify(repository).save(existing);
        assertThat(existing.getAccessToken()).isNull();
        assertThat(existing.isAuthenticated()).isFalse();
    }

    @Test
    void loadDecryptsTheToken() {
        when(repository.findById("google")).thenReturn(Optional.of(PlatformToken.builder()
                .platform("google")
                .accessToken(encryption.encrypt("ya29.token"))
                .authenticated(true)
                .expiresAt(EXPIRES)
                .lastRefreshed(REFRESHED)
                .build()));

        StoredAuth loaded = store.load(Platform.GOOGLE).orElseThrow();

        assertThat(loaded.token()).isEqualTo("ya29.token");
        assertThat(loaded.state().getPlatform()).isEqualTo(Platform.GOOGLE);
        assertThat(loaded.state().isAuthenticated()).isTrue();
        assertThat(loaded.state().getExpiresAt()).isEqualTo(EXPIRES);
    }

    @Test
    void loadAllKeysRowsByPlatform() {
        when(repository.findAll()).thenReturn(List.of(
                PlatformToken.builder().platform("x").accessToken("legacy-plaintext").authenticated(true).build(),
                PlatformToken.builder().platform("snapchat").authenticated(false).build()));

        Map<Platform, StoredAuth> all = store.loadAll();

        assertThat(all).containsOnlyKeys(Platform.X, Platform.SNAPCHAT);
        assertThat(all.get(Platform.X).token()).isEqualTo("legacy-plaintext");
        assertThat(all.get(Platform.SNAPCHAT).token()).isNull();
    }

    @Test
    void deleteOfAMissingRowIsANoOp() {
        when(repository.existsById("meta")).thenReturn(false);

        store.delete(Platform.META);

        verify(repository, never()).deleteById(anyString());
    }

    private static AuthState state(Platform platform) {
        return AuthState.builder()
                .platform(platform)
                .authenticated(true)
                .expiresAt(EXPIRES)
                .lastRefreshed(REFRESHED)
                .build();
    }
}
