package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.constants.Platform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "adplatforms.auth", name = "storage", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryTokenStore implements TokenStore {

    private final Map<Platform, StoredAuth> entries = new ConcurrentHashMap<>();

    public InMemoryTokenStore() {
        log.info("Using in-memory token store; tokens are lost on restart");
    }

    @Override
    public Optional<StoredAuth> load(Platform platform) {
        return Optional.ofNullable(entries.get(platform));
    }

    @Override
    public void save(Platform platform, StoredAuth auth) {
        entries.put(platform, auth);
    }

    @Override
    public void delete(Platform platform) {
        entries.remove(platform);
    }

    @Override
    public Map<Platform, StoredAuth> loadAll() {
        return entries.isEmpty() ? Map.of() : new EnumMap<>(entries);
    }
}
