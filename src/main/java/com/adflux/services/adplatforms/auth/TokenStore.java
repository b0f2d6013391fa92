package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.constants.Platform;

import java.util.Map;
import java.util.Optional;

/**
 * Storage backend for per-platform auth state and token.
 * Callers serialize writes per platform; implementations need no locking of their own
 * beyond being safe for concurrent access to different platforms.
 */
public interface TokenStore {

    Optional<StoredAuth> load(Platform platform);

    void save(Platform platform, StoredAuth auth);

    void delete(Platform platform);

    Map<Platform, StoredAuth> loadAll();
}
