package com.adflux.services.adplatforms.repository;

import com.adflux.services.adplatforms.entity.PlatformToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Persisted platform tokens, keyed by platform tag.
 */
@Repository
public interface PlatformTokenRepository extends JpaRepository<PlatformToken, String> {
}
