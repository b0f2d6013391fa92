package com.adflux.services.adplatforms.adapter;

import java.util.Map;

/**
 * Raw status of an ad as the platform reports it, plus platform-specific details.
 */
public record PlatformAdState(String platformStatus, Map<String, Object> details) {
}
