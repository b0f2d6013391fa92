package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.request.AdCampaignUpdate;
import com.adflux.services.adplatforms.dto.response.ApiResponse;
import com.adflux.services.adplatforms.dto.response.RateLimitSnapshot;

import java.util.List;
import java.util.Map;

/**
 * Common ad-operations contract implemented once per platform.
 * Every operation answers with an {@link ApiResponse}; transport exceptions never escape.
 */
public interface PlatformAdapter {

    Platform platform();

    /** Authenticate with the registered credentials and resolve account-level ids */
    ApiResponse<Map<String, Object>> initialize();

    ApiResponse<Map<String, Object>> createAd(AdCampaign campaign);

    ApiResponse<Map<String, Object>> updateAd(String adId, AdCampaignUpdate update);

    ApiResponse<Map<String, Object>> deleteAd(String adId);

    ApiResponse<Map<String, Object>> getAdStatus(String adId);

    ApiResponse<Map<String, Object>> getAdPerformance(String adId, List<String> metrics);

    boolean isRateLimitNearExhaustion();

    RateLimitSnapshot rateLimitSnapshot();
}
