package com.adflux.services.adplatforms.controller;

import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.request.AdCampaignUpdate;
import com.adflux.services.adplatforms.dto.request.MultiPlatformAdRequest;
import com.adflux.services.adplatforms.dto.request.MultiPlatformPerformanceRequest;
import com.adflux.services.adplatforms.dto.response.ApiResponse;
import com.adflux.services.adplatforms.service.AdPlatformService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST Controller for ad campaign operations across platforms
 */
@RestController
@RequestMapping(AdPlatformConstants.API_V1 + "/ads")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Ads", description = "Create and manage job ads on the advertising platforms")
public class AdCampaignController {

    private final AdPlatformService adPlatformService;

    @PostMapping
    @Operation(summary = "Create ad", description = "Creates the campaign, ad set, creative and ad on campaign.platform")
    public ResponseEntity<ApiResponse<Map<String, Object>>> createAd(
            @Valid @RequestBody AdCampaign campaign
    ) {
        log.info("POST /ads - platform: {}, campaign: {}", campaign.getPlatform(), campaign.getName());
        return ResponseStatuses.toEntity(adPlatformService.createAd(campaign), HttpStatus.CREATED);
    }

    @PostMapping("/multi-platform")
    @Operation(summary = "Create ad on several platforms",
            description = "Runs one creation per platform concurrently; each platform reports its own outcome")
    public ResponseEntity<ApiResponse<Map<String, ApiResponse<Map<String, Object>>>>> createMultiPlatformAd(
            @Valid @RequestBody MultiPlatformAdRequest request
    ) {
        log.info("POST /ads/multi-platform - platforms: {}, campaign: {}",
                request.getPlatforms(), request.getCampaign().getName());
        Map<String, ApiResponse<Map<String, Object>>> results = ResponseStatuses.byTag(
                adPlatformService.createMultiPlatformAd(request.getCampaign(), request.getPlatforms()));
        return ResponseEntity.ok(ApiResponse.success(results, summary(results)));
    }

    @PutMapping("/{platform}/{adId}")
    @Operation(summary = "Update ad", description = "Patches the ad, ad set and campaign levels the update touches")
    public ResponseEntity<ApiResponse<Map<String, Object>>> updateAd(
            @Parameter(description = "Platform tag", example = "meta") @PathVariable Platform platform,
            @Parameter(description = "Platform ad id") @PathVariable String adId,
            @RequestBody AdCampaignUpdate update
    ) {
        log.info("PUT /ads/{}/{}", platform.getValue(), adId);
        return ResponseStatuses.toEntity(adPlatformService.updateAd(platform, adId, update), HttpStatus.OK);
    }

    @DeleteMapping("/{platform}/{adId}")
    @Operation(summary = "Delete ad")
    public ResponseEntity<ApiResponse<Map<String, Object>>> deleteAd(
            @PathVariable Platform platform,
            @PathVariable String adId
    ) {
        log.info("DELETE /ads/{}/{}", platform.getValue(), adId);
        return ResponseStatuses.toEntity(adPlatformService.deleteAd(platform, adId), HttpStatus.OK);
    }

    @GetMapping("/{platform}/{adId}/status")
    @Operation(summary = "Get ad status", description = "Platform status mapped onto draft/active/paused/completed/pending/error")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getAdStatus(
            @PathVariable Platform platform,
            @PathVariable String adId
    ) {
        log.debug("GET /ads/{}/{}/status", platform.getValue(), adId);
        return ResponseStatuses.toEntity(adPlatformService.getAdStatus(platform, adId), HttpStatus.OK);
    }

    @GetMapping("/{platform}/{adId}/performance")
    @Operation(summary = "Get ad performance")
    public ResponseEntity<ApiResponse<Map<String, Object>>> getAdPerformance(
            @PathVariable Platform platform,
            @PathVariable String adId,
            @Parameter(description = "Metric names; defaults apply when omitted")
            @RequestParam(required = false) List<String> metrics
    ) {
        log.debug("GET /ads/{}/{}/performance - metrics: {}", platform.getValue(), adId, metrics);
        return ResponseStatuses.toEntity(adPlatformService.getAdPerformance(platform, adId, metrics), HttpStatus.OK);
    }

    @PostMapping("/performance")
    @Operation(summary = "Get performance of one ad per platform")
    public ResponseEntity<ApiResponse<Map<String, ApiResponse<Map<String, Object>>>>> getMultiPlatformPerformance(
            @Valid @RequestBody MultiPlatformPerformanceRequest request
    ) {
        log.debug("POST /ads/performance - platforms: {}", request.getAdIds().keySet());
        Map<String, ApiResponse<Map<String, Object>>> results = ResponseStatuses.byTag(
                adPlatformService.getMultiPlatformPerformance(request.getAdIds(), request.getMetrics()));
        return ResponseEntity.ok(ApiResponse.success(results, summary(results)));
    }

    private static String summary(Map<String, ApiResponse<Map<String, Object>>> results) {
        long succeeded = results.values().stream().filter(ApiResponse::isSuccessful).count();
        return succeeded + " of " + results.size() + " platform(s) succeeded";
    }
}
