package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.credentials.TikTokCredentials;
import com.adflux.services.adplatforms.client.PlatformHttpClient;
import com.adflux.services.adplatforms.constants.CampaignStatus;
import com.adflux.services.adplatforms.constants.Gender;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.request.AdCampaignUpdate;
import com.adflux.services.adplatforms.dto.request.AdContent;
import com.adflux.services.adplatforms.dto.request.AgeRange;
import com.adflux.services.adplatforms.dto.request.TargetAudience;
import com.adflux.services.adplatforms.exception.AdPlatformException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.*;

/**
 * TikTok Marketing API v1.3.
 *
 * Resource graph: campaign -> ad group -> ad. Every call is scoped by advertiser_id;
 * list-valued query parameters are sent as JSON strings.
 */
@Slf4j
public class TikTokAdapter extends AbstractPlatformAdapter {

    static final PlatformVocabulary VOCABULARY = PlatformVocabulary.builder()
            .callToAction("apply_now", "APPLY_NOW")
            .callToAction("sign_up", "SIGN_UP")
            .callToAction("learn_more", "LEARN_MORE")
            .callToAction("contact", "CONTACT_US")
            .callToAction("submit", "APPLY_NOW")
            .defaultCallToAction("LEARN_MORE")
            .outboundStatus(CampaignStatus.ACTIVE, "ENABLE")
            .defaultOutboundStatus("DISABLE")
            .inboundStatus("ENABLE", CampaignStatus.ACTIVE)
            .inboundStatus("AD_STATUS_DELIVERY_OK", CampaignStatus.ACTIVE)
            .inboundStatus("DISABLE", CampaignStatus.PAUSED)
            .inboundStatus("AD_STATUS_DISABLE", CampaignStatus.PAUSED)
            .inboundStatus("AD_STATUS_CAMPAIGN_DISABLE", CampaignStatus.PAUSED)
            .inboundStatus("AD_STATUS_ADGROUP_DISABLE", CampaignStatus.PAUSED)
            .inboundStatus("DELETE", CampaignStatus.COMPLETED)
            .inboundStatus("AD_STATUS_DELETE", CampaignStatus.COMPLETED)
            .inboundStatus("AD_STATUS_DONE", CampaignStatus.COMPLETED)
            .inboundStatus("AD_STATUS_AUDIT", CampaignStatus.PENDING)
            .inboundStatus("AD_STATUS_REAUDIT", CampaignStatus.PENDING)
            .inboundStatus("AD_STATUS_NOT_START", CampaignStatus.PENDING)
            .inboundStatus("AD_STATUS_AUDIT_DENY", CampaignStatus.ERROR)
            .metric("impressions", "impressions")
            .metric("clicks", "clicks")
            .metric("ctr", "ctr")
            .metric("reach", "reach")
            .metric("spend", "spend")
            .metric("conversions", "conversion")
            .metric("cpc", "cpc")
            .metric("videoViews", "video_play_actions")
            .lookbackDays(7)
            .build();

    private static final int[][] AGE_GROUPS = {{18, 24}, {25, 34}, {35, 44}, {45, 54}, {55, 100}};

    private final String advertiserId;
    private final ObjectMapper objectMapper;

    public TikTokAdapter(PlatformHttpClient client, AuthManager authManager, Clock clock,
                         TikTokCredentials credentials, ObjectMapper objectMapper) {
        super(client, authManager, VOCABULARY, clock);
        this.advertiserId = credentials.getAdvertiserId();
        this.objectMapper = objectMapper;
        client.setSigner((method, uri) -> Map.of("Access-Token", authManager.requireToken(Platform.TIKTOK)));
    }

    @Override
    protected void validatePrerequisites(AdCampaign campaign) {
        if (advertiserId == null || advertiserId.isBlank()) {
            throw notConfigured("TIKTOK_ADVERTISER_REQUIRED", "TikTok advertiser id is not configured");
        }
    }

    // ========================
    // CREATE
    // ========================

    @Override
    protected List<CreationStep> creationSteps(AdCampaign campaign) {
        String status = vocabulary.toPlatformStatus(campaign.getStatus());

        return List.of(
                CreationStep.of("campaignId", "campaign/create/", ids -> {
                    Map<String, Object> body = scoped();
                    body.put("campaign_name", campaign.getName());
                    body.put("objective_type", "TRAFFIC");
                    body.put("budget_mode", "BUDGET_MODE_TOTAL");
                    body.put("budget", campaign.getBudget());
                    body.put("operation_status", status);
                    return body;
                }, "data.campaign_id"),
                CreationStep.of("adGroupId", "adgroup/create/", ids -> {
                    Map<String, Object> body = scoped();
                    body.put("campaign_id", ids.get("campaignId"));
                    body.put("adgroup_name", campaign.getName() + " - Ad Group");
                    body.put("placement_type", "PLACEMENT_TYPE_AUTOMATIC");
                    body.put("promotion_type", "WEBSITE");
                    body.put("budget_mode", "BUDGET_MODE_DAY");
                    body.put("budget", BudgetUnits.dailyAmount(campaign));
                    body.put("schedule_type", "SCHEDULE_START_END");
                    body.put("schedule_start_time", scheduleTime(campaign.getStartDate(), "00:00:00"));
                    body.put("schedule_end_time", scheduleTime(campaign.getEndDate(), "23:59:59"));
                    body.put("optimization_goal", "CLICK");
                    body.put("billing_event", "CPC");
                    body.put("bid_type", "BID_TYPE_NO_BID");
                    body.put("operation_status", status);
                    body.putAll(targeting(audience(campaign)));
                    return body;
                }, "data.adgroup_id"),
                CreationStep.of("id", "ad/create/", ids -> {
                    Map<String, Object> body = scoped();
                    body.put("adgroup_id", ids.get("adGroupId"));
                    body.put("creatives", List.of(creative(campaign.getName(), campaign.getContent())));
                    return body;
                }, "data.ad_ids.0"));
    }

    // ========================
    // UPDATE / DELETE / STATUS
    // ========================

    @Override
    protected Map<String, Object> applyUpdate(String adId, AdCampaignUpdate update) {
        Map<String, Object> ad = findAd(adId);
        String adGroupId = JsonPaths.readString(ad, "adgroup_id").orElse(null);
        String campaignId = JsonPaths.readString(ad, "campaign_id").orElse(null);
        List<String> levels = new ArrayList<>();

        if (update.getStatus() != null) {
            Map<String, Object> body = scoped();
            body.put("ad_ids", List.of(adId));
            body.put("operation_status", vocabulary.toPlatformStatus(update.getStatus()));
            client.post("ad/status/update/", body);
            levels.add("ad");
        }

        if (campaignId != null && (update.getName() != null || update.getBudget() != null)) {
            Map<String, Object> body = scoped();
            body.put("campaign_id", campaignId);
            if (update.getName() != null) body.put("campaign_name", update.getName());
            if (update.getBudget() != null) body.put("budget", update.getBudget());
            client.post("campaign/update/", body);
            levels.add("campaign");
        }

        boolean touchesAdGroup = update.getDailyBudget() != null || update.getStartDate() != null
                || update.getEndDate() != null || update.getTargetAudience() != null;
        if (adGroupId != null && touchesAdGroup) {
            Map<String, Object> body = scoped();
            body.put("adgroup_id", adGroupId);
            if (update.getDailyBudget() != null) body.put("budget", update.getDailyBudget());
            if (update.getStartDate() != null) body.put("schedule_start_time", scheduleTime(update.getStartDate(), "00:00:00"));
            if (update.getEndDate() != null) body.put("schedule_end_time", scheduleTime(update.getEndDate(), "23:59:59"));
            if (update.getTargetAudience() != null) body.putAll(targeting(update.getTargetAudience()));
            client.post("adgroup/update/", body);
            levels.add("adGroup");
        }

        if (update.getContent() != null) {
            Map<String, Object> body = scoped();
            body.put("adgroup_id", adGroupId);
            Map<String, Object> creative = creative(
                    Objects.toString(ad.get("ad_name"), adId), update.getContent());
            creative.put("ad_id", adId);
            body.put("creatives", List.of(creative));
            client.post("ad/update/", body);
            levels.add("creative");
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("campaignId", campaignId);
        result.put("adGroupId", adGroupId);
        result.put("updatedLevels", levels);
        return result;
    }

    /** TikTok has no hard delete for ads; the DELETE status is terminal */
    @Override
    protected Map<String, Object> removeAd(String adId) {
        Map<String, Object> body = scoped();
        body.put("ad_ids", List.of(adId));
        body.put("operation_status", "DELETE");
        client.post("ad/status/update/", body);
        return Map.of("platformStatus", "DELETE");
    }

    @Override
    protected PlatformAdState fetchStatus(String adId) {
        Map<String, Object> ad = findAd(adId);

        Map<String, Object> details = new LinkedHashMap<>();
        JsonPaths.readString(ad, "adgroup_id").ifPresent(id -> details.put("adGroupId", id));
        JsonPaths.readString(ad, "campaign_id").ifPresent(id -> details.put("campaignId", id));
        JsonPaths.readString(ad, "operation_status").ifPresent(s -> details.put("operationStatus", s));

        // secondary status carries review and delivery state; fall back to the switch
        String status = JsonPaths.readString(ad, "secondary_status")
                .orElseGet(() -> JsonPaths.readString(ad, "operation_status").orElse(null));
        return new PlatformAdState(status, details);
    }

    // ========================
    // INSIGHTS
    // ========================

    @Override
    protected Map<String, Object> fetchInsights(String adId, List<String> fields, LocalDate since, LocalDate until) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("advertiser_id", advertiserId);
        query.put("report_type", "BASIC");
        query.put("data_level", "AUCTION_AD");
        query.put("dimensions", json(List.of("ad_id")));
        query.put("metrics", json(fields));
        query.put("filtering", json(List.of(Map.of(
                "field_name", "ad_ids", "filter_type", "IN", "filter_value", json(List.of(adId))))));
        query.put("start_date", since.toString());
        query.put("end_date", until.toString());
        query.put("query_lifetime", "false");

        return new LinkedHashMap<>(JsonPaths.readMap(client.get("report/integrated/get/", query), "data.list.0.metrics"));
    }

    // ========================
    // PAYLOADS
    // ========================

    Map<String, Object> targeting(TargetAudience audience) {
        Map<String, Object> targeting = new LinkedHashMap<>();
        targeting.put("location_ids", audience.locationsOrDefault("CO"));
        targeting.put("gender", audience.targetsAllGenders() ? "GENDER_UNLIMITED"
                : audience.getGenders().contains(Gender.MALE) ? "GENDER_MALE" : "GENDER_FEMALE");
        if (audience.getAgeRange() != null) {
            targeting.put("age_groups", ageGroups(audience.getAgeRange()));
        }
        if (audience.getLanguages() != null && !audience.getLanguages().isEmpty()) {
            targeting.put("languages", audience.getLanguages());
        }
        if (!audience.interestsOrEmpty().isEmpty()) {
            targeting.put("interest_keywords", audience.interestsOrEmpty());
        }
        return targeting;
    }

    /** Every TikTok age bucket overlapping the requested range */
    static List<String> ageGroups(AgeRange range) {
        List<String> groups = new ArrayList<>();
        for (int[] group : AGE_GROUPS) {
            if (range.overlaps(group[0], group[1])) {
                groups.add("AGE_" + group[0] + "_" + group[1]);
            }
        }
        return groups;
    }

    private Map<String, Object> creative(String name, AdContent content) {
        Map<String, Object> creative = new LinkedHashMap<>();
        creative.put("ad_name", name);
        creative.put("ad_format", content.getVideoUrl() != null ? "SINGLE_VIDEO" : "SINGLE_IMAGE");
        creative.put("ad_text", truncate(Objects.toString(content.getTitle(), "") + " "
                + Objects.toString(content.getDescription(), ""), 100));
        creative.put("call_to_action", vocabulary.callToAction(content.getCallToAction()));
        creative.put("landing_page_url", content.getLandingUrl());
        if (content.getVideoUrl() != null) creative.put("video_url", content.getVideoUrl());
        if (content.getImageUrl() != null) creative.put("image_urls", List.of(content.getImageUrl()));
        return creative;
    }

    private Map<String, Object> findAd(String adId) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("advertiser_id", advertiserId);
        query.put("filtering", json(Map.of("ad_ids", List.of(adId))));
        Map<String, Object> ad = JsonPaths.readMap(client.get("ad/get/", query), "data.list.0");
        if (ad.isEmpty()) {
            throw notFound("TIKTOK_AD_NOT_FOUND", "TikTok has no ad " + adId);
        }
        return ad;
    }

    private Map<String, Object> scoped() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("advertiser_id", advertiserId);
        return body;
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new AdPlatformException("Could not encode TikTok query parameter", "TIKTOK_QUERY_ENCODING", ex);
        }
    }

    private static String scheduleTime(LocalDate date, String time) {
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE) + " " + time;
    }

    private static String truncate(String value, int max) {
        String trimmed = value.trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max);
    }
}
