package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.credentials.SnapchatCredentials;
import com.adflux.services.adplatforms.client.PlatformHttpClient;
import com.adflux.services.adplatforms.constants.CampaignStatus;
import com.adflux.services.adplatforms.constants.Gender;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.request.AdCampaignUpdate;
import com.adflux.services.adplatforms.dto.request.AdContent;
import com.adflux.services.adplatforms.dto.request.TargetAudience;
import com.adflux.services.adplatforms.exception.AdPlatformException;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Snapchat Marketing API.
 *
 * Resource graph: campaign -> ad squad -> creative -> ad. Requests and responses wrap
 * each entity, e.g. {@code {"campaigns":[{"campaign":{...}}]}}; money is in micros.
 * Updates are full-entity PUTs, so the current entity is read and merged first.
 */
@Slf4j
public class SnapchatAdapter extends AbstractPlatformAdapter {

    static final PlatformVocabulary VOCABULARY = PlatformVocabulary.builder()
            .callToAction("apply_now", "APPLY_NOW")
            .callToAction("sign_up", "SIGN_UP")
            .callToAction("learn_more", "MORE")
            .callToAction("contact", "CONTACT_US")
            .callToAction("submit", "APPLY_NOW")
            .defaultCallToAction("MORE")
            .outboundStatus(CampaignStatus.ACTIVE, "ACTIVE")
            .defaultOutboundStatus("PAUSED")
            .inboundStatus("ACTIVE", CampaignStatus.ACTIVE)
            .inboundStatus("PAUSED", CampaignStatus.PAUSED)
            .inboundStatus("PENDING", CampaignStatus.PENDING)
            .inboundStatus("IN_REVIEW", CampaignStatus.PENDING)
            .inboundStatus("REJECTED", CampaignStatus.ERROR)
            .inboundStatus("DELETED", CampaignStatus.COMPLETED)
            .metric("impressions", "impressions")
            .metric("clicks", "swipes")
            .metric("ctr", "swipe_up_percent")
            .metric("reach", "uniques")
            .metric("spend", "spend")
            .metric("conversions", "conversion_sign_ups")
            .metric("videoViews", "video_views")
            .lookbackDays(7)
            .build();

    private final String adAccountId;
    private final String organizationId;

    public SnapchatAdapter(PlatformHttpClient client, AuthManager authManager, Clock clock,
                           SnapchatCredentials credentials) {
        super(client, authManager, VOCABULARY, clock);
        this.adAccountId = credentials.getAdAccountId();
        this.organizationId = credentials.getOrganizationId();
        client.setSigner(bearerSigner());
    }

    @Override
    protected Map<String, Object> resolveAccount() {
        Map<String, Object> resolved = new LinkedHashMap<>();
        resolved.put("adAccountId", adAccountId);
        if (organizationId != null) {
            resolved.put("organizationId", organizationId);
        }
        return resolved;
    }

    @Override
    protected void validatePrerequisites(AdCampaign campaign) {
        if (adAccountId == null || adAccountId.isBlank()) {
            throw notConfigured("SNAPCHAT_AD_ACCOUNT_REQUIRED", "Snapchat ad account id is not configured");
        }
        AdContent content = campaign.getContent();
        if (content.getImageUrl() == null && content.getVideoUrl() == null) {
            log.warn("Snapchat ad '{}' has no media; the creative will be rejected at review", campaign.getName());
        }
    }

    // ========================
    // CREATE
    // ========================

    @Override
    protected List<CreationStep> creationSteps(AdCampaign campaign) {
        String status = vocabulary.toPlatformStatus(campaign.getStatus());

        return List.of(
                CreationStep.of("campaignId", "adaccounts/" + adAccountId + "/campaigns", ids -> {
                    Map<String, Object> entity = new LinkedHashMap<>();
                    entity.put("name", campaign.getName());
                    entity.put("ad_account_id", adAccountId);
                    entity.put("status", status);
                    entity.put("start_time", isoStart(campaign.getStartDate()));
                    entity.put("end_time", isoEnd(campaign.getEndDate()));
                    entity.put("lifetime_spend_cap_micro", BudgetUnits.toMicros(campaign.getBudget()));
                    return wrap("campaigns", "campaign", entity);
                }, "campaigns.0.campaign.id"),
                new CreationStep("adSquadId", ids -> "campaigns/" + ids.get("campaignId") + "/adsquads", ids -> {
                    Map<String, Object> entity = new LinkedHashMap<>();
                    entity.put("name", campaign.getName() + " - Ad Squad");
                    entity.put("campaign_id", ids.get("campaignId"));
                    entity.put("status", status);
                    entity.put("type", "SNAP_ADS");
                    entity.put("placement_v2", Map.of("config", "AUTOMATIC"));
                    entity.put("billing_event", "IMPRESSION");
                    entity.put("optimization_goal", "SWIPES");
                    entity.put("auto_bid", true);
                    entity.put("daily_budget_micro", BudgetUnits.toMicros(BudgetUnits.dailyAmount(campaign)));
                    entity.put("start_time", isoStart(campaign.getStartDate()));
                    entity.put("end_time", isoEnd(campaign.getEndDate()));
                    entity.put("targeting", targeting(audience(campaign)));
                    return wrap("adsquads", "adsquad", entity);
                }, "adsquads.0.adsquad.id"),
                CreationStep.of("creativeId", "adaccounts/" + adAccountId + "/creatives",
                        ids -> wrap("creatives", "creative", creative(campaign.getName(), campaign.getContent())),
                        "creatives.0.creative.id"),
                new CreationStep("id", ids -> "adsquads/" + ids.get("adSquadId") + "/ads", ids -> {
                    Map<String, Object> entity = new LinkedHashMap<>();
                    entity.put("name", campaign.getName());
                    entity.put("ad_squad_id", ids.get("adSquadId"));
                    entity.put("creative_id", ids.get("creativeId"));
                    entity.put("type", "REMOTE_WEBPAGE");
                    entity.put("status", status);
                    return wrap("ads", "ad", entity);
                }, "ads.0.ad.id"));
    }

    // ========================
    // UPDATE / DELETE / STATUS
    // ========================

    @Override
    protected Map<String, Object> applyUpdate(String adId, AdCampaignUpdate update) {
        Map<String, Object> ad = entity("ads/" + adId, "ads", "ad");
        String adSquadId = JsonPaths.readString(ad, "ad_squad_id").orElse(null);
        Map<String, Object> adSquad = adSquadId == null ? Map.of() : entity("adsquads/" + adSquadId, "adsquads", "adsquad");
        String campaignId = JsonPaths.readString(adSquad, "campaign_id").orElse(null);
        List<String> levels = new ArrayList<>();

        boolean adChanged = false;
        Map<String, Object> adChanges = new LinkedHashMap<>(ad);
        if (update.getStatus() != null) {
            adChanges.put("status", vocabulary.toPlatformStatus(update.getStatus()));
            adChanged = true;
        }
        if (update.getContent() != null) {
            String creativeName = Objects.toString(ad.get("name"), adId);
            Map<String, Object> created = client.post("adaccounts/" + adAccountId + "/creatives",
                    wrap("creatives", "creative", creative(creativeName, update.getContent())));
            String creativeId = JsonPaths.readString(created, "creatives.0.creative.id")
                    .orElseThrow(() -> new AdPlatformException("Snapchat returned no creative id", "SNAPCHAT_UNEXPECTED_RESPONSE"));
            adChanges.put("creative_id", creativeId);
            levels.add("creative");
            adChanged = true;
        }
        if (adChanged && adSquadId != null) {
            client.put("adsquads/" + adSquadId + "/ads", wrap("ads", "ad", adChanges));
            levels.add("ad");
        }

        if (!adSquad.isEmpty() && (update.getDailyBudget() != null || update.getTargetAudience() != null
                || update.getStartDate() != null || update.getEndDate() != null)) {
            Map<String, Object> squad = new LinkedHashMap<>(adSquad);
            if (update.getDailyBudget() != null) squad.put("daily_budget_micro", BudgetUnits.toMicros(update.getDailyBudget()));
            if (update.getTargetAudience() != null) squad.put("targeting", targeting(update.getTargetAudience()));
            if (update.getStartDate() != null) squad.put("start_time", isoStart(update.getStartDate()));
            if (update.getEndDate() != null) squad.put("end_time", isoEnd(update.getEndDate()));
            client.put("campaigns/" + campaignId + "/adsquads", wrap("adsquads", "adsquad", squad));
            levels.add("adSquad");
        }

        if (campaignId != null && (update.getName() != null || update.getBudget() != null
                || update.getStatus() != null || update.getStartDate() != null || update.getEndDate() != null)) {
            Map<String, Object> campaign = new LinkedHashMap<>(entity("campaigns/" + campaignId, "campaigns", "campaign"));
            if (update.getName() != null) campaign.put("name", update.getName());
            if (update.getBudget() != null) campaign.put("lifetime_spend_cap_micro", BudgetUnits.toMicros(update.getBudget()));
            if (update.getStatus() != null) campaign.put("status", vocabulary.toPlatformStatus(update.getStatus()));
            if (update.getStartDate() != null) campaign.put("start_time", isoStart(update.getStartDate()));
            if (update.getEndDate() != null) campaign.put("end_time", isoEnd(update.getEndDate()));
            client.put("adaccounts/" + adAccountId + "/campaigns", wrap("campaigns", "campaign", campaign));
            levels.add("campaign");
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("campaignId", campaignId);
        result.put("adSquadId", adSquadId);
        result.put("updatedLevels", levels);
        return result;
    }

    @Override
    protected Map<String, Object> removeAd(String adId) {
        client.delete("ads/" + adId);
        return Map.of("platformStatus", "DELETED");
    }

    @Override
    protected PlatformAdState fetchStatus(String adId) {
        Map<String, Object> ad = entity("ads/" + adId, "ads", "ad");

        String status = JsonPaths.readString(ad, "status").orElse(null);
        String review = JsonPaths.readString(ad, "review_status").orElse(null);

        Map<String, Object> details = new LinkedHashMap<>();
        JsonPaths.readString(ad, "ad_squad_id").ifPresent(id -> details.put("adSquadId", id));
        JsonPaths.readString(ad, "creative_id").ifPresent(id -> details.put("creativeId", id));
        if (review != null) details.put("reviewStatus", review);
        JsonPaths.read(ad, "review_status_reasons").ifPresent(reasons -> details.put("reviewStatusReasons", reasons));

        // review outcome wins over the delivery switch
        String effective = "REJECTED".equals(review) ? "REJECTED"
                : "PENDING".equals(review) ? "PENDING"
                : status;
        return new PlatformAdState(effective, details);
    }

    // ========================
    // INSIGHTS
    // ========================

    @Override
    protected Map<String, Object> fetchInsights(String adId, List<String> fields, LocalDate since, LocalDate until) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("granularity", "TOTAL");
        query.put("fields", String.join(",", fields));
        query.put("start_time", isoStart(since));
        query.put("end_time", isoStart(until.plusDays(1)));

        Map<String, Object> row = new LinkedHashMap<>(
                JsonPaths.readMap(client.get("ads/" + adId + "/stats", query), "total_stats.0.total_stat.stats"));
        toDecimal(row.get("spend")).ifPresent(micros -> row.put("spend", BudgetUnits.fromMicros(micros)));
        return row;
    }

    // ========================
    // PAYLOADS
    // ========================

    Map<String, Object> targeting(TargetAudience audience) {
        Map<String, Object> targeting = new LinkedHashMap<>();

        List<Map<String, Object>> geos = new ArrayList<>();
        for (String location : audience.locationsOrDefault("co")) {
            geos.add(Map.of("country_code", location.toLowerCase(Locale.ROOT)));
        }
        targeting.put("geos", geos);

        Map<String, Object> demographics = new LinkedHashMap<>();
        if (audience.getAgeRange() != null) {
            demographics.put("min_age", audience.getAgeRange().minOr(18));
            demographics.put("max_age", audience.getAgeRange().maxOr(65));
        }
        if (!audience.targetsAllGenders()) {
            demographics.put("gender", audience.getGenders().contains(Gender.MALE) ? "MALE" : "FEMALE");
        }
        if (audience.getLanguages() != null && !audience.getLanguages().isEmpty()) {
            demographics.put("languages", audience.getLanguages());
        }
        if (!demographics.isEmpty()) {
            targeting.put("demographics", List.of(demographics));
        }
        return targeting;
    }

    private Map<String, Object> creative(String name, AdContent content) {
        Map<String, Object> creative = new LinkedHashMap<>();
        creative.put("ad_account_id", adAccountId);
        creative.put("name", name + " - Creative");
        creative.put("type", "WEB_VIEW");
        creative.put("headline", truncate(Objects.toString(content.getTitle(), ""), 34));
        creative.put("brand_name", truncate(name, 25));
        creative.put("shareable", true);
        creative.put("call_to_action", vocabulary.callToAction(content.getCallToAction()));
        creative.put("web_view_properties", Map.of("url", content.getLandingUrl()));
        if (content.getVideoUrl() != null) {
            creative.put("top_snap_media_url", content.getVideoUrl());
        } else if (content.getImageUrl() != null) {
            creative.put("top_snap_media_url", content.getImageUrl());
        }
        return creative;
    }

    private Map<String, Object> entity(String endpoint, String collection, String key) {
        Map<String, Object> entity = JsonPaths.readMap(client.get(endpoint, Map.of()), collection + ".0." + key);
        if (entity.isEmpty()) {
            throw notFound("SNAPCHAT_NOT_FOUND", "Snapchat has no entity at " + endpoint);
        }
        return entity;
    }

    private static Map<String, Object> wrap(String collection, String key, Map<String, Object> entity) {
        return Map.of(collection, List.of(Map.of(key, entity)));
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
