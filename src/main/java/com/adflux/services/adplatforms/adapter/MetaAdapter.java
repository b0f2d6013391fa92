package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.credentials.MetaCredentials;
import com.adflux.services.adplatforms.client.PlatformHttpClient;
import com.adflux.services.adplatforms.constants.CampaignStatus;
import com.adflux.services.adplatforms.constants.Gender;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.request.AdCampaignUpdate;
import com.adflux.services.adplatforms.dto.request.AdContent;
import com.adflux.services.adplatforms.dto.request.TargetAudience;
import com.adflux.services.adplatforms.exception.AdPlatformException;
import com.adflux.services.adplatforms.exception.InvalidCampaignException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Meta Marketing API (Facebook / Instagram).
 *
 * Resource graph: act_{account}/campaigns -> adsets -> adcreatives -> ads.
 * Budgets are sent in cents. Deletion is the terminal status DELETED.
 */
@Slf4j
public class MetaAdapter extends AbstractPlatformAdapter {

    static final PlatformVocabulary VOCABULARY = PlatformVocabulary.builder()
            .callToAction("apply_now", "APPLY_NOW")
            .callToAction("sign_up", "SIGN_UP")
            .callToAction("learn_more", "LEARN_MORE")
            .callToAction("contact", "CONTACT_US")
            .callToAction("submit", "SUBMIT_APPLICATION")
            .defaultCallToAction("LEARN_MORE")
            .outboundStatus(CampaignStatus.ACTIVE, "ACTIVE")
            .outboundStatus(CampaignStatus.PAUSED, "PAUSED")
            .outboundStatus(CampaignStatus.COMPLETED, "ARCHIVED")
            .defaultOutboundStatus("PAUSED")
            .inboundStatus("ACTIVE", CampaignStatus.ACTIVE)
            .inboundStatus("PAUSED", CampaignStatus.PAUSED)
            .inboundStatus("CAMPAIGN_PAUSED", CampaignStatus.PAUSED)
            .inboundStatus("ADSET_PAUSED", CampaignStatus.PAUSED)
            .inboundStatus("DELETED", CampaignStatus.COMPLETED)
            .inboundStatus("ARCHIVED", CampaignStatus.COMPLETED)
            .inboundStatus("PENDING_REVIEW", CampaignStatus.PENDING)
            .inboundStatus("IN_PROCESS", CampaignStatus.PENDING)
            .inboundStatus("PREAPPROVED", CampaignStatus.PENDING)
            .inboundStatus("PENDING_BILLING_INFO", CampaignStatus.PENDING)
            .inboundStatus("DISAPPROVED", CampaignStatus.ERROR)
            .inboundStatus("WITH_ISSUES", CampaignStatus.ERROR)
            .metric("impressions", "impressions")
            .metric("clicks", "clicks")
            .metric("ctr", "ctr")
            .metric("reach", "reach")
            .metric("frequency", "frequency")
            .metric("conversions", "actions")
            .metric("costPerConversion", "cost_per_action_type")
            .metric("costPerClick", "cost_per_inline_link_click")
            .metric("engagement", "inline_post_engagement")
            .metric("spend", "spend")
            .metric("uniqueClicks", "unique_clicks")
            .metric("videoViews", "video_p25_watched_actions")
            .lookbackDays(30)
            .build();

    private static final Map<String, Integer> EDUCATION_STATUSES = Map.of(
            "high_school", 1,
            "technical", 2,
            "undergraduate", 3,
            "graduate", 4);

    private volatile String adAccountId;
    private volatile String pageId;

    public MetaAdapter(PlatformHttpClient client, AuthManager authManager, Clock clock, MetaCredentials credentials) {
        super(client, authManager, VOCABULARY, clock);
        this.adAccountId = blankToNull(credentials.getAdAccountId());
        this.pageId = blankToNull(credentials.getPageId());
        client.setSigner(bearerSigner());
    }

    // ========================
    // ACCOUNT
    // ========================

    /** Picks the first active ad account (account_status == 1) and the first page of the token */
    @Override
    protected Map<String, Object> resolveAccount() {
        if (adAccountId == null) {
            List<Object> accounts = JsonPaths.readList(
                    client.get("me/adaccounts", Map.of("fields", "id,name,account_status,currency")), "data");
            if (accounts.isEmpty()) {
                throw notConfigured("META_NO_AD_ACCOUNT", "No ad accounts are linked to the Meta token");
            }
            Object chosen = accounts.stream()
                    .filter(account -> "1".equals(JsonPaths.readString(account, "account_status").orElse(null)))
                    .findFirst()
                    .orElse(accounts.get(0));
            adAccountId = JsonPaths.readString(chosen, "id")
                    .orElseThrow(() -> notConfigured("META_NO_AD_ACCOUNT", "Meta ad account has no id"));
            log.info("Meta ad account selected: {}", adAccountId);
        }
        if (pageId == null) {
            List<Object> pages = JsonPaths.readList(
                    client.get("me/accounts", Map.of("fields", "id,name,category")), "data");
            if (pages.isEmpty()) {
                log.warn("No Facebook pages linked to the Meta token; ads cannot be created until a page is set");
            } else {
                pageId = JsonPaths.readString(pages.get(0), "id").orElse(null);
                log.info("Facebook page selected: {}", pageId);
            }
        }

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("accountId", adAccountId);
        if (pageId != null) data.put("pageId", pageId);
        return data;
    }

    @Override
    protected void validatePrerequisites(AdCampaign campaign) {
        if (adAccountId == null) {
            throw notConfigured("META_AD_ACCOUNT_REQUIRED", "No Meta ad account id resolved");
        }
        if (pageId == null) {
            throw notConfigured("META_PAGE_REQUIRED", "No Facebook page id resolved");
        }
    }

    // ========================
    // CREATE
    // ========================

    @Override
    protected List<CreationStep> creationSteps(AdCampaign campaign) {
        String account = accountPath();
        String status = vocabulary.toPlatformStatus(campaign.getStatus());

        return List.of(
                CreationStep.of("campaignId", account + "/campaigns", ids -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("name", campaign.getName());
                    body.put("objective", "OUTCOME_TRAFFIC");
                    body.put("status", status);
                    body.put("special_ad_categories", List.of());
                    return body;
                }, "id"),
                CreationStep.of("adSetId", account + "/adsets", ids -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("name", campaign.getName() + " - Ad Set");
                    body.put("campaign_id", ids.get("campaignId"));
                    body.put("targeting", targeting(audience(campaign)));
                    if (campaign.hasDailyBudget()) {
                        body.put("daily_budget", BudgetUnits.toCents(campaign.getDailyBudget()));
                    } else {
                        body.put("lifetime_budget", BudgetUnits.toCents(campaign.getBudget()));
                    }
                    body.put("start_time", isoStart(campaign.getStartDate()));
                    body.put("end_time", isoEnd(campaign.getEndDate()));
                    body.put("billing_event", "IMPRESSIONS");
                    body.put("optimization_goal", "LINK_CLICKS");
                    body.put("bid_amount", 1000);
                    body.put("status", status);
                    return body;
                }, "id"),
                CreationStep.of("creativeId", account + "/adcreatives",
                        ids -> creative(campaign.getName() + " - Creative", campaign.getContent()), "id"),
                CreationStep.of("id", account + "/ads", ids -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("name", campaign.getName() + " - Ad");
                    body.put("adset_id", ids.get("adSetId"));
                    body.put("creative", Map.of("creative_id", ids.get("creativeId")));
                    body.put("status", status);
                    return body;
                }, "id"));
    }

    // ========================
    // UPDATE / DELETE / STATUS
    // ========================

    @Override
    protected Map<String, Object> applyUpdate(String adId, AdCampaignUpdate update) {
        Map<String, Object> ad = client.get(adId, Map.of("fields", "id,name,adset_id,campaign_id,creative"));
        String adSetId = JsonPaths.readString(ad, "adset_id").orElse(null);
        String campaignId = JsonPaths.readString(ad, "campaign_id").orElse(null);
        List<String> levels = new ArrayList<>();

        if (update.touchesCampaign()) {
            client.post(adId, namedStatusPatch(update));
            levels.add("ad");
        }
        if (update.touchesAdSet() && adSetId != null) {
            Map<String, Object> patch = new LinkedHashMap<>();
            if (update.getDailyBudget() != null) patch.put("daily_budget", BudgetUnits.toCents(update.getDailyBudget()));
            if (update.getBudget() != null) patch.put("lifetime_budget", BudgetUnits.toCents(update.getBudget()));
            if (update.getStartDate() != null) patch.put("start_time", isoStart(update.getStartDate()));
            if (update.getEndDate() != null) patch.put("end_time", isoEnd(update.getEndDate()));
            if (update.getTargetAudience() != null) patch.put("targeting", targeting(update.getTargetAudience()));
            client.post(adSetId, patch);
            levels.add("adSet");
        }
        if (update.touchesCampaign() && campaignId != null) {
            client.post(campaignId, namedStatusPatch(update));
            levels.add("campaign");
        }

        Map<String, Object> result = new LinkedHashMap<>();
        if (update.getContent() != null) {
            String name = update.getName() != null ? update.getName() : JsonPaths.readString(ad, "name").orElse(adId);
            Map<String, Object> created = client.post(accountPath() + "/adcreatives",
                    creative(name + " - Creative Updated", update.getContent()));
            String creativeId = JsonPaths.readString(created, "id")
                    .orElseThrow(() -> new AdPlatformException("Meta returned no creative id", "META_CREATIVE_FAILED"));
            client.post(adId, Map.of("creative", Map.of("creative_id", creativeId)));
            result.put("creativeId", creativeId);
            levels.add("creative");
            log.info("Meta ad {} switched to creative {}", adId, creativeId);
        }

        if (campaignId != null) result.put("campaignId", campaignId);
        if (adSetId != null) result.put("adSetId", adSetId);
        result.put("updatedLevels", levels);
        return result;
    }

    @Override
    protected Map<String, Object> removeAd(String adId) {
        Map<String, Object> ad = client.get(adId, Map.of("fields", "id,adset_id,campaign_id"));
        client.post(adId, Map.of("status", "DELETED"));

        Map<String, Object> result = new LinkedHashMap<>();
        JsonPaths.readString(ad, "campaign_id").ifPresent(id -> result.put("campaignId", id));
        JsonPaths.readString(ad, "adset_id").ifPresent(id -> result.put("adSetId", id));
        result.put("platformStatus", "DELETED");
        return result;
    }

    @Override
    protected PlatformAdState fetchStatus(String adId) {
        Map<String, Object> ad = client.get(adId,
                Map.of("fields", "id,name,status,effective_status,adset{status},campaign{status}"));

        Map<String, Object> details = new LinkedHashMap<>();
        JsonPaths.readString(ad, "name").ifPresent(name -> details.put("name", name));
        JsonPaths.readString(ad, "status").ifPresent(status -> details.put("configuredStatus", status));
        details.put("adSetStatus", JsonPaths.readString(ad, "adset.status").orElse("unknown"));
        details.put("campaignStatus", JsonPaths.readString(ad, "campaign.status").orElse("unknown"));
        return new PlatformAdState(JsonPaths.readString(ad, "effective_status").orElse(null), details);
    }

    // ========================
    // INSIGHTS
    // ========================

    @Override
    protected Map<String, Object> fetchInsights(String adId, List<String> fields, LocalDate since, LocalDate until) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("fields", String.join(",", fields));
        query.put("time_range", "{\"since\":\"" + since + "\",\"until\":\"" + until + "\"}");
        query.put("level", "ad");
        return JsonPaths.readMap(client.get(adId + "/insights", query), "data.0");
    }

    /** Conversions are the sum of conversion-type actions */
    @Override
    protected Optional<BigDecimal> metricValue(String metric, Map<String, Object> row) {
        if (!"conversions".equals(metric)) {
            return super.metricValue(metric, row);
        }
        List<Object> actions = JsonPaths.readList(row, "actions");
        if (actions.isEmpty()) {
            return Optional.empty();
        }
        BigDecimal total = BigDecimal.ZERO;
        for (Object action : actions) {
            String type = JsonPaths.readString(action, "action_type").orElse("");
            if (type.contains("conversion") || type.equals("lead")) {
                total = total.add(toDecimal(JsonPaths.read(action, "value").orElse(null)).orElse(BigDecimal.ZERO));
            }
        }
        return Optional.of(total);
    }

    // ========================
    // PAYLOADS
    // ========================

    Map<String, Object> targeting(TargetAudience audience) {
        Map<String, Object> targeting = new LinkedHashMap<>();
        targeting.put("geo_locations", Map.of("countries", audience.locationsOrDefault("CO")));
        targeting.put("age_min", audience.getAgeRange() != null ? audience.getAgeRange().minOr(18) : 18);
        targeting.put("age_max", audience.getAgeRange() != null ? audience.getAgeRange().maxOr(65) : 65);
        if (audience.targetsAllGenders()) {
            targeting.put("genders", List.of(1, 2));
        } else {
            targeting.put("genders", audience.getGenders().contains(Gender.MALE) ? List.of(1) : List.of(2));
        }
        if (!audience.interestsOrEmpty().isEmpty()) {
            List<Map<String, String>> interests = new ArrayList<>();
            audience.interestsOrEmpty().forEach(interest -> interests.add(Map.of("name", interest)));
            targeting.put("interests", interests);
        }
        if (audience.getEducationLevels() != null && !audience.getEducationLevels().isEmpty()) {
            List<Integer> statuses = new ArrayList<>();
            audience.getEducationLevels().forEach(level ->
                    statuses.add(EDUCATION_STATUSES.getOrDefault(level.toLowerCase(Locale.ROOT).replace('-', '_'), 1)));
            targeting.put("education_statuses", statuses);
        }
        if (audience.getLanguages() != null && !audience.getLanguages().isEmpty()) {
            targeting.put("locales", audience.getLanguages());
        }
        return targeting;
    }

    private Map<String, Object> creative(String name, AdContent content) {
        if (pageId == null) {
            throw notConfigured("META_PAGE_REQUIRED", "No Facebook page id resolved");
        }
        if (content.getLandingUrl() == null || content.getLandingUrl().isBlank()) {
            throw new InvalidCampaignException("Meta creatives need a landing URL");
        }
        Map<String, Object> linkData = new LinkedHashMap<>();
        linkData.put("message", Objects.toString(content.getTitle(), "") + "\n\n"
                + Objects.toString(content.getDescription(), ""));
        linkData.put("link", content.getLandingUrl());
        if (content.getImageUrl() != null) linkData.put("image_url", content.getImageUrl());
        linkData.put("call_to_action", Map.of(
                "type", vocabulary.callToAction(content.getCallToAction()),
                "value", Map.of("link", content.getLandingUrl())));

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        body.put("object_story_spec", Map.of("page_id", pageId, "link_data", linkData));
        return body;
    }

    private Map<String, Object> namedStatusPatch(AdCampaignUpdate update) {
        Map<String, Object> patch = new LinkedHashMap<>();
        if (update.getName() != null) patch.put("name", update.getName());
        if (update.getStatus() != null) patch.put("status", vocabulary.toPlatformStatus(update.getStatus()));
        return patch;
    }

    private String accountPath() {
        return adAccountId.startsWith("act_") ? adAccountId : "act_" + adAccountId;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
