package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.credentials.XCredentials;
import com.adflux.services.adplatforms.client.OAuth1Signer;
import com.adflux.services.adplatforms.client.PlatformHttpClient;
import com.adflux.services.adplatforms.constants.CampaignStatus;
import com.adflux.services.adplatforms.constants.Gender;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.request.AdCampaignUpdate;
import com.adflux.services.adplatforms.dto.request.AdContent;
import com.adflux.services.adplatforms.dto.request.TargetAudience;
import com.adflux.services.adplatforms.exception.AdPlatformException;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * X Ads API, OAuth 1.0a signed.
 *
 * Resource graph: campaign -> line item -> targeting criteria -> tweet -> promoted tweet.
 * The promoted tweet is the ad. Budgets and bids are sent in micros.
 */
@Slf4j
public class XAdapter extends AbstractPlatformAdapter {

    static final PlatformVocabulary VOCABULARY = PlatformVocabulary.builder()
            .callToAction("apply_now", "APPLY_NOW")
            .callToAction("sign_up", "SIGN_UP")
            .callToAction("learn_more", "LEARN_MORE")
            .callToAction("contact", "CONTACT_US")
            .callToAction("submit", "APPLY")
            .defaultCallToAction("LEARN_MORE")
            .outboundStatus(CampaignStatus.DRAFT, "DRAFT")
            .outboundStatus(CampaignStatus.ACTIVE, "ACTIVE")
            .defaultOutboundStatus("PAUSED")
            .inboundStatus("ACTIVE", CampaignStatus.ACTIVE)
            .inboundStatus("PAUSED", CampaignStatus.PAUSED)
            .inboundStatus("DRAFT", CampaignStatus.DRAFT)
            .inboundStatus("UNDER_REVIEW", CampaignStatus.PENDING)
            .inboundStatus("REJECTED", CampaignStatus.ERROR)
            .inboundStatus("DELETED", CampaignStatus.COMPLETED)
            .inboundStatus("EXPIRED", CampaignStatus.COMPLETED)
            .metric("impressions", "impressions")
            .metric("clicks", "clicks")
            .metric("engagement", "engagements")
            .metric("conversions", "conversion_site_visits")
            .metric("spend", "billed_charge_local_micro")
            .metric("videoViews", "video_total_views")
            .lookbackDays(7)
            .build();

    private static final long DEFAULT_BID_MICROS = 1_500_000L;

    private final String accountId;
    private final String fundingInstrumentId;

    public XAdapter(PlatformHttpClient client, AuthManager authManager, Clock clock, XCredentials credentials) {
        super(client, authManager, VOCABULARY, clock);
        this.accountId = credentials.getAccountId();
        this.fundingInstrumentId = credentials.getFundingInstrumentId();
        client.setSigner(new OAuth1Signer(credentials.getConsumerKey(), credentials.getConsumerSecret(),
                () -> authManager.requireToken(Platform.X), credentials.getAccessTokenSecret(), clock));
    }

    @Override
    protected void validatePrerequisites(AdCampaign campaign) {
        if (accountId == null || accountId.isBlank()) {
            throw notConfigured("X_ACCOUNT_REQUIRED", "X ads account id is not configured");
        }
        if (fundingInstrumentId == null || fundingInstrumentId.isBlank()) {
            throw notConfigured("X_FUNDING_INSTRUMENT_REQUIRED", "X funding instrument id is not configured");
        }
    }

    // ========================
    // CREATE
    // ========================

    @Override
    protected List<CreationStep> creationSteps(AdCampaign campaign) {
        String status = vocabulary.toPlatformStatus(campaign.getStatus());

        return List.of(
                CreationStep.of("campaignId", account("campaigns"), ids -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("name", campaign.getName());
                    body.put("funding_instrument_id", fundingInstrumentId);
                    body.put("start_time", isoStart(campaign.getStartDate()));
                    body.put("end_time", isoEnd(campaign.getEndDate()));
                    body.put("daily_budget_amount_local_micro", BudgetUnits.toMicros(BudgetUnits.dailyAmount(campaign)));
                    body.put("total_budget_amount_local_micro", BudgetUnits.toMicros(campaign.getBudget()));
                    body.put("entity_status", status);
                    return body;
                }, "data.id"),
                CreationStep.of("lineItemId", account("line_items"), ids -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("campaign_id", ids.get("campaignId"));
                    body.put("name", campaign.getName() + " - Line Item");
                    body.put("product_type", "PROMOTED_TWEETS");
                    body.put("placements", List.of("ALL_ON_TWITTER"));
                    body.put("objective", "WEBSITE_CLICKS");
                    body.put("bid_amount_local_micro", DEFAULT_BID_MICROS);
                    body.put("entity_status", status);
                    return body;
                }, "data.id"),
                new CreationStep("targetingCriteriaId",
                        ids -> "batch/" + account("targeting_criteria"),
                        ids -> targetingOperations(ids.get("lineItemId"), audience(campaign)),
                        "data.0.id"),
                CreationStep.of("tweetId", account("tweet"),
                        ids -> tweet(campaign.getContent()), "data.id_str"),
                CreationStep.of("id", account("promoted_tweets"), ids -> {
                    Map<String, Object> body = new LinkedHashMap<>();
                    body.put("line_item_id", ids.get("lineItemId"));
                    body.put("tweet_ids", List.of(ids.get("tweetId")));
                    return body;
                }, "data.0.id"));
    }

    // ========================
    // UPDATE / DELETE / STATUS
    // ========================

    /**
     * Budget, dates, name and status live on the campaign; status is mirrored on the line item.
     * New content means a new tweet promoted in place of the old one.
     */
    @Override
    protected Map<String, Object> applyUpdate(String adId, AdCampaignUpdate update) {
        Map<String, Object> promoted = client.get(account("promoted_tweets/" + adId), Map.of());
        String lineItemId = requireString(promoted, "data.line_item_id", adId);
        Map<String, Object> lineItem = client.get(account("line_items/" + lineItemId), Map.of());
        String campaignId = requireString(lineItem, "data.campaign_id", adId);
        List<String> levels = new ArrayList<>();

        if (update.getStatus() != null) {
            client.put(account("line_items/" + lineItemId),
                    Map.of("entity_status", vocabulary.toPlatformStatus(update.getStatus())));
            levels.add("lineItem");
        }

        Map<String, Object> campaignPatch = new LinkedHashMap<>();
        if (update.getName() != null) campaignPatch.put("name", update.getName());
        if (update.getStatus() != null) campaignPatch.put("entity_status", vocabulary.toPlatformStatus(update.getStatus()));
        if (update.getDailyBudget() != null) {
            campaignPatch.put("daily_budget_amount_local_micro", BudgetUnits.toMicros(update.getDailyBudget()));
        }
        if (update.getBudget() != null) {
            campaignPatch.put("total_budget_amount_local_micro", BudgetUnits.toMicros(update.getBudget()));
        }
        if (update.getStartDate() != null) campaignPatch.put("start_time", isoStart(update.getStartDate()));
        if (update.getEndDate() != null) campaignPatch.put("end_time", isoEnd(update.getEndDate()));
        if (!campaignPatch.isEmpty()) {
            client.put(account("campaigns/" + campaignId), campaignPatch);
            levels.add("campaign");
        }

        if (update.getTargetAudience() != null) {
            client.post("batch/" + account("targeting_criteria"),
                    targetingOperations(lineItemId, update.getTargetAudience()));
            levels.add("targeting");
        }

        Map<String, Object> result = new LinkedHashMap<>();
        if (update.getContent() != null) {
            String tweetId = requireString(client.post(account("tweet"), tweet(update.getContent())), "data.id_str", adId);
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("line_item_id", lineItemId);
            body.put("tweet_ids", List.of(tweetId));
            String newAdId = requireString(client.post(account("promoted_tweets"), body), "data.0.id", adId);
            client.delete(account("promoted_tweets/" + adId));
            result.put("id", newAdId);
            result.put("replacedAdId", adId);
            result.put("tweetId", tweetId);
            levels.add("tweet");
            log.info("X promoted tweet {} replaced by {}", adId, newAdId);
        }

        result.put("campaignId", campaignId);
        result.put("lineItemId", lineItemId);
        result.put("updatedLevels", levels);
        return result;
    }

    @Override
    protected Map<String, Object> removeAd(String adId) {
        Map<String, Object> response = client.delete(account("promoted_tweets/" + adId));
        Map<String, Object> result = new LinkedHashMap<>();
        JsonPaths.readString(response, "data.line_item_id").ifPresent(id -> result.put("lineItemId", id));
        result.put("platformStatus", "DELETED");
        return result;
    }

    @Override
    protected PlatformAdState fetchStatus(String adId) {
        Map<String, Object> data = JsonPaths.readMap(client.get(account("promoted_tweets/" + adId), Map.of()), "data");

        String approval = JsonPaths.readString(data, "approval_status").orElse(null);
        String entityStatus = JsonPaths.readString(data, "entity_status").orElse(null);
        boolean deleted = Boolean.TRUE.equals(data.get("deleted"));

        Map<String, Object> details = new LinkedHashMap<>();
        JsonPaths.readString(data, "line_item_id").ifPresent(id -> details.put("lineItemId", id));
        JsonPaths.readString(data, "tweet_id").ifPresent(id -> details.put("tweetId", id));
        if (approval != null) details.put("approvalStatus", approval);

        String effective = deleted ? "DELETED"
                : "REJECTED".equals(approval) ? "REJECTED"
                : "UNDER_REVIEW".equals(approval) ? "UNDER_REVIEW"
                : entityStatus;
        return new PlatformAdState(effective, details);
    }

    // ========================
    // INSIGHTS
    // ========================

    @Override
    protected Map<String, Object> fetchInsights(String adId, List<String> fields, LocalDate since, LocalDate until) {
        Map<String, String> query = new LinkedHashMap<>();
        query.put("entity", "PROMOTED_TWEET");
        query.put("entity_ids", adId);
        query.put("metric_groups", "ENGAGEMENT,BILLING,VIDEO,WEB_CONVERSION");
        query.put("start_time", isoStart(since));
        query.put("end_time", isoStart(until.plusDays(1)));
        query.put("granularity", "TOTAL");
        query.put("placement", "ALL_ON_TWITTER");

        Map<String, Object> metrics = JsonPaths.readMap(client.get(statsPath(), query), "data.0.id_data.0.metrics");
        Map<String, Object> row = new LinkedHashMap<>();
        metrics.forEach((name, value) -> {
            // TOTAL granularity answers one-element arrays
            Object scalar = value instanceof List && !((List<?>) value).isEmpty() ? ((List<?>) value).get(0) : value;
            if (scalar != null) row.put(name, scalar);
        });
        toDecimal(row.get("billed_charge_local_micro"))
                .ifPresent(micros -> row.put("billed_charge_local_micro", BudgetUnits.fromMicros(micros)));
        return row;
    }

    /** ctr is not reported by X; it is derived from impressions and clicks */
    @Override
    protected Optional<BigDecimal> metricValue(String metric, Map<String, Object> row) {
        if ("ctr".equals(metric)) {
            Optional<BigDecimal> impressions = toDecimal(row.get("impressions"));
            Optional<BigDecimal> clicks = toDecimal(row.get("clicks"));
            if (impressions.isPresent() && clicks.isPresent() && impressions.get().signum() > 0) {
                return Optional.of(clicks.get().multiply(BigDecimal.valueOf(100))
                        .divide(impressions.get(), 4, RoundingMode.HALF_UP));
            }
            return Optional.empty();
        }
        return super.metricValue(metric, row);
    }

    // ========================
    // PAYLOADS
    // ========================

    List<Map<String, Object>> targetingOperations(String lineItemId, TargetAudience audience) {
        List<Map<String, Object>> operations = new ArrayList<>();
        for (String location : audience.locationsOrDefault("CO")) {
            operations.add(criterion(lineItemId, "LOCATION", location));
        }
        if (!audience.targetsAllGenders()) {
            operations.add(criterion(lineItemId, "GENDER", audience.getGenders().contains(Gender.MALE) ? "1" : "2"));
        }
        if (audience.getAgeRange() != null) {
            operations.add(criterion(lineItemId, "AGE",
                    "AGE_" + audience.getAgeRange().minOr(18) + "_TO_" + audience.getAgeRange().maxOr(65)));
        }
        for (String interest : audience.interestsOrEmpty()) {
            operations.add(criterion(lineItemId, "BROAD_KEYWORD", interest));
        }
        if (audience.getLanguages() != null) {
            for (String language : audience.getLanguages()) {
                operations.add(criterion(lineItemId, "LANGUAGE", language));
            }
        }
        return operations;
    }

    private Map<String, Object> criterion(String lineItemId, String type, String value) {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("line_item_id", lineItemId);
        params.put("targeting_type", type);
        params.put("targeting_value", value);
        return Map.of("operation_type", "Create", "params", params);
    }

    private Map<String, Object> tweet(AdContent content) {
        StringBuilder text = new StringBuilder();
        if (content.getTitle() != null) text.append(content.getTitle()).append("\n\n");
        if (content.getDescription() != null) text.append(content.getDescription()).append("\n\n");
        if (content.getLandingUrl() != null) text.append(content.getLandingUrl());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", text.toString().trim());
        body.put("nullcast", true);
        body.put("call_to_action", vocabulary.callToAction(content.getCallToAction()));
        return body;
    }

    private String account(String resource) {
        return "accounts/" + accountId + "/" + resource;
    }

    private String statsPath() {
        return "stats/accounts/" + accountId;
    }

    private String requireString(Map<String, Object> body, String path, String adId) {
        return JsonPaths.readString(body, path)
                .orElseThrow(() -> new AdPlatformException("X response for ad " + adId + " has no " + path,
                        "X_UNEXPECTED_RESPONSE"));
    }
}
