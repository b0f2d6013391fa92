package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.credentials.GoogleCredentials;
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
import org.springframework.http.HttpHeaders;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.*;

/**
 * Google Ads REST API.
 *
 * Resource graph: campaign budget -> search campaign -> (geo criteria) -> ad group
 * -> (keywords) -> responsive search ad. Every step is a {@code :mutate} call whose
 * created resource name is the id handed to the next step.
 */
@Slf4j
public class GoogleAdsAdapter extends AbstractPlatformAdapter {

    static final PlatformVocabulary VOCABULARY = PlatformVocabulary.builder()
            .callToAction("apply_now", "APPLY_NOW")
            .callToAction("sign_up", "SIGN_UP")
            .callToAction("learn_more", "LEARN_MORE")
            .callToAction("contact", "CONTACT_US")
            .callToAction("submit", "APPLY_NOW")
            .defaultCallToAction("LEARN_MORE")
            .outboundStatus(CampaignStatus.ACTIVE, "ENABLED")
            .outboundStatus(CampaignStatus.COMPLETED, "REMOVED")
            .defaultOutboundStatus("PAUSED")
            .inboundStatus("ENABLED", CampaignStatus.ACTIVE)
            .inboundStatus("PAUSED", CampaignStatus.PAUSED)
            .inboundStatus("REMOVED", CampaignStatus.COMPLETED)
            .inboundStatus("UNDER_REVIEW", CampaignStatus.PENDING)
            .inboundStatus("DISAPPROVED", CampaignStatus.ERROR)
            .metric("impressions", "metrics.impressions")
            .metric("clicks", "metrics.clicks")
            .metric("ctr", "metrics.ctr")
            .metric("spend", "metrics.cost_micros")
            .metric("conversions", "metrics.conversions")
            .metric("cpc", "metrics.average_cpc")
            .metric("videoViews", "metrics.video_views")
            .lookbackDays(7)
            .build();

    /** Geo target constants for the markets campaigns are run in */
    static final Map<String, String> GEO_TARGETS = Map.of(
            "CO", "geoTargetConstants/2170",
            "MX", "geoTargetConstants/2484",
            "AR", "geoTargetConstants/2032",
            "ES", "geoTargetConstants/2724",
            "US", "geoTargetConstants/2840");

    private static final int HEADLINE_MAX = 30;
    private static final int DESCRIPTION_MAX = 90;
    private static final long DEFAULT_CPC_BID_MICROS = 1_000_000L;

    private final String customerId;
    private final String managerId;
    private final String developerToken;

    public GoogleAdsAdapter(PlatformHttpClient client, AuthManager authManager, Clock clock,
                            GoogleCredentials credentials) {
        super(client, authManager, VOCABULARY, clock);
        this.customerId = stripDashes(credentials.getCustomerId());
        this.managerId = stripDashes(credentials.getManagerId());
        this.developerToken = credentials.getDeveloperToken();
        client.setSigner((method, uri) -> {
            Map<String, String> headers = new LinkedHashMap<>();
            headers.put(HttpHeaders.AUTHORIZATION, "Bearer " + authManager.requireToken(Platform.GOOGLE));
            headers.put("developer-token", developerToken);
            if (managerId != null) {
                headers.put("login-customer-id", managerId);
            }
            return headers;
        });
    }

    @Override
    protected void validatePrerequisites(AdCampaign campaign) {
        if (customerId == null) {
            throw notConfigured("GOOGLE_CUSTOMER_REQUIRED", "Google Ads customer id is not configured");
        }
    }

    // ========================
    // CREATE
    // ========================

    @Override
    protected List<CreationStep> creationSteps(AdCampaign campaign) {
        TargetAudience audience = audience(campaign);
        String status = vocabulary.toPlatformStatus(campaign.getStatus());

        return List.of(
                CreationStep.of("budgetId", mutate("campaignBudgets"), ids -> {
                    Map<String, Object> budget = new LinkedHashMap<>();
                    budget.put("name", campaign.getName() + " Budget " + clock.millis());
                    budget.put("amountMicros", String.valueOf(BudgetUnits.toMicros(BudgetUnits.dailyAmount(campaign))));
                    budget.put("deliveryMethod", "STANDARD");
                    budget.put("explicitlyShared", false);
                    return create(budget);
                }, "results.0.resourceName"),
                CreationStep.of("campaignId", mutate("campaigns"), ids -> {
                    Map<String, Object> network = new LinkedHashMap<>();
                    network.put("targetGoogleSearch", true);
                    network.put("targetSearchNetwork", true);
                    network.put("targetContentNetwork", false);

                    Map<String, Object> created = new LinkedHashMap<>();
                    created.put("name", campaign.getName());
                    created.put("status", status);
                    created.put("advertisingChannelType", "SEARCH");
                    created.put("campaignBudget", ids.get("budgetId"));
                    created.put("manualCpc", Map.of("enhancedCpcEnabled", false));
                    created.put("networkSettings", network);
                    created.put("startDate", campaign.getStartDate().toString());
                    created.put("endDate", campaign.getEndDate().toString());
                    return create(created);
                }, "results.0.resourceName"),
                CreationStep.of("campaignCriteriaId", mutate("campaignCriteria"),
                        ids -> campaignCriteria(ids.get("campaignId"), audience), "results.0.resourceName"),
                CreationStep.of("adGroupId", mutate("adGroups"), ids -> {
                    Map<String, Object> group = new LinkedHashMap<>();
                    group.put("name", campaign.getName() + " - Ad Group");
                    group.put("campaign", ids.get("campaignId"));
                    group.put("status", "ENABLED");
                    group.put("type", "SEARCH_STANDARD");
                    group.put("cpcBidMicros", String.valueOf(DEFAULT_CPC_BID_MICROS));
                    return create(group);
                }, "results.0.resourceName"),
                CreationStep.of("keywordsId", mutate("adGroupCriteria"),
                        ids -> keywords(ids.get("adGroupId"), audience), "results.0.resourceName"),
                CreationStep.of("id", mutate("adGroupAds"), ids -> {
                    Map<String, Object> groupAd = new LinkedHashMap<>();
                    groupAd.put("adGroup", ids.get("adGroupId"));
                    groupAd.put("status", "ENABLED");
                    groupAd.put("ad", responsiveSearchAd(campaign.getContent()));
                    return create(groupAd);
                }, "results.0.resourceName"));
    }

    // ========================
    // UPDATE / DELETE / STATUS
    // ========================

    @Override
    protected Map<String, Object> applyUpdate(String adId, AdCampaignUpdate update) {
        Map<String, Object> row = searchOne("SELECT ad_group_ad.resource_name, campaign.resource_name, "
                + "campaign.campaign_budget, ad_group.resource_name FROM ad_group_ad "
                + "WHERE ad_group_ad.resource_name = '" + adId + "'", adId);
        String campaign = JsonPaths.readString(row, "campaign.resourceName").orElse(null);
        String budget = JsonPaths.readString(row, "campaign.campaignBudget").orElse(null);
        List<String> levels = new ArrayList<>();

        if (update.getStatus() != null) {
            client.post(mutate("adGroupAds"), update(Map.of(
                    "resourceName", adId,
                    "status", vocabulary.toPlatformStatus(update.getStatus())), "status"));
            levels.add("ad");
        }

        Map<String, Object> campaignChanges = new LinkedHashMap<>();
        if (update.getName() != null) campaignChanges.put("name", update.getName());
        if (update.getStatus() != null) campaignChanges.put("status", vocabulary.toPlatformStatus(update.getStatus()));
        if (update.getStartDate() != null) campaignChanges.put("startDate", update.getStartDate().toString());
        if (update.getEndDate() != null) campaignChanges.put("endDate", update.getEndDate().toString());
        if (!campaignChanges.isEmpty() && campaign != null) {
            String mask = String.join(",", campaignChanges.keySet()).replace("startDate", "start_date")
                    .replace("endDate", "end_date");
            campaignChanges.put("resourceName", campaign);
            client.post(mutate("campaigns"), update(campaignChanges, mask));
            levels.add("campaign");
        }

        BigDecimal daily = update.getDailyBudget() != null ? update.getDailyBudget() : update.getBudget();
        if (daily != null && budget != null) {
            client.post(mutate("campaignBudgets"), update(Map.of(
                    "resourceName", budget,
                    "amountMicros", String.valueOf(BudgetUnits.toMicros(daily))), "amount_micros"));
            levels.add("budget");
        }

        if (update.getTargetAudience() != null && campaign != null) {
            Object criteria = campaignCriteria(campaign, update.getTargetAudience());
            if (criteria != null) {
                client.post(mutate("campaignCriteria"), criteria);
                levels.add("targeting");
            }
        }

        if (update.getContent() != null) {
            // responsive search ads are immutable: create a new one and remove the old
            String adGroup = JsonPaths.readString(row, "adGroup.resourceName")
                    .orElseThrow(() -> new AdPlatformException("No ad group found for " + adId, "GOOGLE_UNEXPECTED_RESPONSE"));
            Map<String, Object> groupAd = new LinkedHashMap<>();
            groupAd.put("adGroup", adGroup);
            groupAd.put("status", "ENABLED");
            groupAd.put("ad", responsiveSearchAd(update.getContent()));
            String replacement = JsonPaths.readString(client.post(mutate("adGroupAds"), create(groupAd)),
                    "results.0.resourceName").orElse(null);
            client.post(mutate("adGroupAds"), remove(adId));
            levels.add("ad");
            log.info("Google ad {} replaced by {}", adId, replacement);
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("id", replacement);
            result.put("replacedAdId", adId);
            result.put("campaignId", campaign);
            result.put("updatedLevels", levels);
            return result;
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("campaignId", campaign);
        result.put("updatedLevels", levels);
        return result;
    }

    @Override
    protected Map<String, Object> removeAd(String adId) {
        client.post(mutate("adGroupAds"), remove(adId));
        return Map.of("platformStatus", "REMOVED");
    }

    @Override
    protected PlatformAdState fetchStatus(String adId) {
        Map<String, Object> row = searchOne("SELECT ad_group_ad.resource_name, ad_group_ad.status, "
                + "ad_group_ad.policy_summary.approval_status, ad_group_ad.policy_summary.review_status, "
                + "campaign.status, ad_group.status FROM ad_group_ad "
                + "WHERE ad_group_ad.resource_name = '" + adId + "'", adId);

        String status = JsonPaths.readString(row, "adGroupAd.status").orElse(null);
        String approval = JsonPaths.readString(row, "adGroupAd.policySummary.approvalStatus").orElse(null);
        String review = JsonPaths.readString(row, "adGroupAd.policySummary.reviewStatus").orElse(null);

        Map<String, Object> details = new LinkedHashMap<>();
        if (approval != null) details.put("approvalStatus", approval);
        if (review != null) details.put("reviewStatus", review);
        JsonPaths.readString(row, "campaign.status").ifPresent(s -> details.put("campaignStatus", s));
        JsonPaths.readString(row, "adGroup.status").ifPresent(s -> details.put("adGroupStatus", s));

        String effective = "DISAPPROVED".equals(approval) ? "DISAPPROVED"
                : "REVIEW_IN_PROGRESS".equals(review) && "ENABLED".equals(status) ? "UNDER_REVIEW"
                : status;
        return new PlatformAdState(effective, details);
    }

    // ========================
    // INSIGHTS
    // ========================

    @Override
    protected Map<String, Object> fetchInsights(String adId, List<String> fields, LocalDate since, LocalDate until) {
        List<String> selected = new ArrayList<>();
        for (String field : fields) {
            if (field.startsWith("metrics.")) selected.add(field);
        }
        String query = "SELECT " + String.join(", ", selected) + " FROM ad_group_ad"
                + " WHERE ad_group_ad.resource_name = '" + adId + "'"
                + " AND segments.date BETWEEN '" + since + "' AND '" + until + "'";

        List<Object> results = JsonPaths.readList(search(query), "results");
        Map<String, Object> row = new LinkedHashMap<>();
        for (Object result : results) {
            JsonPaths.readMap(result, "metrics").forEach((name, value) ->
                    toDecimal(value).ifPresent(amount ->
                            row.merge("metrics." + snakeCase(name), amount,
                                    (a, b) -> ((BigDecimal) a).add((BigDecimal) b))));
        }
        toDecimal(row.get("metrics.cost_micros"))
                .ifPresent(micros -> row.put("metrics.cost_micros", BudgetUnits.fromMicros(micros)));
        toDecimal(row.get("metrics.average_cpc"))
                .ifPresent(micros -> row.put("metrics.average_cpc", BudgetUnits.fromMicros(micros)));
        return row;
    }

    /** Summed daily rows make ctr meaningless; recompute it from the totals */
    @Override
    protected Optional<BigDecimal> metricValue(String metric, Map<String, Object> row) {
        if ("ctr".equals(metric)) {
            Optional<BigDecimal> impressions = toDecimal(row.get("metrics.impressions"));
            Optional<BigDecimal> clicks = toDecimal(row.get("metrics.clicks"));
            if (impressions.isPresent() && clicks.isPresent() && impressions.get().signum() > 0) {
                return Optional.of(clicks.get().divide(impressions.get(), 6, RoundingMode.HALF_UP));
            }
            return Optional.empty();
        }
        return super.metricValue(metric, row);
    }

    // ========================
    // PAYLOADS
    // ========================

    /** Geo criteria for known markets plus gender exclusions; null when nothing applies */
    Object campaignCriteria(String campaign, TargetAudience audience) {
        List<Map<String, Object>> operations = new ArrayList<>();
        for (String location : audience.locationsOrDefault("CO")) {
            String constant = GEO_TARGETS.get(location.toUpperCase(Locale.ROOT));
            if (constant == null) {
                log.warn("No Google geo target constant for location '{}', skipping", location);
                continue;
            }
            Map<String, Object> criterion = new LinkedHashMap<>();
            criterion.put("campaign", campaign);
            criterion.put("location", Map.of("geoTargetConstant", constant));
            operations.add(Map.of("create", criterion));
        }
        if (!audience.targetsAllGenders()) {
            String excluded = audience.getGenders().contains(Gender.MALE) ? "FEMALE" : "MALE";
            Map<String, Object> criterion = new LinkedHashMap<>();
            criterion.put("campaign", campaign);
            criterion.put("negative", true);
            criterion.put("gender", Map.of("type", excluded));
            operations.add(Map.of("create", criterion));
        }
        return operations.isEmpty() ? null : Map.of("operations", operations);
    }

    /** Broad-match keywords from interests and job titles; null when there are none */
    Object keywords(String adGroup, TargetAudience audience) {
        Set<String> terms = new LinkedHashSet<>(audience.interestsOrEmpty());
        if (audience.getJobTitles() != null) {
            terms.addAll(audience.getJobTitles());
        }
        if (terms.isEmpty()) {
            return null;
        }
        List<Map<String, Object>> operations = new ArrayList<>();
        for (String term : terms) {
            Map<String, Object> criterion = new LinkedHashMap<>();
            criterion.put("adGroup", adGroup);
            criterion.put("status", "ENABLED");
            criterion.put("keyword", Map.of("text", term, "matchType", "BROAD"));
            operations.add(Map.of("create", criterion));
        }
        return Map.of("operations", operations);
    }

    private Map<String, Object> responsiveSearchAd(AdContent content) {
        String title = Objects.toString(content.getTitle(), "");
        String description = Objects.toString(content.getDescription(), "");

        List<Map<String, Object>> headlines = new ArrayList<>();
        headlines.add(Map.of("text", truncate(title, HEADLINE_MAX)));
        headlines.add(Map.of("text", truncate(vocabulary.callToAction(content.getCallToAction())
                .replace('_', ' '), HEADLINE_MAX)));
        headlines.add(Map.of("text", truncate(description, HEADLINE_MAX)));

        List<Map<String, Object>> descriptions = new ArrayList<>();
        descriptions.add(Map.of("text", truncate(description, DESCRIPTION_MAX)));
        descriptions.add(Map.of("text", truncate(title, DESCRIPTION_MAX)));

        Map<String, Object> rsa = new LinkedHashMap<>();
        rsa.put("headlines", headlines);
        rsa.put("descriptions", descriptions);

        Map<String, Object> ad = new LinkedHashMap<>();
        ad.put("finalUrls", List.of(content.getLandingUrl()));
        ad.put("responsiveSearchAd", rsa);
        return ad;
    }

    private Map<String, Object> searchOne(String query, String adId) {
        Map<String, Object> row = JsonPaths.readMap(search(query), "results.0");
        if (row.isEmpty()) {
            throw notFound("GOOGLE_NOT_FOUND", "Google Ads has no ad " + adId);
        }
        return row;
    }

    private Map<String, Object> search(String query) {
        return client.post("customers/" + customerId + "/googleAds:search", Map.of("query", query));
    }

    private String mutate(String resource) {
        return "customers/" + customerId + "/" + resource + ":mutate";
    }

    private static Map<String, Object> create(Map<String, Object> resource) {
        return Map.of("operations", List.of(Map.of("create", resource)));
    }

    private static Map<String, Object> update(Map<String, Object> resource, String updateMask) {
        Map<String, Object> operation = new LinkedHashMap<>();
        operation.put("update", resource);
        operation.put("updateMask", updateMask);
        return Map.of("operations", List.of(operation));
    }

    private static Map<String, Object> remove(String resourceName) {
        return Map.of("operations", List.of(Map.of("remove", resourceName)));
    }

    static String snakeCase(String camel) {
        StringBuilder out = new StringBuilder();
        for (char c : camel.toCharArray()) {
            if (Character.isUpperCase(c)) {
                out.append('_').append(Character.toLowerCase(c));
            } else {
                out.append(c);
            }
        }
        return out.toString();
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static String stripDashes(String id) {
        return id == null || id.isBlank() ? null : id.replace("-", "");
    }
}
