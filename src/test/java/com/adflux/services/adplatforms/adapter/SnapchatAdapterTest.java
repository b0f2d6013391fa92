package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.credentials.SnapchatCredentials;
import com.adflux.services.adplatforms.client.PlatformHttpClient;
import com.adflux.services.adplatforms.constants.CampaignStatus;
import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.request.AdCampaignUpdate;
import com.adflux.services.adplatforms.dto.request.AdContent;
import com.adflux.services.adplatforms.dto.request.AgeRange;
import com.adflux.services.adplatforms.dto.request.TargetAudience;
import com.adflux.services.adplatforms.dto.response.ApiResponse;
import com.adflux.services.adplatforms.dto.response.ResponseMeta;
import com.adflux.services.adplatforms.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("SnapchatAdapter")
class SnapchatAdapterTest {

    @Mock
    private PlatformHttpClient client;

    @Mock
    private AuthManager authManager;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));

    private SnapchatCredentials credentials;
    private SnapchatAdapter adapter;

    @BeforeEach
    void setUp() {
        lenient().when(client.getPlatform()).thenReturn(Platform.SNAPCHAT);
        lenient().when(client.lastResponseMeta()).thenReturn(ResponseMeta.builder().requestId("snapchat_1_abcdefg").build());
        lenient().when(authManager.isAuthenticated(Platform.SNAPCHAT)).thenReturn(true);

        credentials = SnapchatCredentials.builder()
                .clientId("snap-client").clientSecret("snap-secret")
                .accessToken("snap-token").refreshToken("snap-refresh")
                .organizationId("org-1").adAccountId("acc-1")
                .build();
        adapter = new SnapchatAdapter(client, authManager, clock, credentials);
    }

    @Test
    @DisplayName("createAd walks campaign, ad squad, creative and ad with wrapped entities")
    @SuppressWarnings("unchecked")
    void createAdRunsAllSteps() {
        when(client.post(eq("adaccounts/acc-1/campaigns"), any())).thenReturn(wrapped("campaigns", "campaign", "sc-c"));
        when(client.post(eq("campaigns/sc-c/adsquads"), any())).thenReturn(wrapped("adsquads", "adsquad", "sc-s"));
        when(client.post(eq("adaccounts/acc-1/creatives"), any())).thenReturn(wrapped("creatives", "creative", "sc-cr"));
        when(client.post(eq("adsquads/sc-s/ads"), any())).thenReturn(wrapped("ads", "ad", "sc-ad"));

        ApiResponse<Map<String, Object>> response = adapter.createAd(campaign());

        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.getData())
                .containsEntry("id", "sc-ad")
                .containsEntry("campaignId", "sc-c")
                .containsEntry("adSquadId", "sc-s")
                .containsEntry("creativeId", "sc-cr")
                .containsEntry("status", CampaignStatus.PENDING.getValue());

        ArgumentCaptor<Object> squad = ArgumentCaptor.forClass(Object.class);
        verify(client).post(eq("campaigns/sc-c/adsquads"), squad.capture());
        Map<String, Object> entity = unwrap(squad.getValue(), "adsquads", "adsquad");
        assertThat(entity)
                .containsEntry("campaign_id", "sc-c")
                .containsEntry("daily_budget_micro", 9_680_000L)
                .containsEntry("status", "PAUSED");
        Map<String, Object> targeting = (Map<String, Object>) entity.get("targeting");
        assertThat(targeting).containsEntry("geos", List.of(Map.of("country_code", "co"), Map.of("country_code", "mx")));

        ArgumentCaptor<Object> ad = ArgumentCaptor.forClass(Object.class);
        verify(client).post(eq("adsquads/sc-s/ads"), ad.capture());
        assertThat(unwrap(ad.getValue(), "ads", "ad"))
                .containsEntry("ad_squad_id", "sc-s")
                .containsEntry("creative_id", "sc-cr")
                .containsEntry("type", "REMOTE_WEBPAGE");
    }

    @Test
    void missingAdAccountIsAConfigurationError() {
        adapter = new SnapchatAdapter(client, authManager, clock, credentials.toBuilder().adAccountId("").build());

        ApiResponse<Map<String, Object>> response = adapter.createAd(campaign());

        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.getError().getCode()).isEqualTo("SNAPCHAT_AD_ACCOUNT_REQUIRED");
        assertThat(response.getError().getType()).isEqualTo(ErrorType.VALIDATION);
        verify(client, never()).post(anyString(), any());
    }

    @Test
    @DisplayName("An empty entity list is reported as not found")
    void unknownAdIsNotFound() {
        when(client.get(eq("ads/missing"), anyMap())).thenReturn(Map.of("request_status", "SUCCESS", "ads", List.of()));

        ApiResponse<Map<String, Object>> response = adapter.getAdStatus("missing");

        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.getError().getCode()).isEqualTo("SNAPCHAT_NOT_FOUND");
        assertThat(response.getError().getType()).isEqualTo(ErrorType.NOT_FOUND);
        assertThat(response.getError().isRetryable()).isFalse();
    }

    @Test
    @DisplayName("A rejected review overrides the delivery status")
    void rejectedReviewIsError() {
        when(client.get(eq("ads/sc-ad"), anyMap())).thenReturn(Map.of("ads", List.of(Map.of("ad", Map.of(
                "id", "sc-ad",
                "ad_squad_id", "sc-s",
                "status", "ACTIVE",
                "review_status", "REJECTED",
                "review_status_reasons", List.of("Landing page unavailable"))))));

        ApiResponse<Map<String, Object>> response = adapter.getAdStatus("sc-ad");

        assertThat(response.getData())
                .containsEntry("status", "error")
                .containsEntry("platformStatus", "REJECTED")
                .containsEntry("reviewStatusReasons", List.of("Landing page unavailable"));
    }

    @Test
    @DisplayName("Status updates PUT the merged ad and campaign entities")
    @SuppressWarnings("unchecked")
    void statusUpdateMergesFullEntities() {
        when(client.get(eq("ads/sc-ad"), anyMap())).thenReturn(Map.of("ads", List.of(Map.of("ad", Map.of(
                "id", "sc-ad", "name", "Backend Engineer", "ad_squad_id", "sc-s", "creative_id", "sc-cr", "status", "PAUSED")))));
        when(client.get(eq("adsquads/sc-s"), anyMap())).thenReturn(Map.of("adsquads", List.of(Map.of("adsquad", Map.of(
                "id", "sc-s", "campaign_id", "sc-c")))));
        when(client.get(eq("campaigns/sc-c"), anyMap())).thenReturn(Map.of("campaigns", List.of(Map.of("campaign", Map.of(
                "id", "sc-c", "name", "Backend Engineer", "status", "PAUSED")))));

        ApiResponse<Map<String, Object>> response = adapter.updateAd("sc-ad",
                AdCampaignUpdate.builder().status(CampaignStatus.ACTIVE).build());

        assertThat(response.isSuccessful()).isTrue();
        assertThat((List<String>) response.getData().get("updatedLevels")).containsExactly("ad", "campaign");

        ArgumentCaptor<Object> ad = ArgumentCaptor.forClass(Object.class);
        verify(client).put(eq("adsquads/sc-s/ads"), ad.capture());
        assertThat(unwrap(ad.getValue(), "ads", "ad"))
                .containsEntry("status", "ACTIVE")
                .containsEntry("creative_id", "sc-cr")
                .containsEntry("name", "Backend Engineer");

        ArgumentCaptor<Object> campaign = ArgumentCaptor.forClass(Object.class);
        verify(client).put(eq("adaccounts/acc-1/campaigns"), campaign.capture());
        assertThat(unwrap(campaign.getValue(), "campaigns", "campaign"))
                .containsEntry("id", "sc-c")
                .containsEntry("status", "ACTIVE");
    }

    @Test
    @SuppressWarnings("unchecked")
    void performanceConvertsMicroSpend() {
        when(client.get(eq("ads/sc-ad/stats"), anyMap())).thenReturn(Map.of("total_stats", List.of(Map.of(
                "total_stat", Map.of("id", "sc-ad", "stats", Map.of(
                        "impressions", 5000,
                        "swipes", 100,
                        "spend", 30_000_000,
                        "conversion_sign_ups", 6))))));

        ApiResponse<Map<String, Object>> response = adapter.getAdPerformance("sc-ad", List.of("impressions", "clicks", "spend"));

        Map<String, Object> metrics = (Map<String, Object>) response.getData().get("metrics");
        assertThat((BigDecimal) metrics.get("clicks")).isEqualByComparingTo("100");
        assertThat((BigDecimal) metrics.get("spend")).isEqualByComparingTo("30");
        assertThat((BigDecimal) metrics.get("costPerClick")).isEqualByComparingTo("0.30");
        assertThat((BigDecimal) metrics.get("costPerConversion")).isEqualByComparingTo("5.00");

        ArgumentCaptor<Map<String, String>> query = ArgumentCaptor.forClass(Map.class);
        verify(client).get(eq("ads/sc-ad/stats"), query.capture());
        assertThat(query.getValue())
                .containsEntry("granularity", "TOTAL")
                .containsEntry("start_time", "2026-02-23T00:00:00Z")
                .containsEntry("end_time", "2026-03-03T00:00:00Z");
        assertThat(query.getValue().get("fields")).contains("swipes").contains("spend");
    }

    private static Map<String, Object> wrapped(String collection, String key, String id) {
        return Map.of("request_status", "SUCCESS", collection, List.of(Map.of(key, Map.of("id", id))));
    }

    private static Map<String, Object> unwrap(Object body, String collection, String key) {
        return JsonPaths.readMap(body, collection + ".0." + key);
    }

    private static AdCampaign campaign() {
        return AdCampaign.builder()
                .name("Backend Engineer")
                .startDate(LocalDate.of(2026, 3, 10))
                .endDate(LocalDate.of(2026, 4, 9))
                .budget(new BigDecimal("300.00"))
                .content(AdContent.builder()
                        .title("Backend Engineer")
                        .description("Java and Spring, remote friendly")
                        .callToAction("apply_now")
                        .landingUrl("https://jobs.example.com/backend-engineer")
                        .imageUrl("https://cdn.example.com/backend.png")
                        .build())
                .targetAudience(TargetAudience.builder()
                        .locations(List.of("CO", "MX"))
                        .ageRange(new AgeRange(25, 45))
                        .build())
                .platform(Platform.SNAPCHAT)
                .build();
    }
}
