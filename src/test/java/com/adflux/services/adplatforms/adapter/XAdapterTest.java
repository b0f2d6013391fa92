package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.credentials.XCredentials;
import com.adflux.services.adplatforms.client.PlatformHttpClient;
import com.adflux.services.adplatforms.constants.CampaignStatus;
import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Gender;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
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
@DisplayName("XAdapter")
class XAdapterTest {

    private static final String ACCOUNT = "accounts/18ce54d4x5t/";

    @Mock
    private PlatformHttpClient client;

    @Mock
    private AuthManager authManager;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));

    private XCredentials credentials;
    private XAdapter adapter;

    @BeforeEach
    void setUp() {
        lenient().when(client.getPlatform()).thenReturn(Platform.X);
        lenient().when(client.lastResponseMeta()).thenReturn(ResponseMeta.builder().requestId("x_1_abcdefg").build());
        lenient().when(authManager.isAuthenticated(Platform.X)).thenReturn(true);

        credentials = XCredentials.builder()
                .consumerKey("ck").consumerSecret("cs")
                .accessToken("at").accessTokenSecret("ats")
                .accountId("18ce54d4x5t").fundingInstrumentId("fi-1")
                .build();
        adapter = new XAdapter(client, authManager, clock, credentials);
    }

    @Test
    @DisplayName("createAd walks campaign, line item, targeting, tweet and promoted tweet")
    @SuppressWarnings("unchecked")
    void createAdRunsAllSteps() {
        when(client.post(eq(ACCOUNT + "campaigns"), any())).thenReturn(Map.of("data", Map.of("id", "c-1")));
        when(client.post(eq(ACCOUNT + "line_items"), any())).thenReturn(Map.of("data", Map.of("id", "li-1")));
        when(client.post(eq("batch/" + ACCOUNT + "targeting_criteria"), any()))
                .thenReturn(Map.of("data", List.of(Map.of("id", "tc-1"))));
        when(client.post(eq(ACCOUNT + "tweet"), any())).thenReturn(Map.of("data", Map.of("id_str", "tw-1")));
        when(client.post(eq(ACCOUNT + "promoted_tweets"), any()))
                .thenReturn(Map.of("data", List.of(Map.of("id", "ad-1"))));

        ApiResponse<Map<String, Object>> response = adapter.createAd(campaign());

        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.getData())
                .containsEntry("id", "ad-1")
                .containsEntry("campaignId", "c-1")
                .containsEntry("lineItemId", "li-1")
                .containsEntry("targetingCriteriaId", "tc-1")
                .containsEntry("tweetId", "tw-1")
                .containsEntry("status", CampaignStatus.PENDING.getValue())
                .containsEntry("platform", "x");

        ArgumentCaptor<Object> campaignBody = ArgumentCaptor.forClass(Object.class);
        verify(client).post(eq(ACCOUNT + "campaigns"), campaignBody.capture());
        assertThat((Map<String, Object>) campaignBody.getValue())
                .containsEntry("funding_instrument_id", "fi-1")
                .containsEntry("total_budget_amount_local_micro", 300_000_000L)
                .containsEntry("entity_status", "DRAFT");

        ArgumentCaptor<Object> targeting = ArgumentCaptor.forClass(Object.class);
        verify(client).post(eq("batch/" + ACCOUNT + "targeting_criteria"), targeting.capture());
        List<Map<String, Object>> operations = (List<Map<String, Object>>) targeting.getValue();
        assertThat(operations).hasSize(4);
        assertThat(operations).allSatisfy(operation -> {
            assertThat(operation).containsEntry("operation_type", "Create");
            assertThat((Map<String, Object>) operation.get("params")).containsEntry("line_item_id", "li-1");
        });
        assertThat((Map<String, Object>) operations.get(3).get("params"))
                .containsEntry("targeting_type", "AGE")
                .containsEntry("targeting_value", "AGE_25_TO_45");

        ArgumentCaptor<Object> promoted = ArgumentCaptor.forClass(Object.class);
        verify(client).post(eq(ACCOUNT + "promoted_tweets"), promoted.capture());
        assertThat((Map<String, Object>) promoted.getValue())
                .containsEntry("line_item_id", "li-1")
                .containsEntry("tweet_ids", List.of("tw-1"));
    }

    @Test
    void missingFundingInstrumentIsAConfigurationError() {
        adapter = new XAdapter(client, authManager, clock, credentials.toBuilder().fundingInstrumentId(" ").build());

        ApiResponse<Map<String, Object>> response = adapter.createAd(campaign());

        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.getError().getCode()).isEqualTo("X_FUNDING_INSTRUMENT_REQUIRED");
        assertThat(response.getError().getType()).isEqualTo(ErrorType.VALIDATION);
        assertThat(response.getError().isRetryable()).isFalse();
        verify(client, never()).post(anyString(), any());
    }

    @Test
    @DisplayName("Promoted tweets are deleted outright")
    void deleteRemovesThePromotedTweet() {
        when(client.delete(ACCOUNT + "promoted_tweets/ad-1"))
                .thenReturn(Map.of("data", Map.of("id", "ad-1", "line_item_id", "li-1", "deleted", true)));

        ApiResponse<Map<String, Object>> response = adapter.deleteAd("ad-1");

        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.getData())
                .containsEntry("deleted", true)
                .containsEntry("lineItemId", "li-1")
                .containsEntry("platformStatus", "DELETED");
        verify(client, never()).put(anyString(), any());
    }

    @Test
    @DisplayName("Approval status takes precedence over the entity status")
    void underReviewIsPending() {
        when(client.get(eq(ACCOUNT + "promoted_tweets/ad-1"), anyMap())).thenReturn(Map.of("data", Map.of(
                "id", "ad-1",
                "line_item_id", "li-1",
                "tweet_id", "tw-1",
                "entity_status", "ACTIVE",
                "approval_status", "UNDER_REVIEW",
                "deleted", false)));

        ApiResponse<Map<String, Object>> response = adapter.getAdStatus("ad-1");

        assertThat(response.getData())
                .containsEntry("status", "pending")
                .containsEntry("platformStatus", "UNDER_REVIEW")
                .containsEntry("lineItemId", "li-1")
                .containsEntry("approvalStatus", "UNDER_REVIEW");
    }

    @Test
    void deletedFlagReportsCompleted() {
        when(client.get(eq(ACCOUNT + "promoted_tweets/ad-1"), anyMap())).thenReturn(Map.of("data", Map.of(
                "id", "ad-1",
                "entity_status", "PAUSED",
                "approval_status", "ACCEPTED",
                "deleted", true)));

        ApiResponse<Map<String, Object>> response = adapter.getAdStatus("ad-1");

        assertThat(response.getData())
                .containsEntry("status", "completed")
                .containsEntry("platformStatus", "DELETED");
    }

    @Test
    @DisplayName("Stats use a seven day window, micros spend and a derived ctr")
    @SuppressWarnings("unchecked")
    void performanceConvertsMicrosAndDerivesCtr() {
        when(client.get(eq("stats/accounts/18ce54d4x5t"), anyMap())).thenReturn(Map.of("data", List.of(Map.of(
                "id", "ad-1",
                "id_data", List.of(Map.of("metrics", Map.of(
                        "impressions", List.of(2000),
                        "clicks", List.of(50),
                        "billed_charge_local_micro", List.of(25_000_000),
                        "conversion_site_visits", List.of(5))))))));

        ApiResponse<Map<String, Object>> response = adapter.getAdPerformance("ad-1", List.of("impressions", "ctr", "spend"));

        assertThat(response.isSuccessful()).isTrue();
        Map<String, Object> metrics = (Map<String, Object>) response.getData().get("metrics");
        assertThat((BigDecimal) metrics.get("impressions")).isEqualByComparingTo("2000");
        assertThat((BigDecimal) metrics.get("ctr")).isEqualByComparingTo("2.5");
        assertThat((BigDecimal) metrics.get("spend")).isEqualByComparingTo("25");
        assertThat((BigDecimal) metrics.get("costPerClick")).isEqualByComparingTo("0.50");
        assertThat((BigDecimal) metrics.get("costPerConversion")).isEqualByComparingTo("5.00");

        Map<String, Object> period = (Map<String, Object>) response.getData().get("period");
        assertThat(period).containsEntry("from", "2026-02-23").containsEntry("to", "2026-03-02");

        ArgumentCaptor<Map<String, String>> query = ArgumentCaptor.forClass(Map.class);
        verify(client).get(eq("stats/accounts/18ce54d4x5t"), query.capture());
        assertThat(query.getValue())
                .containsEntry("entity", "PROMOTED_TWEET")
                .containsEntry("entity_ids", "ad-1")
                .containsEntry("granularity", "TOTAL");
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
                        .build())
                .targetAudience(TargetAudience.builder()
                        .locations(List.of("CO", "MX"))
                        .ageRange(new AgeRange(25, 45))
                        .genders(List.of(Gender.FEMALE))
                        .build())
                .platform(Platform.X)
                .build();
    }
}
