package com.adflux.services.adplatforms.adapter;

import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.credentials.GoogleCredentials;
import com.adflux.services.adplatforms.client.PlatformHttpClient;
import com.adflux.services.adplatforms.client.RequestSigner;
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
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;

import java.math.BigDecimal;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("GoogleAdsAdapter")
class GoogleAdsAdapterTest {

    private static final String CUSTOMER = "customers/1234567890/";
    private static final String SEARCH = CUSTOMER + "googleAds:search";
    private static final String AD = CUSTOMER + "adGroupAds/3~4";

    @Mock
    private PlatformHttpClient client;

    @Mock
    private AuthManager authManager;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));

    private GoogleCredentials credentials;
    private GoogleAdsAdapter adapter;

    @BeforeEach
    void setUp() {
        lenient().when(client.getPlatform()).thenReturn(Platform.GOOGLE);
        lenient().when(client.lastResponseMeta()).thenReturn(ResponseMeta.builder().requestId("google_1_abcdefg").build());
        lenient().when(authManager.isAuthenticated(Platform.GOOGLE)).thenReturn(true);

        credentials = GoogleCredentials.builder()
                .clientId("client").clientSecret("secret").refreshToken("refresh")
                .developerToken("dev-token")
                .customerId("123-456-7890").managerId("111-222-3333")
                .build();
        adapter = new GoogleAdsAdapter(client, authManager, clock, credentials);
    }

    @Test
    @DisplayName("createAd mutates budget, campaign, criteria, ad group and ad, skipping empty keywords")
    @SuppressWarnings("unchecked")
    void createAdRunsAllSteps() {
        when(client.post(eq(CUSTOMER + "campaignBudgets:mutate"), any())).thenReturn(resource(CUSTOMER + "campaignBudgets/1"));
        when(client.post(eq(CUSTOMER + "campaigns:mutate"), any())).thenReturn(resource(CUSTOMER + "campaigns/2"));
        when(client.post(eq(CUSTOMER + "campaignCriteria:mutate"), any())).thenReturn(resource(CUSTOMER + "campaignCriteria/2~2170"));
        when(client.post(eq(CUSTOMER + "adGroups:mutate"), any())).thenReturn(resource(CUSTOMER + "adGroups/3"));
        when(client.post(eq(CUSTOMER + "adGroupAds:mutate"), any())).thenReturn(resource(AD));

        ApiResponse<Map<String, Object>> response = adapter.createAd(campaign());

        assertThat(response.isSuccessful()).isTrue();
        assertThat(response.getData())
                .containsEntry("id", AD)
                .containsEntry("budgetId", CUSTOMER + "campaignBudgets/1")
                .containsEntry("campaignId", CUSTOMER + "campaigns/2")
                .containsEntry("adGroupId", CUSTOMER + "adGroups/3")
                .doesNotContainKey("keywordsId");
        verify(client, never()).post(eq(CUSTOMER + "adGroupCriteria:mutate"), any());

        ArgumentCaptor<Object> budget = ArgumentCaptor.forClass(Object.class);
        verify(client).post(eq(CUSTOMER + "campaignBudgets:mutate"), budget.capture());
        assertThat(JsonPaths.readMap(budget.getValue(), "operations.0.create"))
                .containsEntry("amountMicros", "9680000")
                .containsEntry("deliveryMethod", "STANDARD");

        ArgumentCaptor<Object> criteria = ArgumentCaptor.forClass(Object.class);
        verify(client).post(eq(CUSTOMER + "campaignCriteria:mutate"), criteria.capture());
        List<Object> operations = JsonPaths.readList(criteria.getValue(), "operations");
        assertThat(operations).hasSize(3);
        assertThat(JsonPaths.readString(operations.get(1), "create.location.geoTargetConstant")).contains("geoTargetConstants/2484");
        assertThat(JsonPaths.readMap(operations.get(2), "create"))
                .containsEntry("negative", true)
                .containsEntry("gender", Map.of("type", "MALE"));
    }

    @Test
    @DisplayName("Every request carries the developer token and the manager account")
    void signerAddsGoogleHeaders() {
        when(authManager.requireToken(Platform.GOOGLE)).thenReturn("ya29.token");
        ArgumentCaptor<RequestSigner> signer = ArgumentCaptor.forClass(RequestSigner.class);
        verify(client).setSigner(signer.capture());

        Map<String, String> headers = signer.getValue().sign(HttpMethod.POST, URI.create("https://googleads.test/v16/" + SEARCH));

        assertThat(headers)
                .containsEntry(HttpHeaders.AUTHORIZATION, "Bearer ya29.token")
                .containsEntry("developer-token", "dev-token")
                .containsEntry("login-customer-id", "1112223333");
    }

    @Test
    void missingCustomerIsAConfigurationError() {
        adapter = new GoogleAdsAdapter(client, authManager, clock, credentials.toBuilder().customerId(null).build());

        ApiResponse<Map<String, Object>> response = adapter.createAd(campaign());

        assertThat(response.getError().getCode()).isEqualTo("GOOGLE_CUSTOMER_REQUIRED");
        assertThat(response.getError().getType()).isEqualTo(ErrorType.VALIDATION);
        verify(client, never()).post(anyString(), any());
    }

    @Test
    void unknownAdIsNotFound() {
        when(client.post(eq(SEARCH), any())).thenReturn(Map.of("results", List.of()));

        ApiResponse<Map<String, Object>> response = adapter.getAdStatus(AD);

        assertThat(response.getError().getCode()).isEqualTo("GOOGLE_NOT_FOUND");
        assertThat(response.getError().getType()).isEqualTo(ErrorType.NOT_FOUND);
    }

    @Test
    @DisplayName("An enabled ad still in policy review is pending")
    void reviewInProgressIsPending() {
        when(client.post(eq(SEARCH), any())).thenReturn(Map.of("results", List.of(Map.of(
                "adGroupAd", Map.of(
                        "resourceName", AD,
                        "status", "ENABLED",
                        "policySummary", Map.of("approvalStatus", "UNKNOWN", "reviewStatus", "REVIEW_IN_PROGRESS")),
                "campaign", Map.of("status", "ENABLED"),
                "adGroup", Map.of("status", "ENABLED")))));

        ApiResponse<Map<String, Object>> response = adapter.getAdStatus(AD);

        assertThat(response.getData())
                .containsEntry("status", "pending")
                .containsEntry("platformStatus", "UNDER_REVIEW")
                .containsEntry("reviewStatus", "REVIEW_IN_PROGRESS")
                .containsEntry("campaignStatus", "ENABLED");
    }

    @Test
    void deleteRemovesTheAdGroupAd() {
        when(client.post(eq(CUSTOMER + "adGroupAds:mutate"), any())).thenReturn(resource(AD));

        ApiResponse<Map<String, Object>> response = adapter.deleteAd(AD);

        assertThat(response.getData()).containsEntry("platformStatus", "REMOVED");
        verify(client).post(CUSTOMER + "adGroupAds:mutate", Map.of("operations", List.of(Map.of("remove", AD))));
    }

    @Test
    @DisplayName("Daily rows are summed, micros converted and ctr recomputed from the totals")
    @SuppressWarnings("unchecked")
    void performanceSumsDailyRows() {
        when(client.post(eq(SEARCH), any())).thenReturn(Map.of("results", List.of(
                Map.of("metrics", Map.of("impressions", "1000", "clicks", "20", "costMicros", "10000000", "ctr", 0.02)),
                Map.of("metrics", Map.of("impressions", "1000", "clicks", "30", "costMicros", "15000000",
                        "ctr", 0.03, "conversions", 5.0)))));

        ApiResponse<Map<String, Object>> response = adapter.getAdPerformance(AD, List.of("impressions", "ctr", "spend"));

        Map<String, Object> metrics = (Map<String, Object>) response.getData().get("metrics");
        assertThat((BigDecimal) metrics.get("impressions")).isEqualByComparingTo("2000");
        assertThat((BigDecimal) metrics.get("ctr")).isEqualByComparingTo("0.025");
        assertThat((BigDecimal) metrics.get("spend")).isEqualByComparingTo("25");
        assertThat((BigDecimal) metrics.get("costPerClick")).isEqualByComparingTo("0.50");
        assertThat((BigDecimal) metrics.get("costPerConversion")).isEqualByComparingTo("5.00");

        ArgumentCaptor<Object> search = ArgumentCaptor.forClass(Object.class);
        verify(client).post(eq(SEARCH), search.capture());
        assertThat(JsonPaths.readString(search.getValue(), "query").orElseThrow())
                .contains("metrics.cost_micros")
                .contains("segments.date BETWEEN '2026-02-23' AND '2026-03-02'");
    }

    private static Map<String, Object> resource(String name) {
        return Map.of("results", List.of(Map.of("resourceName", name)));
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
                .platform(Platform.GOOGLE)
                .build();
    }
}
