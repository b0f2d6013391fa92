package com.adflux.services.adplatforms.service;

import com.adflux.services.adplatforms.adapter.PlatformAdapter;
import com.adflux.services.adplatforms.adapter.PlatformAdapterFactory;
import com.adflux.services.adplatforms.auth.AuthManager;
import com.adflux.services.adplatforms.auth.AuthResult;
import com.adflux.services.adplatforms.auth.credentials.MetaCredentials;
import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.auth.credentials.XCredentials;
import com.adflux.services.adplatforms.config.AdPlatformsProperties;
import com.adflux.services.adplatforms.constants.AdPlatformConstants;
import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.constants.PlatformEventType;
import com.adflux.services.adplatforms.dto.request.AdCampaign;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.adflux.services.adplatforms.dto.response.ApiResponse;
import com.adflux.services.adplatforms.event.PlatformEventPublisher;
import com.adflux.services.adplatforms.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("AdPlatformService")
class AdPlatformServiceTest {

    @Mock
    private PlatformAdapterFactory adapterFactory;

    @Mock
    private AuthManager authManager;

    @Mock
    private PlatformEventPublisher eventPublisher;

    @Mock
    private PlatformAdapter metaAdapter;

    @Mock
    private PlatformAdapter xAdapter;

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
    private final Executor directExecutor = Runnable::run;

    private AdPlatformService service;

    @BeforeEach
    void setUp() {
        service = new AdPlatformService(adapterFactory, authManager, eventPublisher, directExecutor, clock,
                new AdPlatformsProperties());
    }

    @Test
    void registerAdapterRemembersCredentials() {
        MetaCredentials credentials = metaCredentials();
        when(adapterFactory.create(eq(credentials), any(AdPlatformsProperties.ClientOverrides.class)))
                .thenReturn(metaAdapter);

        service.registerAdapter(credentials, new AdPlatformsProperties.ClientOverrides());

        verify(authManager).registerCredentials(credentials);
        assertThat(service.isRegistered(Platform.META)).isTrue();
        assertThat(service.getRegisteredPlatforms()).containsExactly(Platform.META);
        assertThat(service.getAdapter(Platform.META)).contains(metaAdapter);
    }

    @Test
    @DisplayName("Operations on an unregistered platform answer PLATFORM_NOT_INITIALIZED")
    void unregisteredPlatformIsReported() {
        ApiResponse<Map<String, Object>> response = service.getAdStatus(Platform.TIKTOK, "ad-1");

        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.getError().getCode()).isEqualTo(AdPlatformConstants.ERROR_NOT_INITIALIZED);
        assertThat(response.getError().getPlatform()).isEqualTo(Platform.TIKTOK);
    }

    @Test
    void createAdWithoutPlatformIsInvalid() {
        ApiResponse<Map<String, Object>> response = service.createAd(campaign().toBuilder().platform(null).build());

        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.getError().getCode()).isEqualTo(AdPlatformConstants.ERROR_INVALID_CAMPAIGN);
    }

    @Test
    @SuppressWarnings("unchecked")
    void successfulCreatePublishesEvent() {
        register(metaCredentials(), metaAdapter);
        when(metaAdapter.createAd(any(AdCampaign.class)))
                .thenReturn(ApiResponse.success(Map.of("id", "ad-1"), "Ad created on Meta"));

        ApiResponse<Map<String, Object>> response = service.createAd(campaign());

        assertThat(response.isSuccessful()).isTrue();
        ArgumentCaptor<Map<String, Object>> payload = ArgumentCaptor.forClass(Map.class);
        verify(eventPublisher).publish(eq(PlatformEventType.AD_CREATED), eq(Platform.META), isNull(),
                any(Long.class), payload.capture());
        assertThat(payload.getValue()).containsEntry("id", "ad-1").containsEntry("campaignName", "Backend Engineer");
    }

    @Test
    void adapterExceptionsBecomeErrorResponses() {
        register(metaCredentials(), metaAdapter);
        when(metaAdapter.deleteAd("ad-1")).thenThrow(new IllegalStateException("boom"));

        ApiResponse<Map<String, Object>> response = service.deleteAd(Platform.META, "ad-1");

        assertThat(response.isSuccessful()).isFalse();
        assertThat(response.getError().getCode()).isEqualTo(AdPlatformConstants.ERROR_API);
        assertThat(response.getError().getMessage()).isEqualTo("boom");
        verify(eventPublisher, never()).publish(eq(PlatformEventType.AD_DELETED), any(), any());
    }

    @Test
    @DisplayName("One platform failing leaves the others untouched")
    void multiPlatformIsolatesFailures() {
        register(metaCredentials(), metaAdapter);
        register(xCredentials(), xAdapter);
        when(metaAdapter.createAd(any(AdCampaign.class)))
                .thenReturn(ApiResponse.success(Map.of("id", "ad-1"), "Ad created on Meta"));
        when(xAdapter.createAd(any(AdCampaign.class))).thenThrow(new IllegalStateException("x exploded"));

        Map<Platform, ApiResponse<Map<String, Object>>> results = service.createMultiPlatformAd(campaign(),
                List.of(Platform.META, Platform.X, Platform.SNAPCHAT));

        assertThat(results).containsOnlyKeys(Platform.META, Platform.X, Platform.SNAPCHAT);
        assertThat(results.get(Platform.META).isSuccessful()).isTrue();
        assertThat(results.get(Platform.X).isSuccessful()).isFalse();
        assertThat(results.get(Platform.X).getError().getCode()).isEqualTo(AdPlatformConstants.ERROR_API);
        assertThat(results.get(Platform.SNAPCHAT).getError().getCode())
                .isEqualTo(AdPlatformConstants.ERROR_NOT_INITIALIZED);
    }

    @Test
    void multiPlatformSendsEachAdapterItsOwnCopy() {
        register(metaCredentials(), metaAdapter);
        register(xCredentials(), xAdapter);
        when(metaAdapter.createAd(any(AdCampaign.class))).thenReturn(ApiResponse.success(Map.of("id", "m"), "ok"));
        when(xAdapter.createAd(any(AdCampaign.class))).thenReturn(ApiResponse.success(Map.of("id", "x"), "ok"));

        service.createMultiPlatformAd(campaign(), List.of(Platform.META, Platform.X));

        ArgumentCaptor<AdCampaign> metaCampaign = ArgumentCaptor.forClass(AdCampaign.class);
        ArgumentCaptor<AdCampaign> xCampaign = ArgumentCaptor.forClass(AdCampaign.class);
        verify(metaAdapter).createAd(metaCampaign.capture());
        verify(xAdapter).createAd(xCampaign.capture());
        assertThat(metaCampaign.getValue().getPlatform()).isEqualTo(Platform.META);
        assertThat(xCampaign.getValue().getPlatform()).isEqualTo(Platform.X);
    }

    @Test
    @DisplayName("A platform that never answers is reported as a timeout")
    void slowPlatformTimesOut() {
        AdPlatformsProperties properties = new AdPlatformsProperties();
        properties.getFanOut().setTimeout(Duration.ofMillis(50));
        Executor neverRuns = task -> { };
        AdPlatformService slowService = new AdPlatformService(adapterFactory, authManager, eventPublisher,
                neverRuns, clock, properties);

        Map<Platform, ApiResponse<Map<String, Object>>> results = slowService.getMultiPlatformPerformance(
                Map.of(Platform.GOOGLE, "customers/1/adGroupAds/2~3"), null);

        ApiErrorDetail error = results.get(Platform.GOOGLE).getError();
        assertThat(error.getCode()).isEqualTo(AdPlatformConstants.ERROR_TIMEOUT);
        assertThat(error.getType()).isEqualTo(ErrorType.TIMEOUT);
    }

    @Test
    @DisplayName("A saturated fan-out pool is reported per platform instead of thrown")
    void rejectedSubmissionBecomesPlatformError() {
        Executor saturated = task -> {
            throw new RejectedExecutionException("pool saturated");
        };
        AdPlatformService busyService = new AdPlatformService(adapterFactory, authManager, eventPublisher,
                saturated, clock, new AdPlatformsProperties());

        Map<Platform, ApiResponse<Map<String, Object>>> results = busyService.createMultiPlatformAd(campaign(),
                List.of(Platform.META, Platform.X));

        assertThat(results).containsOnlyKeys(Platform.META, Platform.X);
        assertThat(results.values()).allSatisfy(response -> {
            assertThat(response.isSuccessful()).isFalse();
            assertThat(response.getError().getCode()).isEqualTo(AdPlatformConstants.ERROR_API);
            assertThat(response.getError().getType()).isEqualTo(ErrorType.SERVER);
            assertThat(response.getError().getMessage()).contains("saturated");
        });
    }

    @Test
    void refreshFailureIsReturnedAsError() {
        when(authManager.refresh(Platform.X)).thenReturn(AuthResult.failure(ApiErrorDetail.of(
                AdPlatformConstants.ERROR_REFRESH_NOT_SUPPORTED, "no refresh", Platform.X, ErrorType.AUTH)));

        assertThat(service.refreshAuth(Platform.X).getError().getCode())
                .isEqualTo(AdPlatformConstants.ERROR_REFRESH_NOT_SUPPORTED);
    }

    private void register(PlatformCredentials credentials, PlatformAdapter adapter) {
        when(adapterFactory.create(eq(credentials), any(AdPlatformsProperties.ClientOverrides.class)))
                .thenReturn(adapter);
        service.registerAdapter(credentials, new AdPlatformsProperties.ClientOverrides());
    }

    private static MetaCredentials metaCredentials() {
        return MetaCredentials.builder().appId("app").appSecret("secret").accessToken("token").build();
    }

    private static XCredentials xCredentials() {
        return XCredentials.builder().consumerKey("ck").consumerSecret("cs")
                .accessToken("at").accessTokenSecret("ats").accountId("acc").build();
    }

    private static AdCampaign campaign() {
        return AdCampaign.builder()
                .name("Backend Engineer")
                .startDate(LocalDate.of(2026, 3, 10))
                .endDate(LocalDate.of(2026, 4, 9))
                .budget(new BigDecimal("300.00"))
                .platform(Platform.META)
                .build();
    }
}
