package com.adflux.services.adplatforms.middleware;

import com.adflux.services.adplatforms.constants.ErrorType;
import com.adflux.services.adplatforms.constants.Platform;
import com.adflux.services.adplatforms.constants.PlatformEventType;
import com.adflux.services.adplatforms.dto.response.ApiErrorDetail;
import com.adflux.services.adplatforms.event.PlatformEventPublisher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("MiddlewarePipeline")
class MiddlewarePipelineTest {

    @Mock
    private PlatformEventPublisher eventPublisher;

    private final RequestContext request = RequestContext.builder()
            .platform(Platform.META)
            .method("POST")
            .endpoint("act_1/campaigns")
            .requestId("meta_1_abc")
            .build();

    @Test
    void requestMiddlewareRunsInRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(
                r -> {
                    calls.add("first");
                    return r.toBuilder().header("X-Trace", "1").build();
                },
                r -> {
                    calls.add("second");
                    return r.toBuilder().header("X-Tenant", "acme").build();
                }), List.of(), List.of());

        RequestContext processed = pipeline.processRequest(request);

        assertThat(calls).containsExactly("first", "second");
        assertThat(processed.getHeaders()).containsEntry("X-Trace", "1").containsEntry("X-Tenant", "acme");
    }

    @Test
    void runtimeMiddlewareIsAppended() {
        MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(), List.of(), List.of());
        pipeline.addResponseMiddleware((req, response) -> response.toBuilder().statusCode(299).build());

        ResponseContext processed = pipeline.processResponse(request,
                ResponseContext.builder().statusCode(200).build());

        assertThat(processed.getStatusCode()).isEqualTo(299);
    }

    @Test
    @DisplayName("A middleware returning null marks the error handled and stops the chain")
    void handledErrorStopsTheChain() {
        List<String> calls = new ArrayList<>();
        MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(), List.of(), List.of(
                (req, error) -> {
                    calls.add("handler");
                    return null;
                },
                (req, error) -> {
                    calls.add("never");
                    return error;
                }));

        ErrorContext result = pipeline.processError(request, error(ErrorType.NETWORK, 0));

        assertThat(result).isNull();
        assertThat(calls).containsExactly("handler");
    }

    @Test
    void networkRetryMiddlewareHandlesUntilCeiling() {
        NetworkRetryMiddleware middleware = new NetworkRetryMiddleware();

        assertThat(middleware.onError(request, error(ErrorType.NETWORK, 0))).isNull();
        assertThat(middleware.onError(request, error(ErrorType.TIMEOUT, 2))).isNull();
        assertThat(middleware.onError(request, error(ErrorType.NETWORK, 3))).isNotNull();
        assertThat(middleware.onError(request, error(ErrorType.VALIDATION, 0))).isNotNull();
    }

    @Test
    @DisplayName("Rate-limit middleware rewrites the message and emits an event")
    void rateLimitMiddlewareEnrichesMessage() {
        RateLimitErrorMiddleware middleware = new RateLimitErrorMiddleware(eventPublisher);

        ErrorContext result = middleware.onError(request, error(ErrorType.RATE_LIMIT, 1));

        assertThat(result.getMessage()).startsWith("Rate limit reached on Meta");
        assertThat(result.resolvedDetail().getCode()).isEqualTo("META_4");
        assertThat(result.resolvedDetail().getMessage()).isEqualTo(result.getMessage());
        verify(eventPublisher).publish(eq(PlatformEventType.RATE_LIMIT), eq(Platform.META),
                eq("meta_1_abc"), anyLong(), any());
    }

    @Test
    void authMiddlewareIgnoresOtherErrors() {
        AuthErrorMiddleware middleware = new AuthErrorMiddleware(eventPublisher);
        ErrorContext error = error(ErrorType.SERVER, 0);

        ErrorContext result = middleware.onError(request, error);

        assertThat(result).isSameAs(error);
        assertThat(result.resolvedDetail()).isSameAs(error.getDetail());
    }

    private static ErrorContext error(ErrorType type, int retryCount) {
        ApiErrorDetail detail = ApiErrorDetail.of("META_4", "Application request limit reached", Platform.META, type);
        return ErrorContext.builder()
                .detail(detail)
                .durationMs(12)
                .retryCount(retryCount)
                .message(detail.getMessage())
                .build();
    }
}
