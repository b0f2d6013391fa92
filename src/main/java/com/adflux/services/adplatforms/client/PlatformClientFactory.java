package com.adflux.services.adplatforms.client;

import com.adflux.services.adplatforms.classifier.ErrorClassifier;
import com.adflux.services.adplatforms.middleware.MiddlewarePipeline;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Clock;
import java.util.concurrent.TimeUnit;

/**
 * Builds one {@link PlatformHttpClient} per registered platform.
 *
 * Timeouts:
 * - Connect: 10s
 * - Read/Write/Response: the platform timeout (Google 60s, others 30s by default)
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlatformClientFactory {

    private final MiddlewarePipeline pipeline;
    private final ErrorClassifier errorClassifier;
    private final Sleeper sleeper;
    private final Clock clock;
    private final ObjectMapper objectMapper;
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public PlatformHttpClient create(ClientSettings settings) {
        log.info("Creating {} client: baseUrl={}, timeout={}, retries={}",
                settings.getPlatform().getValue(), settings.getBaseUrl(), settings.getTimeout(), settings.getRetries());
        return create(settings, buildWebClient(settings));
    }

    public PlatformHttpClient create(ClientSettings settings, WebClient webClient) {
        return new PlatformHttpClient(settings, webClient, pipeline, errorClassifier, RetryPolicy.defaults(),
                sleeper, clock, objectMapper,
                circuitBreakerRegistry.circuitBreaker(settings.getPlatform().getValue()));
    }

    private WebClient buildWebClient(ClientSettings settings) {
        long timeoutSeconds = Math.max(1, settings.getTimeout().getSeconds());
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10_000)
                .responseTimeout(settings.getTimeout())
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                );

        return WebClient.builder()
                .baseUrl(settings.getBaseUrl())
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(4 * 1024 * 1024))
                .filter(ExchangeLogging.filter(settings.getPlatform().getDisplayName() + " API"))
                .build();
    }
}
