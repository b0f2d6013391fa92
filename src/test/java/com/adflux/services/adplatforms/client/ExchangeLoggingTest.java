package com.adflux.services.adplatforms.client;

import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExchangeLoggingTest {

    @Test
    void describeLeavesOutTheQueryString() {
        ClientRequest request = ClientRequest.create(HttpMethod.GET,
                URI.create("https://graph.facebook.test/v19.0/oauth/access_token?client_secret=s3cr3t&fb_exchange_token=t"))
                .build();

        assertThat(ExchangeLogging.describe(request))
                .isEqualTo("GET graph.facebook.test/v19.0/oauth/access_token")
                .doesNotContain("s3cr3t");
    }

    @Test
    void filterPassesTheExchangeThroughUnchanged() {
        List<ClientRequest> seen = new ArrayList<>();
        WebClient webClient = WebClient.builder()
                .filter(ExchangeLogging.filter("Test"))
                .exchangeFunction(request -> {
                    seen.add(request);
                    return Mono.just(ClientResponse.create(HttpStatus.ACCEPTED).build());
                })
                .build();

        HttpStatus status = HttpStatus.valueOf(webClient.post()
                .uri("https://ads.test/v1/campaigns?advertiser_id=7001")
                .retrieve()
                .toBodilessEntity()
                .block()
                .getStatusCode()
                .value());

        assertThat(status).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).url().getQuery()).isEqualTo("advertiser_id=7001");
    }
}
