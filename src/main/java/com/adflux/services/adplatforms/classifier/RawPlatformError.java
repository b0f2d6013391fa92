package com.adflux.services.adplatforms.classifier;

import com.adflux.services.adplatforms.exception.PlatformErrorBodyException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.netty.handler.timeout.TimeoutException;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Map;

/**
 * Normalized view of whatever went wrong during one platform call.
 */
@Getter
@Builder
@ToString(exclude = "cause")
public class RawPlatformError {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final Integer statusCode;
    private final Map<String, Object> body;
    private final String rawBody;
    private final String message;
    private final boolean network;
    private final boolean timeout;
    private final boolean circuitOpen;
    private final Throwable cause;

    public static RawPlatformError from(Throwable error, ObjectMapper objectMapper) {
        Throwable ex = Exceptions.unwrap(error);

        if (ex instanceof PlatformErrorBodyException) {
            PlatformErrorBodyException bodyEx = (PlatformErrorBodyException) ex;
            return RawPlatformError.builder()
                    .statusCode(bodyEx.getStatusCode())
                    .body(bodyEx.getBody())
                    .message(bodyEx.getMessage())
                    .cause(ex)
                    .build();
        }
        if (ex instanceof WebClientResponseException) {
            WebClientResponseException responseEx = (WebClientResponseException) ex;
            String raw = responseEx.getResponseBodyAsString();
            return RawPlatformError.builder()
                    .statusCode(responseEx.getStatusCode().value())
                    .body(parseBody(raw, objectMapper))
                    .rawBody(raw)
                    .message(responseEx.getMessage())
                    .cause(ex)
                    .build();
        }
        if (ex instanceof CallNotPermittedException) {
            return RawPlatformError.builder()
                    .circuitOpen(true)
                    .message(ex.getMessage())
                    .cause(ex)
                    .build();
        }
        if (isTimeout(ex)) {
            return RawPlatformError.builder()
                    .timeout(true)
                    .message("Request timed out: " + ex.getMessage())
                    .cause(ex)
                    .build();
        }
        if (ex instanceof WebClientRequestException || ex instanceof IOException) {
            return RawPlatformError.builder()
                    .network(true)
                    .message("Network error: " + ex.getMessage())
                    .cause(ex)
                    .build();
        }
        return RawPlatformError.builder()
                .message(ex.getMessage())
                .cause(ex)
                .build();
    }

    private static boolean isTimeout(Throwable ex) {
        Throwable current = ex;
        while (current != null) {
            if (current instanceof java.util.concurrent.TimeoutException
                    || current instanceof TimeoutException
                    || current instanceof SocketTimeoutException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static Map<String, Object> parseBody(String raw, ObjectMapper objectMapper) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return objectMapper.readValue(raw, MAP_TYPE);
        } catch (JsonProcessingException ex) {
            return null;
        }
    }
}
