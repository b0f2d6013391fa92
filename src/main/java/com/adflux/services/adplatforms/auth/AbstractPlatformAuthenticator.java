package com.adflux.services.adplatforms.auth;

import com.adflux.services.adplatforms.auth.credentials.PlatformCredentials;
import com.adflux.services.adplatforms.classifier.ErrorBodyParser;
import com.adflux.services.adplatforms.classifier.ErrorClassifier;
import com.adflux.services.adplatforms.exception.AuthenticationException;
import com.adflux.services.adplatforms.exception.PlatformApiException;
import com.adflux.services.adplatforms.exception.PlatformErrorBodyException;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.util.MultiValueMap;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Shared plumbing for token endpoint calls: every failure is classified with the
 * platform's error table and raised as {@link PlatformApiException}.
 */
public abstract class AbstractPlatformAuthenticator implements PlatformAuthenticator {

    protected static final ParameterizedTypeReference<Map<String, Object>> MAP_TYPE =
            new ParameterizedTypeReference<>() {};

    private static final Duration CALL_TIMEOUT = Duration.ofSeconds(30);

    protected final WebClient webClient;
    protected final ErrorClassifier errorClassifier;
    protected final Clock clock;

    protected AbstractPlatformAuthenticator(WebClient webClient, ErrorClassifier errorClassifier, Clock clock) {
        this.webClient = webClient;
        this.errorClassifier = errorClassifier;
        this.clock = clock;
    }

    protected Map<String, Object> getJson(URI uri) {
        try {
            return checked(webClient.get()
                    .uri(uri)
                    .retrieve()
                    .bodyToMono(MAP_TYPE)
                    .block(CALL_TIMEOUT));
        } catch (PlatformApiException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new PlatformApiException(errorClassifier.classify(ex, platform()), ex);
        }
    }

    protected Map<String, Object> postForm(String url, MultiValueMap<String, String> form) {
        try {
            return checked(webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData(form))
                    .retrieve()
                    .bodyToMono(MAP_TYPE)
                    .block(CALL_TIMEOUT));
        } catch (PlatformApiException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new PlatformApiException(errorClassifier.classify(ex, platform()), ex);
        }
    }

    protected Map<String, Object> postJson(String url, Object body) {
        try {
            return checked(webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(MAP_TYPE)
                    .block(CALL_TIMEOUT));
        } catch (PlatformApiException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new PlatformApiException(errorClassifier.classify(ex, platform()), ex);
        }
    }

    @SuppressWarnings("unchecked")
    protected <C extends PlatformCredentials> C cast(PlatformCredentials credentials, Class<C> type) {
        if (!type.isInstance(credentials)) {
            throw new AuthenticationException("Expected " + type.getSimpleName() + " for "
                    + platform().getValue(), platform().errorPrefix() + "_INVALID_CREDENTIALS");
        }
        return (C) credentials;
    }

    protected static String requiredString(Map<String, ?> body, String field, String errorCode) {
        Object value = body != null ? body.get(field) : null;
        if (value == null || String.valueOf(value).isBlank()) {
            throw new AuthenticationException("Token response has no " + field, errorCode);
        }
        return String.valueOf(value);
    }

    protected static Long optionalLong(Map<String, ?> body, String field) {
        Object value = body != null ? body.get(field) : null;
        if (value instanceof Number) return ((Number) value).longValue();
        if (value instanceof String && !((String) value).isBlank()) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    private Map<String, Object> checked(Map<String, Object> body) {
        Map<String, Object> payload = body != null ? body : Map.of();
        if (ErrorBodyParser.carriesError(platform(), payload)) {
            throw new PlatformApiException(
                    errorClassifier.classify(new PlatformErrorBodyException(200, payload), platform()));
        }
        return payload;
    }
}
