package com.adflux.services.adplatforms.client;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.util.MultiValueMap;
import org.springframework.web.util.UriComponentsBuilder;
import org.springframework.web.util.UriUtils;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * OAuth 1.0a HMAC-SHA1 request signing used by the X Ads API.
 * Query parameters take part in the signature; JSON bodies do not.
 */
public class OAuth1Signer implements RequestSigner {

    private static final String HMAC_SHA1 = "HmacSHA1";

    private final String consumerKey;
    private final String consumerSecret;
    private final Supplier<String> accessToken;
    private final String accessTokenSecret;
    private final Clock clock;
    private final Supplier<String> nonceSupplier;

    public OAuth1Signer(String consumerKey, String consumerSecret, Supplier<String> accessToken,
                        String accessTokenSecret, Clock clock) {
        this(consumerKey, consumerSecret, accessToken, accessTokenSecret, clock, OAuth1Signer::randomNonce);
    }

    OAuth1Signer(String consumerKey, String consumerSecret, Supplier<String> accessToken,
                 String accessTokenSecret, Clock clock, Supplier<String> nonceSupplier) {
        this.consumerKey = consumerKey;
        this.consumerSecret = consumerSecret;
        this.accessToken = accessToken;
        this.accessTokenSecret = accessTokenSecret;
        this.clock = clock;
        this.nonceSupplier = nonceSupplier;
    }

    @Override
    public Map<String, String> sign(HttpMethod method, URI uri) {
        Map<String, String> oauth = new TreeMap<>();
        oauth.put("oauth_consumer_key", consumerKey);
        oauth.put("oauth_nonce", nonceSupplier.get());
        oauth.put("oauth_signature_method", "HMAC-SHA1");
        oauth.put("oauth_timestamp", String.valueOf(clock.instant().getEpochSecond()));
        oauth.put("oauth_token", accessToken.get());
        oauth.put("oauth_version", "1.0");

        oauth.put("oauth_signature", signature(method, uri, oauth));

        String header = "OAuth " + oauth.entrySet().stream()
                .map(e -> percentEncode(e.getKey()) + "=\"" + percentEncode(e.getValue()) + "\"")
                .collect(Collectors.joining(", "));
        return Map.of(HttpHeaders.AUTHORIZATION, header);
    }

    String signature(HttpMethod method, URI uri, Map<String, String> oauthParams) {
        List<String> pairs = new ArrayList<>();
        oauthParams.forEach((k, v) -> pairs.add(percentEncode(k) + "=" + percentEncode(v)));

        MultiValueMap<String, String> query = UriComponentsBuilder.fromUri(uri).build(true).getQueryParams();
        query.forEach((name, values) -> {
            String decodedName = UriUtils.decode(name, StandardCharsets.UTF_8);
            for (String value : values) {
                String decodedValue = value != null ? UriUtils.decode(value, StandardCharsets.UTF_8) : "";
                pairs.add(percentEncode(decodedName) + "=" + percentEncode(decodedValue));
            }
        });
        pairs.sort(null);

        String baseUrl = uri.getScheme().toLowerCase() + "://" + uri.getHost().toLowerCase()
                + (uri.getPort() > 0 && uri.getPort() != 443 && uri.getPort() != 80 ? ":" + uri.getPort() : "")
                + uri.getRawPath();
        String baseString = method.name() + "&" + percentEncode(baseUrl) + "&" + percentEncode(String.join("&", pairs));
        String signingKey = percentEncode(consumerSecret) + "&" + percentEncode(accessTokenSecret);

        try {
            Mac mac = Mac.getInstance(HMAC_SHA1);
            mac.init(new SecretKeySpec(signingKey.getBytes(StandardCharsets.UTF_8), HMAC_SHA1));
            return Base64.getEncoder().encodeToString(mac.doFinal(baseString.getBytes(StandardCharsets.UTF_8)));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("HMAC-SHA1 unavailable for OAuth signing", ex);
        }
    }

    static String percentEncode(String value) {
        if (value == null) return "";
        return URLEncoder.encode(value, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    private static String randomNonce() {
        byte[] bytes = new byte[16];
        new SecureRandom().nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }
}
