package org.nowstart.backtester.service.auth;

import static org.assertj.core.api.Assertions.assertThat;

import feign.RequestTemplate;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.backtester.data.dto.ExchangeCredentials;

class UpbitAuthRequestInterceptorTest {

    @Test
    void apply_signsCandleRequestWhenCredentialsPresent() {
        UpbitAuthRequestInterceptor interceptor = interceptor(new ExchangeCredentials("access", "secret", "", "", ""));
        RequestTemplate template = new RequestTemplate();
        template.method("GET");
        template.uri("/v1/candles/minutes/15");
        template.query("market", "KRW-BTC");
        template.query("count", "200");

        interceptor.apply(template);

        String authHeader = headerValue(template, "Authorization");
        assertThat(authHeader).startsWith("Bearer ");
        assertThat(headerValue(template, "Accept")).isEqualTo("application/json");
        assertThat(headerValue(template, "User-Agent")).isEqualTo("evergreen-backtester/1.0");
        assertThat(decodePayload(authHeader)).contains(sha512Hex("count=200&market=KRW-BTC"));
    }

    @Test
    void apply_leavesPublicRequestUnsignedWithoutCredentials() {
        UpbitAuthRequestInterceptor interceptor = interceptor(ExchangeCredentials.EMPTY);
        RequestTemplate template = new RequestTemplate();
        template.method("GET");
        template.uri("/v1/candles/days");
        template.query("market", "KRW-BTC");

        interceptor.apply(template);

        assertThat(template.headers()).doesNotContainKey("Authorization");
        assertThat(headerValue(template, "Accept")).isEqualTo("application/json");
    }

    @Test
    void buildCanonicalQuery_sortsKeysAndSkipsNullValues() {
        UpbitAuthRequestInterceptor interceptor = interceptor(ExchangeCredentials.EMPTY);
        Map<String, Collection<String>> queries = new LinkedHashMap<>();
        queries.put("to", List.of("2026-01-01T00:00:00Z"));
        queries.put("market", List.of("KRW-BTC"));
        queries.put("empty", List.of());
        queries.put("mixed", new ArrayList<>(Arrays.asList("a", null)));
        queries.put("nothing", null);

        assertThat(interceptor.buildCanonicalQuery(queries))
                .isEqualTo("market=KRW-BTC&mixed=a&to=2026-01-01T00:00:00Z");
        assertThat(interceptor.buildCanonicalQuery(Map.of())).isEmpty();
    }

    private static UpbitAuthRequestInterceptor interceptor(ExchangeCredentials credentials) {
        return new UpbitAuthRequestInterceptor(new UpbitJwtSigner(() -> credentials));
    }

    private String headerValue(RequestTemplate template, String key) {
        return template.headers().get(key).iterator().next();
    }

    private String decodePayload(String authHeader) {
        String[] parts = authHeader.replace("Bearer ", "").split("\\.");
        return new String(Base64.getUrlDecoder().decode(parts[1]), StandardCharsets.UTF_8);
    }

    private String sha512Hex(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }
}
