package org.nowstart.backtester.service.auth;

import feign.RequestInterceptor;
import feign.RequestTemplate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import lombok.RequiredArgsConstructor;

/**
 * Signs requests when credentials are configured. Candle endpoints are public, so unsigned
 * requests are sent as-is.
 */
@RequiredArgsConstructor
public class UpbitAuthRequestInterceptor implements RequestInterceptor {

    private final UpbitJwtSigner upbitJwtSigner;

    @Override
    public void apply(RequestTemplate template) {
        template.header("Accept", "application/json");
        template.header("User-Agent", "evergreen-backtester/1.0");
        if (!upbitJwtSigner.hasCredentials()) {
            return;
        }
        String token = upbitJwtSigner.createToken(buildCanonicalQuery(template.queries()));
        template.header("Authorization", "Bearer " + token);
    }

    String buildCanonicalQuery(Map<String, Collection<String>> queries) {
        if (queries == null || queries.isEmpty()) {
            return "";
        }
        List<String> pairs = new ArrayList<>();
        new TreeMap<>(queries).forEach((key, values) -> {
            if (values == null) {
                return;
            }
            for (String value : values) {
                if (value != null) {
                    pairs.add(key + "=" + value);
                }
            }
        });
        return String.join("&", pairs);
    }
}
