package org.nowstart.backtester.service.auth;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;
import java.util.function.Supplier;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import lombok.RequiredArgsConstructor;
import org.nowstart.backtester.data.dto.ExchangeCredentials;

/**
 * HS512 token for Upbit requests, read from the current credentials on every call so live-data
 * overrides take effect without rebuilding the Feign client.
 */
@RequiredArgsConstructor
public class UpbitJwtSigner {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final String HEADER = encode("{\"alg\":\"HS512\",\"typ\":\"JWT\"}".getBytes(StandardCharsets.UTF_8));

    private final Supplier<ExchangeCredentials> credentials;

    public boolean hasCredentials() {
        ExchangeCredentials current = credentials.get();
        return current != null && !current.key().isBlank() && !current.secret().isBlank();
    }

    public String createToken(String canonicalQuery) {
        ExchangeCredentials current = credentials.get();
        if (current == null || current.secret().isEmpty()) {
            throw new IllegalStateException("Failed to sign JWT: secret key is empty");
        }

        ObjectNode claims = OBJECT_MAPPER.createObjectNode()
                .put("access_key", current.key())
                .put("nonce", UUID.randomUUID().toString());
        if (canonicalQuery != null && !canonicalQuery.isBlank()) {
            claims.put("query_hash", HexFormat.of().formatHex(digest(canonicalQuery)));
            claims.put("query_hash_alg", "SHA512");
        }

        String unsigned = HEADER + "." + encode(claims.toString().getBytes(StandardCharsets.UTF_8));
        return unsigned + "." + encode(sign(unsigned, current.secret()));
    }

    private static byte[] digest(String query) {
        try {
            return MessageDigest.getInstance("SHA-512").digest(query.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("SHA-512 not available", e);
        }
    }

    private static byte[] sign(String unsigned, String secret) {
        try {
            Mac mac = Mac.getInstance("HmacSHA512");
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), "HmacSHA512"));
            return mac.doFinal(unsigned.getBytes(StandardCharsets.UTF_8));
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Failed to sign JWT", e);
        }
    }

    private static String encode(byte[] bytes) {
        return ENCODER.encodeToString(bytes);
    }
}
