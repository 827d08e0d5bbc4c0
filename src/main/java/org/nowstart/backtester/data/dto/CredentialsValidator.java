package org.nowstart.backtester.data.dto;

import java.util.ArrayList;
import java.util.Base64;
import java.util.List;

/**
 * Which credential fields an exchange needs before authenticated requests can be made.
 */
public record CredentialsValidator(
        boolean requiresKey,
        boolean requiresSecret,
        boolean requiresClientId,
        boolean requiresPemKey,
        boolean requiresBase64DecodeSecret
) {

    public static final CredentialsValidator NONE = new CredentialsValidator(false, false, false, false, false);

    public List<String> validate(ExchangeCredentials credentials) {
        ExchangeCredentials resolved = credentials == null ? ExchangeCredentials.EMPTY : credentials;
        List<String> problems = new ArrayList<>();
        if (requiresKey && resolved.key().isBlank()) {
            problems.add("api key required");
        }
        if (requiresSecret && resolved.secret().isBlank()) {
            problems.add("api secret required");
        }
        if (requiresClientId && resolved.clientId().isBlank()) {
            problems.add("client id required");
        }
        if (requiresPemKey && resolved.pemKey().isBlank()) {
            problems.add("pem key required");
        }
        if (requiresBase64DecodeSecret && !resolved.secret().isBlank()) {
            try {
                Base64.getDecoder().decode(resolved.secret());
            } catch (IllegalArgumentException e) {
                problems.add("api secret must be base64 encoded");
            }
        }
        return problems;
    }
}
