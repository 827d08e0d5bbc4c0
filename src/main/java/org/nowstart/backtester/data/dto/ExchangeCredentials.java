package org.nowstart.backtester.data.dto;

public record ExchangeCredentials(
        String key,
        String secret,
        String clientId,
        String pemKey,
        String oneTimePassword
) {

    public static final ExchangeCredentials EMPTY = new ExchangeCredentials("", "", "", "", "");

    public ExchangeCredentials {
        key = key == null ? "" : key;
        secret = secret == null ? "" : secret;
        clientId = clientId == null ? "" : clientId;
        pemKey = pemKey == null ? "" : pemKey;
        oneTimePassword = oneTimePassword == null ? "" : oneTimePassword;
    }

    public boolean isEmpty() {
        return key.isBlank() && secret.isBlank() && clientId.isBlank() && pemKey.isBlank();
    }

    @Override
    public String toString() {
        return "ExchangeCredentials[key=" + mask(key) + ", clientId=" + clientId + "]";
    }

    private static String mask(String value) {
        if (value.length() <= 4) {
            return value.isEmpty() ? "" : "****";
        }
        return value.substring(0, 4) + "****";
    }
}
