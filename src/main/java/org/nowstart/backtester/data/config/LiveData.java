package org.nowstart.backtester.data.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class LiveData {

    private String apiKeyOverride;
    private String apiSecretOverride;
    private String apiClientIdOverride;
    private String api2faOverride;
    // 실주문은 지원하지 않음. true여도 false로 강제됨
    private boolean realOrders;
    private boolean authenticatedDataRequired;

    public boolean hasCredentialOverrides() {
        return isSet(apiKeyOverride) || isSet(apiSecretOverride) || isSet(apiClientIdOverride) || isSet(api2faOverride);
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
