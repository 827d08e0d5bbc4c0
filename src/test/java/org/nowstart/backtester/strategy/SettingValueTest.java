package org.nowstart.backtester.strategy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.backtester.data.exception.BacktestException;
import org.nowstart.backtester.data.exception.ErrorCode;

class SettingValueTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void from_readsJsonScalars() throws Exception {
        Map<String, SettingValue> settings = objectMapper.readValue(
                "{\"rsi-high\":75,\"label\":\"fast\",\"enabled\":true}",
                new TypeReference<Map<String, SettingValue>>() {
                }
        );

        assertThat(settings.get("rsi-high").kind()).isEqualTo(SettingValue.Kind.NUMBER);
        assertThat(settings.get("rsi-high").asInt("rsi-high")).isEqualTo(75);
        assertThat(settings.get("label").text()).isEqualTo("fast");
        assertThat(settings.get("enabled").asBoolean("enabled")).isTrue();
        assertThat(objectMapper.writeValueAsString(settings.get("label"))).isEqualTo("\"fast\"");
    }

    @Test
    void asDouble_parsesNumericText() {
        assertThat(SettingValue.of(" 12.5 ").asDouble("x")).isEqualTo(12.5);
        assertThat(SettingValue.of("TRUE").asBoolean("x")).isTrue();
    }

    @Test
    void asDouble_throwsForNonNumericValue() {
        assertThatThrownBy(() -> SettingValue.of("moto").asDouble("hello"))
                .isInstanceOf(BacktestException.class)
                .hasMessageContaining("hello")
                .extracting("code")
                .isEqualTo(ErrorCode.INVALID_STRATEGY_SETTINGS);
        assertThatThrownBy(() -> SettingValue.of(true).asDouble("flag")).isInstanceOf(BacktestException.class);
    }

    @Test
    void asInt_rejectsFractions() {
        assertThatThrownBy(() -> SettingValue.of(1.5).asInt("period"))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.INVALID_STRATEGY_SETTINGS);
    }

    @Test
    void from_rejectsStructuredValues() {
        assertThatThrownBy(() -> SettingValue.from(List.of(1, 2)))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(ErrorCode.INVALID_STRATEGY_SETTINGS);
    }
}
