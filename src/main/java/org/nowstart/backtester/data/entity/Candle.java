package org.nowstart.backtester.data.entity;

import jakarta.persistence.Embeddable;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import java.io.Serializable;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.nowstart.backtester.data.dto.OhlcvCandle;

@Getter
@Setter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Entity
@Table(name = "candle")
public class Candle {

    @EmbeddedId
    private CandleKey id;

    private BigDecimal openPrice;

    private BigDecimal highPrice;

    private BigDecimal lowPrice;

    private BigDecimal closePrice;

    private BigDecimal volume;

    public OhlcvCandle toOhlcv() {
        return new OhlcvCandle(
                id.ts(),
                openPrice.doubleValue(),
                highPrice.doubleValue(),
                lowPrice.doubleValue(),
                closePrice.doubleValue(),
                volume == null ? 0.0 : volume.doubleValue()
        );
    }

    @Embeddable
    public record CandleKey(
            String exchange,
            String base,
            String quote,
            String asset,
            long intervalSeconds,
            Instant ts
    ) implements Serializable {}
}
