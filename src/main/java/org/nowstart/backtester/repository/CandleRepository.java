package org.nowstart.backtester.repository;

import java.time.Instant;
import java.util.List;
import org.nowstart.backtester.data.entity.Candle;
import org.springframework.data.jpa.repository.JpaRepository;

public interface CandleRepository extends JpaRepository<Candle, Candle.CandleKey> {

    List<Candle> findByIdExchangeAndIdBaseAndIdQuoteAndIdAssetAndIdIntervalSecondsAndIdTsBetweenOrderByIdTsAsc(
            String exchange,
            String base,
            String quote,
            String asset,
            long intervalSeconds,
            Instant from,
            Instant to
    );
}
