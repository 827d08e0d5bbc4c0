package org.nowstart.backtester.repository;

import java.util.List;
import org.nowstart.backtester.config.UpbitFeignConfig;
import org.nowstart.backtester.data.dto.UpbitCandleResponse;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;

@FeignClient(
        name = "upbitClient",
        url = "${backtester.upbit-base-url}",
        configuration = UpbitFeignConfig.class
)
public interface UpbitFeignClient {

    @GetMapping("/v1/candles/minutes/{unit}")
    List<UpbitCandleResponse> getMinuteCandles(
            @PathVariable("unit") int unit,
            @RequestParam("market") String market,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam("count") int count
    );

    @GetMapping("/v1/candles/days")
    List<UpbitCandleResponse> getDayCandles(
            @RequestParam("market") String market,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam("count") int count
    );

    @GetMapping("/v1/candles/weeks")
    List<UpbitCandleResponse> getWeekCandles(
            @RequestParam("market") String market,
            @RequestParam(value = "to", required = false) String to,
            @RequestParam("count") int count
    );
}
