package org.nowstart.backtester.config;

import feign.RequestInterceptor;
import org.nowstart.backtester.service.auth.UpbitAuthRequestInterceptor;
import org.nowstart.backtester.service.auth.UpbitCredentialsStore;
import org.nowstart.backtester.service.auth.UpbitJwtSigner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class UpbitFeignConfig {

    @Bean
    public UpbitJwtSigner upbitJwtSigner(UpbitCredentialsStore upbitCredentialsStore) {
        return new UpbitJwtSigner(upbitCredentialsStore::get);
    }

    @Bean
    public RequestInterceptor upbitAuthRequestInterceptor(UpbitJwtSigner upbitJwtSigner) {
        return new UpbitAuthRequestInterceptor(upbitJwtSigner);
    }
}
