package org.nowstart.backtester.data.property;

import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "backtester")
public record BacktestProperties(
        // 애플리케이션 기동 시 백테스트 실행 여부
        @DefaultValue("false") boolean enabled,
        // 실행 설정 JSON 파일 경로
        @DefaultValue("") String configPath,
        // 리포트 저장 디렉터리(비어 있으면 로그로만 출력)
        @DefaultValue("") String reportOutputPath,
        // DB 캔들 데이터 사용 여부
        @DefaultValue("true") boolean databaseEnabled,
        // 업비트 REST API 기본 URL
        @NotBlank @DefaultValue("https://api.upbit.com") String upbitBaseUrl,
        // 업비트 Access Key
        @DefaultValue("") String upbitAccessKey,
        // 업비트 Secret Key (JWT 서명용 비밀키)
        @DefaultValue("") String upbitSecretKey
) {
}
