package com.example.intel.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "briefing")
public class BriefingProperties {

    /** 공급자 호출 1건당 제한 시간. 초과하면 해당 항목만 실패로 기록 */
    @NotNull
    private Duration providerTimeout = Duration.ofSeconds(12);

    /** 분석 호출 제한 시간. 초과하면 요청 전체 실패 */
    @NotNull
    private Duration analysisTimeout = Duration.ofSeconds(120);

    /** 스냅샷 재사용 허용 시간. 0이면 캐시 미사용 */
    @NotNull
    private Duration snapshotFreshness = Duration.ofSeconds(60);

    /** Redis L2 시세 캐시 TTL */
    @NotNull
    private Duration quoteL2Ttl = Duration.ofSeconds(45);

    @Min(1)
    private int maxNewsPerSymbol = 7;

    private boolean seedDefaultPortfolio = true;

    /** 지표 이름 → 공급자 심볼. 순서 유지 */
    @NotEmpty
    private Map<String, String> macroIndicators = defaultMacroIndicators();

    public static Map<String, String> defaultMacroIndicators() {
        Map<String, String> m = new LinkedHashMap<>();
        m.put("VIX", "^VIX");
        m.put("US_10Y_YIELD", "^TNX");
        m.put("DXY", "DX-Y.NYB");
        m.put("CRUDE_OIL", "CL=F");
        return m;
    }
}
