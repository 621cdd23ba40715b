package org.nowstart.beacon.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import org.nowstart.beacon.data.type.StateStoreType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "beacon.signal")
public record SignalProperties(
        // 감시 대상 심볼 목록 (예: BTCUSDT,ETHUSDT)
        @NotNull @DefaultValue("BTCUSDT") List<String> watchlist,
        // 장중 PREVIEW 노출 최소 신뢰도
        @Min(0) @Max(100) @DefaultValue("60") int minConfShow,
        // 마감 확정 최소 신뢰도
        @Min(0) @Max(100) @DefaultValue("60") int minConfConfirmed,
        // CONFIRMED 이후 쿨다운
        @NotNull @DefaultValue("30m") Duration cooldownConfirmed,
        // INVALIDATED 이후 쿨다운
        @NotNull @DefaultValue("15m") Duration cooldownInvalidated,
        // ATR 기간
        @Positive @DefaultValue("14") int atrPeriod,
        // 기본 손절 ATR 배수
        @DecimalMin("0") @DefaultValue("2.0") BigDecimal slAtrMultLow,
        // 손절 ATR 배수 상한
        @DecimalMin("0") @DefaultValue("3.0") BigDecimal slAtrMultHigh,
        // 역추세/저신뢰/고변동 구간 손절 ATR 배수
        @DecimalMin("0") @DefaultValue("2.5") BigDecimal slAtrMultWidened,
        // 기본 손익비
        @DecimalMin("0") @DefaultValue("1.5") BigDecimal rrBase,
        // 고신뢰 + 강한 모멘텀 손익비
        @DecimalMin("0") @DefaultValue("2.0") BigDecimal rrHigh,
        // 최소 손절 거리(bps)
        @DecimalMin("0") @DefaultValue("10") BigDecimal minSlBps,
        // 최소 익절 거리(bps)
        @DecimalMin("0") @DefaultValue("15") BigDecimal minTpBps,
        // 청산 강도 임계값(상/중/하)
        @DefaultValue("8") double liqThrHigh,
        @DefaultValue("6") double liqThrMed,
        @DefaultValue("4") double liqThrLow,
        // 청산 강도별 신뢰도 감점
        @DefaultValue("10") int liqPenaltyHigh,
        @DefaultValue("7") int liqPenaltyMed,
        @DefaultValue("4") int liqPenaltyLow,
        // 청산 방향이 신호와 역방향일 때 가점
        @DefaultValue("5") int liqBonusAlign,
        // 펀딩 임박 경고 구간
        @NotNull @DefaultValue("30m") Duration fundingWarnWindow,
        // 펀딩비 경고 절대값
        @DecimalMin("0") @DefaultValue("0.0002") BigDecimal fundingRateAbsWarn,
        // 상태 저장 TTL (쿨다운/대기/최근 신호)
        @NotNull @DefaultValue("6h") Duration ttlCooldown,
        @NotNull @DefaultValue("2h") Duration ttlPending,
        @NotNull @DefaultValue("6h") Duration ttlLastSignal,
        // 중복 방지 키 TTL
        @NotNull @DefaultValue("120s") Duration dedupeTtl,
        // PREVIEW 식별자 시간 버킷
        @NotNull @DefaultValue("120s") Duration dedupeScope,
        // 평가당 요청 캔들 수
        @Positive @DefaultValue("200") int klineLimit,
        // 캔들 주기
        @NotBlank @DefaultValue("1HRS") String klinePeriod,
        // 24h 등락률 추세 임계값
        @DefaultValue("2.0") double trendUpPct,
        @DefaultValue("-2.0") double trendDownPct,
        // 가격 정밀도 캐시 TTL
        @NotNull @DefaultValue("24h") Duration metaTtl,
        // 메타데이터가 없을 때 가격 소수 자릿수
        @Min(0) @Max(18) @DefaultValue("2") int defaultPricePrecision,
        // 상태 저장소 종류 (MEMORY 또는 REDIS)
        @NotNull @DefaultValue("MEMORY") StateStoreType stateStore,
        @Valid @NotNull @DefaultValue Scheduler scheduler
) {

    public record Scheduler(
            // 스케줄러 사용 여부
            @DefaultValue("false") boolean enabled,
            // 장중 평가 주기
            @NotNull @DefaultValue("60s") Duration intrabarInterval,
            // 마감 확정 평가 cron
            @NotBlank @DefaultValue("0 0 * * * *") String closeCron
    ) {
    }
}
