package org.nowstart.cadence.data.property;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "cadence.schedule")
public record ScheduleProperties(
        // 지급일 일정 시작일(이전 날짜 항목은 로드 시 제거)
        @NotNull @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) @DefaultValue("2026-02-15") LocalDate startDate,
        // 지급일 매수 예정 시각(현지 시간)
        @NotNull @DateTimeFormat(iso = DateTimeFormat.ISO.TIME) @DefaultValue("09:00") LocalTime plannedTime,
        // 일정 기준 시간대
        @NotNull @DefaultValue("America/Los_Angeles") ZoneId zone,
        // 일정 파일 경로
        @NotBlank @DefaultValue("data/scheduled_buys.json") String path,
        // 워크플로 실행 cron
        @NotBlank @DefaultValue("0 5 9 * * *") String cron
) {
}
