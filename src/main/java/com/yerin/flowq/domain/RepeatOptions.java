package com.yerin.flowq.domain;

import org.springframework.scheduling.support.CronExpression;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 반복 작업의 cron 규칙. 유닉스 5필드 표현식과 초 단위가 포함된 6필드 표현식을 모두 받는다.
 * <p>
 * 유닉스 cron 처럼 일(day-of-month)과 요일(day-of-week)이 둘 다 지정되면 둘 중 하나만 맞아도 실행된다.
 * Spring {@link CronExpression} 은 두 필드를 모두 만족해야 하므로 각각을 따로 계산해 더 이른 시각을 고른다.
 */
public record RepeatOptions(String pattern, String tz) {

    public RepeatOptions {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("cron expression must not be blank");
        }
        if (tz == null || tz.isBlank()) {
            throw new IllegalArgumentException("timezone must not be blank");
        }
        try {
            ZoneId.of(tz);
        } catch (DateTimeException e) {
            throw new IllegalArgumentException("invalid timezone: " + tz, e);
        }
        toCrons(pattern);
    }

    /**
     * {@code after} 이후(미포함) 첫 실행 시각.
     */
    public Instant nextAfter(Instant after) {
        ZonedDateTime from = after.atZone(ZoneId.of(tz));
        ZonedDateTime earliest = null;
        for (CronExpression cron : toCrons(pattern)) {
            ZonedDateTime next = cron.next(from);
            if (next != null && (earliest == null || next.isBefore(earliest))) {
                earliest = next;
            }
        }
        if (earliest == null) {
            throw new IllegalStateException("cron expression never fires again: " + pattern);
        }
        return earliest.toInstant();
    }

    private static List<CronExpression> toCrons(String pattern) {
        String[] fields = pattern.trim().split("\\s+");
        if (fields.length == 5) {
            String[] withSeconds = new String[6];
            withSeconds[0] = "0";
            System.arraycopy(fields, 0, withSeconds, 1, 5);
            fields = withSeconds;
        }
        if (fields.length != 6) {
            return List.of(CronExpression.parse(pattern.trim()));
        }

        // fields: 초 분 시 일 월 요일
        String dayOfMonth = fields[3];
        String dayOfWeek = fields[5];
        if (!restricts(dayOfMonth) || !restricts(dayOfWeek)) {
            return List.of(CronExpression.parse(String.join(" ", fields)));
        }
        List<CronExpression> crons = new ArrayList<>(2);
        fields[5] = "*";
        crons.add(CronExpression.parse(String.join(" ", fields)));
        fields[3] = "*";
        fields[5] = dayOfWeek;
        crons.add(CronExpression.parse(String.join(" ", fields)));
        return crons;
    }

    // '*' 로 시작하는 필드(*, */2)는 제한으로 보지 않는다
    private static boolean restricts(String field) {
        return !field.startsWith("*") && !field.equals("?");
    }
}
