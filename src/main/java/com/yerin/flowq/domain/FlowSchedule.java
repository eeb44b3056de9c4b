package com.yerin.flowq.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.*;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Embeddable
public class FlowSchedule {

    @Enumerated(EnumType.STRING)
    @Column(name = "schedule_type", length = 30)
    private ScheduleType type;

    @Column(name = "schedule_timezone", length = 64)
    private String timezone;

    @Column(name = "schedule_cron_expression", length = 120)
    private String cronExpression;

    public static FlowSchedule cron(String cronExpression, String timezone) {
        return new FlowSchedule(ScheduleType.CRON_EXPRESSION, timezone, cronExpression);
    }
}
