package com.yerin.flowq.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import com.yerin.flowq.domain.BrokerJob;
import com.yerin.flowq.domain.FlowQueueMetrics;
import com.yerin.flowq.domain.RepeatOptions;
import com.yerin.flowq.global.exception.ExceptionReporter;
import com.yerin.flowq.service.FlowScheduleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * v2 → v3: 브로커의 repeat 옵션(cron, tz)을 플로우 레코드의 schedule 로 옮긴다.
 * repeat 옵션이 없거나 플로우를 찾지 못하면 버전을 올리지 않는다.
 */
@Slf4j
@RequiredArgsConstructor
public class ScheduleBackfillMigration implements JobDataMigration {

    private final FlowScheduleService flowScheduleService;
    private final UnrepeatableJobPolicy unrepeatableJobPolicy;
    private final ExceptionReporter exceptionReporter;
    private final FlowQueueMetrics metrics;
    private final String queueName;

    @Override
    public int fromVersion() {
        return 2;
    }

    @Override
    public Optional<ObjectNode> migrate(BrokerJob job, ObjectNode data) {
        RepeatOptions repeat = job.opts() == null ? null : job.opts().repeat();
        if (repeat == null) {
            log.error("[Migration] Found unrepeatable job in repeatable queue jobId={}", job.id());
            metrics.incMigrationAnomaly();
            if (unrepeatableJobPolicy == UnrepeatableJobPolicy.REPORT) {
                exceptionReporter.report(new UnrepeatableJobException(job.id(), queueName));
            }
            return Optional.empty();
        }

        String flowVersionId = data.path("flowVersionId").asText(null);
        boolean updated = flowVersionId != null
                && flowScheduleService.backfillCron(flowVersionId, repeat.pattern(), repeat.tz());
        if (!updated) {
            log.warn("[Migration] no flow published with versionId={}, jobId={} stays at v2", flowVersionId, job.id());
            return Optional.empty();
        }

        ObjectNode v3 = data.deepCopy();
        v3.put("schemaVersion", 3);
        return Optional.of(v3);
    }
}
