package com.yerin.flowq.infra;

import com.yerin.flowq.domain.FlowQueueMetrics;
import com.yerin.flowq.domain.JobQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class StalledJobReaper {

    private final List<JobQueue> queues;
    private final FlowQueueMetrics metrics;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${flowq.worker.stalled-interval-millis:5000}")
    public void reap() {
        for (JobQueue queue : queues) {
            try {
                int reclaimed = queue.reclaimStalled(clock.instant());
                if (reclaimed == 0) continue;
                metrics.incStalled(reclaimed);
                log.info("[StalledJobReaper] reaped={} queue={} (active→wait)", reclaimed, queue.name());
            } catch (Exception e) {
                log.warn("[StalledJobReaper] failed queue={}, err={}", queue.name(), e.toString());
            }
        }
    }
}
