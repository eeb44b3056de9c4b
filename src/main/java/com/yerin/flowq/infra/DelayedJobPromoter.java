package com.yerin.flowq.infra;

import com.yerin.flowq.domain.JobQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.List;

/**
 * 실행 시각이 된 delayed 작업(지연 실행, 재시도, 반복 실행분)을 wait 로 올린다.
 */
@Slf4j
@RequiredArgsConstructor
public class DelayedJobPromoter {

    private final List<JobQueue> queues;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${flowq.worker.promote-interval-millis:1000}")
    public void promoteDue() {
        for (JobQueue queue : queues) {
            try {
                int moved = queue.promoteDelayed(clock.instant());
                if (moved > 0) log.debug("[DelayedJobPromoter] promoted={} queue={}", moved, queue.name());
            } catch (Exception e) {
                log.warn("[DelayedJobPromoter] promote fail queue={}, err={}", queue.name(), e.toString());
            }
        }
    }
}
