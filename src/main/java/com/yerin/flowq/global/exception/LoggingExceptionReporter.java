package com.yerin.flowq.global.exception;

import com.yerin.flowq.domain.FlowQueueMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class LoggingExceptionReporter implements ExceptionReporter {

    private final FlowQueueMetrics metrics;

    @Override
    public void report(Throwable e) {
        metrics.incExceptionReported();
        log.error("[ExceptionReporter] {}", e.getMessage(), e);
    }
}
