package com.yerin.flowq.config;

import com.yerin.flowq.infra.FlowWorker;
import com.yerin.flowq.service.FlowQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * 큐 초기화(마이그레이션 포함)가 끝난 뒤에 워커를 띄운다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlowQueueBootstrap implements ApplicationRunner {

    private final FlowQueue flowQueue;
    private final ObjectProvider<FlowWorker> worker;

    @Override
    public void run(ApplicationArguments args) {
        flowQueue.init();
        worker.ifAvailable(FlowWorker::start);
        log.info("[Bootstrap] flow queue ready mode={}", flowQueue.mode());
    }
}
