package com.yerin.flowq.service;

import com.yerin.flowq.domain.Flow;
import com.yerin.flowq.domain.FlowSchedule;
import com.yerin.flowq.repository.FlowRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class FlowScheduleService {

    private final FlowRepository flowRepository;

    /**
     * publishedVersionId 가 일치하는 플로우의 schedule 을 cron 으로 채운다.
     *
     * @return 플로우를 찾아 갱신했으면 true
     */
    @Transactional
    public boolean backfillCron(String publishedVersionId, String cronExpression, String timezone) {
        Optional<Flow> found = flowRepository.findByPublishedVersionId(publishedVersionId);
        if (found.isEmpty()) return false;

        Flow flow = found.get();
        flow.setSchedule(FlowSchedule.cron(cronExpression, timezone));
        flowRepository.save(flow);
        log.info("[FlowSchedule] backfilled flowId={} cron='{}' tz={}", flow.getId(), cronExpression, timezone);
        return true;
    }
}
